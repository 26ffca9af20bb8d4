package org.gbif.beetles.config;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.Properties;
import java.util.Set;

import com.google.common.base.Preconditions;
import com.google.common.base.Splitter;
import com.google.common.base.Strings;
import com.google.common.base.Throwables;
import com.google.common.collect.ImmutableSet;
import org.apache.commons.lang3.StringEscapeUtils;

/**
 * Settings of the beetle count transformation. Defaults are loaded from the beetles.properties file on the classpath;
 * any key can be overridden with a system property of the same name prefixed with "beetles.".
 */
public class BeetleProperties {

  public static final String SORT_SAMPLE_TYPES = "sortSampleTypes";
  public static final String EVENT_ID_SEPARATORS = "eventIdSeparators";
  public static final String FILE_FIELD_SAMPLES = "file.fieldSamples";
  public static final String FILE_SORTING = "file.sorting";
  public static final String FILE_PINNING = "file.pinning";
  public static final String FILE_EXPERT = "file.expert";
  public static final String FILE_DELIMITER = "file.delimiter";
  public static final String FILE_COUNTS = "file.counts";

  private static final String RESOURCE = "/config/beetles.properties";
  private static final String SYSTEM_PREFIX = "beetles.";

  private static BeetleProperties defaults;

  private final Properties properties;

  public BeetleProperties(Properties properties) {
    this.properties = Preconditions.checkNotNull(properties, "properties");
  }

  /**
   * Load the properties from the beetles.properties file, applying system property overrides.
   */
  public static synchronized BeetleProperties load() {
    if (defaults == null) {
      Properties p = new Properties();
      InputStream in = BeetleProperties.class.getResourceAsStream(RESOURCE);
      try {
        if (in == null) {
          throw new IOException("Missing classpath resource " + RESOURCE);
        }
        p.load(in);
      } catch (IOException e) {
        throw Throwables.propagate(e);
      } finally {
        if (in != null) {
          try {
            in.close();
          } catch (IOException e) {
            throw Throwables.propagate(e);
          }
        }
      }
      for (String key : p.stringPropertyNames()) {
        String override = System.getProperty(SYSTEM_PREFIX + key);
        if (override != null) {
          p.setProperty(key, override);
        }
      }
      defaults = new BeetleProperties(p);
    }
    return defaults;
  }

  /**
   * @return sample types admitted from the sorting table, lower case
   */
  public Set<String> getSortSampleTypes() {
    ImmutableSet.Builder<String> types = ImmutableSet.builder();
    List<String> values = Splitter.on(',').trimResults().omitEmptyStrings().splitToList(get(SORT_SAMPLE_TYPES));
    for (String value : values) {
      types.add(value.toLowerCase());
    }
    return types.build();
  }

  /**
   * @return regular expression matching the separator characters stripped from eventIDs
   */
  public String getEventIdSeparators() {
    return get(EVENT_ID_SEPARATORS);
  }

  public String getFieldSamplesFile() {
    return get(FILE_FIELD_SAMPLES);
  }

  public String getSortingFile() {
    return get(FILE_SORTING);
  }

  public String getPinningFile() {
    return get(FILE_PINNING);
  }

  public String getExpertFile() {
    return get(FILE_EXPERT);
  }

  /**
   * @return the single delimiter character of the input files, escape sequences like \t are interpreted
   */
  public char getDelimiter() {
    String delimiter = StringEscapeUtils.unescapeJava(get(FILE_DELIMITER));
    Preconditions.checkState(delimiter.length() == 1, "%s must be a single character: %s", FILE_DELIMITER,
      delimiter);
    return delimiter.charAt(0);
  }

  public String getCountsFile() {
    return get(FILE_COUNTS);
  }

  private String get(String key) {
    String value = properties.getProperty(key);
    Preconditions.checkState(!Strings.isNullOrEmpty(value), "Missing configuration property %s", key);
    return value;
  }
}
