package org.gbif.beetles.io;

import org.gbif.beetles.config.BeetleProperties;
import org.gbif.beetles.model.ExpertRecord;
import org.gbif.beetles.model.FieldSample;
import org.gbif.beetles.model.PinRecord;
import org.gbif.beetles.model.SortRecord;
import org.gbif.beetles.model.Taxon;
import org.gbif.beetles.utils.TermUtils;
import org.gbif.utils.file.tabular.TabularDataFileReader;
import org.gbif.utils.file.tabular.TabularFiles;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStreamReader;
import java.text.ParseException;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import javax.annotation.Nullable;

import com.google.common.base.Charsets;
import com.google.common.base.Preconditions;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads the raw beetle tables from delimited text files in one directory. Columns are located by their header name,
 * so column order and additional columns do not matter. The pinning and expert tables are optional: a missing file is
 * an empty table.
 */
public class TabularFileDataProvider implements BeetleDataProvider {

  private static final Logger LOG = LoggerFactory.getLogger(TabularFileDataProvider.class);

  private final File directory;
  private final BeetleProperties properties;

  public TabularFileDataProvider(File directory, BeetleProperties properties) {
    this.directory = Preconditions.checkNotNull(directory, "directory");
    this.properties = Preconditions.checkNotNull(properties, "properties");
  }

  @Override
  public List<FieldSample> fieldSamples() throws IOException {
    Table table = read(properties.getFieldSamplesFile(), true);
    List<FieldSample> samples = Lists.newArrayListWithCapacity(table.rows.size());
    for (Row row : table.rows) {
      samples.add(new FieldSample(row.get("sampleID"), row.get("domainID"), row.get("siteID"), row.get("plotID"),
        row.get("trapID"), row.get("setDate"), row.get("collectDate"), row.get("eventID"),
        TermUtils.isCollected(row.get("sampleCollected"))));
    }
    LOG.info("Read " + samples.size() + " field samples.");
    return samples;
  }

  @Override
  public List<SortRecord> sortRecords() throws IOException {
    Table table = read(properties.getSortingFile(), true);
    List<SortRecord> sorts = Lists.newArrayListWithCapacity(table.rows.size());
    int skipped = 0;
    for (Row row : table.rows) {
      String sampleID = row.require("sampleID");
      String subsampleID = row.require("subsampleID");
      String sampleType = row.get("sampleType");
      Integer count = parseCount(row.get("individualCount"));
      Taxon taxon = taxon(row);
      if (sampleType == null || count == null || taxon == null) {
        // bycatch is often recorded without a determination or count
        LOG.debug("Sort record {} without sampleType, taxonID or valid individualCount skipped", subsampleID);
        skipped++;
        continue;
      }
      sorts.add(new SortRecord(sampleID, subsampleID, sampleType, taxon, count));
    }
    if (skipped > 0) {
      LOG.warn(skipped + " sort records without sampleType, taxonID or valid individualCount skipped.");
    }
    LOG.info("Read " + sorts.size() + " sort records.");
    return sorts;
  }

  @Override
  public List<PinRecord> pinRecords() throws IOException {
    Table table = read(properties.getPinningFile(), false);
    List<PinRecord> pins = Lists.newArrayListWithCapacity(table.rows.size());
    for (Row row : table.rows) {
      String subsampleID = row.require("subsampleID");
      String individualID = row.require("individualID");
      Taxon taxon = taxon(row);
      if (taxon == null) {
        LOG.warn("Pinned individual " + individualID + " has no taxonID and is ignored");
        continue;
      }
      pins.add(new PinRecord(subsampleID, individualID, taxon));
    }
    LOG.info("Read " + pins.size() + " pin records.");
    return pins;
  }

  @Override
  public List<ExpertRecord> expertRecords() throws IOException {
    Table table = read(properties.getExpertFile(), false);
    List<ExpertRecord> experts = Lists.newArrayListWithCapacity(table.rows.size());
    for (Row row : table.rows) {
      String individualID = row.require("individualID");
      Taxon taxon = taxon(row);
      if (taxon == null) {
        LOG.warn("Expert record for individual " + individualID + " has no taxonID and is ignored");
        continue;
      }
      experts.add(new ExpertRecord(individualID, taxon));
    }
    LOG.info("Read " + experts.size() + " expert records.");
    return experts;
  }

  @Nullable
  private static Taxon taxon(Row row) throws IOException {
    String taxonID = row.get("taxonID");
    if (taxonID == null) {
      return null;
    }
    return new Taxon(taxonID, row.get("scientificName"), row.get("taxonRank"),
      row.optional("identificationQualifier"));
  }

  @Nullable
  private static Integer parseCount(@Nullable String value) {
    if (value == null) {
      return null;
    }
    try {
      int count = Integer.parseInt(value);
      return count >= 1 ? count : null;
    } catch (NumberFormatException e) {
      LOG.debug("Invalid individualCount {}", value);
      return null;
    }
  }

  /**
   * Read a whole table, using its first line as header.
   *
   * @param fileName file in the input directory
   * @param required if false a missing file is read as an empty table
   */
  private Table read(String fileName, boolean required) throws IOException {
    File file = new File(directory, fileName);
    if (!file.exists()) {
      if (required) {
        throw new IOException("Missing input file " + file.getAbsolutePath());
      }
      LOG.info("No " + fileName + " in " + directory.getAbsolutePath() + ", assuming an empty table");
      return new Table(fileName, Collections.<String, Integer>emptyMap());
    }

    TabularDataFileReader<List<String>> reader = TabularFiles.newTabularFileReader(
      new InputStreamReader(new FileInputStream(file), Charsets.UTF_8), properties.getDelimiter(), "\n", '"', false);
    Table table = null;
    int line = 0;
    try {
      List<String> record;
      while ((record = reader.read()) != null) {
        line++;
        if (table == null) {
          table = new Table(fileName, index(record));
          continue;
        }
        if (isBlank(record)) {
          continue;
        }
        table.rows.add(new Row(table, record, line));
      }
    } catch (ParseException e) {
      throw new IOException("Failed to parse " + fileName + " after line " + line, e);
    } finally {
      reader.close();
    }
    if (table == null) {
      throw new IOException("Input file " + file.getAbsolutePath() + " has no header line");
    }
    LOG.debug("Iterated over {} lines in {}", line, fileName);
    return table;
  }

  private static Map<String, Integer> index(List<String> header) {
    Map<String, Integer> columns = Maps.newHashMap();
    for (int i = 0; i < header.size(); i++) {
      String name = StringUtils.trimToNull(header.get(i));
      if (name != null && !columns.containsKey(name)) {
        columns.put(name, i);
      }
    }
    return columns;
  }

  private static boolean isBlank(List<String> record) {
    for (String value : record) {
      if (StringUtils.isNotBlank(value)) {
        return false;
      }
    }
    return true;
  }

  /**
   * Rows of one file with their header index.
   */
  private static final class Table {

    private final String fileName;
    private final Map<String, Integer> columns;
    private final List<Row> rows = Lists.newArrayList();

    private Table(String fileName, Map<String, Integer> columns) {
      this.fileName = fileName;
      this.columns = columns;
    }
  }

  private static final class Row {

    private final Table table;
    private final List<String> values;
    private final int line;

    private Row(Table table, List<String> values, int line) {
      this.table = table;
      this.values = values;
      this.line = line;
    }

    /**
     * @return trimmed value of the column, null if blank or beyond the end of the row
     *
     * @throws IOException if the file has no such column
     */
    @Nullable
    String get(String column) throws IOException {
      if (!table.columns.containsKey(column)) {
        throw new IOException(table.fileName + " has no column " + column);
      }
      return optional(column);
    }

    /**
     * @return trimmed value of the column, null if blank or if the file has no such column
     */
    @Nullable
    String optional(String column) {
      Integer index = table.columns.get(column);
      if (index == null || index >= values.size()) {
        return null;
      }
      return StringUtils.trimToNull(values.get(index));
    }

    String require(String column) throws IOException {
      String value = get(column);
      if (value == null) {
        throw new IOException(table.fileName + " line " + line + ": missing " + column);
      }
      return value;
    }
  }
}
