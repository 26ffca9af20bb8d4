package org.gbif.beetles.utils;

import java.io.File;
import java.io.IOException;
import java.io.Writer;
import java.util.regex.Pattern;
import javax.validation.constraints.NotNull;

import org.apache.commons.lang3.StringUtils;

/**
 * Set of utilities used to operate on files.
 */
public class FileUtils {

  private static final Pattern escapeChars = Pattern.compile("[\t\n\r]");

  private FileUtils() {
  }

  /**
   * Generate a row/string of values tab delimited. Line breaking characters encountered in
   * a value are replaced with a space, and blank values are written as empty columns.
   *
   * @param columns array of values/columns
   *
   * @return row/string of values tab delimited, terminated by a line break
   */
  @NotNull
  public static String tabRow(String[] columns) {
    String[] escaped = new String[columns.length];
    for (int i = 0; i < columns.length; i++) {
      if (columns[i] != null) {
        escaped[i] = StringUtils.trimToNull(escapeChars.matcher(columns[i]).replaceAll(" "));
      }
    }
    return StringUtils.join(escaped, '\t') + "\n";
  }

  /**
   * Create a new UTF-8 file in the output directory and write its header line.
   *
   * @param output   directory
   * @param fileName name of the file to create
   * @param header   column list equal to header line
   *
   * @return writer on file
   *
   * @throws IOException if writer failed to be created
   */
  public static Writer startTabFile(File output, String fileName, String[] header) throws IOException {
    File file = new File(output, fileName);
    Writer writer = org.gbif.utils.file.FileUtils.startNewUtf8File(file);
    writer.write(FileUtils.tabRow(header));
    return writer;
  }
}
