package org.gbif.beetles.io;

import org.gbif.beetles.model.CountRow;
import org.gbif.beetles.utils.FileUtils;

import java.io.File;
import java.io.IOException;
import java.io.Writer;
import java.util.List;

import com.google.common.base.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes the count table as a UTF-8, tab delimited file with a header line.
 */
public class TabularCountTableWriter implements CountTableSink {

  private static final Logger LOG = LoggerFactory.getLogger(TabularCountTableWriter.class);

  private final File output;
  private final String fileName;

  /**
   * @param output   directory to write the file to
   * @param fileName name of the count table file
   */
  public TabularCountTableWriter(File output, String fileName) {
    this.output = Preconditions.checkNotNull(output, "output");
    this.fileName = Preconditions.checkNotNull(fileName, "fileName");
  }

  @Override
  public void write(List<CountRow> counts) throws IOException {
    Writer writer = FileUtils.startTabFile(output, fileName, CountRow.COLUMNS);
    try {
      for (CountRow row : counts) {
        writer.write(FileUtils.tabRow(row.toColumns()));
      }
    } finally {
      writer.close();
    }
    LOG.info("Wrote " + counts.size() + " counts to " + getFile().getAbsolutePath());
  }

  public File getFile() {
    return new File(output, fileName);
  }
}
