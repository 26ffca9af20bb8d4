package org.gbif.beetles;

import org.gbif.beetles.config.BeetleProperties;
import org.gbif.beetles.io.TabularCountTableWriter;
import org.gbif.beetles.io.TabularFileDataProvider;
import org.gbif.beetles.pipeline.BeetlePipeline;
import org.gbif.beetles.pipeline.PipelineResult;

import java.io.File;
import java.io.IOException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * This class is used to turn the ground beetle pitfall trap tables (field data, sorting, parataxonomist pinning and
 * expert taxonomist identifications) into a table of individuals counted per trap collection and taxon.
 * <p>
 * Usage: BeetleCounts inputDirectory [outputDirectory]. Without an output directory, a new temporary directory is
 * created.
 */
public class BeetleCounts {

  private static final Logger LOG = LoggerFactory.getLogger(BeetleCounts.class);

  public static void main(String[] args) throws IOException {
    if (args.length < 1) {
      LOG.error("Usage: BeetleCounts inputDirectory [outputDirectory]");
      System.exit(1);
    }
    File input = new File(args[0]);
    // directory where file should be written to
    File output = args.length > 1 ? new File(args[1]) : org.gbif.utils.file.FileUtils.createTempDir();

    PipelineResult result = processBeetles(input, output, BeetleProperties.load());
    LOG.info("Processing complete! " + result.getCounts().size() + " counts written to: " + output.getAbsolutePath());
    if (!result.isConserved()) {
      LOG.warn("Count table written with " + result.getWarnings().size() + " count conservation violations");
    }
  }

  /**
   * Reads the raw tables from the input directory, reconciles identifications, aggregates counts and writes the count
   * table into the output directory.
   *
   * @param input      directory holding the raw tables
   * @param output     directory to write the count table to
   * @param properties file names and pipeline settings
   *
   * @return result of the pipeline run
   *
   * @throws IOException if reading or writing fails
   */
  public static PipelineResult processBeetles(File input, File output, BeetleProperties properties)
    throws IOException {
    if (!output.isDirectory() && !output.mkdirs()) {
      throw new IOException("Failed to create output directory " + output.getAbsolutePath());
    }
    try {
      BeetlePipeline pipeline = new BeetlePipeline(new TabularFileDataProvider(input, properties), properties);
      PipelineResult result = pipeline.run();
      new TabularCountTableWriter(output, properties.getCountsFile()).write(result.getCounts());
      return result;
    } catch (IOException e) {
      LOG.error("Failed to process beetle tables in " + input.getAbsolutePath(), e);
      throw e;
    }
  }
}
