package org.gbif.beetles.pipeline;

import org.gbif.beetles.config.BeetleProperties;
import org.gbif.beetles.io.BeetleDataProvider;
import org.gbif.beetles.model.CountRow;
import org.gbif.beetles.model.ReconciledIndividual;
import org.gbif.beetles.model.TrappingRecord;

import java.io.IOException;
import java.util.List;
import java.util.Set;

import com.google.common.base.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns the four raw beetle tables into a table of counts per trap collection and taxon. The data provider is owned
 * by the caller; the pipeline only reads from it.
 */
public class BeetlePipeline {

  private static final Logger LOG = LoggerFactory.getLogger(BeetlePipeline.class);

  private final BeetleDataProvider provider;
  private final SampleNormalizer normalizer;
  private final IdentificationMerger merger;
  private final CountAggregator aggregator;
  private final CountConservationCheck conservationCheck;

  public BeetlePipeline(BeetleDataProvider provider, BeetleProperties properties) {
    this(provider, properties.getEventIdSeparators(), properties.getSortSampleTypes());
  }

  public BeetlePipeline(BeetleDataProvider provider, String eventIdSeparators, Set<String> sortSampleTypes) {
    this.provider = Preconditions.checkNotNull(provider, "provider");
    this.normalizer = new SampleNormalizer(eventIdSeparators);
    this.merger = new IdentificationMerger(sortSampleTypes);
    this.aggregator = new CountAggregator();
    this.conservationCheck = new CountConservationCheck();
  }

  /**
   * @return trapping records, reconciled individuals, counts and conservation warnings of this run
   *
   * @throws IOException                 if the provider fails to supply a table
   * @throws InvalidFieldSampleException if a collected field sample cannot be interpreted
   */
  public PipelineResult run() throws IOException {
    List<TrappingRecord> trapping = normalizer.normalize(provider.fieldSamples());

    List<ReconciledIndividual> sortRows = merger.sortBaseline(trapping, provider.sortRecords());
    List<ReconciledIndividual> pinRows = merger.pinOverride(sortRows, provider.pinRecords());
    List<ReconciledIndividual> reconciled = merger.expertOverride(pinRows, provider.expertRecords());

    List<CountRow> counts = aggregator.aggregate(reconciled);
    List<String> warnings = conservationCheck.check(sortRows, reconciled, counts);

    LOG.info("Pipeline complete: " + trapping.size() + " trapping records, " + reconciled.size()
             + " reconciled rows, " + counts.size() + " counts.");
    return new PipelineResult(trapping, reconciled, counts, warnings);
  }
}
