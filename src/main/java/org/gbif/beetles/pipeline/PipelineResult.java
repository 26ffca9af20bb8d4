package org.gbif.beetles.pipeline;

import org.gbif.beetles.model.CountRow;
import org.gbif.beetles.model.ReconciledIndividual;
import org.gbif.beetles.model.TrappingRecord;

import java.util.List;

import com.google.common.collect.ImmutableList;

/**
 * Everything produced by one pipeline run.
 */
public final class PipelineResult {

  private final List<TrappingRecord> trappingRecords;
  private final List<ReconciledIndividual> reconciled;
  private final List<CountRow> counts;
  private final List<String> warnings;

  public PipelineResult(List<TrappingRecord> trappingRecords, List<ReconciledIndividual> reconciled,
    List<CountRow> counts, List<String> warnings) {
    this.trappingRecords = ImmutableList.copyOf(trappingRecords);
    this.reconciled = ImmutableList.copyOf(reconciled);
    this.counts = ImmutableList.copyOf(counts);
    this.warnings = ImmutableList.copyOf(warnings);
  }

  public List<TrappingRecord> getTrappingRecords() {
    return trappingRecords;
  }

  public List<ReconciledIndividual> getReconciled() {
    return reconciled;
  }

  public List<CountRow> getCounts() {
    return counts;
  }

  /**
   * @return count conservation violations found in this run
   */
  public List<String> getWarnings() {
    return warnings;
  }

  public boolean isConserved() {
    return warnings.isEmpty();
  }
}
