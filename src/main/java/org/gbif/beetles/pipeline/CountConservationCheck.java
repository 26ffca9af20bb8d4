package org.gbif.beetles.pipeline;

import org.gbif.beetles.model.CountRow;
import org.gbif.beetles.model.ReconciledIndividual;

import java.util.List;
import java.util.Map;

import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Verifies that no individual was lost or counted twice on the way from the sorting table to the count table. A
 * violation points at a join defect or at inconsistent source data; it is reported, never fatal.
 */
public class CountConservationCheck {

  private static final Logger LOG = LoggerFactory.getLogger(CountConservationCheck.class);

  /**
   * @param sortRows   sort-level rows holding the declared individualCount of every subsample
   * @param reconciled reconciled individuals
   * @param counts     aggregated count rows
   *
   * @return one message per violation, empty if all individuals are accounted for
   */
  public List<String> check(List<ReconciledIndividual> sortRows, List<ReconciledIndividual> reconciled,
    List<CountRow> counts) {
    Map<String, Integer> declared = Maps.newLinkedHashMap();
    for (ReconciledIndividual sortRow : sortRows) {
      declared.put(sortRow.getSubsampleID(), sortRow.getIndividualCount());
    }

    Map<String, Integer> reconciledCounts = Maps.newHashMap();
    long reconciledTotal = 0;
    for (ReconciledIndividual individual : reconciled) {
      Integer sum = reconciledCounts.get(individual.getSubsampleID());
      reconciledCounts.put(individual.getSubsampleID(), (sum == null ? 0 : sum) + individual.getIndividualCount());
      reconciledTotal += individual.getIndividualCount();
    }

    List<String> warnings = Lists.newArrayList();
    for (Map.Entry<String, Integer> subsample : declared.entrySet()) {
      Integer sum = reconciledCounts.get(subsample.getKey());
      int actual = sum == null ? 0 : sum;
      if (actual != subsample.getValue()) {
        warnings.add("Subsample " + subsample.getKey() + " declares " + subsample.getValue()
                     + " individuals but " + actual + " were reconciled");
      }
    }
    for (String subsampleID : reconciledCounts.keySet()) {
      if (!declared.containsKey(subsampleID)) {
        warnings.add("Subsample " + subsampleID + " was reconciled without a sort record");
      }
    }

    long countTotal = 0;
    for (CountRow row : counts) {
      countTotal += row.getCount();
    }
    if (countTotal != reconciledTotal) {
      warnings.add("Count table holds " + countTotal + " individuals but " + reconciledTotal + " were reconciled");
    }

    for (String warning : warnings) {
      LOG.warn(warning);
    }
    if (warnings.isEmpty()) {
      LOG.info("All " + reconciledTotal + " individuals of " + declared.size() + " subsamples accounted for.");
    } else {
      LOG.warn("***** " + warnings.size() + " count conservation violations");
    }
    return warnings;
  }
}
