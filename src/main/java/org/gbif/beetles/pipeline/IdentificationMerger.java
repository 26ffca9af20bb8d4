package org.gbif.beetles.pipeline;

import org.gbif.beetles.model.ExpertRecord;
import org.gbif.beetles.model.Identification;
import org.gbif.beetles.model.IdentificationSource;
import org.gbif.beetles.model.PinRecord;
import org.gbif.beetles.model.ReconciledIndividual;
import org.gbif.beetles.model.SortRecord;
import org.gbif.beetles.model.TrappingRecord;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.ListMultimap;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import com.google.common.collect.MultimapBuilder;
import com.google.common.collect.Sets;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reconciles the sorting, pinning and expert identification tables into one identification per individual. The passes
 * run in a fixed order and each one can only override an identification made by a lower ranked source:
 * i) sort: every admitted subsample of a collected sample, with its declared individualCount
 * ii) pin: each pinned individual replaces one individual of its subsample; un-pinned individuals remain as a single
 * residual sort-level row
 * iii) expert: re-identifications of pinned individuals, except individuals the experts disagree about
 * <p>
 * An expert re-identification applies to the examined individual only. It is not carried over to un-pinned siblings
 * of the same subsample, so a subsample can end up split across several taxa.
 */
public class IdentificationMerger {

  private static final Logger LOG = LoggerFactory.getLogger(IdentificationMerger.class);

  private final Set<String> sampleTypes;

  /**
   * @param sampleTypes sort sample types to admit (lower case); other sort rows are bycatch
   */
  public IdentificationMerger(Set<String> sampleTypes) {
    Preconditions.checkArgument(!sampleTypes.isEmpty(), "At least one sample type must be admitted");
    this.sampleTypes = ImmutableSet.copyOf(sampleTypes);
  }

  /**
   * Run all three passes.
   */
  public List<ReconciledIndividual> merge(List<TrappingRecord> trapping, List<SortRecord> sorts,
    List<PinRecord> pins, List<ExpertRecord> experts) {
    return expertOverride(pinOverride(sortBaseline(trapping, sorts), pins), experts);
  }

  /**
   * Pass 1: join the trapping records to the admitted sort records. Sort records of uncollected or unknown samples and
   * collected samples without sort records contribute nothing.
   *
   * @return one sort-level row per admitted subsample, carrying the declared individualCount
   */
  public List<ReconciledIndividual> sortBaseline(List<TrappingRecord> trapping, List<SortRecord> sorts) {
    Map<String, TrappingRecord> bySample = Maps.newHashMap();
    for (TrappingRecord t : trapping) {
      if (bySample.put(t.getSampleID(), t) != null) {
        LOG.warn("Duplicate trapping record for sampleID " + t.getSampleID() + ", using the last one");
      }
    }

    List<ReconciledIndividual> rows = Lists.newArrayList();
    Set<String> subsamples = Sets.newHashSet();
    int bycatch = 0;
    int orphans = 0;
    for (SortRecord sort : sorts) {
      if (!sampleTypes.contains(sort.getSampleType().toLowerCase())) {
        bycatch++;
        continue;
      }
      TrappingRecord t = bySample.get(sort.getSampleID());
      if (t == null) {
        orphans++;
        LOG.debug("Subsample {} dropped: sample {} was not collected", sort.getSubsampleID(), sort.getSampleID());
        continue;
      }
      if (!subsamples.add(sort.getSubsampleID())) {
        LOG.warn("Duplicate sort record for subsampleID " + sort.getSubsampleID() + " ignored");
        continue;
      }
      rows.add(new ReconciledIndividual(t, sort.getSubsampleID(), sort.getSampleType(), null,
        Identification.sort(sort.getTaxon()), sort.getIndividualCount()));
    }

    LOG.info("Sort pass: " + rows.size() + " subsamples kept, " + bycatch + " bycatch rows and " + orphans
             + " rows without a collected sample dropped.");
    return rows;
  }

  /**
   * Pass 2: replace sort-level identifications by the pinned individuals of each subsample. When fewer individuals
   * were pinned than the subsample declares, the remainder stays as one sort-level row.
   *
   * @param sortRows output of {@link #sortBaseline(List, List)}
   * @param pins     pin records in input order
   */
  public List<ReconciledIndividual> pinOverride(List<ReconciledIndividual> sortRows, List<PinRecord> pins) {
    ListMultimap<String, PinRecord> pinsBySubsample = MultimapBuilder.hashKeys().arrayListValues().build();
    for (PinRecord pin : pins) {
      pinsBySubsample.put(pin.getSubsampleID(), pin);
    }

    List<ReconciledIndividual> rows = Lists.newArrayList();
    int pinned = 0;
    int residuals = 0;
    for (ReconciledIndividual sortRow : sortRows) {
      Collection<PinRecord> subsamplePins = distinctIndividuals(pinsBySubsample.get(sortRow.getSubsampleID()));
      if (subsamplePins.isEmpty()) {
        rows.add(sortRow);
        continue;
      }

      for (PinRecord pin : subsamplePins) {
        Identification identification = sortRow.getIdentification().resolve(Identification.pin(pin.getTaxon()));
        rows.add(new ReconciledIndividual(sortRow.getTrapping(), sortRow.getSubsampleID(), sortRow.getSampleType(),
          pin.getIndividualID(), identification, 1));
        pinned++;
      }

      int remaining = sortRow.getIndividualCount() - subsamplePins.size();
      if (remaining > 0) {
        rows.add(new ReconciledIndividual(sortRow.getTrapping(), sortRow.getSubsampleID(), sortRow.getSampleType(),
          null, sortRow.getIdentification(), remaining));
        residuals++;
      } else if (remaining < 0) {
        LOG.warn("Subsample " + sortRow.getSubsampleID() + " declares " + sortRow.getIndividualCount()
                 + " individuals but " + subsamplePins.size() + " were pinned");
      }
    }

    LOG.info("Pin pass: " + pinned + " pinned individuals, " + residuals + " residual sort-level rows.");
    return rows;
  }

  /**
   * Pass 3: apply expert re-identifications to pinned individuals. Individuals whose expert records disagree on the
   * taxonID keep their pin-level identification.
   *
   * @param pinRows output of {@link #pinOverride(List, List)}
   * @param experts expert records in input order
   */
  public List<ReconciledIndividual> expertOverride(List<ReconciledIndividual> pinRows, List<ExpertRecord> experts) {
    Set<String> excluded = inconsistentExpertIdentifications(experts);

    // first expert record per individual
    Map<String, ExpertRecord> byIndividual = Maps.newHashMap();
    for (ExpertRecord expert : experts) {
      if (!excluded.contains(expert.getIndividualID()) && !byIndividual.containsKey(expert.getIndividualID())) {
        byIndividual.put(expert.getIndividualID(), expert);
      }
    }

    List<ReconciledIndividual> rows = Lists.newArrayListWithCapacity(pinRows.size());
    int overridden = 0;
    for (ReconciledIndividual row : pinRows) {
      ExpertRecord expert = row.getIndividualID() == null ? null : byIndividual.get(row.getIndividualID());
      if (expert != null && row.getIdentificationSource() == IdentificationSource.PIN) {
        rows.add(row.withIdentification(row.getIdentification().resolve(Identification.expert(expert.getTaxon()))));
        overridden++;
      } else {
        rows.add(row);
      }
    }

    LOG.info("Expert pass: " + overridden + " individuals re-identified, " + excluded.size()
             + " individuals with conflicting expert identifications left at pin level.");
    return rows;
  }

  /**
   * @return individualIDs with more than one distinct expert taxonID
   */
  public static Set<String> inconsistentExpertIdentifications(List<ExpertRecord> experts) {
    Map<String, String> firstTaxon = Maps.newHashMap();
    Set<String> excluded = Sets.newLinkedHashSet();
    for (ExpertRecord expert : experts) {
      String previous = firstTaxon.get(expert.getIndividualID());
      if (previous == null) {
        firstTaxon.put(expert.getIndividualID(), expert.getTaxon().getTaxonID());
      } else if (!previous.equals(expert.getTaxon().getTaxonID())) {
        if (excluded.add(expert.getIndividualID())) {
          LOG.debug("Experts disagree on individual {}: {} and {}", expert.getIndividualID(), previous,
            expert.getTaxon().getTaxonID());
        }
      }
    }
    return excluded;
  }

  /**
   * @return the pins of one subsample, keeping the first record of every individualID
   */
  private static Collection<PinRecord> distinctIndividuals(List<PinRecord> pins) {
    Map<String, PinRecord> distinct = Maps.newLinkedHashMap();
    for (PinRecord pin : pins) {
      if (distinct.containsKey(pin.getIndividualID())) {
        LOG.debug("Duplicate pin record for individual {} ignored", pin.getIndividualID());
      } else {
        distinct.put(pin.getIndividualID(), pin);
      }
    }
    return distinct.values();
  }
}
