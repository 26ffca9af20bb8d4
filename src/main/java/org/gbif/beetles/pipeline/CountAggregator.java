package org.gbif.beetles.pipeline;

import org.gbif.beetles.model.CountRow;
import org.gbif.beetles.model.ReconciledIndividual;
import org.gbif.beetles.model.Taxon;
import org.gbif.beetles.model.TrappingRecord;

import java.util.List;
import java.util.Map;

import com.google.common.base.Objects;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Sums reconciled individuals into one count per trap collection and taxon. Subsample, individual, identification
 * source and qualifier are not part of the key, so individuals reaching the same taxon through different subsamples
 * or sources are counted together.
 */
public class CountAggregator {

  private static final Logger LOG = LoggerFactory.getLogger(CountAggregator.class);

  /**
   * @param individuals reconciled individuals
   *
   * @return count rows with unique keys, in order of first appearance
   */
  public List<CountRow> aggregate(List<ReconciledIndividual> individuals) {
    Map<CountKey, Integer> counts = Maps.newLinkedHashMap();
    for (ReconciledIndividual individual : individuals) {
      CountKey key = new CountKey(individual.getTrapping(), individual.getTaxon());
      Integer count = counts.get(key);
      counts.put(key, (count == null ? 0 : count) + individual.getIndividualCount());
    }

    List<CountRow> rows = Lists.newArrayListWithCapacity(counts.size());
    for (Map.Entry<CountKey, Integer> entry : counts.entrySet()) {
      CountKey key = entry.getKey();
      rows.add(new CountRow(key.trapping, key.taxonID, key.scientificName, key.taxonRank, entry.getValue()));
    }
    LOG.info("Aggregated " + individuals.size() + " reconciled rows into " + rows.size() + " counts.");
    return rows;
  }

  private static final class CountKey {

    private final TrappingRecord trapping;
    private final String taxonID;
    private final String scientificName;
    private final String taxonRank;

    private CountKey(TrappingRecord trapping, Taxon taxon) {
      this.trapping = trapping;
      this.taxonID = taxon.getTaxonID();
      this.scientificName = taxon.getScientificName();
      this.taxonRank = taxon.getTaxonRank();
    }

    @Override
    public boolean equals(Object o) {
      if (this == o) {
        return true;
      }
      if (!(o instanceof CountKey)) {
        return false;
      }
      CountKey that = (CountKey) o;
      return Objects.equal(trapping, that.trapping)
             && Objects.equal(taxonID, that.taxonID)
             && Objects.equal(scientificName, that.scientificName)
             && Objects.equal(taxonRank, that.taxonRank);
    }

    @Override
    public int hashCode() {
      return Objects.hashCode(trapping, taxonID, scientificName, taxonRank);
    }
  }
}
