package org.gbif.beetles.model;

import javax.annotation.Nullable;

import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;
import com.google.common.base.Preconditions;

/**
 * Number of individuals of one taxon caught in one trap collection. Every field except the count is part of the
 * row's key.
 */
public final class CountRow {

  /**
   * Column names of the count table, in output order.
   */
  public static final String[] COLUMNS = {
    "sampleID", "domainID", "siteID", "plotID", "trapID", "collectDate", "trappingDays", "boutID", "taxonID",
    "scientificName", "taxonRank", "count"
  };

  private final TrappingRecord trapping;
  private final String taxonID;
  private final String scientificName;
  private final String taxonRank;
  private final int count;

  public CountRow(TrappingRecord trapping, String taxonID, @Nullable String scientificName,
    @Nullable String taxonRank, int count) {
    this.trapping = Preconditions.checkNotNull(trapping, "trapping");
    this.taxonID = Preconditions.checkNotNull(taxonID, "taxonID");
    this.scientificName = scientificName;
    this.taxonRank = taxonRank;
    this.count = count;
  }

  public TrappingRecord getTrapping() {
    return trapping;
  }

  public String getTaxonID() {
    return taxonID;
  }

  @Nullable
  public String getScientificName() {
    return scientificName;
  }

  @Nullable
  public String getTaxonRank() {
    return taxonRank;
  }

  public int getCount() {
    return count;
  }

  /**
   * @return the row's values as strings, in the order of {@link #COLUMNS}
   */
  public String[] toColumns() {
    return new String[] {
      trapping.getSampleID(),
      trapping.getDomainID(),
      trapping.getSiteID(),
      trapping.getPlotID(),
      trapping.getTrapID(),
      trapping.getCollectDate(),
      String.valueOf(trapping.getTrappingDays()),
      trapping.getBoutID(),
      taxonID,
      scientificName,
      taxonRank,
      String.valueOf(count)
    };
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof CountRow)) {
      return false;
    }
    CountRow that = (CountRow) o;
    return count == that.count
           && Objects.equal(trapping, that.trapping)
           && Objects.equal(taxonID, that.taxonID)
           && Objects.equal(scientificName, that.scientificName)
           && Objects.equal(taxonRank, that.taxonRank);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(trapping, taxonID, scientificName, taxonRank, count);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
      .add("sampleID", trapping.getSampleID())
      .add("boutID", trapping.getBoutID())
      .add("taxonID", taxonID)
      .add("scientificName", scientificName)
      .add("count", count)
      .toString();
  }
}
