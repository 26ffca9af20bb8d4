package org.gbif.beetles.model;

import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;
import com.google.common.base.Preconditions;

/**
 * A group of individuals sorted together out of one trap collection by the field technicians.
 */
public final class SortRecord {

  private final String sampleID;
  private final String subsampleID;
  private final String sampleType;
  private final Taxon taxon;
  private final int individualCount;

  public SortRecord(String sampleID, String subsampleID, String sampleType, Taxon taxon, int individualCount) {
    Preconditions.checkArgument(individualCount >= 1, "individualCount must be at least 1: %s", individualCount);
    this.sampleID = Preconditions.checkNotNull(sampleID, "sampleID");
    this.subsampleID = Preconditions.checkNotNull(subsampleID, "subsampleID");
    this.sampleType = Preconditions.checkNotNull(sampleType, "sampleType");
    this.taxon = Preconditions.checkNotNull(taxon, "taxon");
    this.individualCount = individualCount;
  }

  public String getSampleID() {
    return sampleID;
  }

  public String getSubsampleID() {
    return subsampleID;
  }

  /**
   * @return sample type, e.g. "carabid", "other carabid", "invert bycatch"
   */
  public String getSampleType() {
    return sampleType;
  }

  public Taxon getTaxon() {
    return taxon;
  }

  public int getIndividualCount() {
    return individualCount;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof SortRecord)) {
      return false;
    }
    SortRecord that = (SortRecord) o;
    return individualCount == that.individualCount
           && Objects.equal(sampleID, that.sampleID)
           && Objects.equal(subsampleID, that.subsampleID)
           && Objects.equal(sampleType, that.sampleType)
           && Objects.equal(taxon, that.taxon);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(sampleID, subsampleID, sampleType, taxon, individualCount);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
      .add("sampleID", sampleID)
      .add("subsampleID", subsampleID)
      .add("sampleType", sampleType)
      .add("taxon", taxon)
      .add("individualCount", individualCount)
      .toString();
  }
}
