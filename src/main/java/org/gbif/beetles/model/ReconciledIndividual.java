package org.gbif.beetles.model;

import javax.annotation.Nullable;

import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;
import com.google.common.base.Preconditions;

/**
 * The resolved identification of either one pinned individual (count 1) or a group of individuals that were only
 * identified at sort level (the whole subsample, or the residual left after partial pinning).
 */
public final class ReconciledIndividual {

  private final TrappingRecord trapping;
  private final String subsampleID;
  private final String sampleType;
  private final String individualID;
  private final Identification identification;
  private final int individualCount;

  public ReconciledIndividual(TrappingRecord trapping, String subsampleID, String sampleType,
    @Nullable String individualID, Identification identification, int individualCount) {
    Preconditions.checkArgument(individualCount >= 1, "individualCount must be at least 1: %s", individualCount);
    this.trapping = Preconditions.checkNotNull(trapping, "trapping");
    this.subsampleID = Preconditions.checkNotNull(subsampleID, "subsampleID");
    this.sampleType = Preconditions.checkNotNull(sampleType, "sampleType");
    this.individualID = individualID;
    this.identification = Preconditions.checkNotNull(identification, "identification");
    this.individualCount = individualCount;
  }

  /**
   * @return a copy carrying the given identification, everything else unchanged
   */
  public ReconciledIndividual withIdentification(Identification other) {
    return new ReconciledIndividual(trapping, subsampleID, sampleType, individualID, other, individualCount);
  }

  public TrappingRecord getTrapping() {
    return trapping;
  }

  public String getSubsampleID() {
    return subsampleID;
  }

  public String getSampleType() {
    return sampleType;
  }

  /**
   * @return the pinned specimen's identifier, or null for rows identified at sort level only
   */
  @Nullable
  public String getIndividualID() {
    return individualID;
  }

  public Identification getIdentification() {
    return identification;
  }

  public IdentificationSource getIdentificationSource() {
    return identification.getSource();
  }

  public Taxon getTaxon() {
    return identification.getTaxon();
  }

  public int getIndividualCount() {
    return individualCount;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof ReconciledIndividual)) {
      return false;
    }
    ReconciledIndividual that = (ReconciledIndividual) o;
    return individualCount == that.individualCount
           && Objects.equal(trapping, that.trapping)
           && Objects.equal(subsampleID, that.subsampleID)
           && Objects.equal(sampleType, that.sampleType)
           && Objects.equal(individualID, that.individualID)
           && Objects.equal(identification, that.identification);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(trapping, subsampleID, sampleType, individualID, identification, individualCount);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
      .add("sampleID", trapping.getSampleID())
      .add("subsampleID", subsampleID)
      .add("individualID", individualID)
      .add("identification", identification)
      .add("individualCount", individualCount)
      .toString();
  }
}
