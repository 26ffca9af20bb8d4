package org.gbif.beetles.model;

import javax.annotation.Nullable;

import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;
import com.google.common.base.Preconditions;

/**
 * A collected field sample with its trap exposure (trapping days) and the bout it belongs to. The collect date is the
 * resolved date of the sample's sampling event, formatted as yyyy-MM-dd.
 */
public final class TrappingRecord {

  private final String sampleID;
  private final String domainID;
  private final String siteID;
  private final String plotID;
  private final String trapID;
  private final String collectDate;
  private final int trappingDays;
  private final String boutID;

  public TrappingRecord(String sampleID, @Nullable String domainID, String siteID, @Nullable String plotID,
    @Nullable String trapID, String collectDate, int trappingDays, String boutID) {
    Preconditions.checkArgument(trappingDays >= 0, "trappingDays must not be negative: %s", trappingDays);
    this.sampleID = Preconditions.checkNotNull(sampleID, "sampleID");
    this.domainID = domainID;
    this.siteID = Preconditions.checkNotNull(siteID, "siteID");
    this.plotID = plotID;
    this.trapID = trapID;
    this.collectDate = Preconditions.checkNotNull(collectDate, "collectDate");
    this.trappingDays = trappingDays;
    this.boutID = Preconditions.checkNotNull(boutID, "boutID");
  }

  public String getSampleID() {
    return sampleID;
  }

  @Nullable
  public String getDomainID() {
    return domainID;
  }

  public String getSiteID() {
    return siteID;
  }

  @Nullable
  public String getPlotID() {
    return plotID;
  }

  @Nullable
  public String getTrapID() {
    return trapID;
  }

  public String getCollectDate() {
    return collectDate;
  }

  public int getTrappingDays() {
    return trappingDays;
  }

  public String getBoutID() {
    return boutID;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof TrappingRecord)) {
      return false;
    }
    TrappingRecord that = (TrappingRecord) o;
    return trappingDays == that.trappingDays
           && Objects.equal(sampleID, that.sampleID)
           && Objects.equal(domainID, that.domainID)
           && Objects.equal(siteID, that.siteID)
           && Objects.equal(plotID, that.plotID)
           && Objects.equal(trapID, that.trapID)
           && Objects.equal(collectDate, that.collectDate)
           && Objects.equal(boutID, that.boutID);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(sampleID, domainID, siteID, plotID, trapID, collectDate, trappingDays, boutID);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
      .add("sampleID", sampleID)
      .add("domainID", domainID)
      .add("siteID", siteID)
      .add("plotID", plotID)
      .add("trapID", trapID)
      .add("collectDate", collectDate)
      .add("trappingDays", trappingDays)
      .add("boutID", boutID)
      .toString();
  }
}
