package org.gbif.beetles.model;

import javax.annotation.Nullable;

import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;

/**
 * One row of the field data table: a single pitfall trap on a single sampling attempt. Dates and identifiers are
 * carried exactly as published; they are validated and interpreted by the sample normalizer.
 */
public final class FieldSample {

  private final String sampleID;
  private final String domainID;
  private final String siteID;
  private final String plotID;
  private final String trapID;
  private final String setDate;
  private final String collectDate;
  private final String eventID;
  private final boolean collected;

  public FieldSample(@Nullable String sampleID, @Nullable String domainID, @Nullable String siteID,
    @Nullable String plotID, @Nullable String trapID, @Nullable String setDate, @Nullable String collectDate,
    @Nullable String eventID, boolean collected) {
    this.sampleID = sampleID;
    this.domainID = domainID;
    this.siteID = siteID;
    this.plotID = plotID;
    this.trapID = trapID;
    this.setDate = setDate;
    this.collectDate = collectDate;
    this.eventID = eventID;
    this.collected = collected;
  }

  @Nullable
  public String getSampleID() {
    return sampleID;
  }

  @Nullable
  public String getDomainID() {
    return domainID;
  }

  @Nullable
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

  @Nullable
  public String getSetDate() {
    return setDate;
  }

  @Nullable
  public String getCollectDate() {
    return collectDate;
  }

  @Nullable
  public String getEventID() {
    return eventID;
  }

  public boolean isCollected() {
    return collected;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof FieldSample)) {
      return false;
    }
    FieldSample that = (FieldSample) o;
    return collected == that.collected
           && Objects.equal(sampleID, that.sampleID)
           && Objects.equal(domainID, that.domainID)
           && Objects.equal(siteID, that.siteID)
           && Objects.equal(plotID, that.plotID)
           && Objects.equal(trapID, that.trapID)
           && Objects.equal(setDate, that.setDate)
           && Objects.equal(collectDate, that.collectDate)
           && Objects.equal(eventID, that.eventID);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(sampleID, domainID, siteID, plotID, trapID, setDate, collectDate, eventID, collected);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
      .add("sampleID", sampleID)
      .add("siteID", siteID)
      .add("plotID", plotID)
      .add("trapID", trapID)
      .add("setDate", setDate)
      .add("collectDate", collectDate)
      .add("eventID", eventID)
      .add("collected", collected)
      .toString();
  }
}
