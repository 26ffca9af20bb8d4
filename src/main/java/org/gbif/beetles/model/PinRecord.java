package org.gbif.beetles.model;

import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;
import com.google.common.base.Preconditions;

/**
 * A single specimen pinned out of a subsample and identified by a parataxonomist.
 */
public final class PinRecord {

  private final String subsampleID;
  private final String individualID;
  private final Taxon taxon;

  public PinRecord(String subsampleID, String individualID, Taxon taxon) {
    this.subsampleID = Preconditions.checkNotNull(subsampleID, "subsampleID");
    this.individualID = Preconditions.checkNotNull(individualID, "individualID");
    this.taxon = Preconditions.checkNotNull(taxon, "taxon");
  }

  public String getSubsampleID() {
    return subsampleID;
  }

  public String getIndividualID() {
    return individualID;
  }

  public Taxon getTaxon() {
    return taxon;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof PinRecord)) {
      return false;
    }
    PinRecord that = (PinRecord) o;
    return Objects.equal(subsampleID, that.subsampleID)
           && Objects.equal(individualID, that.individualID)
           && Objects.equal(taxon, that.taxon);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(subsampleID, individualID, taxon);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
      .add("subsampleID", subsampleID)
      .add("individualID", individualID)
      .add("taxon", taxon)
      .toString();
  }
}
