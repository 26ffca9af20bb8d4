package org.gbif.beetles.model;

import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;
import com.google.common.base.Preconditions;

/**
 * A re-identification of a pinned individual by an expert taxonomist.
 */
public final class ExpertRecord {

  private final String individualID;
  private final Taxon taxon;

  public ExpertRecord(String individualID, Taxon taxon) {
    this.individualID = Preconditions.checkNotNull(individualID, "individualID");
    this.taxon = Preconditions.checkNotNull(taxon, "taxon");
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
    if (!(o instanceof ExpertRecord)) {
      return false;
    }
    ExpertRecord that = (ExpertRecord) o;
    return Objects.equal(individualID, that.individualID) && Objects.equal(taxon, that.taxon);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(individualID, taxon);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this).add("individualID", individualID).add("taxon", taxon).toString();
  }
}
