package org.gbif.beetles.model;

import javax.annotation.Nullable;

import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;
import com.google.common.base.Preconditions;

/**
 * Taxonomic determination as recorded by the sorting, pinning or expert identification tables.
 */
public final class Taxon {

  private final String taxonID;
  private final String scientificName;
  private final String taxonRank;
  private final String identificationQualifier;

  public Taxon(String taxonID, @Nullable String scientificName, @Nullable String taxonRank,
    @Nullable String identificationQualifier) {
    this.taxonID = Preconditions.checkNotNull(taxonID, "taxonID");
    this.scientificName = scientificName;
    this.taxonRank = taxonRank;
    this.identificationQualifier = identificationQualifier;
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

  /**
   * @return qualifier such as "cf. species" or "aff. genus", null if the determination is unqualified
   */
  @Nullable
  public String getIdentificationQualifier() {
    return identificationQualifier;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Taxon)) {
      return false;
    }
    Taxon that = (Taxon) o;
    return Objects.equal(taxonID, that.taxonID)
           && Objects.equal(scientificName, that.scientificName)
           && Objects.equal(taxonRank, that.taxonRank)
           && Objects.equal(identificationQualifier, that.identificationQualifier);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(taxonID, scientificName, taxonRank, identificationQualifier);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
      .add("taxonID", taxonID)
      .add("scientificName", scientificName)
      .add("taxonRank", taxonRank)
      .add("identificationQualifier", identificationQualifier)
      .omitNullValues()
      .toString();
  }
}
