package org.gbif.beetles.model;

import javax.annotation.Nullable;

import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;
import com.google.common.base.Preconditions;

/**
 * A taxon tagged with the identification source that determined it.
 */
public final class Identification {

  private final IdentificationSource source;
  private final Taxon taxon;

  private Identification(IdentificationSource source, Taxon taxon) {
    this.source = Preconditions.checkNotNull(source, "source");
    this.taxon = Preconditions.checkNotNull(taxon, "taxon");
  }

  public static Identification sort(Taxon taxon) {
    return new Identification(IdentificationSource.SORT, taxon);
  }

  public static Identification pin(Taxon taxon) {
    return new Identification(IdentificationSource.PIN, taxon);
  }

  public static Identification expert(Taxon taxon) {
    return new Identification(IdentificationSource.EXPERT, taxon);
  }

  /**
   * Resolve this identification against a candidate coming from another source. The candidate only wins when its
   * source outranks this one; a missing candidate never erases this identification.
   *
   * @param candidate identification from another source, may be null
   *
   * @return the identification with the higher precedence
   */
  public Identification resolve(@Nullable Identification candidate) {
    if (candidate != null && candidate.source.outranks(source)) {
      return candidate;
    }
    return this;
  }

  public IdentificationSource getSource() {
    return source;
  }

  public Taxon getTaxon() {
    return taxon;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Identification)) {
      return false;
    }
    Identification that = (Identification) o;
    return source == that.source && Objects.equal(taxon, that.taxon);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(source, taxon);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this).add("source", source.getLabel()).add("taxon", taxon).toString();
  }
}
