package org.gbif.beetles.model;

/**
 * Where an identification comes from, in increasing order of taxonomic rigor. The declaration order is the
 * precedence order: a later constant outranks an earlier one.
 */
public enum IdentificationSource {
  SORT("sort"),
  PIN("pin"),
  EXPERT("expert");

  private final String label;

  IdentificationSource(String label) {
    this.label = label;
  }

  /**
   * @return lower case label used in output tables
   */
  public String getLabel() {
    return label;
  }

  public boolean outranks(IdentificationSource other) {
    return compareTo(other) > 0;
  }
}
