package com.quantori.csp.api.model;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/**
 * Label assigned to a balanced reaction by the classifier.
 */
public enum ReactionType {
  /** An oxygen-only reactant burns a carbon compound into CO2 and H2O. */
  COMBUSTION,
  /** A single reactant breaks into several products. */
  DECOMPOSITION,
  /** Several reactants combine into a single product. */
  SYNTHESIS,
  /** Charge annotations show an element changing its oxidation state. */
  REDOX,
  /** An acid and a base neutralise each other into water. */
  ACID_BASE,
  /** Two compounds exchange partners, AB + CD -> AD + CB. */
  DOUBLE_DISPLACEMENT,
  /** An element replaces another one in a compound, A + BC -> AC + B. */
  SINGLE_DISPLACEMENT,
  /** None of the rules matched. */
  UNCLASSIFIED;

  @JsonValue
  public String getValue() {
    return name().toLowerCase(Locale.ROOT);
  }
}
