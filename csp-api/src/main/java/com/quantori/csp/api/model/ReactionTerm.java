package com.quantori.csp.api.model;

import com.quantori.csp.api.CompositionException;
import java.util.Objects;
import lombok.Getter;
import lombok.ToString;

/**
 * A species on one side of an equation, with its stoichiometric coefficient. Catalysts are kept
 * for display and persistence but take no part in balancing.
 */
@Getter
@ToString
public class ReactionTerm {
  private final Species species;
  private long coefficient;
  private final boolean catalyst;

  public ReactionTerm(Species species, long coefficient, boolean catalyst) {
    this.species = Objects.requireNonNull(species, "species");
    if (coefficient < 1) {
      throw new CompositionException(ErrorType.INVALID_MULTIPLIER,
          "Coefficient must be positive, got " + coefficient + " for " + species);
    }
    this.coefficient = coefficient;
    this.catalyst = catalyst;
  }

  ReactionTerm copy() {
    return new ReactionTerm(species, coefficient, catalyst);
  }

  void setCoefficient(long coefficient) {
    this.coefficient = coefficient;
  }
}
