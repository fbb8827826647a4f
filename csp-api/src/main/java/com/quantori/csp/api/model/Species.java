package com.quantori.csp.api.model;

import com.quantori.csp.api.util.FormulaUtilities;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * One chemical species: a composition with a net charge and an optional phase. Species are
 * immutable; charge and phase belong to the value, so Fe, Fe2+ and Fe(s) are three different
 * species sharing the same composition.
 *
 * @see com.quantori.csp.api.Expressions
 */
@Value
@Builder(toBuilder = true)
public class Species {
  @NonNull CompositionNode composition;
  int charge;
  PhaseTag phase;

  public Optional<PhaseTag> getPhase() {
    return Optional.ofNullable(phase);
  }

  public Map<ElementSymbol, Long> flatten() {
    return composition.flatten();
  }

  public Set<ElementSymbol> elements() {
    return composition.elements();
  }

  public boolean contains(ElementSymbol element) {
    return elements().contains(element);
  }

  public long count(ElementSymbol element) {
    return flatten().getOrDefault(element, 0L);
  }

  public long atomCount() {
    return flatten().values().stream().mapToLong(Long::longValue).sum();
  }

  /**
   * A species is elemental when it is made of a single distinct element, e.g. Fe, O2 or Fe3+.
   */
  public boolean isElemental() {
    return elements().size() == 1;
  }

  public boolean isCharged() {
    return charge != 0;
  }

  /**
   * Molar mass from the standard atomic weights.
   *
   * @return molecular weight in g/mol
   */
  public double molecularWeight() {
    return flatten().entrySet().stream()
        .mapToDouble(entry -> entry.getKey().getAtomicWeight() * entry.getValue())
        .sum();
  }

  /**
   * Formula keeping the parenthesised structure of the composition, without charge or phase.
   */
  public String formula() {
    return FormulaUtilities.formula(composition);
  }

  @Override
  public String toString() {
    return FormulaUtilities.label(this);
  }
}
