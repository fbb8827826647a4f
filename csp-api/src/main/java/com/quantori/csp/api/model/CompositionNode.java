package com.quantori.csp.api.model;

import java.util.Map;
import java.util.Set;

/**
 * Tree describing which elements, and how many of each, make up a species. A node is either a
 * {@link Leaf} (one element with a count) or a {@link Group} of repeated sub-compositions, which
 * allows formulas such as Ba(OH)2 or Fe(NO3)3 to keep their parenthesised structure.
 */
public interface CompositionNode {

  /**
   * Collapses the tree into atom counts: every child's counts are multiplied by its group
   * multiplier and summed by element. The result never contains a zero or negative count.
   *
   * @return unmodifiable element to count mapping ordered by atomic number
   * @throws ArithmeticException if a count overflows a long
   */
  Map<ElementSymbol, Long> flatten();

  /**
   * Distinct elements present anywhere in the tree.
   *
   * @return unmodifiable set of elements
   */
  default Set<ElementSymbol> elements() {
    return flatten().keySet();
  }
}
