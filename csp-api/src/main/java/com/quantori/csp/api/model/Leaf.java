package com.quantori.csp.api.model;

import com.quantori.csp.api.CompositionException;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * A single element repeated {@code count} times, e.g. the H2 in H2O.
 */
public record Leaf(ElementSymbol element, int count) implements CompositionNode {

  public Leaf {
    Objects.requireNonNull(element, "element");
    if (count < 1) {
      throw new CompositionException(ErrorType.INVALID_COUNT,
          "Element count must be positive, got " + count + " for " + element.getSymbol());
    }
  }

  @Override
  public Map<ElementSymbol, Long> flatten() {
    Map<ElementSymbol, Long> counts = new EnumMap<>(ElementSymbol.class);
    counts.put(element, (long) count);
    return Collections.unmodifiableMap(counts);
  }
}
