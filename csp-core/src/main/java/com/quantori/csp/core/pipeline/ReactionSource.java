package com.quantori.csp.core.pipeline;

import com.quantori.csp.api.model.Reaction;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Set;

/** Source of reactions to balance. */
public interface ReactionSource {

  /* reactions to process */
  Iterator<Reaction> createIterator();

  /**
   * Source over a fixed collection. A reaction instance listed more than once is emitted only the
   * first time, so no reaction reaches two workers.
   *
   * @param reactions reactions in order
   * @return source emitting each distinct instance once
   */
  static ReactionSource of(Collection<Reaction> reactions) {
    Set<Reaction> seen = Collections.newSetFromMap(new IdentityHashMap<>());
    List<Reaction> distinct = new ArrayList<>();
    for (Reaction reaction : reactions) {
      if (seen.add(reaction)) {
        distinct.add(reaction);
      }
    }
    List<Reaction> copy = List.copyOf(distinct);
    return copy::iterator;
  }
}
