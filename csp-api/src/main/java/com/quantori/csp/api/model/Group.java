package com.quantori.csp.api.model;

import com.quantori.csp.api.CompositionException;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Ordered collection of sub-compositions, each repeated by its own multiplier. Groups nest to any
 * depth; Ba(OH)2 is {@code Group[(Leaf(Ba),1), (Group[(Leaf(O),1),(Leaf(H),1)],2)]}.
 */
public record Group(List<Member> members) implements CompositionNode {

  public Group {
    Objects.requireNonNull(members, "members");
    if (members.isEmpty()) {
      throw new CompositionException(ErrorType.INVALID_COUNT, "A group needs at least one member");
    }
    members = List.copyOf(members);
  }

  public static Group of(CompositionNode node, int multiplier) {
    return new Group(List.of(new Member(node, multiplier)));
  }

  @Override
  public Map<ElementSymbol, Long> flatten() {
    Map<ElementSymbol, Long> counts = new EnumMap<>(ElementSymbol.class);
    for (Member member : members) {
      member.node().flatten().forEach((element, count) ->
          counts.merge(element, Math.multiplyExact(count, (long) member.multiplier()), Math::addExact));
    }
    return Collections.unmodifiableMap(counts);
  }

  /**
   * One child of a group together with the number of times it is repeated.
   */
  public record Member(CompositionNode node, int multiplier) {

    public Member {
      Objects.requireNonNull(node, "node");
      if (multiplier < 1) {
        throw new CompositionException(ErrorType.INVALID_MULTIPLIER,
            "Group multiplier must be positive, got " + multiplier);
      }
    }
  }
}
