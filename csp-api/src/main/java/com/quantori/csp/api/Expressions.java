package com.quantori.csp.api;

import com.quantori.csp.api.model.CompositionNode;
import com.quantori.csp.api.model.ElementSymbol;
import com.quantori.csp.api.model.ErrorType;
import com.quantori.csp.api.model.Group;
import com.quantori.csp.api.model.Leaf;
import com.quantori.csp.api.model.PhaseTag;
import com.quantori.csp.api.model.Reaction;
import com.quantori.csp.api.model.ReactionTerm;
import com.quantori.csp.api.model.Species;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import lombok.experimental.UtilityClass;

/**
 * Fluent construction of species and reactions. Every operation returns a new value and never
 * changes its arguments; invalid input is rejected with a {@link CompositionException} instead of
 * being coerced.
 *
 * <pre>{@code
 * Species water = combine(element(H, 2), element(O));
 * Species ironNitrate = addGroup(element(Fe), compound(element(N), element(O, 3)), 3);
 * Reaction reaction = react(join(term(element(H, 2)), term(element(O, 2))), join(term(water)));
 * }</pre>
 */
@UtilityClass
public final class Expressions {

  /**
   * Single neutral atom of an element, without phase.
   *
   * @param element the element
   * @return a species with one leaf of count one
   */
  public static Species element(ElementSymbol element) {
    return element(element, 1);
  }

  /**
   * Single neutral atom looked up by its symbol.
   *
   * @param symbol element symbol, case sensitive, e.g. {@code Fe}
   * @return a species with one leaf of count one
   * @throws CompositionException with {@link ErrorType#UNKNOWN_ELEMENT} for an unknown symbol
   */
  public static Species element(String symbol) {
    return element(ElementSymbol.of(symbol), 1);
  }

  /**
   * Element repeated {@code count} times, e.g. O2.
   *
   * @param element the element
   * @param count   number of atoms
   * @return a neutral species without phase
   * @throws CompositionException with {@link ErrorType#INVALID_COUNT} if {@code count < 1}
   */
  public static Species element(ElementSymbol element, int count) {
    return Species.builder().composition(new Leaf(element, count)).build();
  }

  /**
   * Puts two species side by side in one group. Charges are added, the phase is left unset.
   *
   * @throws CompositionException with {@link ErrorType#PHASE_CONFLICT} if both carry different phases
   */
  public static Species combine(Species a, Species b) {
    return compound(a, b);
  }

  /**
   * Same as {@link #combine(Species, Species)} for any number of parts, producing one flat group.
   */
  public static Species compound(Species... parts) {
    if (parts.length == 0) {
      throw new CompositionException(ErrorType.INVALID_COUNT, "A compound needs at least one part");
    }
    requireSamePhase(parts);
    List<Group.Member> members = new ArrayList<>();
    int charge = 0;
    for (Species part : parts) {
      members.add(new Group.Member(part.getComposition(), 1));
      charge = Math.addExact(charge, part.getCharge());
    }
    return Species.builder().composition(new Group(members)).charge(charge).build();
  }

  /**
   * Repeats a whole species {@code n} times, multiplying its charge. The phase is kept.
   *
   * @throws CompositionException with {@link ErrorType#INVALID_MULTIPLIER} if {@code n < 1}
   */
  public static Species scale(Species species, int n) {
    requirePositive(n);
    return species.toBuilder()
        .composition(Group.of(species.getComposition(), n))
        .charge(Math.multiplyExact(species.getCharge(), n))
        .build();
  }

  /**
   * Attaches {@code n} copies of a parenthesised sub-group to a base species, as in Fe(NO3)3.
   * The charge becomes {@code base + n * group}; the phase of the base is kept.
   */
  public static Species addGroup(Species base, Species group, int n) {
    requirePositive(n);
    requireSamePhase(base, group);
    CompositionNode composition = new Group(List.of(
        new Group.Member(base.getComposition(), 1),
        new Group.Member(group.getComposition(), n)));
    return base.toBuilder()
        .composition(composition)
        .charge(Math.addExact(base.getCharge(), Math.multiplyExact(group.getCharge(), n)))
        .build();
  }

  /**
   * Copy of a species with the given phase.
   *
   * @param species source species
   * @param phase   phase to set
   * @return a new species with the same composition and charge
   */
  public static Species withPhase(Species species, PhaseTag phase) {
    return species.toBuilder().phase(Objects.requireNonNull(phase, "phase")).build();
  }

  /**
   * Sets the absolute net charge of a species.
   */
  public static Species withCharge(Species species, int charge) {
    return species.toBuilder().charge(charge).build();
  }

  /**
   * Removes one electron: Fe -> Fe+ -> Fe2+.
   */
  public static Species incrementCharge(Species species) {
    return withCharge(species, Math.addExact(species.getCharge(), 1));
  }

  /**
   * Adds one electron: Cl -> Cl-.
   */
  public static Species decrementCharge(Species species) {
    return withCharge(species, Math.subtractExact(species.getCharge(), 1));
  }

  /**
   * Reaction term with coefficient one.
   *
   * @param species the species
   * @return a non-catalyst term
   */
  public static ReactionTerm term(Species species) {
    return new ReactionTerm(species, 1, false);
  }

  /**
   * Reaction term with an explicit coefficient.
   *
   * @param coefficient stoichiometric coefficient
   * @param species     the species
   * @return a non-catalyst term
   * @throws CompositionException with {@link ErrorType#INVALID_MULTIPLIER} if {@code coefficient < 1}
   */
  public static ReactionTerm term(long coefficient, Species species) {
    return new ReactionTerm(species, coefficient, false);
  }

  /**
   * Catalyst term. Catalysts are shown in equations but take no part in balancing.
   *
   * @param species the catalyst
   * @return a catalyst term with coefficient one
   */
  public static ReactionTerm catalyst(Species species) {
    return new ReactionTerm(species, 1, true);
  }

  /**
   * Collects terms into one side of an equation.
   *
   * @param terms terms in order
   * @return unmodifiable list of the terms
   */
  public static List<ReactionTerm> join(ReactionTerm... terms) {
    return List.of(terms);
  }

  /**
   * Collects species into one side of an equation, each with coefficient one.
   *
   * @param species species in order
   * @return unmodifiable list of terms
   */
  public static List<ReactionTerm> join(Species... species) {
    return Arrays.stream(species).map(Expressions::term).collect(Collectors.toUnmodifiableList());
  }

  /**
   * New reaction from two sides. Terms are copied, so reactions built from the same lists do not
   * share coefficients.
   *
   * @param reactants reactant terms, catalysts included
   * @param products  product terms
   * @return a new reaction without a type
   */
  public static Reaction react(List<ReactionTerm> reactants, List<ReactionTerm> products) {
    return new Reaction(reactants, products);
  }

  private static void requirePositive(int n) {
    if (n < 1) {
      throw new CompositionException(ErrorType.INVALID_MULTIPLIER, "Multiplier must be positive, got " + n);
    }
  }

  private static void requireSamePhase(Species... parts) {
    PhaseTag seen = null;
    for (Species part : parts) {
      PhaseTag phase = part.getPhase().orElse(null);
      if (phase == null) {
        continue;
      }
      if (seen != null && seen != phase) {
        throw new CompositionException(ErrorType.PHASE_CONFLICT,
            String.format("Cannot combine species in phases %s and %s", seen, phase));
      }
      seen = phase;
    }
  }
}
