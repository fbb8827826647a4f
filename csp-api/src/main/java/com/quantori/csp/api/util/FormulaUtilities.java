package com.quantori.csp.api.util;

import com.quantori.csp.api.model.CompositionNode;
import com.quantori.csp.api.model.ElementSymbol;
import com.quantori.csp.api.model.Group;
import com.quantori.csp.api.model.Leaf;
import com.quantori.csp.api.model.Reaction;
import com.quantori.csp.api.model.ReactionTerm;
import com.quantori.csp.api.model.Species;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import lombok.experimental.UtilityClass;

/**
 * Set of utilities to render compositions, species and reactions as plain ASCII text.
 */
@UtilityClass
public final class FormulaUtilities {

  public static final String ARROW = " -> ";

  /**
   * Formula preserving the structure of a composition tree, e.g. {@code Fe(NO3)3} or
   * {@code Ba(OH)2}. Groups repeated more than once are parenthesised.
   *
   * @param node composition tree
   * @return formula text
   */
  public static String formula(CompositionNode node) {
    if (node instanceof Leaf leaf) {
      return leaf.element().getSymbol() + subscript(leaf.count());
    }
    Group group = (Group) node;
    StringBuilder formula = new StringBuilder();
    for (Group.Member member : group.members()) {
      formula.append(memberFormula(member));
    }
    return formula.toString();
  }

  /**
   * Hill system formula of flattened atom counts: carbon first, hydrogen second when carbon is
   * present, all other elements alphabetically. Without carbon every element is alphabetical.
   *
   * @param counts flattened composition
   * @return formula text, e.g. {@code C2H6O}
   */
  public static String hillFormula(Map<ElementSymbol, Long> counts) {
    boolean hasCarbon = counts.containsKey(ElementSymbol.C);
    Comparator<ElementSymbol> hillOrder = Comparator
        .comparing((ElementSymbol element) -> !(hasCarbon && element == ElementSymbol.C))
        .thenComparing(element -> !(hasCarbon && element == ElementSymbol.H))
        .thenComparing(ElementSymbol::getSymbol);
    return counts.entrySet().stream()
        .sorted(Map.Entry.comparingByKey(hillOrder))
        .map(entry -> entry.getKey().getSymbol() + subscript(entry.getValue()))
        .collect(Collectors.joining());
  }

  /**
   * Empirical formula: the atom counts divided by their greatest common divisor, written in Hill
   * order. C6H12O6 gives {@code CH2O}.
   *
   * @param counts flattened composition
   * @return formula text, empty for an empty composition
   */
  public static String empiricalFormula(Map<ElementSymbol, Long> counts) {
    long divisor = counts.values().stream().reduce(0L, FormulaUtilities::gcd);
    if (divisor <= 1) {
      return hillFormula(counts);
    }
    Map<ElementSymbol, Long> reduced = new EnumMap<>(ElementSymbol.class);
    counts.forEach((element, count) -> reduced.put(element, count / divisor));
    return hillFormula(reduced);
  }

  /**
   * Charge written the way chemists read it: {@code 2+}, {@code -}, {@code 3-}; empty for neutral.
   */
  public static String chargeLabel(int charge) {
    if (charge == 0) {
      return "";
    }
    String sign = charge > 0 ? "+" : "-";
    int magnitude = Math.abs(charge);
    return magnitude == 1 ? sign : magnitude + sign;
  }

  /**
   * Species as {@code formula^charge(phase)}, e.g. {@code Fe^2+(aq)} or {@code H2O(l)}.
   */
  public static String label(Species species) {
    StringBuilder label = new StringBuilder(species.formula());
    if (species.isCharged()) {
      label.append('^').append(chargeLabel(species.getCharge()));
    }
    species.getPhase().ifPresent(phase -> label.append('(').append(phase.getCode()).append(')'));
    return label.toString();
  }

  /**
   * Equation text with coefficients, e.g. {@code 2 H2 + O2 -> 2 H2O}. Coefficients equal to one
   * are omitted and catalysts are listed after the equation.
   */
  public static String equation(Reaction reaction) {
    String equation = side(reaction.getReactants(false)) + ARROW + side(productsWithoutCatalysts(reaction));
    List<ReactionTerm> catalysts = reaction.getCatalysts();
    if (!catalysts.isEmpty()) {
      equation += catalysts.stream()
          .map(term -> label(term.getSpecies()))
          .collect(Collectors.joining(", ", " [catalyst: ", "]"));
    }
    return equation;
  }

  /**
   * Single term with its coefficient, e.g. {@code 2 H2O(l)}.
   */
  public static String term(ReactionTerm term) {
    String label = label(term.getSpecies());
    return term.getCoefficient() == 1 ? label : term.getCoefficient() + " " + label;
  }

  private static List<ReactionTerm> productsWithoutCatalysts(Reaction reaction) {
    return reaction.getProducts().stream().filter(term -> !term.isCatalyst()).collect(Collectors.toList());
  }

  private static String side(List<ReactionTerm> terms) {
    if (terms.isEmpty()) {
      return "0";
    }
    return terms.stream().map(FormulaUtilities::term).collect(Collectors.joining(" + "));
  }

  private static String memberFormula(Group.Member member) {
    CompositionNode node = member.node();
    int multiplier = member.multiplier();
    if (node instanceof Leaf leaf) {
      return leaf.element().getSymbol() + subscript((long) leaf.count() * multiplier);
    }
    Group group = (Group) node;
    if (multiplier == 1) {
      return formula(group);
    }
    if (group.members().size() == 1 && group.members().get(0).node() instanceof Leaf leaf) {
      long count = (long) leaf.count() * group.members().get(0).multiplier() * multiplier;
      return leaf.element().getSymbol() + subscript(count);
    }
    return "(" + formula(group) + ")" + multiplier;
  }

  private static String subscript(long count) {
    return count == 1 ? "" : Long.toString(count);
  }

  private static long gcd(long a, long b) {
    return b == 0 ? a : gcd(b, a % b);
  }
}
