package com.quantori.csp.api.model;

import com.quantori.csp.api.util.FormulaUtilities;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import lombok.Getter;
import lombok.Setter;

/**
 * A chemical equation: ordered reactant and product terms. The coefficients of the terms are the
 * only stoichiometric state that changes after construction, and only through
 * {@link #updateCoefficients(List)}.
 *
 * <p>Instances are not thread safe. Reactions may be read concurrently, but a single reaction must
 * not be balanced from two threads at once.
 */
public class Reaction {
  private final List<ReactionTerm> reactants;
  private final List<ReactionTerm> products;

  @Setter
  private ReactionType reactionType;

  @Getter
  @Setter
  private String name;

  /** Temperature in kelvin. */
  @Getter
  @Setter
  private Double temperature;

  /** Pressure in atmospheres. */
  @Getter
  @Setter
  private Double pressure;

  private final Map<String, String> conditions = new LinkedHashMap<>();

  public Reaction(List<ReactionTerm> reactants, List<ReactionTerm> products) {
    Objects.requireNonNull(reactants, "reactants");
    Objects.requireNonNull(products, "products");
    this.reactants = reactants.stream().map(ReactionTerm::copy).collect(Collectors.toUnmodifiableList());
    this.products = products.stream().map(ReactionTerm::copy).collect(Collectors.toUnmodifiableList());
  }

  public List<ReactionTerm> getReactants() {
    return reactants;
  }

  public List<ReactionTerm> getReactants(boolean includeCatalysts) {
    if (includeCatalysts) {
      return reactants;
    }
    return reactants.stream().filter(term -> !term.isCatalyst()).collect(Collectors.toUnmodifiableList());
  }

  public List<ReactionTerm> getProducts() {
    return products;
  }

  public List<ReactionTerm> getCatalysts() {
    return Stream.concat(reactants.stream(), products.stream())
        .filter(ReactionTerm::isCatalyst)
        .collect(Collectors.toUnmodifiableList());
  }

  /**
   * Terms taking part in balancing: non-catalyst reactants followed by non-catalyst products.
   * This order defines the columns of the conservation matrix and of {@link #coefficients()}.
   */
  public List<ReactionTerm> getParticipants() {
    return Stream.concat(reactants.stream(), products.stream())
        .filter(term -> !term.isCatalyst())
        .collect(Collectors.toUnmodifiableList());
  }

  /**
   * Whether the term is on the reactant side of this reaction.
   */
  public boolean isReactant(ReactionTerm term) {
    return reactants.stream().anyMatch(reactant -> reactant == term);
  }

  public Optional<ReactionType> getReactionType() {
    return Optional.ofNullable(reactionType);
  }

  public Map<String, String> getConditions() {
    return Collections.unmodifiableMap(conditions);
  }

  public void putCondition(String key, String value) {
    conditions.put(key, value);
  }

  public List<Long> coefficients() {
    return getParticipants().stream().map(ReactionTerm::getCoefficient).collect(Collectors.toUnmodifiableList());
  }

  /**
   * Replaces the coefficients of all participants at once, in {@link #getParticipants()} order.
   * Catalyst terms are left untouched.
   *
   * @param coefficients one strictly positive value per participant
   * @throws IllegalArgumentException if the size does not match or a value is not positive
   */
  public void updateCoefficients(List<Long> coefficients) {
    List<ReactionTerm> participants = getParticipants();
    if (coefficients.size() != participants.size()) {
      throw new IllegalArgumentException(String.format(
          "Expected %d coefficients, got %d", participants.size(), coefficients.size()));
    }
    if (coefficients.stream().anyMatch(value -> value == null || value < 1)) {
      throw new IllegalArgumentException("Coefficients must be positive: " + coefficients);
    }
    for (int i = 0; i < participants.size(); i++) {
      participants.get(i).setCoefficient(coefficients.get(i));
    }
  }

  /**
   * Multiplies every participant coefficient by the same factor. Catalysts keep their coefficient.
   *
   * @param factor strictly positive multiplier
   * @throws IllegalArgumentException if the factor is not positive
   * @throws ArithmeticException      if a coefficient overflows
   */
  public void scaleCoefficients(long factor) {
    if (factor < 1) {
      throw new IllegalArgumentException("Scaling factor must be positive, got " + factor);
    }
    updateCoefficients(coefficients().stream()
        .map(coefficient -> Math.multiplyExact(coefficient, factor))
        .collect(Collectors.toList()));
  }

  /**
   * Divides the participant coefficients by their greatest common divisor, so that 4 H2 + 2 O2 -> 4 H2O
   * becomes 2 H2 + O2 -> 2 H2O. Catalysts keep their coefficient.
   *
   * @return the divisor applied, 1 when the coefficients were already coprime or there are none
   */
  public long normalizeCoefficients() {
    List<Long> coefficients = coefficients();
    long divisor = 0;
    for (long coefficient : coefficients) {
      divisor = gcd(divisor, coefficient);
    }
    if (divisor <= 1) {
      return 1;
    }
    final long common = divisor;
    updateCoefficients(coefficients.stream().map(coefficient -> coefficient / common).collect(Collectors.toList()));
    return common;
  }

  /**
   * Net change of every element, products minus reactants, weighted by the coefficients.
   * Catalysts are excluded. A balanced reaction maps every element to zero.
   *
   * @return element balance ordered by atomic number
   */
  public Map<ElementSymbol, Long> elementBalance() {
    Map<ElementSymbol, Long> balance = new EnumMap<>(ElementSymbol.class);
    for (ReactionTerm term : getParticipants()) {
      long sign = isReactant(term) ? -1 : 1;
      term.getSpecies().flatten().forEach((element, count) -> balance.merge(
          element, Math.multiplyExact(sign * term.getCoefficient(), count), Math::addExact));
    }
    return Collections.unmodifiableMap(balance);
  }

  /**
   * Net charge of the products minus the net charge of the reactants.
   */
  public long chargeBalance() {
    long balance = 0;
    for (ReactionTerm term : getParticipants()) {
      long charge = Math.multiplyExact(term.getCoefficient(), (long) term.getSpecies().getCharge());
      balance = Math.addExact(balance, isReactant(term) ? -charge : charge);
    }
    return balance;
  }

  public Map<ElementSymbol, Long> unbalancedElements() {
    Map<ElementSymbol, Long> unbalanced = new EnumMap<>(ElementSymbol.class);
    elementBalance().forEach((element, delta) -> {
      if (delta != 0) {
        unbalanced.put(element, delta);
      }
    });
    return Collections.unmodifiableMap(unbalanced);
  }

  /**
   * A reaction is balanced when every element and the net charge are conserved. A reaction
   * without reactants or without products is never balanced.
   */
  public boolean isBalanced() {
    List<ReactionTerm> participants = getParticipants();
    boolean hasBothSides = participants.stream().anyMatch(this::isReactant)
        && participants.stream().anyMatch(term -> !isReactant(term));
    return hasBothSides && unbalancedElements().isEmpty() && chargeBalance() == 0;
  }

  /**
   * Creates the reverse reaction. Products become reactants and vice versa, catalysts stay on the
   * reactant side, coefficients and conditions are copied and the type is cleared.
   */
  public Reaction reverse() {
    List<ReactionTerm> newReactants = new ArrayList<>();
    products.stream().filter(term -> !term.isCatalyst()).forEach(newReactants::add);
    getCatalysts().forEach(newReactants::add);
    List<ReactionTerm> newProducts = getReactants(false);

    Reaction reversed = new Reaction(newReactants, newProducts);
    reversed.setName(name == null ? null : "Reverse of " + name);
    reversed.setTemperature(temperature);
    reversed.setPressure(pressure);
    conditions.forEach(reversed::putCondition);
    return reversed;
  }

  @Override
  public String toString() {
    return FormulaUtilities.equation(this);
  }

  private static long gcd(long a, long b) {
    while (b != 0) {
      long remainder = a % b;
      a = b;
      b = remainder;
    }
    return a;
  }
}
