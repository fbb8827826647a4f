package com.quantori.csp.core.balance;

import com.quantori.csp.api.BalanceVerificationException;
import com.quantori.csp.api.BalancingException;
import com.quantori.csp.api.model.ErrorType;
import com.quantori.csp.api.model.Reaction;
import com.quantori.csp.core.configuration.BalancingProperties;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;

/**
 * Finds the minimal positive integer coefficients conserving every element and the net charge of
 * a reaction, using exact rational elimination on its conservation matrix.
 *
 * <p>A successful call writes the coefficients back to the reaction. Catalyst terms are never
 * part of the system and keep their coefficients. Failures leave the reaction unchanged.
 */
@Slf4j
public class ReactionBalancer {
  private static final Comparator<List<Long>> LEXICOGRAPHIC = (left, right) -> {
    for (int i = 0; i < Math.min(left.size(), right.size()); i++) {
      int compared = Long.compare(left.get(i), right.get(i));
      if (compared != 0) {
        return compared;
      }
    }
    return Integer.compare(left.size(), right.size());
  };

  private final BalancingProperties properties;
  private final BalanceVerifier verifier;

  public ReactionBalancer() {
    this(BalancingProperties.defaults());
  }

  public ReactionBalancer(BalancingProperties properties) {
    this(properties, new BalanceVerifier());
  }

  ReactionBalancer(BalancingProperties properties, BalanceVerifier verifier) {
    this.properties = properties;
    this.verifier = verifier;
  }

  /**
   * Balances the reaction in place.
   *
   * @param reaction reaction to balance
   * @return coefficients and null space information
   * @throws BalancingException            if the reaction has no positive integer solution or the
   *                                       system exceeds the configured size
   * @throws BalanceVerificationException  if computed coefficients fail the conservation check
   */
  public BalanceResult balance(Reaction reaction) {
    if (verifier.isConserved(reaction)) {
      log.debug("Reaction is already balanced: {}", reaction);
      return BalanceResult.unchanged(reaction.coefficients());
    }

    ConservationMatrix matrix = ConservationMatrix.of(reaction);
    if (matrix.columnCount() > properties.getMaxParticipants()
        || matrix.getElements().size() > properties.getMaxElements()) {
      throw new BalancingException(ErrorType.SYSTEM_TOO_LARGE, String.format(
          "%d participants and %d elements exceed the limits of %d and %d", matrix.columnCount(),
          matrix.getElements().size(), properties.getMaxParticipants(), properties.getMaxElements()));
    }

    List<Fraction[]> basis = matrix.toRational().nullSpace();
    log.debug("Conservation matrix {} of {} has nullity {}", matrix.rowLabels(), reaction, basis.size());
    if (basis.isEmpty()) {
      throw new BalancingException(ErrorType.UNBALANCEABLE,
          "Only the trivial solution conserves atoms and charge: " + reaction);
    }

    boolean ambiguous = basis.size() > 1;
    List<Long> coefficients = ambiguous ? pick(basis, reaction) : positive(normalize(basis.get(0)))
        .orElseThrow(() -> new BalancingException(ErrorType.NO_POSITIVE_SOLUTION,
            "The only solution mixes signs or leaves a participant out: " + reaction));
    if (ambiguous) {
      log.debug("{} independent solutions for {}, picked {}", basis.size(), reaction, coefficients);
    }

    if (!verifier.isConserved(reaction, coefficients)) {
      throw new BalanceVerificationException(String.format(
          "Coefficients %s do not conserve %s: %s", coefficients, reaction,
          verifier.imbalance(reaction, coefficients)));
    }
    reaction.updateCoefficients(coefficients);
    return new BalanceResult(coefficients, basis.size(), ambiguous, false);
  }

  /**
   * Picks among several independent solutions: the lexicographically smallest normalized basis
   * vector that is strictly positive, otherwise the normalized sum of all basis vectors.
   */
  private List<Long> pick(List<Fraction[]> basis, Reaction reaction) {
    List<BigInteger[]> normalized = new ArrayList<>();
    basis.forEach(vector -> normalized.add(normalize(vector)));

    Optional<List<Long>> candidate = normalized.stream()
        .map(this::positive)
        .flatMap(Optional::stream)
        .min(LEXICOGRAPHIC);
    if (candidate.isPresent()) {
      return candidate.get();
    }

    Fraction[] sum = new Fraction[basis.get(0).length];
    Arrays.fill(sum, Fraction.ZERO);
    for (BigInteger[] vector : normalized) {
      BigInteger[] oriented = orient(vector);
      for (int i = 0; i < sum.length; i++) {
        sum[i] = sum[i].add(Fraction.of(oriented[i], BigInteger.ONE));
      }
    }
    return positive(normalize(sum)).orElseThrow(() -> new BalancingException(
        ErrorType.NO_POSITIVE_SOLUTION, "No strictly positive combination was found among "
        + basis.size() + " independent solutions: " + reaction));
  }

  /**
   * Scales a rational vector to coprime integers: multiply by the LCM of the denominators, then
   * divide by the GCD of the numerators.
   */
  static BigInteger[] normalize(Fraction[] vector) {
    BigInteger lcm = BigInteger.ONE;
    for (Fraction value : vector) {
      BigInteger denominator = value.getDenominator();
      lcm = lcm.divide(lcm.gcd(denominator)).multiply(denominator);
    }
    BigInteger[] integers = new BigInteger[vector.length];
    BigInteger gcd = BigInteger.ZERO;
    for (int i = 0; i < vector.length; i++) {
      integers[i] = vector[i].getNumerator().multiply(lcm.divide(vector[i].getDenominator()));
      gcd = gcd.gcd(integers[i]);
    }
    if (gcd.signum() != 0 && !BigInteger.ONE.equals(gcd)) {
      for (int i = 0; i < integers.length; i++) {
        integers[i] = integers[i].divide(gcd);
      }
    }
    return integers;
  }

  // all-negative vectors are flipped, anything else is returned as is
  private static BigInteger[] orient(BigInteger[] vector) {
    boolean allNegative = Arrays.stream(vector).allMatch(value -> value.signum() < 0);
    return allNegative ? Arrays.stream(vector).map(BigInteger::negate).toArray(BigInteger[]::new) : vector;
  }

  private Optional<List<Long>> positive(BigInteger[] vector) {
    BigInteger[] oriented = orient(vector);
    if (Arrays.stream(oriented).anyMatch(value -> value.signum() <= 0)) {
      return Optional.empty();
    }
    List<Long> coefficients = new ArrayList<>(oriented.length);
    for (BigInteger value : oriented) {
      try {
        coefficients.add(value.longValueExact());
      } catch (ArithmeticException e) {
        throw new BalancingException(ErrorType.SYSTEM_TOO_LARGE,
            "Coefficient " + value + " does not fit a long", e);
      }
    }
    return Optional.of(List.copyOf(coefficients));
  }
}
