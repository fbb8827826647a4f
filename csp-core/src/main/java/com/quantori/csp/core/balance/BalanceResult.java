package com.quantori.csp.core.balance;

import java.util.List;

/**
 * Outcome of a successful balance.
 *
 * @param coefficients    coefficients of the participants, in
 *                        {@link com.quantori.csp.api.model.Reaction#getParticipants()} order
 * @param nullity         dimension of the null space of the conservation matrix; zero when the
 *                        reaction was already balanced and no elimination was run
 * @param ambiguous       the null space had more than one dimension and a deterministic pick was
 *                        made among several independent solutions
 * @param alreadyBalanced the reaction's coefficients conserved atoms and charge before the call
 *                        and were left untouched
 */
public record BalanceResult(List<Long> coefficients, int nullity, boolean ambiguous, boolean alreadyBalanced) {

  public BalanceResult {
    coefficients = List.copyOf(coefficients);
  }

  static BalanceResult unchanged(List<Long> coefficients) {
    return new BalanceResult(coefficients, 0, false, true);
  }
}
