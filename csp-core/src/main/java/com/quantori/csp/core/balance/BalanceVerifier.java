package com.quantori.csp.core.balance;

import com.quantori.csp.api.model.ElementSymbol;
import com.quantori.csp.api.model.Reaction;
import com.quantori.csp.api.model.ReactionTerm;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Conservation check of a coefficient vector against a reaction: for every element and for net
 * charge, the weighted reactant sum must equal the weighted product sum.
 */
public class BalanceVerifier {

  /**
   * Checks the coefficients currently stored on the reaction.
   */
  public boolean isConserved(Reaction reaction) {
    return isConserved(reaction, reaction.coefficients());
  }

  /**
   * Checks a candidate coefficient vector without writing it to the reaction.
   *
   * @param coefficients one value per participant, in participant order
   */
  public boolean isConserved(Reaction reaction, List<Long> coefficients) {
    if (!hasBothSides(reaction)) {
      return false;
    }
    long[][] values = ConservationMatrix.of(reaction).getValues();
    for (long[] row : values) {
      long sum = 0;
      for (int column = 0; column < row.length; column++) {
        sum = Math.addExact(sum, Math.multiplyExact(row[column], coefficients.get(column)));
      }
      if (sum != 0) {
        return false;
      }
    }
    return true;
  }

  /**
   * Imbalance of each element under the given coefficients, products minus reactants.
   */
  public Map<ElementSymbol, Long> imbalance(Reaction reaction, List<Long> coefficients) {
    List<ReactionTerm> participants = reaction.getParticipants();
    Map<ElementSymbol, Long> imbalance = new EnumMap<>(ElementSymbol.class);
    for (int i = 0; i < participants.size(); i++) {
      ReactionTerm term = participants.get(i);
      long sign = reaction.isReactant(term) ? -1 : 1;
      long coefficient = coefficients.get(i);
      term.getSpecies().flatten().forEach((element, count) ->
          imbalance.merge(element, Math.multiplyExact(sign * coefficient, count), Math::addExact));
    }
    imbalance.values().removeIf(value -> value == 0);
    return imbalance;
  }

  static boolean hasBothSides(Reaction reaction) {
    List<ReactionTerm> participants = reaction.getParticipants();
    int reactants = reaction.getReactants(false).size();
    return reactants > 0 && participants.size() > reactants;
  }
}
