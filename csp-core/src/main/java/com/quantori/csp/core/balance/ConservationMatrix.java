package com.quantori.csp.core.balance;

import com.quantori.csp.api.BalancingException;
import com.quantori.csp.api.model.ElementSymbol;
import com.quantori.csp.api.model.ErrorType;
import com.quantori.csp.api.model.Reaction;
import com.quantori.csp.api.model.ReactionTerm;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.Getter;

/**
 * Conservation matrix of a reaction. Rows are the distinct elements ordered by atomic number,
 * followed by a net charge row when any participant is charged; columns are the participants
 * (non-catalyst reactants, then products). Reactant entries are negative, product entries positive.
 */
@Getter
public final class ConservationMatrix {
  private final List<ReactionTerm> participants;
  private final List<ElementSymbol> elements;
  private final boolean chargeRow;
  private final long[][] values;

  private ConservationMatrix(List<ReactionTerm> participants, List<ElementSymbol> elements,
                             boolean chargeRow, long[][] values) {
    this.participants = participants;
    this.elements = elements;
    this.chargeRow = chargeRow;
    this.values = values;
  }

  /**
   * Builds the matrix of a reaction.
   *
   * @throws BalancingException with {@link ErrorType#UNBALANCEABLE} if a side has no participant
   */
  public static ConservationMatrix of(Reaction reaction) {
    List<ReactionTerm> participants = reaction.getParticipants();
    if (!BalanceVerifier.hasBothSides(reaction)) {
      throw new BalancingException(ErrorType.UNBALANCEABLE,
          "Reaction must have both reactants and products to balance: " + reaction);
    }

    Set<ElementSymbol> distinct = EnumSet.noneOf(ElementSymbol.class);
    boolean charged = false;
    for (ReactionTerm term : participants) {
      distinct.addAll(term.getSpecies().elements());
      charged |= term.getSpecies().isCharged();
    }
    List<ElementSymbol> elements = List.copyOf(distinct);

    int rows = elements.size() + (charged ? 1 : 0);
    long[][] values = new long[rows][participants.size()];
    for (int column = 0; column < participants.size(); column++) {
      ReactionTerm term = participants.get(column);
      long sign = reaction.isReactant(term) ? -1 : 1;
      Map<ElementSymbol, Long> counts = term.getSpecies().flatten();
      for (int row = 0; row < elements.size(); row++) {
        values[row][column] = sign * counts.getOrDefault(elements.get(row), 0L);
      }
      if (charged) {
        values[rows - 1][column] = sign * term.getSpecies().getCharge();
      }
    }
    return new ConservationMatrix(participants, elements, charged, values);
  }

  public int rowCount() {
    return values.length;
  }

  public int columnCount() {
    return participants.size();
  }

  /**
   * Row labels in order: element symbols, then {@code "charge"} if present.
   */
  public List<String> rowLabels() {
    List<String> labels = new ArrayList<>();
    elements.forEach(element -> labels.add(element.getSymbol()));
    if (chargeRow) {
      labels.add("charge");
    }
    return Collections.unmodifiableList(labels);
  }

  public RationalMatrix toRational() {
    return RationalMatrix.of(values, participants.size());
  }
}
