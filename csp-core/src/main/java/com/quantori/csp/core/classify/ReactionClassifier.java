package com.quantori.csp.core.classify;

import com.quantori.csp.api.model.Reaction;
import com.quantori.csp.api.model.ReactionTerm;
import com.quantori.csp.api.model.ReactionType;
import com.quantori.csp.api.model.Species;
import java.util.List;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;

/**
 * Assigns a {@link ReactionType} from the structure of a reaction. Catalysts are ignored and the
 * reaction is never modified; storing the result is left to the caller.
 */
@Slf4j
public class ReactionClassifier {

  public ReactionType classify(Reaction reaction) {
    List<Species> reactants = species(reaction.getReactants(false));
    List<Species> products = species(reaction.getProducts());
    for (ClassificationRule rule : ClassificationRule.values()) {
      if (rule.matches(reactants, products)) {
        log.debug("{} classified as {}", reaction, rule.type());
        return rule.type();
      }
    }
    return ReactionType.UNCLASSIFIED;
  }

  private static List<Species> species(List<ReactionTerm> terms) {
    return terms.stream()
        .filter(term -> !term.isCatalyst())
        .map(ReactionTerm::getSpecies)
        .collect(Collectors.toList());
  }
}
