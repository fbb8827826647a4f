package com.quantori.csp.core.service;

import com.quantori.csp.api.model.Reaction;
import com.quantori.csp.api.model.ReactionType;
import com.quantori.csp.core.balance.BalanceResult;
import com.quantori.csp.core.balance.ReactionBalancer;
import com.quantori.csp.core.classify.ReactionClassifier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Balances a reaction and labels it. The type is stored only after a successful balance.
 */
@Slf4j
@RequiredArgsConstructor
public class ReactionService {
  private final ReactionBalancer balancer;
  private final ReactionClassifier classifier;

  public ReactionService() {
    this(new ReactionBalancer(), new ReactionClassifier());
  }

  public BalanceResult process(Reaction reaction) {
    BalanceResult result = balancer.balance(reaction);
    ReactionType type = classifier.classify(reaction);
    reaction.setReactionType(type);
    log.debug("Processed {} as {}", reaction, type);
    return result;
  }
}
