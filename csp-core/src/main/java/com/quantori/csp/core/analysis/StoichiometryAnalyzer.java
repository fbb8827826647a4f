package com.quantori.csp.core.analysis;

import com.quantori.csp.api.BalancingException;
import com.quantori.csp.api.model.ErrorType;
import com.quantori.csp.api.model.Reaction;
import com.quantori.csp.api.model.ReactionTerm;
import com.quantori.csp.api.model.Species;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Mass and mole bookkeeping over a reaction. Masses are in g/mol weighted by the coefficients,
 * amounts are in moles. Catalysts are ignored everywhere.
 */
public class StoichiometryAnalyzer {

  /**
   * Product mass minus reactant mass. Zero for a balanced reaction up to rounding.
   */
  public double massBalance(Reaction reaction) {
    return mass(reaction.getProducts()) - mass(reaction.getReactants(false));
  }

  /**
   * Absolute mass difference as a percentage of the reactant mass. Infinite when the reactants have
   * no mass but the products do.
   */
  public double massBalanceError(Reaction reaction) {
    double reactantMass = mass(reaction.getReactants(false));
    double productMass = mass(reaction.getProducts());
    if (reactantMass == 0) {
      return productMass > 0 ? Double.POSITIVE_INFINITY : 0.0;
    }
    return Math.abs(productMass - reactantMass) / reactantMass * 100.0;
  }

  /**
   * Share of the total product mass that ends up in the desired product, in percent.
   *
   * @param productIndex index of the desired product in {@link Reaction#getProducts()}
   * @throws IndexOutOfBoundsException if there is no such product
   */
  public double atomEconomy(Reaction reaction, int productIndex) {
    List<ReactionTerm> products = reaction.getProducts();
    ReactionTerm desired = products.get(productIndex);
    double total = mass(products);
    if (total == 0) {
      return 0.0;
    }
    return desired.getCoefficient() * desired.getSpecies().molecularWeight() / total * 100.0;
  }

  /**
   * Reactant that runs out first, the one with the smallest amount per unit of coefficient.
   * Reactants missing from {@code moles} count as zero.
   *
   * @param moles available amount of each reactant species
   */
  public Species limitingReactant(Reaction reaction, Map<Species, Double> moles) {
    requireBalanced(reaction);
    return reaction.getReactants(false).stream()
        .min(Comparator.comparingDouble(term -> available(term, moles)))
        .map(ReactionTerm::getSpecies)
        .orElseThrow();
  }

  /**
   * Moles of every product formed when the limiting reactant is consumed completely.
   *
   * @return yield per product species, in product order
   */
  public Map<Species, Double> theoreticalYield(Reaction reaction, Map<Species, Double> moles) {
    Species limiting = limitingReactant(reaction, moles);
    ReactionTerm limitingTerm = reaction.getReactants(false).stream()
        .filter(term -> term.getSpecies().equals(limiting))
        .findFirst()
        .orElseThrow();
    double extent = available(limitingTerm, moles);

    Map<Species, Double> yields = new LinkedHashMap<>();
    for (ReactionTerm product : reaction.getProducts()) {
      if (product.isCatalyst()) {
        continue;
      }
      yields.merge(product.getSpecies(), extent * product.getCoefficient(), Double::sum);
    }
    return Collections.unmodifiableMap(yields);
  }

  private static double available(ReactionTerm term, Map<Species, Double> moles) {
    return moles.getOrDefault(term.getSpecies(), 0.0) / term.getCoefficient();
  }

  private static double mass(List<ReactionTerm> terms) {
    return terms.stream()
        .filter(term -> !term.isCatalyst())
        .mapToDouble(term -> term.getCoefficient() * term.getSpecies().molecularWeight())
        .sum();
  }

  private static void requireBalanced(Reaction reaction) {
    if (!reaction.isBalanced()) {
      throw new BalancingException(ErrorType.UNBALANCEABLE,
          "Reaction must be balanced for yield calculations: " + reaction);
    }
  }
}
