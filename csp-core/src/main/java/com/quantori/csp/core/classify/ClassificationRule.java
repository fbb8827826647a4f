package com.quantori.csp.core.classify;

import com.quantori.csp.api.model.ElementSymbol;
import com.quantori.csp.api.model.ReactionType;
import com.quantori.csp.api.model.Species;
import com.quantori.csp.core.balance.Fraction;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Heuristic rules of the classifier. Declaration order is evaluation order; the first matching
 * rule determines the type.
 */
enum ClassificationRule {
  COMBUSTION(ReactionType.COMBUSTION) {
    @Override
    boolean matches(List<Species> reactants, List<Species> products) {
      long oxidizers = reactants.stream().filter(ClassificationRule::isMolecularOxygen).count();
      boolean fuel = reactants.stream()
          .anyMatch(species -> !isMolecularOxygen(species) && species.contains(ElementSymbol.C));
      return oxidizers == 1 && fuel
          && products.stream().anyMatch(species -> hasComposition(species, CARBON_DIOXIDE))
          && products.stream().anyMatch(species -> hasComposition(species, WATER));
    }
  },
  DECOMPOSITION(ReactionType.DECOMPOSITION) {
    @Override
    boolean matches(List<Species> reactants, List<Species> products) {
      return reactants.size() == 1 && products.size() >= 2;
    }
  },
  SYNTHESIS(ReactionType.SYNTHESIS) {
    @Override
    boolean matches(List<Species> reactants, List<Species> products) {
      return reactants.size() >= 2 && products.size() == 1;
    }
  },
  REDOX(ReactionType.REDOX) {
    @Override
    boolean matches(List<Species> reactants, List<Species> products) {
      boolean charged = reactants.stream().anyMatch(Species::isCharged)
          || products.stream().anyMatch(Species::isCharged);
      if (!charged) {
        return false;
      }
      Map<ElementSymbol, Set<Fraction>> before = oxidationStates(reactants);
      Map<ElementSymbol, Set<Fraction>> after = oxidationStates(products);
      return before.entrySet().stream()
          .filter(entry -> after.containsKey(entry.getKey()))
          .anyMatch(entry -> !entry.getValue().equals(after.get(entry.getKey())));
    }
  },
  ACID_BASE(ReactionType.ACID_BASE) {
    @Override
    boolean matches(List<Species> reactants, List<Species> products) {
      return reactants.stream().anyMatch(ClassificationRule::isAcid)
          && reactants.stream().anyMatch(ClassificationRule::isBase)
          && products.stream().anyMatch(species -> hasComposition(species, WATER) && !species.isCharged());
    }
  },
  DOUBLE_DISPLACEMENT(ReactionType.DOUBLE_DISPLACEMENT) {
    @Override
    boolean matches(List<Species> reactants, List<Species> products) {
      if (reactants.size() != 2 || products.size() != 2) {
        return false;
      }
      Set<ElementSymbol> first = reactants.get(0).elements();
      Set<ElementSymbol> second = reactants.get(1).elements();
      return products.stream().map(Species::elements).allMatch(elements ->
          !Collections.disjoint(elements, first) && !Collections.disjoint(elements, second)
              && !first.containsAll(elements) && !second.containsAll(elements));
    }
  },
  SINGLE_DISPLACEMENT(ReactionType.SINGLE_DISPLACEMENT) {
    @Override
    boolean matches(List<Species> reactants, List<Species> products) {
      for (Species element : reactants) {
        if (!element.isElemental()) {
          continue;
        }
        ElementSymbol incoming = element.elements().iterator().next();
        boolean enters = products.stream()
            .anyMatch(product -> !product.isElemental() && product.contains(incoming));
        if (enters && releases(reactants, products, incoming)) {
          return true;
        }
      }
      return false;
    }
  };

  private static final Map<ElementSymbol, Long> CARBON_DIOXIDE = Map.of(ElementSymbol.C, 1L, ElementSymbol.O, 2L);
  private static final Map<ElementSymbol, Long> WATER = Map.of(ElementSymbol.H, 2L, ElementSymbol.O, 1L);
  private static final Map<ElementSymbol, Long> HYDROGEN = Map.of(ElementSymbol.H, 2L);
  private static final Map<ElementSymbol, Long> AMMONIA = Map.of(ElementSymbol.N, 1L, ElementSymbol.H, 3L);

  private final ReactionType type;

  ClassificationRule(ReactionType type) {
    this.type = type;
  }

  ReactionType type() {
    return type;
  }

  /**
   * @param reactants non-catalyst reactant species
   * @param products  non-catalyst product species
   */
  abstract boolean matches(List<Species> reactants, List<Species> products);

  private static boolean hasComposition(Species species, Map<ElementSymbol, Long> composition) {
    return species.flatten().equals(composition);
  }

  private static boolean isMolecularOxygen(Species species) {
    return species.elements().equals(EnumSet.of(ElementSymbol.O)) && species.atomCount() % 2 == 0;
  }

  private static boolean isAcid(Species species) {
    if (species.getCharge() == 1 && hasComposition(species, Map.of(ElementSymbol.H, 1L))) {
      return true;
    }
    return !species.isCharged()
        && species.contains(ElementSymbol.H)
        && !species.contains(ElementSymbol.C)
        && species.elements().stream().noneMatch(ElementSymbol::isMetal)
        && !hasComposition(species, HYDROGEN)
        && !hasComposition(species, WATER)
        && !hasComposition(species, AMMONIA);
  }

  private static boolean isBase(Species species) {
    if (species.getCharge() == -1 && hasComposition(species, Map.of(ElementSymbol.O, 1L, ElementSymbol.H, 1L))) {
      return true;
    }
    if (!species.isCharged() && hasComposition(species, AMMONIA)) {
      return true;
    }
    return species.contains(ElementSymbol.O) && species.contains(ElementSymbol.H)
        && species.elements().stream().anyMatch(ElementSymbol::isMetal);
  }

  // an elemental product whose element left a compound reactant
  private static boolean releases(List<Species> reactants, List<Species> products, ElementSymbol incoming) {
    Set<ElementSymbol> bound = new HashSet<>();
    reactants.stream().filter(species -> !species.isElemental()).forEach(species -> bound.addAll(species.elements()));
    return products.stream()
        .filter(Species::isElemental)
        .map(species -> species.elements().iterator().next())
        .anyMatch(released -> released != incoming && bound.contains(released));
  }

  // per-atom charge of every single-element species, neutral elementals included
  private static Map<ElementSymbol, Set<Fraction>> oxidationStates(List<Species> side) {
    Map<ElementSymbol, Set<Fraction>> states = new EnumMap<>(ElementSymbol.class);
    for (Species species : side) {
      if (species.isElemental()) {
        ElementSymbol element = species.elements().iterator().next();
        states.computeIfAbsent(element, key -> new HashSet<>())
            .add(Fraction.of(species.getCharge(), species.atomCount()));
      }
    }
    return states;
  }
}
