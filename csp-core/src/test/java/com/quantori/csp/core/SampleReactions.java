package com.quantori.csp.core;

import static com.quantori.csp.api.Expressions.addGroup;
import static com.quantori.csp.api.Expressions.combine;
import static com.quantori.csp.api.Expressions.compound;
import static com.quantori.csp.api.Expressions.element;
import static com.quantori.csp.api.Expressions.join;
import static com.quantori.csp.api.Expressions.react;
import static com.quantori.csp.api.Expressions.withCharge;

import com.quantori.csp.api.model.ElementSymbol;
import com.quantori.csp.api.model.Reaction;
import com.quantori.csp.api.model.Species;
import lombok.experimental.UtilityClass;

/** Reactions shared by the core tests, all with unit coefficients. */
@UtilityClass
public class SampleReactions {
  public static final Species HYDROGEN = element(ElementSymbol.H, 2);
  public static final Species OXYGEN = element(ElementSymbol.O, 2);
  public static final Species WATER = combine(element(ElementSymbol.H, 2), element(ElementSymbol.O));
  public static final Species CARBON_DIOXIDE = combine(element(ElementSymbol.C), element(ElementSymbol.O, 2));
  public static final Species HYDROXIDE = combine(element(ElementSymbol.O), element(ElementSymbol.H));
  public static final Species NITRATE = compound(element(ElementSymbol.N), element(ElementSymbol.O, 3));

  public static Reaction waterSynthesis() {
    return react(join(HYDROGEN, OXYGEN), join(WATER));
  }

  public static Reaction ironOxidation() {
    Species ironOxide = combine(element(ElementSymbol.Fe, 2), element(ElementSymbol.O, 3));
    return react(join(element(ElementSymbol.Fe), OXYGEN), join(ironOxide));
  }

  public static Reaction ethaneCombustion() {
    Species ethane = combine(element(ElementSymbol.C, 2), element(ElementSymbol.H, 6));
    return react(join(ethane, OXYGEN), join(CARBON_DIOXIDE, WATER));
  }

  public static Reaction ironCeriumRedox() {
    return react(
        join(withCharge(element(ElementSymbol.Fe), 2), withCharge(element(ElementSymbol.Ce), 4)),
        join(withCharge(element(ElementSymbol.Fe), 3), withCharge(element(ElementSymbol.Ce), 3)));
  }

  public static Reaction chlorateDecomposition() {
    Species chlorate = compound(element(ElementSymbol.K), element(ElementSymbol.Cl), element(ElementSymbol.O, 3));
    Species chloride = combine(element(ElementSymbol.K), element(ElementSymbol.Cl));
    return react(join(chlorate), join(chloride, OXYGEN));
  }

  public static Reaction ironNitrateHydrolysis() {
    Species ironNitrate = addGroup(element(ElementSymbol.Fe), NITRATE, 3);
    Species sodiumHydroxide = combine(element(ElementSymbol.Na), HYDROXIDE);
    Species ironHydroxide = addGroup(element(ElementSymbol.Fe), HYDROXIDE, 3);
    Species sodiumNitrate = combine(element(ElementSymbol.Na), NITRATE);
    return react(join(ironNitrate, sodiumHydroxide), join(ironHydroxide, sodiumNitrate));
  }

  public static Reaction bariumHydroxideNeutralization() {
    Species bariumHydroxide = addGroup(element(ElementSymbol.Ba), HYDROXIDE, 2);
    Species hydrochloricAcid = combine(element(ElementSymbol.H), element(ElementSymbol.Cl));
    Species bariumChloride = combine(element(ElementSymbol.Ba), element(ElementSymbol.Cl, 2));
    return react(join(bariumHydroxide, hydrochloricAcid), join(bariumChloride, WATER));
  }

  public static Reaction permanganateIron() {
    Species permanganate = withCharge(compound(element(ElementSymbol.Mn), element(ElementSymbol.O, 4)), -1);
    return react(
        join(permanganate, withCharge(element(ElementSymbol.Fe), 2), withCharge(element(ElementSymbol.H), 1)),
        join(withCharge(element(ElementSymbol.Mn), 2), withCharge(element(ElementSymbol.Fe), 3), WATER));
  }
}
