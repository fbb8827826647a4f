package com.quantori.csp.api.util;

import static com.quantori.csp.api.Expressions.addGroup;
import static com.quantori.csp.api.Expressions.catalyst;
import static com.quantori.csp.api.Expressions.combine;
import static com.quantori.csp.api.Expressions.element;
import static com.quantori.csp.api.Expressions.join;
import static com.quantori.csp.api.Expressions.react;
import static com.quantori.csp.api.Expressions.scale;
import static com.quantori.csp.api.Expressions.term;
import static com.quantori.csp.api.Expressions.withCharge;
import static com.quantori.csp.api.Expressions.withPhase;
import static org.junit.jupiter.api.Assertions.assertEquals;

import com.quantori.csp.api.model.ElementSymbol;
import com.quantori.csp.api.model.PhaseTag;
import com.quantori.csp.api.model.Species;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class FormulaUtilitiesTest {

  private static final Species WATER = combine(element(ElementSymbol.H, 2), element(ElementSymbol.O));

  @Test
  void structuredFormulas() {
    Species hydroxide = combine(element(ElementSymbol.O), element(ElementSymbol.H));
    assertEquals("Ba(OH)2", addGroup(element(ElementSymbol.Ba), hydroxide, 2).formula());
    assertEquals("(H2O)2", scale(WATER, 2).formula());
    assertEquals("O2", scale(element(ElementSymbol.O), 2).formula());
  }

  @Test
  void hillFormula() {
    assertEquals("C2H6O", FormulaUtilities.hillFormula(
        Map.of(ElementSymbol.O, 1L, ElementSymbol.H, 6L, ElementSymbol.C, 2L)));
    assertEquals("ClNa", FormulaUtilities.hillFormula(Map.of(ElementSymbol.Na, 1L, ElementSymbol.Cl, 1L)));
    assertEquals("H2O4S", FormulaUtilities.hillFormula(
        Map.of(ElementSymbol.S, 1L, ElementSymbol.O, 4L, ElementSymbol.H, 2L)));
  }

  @ParameterizedTest
  @CsvSource(value = {"0,''", "1,+", "2,2+", "-1,-", "-3,3-"})
  void chargeLabels(int charge, String label) {
    assertEquals(label, FormulaUtilities.chargeLabel(charge));
  }

  @Test
  void speciesLabel() {
    assertEquals("Fe^2+(aq)", FormulaUtilities.label(
        withPhase(withCharge(element(ElementSymbol.Fe), 2), PhaseTag.AQUEOUS)));
    assertEquals("H2O(l)", FormulaUtilities.label(withPhase(WATER, PhaseTag.LIQUID)));
  }

  @Test
  void equationText() {
    var reaction = react(
        join(term(2, element(ElementSymbol.H, 2)), term(element(ElementSymbol.O, 2)),
            catalyst(element(ElementSymbol.Pt))),
        join(term(2, WATER)));

    assertEquals("2 H2 + O2 -> 2 H2O [catalyst: Pt]", FormulaUtilities.equation(reaction));
    assertEquals("0 -> H2O", FormulaUtilities.equation(react(List.of(), join(term(WATER)))));
  }

  @Test
  void empiricalFormula() {
    assertEquals("CH2O", FormulaUtilities.empiricalFormula(
        Map.of(ElementSymbol.C, 6L, ElementSymbol.H, 12L, ElementSymbol.O, 6L)));
    assertEquals("HO", FormulaUtilities.empiricalFormula(Map.of(ElementSymbol.H, 2L, ElementSymbol.O, 2L)));
    assertEquals("H2O", FormulaUtilities.empiricalFormula(WATER.flatten()));
    assertEquals("O", FormulaUtilities.empiricalFormula(Map.of(ElementSymbol.O, 2L)));
    assertEquals("", FormulaUtilities.empiricalFormula(Map.of()));
  }
}
