package com.quantori.csp.api.util;

import static com.quantori.csp.api.Expressions.addGroup;
import static com.quantori.csp.api.Expressions.catalyst;
import static com.quantori.csp.api.Expressions.combine;
import static com.quantori.csp.api.Expressions.element;
import static com.quantori.csp.api.Expressions.join;
import static com.quantori.csp.api.Expressions.react;
import static com.quantori.csp.api.Expressions.term;
import static com.quantori.csp.api.Expressions.withCharge;
import static com.quantori.csp.api.Expressions.withPhase;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.quantori.csp.api.CompositionException;
import com.quantori.csp.api.model.ElementSymbol;
import com.quantori.csp.api.model.ErrorType;
import com.quantori.csp.api.model.PhaseTag;
import com.quantori.csp.api.model.Reaction;
import com.quantori.csp.api.model.ReactionType;
import com.quantori.csp.api.model.Species;
import com.quantori.csp.api.model.document.SpeciesDocument;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ReactionDocumentsTest {

  @Test
  void speciesDocumentIsFlattened() {
    Species hydroxide = combine(element(ElementSymbol.O), element(ElementSymbol.H));
    Species bariumHydroxide = withPhase(addGroup(element(ElementSymbol.Ba), hydroxide, 2), PhaseTag.AQUEOUS);

    SpeciesDocument document = ReactionDocuments.toDocument(bariumHydroxide);

    assertThat(document.formula()).isEqualTo("Ba(OH)2");
    assertThat(document.elements()).containsExactly(
        Map.entry("H", 2L), Map.entry("O", 2L), Map.entry("Ba", 1L));
    assertThat(document.phase()).isEqualTo(PhaseTag.AQUEOUS);

    Species restored = ReactionDocuments.toSpecies(document);
    assertThat(restored.flatten()).isEqualTo(bariumHydroxide.flatten());
    assertThat(restored.getPhase()).contains(PhaseTag.AQUEOUS);
  }

  @Test
  void reactionDocumentJson() {
    Species water = combine(element(ElementSymbol.H, 2), element(ElementSymbol.O));
    var reaction = react(join(term(2, element(ElementSymbol.H, 2)), term(element(ElementSymbol.O, 2))),
        join(term(2, water)));
    reaction.setName("water");
    reaction.setReactionType(ReactionType.SYNTHESIS);

    String json = ReactionDocuments.toJson(ReactionDocuments.toDocument(reaction));

    assertThat(json).contains("\"type\":\"synthesis\"", "\"balanced\":true", "\"equation\":\"2 H2 + O2 -> 2 H2O\"")
        .doesNotContain("\"phase\"");
    var document = ReactionDocuments.fromJson(json);
    assertThat(document.type()).isEqualTo(ReactionType.SYNTHESIS);
    assertThat(document.products()).hasSize(1);
    assertThat(document.products().get(0).coefficient()).isEqualTo(2);
    assertThat(document.products().get(0).species().elements()).containsEntry("H", 2L);
  }

  @Test
  void chargedSpeciesRoundTripKeepsCharge() {
    var document = ReactionDocuments.toDocument(withCharge(element(ElementSymbol.Fe), 3));
    assertThat(ReactionDocuments.toSpecies(document).getCharge()).isEqualTo(3);
  }

  @Test
  void unknownElementInDocument() {
    var document = new SpeciesDocument("Xx", Map.of("Xx", 1L), 0, null);
    assertThatThrownBy(() -> ReactionDocuments.toSpecies(document)).isInstanceOf(CompositionException.class);
  }

  @Test
  void reactionIsRebuiltFromDocument() {
    Species water = combine(element(ElementSymbol.H, 2), element(ElementSymbol.O));
    var reaction = react(
        join(term(2, element(ElementSymbol.H, 2)), term(element(ElementSymbol.O, 2)), catalyst(element(ElementSymbol.Pt))),
        join(term(2, water)));
    reaction.setName("water");
    reaction.setReactionType(ReactionType.SYNTHESIS);

    Reaction restored = ReactionDocuments.toReaction(
        ReactionDocuments.fromJson(ReactionDocuments.toJson(ReactionDocuments.toDocument(reaction))));

    assertThat(restored.getName()).isEqualTo("water");
    assertThat(restored.getReactionType()).contains(ReactionType.SYNTHESIS);
    assertThat(restored.coefficients()).containsExactly(2L, 1L, 2L);
    assertThat(restored.getCatalysts()).hasSize(1);
    assertThat(restored.getCatalysts().get(0).getSpecies().formula()).isEqualTo("Pt");
    assertThat(restored.isBalanced()).isTrue();
    assertThat(restored).hasToString(reaction.toString());
  }

  @Test
  void invalidCountsAreCompositionErrors() {
    var negative = new SpeciesDocument("H", Map.of("H", -1L), 0, null);
    var huge = new SpeciesDocument("H", Map.of("H", Integer.MAX_VALUE + 1L), 0, null);
    var empty = new SpeciesDocument("?", null, 0, null);

    for (SpeciesDocument document : List.of(negative, huge, empty)) {
      assertThatThrownBy(() -> ReactionDocuments.toSpecies(document))
          .isInstanceOf(CompositionException.class)
          .extracting("errorType").isEqualTo(ErrorType.INVALID_COUNT);
    }
  }
}
