package com.quantori.csp.api.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.quantori.csp.api.CompositionException;
import com.quantori.csp.api.model.ElementSymbol;
import com.quantori.csp.api.model.ErrorType;
import com.quantori.csp.api.model.Group;
import com.quantori.csp.api.model.Leaf;
import com.quantori.csp.api.model.Reaction;
import com.quantori.csp.api.model.ReactionTerm;
import com.quantori.csp.api.model.Species;
import com.quantori.csp.api.model.document.ReactionDocument;
import com.quantori.csp.api.model.document.SpeciesDocument;
import com.quantori.csp.api.model.document.TermDocument;
import java.io.UncheckedIOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import lombok.experimental.UtilityClass;

/**
 * Conversion between the in-memory model and its storage documents.
 */
@UtilityClass
public final class ReactionDocuments {

  private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

  public static SpeciesDocument toDocument(Species species) {
    Map<String, Long> elements = new LinkedHashMap<>();
    species.flatten().forEach((element, count) -> elements.put(element.getSymbol(), count));
    return new SpeciesDocument(
        species.formula(), elements, species.getCharge(), species.getPhase().orElse(null));
  }

  public static ReactionDocument toDocument(Reaction reaction) {
    return new ReactionDocument(
        reaction.getName(),
        FormulaUtilities.equation(reaction),
        toTermDocuments(reaction.getReactants()),
        toTermDocuments(reaction.getProducts()),
        reaction.getReactionType().orElse(null),
        reaction.isBalanced());
  }

  /**
   * Rebuilds a species from its document. The nested structure of the original composition is not
   * stored, so the result is one flat group of leaves in document order.
   *
   * @throws com.quantori.csp.api.CompositionException if the document names an unknown element or
   *                                                   a non-positive count
   */
  public static Species toSpecies(SpeciesDocument document) {
    if (document.elements() == null || document.elements().isEmpty()) {
      throw new CompositionException(ErrorType.INVALID_COUNT,
          "Species document '" + document.formula() + "' lists no elements");
    }
    List<Group.Member> members = document.elements().entrySet().stream()
        .map(entry -> new Group.Member(new Leaf(ElementSymbol.of(entry.getKey()), toCount(entry)), 1))
        .collect(Collectors.toList());
    return Species.builder()
        .composition(new Group(members))
        .charge(document.charge())
        .phase(document.phase())
        .build();
  }

  /**
   * Rebuilds a reaction from its document. Species come back as flat groups, see
   * {@link #toSpecies(SpeciesDocument)}; name, type and coefficients are restored.
   *
   * @param document stored reaction
   * @return a new reaction owning fresh terms
   * @throws CompositionException if a species or a coefficient is invalid
   */
  public static Reaction toReaction(ReactionDocument document) {
    Reaction reaction = new Reaction(toTerms(document.reactants()), toTerms(document.products()));
    reaction.setName(document.name());
    reaction.setReactionType(document.type());
    return reaction;
  }

  public static String toJson(ReactionDocument document) {
    try {
      return OBJECT_MAPPER.writeValueAsString(document);
    } catch (JsonProcessingException e) {
      throw new UncheckedIOException("Cannot serialize reaction document", e);
    }
  }

  public static ReactionDocument fromJson(String json) {
    try {
      return OBJECT_MAPPER.readValue(json, ReactionDocument.class);
    } catch (JsonProcessingException e) {
      throw new UncheckedIOException("Cannot deserialize reaction document", e);
    }
  }

  private static List<TermDocument> toTermDocuments(List<ReactionTerm> terms) {
    return terms.stream()
        .map(term -> new TermDocument(toDocument(term.getSpecies()), term.getCoefficient(), term.isCatalyst()))
        .collect(Collectors.toList());
  }

  private static List<ReactionTerm> toTerms(List<TermDocument> documents) {
    if (documents == null) {
      return List.of();
    }
    return documents.stream()
        .map(term -> new ReactionTerm(toSpecies(term.species()), term.coefficient(), term.catalyst()))
        .collect(Collectors.toList());
  }

  private static int toCount(Map.Entry<String, Long> entry) {
    long count = entry.getValue() == null ? 0 : entry.getValue();
    if (count < 1 || count > Integer.MAX_VALUE) {
      throw new CompositionException(ErrorType.INVALID_COUNT,
          String.format("Count %d of %s is not a valid leaf count", count, entry.getKey()));
    }
    return (int) count;
  }
}
