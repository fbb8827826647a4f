package com.quantori.csp.api.model.document;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.quantori.csp.api.model.ReactionType;
import java.util.List;

/**
 * Reaction document with all data necessary to send to a storage or a renderer.
 *
 * @see TermDocument
 * @see SpeciesDocument
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ReactionDocument(
    @JsonProperty("name") String name,
    @JsonProperty("equation") String equation,
    @JsonProperty("reactants") List<TermDocument> reactants,
    @JsonProperty("products") List<TermDocument> products,
    @JsonProperty("type") ReactionType type,
    @JsonProperty("balanced") boolean balanced) {
}
