package com.quantori.csp.api.model.document;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.quantori.csp.api.model.PhaseTag;
import java.util.Map;

/**
 * Serialisable shape of a species: flattened atom counts keyed by element symbol, charge and phase.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SpeciesDocument(
    @JsonProperty("formula") String formula,
    @JsonProperty("elements") Map<String, Long> elements,
    @JsonProperty("charge") int charge,
    @JsonProperty("phase") PhaseTag phase) {
}
