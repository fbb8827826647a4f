package com.quantori.csp.api.model.document;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One side entry of a stored reaction.
 */
public record TermDocument(
    @JsonProperty("species") SpeciesDocument species,
    @JsonProperty("coefficient") long coefficient,
    @JsonProperty("catalyst") boolean catalyst) {
}
