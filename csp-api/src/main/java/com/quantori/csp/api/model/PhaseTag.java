package com.quantori.csp.api.model;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/** Physical phase annotation of a species. */
@Getter
@RequiredArgsConstructor
public enum PhaseTag {
  SOLID("s"),
  LIQUID("l"),
  GAS("g"),
  /** Dissolved in water. */
  AQUEOUS("aq");

  @JsonValue private final String code;
}
