package com.quantori.csp.api;

import com.quantori.csp.api.model.ErrorType;

/**
 * Raised when a composition, species or reaction term cannot be constructed from the given values.
 * Always recoverable by retrying with valid input.
 */
public class CompositionException extends ChemistryException {

  public CompositionException(ErrorType errorType, String message) {
    super(errorType, message);
  }
}
