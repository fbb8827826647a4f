package com.quantori.csp.api;

import com.quantori.csp.api.model.ErrorType;

/**
 * Raised when a reaction has no physically valid set of coefficients.
 */
public class BalancingException extends ChemistryException {

  public BalancingException(ErrorType errorType, String message) {
    super(errorType, message);
  }

  public BalancingException(ErrorType errorType, String message, Throwable cause) {
    super(errorType, message, cause);
  }
}
