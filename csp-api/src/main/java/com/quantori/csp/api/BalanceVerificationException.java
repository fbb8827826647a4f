package com.quantori.csp.api;

import com.quantori.csp.api.model.ErrorType;

/**
 * Computed coefficients failed the conservation check. This is an internal consistency defect,
 * not a user input error; the balance attempt is aborted and the reaction is left untouched.
 */
public class BalanceVerificationException extends ChemistryException {

  public BalanceVerificationException(String message) {
    super(ErrorType.BALANCE_VERIFICATION_FAILED, message);
  }
}
