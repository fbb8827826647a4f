package com.quantori.csp.api.model;

/**
 * Kind of failure raised while building species or balancing a reaction.
 */
public enum ErrorType {
  /**
   * A group multiplier, scale factor or declared coefficient is not a positive integer.
   */
  INVALID_MULTIPLIER,
  /**
   * An element count is not a positive integer, or a group has no members.
   */
  INVALID_COUNT,
  /**
   * A symbol does not name a known chemical element.
   */
  UNKNOWN_ELEMENT,
  /**
   * Two species carrying different explicit phases were combined.
   */
  PHASE_CONFLICT,
  /**
   * The conservation matrix only admits the trivial solution, or a side of the equation is empty.
   */
  UNBALANCEABLE,
  /**
   * The chosen null space vector cannot be scaled to strictly positive coefficients.
   */
  NO_POSITIVE_SOLUTION,
  /**
   * Balancing succeeded but the null space had more than one dimension. Reported as a flag,
   * never thrown.
   */
  AMBIGUOUS_BALANCE,
  /**
   * The reaction has more participants or distinct elements than the engine is configured for.
   */
  SYSTEM_TOO_LARGE,
  /**
   * Computed coefficients do not conserve atoms or charge. Internal defect.
   */
  BALANCE_VERIFICATION_FAILED
}
