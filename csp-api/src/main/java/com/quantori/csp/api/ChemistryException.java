package com.quantori.csp.api;

import com.quantori.csp.api.model.ErrorType;
import lombok.Getter;

/**
 * Base error of the platform. Every instance carries the {@link ErrorType} describing which
 * construction or balancing rule was violated, so callers can react without parsing messages.
 */
@Getter
public class ChemistryException extends RuntimeException {
  private final ErrorType errorType;

  /**
   * Constructs a {@code ChemistryException} with the specified error type and detail message.
   *
   * @param errorType the kind of failure
   * @param message   the detail message, or null
   */
  public ChemistryException(ErrorType errorType, String message) {
    super(String.format("%s: %s", errorType, message));
    this.errorType = errorType;
  }

  /**
   * Constructs a {@code ChemistryException} with the specified error type, detail message and cause.
   *
   * @param errorType the kind of failure
   * @param message   the detail message, or null
   * @param cause     the cause
   */
  public ChemistryException(ErrorType errorType, String message, Throwable cause) {
    super(String.format("%s: %s", errorType, message), cause);
    this.errorType = errorType;
  }
}
