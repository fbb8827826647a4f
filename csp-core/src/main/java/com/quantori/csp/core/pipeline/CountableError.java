package com.quantori.csp.core.pipeline;

import lombok.Getter;

/** Wrapper exception to preserve index of the reaction where an error occurred. */
@Getter
public class CountableError extends RuntimeException {
  private final Long at;
  private final int successful;

  public CountableError(final Long at, final int successful, final Throwable e) {
    super("Reaction #" + at + " failed: " + e.getMessage(), e);
    this.successful = successful;
    this.at = at;
  }
}
