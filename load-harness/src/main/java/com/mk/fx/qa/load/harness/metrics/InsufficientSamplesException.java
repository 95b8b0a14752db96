package com.mk.fx.qa.load.harness.metrics;

/** Raised when a statistic is requested over fewer values than it needs to be defined. */
public class InsufficientSamplesException extends RuntimeException {

  private final int available;
  private final int required;

  public InsufficientSamplesException(int available, int required) {
    super(
        String.format(
            "At least %d latency values are needed for summary statistics, got %d",
            required, available));
    this.available = available;
    this.required = required;
  }

  public int available() {
    return available;
  }

  public int required() {
    return required;
  }
}
