package com.mk.fx.qa.load.harness.executors;

/** A load worker died from an unexpected error rather than a failed request. */
public class LoadExecutionException extends RuntimeException {

  public LoadExecutionException(String message, Throwable cause) {
    super(message, cause);
  }
}
