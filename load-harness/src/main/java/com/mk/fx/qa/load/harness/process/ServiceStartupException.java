package com.mk.fx.qa.load.harness.process;

/**
 * The service under test could not be launched or did not report readiness in time. A run cannot
 * continue without a listening service, so this is always fatal.
 */
public class ServiceStartupException extends RuntimeException {

  public ServiceStartupException(String message) {
    super(message);
  }

  public ServiceStartupException(String message, Throwable cause) {
    super(message, cause);
  }
}
