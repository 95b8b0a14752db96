package com.mk.fx.qa.load.harness.rest;

/** Raised when a request fails at the transport level for any reason other than a timeout. */
public class RequestExecutionException extends RuntimeException {

    public RequestExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
