package com.mk.fx.qa.load.harness.rest;

/**
 * Issues GET requests against a single running service. One issuer is built per service handle and
 * handed to callers explicitly, so ownership stays visible when it crosses thread boundaries.
 *
 * <p>Implementations must be safe to share between load workers for stateless GET requests.
 */
public interface RequestIssuer {

    /**
     * Issues one GET request.
     *
     * @param path path relative to the service root, with or without a leading slash
     * @param options per-request headers and query parameters
     * @return the response, or {@code null} if the request timed out
     * @throws RequestExecutionException on any other transport failure
     */
    RestResponseData issue(String path, RequestOptions options);

    default RestResponseData issue(String path) {
        return issue(path, RequestOptions.none());
    }
}
