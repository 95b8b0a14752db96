package com.mk.fx.qa.load.harness.sampling;

import com.mk.fx.qa.load.harness.rest.RequestExecutionException;
import com.mk.fx.qa.load.harness.rest.RequestIssuer;
import com.mk.fx.qa.load.harness.rest.RequestOptions;
import com.mk.fx.qa.load.harness.rest.RestResponseData;
import java.time.Duration;
import java.util.Objects;
import lombok.extern.slf4j.Slf4j;

/**
 * Performs single request attempts against one path and turns each into a {@link RequestSample}.
 * Failures of any kind become failed samples; they never escape as exceptions.
 *
 * <p>Successful samples carry the latency reported by the response. Failed samples carry the
 * wall-clock time spent on the attempt.
 */
@Slf4j
public final class RequestSampler {

  private final RequestIssuer issuer;
  private final String path;
  private final RequestOptions options;

  public RequestSampler(RequestIssuer issuer, String path) {
    this(issuer, path, RequestOptions.none());
  }

  public RequestSampler(RequestIssuer issuer, String path, RequestOptions options) {
    this.issuer = Objects.requireNonNull(issuer, "issuer");
    this.path = Objects.requireNonNull(path, "path");
    this.options = Objects.requireNonNull(options, "options");
  }

  public String path() {
    return path;
  }

  /** Issues one request and records its outcome. */
  public RequestSample attempt() {
    long start = System.nanoTime();
    RestResponseData response;
    try {
      response = issuer.issue(path, options);
    } catch (RequestExecutionException e) {
      log.trace("Request to {} failed: {}", path, e.getMessage());
      response = null;
    }
    var took = Duration.ofNanos(System.nanoTime() - start);

    if (response == null || !response.isOk()) {
      return new RequestSample(start, took, false);
    }
    var elapsed = response.getElapsed() != null ? response.getElapsed() : took;
    return new RequestSample(start, elapsed, true);
  }
}
