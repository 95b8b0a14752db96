package com.mk.fx.qa.load.harness.sampling;

import java.time.Duration;
import java.util.Objects;

/**
 * Outcome of one request attempt.
 *
 * @param startNanos monotonic {@link System#nanoTime()} reading taken just before the request
 * @param duration how long the request took
 * @param success true when the service answered with a 2xx status
 */
public record RequestSample(long startNanos, Duration duration, boolean success) {

  public RequestSample {
    Objects.requireNonNull(duration, "duration");
  }

  /** Duration in seconds, as used by latency statistics. */
  public double durationSeconds() {
    return duration.toNanos() / 1_000_000_000.0;
  }

  /** Monotonic instant at which the request finished. */
  public long endNanos() {
    return startNanos + duration.toNanos();
  }
}
