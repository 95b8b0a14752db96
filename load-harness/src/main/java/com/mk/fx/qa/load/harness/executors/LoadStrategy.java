package com.mk.fx.qa.load.harness.executors;

import com.mk.fx.qa.load.harness.sampling.RequestSampler;

/**
 * Drives request attempts until a deadline and returns them as one time-ordered result.
 *
 * <p>The deadline is checked between requests only, so a run may overshoot it by at most the
 * duration of one in-flight request, which the request timeout bounds.
 */
public interface LoadStrategy {

  /**
   * Runs load until the deadline passes.
   *
   * @param sampler performs and records each request attempt
   * @param deadlineNanos {@link System#nanoTime()} value after which no new request starts
   * @return samples ordered by start time
   * @throws InterruptedException if the calling thread is interrupted while waiting on workers
   */
  LoadResult run(RequestSampler sampler, long deadlineNanos) throws InterruptedException;

  /** Short human readable name used in logs. */
  String describe();
}
