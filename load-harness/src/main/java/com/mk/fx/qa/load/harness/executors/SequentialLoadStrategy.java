package com.mk.fx.qa.load.harness.executors;

import com.mk.fx.qa.load.harness.sampling.RequestSample;
import com.mk.fx.qa.load.harness.sampling.RequestSampler;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import lombok.extern.slf4j.Slf4j;

/**
 * Sends one request at a time until the deadline. The request that is in flight when the deadline
 * passes is still recorded.
 */
@Slf4j
public final class SequentialLoadStrategy implements LoadStrategy {

  @Override
  public LoadResult run(RequestSampler sampler, long deadlineNanos) {
    var samples = runUntil(sampler, deadlineNanos);
    return new LoadResult(samples, List.of(samples.size()));
  }

  @Override
  public String describe() {
    return "sequential";
  }

  /**
   * The request loop shared with {@link ConcurrentLoadStrategy}; samples come out in start order.
   */
  static List<RequestSample> runUntil(RequestSampler sampler, long deadlineNanos) {
    Objects.requireNonNull(sampler, "sampler");
    List<RequestSample> samples = new ArrayList<>();
    while (System.nanoTime() - deadlineNanos <= 0) {
      if (Thread.currentThread().isInterrupted()) {
        log.info("Load loop interrupted after {} requests", samples.size());
        break;
      }
      samples.add(sampler.attempt());
    }
    return samples;
  }
}
