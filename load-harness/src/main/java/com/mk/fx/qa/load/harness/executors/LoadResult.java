package com.mk.fx.qa.load.harness.executors;

import com.google.common.base.Preconditions;
import com.google.common.collect.Comparators;
import com.mk.fx.qa.load.harness.sampling.RequestSample;
import java.time.Duration;
import java.util.Comparator;
import java.util.List;

/**
 * Samples of one load run, ordered by start time regardless of which worker produced them.
 *
 * @param samples every recorded attempt, sorted by {@link RequestSample#startNanos()}
 * @param workerSampleCounts number of samples contributed by each worker, in worker order
 */
public record LoadResult(List<RequestSample> samples, List<Integer> workerSampleCounts) {

  static final Comparator<RequestSample> BY_START =
      Comparator.comparingLong(RequestSample::startNanos);

  public LoadResult {
    samples = List.copyOf(samples);
    workerSampleCounts = List.copyOf(workerSampleCounts);
    Preconditions.checkArgument(
        Comparators.isInOrder(samples, BY_START), "Samples must be ordered by start time");
    Preconditions.checkArgument(
        workerSampleCounts.stream().mapToInt(Integer::intValue).sum() == samples.size(),
        "Worker sample counts %s do not add up to %s samples",
        workerSampleCounts,
        samples.size());
  }

  public int size() {
    return samples.size();
  }

  public boolean isEmpty() {
    return samples.isEmpty();
  }

  public int workers() {
    return workerSampleCounts.size();
  }

  public long failedCount() {
    return samples.stream().filter(sample -> !sample.success()).count();
  }

  /** Time from the first request's start to the latest request end. */
  public Duration span() {
    if (samples.isEmpty()) {
      return Duration.ZERO;
    }
    long lastEnd = samples.stream().mapToLong(RequestSample::endNanos).max().getAsLong();
    return Duration.ofNanos(Math.max(0, lastEnd - samples.get(0).startNanos()));
  }
}
