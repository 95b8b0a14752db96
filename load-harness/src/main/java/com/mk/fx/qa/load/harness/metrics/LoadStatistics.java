package com.mk.fx.qa.load.harness.metrics;

import com.mk.fx.qa.load.harness.sampling.RequestSample;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/** Reduces request samples to summary statistics. */
public final class LoadStatistics {

  static final int MIN_SAMPLES = 2;

  private LoadStatistics() {
    throw new UnsupportedOperationException("LoadStatistics cannot be instantiated");
  }

  /**
   * Summarises a run.
   *
   * @param samples request samples in any order
   * @return counts and latency statistics over every sample, failed ones included
   * @throws InsufficientSamplesException when fewer than two samples are given, since the sample
   *     standard deviation is undefined there
   */
  public static LoadSummary summarize(List<RequestSample> samples) {
    Objects.requireNonNull(samples, "samples");
    if (samples.size() < MIN_SAMPLES) {
      throw new InsufficientSamplesException(samples.size(), MIN_SAMPLES);
    }

    int n = samples.size();
    double[] latencies = new double[n];
    long failed = 0;
    long firstStart = Long.MAX_VALUE;
    long lastEnd = Long.MIN_VALUE;
    for (int i = 0; i < n; i++) {
      RequestSample sample = samples.get(i);
      latencies[i] = sample.durationSeconds();
      if (!sample.success()) failed++;
      firstStart = Math.min(firstStart, sample.startNanos());
      lastEnd = Math.max(lastEnd, sample.endNanos());
    }

    double mean = mean(latencies);
    double stdev = sampleStandardDeviation(latencies, mean);
    Arrays.sort(latencies);

    var span = Duration.ofNanos(Math.max(0, lastEnd - firstStart));
    double spanSeconds = span.toNanos() / 1_000_000_000.0;
    double throughput = spanSeconds > 0 ? n / spanSeconds : 0.0;

    return new LoadSummary(
        n,
        failed,
        mean,
        stdev,
        latencies[0],
        latencies[n - 1],
        percentile(latencies, 95),
        percentile(latencies, 99),
        span,
        throughput);
  }

  static double mean(double[] values) {
    double sum = 0.0;
    for (double v : values) sum += v;
    return sum / values.length;
  }

  static double sampleStandardDeviation(double[] values, double mean) {
    if (values.length < MIN_SAMPLES) {
      throw new InsufficientSamplesException(values.length, MIN_SAMPLES);
    }
    double squares = 0.0;
    for (double v : values) {
      double d = v - mean;
      squares += d * d;
    }
    return Math.sqrt(squares / (values.length - 1));
  }

  /** Nearest-rank percentile over an ascending array. */
  static double percentile(double[] sorted, int p) {
    if (p < 0 || p > 100) {
      throw new IllegalArgumentException("Percentile must be between 0 and 100");
    }
    int idx = Math.min(sorted.length - 1, Math.max(0, (int) Math.ceil((p / 100.0) * sorted.length) - 1));
    return sorted[idx];
  }
}
