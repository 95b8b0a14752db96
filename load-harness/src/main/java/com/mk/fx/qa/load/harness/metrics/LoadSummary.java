package com.mk.fx.qa.load.harness.metrics;

import java.time.Duration;

/**
 * Aggregate view of a load run. Latencies are in seconds.
 *
 * @param count number of requests attempted
 * @param failedCount requests that timed out, failed or answered with a non-2xx status
 * @param meanLatency arithmetic mean of all request durations
 * @param stdevLatency sample standard deviation (n - 1) of all request durations
 * @param minLatency shortest request duration
 * @param maxLatency longest request duration
 * @param p95Latency 95th percentile (nearest rank)
 * @param p99Latency 99th percentile (nearest rank)
 * @param span time from the first request's start to the last request's end
 * @param throughput requests per second over the span
 */
public record LoadSummary(
    long count,
    long failedCount,
    double meanLatency,
    double stdevLatency,
    double minLatency,
    double maxLatency,
    double p95Latency,
    double p99Latency,
    Duration span,
    double throughput) {

  public long successCount() {
    return count - failedCount;
  }

  public double successRate() {
    return count == 0 ? 0.0 : (double) successCount() / count;
  }
}
