package com.mk.fx.qa.load.harness.runner;

import com.mk.fx.qa.load.harness.executors.LoadStrategy;
import com.mk.fx.qa.load.harness.metrics.LoadStatistics;
import com.mk.fx.qa.load.harness.report.RequestDensityChart;
import com.mk.fx.qa.load.harness.rest.RequestIssuer;
import com.mk.fx.qa.load.harness.rest.RequestOptions;
import com.mk.fx.qa.load.harness.sampling.RequestSampler;
import java.time.Duration;
import java.util.Objects;
import lombok.extern.slf4j.Slf4j;

/**
 * Sends continuous GET load to one path for a fixed wall-clock duration, then logs request counts,
 * latency statistics and the density chart.
 *
 * <p>A wall-clock deadline rather than a request count keeps the total run time bounded whatever
 * the service latency or worker count.
 */
@Slf4j
public final class PerformanceTestRunner {

  private final int chartColumns;

  public PerformanceTestRunner() {
    this(RequestDensityChart.DEFAULT_COLUMNS);
  }

  public PerformanceTestRunner(int chartColumns) {
    if (chartColumns < 1) {
      throw new IllegalArgumentException("chartColumns must be >= 1, got " + chartColumns);
    }
    this.chartColumns = chartColumns;
  }

  public PerformanceReport run(
      RequestIssuer issuer, String path, LoadStrategy strategy, Duration duration)
      throws InterruptedException {
    return run(issuer, path, RequestOptions.none(), strategy, duration);
  }

  /**
   * Runs the load and summarises it.
   *
   * @throws com.mk.fx.qa.load.harness.metrics.InsufficientSamplesException if the run produced
   *     fewer than two samples
   * @throws InterruptedException if interrupted while waiting for load workers
   */
  public PerformanceReport run(
      RequestIssuer issuer,
      String path,
      RequestOptions options,
      LoadStrategy strategy,
      Duration duration)
      throws InterruptedException {
    Objects.requireNonNull(strategy, "strategy");
    Objects.requireNonNull(duration, "duration");
    if (duration.isNegative()) {
      throw new IllegalArgumentException("duration must not be negative");
    }
    var sampler = new RequestSampler(issuer, path, options);

    log.info(
        "The test will now continuously send GET requests to '{}' for {} seconds ({})...",
        path,
        duration.toMillis() / 1000.0,
        strategy.describe());

    long started = System.nanoTime();
    var result = strategy.run(sampler, started + duration.toNanos());
    var elapsed = Duration.ofNanos(System.nanoTime() - started);

    var summary = LoadStatistics.summarize(result.samples());
    var chart = RequestDensityChart.of(result.samples(), chartColumns, started);

    log.info(
        "Made {} requests in {} seconds",
        summary.count(),
        String.format("%.2f", summary.span().toNanos() / 1_000_000_000.0));
    log.info("{} requests got error responses", summary.failedCount());
    log.info("Arithmetic mean of response times: {}", String.format("%.5f", summary.meanLatency()));
    log.info("Standard deviation of response times: {}", String.format("%.5f", summary.stdevLatency()));
    log.info(
        "Latency min/p95/p99/max: {}/{}/{}/{} s, throughput {} req/s",
        String.format("%.5f", summary.minLatency()),
        String.format("%.5f", summary.p95Latency()),
        String.format("%.5f", summary.p99Latency()),
        String.format("%.5f", summary.maxLatency()),
        String.format("%.1f", summary.throughput()));
    log.info("Request density per second:{}{}", System.lineSeparator(), chart.render());

    return new PerformanceReport(
        path, strategy.describe(), duration, elapsed, result, summary, chart);
  }
}
