package com.mk.fx.qa.load.harness.runner;

import com.mk.fx.qa.load.harness.executors.LoadResult;
import com.mk.fx.qa.load.harness.metrics.LoadSummary;
import com.mk.fx.qa.load.harness.report.RequestDensityChart;
import java.time.Duration;

/**
 * Everything produced by one performance run.
 *
 * @param path request path the load was sent to
 * @param strategy description of the load strategy
 * @param plannedDuration requested run duration
 * @param elapsed wall-clock time the run actually took, deadline overshoot included
 * @param result ordered request samples
 * @param summary aggregate statistics
 * @param chart per-second pass/fail density
 */
public record PerformanceReport(
    String path,
    String strategy,
    Duration plannedDuration,
    Duration elapsed,
    LoadResult result,
    LoadSummary summary,
    RequestDensityChart chart) {

  public long totalRequests() {
    return summary.count();
  }

  public long failedRequests() {
    return summary.failedCount();
  }
}
