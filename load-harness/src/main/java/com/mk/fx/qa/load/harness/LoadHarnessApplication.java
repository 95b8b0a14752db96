package com.mk.fx.qa.load.harness;

import com.mk.fx.qa.load.harness.config.HarnessProperties;
import com.mk.fx.qa.load.harness.executors.LoadExecutionException;
import com.mk.fx.qa.load.harness.metrics.InsufficientSamplesException;
import com.mk.fx.qa.load.harness.plan.LoadTestPlan;
import com.mk.fx.qa.load.harness.process.ServiceProcessManager;
import com.mk.fx.qa.load.harness.process.ServiceStartupException;
import com.mk.fx.qa.load.harness.rest.JsonUtil;
import com.mk.fx.qa.load.harness.runner.PerformanceReport;
import com.mk.fx.qa.load.harness.runner.PerformanceTestRunner;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;

/**
 * Command line entry point: {@code LoadHarnessApplication <plan.json>}.
 *
 * <p>Exit status is {@value #EXIT_PASSED} when failed requests stay within the plan's budget,
 * {@value #EXIT_FAILED} when they exceed it, and {@value #EXIT_ERROR} when the run could not be
 * carried out (bad arguments or plan, service that never became ready, too few samples).
 */
@Slf4j
public final class LoadHarnessApplication {

  static final int EXIT_PASSED = 0;
  static final int EXIT_FAILED = 1;
  static final int EXIT_ERROR = 2;

  private LoadHarnessApplication() {
    throw new UnsupportedOperationException("LoadHarnessApplication cannot be instantiated");
  }

  public static void main(String[] args) {
    System.exit(run(args, new ServiceProcessManager(), HarnessProperties.fromSystemProperties()));
  }

  static int run(String[] args, ServiceProcessManager manager, HarnessProperties properties) {
    if (args.length != 1) {
      log.error("Usage: LoadHarnessApplication <plan.json>");
      return EXIT_ERROR;
    }

    LoadTestPlan plan;
    try {
      plan = LoadTestPlan.read(Path.of(args[0]));
    } catch (IOException | IllegalArgumentException e) {
      log.error("Cannot use plan {}: {}", args[0], e.getMessage());
      return EXIT_ERROR;
    }

    Duration duration;
    try {
      duration = properties.duration("duration", plan.duration());
    } catch (IllegalArgumentException e) {
      log.error("Invalid {}duration: {}", HarnessProperties.PREFIX, e.getMessage());
      return EXIT_ERROR;
    }
    var runner = new PerformanceTestRunner(plan.chartColumns());

    try (var service = manager.acquire(plan.serviceConfiguration())) {
      var report = runner.run(service.requestIssuer(), plan.path(), plan.strategy(), duration);
      writeReport(plan, report);
      if (report.failedRequests() > plan.allowedFailures()) {
        log.error(
            "{}/{} requests failed (allowed {})",
            report.failedRequests(),
            report.totalRequests(),
            plan.allowedFailures());
        return EXIT_FAILED;
      }
      log.info("Load test passed: {}/{} requests failed", report.failedRequests(), report.totalRequests());
      return EXIT_PASSED;
    } catch (ServiceStartupException
        | InsufficientSamplesException
        | LoadExecutionException
        | IllegalArgumentException e) {
      log.error("Load test aborted: {}", e.getMessage());
      return EXIT_ERROR;
    } catch (IOException e) {
      log.error("Could not write report: {}", e.getMessage());
      return EXIT_ERROR;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      log.error("Load test interrupted");
      return EXIT_ERROR;
    }
  }

  private static void writeReport(LoadTestPlan plan, PerformanceReport report) throws IOException {
    var target = plan.reportFile();
    if (target.isEmpty()) {
      return;
    }
    Map<String, Object> document = new LinkedHashMap<>();
    document.put("path", report.path());
    document.put("strategy", report.strategy());
    document.put("plannedDuration", report.plannedDuration());
    document.put("elapsed", report.elapsed());
    document.put("workerSampleCounts", report.result().workerSampleCounts());
    document.put("summary", report.summary());
    document.put("cellWeight", report.chart().cellWeight());
    document.put("seconds", report.chart().rows());

    var file = target.get();
    if (file.getParent() != null) {
      Files.createDirectories(file.getParent());
    }
    Files.writeString(file, JsonUtil.toJson(document));
    log.info("Report written to {}", file.toAbsolutePath());
  }
}
