package com.mk.fx.qa.load.harness.plan;

import static com.mk.fx.qa.load.harness.utils.LoadUtils.parseDuration;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.mk.fx.qa.load.harness.executors.LoadStrategy;
import com.mk.fx.qa.load.harness.process.ServiceConfiguration;
import com.mk.fx.qa.load.harness.report.RequestDensityChart;
import com.mk.fx.qa.load.harness.rest.JsonUtil;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Optional;
import lombok.Getter;

/**
 * A load test described as JSON: which service to launch, what load to drive against it, how to
 * report, and how many failed requests are tolerated.
 *
 * <pre>{@code
 * {
 *   "service": {"command": ["java", "-cp", "app.jar", "Main", "--bind", "{{host}}:{{port}}"],
 *               "environment": {"WEB_CONCURRENCY": "2"}, "expectedWorkers": 2},
 *   "load": {"type": "CONCURRENT", "concurrency": 3, "duration": "60s", "path": "people/0"},
 *   "report": {"columns": 10},
 *   "maxFailures": 0
 * }
 * }</pre>
 */
@Getter
@JsonIgnoreProperties(ignoreUnknown = true)
public class LoadTestPlan {

    static final Duration DEFAULT_DURATION = Duration.ofMinutes(1);

    @JsonProperty("service")
    private ServiceSpec service;

    @JsonProperty("load")
    private LoadModelConfig load;

    @JsonProperty("report")
    private ReportConfig report;

    @JsonProperty("maxFailures")
    private Long maxFailures;

    /**
     * Reads and validates a plan file.
     *
     * @throws IOException if the file cannot be read or is not valid JSON
     * @throws IllegalArgumentException if the plan is incomplete
     */
    public static LoadTestPlan read(Path file) throws IOException {
        var plan = JsonUtil.mapper().readValue(Files.readString(file), LoadTestPlan.class);
        plan.validate();
        return plan;
    }

    void validate() {
        if (service == null) {
            throw new IllegalArgumentException("Plan is missing the 'service' section");
        }
        if (load == null || load.getPath() == null || load.getPath().isBlank()) {
            throw new IllegalArgumentException("Plan must name the request path in 'load.path'");
        }
        if (maxFailures != null && maxFailures < 0) {
            throw new IllegalArgumentException("maxFailures must not be negative");
        }
        if (report != null && report.getColumns() != null && report.getColumns() < 1) {
            throw new IllegalArgumentException("report.columns must be >= 1");
        }
        serviceConfiguration();
        strategy();
        if (duration().isNegative()) {
            throw new IllegalArgumentException("load.duration must not be negative, got " + load.getDuration());
        }
    }

    public ServiceConfiguration serviceConfiguration() {
        return service.toConfiguration();
    }

    public LoadStrategy strategy() {
        return load.toStrategy();
    }

    public Duration duration() {
        return parseDuration(load.getDuration(), DEFAULT_DURATION);
    }

    public String path() {
        return load.getPath();
    }

    public long allowedFailures() {
        return maxFailures != null ? maxFailures : 0L;
    }

    public int chartColumns() {
        return report != null && report.getColumns() != null
                ? report.getColumns()
                : RequestDensityChart.DEFAULT_COLUMNS;
    }

    public Optional<Path> reportFile() {
        return report != null && report.getJsonFile() != null && !report.getJsonFile().isBlank()
                ? Optional.of(Path.of(report.getJsonFile()))
                : Optional.empty();
    }
}
