package com.mk.fx.qa.load.harness.plan;

import static com.mk.fx.qa.load.harness.utils.LoadUtils.parseDuration;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.mk.fx.qa.load.harness.process.ServiceConfiguration;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import lombok.Getter;

/** How to launch the service under test; durations use the {@code 10s} / {@code 500ms} syntax. */
@Getter
@JsonIgnoreProperties(ignoreUnknown = true)
public class ServiceSpec {

    @JsonProperty("command")
    private List<String> command;

    @JsonProperty("environment")
    private Map<String, String> environment;

    @JsonProperty("workingDirectory")
    private String workingDirectory;

    @JsonProperty("host")
    private String host;

    @JsonProperty("expectedWorkers")
    private Integer expectedWorkers;

    @JsonProperty("readinessMarker")
    private String readinessMarker;

    @JsonProperty("startupTimeout")
    private String startupTimeout;

    @JsonProperty("shutdownTimeout")
    private String shutdownTimeout;

    @JsonProperty("requestTimeout")
    private String requestTimeout;

    ServiceConfiguration toConfiguration() {
        if (command == null || command.isEmpty()) {
            throw new IllegalArgumentException("service.command must list the executable and its arguments");
        }
        var defaults = ServiceConfiguration.builder().build();
        var builder = ServiceConfiguration.builder().command(command);
        if (environment != null) {
            builder.environment(environment);
        }
        if (workingDirectory != null && !workingDirectory.isBlank()) {
            builder.workingDirectory(Path.of(workingDirectory));
        }
        if (host != null && !host.isBlank()) {
            builder.host(host);
        }
        if (expectedWorkers != null) {
            if (expectedWorkers < 1) {
                throw new IllegalArgumentException("service.expectedWorkers must be >= 1, got " + expectedWorkers);
            }
            builder.expectedWorkers(expectedWorkers);
        }
        if (readinessMarker != null && !readinessMarker.isBlank()) {
            builder.readinessMarker(readinessMarker);
        }
        return builder
                .startupTimeout(parseDuration(startupTimeout, defaults.getStartupTimeout()))
                .shutdownTimeout(parseDuration(shutdownTimeout, defaults.getShutdownTimeout()))
                .requestTimeout(parseDuration(requestTimeout, defaults.getRequestTimeout()))
                .build();
    }
}
