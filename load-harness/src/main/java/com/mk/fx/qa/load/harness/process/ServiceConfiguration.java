package com.mk.fx.qa.load.harness.process;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * Describes how to launch a service under test and how long to wait for it.
 *
 * <p>{@code {{host}}} and {@code {{port}}} placeholders in the command are replaced with the bind
 * host and the port allocated for the run. Environment entries are layered over the harness's own
 * environment.
 */
@Value
@Builder(toBuilder = true)
public class ServiceConfiguration {

  public static final String DEFAULT_READINESS_MARKER = "Application startup complete.";

  @Singular("arg")
  List<String> command;

  @Singular("env")
  Map<String, String> environment;

  /** Working directory of the child process; inherits the harness's when null. */
  Path workingDirectory;

  @Builder.Default String host = "127.0.0.1";

  /** Number of readiness lines to observe before the service counts as started. */
  @Builder.Default int expectedWorkers = 1;

  @Builder.Default String readinessMarker = DEFAULT_READINESS_MARKER;

  @Builder.Default Duration startupTimeout = Duration.ofSeconds(10);

  @Builder.Default Duration shutdownTimeout = Duration.ofSeconds(10);

  @Builder.Default Duration requestTimeout = Duration.ofSeconds(1);
}
