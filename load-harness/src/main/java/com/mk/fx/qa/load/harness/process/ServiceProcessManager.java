package com.mk.fx.qa.load.harness.process;

import com.google.common.annotations.VisibleForTesting;
import com.mk.fx.qa.load.harness.rest.LoadHttpClient;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.URI;
import java.net.URISyntaxException;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;

/**
 * Launches a service under test as a child process, waits for it to report readiness, and shuts it
 * down again.
 *
 * <p>Shutdown first sends an interrupt (SIGINT) and waits for the process to exit and its streams
 * to drain. If that takes longer than the configured grace period the process is killed. A JVM
 * shutdown hook kills the child as well if the harness itself dies before releasing it.
 */
@Slf4j
public class ServiceProcessManager {

  private static final Duration FORCED_KILL_WAIT = Duration.ofSeconds(5);
  private static final Duration SIGNAL_COMMAND_TIMEOUT = Duration.ofSeconds(2);

  /**
   * Starts a service and blocks until it is ready.
   *
   * @param configuration launch settings
   * @return handle owning the running process
   * @throws ServiceStartupException if the process cannot be launched, exits early, or does not
   *     report readiness within the startup timeout
   */
  public ServiceHandle acquire(ServiceConfiguration configuration) {
    Objects.requireNonNull(configuration, "configuration");
    if (configuration.getCommand().isEmpty()) {
      throw new IllegalArgumentException("Service command must not be empty");
    }

    var host = configuration.getHost();
    int port = allocatePort(host);
    var command = resolveCommand(configuration.getCommand(), host, port);
    var readiness =
        new ReadinessMonitor(configuration.getReadinessMarker(), configuration.getExpectedWorkers());

    log.info(
        "Starting service on {}:{} with settings: {}", host, port, configuration.getEnvironment());
    log.debug("Service command: {}", command);

    Process process = launch(configuration, command);

    var stderr =
        new ProcessOutputCollector(
            "service-" + process.pid() + "-stderr", process.getErrorStream(), readiness::accept);
    var stdout =
        new ProcessOutputCollector(
            "service-" + process.pid() + "-stdout", process.getInputStream(), line -> {});
    stderr.start();
    stdout.start();

    Thread shutdownHook =
        new Thread(process::destroyForcibly, "service-" + process.pid() + "-reaper");
    Runtime.getRuntime().addShutdownHook(shutdownHook);

    var issuer =
        new LoadHttpClient(
            baseUrl(host, port),
            LoadHttpClient.DEFAULT_CONNECT_TIMEOUT,
            configuration.getRequestTimeout(),
            Map.of());
    var handle =
        new ServiceHandle(
            this, configuration, process, port, stdout, stderr, readiness, issuer, shutdownHook);

    try {
      readiness.awaitReady(configuration.getStartupTimeout(), process::isAlive);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      release(handle);
      throw new ServiceStartupException("Interrupted while waiting for service to start", e);
    } catch (RuntimeException e) {
      log.error("Service on port {} failed to start: {}", port, e.getMessage());
      release(handle);
      throw e;
    }

    log.info("Service started successfully on {} (pid {})", handle.baseUrl(), process.pid());
    return handle;
  }

  /**
   * Stops the service owned by the handle. Safe to call repeatedly; only the first call does any
   * work and later calls return the same report.
   *
   * @param handle handle to release
   * @return what was observed while stopping, or null if another thread is still releasing it
   */
  public ShutdownReport release(ServiceHandle handle) {
    Objects.requireNonNull(handle, "handle");
    if (!handle.markReleased()) {
      log.debug("Service pid {} already released", handle.pid());
      return handle.shutdownReport();
    }

    removeShutdownHook(handle.shutdownHook());
    handle.issuer().close();

    var process = handle.process();
    var grace = handle.configuration().getShutdownTimeout();
    boolean interrupted = false;
    boolean forced = false;

    log.info("Stopping service (pid {})...", process.pid());
    try {
      sendInterrupt(process);
      if (!exitedAndDrained(handle, grace)) {
        log.warn(
            "Service pid {} did not stop within {} ms of the interrupt signal; killing it",
            process.pid(),
            grace.toMillis());
        forced = true;
        process.destroyForcibly();
        if (!exitedAndDrained(handle, FORCED_KILL_WAIT)) {
          log.warn("Output of service pid {} was not fully drained after kill", process.pid());
        }
      }
    } catch (InterruptedException e) {
      interrupted = true;
      forced = true;
      process.destroyForcibly();
    }

    Integer exitCode = process.isAlive() ? null : process.exitValue();
    var diagnosticLog = handle.stderrCollector().lines();
    var accessLog = OrderedLineSet.of(handle.stdoutCollector().lines());
    var report = new ShutdownReport(exitCode, forced, diagnosticLog, accessLog.toList());
    handle.recordShutdown(report);

    log.info("Stopped service (pid {}, exit code {})", process.pid(), exitCode);
    log.info(
        "Error log from the service instance:{}{}",
        System.lineSeparator(),
        String.join(System.lineSeparator(), diagnosticLog));
    log.info(
        "Unique entries from access log of the service instance:{}{}",
        System.lineSeparator(),
        accessLog.join());

    if (interrupted) {
      Thread.currentThread().interrupt();
    }
    return report;
  }

  @VisibleForTesting
  static List<String> resolveCommand(List<String> command, String host, int port) {
    return command.stream()
        .map(part -> part.replace("{{host}}", host).replace("{{port}}", Integer.toString(port)))
        .collect(Collectors.toUnmodifiableList());
  }

  @VisibleForTesting
  static int allocatePort(String host) {
    try (var socket = new ServerSocket()) {
      socket.bind(new InetSocketAddress(host, 0));
      return socket.getLocalPort();
    } catch (IOException e) {
      throw new ServiceStartupException("Could not allocate a free port on " + host, e);
    }
  }

  /** HTTP base URL for a bind address; IPv6 literals come out in brackets. */
  @VisibleForTesting
  static String baseUrl(String bindHost, int port) {
    try {
      return new URI("http", null, requestHost(bindHost), port, null, null, null).toString();
    } catch (URISyntaxException e) {
      throw new ServiceStartupException("Cannot build a URL for host " + bindHost, e);
    }
  }

  private static String requestHost(String bindHost) {
    if ("0.0.0.0".equals(bindHost)) {
      return "127.0.0.1";
    }
    if ("::".equals(bindHost)) {
      return "::1";
    }
    return bindHost;
  }

  private Process launch(ServiceConfiguration configuration, List<String> command) {
    var builder = new ProcessBuilder(command);
    builder.environment().putAll(configuration.getEnvironment());
    if (configuration.getWorkingDirectory() != null) {
      builder.directory(configuration.getWorkingDirectory().toFile());
    }
    try {
      return builder.start();
    } catch (IOException e) {
      throw new ServiceStartupException("Failed to launch service: " + command.get(0), e);
    }
  }

  private boolean exitedAndDrained(ServiceHandle handle, Duration timeout)
      throws InterruptedException {
    long deadline = System.nanoTime() + timeout.toNanos();
    if (!handle.process().waitFor(timeout.toNanos(), TimeUnit.NANOSECONDS)) {
      return false;
    }
    return handle.stdoutCollector().awaitDrained(remaining(deadline))
        && handle.stderrCollector().awaitDrained(remaining(deadline));
  }

  private static Duration remaining(long deadline) {
    return Duration.ofNanos(Math.max(0, deadline - System.nanoTime()));
  }

  /** Sends SIGINT through the platform kill command, falling back to a plain terminate request. */
  private void sendInterrupt(Process process) throws InterruptedException {
    try {
      var signal =
          new ProcessBuilder("kill", "-INT", Long.toString(process.pid()))
              .redirectOutput(ProcessBuilder.Redirect.DISCARD)
              .redirectError(ProcessBuilder.Redirect.DISCARD)
              .start();
      if (!signal.waitFor(SIGNAL_COMMAND_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS)) {
        signal.destroyForcibly();
      } else if (signal.exitValue() == 0) {
        return;
      }
      log.debug("kill -INT {} did not succeed, terminating instead", process.pid());
    } catch (IOException e) {
      log.debug("No kill command available ({}), terminating instead", e.getMessage());
    }
    process.destroy();
  }

  private void removeShutdownHook(Thread hook) {
    try {
      Runtime.getRuntime().removeShutdownHook(hook);
    } catch (IllegalStateException e) {
      log.debug("JVM is already shutting down, leaving reaper hook in place");
    }
  }
}
