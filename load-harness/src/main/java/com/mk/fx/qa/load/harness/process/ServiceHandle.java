package com.mk.fx.qa.load.harness.process;

import com.mk.fx.qa.load.harness.rest.LoadHttpClient;
import com.mk.fx.qa.load.harness.rest.RequestIssuer;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A running service under test, owned exclusively by one test session. Closing the handle releases
 * the service, so acquiring it in a try-with-resources block guarantees shutdown on every exit path.
 */
public final class ServiceHandle implements AutoCloseable {

  private final ServiceProcessManager manager;
  private final ServiceConfiguration configuration;
  private final Process process;
  private final int port;
  private final ProcessOutputCollector stdout;
  private final ProcessOutputCollector stderr;
  private final ReadinessMonitor readiness;
  private final LoadHttpClient issuer;
  private final Thread shutdownHook;
  private final AtomicBoolean released = new AtomicBoolean(false);
  private volatile ShutdownReport shutdownReport;

  ServiceHandle(
      ServiceProcessManager manager,
      ServiceConfiguration configuration,
      Process process,
      int port,
      ProcessOutputCollector stdout,
      ProcessOutputCollector stderr,
      ReadinessMonitor readiness,
      LoadHttpClient issuer,
      Thread shutdownHook) {
    this.manager = manager;
    this.configuration = configuration;
    this.process = process;
    this.port = port;
    this.stdout = stdout;
    this.stderr = stderr;
    this.readiness = readiness;
    this.issuer = issuer;
    this.shutdownHook = shutdownHook;
  }

  public int port() {
    return port;
  }

  public long pid() {
    return process.pid();
  }

  public boolean isAlive() {
    return process.isAlive();
  }

  /** Environment overrides this service was started with. */
  public Map<String, String> environment() {
    return configuration.getEnvironment();
  }

  public String baseUrl() {
    return issuer.baseUrl();
  }

  /** Issuer bound to this service; shared by all load workers of the session. */
  public RequestIssuer requestIssuer() {
    return issuer;
  }

  public ReadinessState readinessState() {
    return readiness.state();
  }

  /** Diagnostic (stderr) lines captured so far. */
  public List<String> diagnosticOutput() {
    return stderr.lines();
  }

  /** Access log (stdout) lines captured so far, duplicates included. */
  public List<String> accessLog() {
    return stdout.lines();
  }

  public boolean isReleased() {
    return released.get();
  }

  /** Report of the release, or null while the service is still held. */
  public ShutdownReport shutdownReport() {
    return shutdownReport;
  }

  @Override
  public void close() {
    manager.release(this);
  }

  ServiceConfiguration configuration() {
    return configuration;
  }

  Process process() {
    return process;
  }

  ProcessOutputCollector stdoutCollector() {
    return stdout;
  }

  ProcessOutputCollector stderrCollector() {
    return stderr;
  }

  LoadHttpClient issuer() {
    return issuer;
  }

  Thread shutdownHook() {
    return shutdownHook;
  }

  boolean markReleased() {
    return released.compareAndSet(false, true);
  }

  void recordShutdown(ShutdownReport report) {
    this.shutdownReport = report;
  }
}
