package com.mk.fx.qa.load.harness.process;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

import com.mk.fx.qa.load.harness.ItemsApiProcess;
import com.mk.fx.qa.load.harness.rest.RestResponseData;
import java.net.ServerSocket;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.DisabledOnOs;
import org.junit.jupiter.api.condition.OS;

class ServiceProcessManagerTest {

  private final ServiceProcessManager manager = new ServiceProcessManager();

  @Test
  void acquire_waitsForEveryWorker_andReleaseStopsTheProcess() {
    var handle = manager.acquire(ItemsApiProcess.configuration("0").build());
    try {
      assertThat(handle.isAlive()).isTrue();
      assertThat(handle.readinessState()).isEqualTo(ReadinessState.READY);
      assertThat(handle.baseUrl()).isEqualTo("http://127.0.0.1:" + handle.port());
      assertThat(handle.environment()).containsEntry("ID_LIMIT", "10");
      assertThat(handle.diagnosticOutput())
          .filteredOn(line -> line.endsWith(ServiceConfiguration.DEFAULT_READINESS_MARKER))
          .hasSize(ItemsApiProcess.SERVER_WORKERS);

      RestResponseData response = handle.requestIssuer().issue("people/1");
      assertThat(response.isOk()).isTrue();
      assertThat(response.getBody()).isEqualTo("{\"item_id\":1}");
      handle.requestIssuer().issue("people/1");

      await()
          .atMost(Duration.ofSeconds(5))
          .until(
              () ->
                  handle.accessLog().stream()
                          .filter(line -> line.contains("GET /people/1 HTTP/1.1\" 200"))
                          .count()
                      == 2);
    } finally {
      handle.close();
    }

    assertThat(handle.isReleased()).isTrue();
    assertThat(handle.isAlive()).isFalse();

    var report = handle.shutdownReport();
    assertThat(report).isNotNull();
    assertThat(report.exitCode()).isNotNull();
    assertThat(report.accessLog())
        .filteredOn(line -> line.contains("GET /people/1 HTTP/1.1\" 200"))
        .hasSizeBetween(1, 2);
    assertThat(handle.accessLog())
        .filteredOn(line -> line.contains("GET /people/1 HTTP/1.1\" 200"))
        .hasSizeGreaterThanOrEqualTo(1);
  }

  @Test
  void release_isIdempotent() {
    var handle = manager.acquire(ItemsApiProcess.configuration("0").build());

    var first = manager.release(handle);
    var second = manager.release(handle);
    handle.close();

    assertThat(first).isNotNull();
    assertThat(second).isSameAs(first);
    assertThat(handle.isAlive()).isFalse();
  }

  @Test
  void acquire_failsWhenFewerWorkersReportThanExpected() {
    var configuration =
        ItemsApiProcess.configuration("0")
            .expectedWorkers(ItemsApiProcess.SERVER_WORKERS + 1)
            .startupTimeout(Duration.ofSeconds(5))
            .build();

    assertThatThrownBy(() -> manager.acquire(configuration))
        .isInstanceOf(ServiceStartupException.class)
        .hasMessageContaining("did not fully start within 5000 ms")
        .hasMessageContaining("2/3");
  }

  @Test
  void acquire_failsWhenTheMarkerNeverAppears() {
    var configuration =
        ItemsApiProcess.configuration("0")
            .readinessMarker("Worker is warm and listening.")
            .startupTimeout(Duration.ofSeconds(3))
            .build();

    assertThatThrownBy(() -> manager.acquire(configuration))
        .isInstanceOf(ServiceStartupException.class)
        .hasMessageContaining("0/2");
  }

  @Test
  void acquire_failsFastWhenTheProcessExits() {
    var configuration =
        ServiceConfiguration.builder()
            .command(List.of(ItemsApiProcess.command().get(0), "-version"))
            .startupTimeout(Duration.ofSeconds(30))
            .build();

    long start = System.nanoTime();
    assertThatThrownBy(() -> manager.acquire(configuration))
        .isInstanceOf(ServiceStartupException.class)
        .hasMessageContaining("exited before it was ready");
    assertThat(Duration.ofNanos(System.nanoTime() - start)).isLessThan(Duration.ofSeconds(20));
  }

  @Test
  void acquire_failsWhenTheExecutableIsMissing() {
    var configuration =
        ServiceConfiguration.builder().arg("/nonexistent/items-api-binary").build();

    assertThatThrownBy(() -> manager.acquire(configuration))
        .isInstanceOf(ServiceStartupException.class)
        .hasMessageContaining("Failed to launch service");
  }

  @Test
  void acquire_rejectsEmptyCommand() {
    assertThatThrownBy(() -> manager.acquire(ServiceConfiguration.builder().build()))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  @DisabledOnOs(OS.WINDOWS)
  void release_killsAServiceThatIgnoresTheInterrupt() {
    var configuration =
        ServiceConfiguration.builder()
            .arg("sh")
            .arg("-c")
            .arg(
                "trap '' INT TERM; echo '"
                    + ServiceConfiguration.DEFAULT_READINESS_MARKER
                    + "' >&2; exec sleep 60")
            .shutdownTimeout(Duration.ofMillis(500))
            .build();

    var handle = manager.acquire(configuration);
    var report = manager.release(handle);

    assertThat(report.forced()).isTrue();
    assertThat(handle.isAlive()).isFalse();
    assertThat(report.diagnosticLog()).contains(ServiceConfiguration.DEFAULT_READINESS_MARKER);
  }

  @Test
  void resolveCommand_substitutesHostAndPort() {
    var resolved =
        ServiceProcessManager.resolveCommand(
            List.of("serve", "--bind", "{{host}}:{{port}}", "--name=api"), "127.0.0.1", 8123);

    assertThat(resolved).containsExactly("serve", "--bind", "127.0.0.1:8123", "--name=api");
  }

  @Test
  void baseUrl_bracketsIpv6Literals() {
    assertThat(ServiceProcessManager.baseUrl("127.0.0.1", 8123)).isEqualTo("http://127.0.0.1:8123");
    assertThat(ServiceProcessManager.baseUrl("0.0.0.0", 8123)).isEqualTo("http://127.0.0.1:8123");
    assertThat(ServiceProcessManager.baseUrl("::1", 8123)).isEqualTo("http://[::1]:8123");
    assertThat(ServiceProcessManager.baseUrl("::", 8123)).isEqualTo("http://[::1]:8123");
    assertThat(ServiceProcessManager.baseUrl("localhost", 8123)).isEqualTo("http://localhost:8123");
  }

  @Test
  void allocatePort_returnsABindablePort() throws Exception {
    int port = ServiceProcessManager.allocatePort("127.0.0.1");

    assertThat(port).isBetween(1, 65535);
    try (var socket = new ServerSocket(port)) {
      assertThat(socket.getLocalPort()).isEqualTo(port);
    }
  }
}
