package com.mk.fx.qa.load.harness.process;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Consumer;
import lombok.extern.slf4j.Slf4j;

/**
 * Drains one output stream of a child process line by line on a daemon thread. Lines are kept in
 * arrival order and optionally handed to a listener as they arrive.
 */
@Slf4j
final class ProcessOutputCollector {

  private final String name;
  private final InputStream stream;
  private final Consumer<String> listener;
  private final List<String> lines = Collections.synchronizedList(new ArrayList<>());
  private final Thread thread;

  ProcessOutputCollector(String name, InputStream stream, Consumer<String> listener) {
    this.name = name;
    this.stream = stream;
    this.listener = listener;
    this.thread = new Thread(this::drain, name);
    this.thread.setDaemon(true);
  }

  void start() {
    thread.start();
  }

  /** Snapshot of the lines captured so far. */
  List<String> lines() {
    synchronized (lines) {
      return List.copyOf(lines);
    }
  }

  /**
   * Waits for the stream to reach end of file.
   *
   * @return true if the stream was fully drained within the timeout
   */
  boolean awaitDrained(Duration timeout) throws InterruptedException {
    thread.join(Math.max(1, timeout.toMillis()));
    return !thread.isAlive();
  }

  private void drain() {
    try (var reader = new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8))) {
      String line;
      while ((line = reader.readLine()) != null) {
        lines.add(line);
        listener.accept(line);
      }
    } catch (IOException e) {
      log.debug("Stopped reading {}: {}", name, e.getMessage());
    }
  }
}
