package com.mk.fx.qa.load.harness.process;

import com.google.common.annotations.VisibleForTesting;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.BooleanSupplier;
import lombok.extern.slf4j.Slf4j;

/**
 * Counts readiness lines on a service's diagnostic stream and lets the launcher block until every
 * expected worker has reported in. Matching is done on whole lines, so a marker can never be split
 * across reads.
 */
@Slf4j
final class ReadinessMonitor {

  private static final long POLL_MILLIS = 50L;

  private final String marker;
  private final int expectedWorkers;
  private final AtomicInteger workersReady = new AtomicInteger();
  private final CountDownLatch ready;
  private final AtomicReference<ReadinessState> state = new AtomicReference<>(ReadinessState.IDLE);

  ReadinessMonitor(String marker, int expectedWorkers) {
    if (marker == null || marker.isBlank()) {
      throw new IllegalArgumentException("Readiness marker must not be blank");
    }
    if (expectedWorkers < 1) {
      throw new IllegalArgumentException("Expected workers must be >= 1, got " + expectedWorkers);
    }
    this.marker = marker;
    this.expectedWorkers = expectedWorkers;
    this.ready = new CountDownLatch(expectedWorkers);
  }

  void starting() {
    state.compareAndSet(ReadinessState.IDLE, ReadinessState.STARTING);
  }

  /** Feeds one line of diagnostic output. */
  void accept(String line) {
    if (!line.stripTrailing().endsWith(marker)) {
      return;
    }
    int count = workersReady.incrementAndGet();
    log.debug("Worker ready signal {}/{}", count, expectedWorkers);
    ready.countDown();
    if (count >= expectedWorkers) {
      state.compareAndSet(ReadinessState.STARTING, ReadinessState.READY);
    }
  }

  /**
   * Blocks until all workers are ready, the timeout elapses, or the process stops being alive.
   *
   * @param timeout how long to wait in total
   * @param processAlive reports whether the watched process is still running
   * @throws ServiceStartupException if readiness is not reached
   */
  void awaitReady(Duration timeout, BooleanSupplier processAlive) throws InterruptedException {
    starting();
    long deadline = System.nanoTime() + timeout.toNanos();
    while (!ready.await(POLL_MILLIS, TimeUnit.MILLISECONDS)) {
      if (!processAlive.getAsBoolean()) {
        // the process may have printed its last marker just before exiting
        if (ready.getCount() == 0) {
          break;
        }
        state.set(ReadinessState.FAILED);
        throw new ServiceStartupException(
            String.format(
                "Service exited before it was ready (%d/%d workers reported ready)",
                workersReady.get(), expectedWorkers));
      }
      if (System.nanoTime() - deadline > 0) {
        state.set(ReadinessState.FAILED);
        throw new ServiceStartupException(
            String.format(
                "Service did not fully start within %d ms (%d/%d workers reported ready)",
                timeout.toMillis(), workersReady.get(), expectedWorkers));
      }
    }
    state.set(ReadinessState.READY);
  }

  ReadinessState state() {
    return state.get();
  }

  @VisibleForTesting
  int workersReady() {
    return workersReady.get();
  }
}
