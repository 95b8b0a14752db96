package com.mk.fx.qa.load.harness.executors;

import static org.assertj.core.api.Assertions.assertThat;

import com.google.common.collect.Comparators;
import com.mk.fx.qa.load.harness.rest.RequestIssuer;
import com.mk.fx.qa.load.harness.rest.RestResponseData;
import com.mk.fx.qa.load.harness.sampling.RequestSample;
import com.mk.fx.qa.load.harness.sampling.RequestSampler;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

class SequentialLoadStrategyTest {

  private final SequentialLoadStrategy strategy = new SequentialLoadStrategy();

  @Test
  void stopsShortlyAfterTheDeadline() {
    var sampler = new RequestSampler(answering(Duration.ofMillis(1)), "people/1");
    long start = System.nanoTime();

    var result = strategy.run(sampler, start + Duration.ofMillis(300).toNanos());

    var elapsed = Duration.ofNanos(System.nanoTime() - start);
    assertThat(elapsed).isBetween(Duration.ofMillis(300), Duration.ofMillis(600));
    assertThat(result.size()).isGreaterThan(1);
    assertThat(result.workerSampleCounts()).containsExactly(result.size());
    assertThat(result.failedCount()).isZero();
  }

  @Test
  void recordsTheRequestInFlightAtTheDeadline() {
    var sampler = new RequestSampler(answering(Duration.ofMillis(100)), "people/1");
    long deadline = System.nanoTime() + Duration.ofMillis(250).toNanos();

    var result = strategy.run(sampler, deadline);

    RequestSample last = result.samples().get(result.size() - 1);
    assertThat(last.startNanos() - deadline).isNotPositive();
    assertThat(last.endNanos() - deadline).isPositive();
    assertThat(Comparators.isInOrder(result.samples(), LoadResult.BY_START)).isTrue();
  }

  @Test
  void expiredDeadline_recordsNothing() {
    var calls = new AtomicInteger();
    RequestIssuer issuer =
        (path, options) -> {
          calls.incrementAndGet();
          return ok(Duration.ZERO);
        };

    var result = strategy.run(new RequestSampler(issuer, "people/1"), System.nanoTime() - 1);

    assertThat(result.isEmpty()).isTrue();
    assertThat(result.span()).isEqualTo(Duration.ZERO);
    assertThat(calls).hasValue(0);
  }

  @Test
  void countsFailedResponses() {
    var calls = new AtomicInteger();
    RequestIssuer issuer =
        (path, options) -> {
          var response = ok(Duration.ofMillis(1));
          if (calls.incrementAndGet() % 2 == 0) {
            response.setStatusCode(503);
          }
          return response;
        };

    var result =
        strategy.run(
            new RequestSampler(issuer, "people/1"),
            System.nanoTime() + Duration.ofMillis(100).toNanos());

    assertThat(result.failedCount()).isEqualTo(result.size() / 2);
  }

  /** Issuer that sleeps for the given latency and answers 200 with the measured time. */
  static RequestIssuer answering(Duration latency) {
    return (path, options) -> {
      long start = System.nanoTime();
      try {
        Thread.sleep(latency.toMillis());
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        return null;
      }
      return ok(Duration.ofNanos(System.nanoTime() - start));
    };
  }

  static RestResponseData ok(Duration elapsed) {
    var response = new RestResponseData();
    response.setStatusCode(200);
    response.setElapsed(elapsed);
    return response;
  }
}
