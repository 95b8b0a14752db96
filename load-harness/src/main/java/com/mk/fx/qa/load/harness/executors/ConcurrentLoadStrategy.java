package com.mk.fx.qa.load.harness.executors;

import static java.util.concurrent.Executors.newFixedThreadPool;

import com.mk.fx.qa.load.harness.sampling.RequestSample;
import com.mk.fx.qa.load.harness.sampling.RequestSampler;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import lombok.extern.slf4j.Slf4j;

/**
 * Runs a fixed number of independent workers, each executing the sequential request loop against
 * the same deadline and sampler. Workers keep private sample lists; once all have finished the
 * lists are concatenated and stably sorted by start time.
 *
 * <p>Threading: one platform thread per worker from a fixed pool. The sampler's issuer is shared
 * by all workers, which is fine for stateless GET requests without cookies.
 */
@Slf4j
public final class ConcurrentLoadStrategy implements LoadStrategy {

  private static final AtomicInteger RUN_SEQUENCE = new AtomicInteger();
  private static final long TERMINATION_WAIT_SECONDS = 30L;

  private final int workers;

  public ConcurrentLoadStrategy(int workers) {
    if (workers < 1) {
      throw new IllegalArgumentException("Concurrent load needs at least one worker, got " + workers);
    }
    this.workers = workers;
  }

  public int workers() {
    return workers;
  }

  @Override
  public String describe() {
    return "concurrent x" + workers;
  }

  @Override
  public LoadResult run(RequestSampler sampler, long deadlineNanos) throws InterruptedException {
    Objects.requireNonNull(sampler, "sampler");
    int run = RUN_SEQUENCE.incrementAndGet();

    ThreadFactory threadFactory =
        new ThreadFactory() {
          private final AtomicInteger index = new AtomicInteger();

          @Override
          public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable);
            thread.setName("load-run-" + run + "-worker-" + index.incrementAndGet());
            thread.setDaemon(true);
            return thread;
          }
        };

    var executor = newFixedThreadPool(workers, threadFactory);
    List<Future<List<RequestSample>>> futures = new ArrayList<>(workers);
    try {
      for (int worker = 0; worker < workers; worker++) {
        futures.add(executor.submit(() -> SequentialLoadStrategy.runUntil(sampler, deadlineNanos)));
      }
      log.debug("Load run {} started {} workers against {}", run, workers, sampler.path());
      return merge(collect(futures));
    } finally {
      stop(executor, run);
    }
  }

  private static void stop(ExecutorService executor, int run) {
    executor.shutdownNow();
    try {
      if (!executor.awaitTermination(TERMINATION_WAIT_SECONDS, TimeUnit.SECONDS)) {
        log.warn("Load run {} workers did not terminate within {}s", run, TERMINATION_WAIT_SECONDS);
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      log.warn("Interrupted while waiting for load run {} workers to stop", run);
    }
  }

  private static List<List<RequestSample>> collect(List<Future<List<RequestSample>>> futures)
      throws InterruptedException {
    List<List<RequestSample>> perWorker = new ArrayList<>(futures.size());
    for (int i = 0; i < futures.size(); i++) {
      try {
        perWorker.add(futures.get(i).get());
      } catch (ExecutionException e) {
        log.error("Load worker {} failed: {}", i + 1, e.getCause().getMessage(), e.getCause());
        throw new LoadExecutionException("Load worker " + (i + 1) + " failed", e.getCause());
      }
    }
    return perWorker;
  }

  /** Concatenates worker results and restores a single timeline; the sort is stable. */
  static LoadResult merge(List<List<RequestSample>> perWorker) {
    List<RequestSample> merged = new ArrayList<>();
    List<Integer> counts = new ArrayList<>(perWorker.size());
    for (List<RequestSample> samples : perWorker) {
      merged.addAll(samples);
      counts.add(samples.size());
    }
    merged.sort(LoadResult.BY_START);
    return new LoadResult(merged, counts);
  }
}
