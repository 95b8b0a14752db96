package com.mk.fx.qa.load.harness.report;

import com.google.common.collect.Lists;
import com.mk.fx.qa.load.harness.sampling.RequestSample;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Text chart of pass/fail density per second of a run. Each row is one elapsed second; each cell in
 * a row stands for up to {@link #cellWeight()} consecutive requests started in that second and is
 * solid when at least half of them passed.
 *
 * <p>Purely diagnostic: the chart never influences whether a run passes.
 */
public final class RequestDensityChart {

  public static final char SOLID = '█';
  public static final char SHADED = '░';
  public static final int DEFAULT_COLUMNS = 10;

  private static final long NANOS_PER_SECOND = 1_000_000_000L;

  private final int cellWeight;
  private final List<SecondRow> rows;

  /**
   * One rendered second.
   *
   * @param second whole seconds elapsed since the start of the run
   * @param passed successful requests started in this second
   * @param failed failed requests started in this second
   * @param cells one glyph per chunk of requests
   */
  public record SecondRow(long second, int passed, int failed, String cells) {

    public int total() {
      return passed + failed;
    }
  }

  private RequestDensityChart(int cellWeight, List<SecondRow> rows) {
    this.cellWeight = cellWeight;
    this.rows = List.copyOf(rows);
  }

  public static RequestDensityChart of(List<RequestSample> samples) {
    return of(samples, DEFAULT_COLUMNS);
  }

  /** Builds a chart with seconds counted from the earliest sample. */
  public static RequestDensityChart of(List<RequestSample> samples, int columns) {
    Objects.requireNonNull(samples, "samples");
    long testStart = samples.stream().mapToLong(RequestSample::startNanos).min().orElse(0L);
    return of(samples, columns, testStart);
  }

  /**
   * Builds a chart.
   *
   * @param samples request samples in any order
   * @param columns target number of cells for the busiest second
   * @param testStartNanos monotonic start of the run; seconds are counted from here
   */
  public static RequestDensityChart of(List<RequestSample> samples, int columns, long testStartNanos) {
    Objects.requireNonNull(samples, "samples");
    if (columns < 1) {
      throw new IllegalArgumentException("columns must be >= 1, got " + columns);
    }

    Map<Long, List<Boolean>> buckets = new TreeMap<>();
    samples.stream()
        .sorted(Comparator.comparingLong(RequestSample::startNanos))
        .forEachOrdered(
            sample ->
                buckets
                    .computeIfAbsent(
                        Math.floorDiv(sample.startNanos() - testStartNanos, NANOS_PER_SECOND),
                        second -> new ArrayList<>())
                    .add(sample.success()));

    int busiest = buckets.values().stream().mapToInt(List::size).max().orElse(0);
    int cellWeight = Math.max(1, (int) Math.rint((double) busiest / columns));

    List<SecondRow> rows = new ArrayList<>(buckets.size());
    for (Map.Entry<Long, List<Boolean>> bucket : buckets.entrySet()) {
      var outcomes = bucket.getValue();
      var cells = new StringBuilder();
      for (List<Boolean> chunk : Lists.partition(outcomes, cellWeight)) {
        long passed = chunk.stream().filter(Boolean::booleanValue).count();
        cells.append((double) passed / chunk.size() >= 0.5 ? SOLID : SHADED);
      }
      int passed = (int) outcomes.stream().filter(Boolean::booleanValue).count();
      rows.add(new SecondRow(bucket.getKey(), passed, outcomes.size() - passed, cells.toString()));
    }
    return new RequestDensityChart(cellWeight, rows);
  }

  /** Number of requests each cell represents at most. */
  public int cellWeight() {
    return cellWeight;
  }

  public List<SecondRow> rows() {
    return rows;
  }

  public String legend() {
    return String.format(
        "Each row is one second of the run and each cell stands for up to %d requests; "
            + "%c means at least half of the cell's requests passed, %c means fewer did.",
        cellWeight, SOLID, SHADED);
  }

  /** Legend followed by one line per second, oldest first. */
  public String render() {
    var out = new StringBuilder(legend());
    if (rows.isEmpty()) {
      out.append(System.lineSeparator()).append("(no requests recorded)");
    }
    for (SecondRow row : rows) {
      out.append(System.lineSeparator())
          .append(
              String.format(
                  "t+%-3d %5d passed %5d failed  %s",
                  row.second(), row.passed(), row.failed(), row.cells()));
    }
    return out.toString();
  }

  @Override
  public String toString() {
    return render();
  }
}
