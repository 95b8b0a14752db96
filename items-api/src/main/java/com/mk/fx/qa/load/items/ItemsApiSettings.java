package com.mk.fx.qa.load.items;

import java.time.Duration;
import java.util.Map;

/**
 * Runtime settings of the items service, read from environment variables.
 *
 * @param workers number of request-handling worker threads ({@code WEB_CONCURRENCY})
 * @param idLimit highest item id served; larger ids answer 404 ({@code ID_LIMIT})
 * @param maxDelay upper bound of the random delay added to each item lookup ({@code MAX_DELAY},
 *     in seconds)
 */
public record ItemsApiSettings(int workers, int idLimit, Duration maxDelay) {

  public static final String WORKERS_ENV = "WEB_CONCURRENCY";
  public static final String ID_LIMIT_ENV = "ID_LIMIT";
  public static final String MAX_DELAY_ENV = "MAX_DELAY";

  static final int DEFAULT_WORKERS = 1;
  static final int DEFAULT_ID_LIMIT = 100;

  public ItemsApiSettings {
    if (workers < 1) {
      throw new IllegalArgumentException("workers must be >= 1, got " + workers);
    }
    idLimit = Math.max(0, idLimit);
    maxDelay = maxDelay == null || maxDelay.isNegative() ? Duration.ZERO : maxDelay;
  }

  public static ItemsApiSettings fromEnvironment(Map<String, String> env) {
    int workers = parseInt(env.get(WORKERS_ENV), DEFAULT_WORKERS, WORKERS_ENV);
    int idLimit = parseInt(env.get(ID_LIMIT_ENV), DEFAULT_ID_LIMIT, ID_LIMIT_ENV);
    double maxDelaySeconds = parseDouble(env.get(MAX_DELAY_ENV), MAX_DELAY_ENV);
    long maxDelayNanos = Math.round(Math.max(0.0, maxDelaySeconds) * 1_000_000_000L);
    return new ItemsApiSettings(Math.max(1, workers), idLimit, Duration.ofNanos(maxDelayNanos));
  }

  private static int parseInt(String value, int defaultValue, String name) {
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    try {
      return Integer.parseInt(value.trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException(name + " must be an integer, got '" + value + "'", e);
    }
  }

  private static double parseDouble(String value, String name) {
    if (value == null || value.isBlank()) {
      return 0.0;
    }
    try {
      return Double.parseDouble(value.trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException(name + " must be a number, got '" + value + "'", e);
    }
  }
}
