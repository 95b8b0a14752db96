package com.mk.fx.qa.load.harness.config;

import com.mk.fx.qa.load.harness.utils.LoadUtils;
import java.time.Duration;
import java.util.Optional;
import java.util.Properties;

/**
 * Harness settings overridable through {@code -Dload.harness.<name>} system properties, for
 * example {@code -Dload.harness.duration=60s} to run the full-length performance session.
 */
public final class HarnessProperties {

  public static final String PREFIX = "load.harness.";

  private final Properties source;

  private HarnessProperties(Properties source) {
    this.source = source;
  }

  public static HarnessProperties fromSystemProperties() {
    return new HarnessProperties(System.getProperties());
  }

  public static HarnessProperties from(Properties properties) {
    return new HarnessProperties(properties);
  }

  public Optional<String> get(String name) {
    var value = source.getProperty(PREFIX + name);
    return value == null || value.isBlank() ? Optional.empty() : Optional.of(value.trim());
  }

  public Duration duration(String name, Duration fallback) {
    return get(name).map(LoadUtils::parseDuration).orElse(fallback);
  }

  public int integer(String name, int fallback) {
    return get(name)
        .map(
            value -> {
              try {
                return Integer.parseInt(value);
              } catch (NumberFormatException e) {
                throw new IllegalArgumentException(
                    PREFIX + name + " must be an integer, got '" + value + "'", e);
              }
            })
        .orElse(fallback);
  }
}
