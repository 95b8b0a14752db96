package com.mk.fx.qa.load.harness.utils;

import java.time.Duration;

public final class LoadUtils {

    private LoadUtils() {
        // Utility class, no instantiation
    }

    /** Parses a duration string, or returns the fallback when the value is blank. */
    public static Duration parseDuration(String value, Duration fallback) {
        return value == null || value.isBlank() ? fallback : parseDuration(value);
    }

    /**
     * Parses durations such as {@code 250ms}, {@code 10s}, {@code 2m}, {@code 1h} or a bare number
     * of seconds ({@code 0.5}).
     */
    public static Duration parseDuration(String value) {
        if (value == null || value.isBlank()) {
            return Duration.ZERO;
        }
        String trimmed = value.trim().toLowerCase();
        try {
            if (trimmed.endsWith("ms")) {
                long ms = Long.parseLong(trimmed.substring(0, trimmed.length() - 2).trim());
                return Duration.ofMillis(ms);
            }
            char unit = trimmed.charAt(trimmed.length() - 1);
            if (Character.isDigit(unit) || unit == '.') {
                return ofSeconds(Double.parseDouble(trimmed));
            }
            long amount = Long.parseLong(trimmed.substring(0, trimmed.length() - 1).trim());
            return switch (unit) {
                case 's' -> Duration.ofSeconds(amount);
                case 'm' -> Duration.ofMinutes(amount);
                case 'h' -> Duration.ofHours(amount);
                default -> throw new IllegalArgumentException("Unrecognised duration unit in " + value);
            };
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid duration: " + value, e);
        }
    }

    /** Converts fractional seconds to a duration with nanosecond precision. */
    public static Duration ofSeconds(double seconds) {
        if (seconds < 0 || Double.isNaN(seconds)) {
            throw new IllegalArgumentException("Duration must not be negative: " + seconds);
        }
        return Duration.ofNanos(Math.round(seconds * 1_000_000_000L));
    }
}
