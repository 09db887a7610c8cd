package com.acme.jobqueue.config;

import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Lenient numeric parsing for environment-provided settings. */
public final class ConfigValues {
  private static final Logger LOG = LoggerFactory.getLogger(ConfigValues.class);

  // plain decimal notation only; no type suffixes, hex or named values
  private static final Pattern DECIMAL =
      Pattern.compile("[+-]?(\\d+(\\.\\d*)?|\\.\\d+)([eE][+-]?\\d+)?");

  private ConfigValues() {}

  /**
   * Parses {@code raw} as a positive number floored to an integer. Missing, non-numeric,
   * non-finite and non-positive values yield {@code fallback}, as do fractions that floor to 0.
   */
  public static int positiveInt(String key, String raw, int fallback) {
    double parsed = parse(raw);
    if (!Double.isFinite(parsed) || parsed < 1) {
      if (raw != null && !raw.isBlank()) {
        LOG.warn("Invalid positive integer for {}: '{}', using default: {}", key, raw, fallback);
      }
      return fallback;
    }
    return (int) Math.min(Math.floor(parsed), Integer.MAX_VALUE);
  }

  /**
   * Parses {@code raw} as an integer with a lower bound of 1. Only a missing or non-numeric value
   * yields {@code fallback}; numeric values below 1 are clamped to 1.
   */
  public static int atLeastOne(String key, String raw, int fallback) {
    double parsed = parse(raw);
    if (Double.isNaN(parsed)) {
      if (raw != null && !raw.isBlank()) {
        LOG.warn("Invalid integer for {}: '{}', using default: {}", key, raw, fallback);
      }
      return fallback;
    }
    if (parsed < 1) {
      return 1;
    }
    return (int) Math.min(Math.floor(parsed), Integer.MAX_VALUE);
  }

  private static double parse(String raw) {
    if (raw == null || raw.isBlank()) {
      return Double.NaN;
    }
    String trimmed = raw.trim();
    if (!DECIMAL.matcher(trimmed).matches()) {
      return Double.NaN;
    }
    try {
      return Double.parseDouble(trimmed);
    } catch (NumberFormatException e) {
      return Double.NaN;
    }
  }
}
