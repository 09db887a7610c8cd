package com.acme.jobqueue.spi;

/**
 * Result of a backend liveness check.
 *
 * @param reply the raw reply from the backend, {@code PONG} when healthy
 */
public record HealthStatus(boolean healthy, String reply) {
  public static final String PONG = "PONG";

  public static HealthStatus up() {
    return new HealthStatus(true, PONG);
  }

  public static HealthStatus down(String reason) {
    return new HealthStatus(false, reason);
  }
}
