package com.acme.jobqueue.config;

/** Selects which queue backend variant the process runs against. */
public enum RunMode {
  /** Live backend reached through the configured connection URL. */
  REAL,
  /** No-op backend; nothing is stored and health checks always pass. */
  STUB;

  public static final String TEST_ENVIRONMENT = "test";

  public static RunMode fromEnvironment(String appEnv) {
    return TEST_ENVIRONMENT.equalsIgnoreCase(appEnv == null ? "" : appEnv.trim()) ? STUB : REAL;
  }
}
