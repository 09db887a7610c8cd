package com.acme.jobqueue.config;

import com.acme.jobqueue.core.QueueConfigurationException;
import java.util.function.Function;

/**
 * Process-wide queue configuration. Pure POJO - built once at startup from an environment lookup
 * and read-only afterwards.
 */
public final class QueueSettings {
  public static final String REDIS_URL = "REDIS_URL";
  public static final String QUEUE_JOB_ATTEMPTS = "QUEUE_JOB_ATTEMPTS";
  public static final String QUEUE_BACKOFF_DELAY_MS = "QUEUE_BACKOFF_DELAY_MS";
  public static final String DLQ_REPLAY_BATCH_SIZE = "DLQ_REPLAY_BATCH_SIZE";
  public static final String APP_ENV = "APP_ENV";

  public static final int DEFAULT_JOB_ATTEMPTS = 5;
  public static final int DEFAULT_BACKOFF_DELAY_MS = 2000;
  public static final int DEFAULT_REPLAY_BATCH_SIZE = 100;

  private final RunMode runMode;
  private final QueueConnection connection;
  private final int jobAttempts;
  private final int backoffDelayMs;
  private final int replayBatchSize;

  private QueueSettings(
      RunMode runMode,
      QueueConnection connection,
      int jobAttempts,
      int backoffDelayMs,
      int replayBatchSize) {
    this.runMode = runMode;
    this.connection = connection;
    this.jobAttempts = jobAttempts;
    this.backoffDelayMs = backoffDelayMs;
    this.replayBatchSize = replayBatchSize;
  }

  /**
   * Reads settings through {@code env}. In {@link RunMode#REAL} the connection URL is parsed
   * eagerly so a bad URL fails before any queue is opened; in {@link RunMode#STUB} it is optional.
   *
   * @throws QueueConfigurationException if the connection URL is required and invalid
   */
  public static QueueSettings from(Function<String, String> env) {
    RunMode mode = RunMode.fromEnvironment(env.apply(APP_ENV));
    String url = env.apply(REDIS_URL);

    QueueConnection connection = null;
    if (mode == RunMode.REAL || (url != null && !url.isBlank())) {
      connection = QueueConnection.parse(url);
    }

    return new QueueSettings(
        mode,
        connection,
        ConfigValues.positiveInt(
            QUEUE_JOB_ATTEMPTS, env.apply(QUEUE_JOB_ATTEMPTS), DEFAULT_JOB_ATTEMPTS),
        ConfigValues.positiveInt(
            QUEUE_BACKOFF_DELAY_MS, env.apply(QUEUE_BACKOFF_DELAY_MS), DEFAULT_BACKOFF_DELAY_MS),
        ConfigValues.atLeastOne(
            DLQ_REPLAY_BATCH_SIZE, env.apply(DLQ_REPLAY_BATCH_SIZE), DEFAULT_REPLAY_BATCH_SIZE));
  }

  public RunMode getRunMode() {
    return runMode;
  }

  /**
   * @throws QueueConfigurationException when running without a configured connection
   */
  public QueueConnection getConnection() {
    if (connection == null) {
      throw new QueueConfigurationException("Queue connection URL is not configured");
    }
    return connection;
  }

  public boolean hasConnection() {
    return connection != null;
  }

  public int getJobAttempts() {
    return jobAttempts;
  }

  public int getBackoffDelayMs() {
    return backoffDelayMs;
  }

  public int getReplayBatchSize() {
    return replayBatchSize;
  }

  @Override
  public String toString() {
    return "QueueSettings{runMode="
        + runMode
        + ", connection="
        + connection
        + ", jobAttempts="
        + jobAttempts
        + ", backoffDelayMs="
        + backoffDelayMs
        + ", replayBatchSize="
        + replayBatchSize
        + "}";
  }
}
