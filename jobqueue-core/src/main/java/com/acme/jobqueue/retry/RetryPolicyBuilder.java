package com.acme.jobqueue.retry;

import com.acme.jobqueue.config.QueueSettings;
import com.acme.jobqueue.job.Backoff;
import com.acme.jobqueue.job.JobOptions;
import com.acme.jobqueue.job.Retention;

/**
 * Builds the default {@link JobOptions} every producer applies: configured attempts with an
 * exponential backoff, the last 1000 completed jobs retained and failed jobs kept.
 *
 * <p>Overrides are explicit-wins: any field set on the overrides replaces the default for that
 * field; unset fields inherit the default.
 */
public class RetryPolicyBuilder {
  public static final int DEFAULT_RETAINED_COMPLETED = 1000;

  private final int attempts;
  private final long backoffDelayMs;

  public RetryPolicyBuilder(int attempts, long backoffDelayMs) {
    if (attempts < 1) {
      throw new IllegalArgumentException("attempts must be at least 1: " + attempts);
    }
    if (backoffDelayMs <= 0) {
      throw new IllegalArgumentException("backoff delay must be positive: " + backoffDelayMs);
    }
    this.attempts = attempts;
    this.backoffDelayMs = backoffDelayMs;
  }

  public static RetryPolicyBuilder fromSettings(QueueSettings settings) {
    return new RetryPolicyBuilder(settings.getJobAttempts(), settings.getBackoffDelayMs());
  }

  public JobOptions buildDefaultOptions() {
    return JobOptions.builder()
        .attempts(attempts)
        .backoff(Backoff.exponential(backoffDelayMs))
        .removeOnComplete(Retention.keepLast(DEFAULT_RETAINED_COMPLETED))
        .removeOnFail(Retention.keepAll())
        .build();
  }

  public JobOptions buildDefaultOptions(JobOptions overrides) {
    JobOptions defaults = buildDefaultOptions();
    if (overrides == null) {
      return defaults;
    }

    return JobOptions.builder()
        .jobId(overrides.getJobId())
        .attempts(pick(overrides.getAttempts(), defaults.getAttempts()))
        .backoff(pick(overrides.getBackoff(), defaults.getBackoff()))
        .removeOnComplete(pick(overrides.getRemoveOnComplete(), defaults.getRemoveOnComplete()))
        .removeOnFail(pick(overrides.getRemoveOnFail(), defaults.getRemoveOnFail()))
        .delay(overrides.getDelay())
        .priority(overrides.getPriority())
        .extras(overrides.getExtra())
        .build();
  }

  public int getAttempts() {
    return attempts;
  }

  public long getBackoffDelayMs() {
    return backoffDelayMs;
  }

  private static <T> T pick(T override, T fallback) {
    return override != null ? override : fallback;
  }
}
