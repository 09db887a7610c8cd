package com.acme.jobqueue.dlq;

import java.util.List;

/** Naming of dead-letter queues. */
public final class DlqNames {
  public static final String SUFFIX = "-dlq";

  /** Scanned in this order when no queue is requested. */
  public static final List<String> DEFAULTS =
      List.of("stripe-events-dlq", "usage-rollups-dlq", "maintenance-jobs-dlq");

  private DlqNames() {}

  public static String forQueue(String queueName) {
    return queueName + SUFFIX;
  }

  /**
   * Returns {@code [requestedQueue + "-dlq"]}, or {@link #DEFAULTS} when no queue is requested. A
   * requested name is used exactly as given; only a null or blank name counts as not requested.
   */
  public static List<String> resolve(String requestedQueue) {
    if (requestedQueue == null || requestedQueue.isBlank()) {
      return DEFAULTS;
    }
    return List.of(forQueue(requestedQueue));
  }
}
