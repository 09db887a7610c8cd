package com.acme.jobqueue.dlq;

import java.util.List;

/** Outcome of one {@link DlqReplayer#replay} run. */
public sealed interface ReplayResult {

  /** Number of jobs moved back before the run ended. */
  int replayed();

  /** Every dead-letter queue was drained without a backend error. */
  record Completed(int replayed, List<String> dlqNames) implements ReplayResult {
    public Completed {
      dlqNames = List.copyOf(dlqNames);
    }
  }

  /**
   * The run stopped at a backend error. Jobs replayed before the error stay replayed; the failing
   * job and everything after it were left in place.
   *
   * @param dlqName the dead-letter queue being drained when the error occurred
   */
  record Failed(RuntimeException cause, String dlqName, int replayed) implements ReplayResult {
    public String message() {
      return cause.getMessage() != null ? cause.getMessage() : cause.toString();
    }
  }
}
