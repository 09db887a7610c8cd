package com.acme.jobqueue.dlq;

import com.acme.jobqueue.job.JobOptions;
import com.acme.jobqueue.job.JobReference;
import com.acme.jobqueue.job.QueuedJob;
import com.acme.jobqueue.queue.QueueHandle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parks jobs that exhausted their attempts in their queue's dead-letter queue, in the payload
 * shape {@link DlqReplayer} reads back.
 */
public class DeadLetterWriter {
  private static final Logger LOG = LoggerFactory.getLogger(DeadLetterWriter.class);

  static final String ID_PREFIX = "dlq:";

  /**
   * Adds {@code failed} to {@code dlq}. The dead-letter job id is derived from the failed job, so
   * parking the same failure twice leaves one entry.
   *
   * @throws IllegalArgumentException if {@code dlq} is not the dead-letter queue of the job's queue
   */
  public JobReference park(QueueHandle dlq, QueuedJob failed, String reason) {
    String expected = DlqNames.forQueue(failed.queueName());
    if (!expected.equals(dlq.getName())) {
      throw new IllegalArgumentException(
          "Job from "
              + failed.queueName()
              + " must be parked in "
              + expected
              + ", not "
              + dlq.getName());
    }

    JobOptions options =
        JobOptions.builder().jobId(ID_PREFIX + failed.queueName() + ":" + failed.id()).build();
    JobReference ref = dlq.enqueue(failed.name(), DeadLetterPayloads.of(failed), options);
    LOG.warn(
        "Parked job {} ({}) from {} in {}: {}",
        failed.id(),
        failed.name(),
        failed.queueName(),
        dlq.getName(),
        reason);
    return ref;
  }
}
