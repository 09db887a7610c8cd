package com.acme.jobqueue.producer;

import com.acme.jobqueue.job.JobOptions;
import com.acme.jobqueue.job.JobReference;
import com.acme.jobqueue.queue.QueueHandle;
import com.acme.jobqueue.retry.RetryPolicyBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Adds jobs with the process-wide retry defaults applied. */
public class JobProducer {
  private static final Logger LOG = LoggerFactory.getLogger(JobProducer.class);

  private final RetryPolicyBuilder retryPolicy;

  public JobProducer(RetryPolicyBuilder retryPolicy) {
    this.retryPolicy = retryPolicy;
  }

  public JobReference enqueue(QueueHandle queue, String jobName, Object data) {
    return enqueue(queue, jobName, data, null);
  }

  /**
   * Adds a job whose options are the retry defaults merged with {@code overrides}.
   *
   * @param overrides per-call options, or null to use the defaults as-is
   */
  public JobReference enqueue(
      QueueHandle queue, String jobName, Object data, JobOptions overrides) {
    JobOptions options = retryPolicy.buildDefaultOptions(overrides);
    JobReference ref = queue.enqueue(jobName, data, options);
    LOG.debug(
        "Enqueued job {} ({}) on {} with attempts={} backoff={}",
        ref.jobId(),
        jobName,
        queue.getName(),
        options.getAttempts(),
        options.getBackoff());
    return ref;
  }
}
