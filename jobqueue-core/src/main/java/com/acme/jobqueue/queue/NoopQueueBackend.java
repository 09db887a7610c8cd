package com.acme.jobqueue.queue;

import com.acme.jobqueue.job.JobOptions;
import com.acme.jobqueue.job.JobReference;
import com.acme.jobqueue.job.JobState;
import com.acme.jobqueue.job.QueuedJob;
import com.acme.jobqueue.spi.HealthStatus;
import com.acme.jobqueue.spi.QueueBackend;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Stub backend for the test run mode: accepts jobs without storing them, holds no jobs, and
 * always reports healthy. Lets producers and tools run without a live queue service.
 */
public final class NoopQueueBackend implements QueueBackend {
  private static final Logger LOG = LoggerFactory.getLogger(NoopQueueBackend.class);

  private final AtomicLong sequence = new AtomicLong();

  @Override
  public JobReference addJob(String queueName, String jobName, JsonNode data, JobOptions options) {
    String jobId =
        options.getJobId() != null ? options.getJobId() : "noop-" + sequence.incrementAndGet();
    LOG.debug("Discarding job {} ({}) for queue {}", jobId, jobName, queueName);
    return new JobReference(queueName, jobId);
  }

  @Override
  public List<QueuedJob> fetchJobs(String queueName, List<JobState> states, int offset, int limit) {
    return List.of();
  }

  @Override
  public void removeJob(JobReference job) {}

  @Override
  public void closeQueue(String queueName) {}

  @Override
  public HealthStatus ping() {
    return HealthStatus.up();
  }

  @Override
  public void close() {}
}
