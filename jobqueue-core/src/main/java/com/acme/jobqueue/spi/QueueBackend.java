package com.acme.jobqueue.spi;

import com.acme.jobqueue.core.QueueBackendException;
import com.acme.jobqueue.job.JobOptions;
import com.acme.jobqueue.job.JobReference;
import com.acme.jobqueue.job.JobState;
import com.acme.jobqueue.job.QueuedJob;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;

/**
 * The durable queue service this library sits on. Implementations own the connection; the
 * process creating a backend closes it once all queue handles are closed.
 *
 * <p>Every operation may throw {@link QueueBackendException} on a backend failure.
 */
public interface QueueBackend extends AutoCloseable {

  /**
   * Adds a job. When {@code options} carries a job id that already exists in the queue, the
   * existing job is kept and its reference returned.
   */
  JobReference addJob(String queueName, String jobName, JsonNode data, JobOptions options);

  /**
   * Lists jobs in the given states, states in the given order and oldest first within a state.
   *
   * @param offset number of matching jobs to skip
   * @param limit maximum number of jobs returned
   */
  List<QueuedJob> fetchJobs(String queueName, List<JobState> states, int offset, int limit);

  /** Removes a job; removing a job that no longer exists is not an error. */
  void removeJob(JobReference job);

  /** Releases resources bound to one queue. The backend itself stays usable. */
  void closeQueue(String queueName);

  HealthStatus ping();

  /** Releases the backend connection. */
  @Override
  void close();
}
