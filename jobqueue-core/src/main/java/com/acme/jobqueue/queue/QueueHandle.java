package com.acme.jobqueue.queue;

import com.acme.jobqueue.job.JobOptions;
import com.acme.jobqueue.job.JobReference;
import com.acme.jobqueue.job.JobState;
import com.acme.jobqueue.job.QueuedJob;
import com.acme.jobqueue.spi.HealthStatus;
import java.util.List;

/** A named queue bound to the process backend. Obtained from {@link QueueHandleFactory#open}. */
public interface QueueHandle extends AutoCloseable {

  String getName();

  default JobReference enqueue(String jobName, Object data) {
    return enqueue(jobName, data, null);
  }

  /**
   * Adds a job to this queue.
   *
   * @param data any value Jackson can serialize, or an existing JSON tree
   * @param options job options, or null for none
   */
  JobReference enqueue(String jobName, Object data, JobOptions options);

  List<QueuedJob> fetch(List<JobState> states, int offset, int limit);

  void remove(QueuedJob job);

  /** Checks the backend connection. Never throws; a failed check is reported as unhealthy. */
  HealthStatus healthCheck();

  /** Releases this handle. Calling it more than once has no further effect. */
  @Override
  void close();
}
