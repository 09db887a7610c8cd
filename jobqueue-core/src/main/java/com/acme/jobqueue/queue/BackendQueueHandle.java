package com.acme.jobqueue.queue;

import com.acme.jobqueue.core.Jsons;
import com.acme.jobqueue.core.QueueBackendException;
import com.acme.jobqueue.job.JobOptions;
import com.acme.jobqueue.job.JobReference;
import com.acme.jobqueue.job.JobState;
import com.acme.jobqueue.job.QueuedJob;
import com.acme.jobqueue.spi.HealthStatus;
import com.acme.jobqueue.spi.QueueBackend;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

final class BackendQueueHandle implements QueueHandle {
  private static final Logger LOG = LoggerFactory.getLogger(BackendQueueHandle.class);

  private final String name;
  private final QueueBackend backend;
  private final AtomicBoolean closed = new AtomicBoolean();

  BackendQueueHandle(String name, QueueBackend backend) {
    this.name = name;
    this.backend = backend;
  }

  @Override
  public String getName() {
    return name;
  }

  @Override
  public JobReference enqueue(String jobName, Object data, JobOptions options) {
    ensureOpen();
    return backend.addJob(
        name, jobName, Jsons.toTree(data), options != null ? options : JobOptions.empty());
  }

  @Override
  public List<QueuedJob> fetch(List<JobState> states, int offset, int limit) {
    ensureOpen();
    return backend.fetchJobs(name, states, offset, limit);
  }

  @Override
  public void remove(QueuedJob job) {
    ensureOpen();
    if (!name.equals(job.queueName())) {
      throw new IllegalArgumentException(
          "Job " + job.id() + " belongs to queue " + job.queueName() + ", not " + name);
    }
    backend.removeJob(job.reference());
  }

  @Override
  public HealthStatus healthCheck() {
    try {
      return backend.ping();
    } catch (QueueBackendException e) {
      LOG.warn("Health check failed for queue {}: {}", name, e.getMessage());
      return HealthStatus.down(e.getMessage());
    }
  }

  @Override
  public void close() {
    if (closed.compareAndSet(false, true)) {
      backend.closeQueue(name);
      LOG.debug("Closed queue handle {}", name);
    }
  }

  boolean isClosed() {
    return closed.get();
  }

  private void ensureOpen() {
    if (closed.get()) {
      throw new IllegalStateException("Queue handle " + name + " is closed");
    }
  }

  @Override
  public String toString() {
    return "QueueHandle{" + name + (closed.get() ? ", closed" : "") + "}";
  }
}
