package com.acme.jobqueue.test;

import com.acme.jobqueue.core.QueueBackendException;
import com.acme.jobqueue.job.JobOptions;
import com.acme.jobqueue.job.JobReference;
import com.acme.jobqueue.job.JobState;
import com.acme.jobqueue.job.QueuedJob;
import com.acme.jobqueue.spi.HealthStatus;
import com.acme.jobqueue.spi.QueueBackend;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.BiPredicate;
import java.util.function.Predicate;

/** Queue backend kept in memory, with hooks to make adds or removals fail. */
public class InMemoryQueueBackend implements QueueBackend {

  private final Map<String, LinkedHashMap<String, QueuedJob>> queues = new HashMap<>();
  private final Map<String, Integer> closeCounts = new HashMap<>();
  private final List<String> operations = new ArrayList<>();
  private BiPredicate<String, String> failAdd = (queue, jobName) -> false;
  private BiPredicate<String, String> failRemove = (queue, jobId) -> false;
  private Predicate<String> failClose = queue -> false;
  private boolean failFetch;
  private long sequence;
  private boolean closed;

  /** Adds a waiting job without going through {@link #addJob}. */
  public QueuedJob seed(String queueName, String jobName, JsonNode data) {
    return seed(queueName, jobName, data, JobState.WAITING);
  }

  public QueuedJob seed(String queueName, String jobName, JsonNode data, JobState state) {
    String id = String.valueOf(++sequence);
    QueuedJob job =
        new QueuedJob(
            queueName, id, jobName, data, JobOptions.empty().withJobId(id), state, sequence);
    queue(queueName).put(id, job);
    return job;
  }

  public void failAddWhen(BiPredicate<String, String> queueAndJobName) {
    this.failAdd = queueAndJobName;
  }

  public void failRemoveWhen(BiPredicate<String, String> queueAndJobId) {
    this.failRemove = queueAndJobId;
  }

  public void failCloseWhen(Predicate<String> queue) {
    this.failClose = queue;
  }

  public void failFetch() {
    this.failFetch = true;
  }

  public List<QueuedJob> jobs(String queueName) {
    return List.copyOf(queue(queueName).values());
  }

  public int closeCount(String queueName) {
    return closeCounts.getOrDefault(queueName, 0);
  }

  public Map<String, Integer> closeCounts() {
    return Map.copyOf(closeCounts);
  }

  public List<String> operations() {
    return List.copyOf(operations);
  }

  public boolean isClosed() {
    return closed;
  }

  @Override
  public synchronized JobReference addJob(
      String queueName, String jobName, JsonNode data, JobOptions options) {
    operations.add("add:" + queueName + ":" + jobName);
    if (failAdd.test(queueName, jobName)) {
      throw new QueueBackendException("add rejected for " + jobName + " on " + queueName);
    }
    String id = options.getJobId() != null ? options.getJobId() : String.valueOf(++sequence);
    LinkedHashMap<String, QueuedJob> queue = queue(queueName);
    if (!queue.containsKey(id)) {
      boolean delayed = options.getDelay() != null && options.getDelay() > 0;
      JobState state = delayed ? JobState.DELAYED : JobState.WAITING;
      queue.put(
          id,
          new QueuedJob(queueName, id, jobName, data, options.withJobId(id), state, ++sequence));
    }
    return new JobReference(queueName, id);
  }

  @Override
  public synchronized List<QueuedJob> fetchJobs(
      String queueName, List<JobState> states, int offset, int limit) {
    operations.add("fetch:" + queueName);
    if (failFetch) {
      throw new QueueBackendException("fetch failed for " + queueName);
    }
    List<QueuedJob> matching = new ArrayList<>();
    for (JobState state : states) {
      for (QueuedJob job : queue(queueName).values()) {
        if (job.state() == state) {
          matching.add(job);
        }
      }
    }
    int from = Math.min(offset, matching.size());
    int to = Math.min(from + limit, matching.size());
    return List.copyOf(matching.subList(from, to));
  }

  @Override
  public synchronized void removeJob(JobReference job) {
    operations.add("remove:" + job.queueName() + ":" + job.jobId());
    if (failRemove.test(job.queueName(), job.jobId())) {
      throw new QueueBackendException("remove failed for " + job.jobId());
    }
    queue(job.queueName()).remove(job.jobId());
  }

  @Override
  public synchronized void closeQueue(String queueName) {
    closeCounts.merge(queueName, 1, Integer::sum);
    if (failClose.test(queueName)) {
      throw new QueueBackendException("close failed for " + queueName);
    }
  }

  @Override
  public HealthStatus ping() {
    return HealthStatus.up();
  }

  @Override
  public void close() {
    closed = true;
  }

  private LinkedHashMap<String, QueuedJob> queue(String queueName) {
    return queues.computeIfAbsent(queueName, name -> new LinkedHashMap<>());
  }
}
