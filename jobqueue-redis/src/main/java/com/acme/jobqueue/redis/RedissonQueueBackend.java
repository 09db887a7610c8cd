package com.acme.jobqueue.redis;

import com.acme.jobqueue.core.QueueBackendException;
import com.acme.jobqueue.job.JobOptions;
import com.acme.jobqueue.job.JobReference;
import com.acme.jobqueue.job.JobState;
import com.acme.jobqueue.job.QueuedJob;
import com.acme.jobqueue.spi.HealthStatus;
import com.acme.jobqueue.spi.QueueBackend;
import com.fasterxml.jackson.databind.JsonNode;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;
import org.redisson.api.RedissonClient;
import org.redisson.api.redisnode.RedisNodes;
import org.redisson.client.RedisException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link QueueBackend} on a shared Redisson client. One {@link RedisJobQueue} binding is kept per
 * queue name until the queue is closed. Redis failures surface as {@link QueueBackendException}.
 */
public class RedissonQueueBackend implements QueueBackend {
  private static final Logger LOG = LoggerFactory.getLogger(RedissonQueueBackend.class);

  private final RedissonClient redisson;
  private final Clock clock;
  private final Map<String, RedisJobQueue> bindings = new ConcurrentHashMap<>();

  public RedissonQueueBackend(RedissonClient redisson) {
    this(redisson, Clock.systemUTC());
  }

  RedissonQueueBackend(RedissonClient redisson, Clock clock) {
    this.redisson = redisson;
    this.clock = clock;
  }

  @Override
  public JobReference addJob(String queueName, String jobName, JsonNode data, JobOptions options) {
    return call(
        "add job " + jobName + " to " + queueName,
        () -> binding(queueName).add(jobName, data, options));
  }

  @Override
  public List<QueuedJob> fetchJobs(String queueName, List<JobState> states, int offset, int limit) {
    return call(
        "fetch jobs from " + queueName, () -> binding(queueName).fetch(states, offset, limit));
  }

  @Override
  public void removeJob(JobReference job) {
    call(
        "remove job " + job.jobId() + " from " + job.queueName(),
        () -> {
          binding(job.queueName()).remove(job.jobId());
          return null;
        });
  }

  @Override
  public void closeQueue(String queueName) {
    if (bindings.remove(queueName) != null) {
      LOG.debug("Released Redis binding for queue {}", queueName);
    }
  }

  @Override
  public HealthStatus ping() {
    boolean alive = call("ping", () -> redisson.getRedisNodes(RedisNodes.SINGLE).pingAll());
    return alive ? HealthStatus.up() : HealthStatus.down("Redis did not answer PING");
  }

  @Override
  public void close() {
    bindings.clear();
    if (!redisson.isShutdown()) {
      redisson.shutdown();
      LOG.info("Redis connection closed");
    }
  }

  int openBindings() {
    return bindings.size();
  }

  private RedisJobQueue binding(String queueName) {
    return bindings.computeIfAbsent(queueName, name -> new RedisJobQueue(redisson, name, clock));
  }

  private static <T> T call(String operation, Supplier<T> action) {
    try {
      return action.get();
    } catch (RedisException e) {
      throw new QueueBackendException("Failed to " + operation + ": " + e.getMessage(), e);
    }
  }
}
