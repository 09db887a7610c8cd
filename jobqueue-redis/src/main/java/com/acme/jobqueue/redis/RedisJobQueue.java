package com.acme.jobqueue.redis;

import com.acme.jobqueue.core.Jsons;
import com.acme.jobqueue.job.JobOptions;
import com.acme.jobqueue.job.JobReference;
import com.acme.jobqueue.job.JobState;
import com.acme.jobqueue.job.QueuedJob;
import com.fasterxml.jackson.databind.JsonNode;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import org.redisson.api.RAtomicLong;
import org.redisson.api.RList;
import org.redisson.api.RMap;
import org.redisson.api.RScoredSortedSet;
import org.redisson.api.RedissonClient;
import org.redisson.client.codec.StringCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Redis binding of one queue. Producer-side states only: jobs are added as waiting, delayed or
 * prioritized; consumers moving them further are outside this library.
 */
class RedisJobQueue {
  private static final Logger LOG = LoggerFactory.getLogger(RedisJobQueue.class);

  // priorities are below 2^21, so priority * 2^32 + sequence stays exact in a double score
  private static final long PRIORITY_SCALE = 1L << 32;

  private final String name;
  private final Clock clock;
  private final RMap<String, String> jobs;
  private final RList<String> waiting;
  private final RScoredSortedSet<String> delayed;
  private final RScoredSortedSet<String> prioritized;
  private final RAtomicLong idCounter;
  private final RAtomicLong priorityCounter;

  RedisJobQueue(RedissonClient redisson, String name, Clock clock) {
    RedisKeys keys = new RedisKeys(name);
    this.name = name;
    this.clock = clock;
    this.jobs = redisson.getMap(keys.jobs(), StringCodec.INSTANCE);
    this.waiting = redisson.getList(keys.waiting(), StringCodec.INSTANCE);
    this.delayed = redisson.getScoredSortedSet(keys.delayed(), StringCodec.INSTANCE);
    this.prioritized = redisson.getScoredSortedSet(keys.prioritized(), StringCodec.INSTANCE);
    this.idCounter = redisson.getAtomicLong(keys.idCounter());
    this.priorityCounter = redisson.getAtomicLong(keys.priorityCounter());
  }

  JobReference add(String jobName, JsonNode data, JobOptions options) {
    long now = clock.millis();
    String id = options.getJobId();
    if (id == null) {
      id = String.valueOf(idCounter.incrementAndGet());
    }
    StoredJob record = new StoredJob(id, jobName, data, options.withJobId(id), now);

    if (!jobs.fastPutIfAbsent(id, Jsons.toJson(record))) {
      LOG.debug("Job {} already exists in {}, keeping the existing job", id, name);
      return new JobReference(name, id);
    }

    Long delay = options.getDelay();
    Integer priority = options.getPriority();
    if (delay != null && delay > 0) {
      delayed.add(now + delay, id);
    } else if (priority != null && priority > 0) {
      long seq = priorityCounter.incrementAndGet() % PRIORITY_SCALE;
      prioritized.add((double) (priority * PRIORITY_SCALE + seq), id);
    } else {
      waiting.add(id);
    }
    return new JobReference(name, id);
  }

  List<QueuedJob> fetch(List<JobState> states, int offset, int limit) {
    Map<String, JobState> ids = new LinkedHashMap<>();
    int skip = Math.max(0, offset);
    int remaining = limit;

    for (JobState state : new LinkedHashSet<>(states)) {
      if (remaining <= 0) {
        break;
      }
      int size = sizeOf(state);
      if (skip >= size) {
        skip -= size;
        continue;
      }
      int from = skip;
      int to = Math.min(size, skip + remaining) - 1;
      for (String id : range(state, from, to)) {
        ids.putIfAbsent(id, state);
      }
      remaining -= to - from + 1;
      skip = 0;
    }

    if (ids.isEmpty()) {
      return List.of();
    }
    Map<String, String> records = jobs.getAll(ids.keySet());
    List<QueuedJob> result = new ArrayList<>(ids.size());
    ids.forEach(
        (id, state) -> {
          String json = records.get(id);
          // removed between the index read and the record read
          if (json != null) {
            result.add(toQueuedJob(Jsons.fromJson(json, StoredJob.class), state));
          }
        });
    return result;
  }

  void remove(String id) {
    waiting.remove(id);
    delayed.remove(id);
    prioritized.remove(id);
    jobs.fastRemove(id);
  }

  private int sizeOf(JobState state) {
    return switch (state) {
      case WAITING -> waiting.size();
      case DELAYED -> delayed.size();
      case PRIORITIZED -> prioritized.size();
      default -> 0;
    };
  }

  private Collection<String> range(JobState state, int from, int to) {
    return switch (state) {
      case WAITING -> waiting.range(from, to);
      case DELAYED -> delayed.valueRange(from, to);
      case PRIORITIZED -> prioritized.valueRange(from, to);
      default -> List.of();
    };
  }

  private QueuedJob toQueuedJob(StoredJob stored, JobState state) {
    return new QueuedJob(
        name,
        stored.id(),
        stored.name(),
        stored.data(),
        stored.opts() != null ? stored.opts() : JobOptions.empty(),
        state,
        stored.timestamp());
  }
}
