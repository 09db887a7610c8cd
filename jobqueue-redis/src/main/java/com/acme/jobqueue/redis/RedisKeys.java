package com.acme.jobqueue.redis;

/**
 * Key layout of one queue. The queue name is wrapped in a hash tag so all keys of a queue land in
 * the same cluster slot.
 *
 * <pre>
 * jq:{name}:jobs         HASH  jobId -> job record JSON
 * jq:{name}:wait         LIST  jobIds, oldest first
 * jq:{name}:delayed      ZSET  jobIds scored by the time they become eligible
 * jq:{name}:prioritized  ZSET  jobIds scored by priority, then insertion order
 * jq:{name}:id           STRING counter for generated job ids
 * jq:{name}:pc           STRING counter ordering jobs of equal priority
 * </pre>
 */
final class RedisKeys {
  private static final String PREFIX = "jq:";

  private final String base;

  RedisKeys(String queueName) {
    this.base = PREFIX + "{" + queueName + "}:";
  }

  String jobs() {
    return base + "jobs";
  }

  String waiting() {
    return base + "wait";
  }

  String delayed() {
    return base + "delayed";
  }

  String prioritized() {
    return base + "prioritized";
  }

  String idCounter() {
    return base + "id";
  }

  String priorityCounter() {
    return base + "pc";
  }
}
