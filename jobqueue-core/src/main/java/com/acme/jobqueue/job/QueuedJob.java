package com.acme.jobqueue.job;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * A job as read back from a queue.
 *
 * @param data the job payload, opaque to this library
 * @param options the options the job was added with, never null
 * @param timestamp enqueue time in epoch milliseconds
 */
public record QueuedJob(
    String queueName,
    String id,
    String name,
    JsonNode data,
    JobOptions options,
    JobState state,
    long timestamp) {

  public JobReference reference() {
    return new JobReference(queueName, id);
  }
}
