package com.acme.jobqueue.dlq;

import com.acme.jobqueue.core.Jsons;
import com.acme.jobqueue.job.JobOptions;
import com.acme.jobqueue.job.QueuedJob;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;

/** Reads and builds {@link DeadLetterPayload}s. */
public final class DeadLetterPayloads {

  private DeadLetterPayloads() {}

  /**
   * Parses dead-letter job data. Only a missing or empty {@code originalQueue} or {@code
   * originalJobName} makes the payload malformed. Stored options are carried as they are, including
   * values {@link JobOptions} does not model.
   */
  public static PayloadParseResult parse(JsonNode data) {
    if (data == null || !data.isObject()) {
      return new PayloadParseResult.Malformed("payload is not an object");
    }
    String queue = requiredText(data, "originalQueue");
    if (queue == null) {
      return new PayloadParseResult.Malformed("missing originalQueue");
    }
    String jobName = requiredText(data, "originalJobName");
    if (jobName == null) {
      return new PayloadParseResult.Malformed("missing originalJobName");
    }

    JsonNode rawOptions = data.get("originalOptions");
    JobOptions options = null;
    if (rawOptions != null && rawOptions.isObject()) {
      // values JobOptions cannot read are kept raw, never rejected
      options = Jsons.convert(rawOptions, JobOptions.class);
    }

    JsonNode originalData = data.get("originalData");
    return new PayloadParseResult.Valid(
        new DeadLetterPayload(
            queue,
            jobName,
            optionalId(data.get("originalJobId")),
            originalData != null ? originalData : NullNode.getInstance(),
            options));
  }

  /** Builds the dead-letter payload for a job that exhausted its attempts. */
  public static DeadLetterPayload of(QueuedJob failed) {
    return new DeadLetterPayload(
        failed.queueName(), failed.name(), failed.id(), failed.data(), failed.options());
  }

  private static String requiredText(JsonNode data, String field) {
    JsonNode node = data.get(field);
    if (node == null || !node.isTextual() || node.asText().isEmpty()) {
      return null;
    }
    return node.asText();
  }

  // ids may have been written as numbers
  private static String optionalId(JsonNode node) {
    if (node == null || node.isNull() || !node.isValueNode()) {
      return null;
    }
    String id = node.asText();
    return id.isEmpty() ? null : id;
  }
}
