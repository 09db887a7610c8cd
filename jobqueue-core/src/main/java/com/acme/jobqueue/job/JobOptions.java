package com.acme.jobqueue.job;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonSetter;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Options attached to a job when it is added to a queue. Every field is optional; a null field is
 * absent and omitted from JSON. Options this class does not model are kept in {@link #getExtra()}
 * and written back unchanged, so options read from a stored job survive a replay verbatim. The same
 * holds for a modelled option whose stored value this class cannot read, such as a custom backoff:
 * it is kept raw under its own name and the typed getter returns null.
 *
 * <p>Instances are immutable; use {@link #builder()} or {@link #toBuilder()}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class JobOptions {

  private String jobId;
  private Integer attempts;
  private Backoff backoff;
  private Retention removeOnComplete;
  private Retention removeOnFail;

  /** Milliseconds to wait before the job becomes eligible. */
  private Long delay;

  private Integer priority;

  private final Map<String, JsonNode> extra = new LinkedHashMap<>();

  private JobOptions() {}

  public static JobOptions empty() {
    return new JobOptions();
  }

  public static Builder builder() {
    return new Builder(new JobOptions());
  }

  public Builder toBuilder() {
    return new Builder(copy());
  }

  /** Returns a copy with the job identifier replaced. */
  public JobOptions withJobId(String newJobId) {
    return toBuilder().jobId(newJobId).build();
  }

  public String getJobId() {
    return jobId;
  }

  public Integer getAttempts() {
    return attempts;
  }

  public Backoff getBackoff() {
    return backoff;
  }

  public Retention getRemoveOnComplete() {
    return removeOnComplete;
  }

  public Retention getRemoveOnFail() {
    return removeOnFail;
  }

  public Long getDelay() {
    return delay;
  }

  public Integer getPriority() {
    return priority;
  }

  @JsonAnyGetter
  public Map<String, JsonNode> getExtra() {
    return Collections.unmodifiableMap(extra);
  }

  @JsonAnySetter
  private void putExtra(String name, JsonNode value) {
    extra.put(name, value);
  }

  @JsonSetter("jobId")
  private void readJobId(JsonNode node) {
    if (node.isTextual() || node.isNumber()) {
      jobId = node.asText();
    } else {
      extra.put("jobId", node);
    }
  }

  @JsonSetter("attempts")
  private void readAttempts(JsonNode node) {
    if (node.isInt() && node.intValue() >= 1) {
      attempts = node.intValue();
    } else {
      extra.put("attempts", node);
    }
  }

  @JsonSetter("backoff")
  private void readBackoff(JsonNode node) {
    try {
      backoff = Backoff.fromJson(node);
    } catch (IllegalArgumentException e) {
      extra.put("backoff", node);
    }
  }

  @JsonSetter("removeOnComplete")
  private void readRemoveOnComplete(JsonNode node) {
    try {
      removeOnComplete = Retention.fromNode(node);
    } catch (IllegalArgumentException e) {
      extra.put("removeOnComplete", node);
    }
  }

  @JsonSetter("removeOnFail")
  private void readRemoveOnFail(JsonNode node) {
    try {
      removeOnFail = Retention.fromNode(node);
    } catch (IllegalArgumentException e) {
      extra.put("removeOnFail", node);
    }
  }

  @JsonSetter("delay")
  private void readDelay(JsonNode node) {
    if (node.isIntegralNumber() && node.canConvertToLong()) {
      delay = node.longValue();
    } else {
      extra.put("delay", node);
    }
  }

  @JsonSetter("priority")
  private void readPriority(JsonNode node) {
    if (node.isInt()) {
      priority = node.intValue();
    } else {
      extra.put("priority", node);
    }
  }

  // A raw value and a typed value never share a name.
  private void clearTyped(String name) {
    switch (name) {
      case "jobId" -> jobId = null;
      case "attempts" -> attempts = null;
      case "backoff" -> backoff = null;
      case "removeOnComplete" -> removeOnComplete = null;
      case "removeOnFail" -> removeOnFail = null;
      case "delay" -> delay = null;
      case "priority" -> priority = null;
      default -> {
        // not a modelled option
      }
    }
  }

  private void dropRaw(String name, Object value) {
    if (value != null) {
      extra.remove(name);
    }
  }

  private JobOptions copy() {
    JobOptions c = new JobOptions();
    c.jobId = jobId;
    c.attempts = attempts;
    c.backoff = backoff;
    c.removeOnComplete = removeOnComplete;
    c.removeOnFail = removeOnFail;
    c.delay = delay;
    c.priority = priority;
    c.extra.putAll(extra);
    return c;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof JobOptions that)) {
      return false;
    }
    return Objects.equals(jobId, that.jobId)
        && Objects.equals(attempts, that.attempts)
        && Objects.equals(backoff, that.backoff)
        && Objects.equals(removeOnComplete, that.removeOnComplete)
        && Objects.equals(removeOnFail, that.removeOnFail)
        && Objects.equals(delay, that.delay)
        && Objects.equals(priority, that.priority)
        && extra.equals(that.extra);
  }

  @Override
  public int hashCode() {
    return Objects.hash(
        jobId, attempts, backoff, removeOnComplete, removeOnFail, delay, priority, extra);
  }

  @Override
  public String toString() {
    return "JobOptions{jobId="
        + jobId
        + ", attempts="
        + attempts
        + ", backoff="
        + backoff
        + ", removeOnComplete="
        + removeOnComplete
        + ", removeOnFail="
        + removeOnFail
        + ", delay="
        + delay
        + ", priority="
        + priority
        + (extra.isEmpty() ? "" : ", extra=" + extra.keySet())
        + "}";
  }

  public static final class Builder {
    private final JobOptions options;

    private Builder(JobOptions options) {
      this.options = options;
    }

    public Builder jobId(String jobId) {
      options.dropRaw("jobId", jobId);
      options.jobId = jobId;
      return this;
    }

    public Builder attempts(Integer attempts) {
      if (attempts != null && attempts < 1) {
        throw new IllegalArgumentException("attempts must be at least 1: " + attempts);
      }
      options.dropRaw("attempts", attempts);
      options.attempts = attempts;
      return this;
    }

    public Builder backoff(Backoff backoff) {
      options.dropRaw("backoff", backoff);
      options.backoff = backoff;
      return this;
    }

    public Builder removeOnComplete(Retention retention) {
      options.dropRaw("removeOnComplete", retention);
      options.removeOnComplete = retention;
      return this;
    }

    public Builder removeOnFail(Retention retention) {
      options.dropRaw("removeOnFail", retention);
      options.removeOnFail = retention;
      return this;
    }

    public Builder delay(Long delayMs) {
      options.dropRaw("delay", delayMs);
      options.delay = delayMs;
      return this;
    }

    public Builder priority(Integer priority) {
      options.dropRaw("priority", priority);
      options.priority = priority;
      return this;
    }

    /** Sets a raw option. A raw value replaces a typed option of the same name. */
    public Builder extra(String name, JsonNode value) {
      options.clearTyped(name);
      options.extra.put(name, value);
      return this;
    }

    public Builder extras(Map<String, JsonNode> values) {
      values.forEach(this::extra);
      return this;
    }

    public JobOptions build() {
      return options.copy();
    }
  }
}
