package com.acme.jobqueue.job;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.Objects;

/**
 * Delay strategy between attempts of a failing job. Serialized as {@code {"type":..,"delay":..}};
 * a bare number is read as a fixed delay.
 */
public final class Backoff {
  public static final String EXPONENTIAL = "exponential";
  public static final String FIXED = "fixed";

  private final String type;
  private final long delay;

  private Backoff(String type, long delay) {
    if (delay <= 0) {
      throw new IllegalArgumentException("Backoff delay must be positive: " + delay);
    }
    this.type = Objects.requireNonNull(type, "type");
    this.delay = delay;
  }

  public static Backoff exponential(long initialDelayMs) {
    return new Backoff(EXPONENTIAL, initialDelayMs);
  }

  public static Backoff fixed(long delayMs) {
    return new Backoff(FIXED, delayMs);
  }

  /**
   * Reads a stored backoff. Only shapes this class writes back identically are accepted: a
   * positive whole number, or an object holding exactly a textual type and a positive whole delay.
   *
   * @throws IllegalArgumentException for any other value
   */
  @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
  static Backoff fromJson(JsonNode node) {
    if (node.isIntegralNumber() && node.canConvertToLong()) {
      return fixed(node.longValue());
    }
    if (node.isObject()
        && node.size() == 2
        && node.path("type").isTextual()
        && node.path("delay").isIntegralNumber()
        && node.path("delay").canConvertToLong()) {
      return new Backoff(node.get("type").textValue(), node.get("delay").longValue());
    }
    throw new IllegalArgumentException("Unsupported backoff value: " + node);
  }

  @JsonProperty("type")
  public String getType() {
    return type;
  }

  /** Initial delay in milliseconds. */
  @JsonProperty("delay")
  public long getDelay() {
    return delay;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Backoff that)) {
      return false;
    }
    return delay == that.delay && type.equals(that.type);
  }

  @Override
  public int hashCode() {
    return Objects.hash(type, delay);
  }

  @Override
  public String toString() {
    return type + "(" + delay + "ms)";
  }
}
