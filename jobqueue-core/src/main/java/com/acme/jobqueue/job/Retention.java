package com.acme.jobqueue.job;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * How many finished job records the backend keeps. Serialized the way the queue service reads it:
 * {@code true} removes every record, {@code false} keeps all of them, a number keeps the most
 * recent n.
 */
public final class Retention {
  private static final Retention KEEP_ALL = new Retention(false, -1);
  private static final Retention REMOVE_ALL = new Retention(true, -1);

  private final boolean removeAll;
  private final int keepLast;

  private Retention(boolean removeAll, int keepLast) {
    this.removeAll = removeAll;
    this.keepLast = keepLast;
  }

  public static Retention keepAll() {
    return KEEP_ALL;
  }

  public static Retention removeAll() {
    return REMOVE_ALL;
  }

  public static Retention keepLast(int count) {
    if (count < 0) {
      throw new IllegalArgumentException("Retention count must not be negative: " + count);
    }
    return new Retention(false, count);
  }

  /** Reads a stored retention: a boolean, or a non-negative whole count. */
  @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
  static Retention fromNode(JsonNode node) {
    if (node.isBoolean()) {
      return node.booleanValue() ? REMOVE_ALL : KEEP_ALL;
    }
    if (node.isInt()) {
      return keepLast(node.intValue());
    }
    throw new IllegalArgumentException("Unsupported retention value: " + node);
  }

  @JsonValue
  Object toJson() {
    return keepLast >= 0 ? (Object) keepLast : (Object) removeAll;
  }

  public boolean isCount() {
    return keepLast >= 0;
  }

  public int getKeepLast() {
    return keepLast;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Retention that)) {
      return false;
    }
    return removeAll == that.removeAll && keepLast == that.keepLast;
  }

  @Override
  public int hashCode() {
    return 31 * Boolean.hashCode(removeAll) + keepLast;
  }

  @Override
  public String toString() {
    return String.valueOf(toJson());
  }
}
