package com.acme.jobqueue.job;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.List;

/** Lifecycle state of a job as reported by the queue service. */
public enum JobState {
  WAITING("waiting"),
  DELAYED("delayed"),
  PRIORITIZED("prioritized"),
  ACTIVE("active"),
  COMPLETED("completed"),
  FAILED("failed");

  /** States of jobs no consumer has picked up yet, in fetch order. */
  public static final List<JobState> REPLAYABLE = List.of(WAITING, DELAYED, PRIORITIZED);

  private final String wireName;

  JobState(String wireName) {
    this.wireName = wireName;
  }

  @JsonValue
  public String wireName() {
    return wireName;
  }
}
