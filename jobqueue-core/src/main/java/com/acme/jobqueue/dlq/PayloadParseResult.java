package com.acme.jobqueue.dlq;

/** Outcome of reading a dead-letter job's data. */
public sealed interface PayloadParseResult {

  /** The data names a target queue and job name and can be replayed. */
  record Valid(DeadLetterPayload payload) implements PayloadParseResult {}

  /** The data cannot be replayed; the job stays in the dead-letter queue. */
  record Malformed(String reason) implements PayloadParseResult {}
}
