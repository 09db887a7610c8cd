package com.acme.jobqueue.queue;

import static org.assertj.core.api.Assertions.*;

import com.acme.jobqueue.job.JobOptions;
import com.acme.jobqueue.job.JobReference;
import com.acme.jobqueue.job.JobState;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/** Unit tests for NoopQueueBackend */
class NoopQueueBackendTest {

  private final QueueHandleFactory factory = new QueueHandleFactory(new NoopQueueBackend());

  @Test
  @DisplayName("enqueue should return a reference without storing the job")
  void testEnqueue() {
    try (QueueHandle queue = factory.open("stripe-events")) {
      JobReference generated = queue.enqueue("p", "data");
      JobReference explicit = queue.enqueue("p", "data", JobOptions.builder().jobId("x").build());

      assertThat(generated.queueName()).isEqualTo("stripe-events");
      assertThat(generated.jobId()).startsWith("noop-");
      assertThat(explicit.jobId()).isEqualTo("x");
      assertThat(queue.fetch(JobState.REPLAYABLE, 0, 100)).isEmpty();
    }
  }

  @Test
  @DisplayName("health check should always report PONG")
  void testHealthCheck() {
    try (QueueHandle queue = factory.open("stripe-events")) {
      assertThat(queue.healthCheck().healthy()).isTrue();
      assertThat(queue.healthCheck().reply()).isEqualTo("PONG");
    }
    assertThat(factory.healthCheck().healthy()).isTrue();
  }
}
