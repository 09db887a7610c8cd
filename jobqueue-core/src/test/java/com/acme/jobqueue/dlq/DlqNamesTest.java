package com.acme.jobqueue.dlq;

import static org.assertj.core.api.Assertions.*;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/** Unit tests for DlqNames */
class DlqNamesTest {

  @Test
  @DisplayName("should scan the default dead-letter queues in fixed order")
  void testDefaults() {
    assertThat(DlqNames.resolve(null))
        .containsExactly("stripe-events-dlq", "usage-rollups-dlq", "maintenance-jobs-dlq");
    assertThat(DlqNames.resolve("  ")).isEqualTo(DlqNames.DEFAULTS);
  }

  @Test
  @DisplayName("should target only the requested queue's dead-letter queue")
  void testRequestedQueue() {
    assertThat(DlqNames.resolve("stripe-events")).containsExactly("stripe-events-dlq");
    assertThat(DlqNames.resolve("billing")).containsExactly("billing-dlq");
  }

  @Test
  @DisplayName("should use the requested name exactly as given")
  void testRequestedNameVerbatim() {
    assertThat(DlqNames.resolve(" billing ")).containsExactly(" billing -dlq");
  }
}
