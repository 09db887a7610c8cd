package com.acme.jobqueue.redis.config;

import static org.assertj.core.api.Assertions.*;

import com.acme.jobqueue.config.QueueSettings;
import com.acme.jobqueue.config.RunMode;
import com.acme.jobqueue.dlq.DeadLetterWriter;
import com.acme.jobqueue.producer.JobProducer;
import com.acme.jobqueue.queue.NoopQueueBackend;
import com.acme.jobqueue.queue.QueueHandle;
import com.acme.jobqueue.queue.QueueHandleFactory;
import com.acme.jobqueue.retry.RetryPolicyBuilder;
import com.acme.jobqueue.spi.QueueBackend;
import io.micronaut.context.ApplicationContext;
import io.micronaut.context.env.Environment;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/** Unit tests for QueueBeansFactory */
class QueueBeansFactoryTest {

  @Nested
  @DisplayName("Test Environment Tests")
  class TestEnvironmentTests {

    @Test
    @DisplayName("should wire the no-op backend and defaults in the test environment")
    void testStubWiring() {
      try (ApplicationContext ctx = ApplicationContext.run(Environment.TEST)) {
        QueueSettings settings = ctx.getBean(QueueSettings.class);

        assertThat(settings.getRunMode()).isEqualTo(RunMode.STUB);
        assertThat(ctx.getBean(QueueBackend.class)).isInstanceOf(NoopQueueBackend.class);
        assertThat(ctx.getBean(RetryPolicyBuilder.class).getAttempts()).isEqualTo(5);
        assertThat(ctx.getBean(JobProducer.class)).isNotNull();
        assertThat(ctx.getBean(DeadLetterWriter.class)).isNotNull();
      }
    }

    @Test
    @DisplayName("should read retry settings from properties")
    void testRetrySettingsFromProperties() {
      Map<String, Object> props =
          Map.of("queue.job.attempts", "3", "queue.backoff.delay.ms", "250");

      try (ApplicationContext ctx = ApplicationContext.run(props, Environment.TEST)) {
        RetryPolicyBuilder retry = ctx.getBean(RetryPolicyBuilder.class);

        assertThat(retry.getAttempts()).isEqualTo(3);
        assertThat(retry.getBackoffDelayMs()).isEqualTo(250);
      }
    }

    @Test
    @DisplayName("handles opened from the wired factory should accept jobs")
    void testHandleFactoryBean() {
      try (ApplicationContext ctx = ApplicationContext.run(Environment.TEST)) {
        QueueHandleFactory handles = ctx.getBean(QueueHandleFactory.class);

        try (QueueHandle queue = handles.open("stripe-events")) {
          assertThat(queue.enqueue("charge.succeeded", Map.of()).jobId()).startsWith("noop-");
          assertThat(queue.healthCheck().healthy()).isTrue();
        }
      }
    }
  }

  @Nested
  @DisplayName("Run Mode Tests")
  class RunModeTests {

    @Test
    @DisplayName("APP_ENV=test should select the no-op backend without a test environment")
    void testAppEnvSelectsStub() {
      try (ApplicationContext ctx =
          ApplicationContext.builder()
              .deduceEnvironment(false)
              .properties(Map.<String, Object>of("app.env", "test"))
              .start()) {

        assertThat(ctx.getEnvironment().getActiveNames()).doesNotContain(Environment.TEST);
        assertThat(ctx.getBean(QueueSettings.class).getRunMode()).isEqualTo(RunMode.STUB);
        assertThat(ctx.getBean(QueueBackend.class)).isInstanceOf(NoopQueueBackend.class);
      }
    }

    @Test
    @DisplayName("settings should report the real mode outside test when a URL is configured")
    void testRealModeSettings() {
      try (ApplicationContext ctx =
          ApplicationContext.builder()
              .deduceEnvironment(false)
              .properties(Map.<String, Object>of("redis.url", "redis://localhost:6390"))
              .start()) {

        QueueSettings settings = ctx.getBean(QueueSettings.class);

        assertThat(settings.getRunMode()).isEqualTo(RunMode.REAL);
        assertThat(settings.getConnection().getPort()).isEqualTo(6390);
      }
    }
  }

  @Test
  @DisplayName("should map environment keys to property names")
  void testToPropertyName() {
    assertThat(QueueBeansFactory.toPropertyName("DLQ_REPLAY_BATCH_SIZE"))
        .isEqualTo("dlq.replay.batch.size");
    assertThat(QueueBeansFactory.toPropertyName("REDIS_URL")).isEqualTo("redis.url");
  }
}
