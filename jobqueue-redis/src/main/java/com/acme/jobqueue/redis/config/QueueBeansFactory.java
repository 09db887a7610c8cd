package com.acme.jobqueue.redis.config;

import com.acme.jobqueue.config.QueueSettings;
import com.acme.jobqueue.config.RunMode;
import com.acme.jobqueue.dlq.DeadLetterWriter;
import com.acme.jobqueue.producer.JobProducer;
import com.acme.jobqueue.queue.QueueHandleFactory;
import com.acme.jobqueue.redis.QueueBackends;
import com.acme.jobqueue.retry.RetryPolicyBuilder;
import com.acme.jobqueue.spi.QueueBackend;
import io.micronaut.context.annotation.Bean;
import io.micronaut.context.annotation.Factory;
import io.micronaut.context.env.Environment;
import jakarta.inject.Singleton;
import java.util.Locale;

/**
 * Wires the framework-free queue components into Micronaut. Settings are read from the
 * environment's property sources, so {@code REDIS_URL} and {@code redis.url} are equivalent. An
 * active {@code test} environment counts as {@code APP_ENV=test}.
 */
@Factory
public class QueueBeansFactory {

  @Singleton
  public QueueSettings queueSettings(Environment environment) {
    boolean testEnv = environment.getActiveNames().contains(Environment.TEST);
    return QueueSettings.from(
        key -> {
          if (testEnv && QueueSettings.APP_ENV.equals(key)) {
            return RunMode.TEST_ENVIRONMENT;
          }
          return environment.getProperty(toPropertyName(key), String.class).orElse(null);
        });
  }

  /** Chosen from {@link QueueSettings#getRunMode()} alone; see {@link QueueBackends}. */
  @Singleton
  @Bean(preDestroy = "close")
  public QueueBackend queueBackend(QueueSettings settings) {
    return QueueBackends.create(settings);
  }

  @Singleton
  public QueueHandleFactory queueHandleFactory(QueueBackend backend) {
    return new QueueHandleFactory(backend);
  }

  @Singleton
  public RetryPolicyBuilder retryPolicyBuilder(QueueSettings settings) {
    return RetryPolicyBuilder.fromSettings(settings);
  }

  @Singleton
  public JobProducer jobProducer(RetryPolicyBuilder retryPolicyBuilder) {
    return new JobProducer(retryPolicyBuilder);
  }

  @Singleton
  public DeadLetterWriter deadLetterWriter() {
    return new DeadLetterWriter();
  }

  static String toPropertyName(String envKey) {
    return envKey.toLowerCase(Locale.ROOT).replace('_', '.');
  }
}
