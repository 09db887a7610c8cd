package com.acme.jobqueue.cli.config;

import com.acme.jobqueue.config.QueueSettings;
import com.acme.jobqueue.config.RunMode;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class CliConfigurationTest {

    @Test
    void testGetInstance_returnsSingleton() {
        CliConfiguration instance1 = CliConfiguration.getInstance();
        CliConfiguration instance2 = CliConfiguration.getInstance();

        assertThat(instance1).isSameAs(instance2);
    }

    @Test
    void testGet_treatsBlankAsMissing() {
        Map<String, String> env = new HashMap<>();
        env.put("REDIS_URL", "   ");
        CliConfiguration config = new CliConfiguration(env::get);

        assertThat(config.get("REDIS_URL")).isNull();
        assertThat(config.get("QUEUE_JOB_ATTEMPTS")).isNull();
    }

    @Test
    void testGetQueueSettings_readsValues() {
        Map<String, String> env = Map.of(
                "REDIS_URL", "redis://cache:6380",
                "QUEUE_JOB_ATTEMPTS", "7",
                "DLQ_REPLAY_BATCH_SIZE", "-4");
        CliConfiguration config = new CliConfiguration(env::get);

        QueueSettings settings = config.getQueueSettings();

        assertThat(settings.getRunMode()).isEqualTo(RunMode.REAL);
        assertThat(settings.getConnection().getPort()).isEqualTo(6380);
        assertThat(settings.getJobAttempts()).isEqualTo(7);
        assertThat(settings.getBackoffDelayMs()).isEqualTo(2000);
        assertThat(settings.getReplayBatchSize()).isEqualTo(1);
    }

    @Test
    void testGetQueueSettings_parsedOnce() {
        Map<String, String> env = new HashMap<>(Map.of("APP_ENV", "test"));
        CliConfiguration config = new CliConfiguration(env::get);

        QueueSettings first = config.getQueueSettings();
        env.put("QUEUE_JOB_ATTEMPTS", "9");

        assertThat(config.getQueueSettings()).isSameAs(first);
    }
}
