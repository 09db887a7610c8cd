package com.acme.jobqueue.cli.config;

import com.acme.jobqueue.config.QueueSettings;
import io.github.cdimascio.dotenv.Dotenv;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Configuration for the CLI: process environment variables, with a {@code .env} file in the
 * working directory as fallback.
 */
public class CliConfiguration {
    private static final Logger logger = LoggerFactory.getLogger(CliConfiguration.class);
    private static CliConfiguration instance;

    private final Function<String, String> lookup;
    private QueueSettings queueSettings;

    CliConfiguration(Function<String, String> lookup) {
        this.lookup = lookup;
    }

    public static synchronized CliConfiguration getInstance() {
        if (instance == null) {
            Dotenv dotenv = Dotenv.configure()
                    .ignoreIfMissing()
                    .ignoreIfMalformed()
                    .load();
            logger.debug("Configuration loaded from environment and .env");
            instance = new CliConfiguration(dotenv::get);
        }
        return instance;
    }

    public String get(String key) {
        String value = lookup.apply(key);
        return value == null || value.isBlank() ? null : value;
    }

    /**
     * Parsed once per process.
     *
     * @throws com.acme.jobqueue.core.QueueConfigurationException if REDIS_URL is missing or invalid
     */
    public synchronized QueueSettings getQueueSettings() {
        if (queueSettings == null) {
            queueSettings = QueueSettings.from(this::get);
            logger.debug("Effective queue settings: {}", queueSettings);
        }
        return queueSettings;
    }
}
