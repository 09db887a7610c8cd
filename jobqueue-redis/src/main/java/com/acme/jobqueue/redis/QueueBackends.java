package com.acme.jobqueue.redis;

import com.acme.jobqueue.config.QueueSettings;
import com.acme.jobqueue.queue.NoopQueueBackend;
import com.acme.jobqueue.spi.QueueBackend;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Picks the backend variant for the configured run mode. */
public final class QueueBackends {
  private static final Logger LOG = LoggerFactory.getLogger(QueueBackends.class);

  private QueueBackends() {}

  public static QueueBackend create(QueueSettings settings) {
    return switch (settings.getRunMode()) {
      case STUB -> {
        LOG.info("Using no-op queue backend (test mode)");
        yield new NoopQueueBackend();
      }
      case REAL -> {
        LOG.info("Connecting queue backend to {}", settings.getConnection());
        yield new RedissonQueueBackend(RedissonClients.create(settings.getConnection()));
      }
    };
  }
}
