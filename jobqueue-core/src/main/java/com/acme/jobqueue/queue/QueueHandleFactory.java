package com.acme.jobqueue.queue;

import com.acme.jobqueue.core.QueueBackendException;
import com.acme.jobqueue.spi.HealthStatus;
import com.acme.jobqueue.spi.QueueBackend;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Opens queue handles against a single backend chosen when the factory is built. The factory does
 * not own the backend; whoever created the backend closes it.
 */
public class QueueHandleFactory {
  private static final Logger LOG = LoggerFactory.getLogger(QueueHandleFactory.class);

  private final QueueBackend backend;

  public QueueHandleFactory(QueueBackend backend) {
    this.backend = Objects.requireNonNull(backend, "backend");
  }

  public QueueHandle open(String name) {
    if (name == null || name.isBlank()) {
      throw new IllegalArgumentException("Queue name must not be blank");
    }
    LOG.debug("Opening queue handle {}", name);
    return new BackendQueueHandle(name, backend);
  }

  /** Checks the shared backend connection without opening a queue. */
  public HealthStatus healthCheck() {
    try {
      return backend.ping();
    } catch (QueueBackendException e) {
      LOG.warn("Queue backend health check failed: {}", e.getMessage());
      return HealthStatus.down(e.getMessage());
    }
  }
}
