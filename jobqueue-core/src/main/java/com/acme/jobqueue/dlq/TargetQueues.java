package com.acme.jobqueue.dlq;

import com.acme.jobqueue.queue.QueueHandle;
import com.acme.jobqueue.queue.QueueHandleFactory;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Handles to replay target queues, opened on first use and closed together. Confined to a single
 * replay run, so not thread-safe.
 */
final class TargetQueues implements AutoCloseable {
  private static final Logger LOG = LoggerFactory.getLogger(TargetQueues.class);

  private final QueueHandleFactory handles;
  private final Executor closeExecutor;
  private final Map<String, QueueHandle> opened = new LinkedHashMap<>();
  private final List<Throwable> closeFailures = new ArrayList<>();
  private RuntimeException runFailure;

  TargetQueues(QueueHandleFactory handles, Executor closeExecutor) {
    this.handles = handles;
    this.closeExecutor = closeExecutor;
  }

  QueueHandle get(String queueName) {
    return opened.computeIfAbsent(queueName, handles::open);
  }

  int size() {
    return opened.size();
  }

  /** Close failures are added to {@code failure} as suppressed exceptions. */
  void failedWith(RuntimeException failure) {
    this.runFailure = failure;
  }

  synchronized List<Throwable> closeFailures() {
    return List.copyOf(closeFailures);
  }

  /** Closes every opened handle concurrently. Never throws; close failures are logged. */
  @Override
  public void close() {
    List<CompletableFuture<Void>> closing = new ArrayList<>(opened.size());
    for (QueueHandle handle : opened.values()) {
      closing.add(
          CompletableFuture.runAsync(handle::close, closeExecutor)
              .exceptionally(
                  e -> {
                    recordCloseFailure(handle, e);
                    return null;
                  }));
    }
    CompletableFuture.allOf(closing.toArray(CompletableFuture[]::new)).join();
    LOG.debug("Closed {} target queue handle(s)", opened.size());
    opened.clear();
  }

  private synchronized void recordCloseFailure(QueueHandle handle, Throwable e) {
    Throwable cause = e instanceof CompletionException && e.getCause() != null ? e.getCause() : e;
    LOG.warn("Failed to close queue handle {}: {}", handle.getName(), cause.getMessage());
    closeFailures.add(cause);
    if (runFailure != null) {
      runFailure.addSuppressed(cause);
    }
  }
}
