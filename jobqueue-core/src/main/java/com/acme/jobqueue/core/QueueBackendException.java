package com.acme.jobqueue.core;

/**
 * Backend failure while talking to the queue service (network, timeout, server error). Treated as
 * transient: it aborts the current operation but never the process configuration.
 */
public class QueueBackendException extends RuntimeException {
  public QueueBackendException(String message) {
    super(message);
  }

  public QueueBackendException(String message, Throwable e) {
    super(message, e);
  }
}
