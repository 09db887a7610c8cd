package com.acme.jobqueue.core;

/** Invalid startup configuration, such as an unparsable connection string. Always fatal. */
public class QueueConfigurationException extends RuntimeException {
  public QueueConfigurationException(String message) {
    super(message);
  }

  public QueueConfigurationException(String message, Throwable e) {
    super(message, e);
  }
}
