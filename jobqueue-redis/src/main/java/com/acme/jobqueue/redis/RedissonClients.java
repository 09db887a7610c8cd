package com.acme.jobqueue.redis;

import com.acme.jobqueue.config.QueueConnection;
import com.acme.jobqueue.core.QueueBackendException;
import org.redisson.Redisson;
import org.redisson.api.RedissonClient;
import org.redisson.client.RedisException;
import org.redisson.client.codec.StringCodec;
import org.redisson.config.Config;
import org.redisson.config.SingleServerConfig;

/** Builds the single Redisson client a process shares across all of its queues. */
public final class RedissonClients {

  private RedissonClients() {}

  public static Config config(QueueConnection connection) {
    Config config = new Config();
    config.setCodec(StringCodec.INSTANCE);
    SingleServerConfig server = config.useSingleServer().setAddress(connection.toAddress());
    connection.getCredential().ifPresent(server::setPassword);
    return config;
  }

  /**
   * Connects to the server described by {@code connection}.
   *
   * @throws QueueBackendException if the server cannot be reached
   */
  public static RedissonClient create(QueueConnection connection) {
    try {
      return Redisson.create(config(connection));
    } catch (RedisException e) {
      throw new QueueBackendException("Cannot connect to " + connection + ": " + e.getMessage(), e);
    }
  }
}
