package com.acme.jobqueue.redis;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

import com.acme.jobqueue.core.QueueBackendException;
import com.acme.jobqueue.spi.HealthStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.redisson.api.RedissonClient;
import org.redisson.api.redisnode.RedisNodes;
import org.redisson.api.redisnode.RedisSingle;
import org.redisson.client.RedisConnectionException;

/** Unit tests for RedissonQueueBackend with a mocked client */
@ExtendWith(MockitoExtension.class)
class RedissonQueueBackendTest {

  @Mock private RedissonClient redisson;

  @Mock private RedisSingle single;

  @Test
  @DisplayName("ping should report PONG when the server answers")
  void testPingUp() {
    when(redisson.getRedisNodes(RedisNodes.SINGLE)).thenReturn(single);
    when(single.pingAll()).thenReturn(true);

    assertThat(new RedissonQueueBackend(redisson).ping()).isEqualTo(HealthStatus.up());
  }

  @Test
  @DisplayName("ping should report unhealthy when the server does not answer")
  void testPingDown() {
    when(redisson.getRedisNodes(RedisNodes.SINGLE)).thenReturn(single);
    when(single.pingAll()).thenReturn(false);

    assertThat(new RedissonQueueBackend(redisson).ping().healthy()).isFalse();
  }

  @Test
  @DisplayName("Redis errors should surface as backend exceptions")
  void testWrapsRedisErrors() {
    when(redisson.getRedisNodes(RedisNodes.SINGLE))
        .thenThrow(new RedisConnectionException("Unable to connect"));

    assertThatThrownBy(() -> new RedissonQueueBackend(redisson).ping())
        .isInstanceOf(QueueBackendException.class)
        .hasMessageContaining("ping")
        .hasCauseInstanceOf(RedisConnectionException.class);
  }

  @Test
  @DisplayName("close should shut the client down once")
  void testCloseShutsDownOnce() {
    when(redisson.isShutdown()).thenReturn(false, true);
    RedissonQueueBackend backend = new RedissonQueueBackend(redisson);

    backend.close();
    backend.close();

    verify(redisson, times(1)).shutdown();
  }
}
