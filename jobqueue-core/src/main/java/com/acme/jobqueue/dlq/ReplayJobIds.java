package com.acme.jobqueue.dlq;

import java.security.SecureRandom;
import java.time.Clock;
import java.util.Random;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Issues job ids for replayed jobs: {@code <originalJobId>:dlq-replay:<ts>}, or {@code
 * dlq-replay:<ts>:<random>} when the original id is unknown. The timestamp part strictly increases
 * across ids from one generator, so replays of the same original job never share an id.
 */
public class ReplayJobIds {
  static final String MARKER = "dlq-replay";
  private static final int SUFFIX_LENGTH = 8;

  private final Clock clock;
  private final Random random;
  private final AtomicLong lastIssued = new AtomicLong(Long.MIN_VALUE);

  public ReplayJobIds() {
    this(Clock.systemUTC(), new SecureRandom());
  }

  public ReplayJobIds(Clock clock, Random random) {
    this.clock = clock;
    this.random = random;
  }

  public String next(String originalJobId) {
    long ts = nextTimestamp();
    if (originalJobId != null && !originalJobId.isEmpty()) {
      return originalJobId + ":" + MARKER + ":" + ts;
    }
    return MARKER + ":" + ts + ":" + randomSuffix();
  }

  private long nextTimestamp() {
    long now = clock.millis();
    return lastIssued.updateAndGet(last -> Math.max(now, last + 1));
  }

  private String randomSuffix() {
    StringBuilder sb = new StringBuilder(SUFFIX_LENGTH);
    for (int i = 0; i < SUFFIX_LENGTH; i++) {
      sb.append(Character.forDigit(random.nextInt(36), 36));
    }
    return sb.toString();
  }
}
