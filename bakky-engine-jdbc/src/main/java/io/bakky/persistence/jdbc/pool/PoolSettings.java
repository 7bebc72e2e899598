package io.bakky.persistence.jdbc.pool;

import java.time.Duration;

/**
 * @param poolSize       connections kept open (minimum idle)
 * @param maxOverflow    extra connections allowed under load, on top of poolSize
 * @param recycle        maximum lifetime of a pooled connection
 * @param acquireTimeout how long a caller waits for a free connection
 */
public record PoolSettings(int poolSize, int maxOverflow, Duration recycle, Duration acquireTimeout) {
  public PoolSettings {
    if (poolSize <= 0) throw new IllegalArgumentException("poolSize must be > 0");
    if (maxOverflow < 0) throw new IllegalArgumentException("maxOverflow must be >= 0");
    recycle = recycle == null ? Duration.ofSeconds(3600) : recycle;
    acquireTimeout = acquireTimeout == null ? Duration.ofSeconds(30) : acquireTimeout;
  }

  public static PoolSettings defaults() {
    return new PoolSettings(10, 20, Duration.ofSeconds(3600), Duration.ofSeconds(30));
  }

  public int maximumPoolSize() { return poolSize + maxOverflow; }
}
