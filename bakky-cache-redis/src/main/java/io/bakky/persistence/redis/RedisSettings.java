package io.bakky.persistence.redis;

import io.bakky.persistence.registry.ClientRegistry;
import redis.clients.jedis.DefaultJedisClientConfig;
import redis.clients.jedis.HostAndPort;
import redis.clients.jedis.JedisClientConfig;

import java.time.Duration;
import java.util.Objects;

/** Connection options for one Redis server; {@code defaultExpiry} applies to writes without their own TTL. */
public record RedisSettings(String host,
                            int port,
                            String username,
                            String password,
                            int database,
                            boolean ssl,
                            Duration timeout,
                            Duration defaultExpiry) {
  public static final int DEFAULT_PORT = 6379;

  public RedisSettings {
    Objects.requireNonNull(host, "host");
    if (port <= 0) throw new IllegalArgumentException("port must be > 0");
    if (database < 0) throw new IllegalArgumentException("database must be >= 0");
    timeout = timeout == null ? Duration.ofSeconds(2) : timeout;
    defaultExpiry = defaultExpiry == null ? Duration.ofSeconds(3600) : defaultExpiry;
    if (defaultExpiry.isNegative() || defaultExpiry.isZero()) throw new IllegalArgumentException("defaultExpiry must be > 0");
  }

  public static RedisSettings of(String host, int port) {
    return new RedisSettings(host, port, null, null, 0, false, null, null);
  }

  public RedisSettings withDatabase(int db) {
    return new RedisSettings(host, port, username, password, db, ssl, timeout, defaultExpiry);
  }

  public RedisSettings withCredentials(String user, String pass) {
    return new RedisSettings(host, port, user, pass, database, ssl, timeout, defaultExpiry);
  }

  public RedisSettings withTimeout(Duration t) {
    return new RedisSettings(host, port, username, password, database, ssl, t, defaultExpiry);
  }

  /** Display form; never contains the password. */
  public String uri() {
    String user = username == null || username.isBlank() ? "" : username + "@";
    return (ssl ? "rediss://" : "redis://") + user + host + ":" + port + "/" + database;
  }

  /** Client registry key: {@link #uri()} plus a fingerprint of the password. */
  public String registryKey() {
    return ClientRegistry.credentialKey(uri(), password);
  }

  public HostAndPort hostAndPort() {
    return new HostAndPort(host, port);
  }

  public JedisClientConfig clientConfig() {
    DefaultJedisClientConfig.Builder b = DefaultJedisClientConfig.builder()
        .database(database)
        .ssl(ssl)
        .timeoutMillis((int) timeout.toMillis())
        .clientName("bakky");
    if (username != null && !username.isBlank()) b.user(username);
    if (password != null && !password.isBlank()) b.password(password);
    return b.build();
  }

  @Override
  public String toString() {
    return "RedisSettings[" + uri() + "]";
  }
}
