package io.bakky.persistence.redis;

import io.bakky.persistence.error.ConnectionException;
import io.bakky.persistence.registry.ClientRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import redis.clients.jedis.JedisPooled;
import redis.clients.jedis.exceptions.JedisException;

/** Pooled Redis clients keyed by {@link RedisSettings#registryKey()}; each is pinged before it is cached. */
public final class RedisConnector implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(RedisConnector.class);

  private final ClientRegistry<JedisPooled> clients = new ClientRegistry<>("redis");

  /** @throws ConnectionException when the server cannot be reached or rejects the credentials */
  public JedisPooled client(RedisSettings settings) {
    return clients.getOrCreate(settings.registryKey(), key -> connect(settings));
  }

  private static JedisPooled connect(RedisSettings settings) {
    JedisPooled client = new JedisPooled(settings.hostAndPort(), settings.clientConfig());
    try {
      String pong = client.ping();
      if (!"PONG".equalsIgnoreCase(pong)) throw new ConnectionException("Unexpected ping reply from " + settings.uri() + ": " + pong);
    } catch (JedisException | ConnectionException e) {
      client.close();
      log.error("bakky.redis op=CONNECT uri={} failed: {}", settings.uri(), e.getMessage());
      if (e instanceof ConnectionException ce) throw ce;
      throw new ConnectionException("Cannot connect to Redis at " + settings.uri() + ": " + e.getMessage(), e);
    }
    log.debug("bakky.redis op=CONNECT uri={}", settings.uri());
    return client;
  }

  /** Opens (or reuses) a client and wraps it in a cache using the settings' default expiry. */
  public RedisCache cache(RedisSettings settings) {
    return new RedisCache(client(settings), settings.defaultExpiry());
  }

  /** Liveness probe; false instead of an exception when the server is unreachable. */
  public boolean ping(RedisSettings settings) {
    try {
      return "PONG".equalsIgnoreCase(client(settings).ping());
    } catch (JedisException | ConnectionException e) {
      log.warn("bakky.redis op=PING uri={} failed: {}", settings.uri(), e.getMessage());
      return false;
    }
  }

  public int size() { return clients.size(); }

  public int closeAll() {
    return clients.closeAll();
  }

  @Override
  public void close() {
    closeAll();
  }
}
