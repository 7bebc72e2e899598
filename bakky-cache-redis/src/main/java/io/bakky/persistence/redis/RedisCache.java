package io.bakky.persistence.redis;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.bakky.persistence.error.QueryException;
import io.bakky.persistence.error.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import redis.clients.jedis.UnifiedJedis;
import redis.clients.jedis.exceptions.JedisException;
import redis.clients.jedis.params.SetParams;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

/**
 * String and JSON cache over a Redis client.\n
 *
 * Every write carries an expiry; without one the default applies. Command failures raise
 * {@link QueryException}.
 */
public final class RedisCache {
  private static final Logger log = LoggerFactory.getLogger(RedisCache.class);
  private static final TypeReference<Map<String, Object>> JSON_OBJECT = new TypeReference<>() {};

  static final String CLEAR_NAMESPACE_LUA =
      "local n = 0 "
      + "for _, k in ipairs(redis.call('KEYS', ARGV[1])) do redis.call('DEL', k) n = n + 1 end "
      + "return n";

  private final UnifiedJedis client;
  private final Duration defaultExpiry;
  private final ObjectMapper json;

  public RedisCache(UnifiedJedis client, Duration defaultExpiry) {
    this(client, defaultExpiry, new ObjectMapper());
  }

  public RedisCache(UnifiedJedis client, Duration defaultExpiry, ObjectMapper json) {
    this.client = Objects.requireNonNull(client, "client");
    this.defaultExpiry = Objects.requireNonNull(defaultExpiry, "defaultExpiry");
    this.json = Objects.requireNonNull(json, "json");
  }

  public Optional<String> get(String key) {
    try {
      return Optional.ofNullable(client.get(key));
    } catch (JedisException e) {
      throw failure("get", key, e);
    }
  }

  /** Stored JSON object, or empty when the key is absent. */
  public Optional<Map<String, Object>> getJson(String key) {
    return get(key).map(raw -> decode(key, raw));
  }

  public Set<String> keys(String pattern) {
    try {
      Set<String> keys = client.keys(pattern == null ? "*" : pattern);
      log.debug("bakky.redis op=KEYS pattern={} count={}", pattern, keys.size());
      return keys;
    } catch (JedisException e) {
      throw failure("keys", pattern, e);
    }
  }

  /** @return true when the key existed */
  public boolean delete(String key) {
    try {
      long n = client.del(key);
      log.debug("bakky.redis op=DEL key={} deleted={}", key, n);
      return n > 0;
    } catch (JedisException e) {
      throw failure("delete", key, e);
    }
  }

  /**
   * Deletes every key under {@code namespace:} in one server-side script.
   * The pattern travels as a script argument, so it is never spliced into Lua source.
   *
   * @return number of keys deleted
   */
  public long clearNamespace(String namespace) {
    if (namespace == null || namespace.isBlank()) throw new ValidationException("Namespace must be non-blank");
    try {
      Object n = client.eval(CLEAR_NAMESPACE_LUA, List.of(), List.of(namespace + ":*"));
      long deleted = n instanceof Number num ? num.longValue() : 0L;
      log.debug("bakky.redis op=CLEAR_NAMESPACE namespace={} deleted={}", namespace, deleted);
      return deleted;
    } catch (JedisException e) {
      throw failure("clear namespace", namespace, e);
    }
  }

  public boolean save(String key, String value) {
    return save(key, value, null);
  }

  /** SET with expiry; {@code expiry} null means the default. */
  public boolean save(String key, String value, Duration expiry) {
    Duration ttl = expiry == null ? defaultExpiry : expiry;
    try {
      String reply = client.set(key, value, SetParams.setParams().px(ttl.toMillis()));
      log.debug("bakky.redis op=SET key={} ttlMs={}", key, ttl.toMillis());
      return "OK".equals(reply);
    } catch (JedisException e) {
      throw failure("save", key, e);
    }
  }

  /** Replaces the key with {@code data} as JSON, creating it when absent; returns what was stored. */
  public Map<String, Object> update(String key, Map<String, ?> data, Duration expiry) {
    String raw = encode(key, data);
    save(key, raw, expiry);
    log.debug("bakky.redis op=UPDATE key={}", key);
    return decode(key, raw);
  }

  /**
   * Cache flow: a present key is served as is unless {@code forceUpdate}; otherwise the supplier's
   * value is stored and returned. The supplier runs only when a write happens.
   */
  public Map<String, Object> getOrSave(String key, Supplier<? extends Map<String, ?>> supplier,
                                       Duration expiry, boolean forceUpdate) {
    Optional<Map<String, Object>> cached = getJson(key);
    if (cached.isPresent() && !forceUpdate) {
      log.debug("bakky.redis op=CACHE key={} hit=true", key);
      return cached.get();
    }
    log.debug("bakky.redis op=CACHE key={} hit={} forceUpdate={}", key, cached.isPresent(), forceUpdate);
    return update(key, supplier.get(), expiry);
  }

  private String encode(String key, Map<String, ?> data) {
    try {
      return json.writeValueAsString(data);
    } catch (JsonProcessingException e) {
      throw new ValidationException("Cannot encode value for key " + key + " as JSON: " + e.getOriginalMessage(), e);
    }
  }

  private Map<String, Object> decode(String key, String raw) {
    try {
      return json.readValue(raw, JSON_OBJECT);
    } catch (JsonProcessingException e) {
      throw new QueryException("Value at key " + key + " is not a JSON object: " + e.getOriginalMessage(), e);
    }
  }

  private static QueryException failure(String what, String key, JedisException e) {
    log.error("bakky.redis op={} key={} failed: {}", what, key, e.getMessage());
    return new QueryException("Redis " + what + " failed for " + key + ": " + e.getMessage(), e);
  }
}
