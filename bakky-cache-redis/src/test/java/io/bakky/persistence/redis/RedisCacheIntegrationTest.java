package io.bakky.persistence.redis;

import io.bakky.persistence.error.ConnectionException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.testcontainers.containers.GenericContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;
import redis.clients.jedis.JedisPooled;

import java.time.Duration;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@Testcontainers(disabledWithoutDocker = true)
final class RedisCacheIntegrationTest {
  @Container
  static final GenericContainer<?> REDIS = new GenericContainer<>(DockerImageName.parse("redis:7-alpine"))
      .withExposedPorts(RedisSettings.DEFAULT_PORT);

  private final RedisConnector connector = new RedisConnector();
  private RedisSettings settings;
  private RedisCache cache;

  @BeforeEach
  void setUp() {
    settings = RedisSettings.of(REDIS.getHost(), REDIS.getMappedPort(RedisSettings.DEFAULT_PORT));
    cache = connector.cache(settings);
    connector.client(settings).flushDB();
  }

  @AfterEach
  void tearDown() {
    connector.closeAll();
  }

  @Test
  void connector_reusesClientPerUri() {
    JedisPooled a = connector.client(settings);
    assertSame(a, connector.client(settings));
    assertEquals(1, connector.size());
    assertEquals(1, connector.closeAll());
  }

  @Test
  void connector_failsForUnreachableServer() {
    RedisSettings dead = RedisSettings.of("127.0.0.1", 1).withTimeout(Duration.ofMillis(200));
    assertThrows(ConnectionException.class, () -> connector.client(dead));
  }

  @Test
  void save_appliesExpiry() throws Exception {
    assertTrue(cache.save("short", "v", Duration.ofMillis(150)));
    assertEquals("v", cache.get("short").orElseThrow());

    Thread.sleep(400);
    assertTrue(cache.get("short").isEmpty());
  }

  @Test
  void clearNamespace_deletesOnlyThatNamespace() {
    cache.save("sessions:1", "a");
    cache.save("sessions:2", "b");
    cache.save("users:1", "c");

    assertEquals(2, cache.clearNamespace("sessions"));
    assertEquals(Set.of("users:1"), cache.keys("*"));
  }

  @Test
  void cacheFlow_keepsFirstValueUntilForced() {
    assertEquals(Map.of("v", 1), cache.getOrSave("flow", () -> Map.of("v", 1), null, false));
    assertEquals(Map.of("v", 1), cache.getOrSave("flow", () -> Map.of("v", 2), null, false));
    assertEquals(Map.of("v", 3), cache.getOrSave("flow", () -> Map.of("v", 3), null, true));

    assertEquals(Map.of("v", 3), cache.getJson("flow").orElseThrow());
    assertTrue(cache.delete("flow"));
    assertFalse(cache.delete("flow"));
  }
}
