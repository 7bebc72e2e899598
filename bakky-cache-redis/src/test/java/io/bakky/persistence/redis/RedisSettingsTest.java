package io.bakky.persistence.redis;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

final class RedisSettingsTest {
  @Test
  void defaults_useDatabaseZeroAndOneHourExpiry() {
    RedisSettings s = RedisSettings.of("cache", RedisSettings.DEFAULT_PORT);

    assertEquals(0, s.database());
    assertEquals(Duration.ofSeconds(3600), s.defaultExpiry());
    assertEquals("redis://cache:6379/0", s.uri());
  }

  @Test
  void uri_includesUserButNeverPassword() {
    RedisSettings s = RedisSettings.of("cache", 6380).withCredentials("app", "s3cret").withDatabase(2);

    assertEquals("redis://app@cache:6380/2", s.uri());
    assertFalse(s.toString().contains("s3cret"));
    assertEquals(2, s.clientConfig().getDatabase());
    assertEquals("app", s.clientConfig().getUser());
  }

  @Test
  void registryKey_differsByPasswordOnly() {
    RedisSettings a = RedisSettings.of("cache", 6379).withCredentials("app", "s3cret");
    RedisSettings b = RedisSettings.of("cache", 6379).withCredentials("app", "other");

    assertEquals(a.uri(), b.uri());
    assertNotEquals(a.registryKey(), b.registryKey());
    assertFalse(a.registryKey().contains("s3cret"));
    assertEquals("redis://cache:6379/0", RedisSettings.of("cache", 6379).registryKey());
  }

  @Test
  void invalidValues_areRejected() {
    assertThrows(IllegalArgumentException.class, () -> RedisSettings.of("cache", 0));
    assertThrows(IllegalArgumentException.class,
        () -> new RedisSettings("cache", 6379, null, null, 0, false, null, Duration.ZERO));
  }
}
