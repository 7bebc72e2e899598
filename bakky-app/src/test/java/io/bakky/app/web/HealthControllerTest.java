package io.bakky.app.web;

import io.bakky.app.config.BakkyProperties;
import io.bakky.persistence.jdbc.pool.PooledEngine;
import io.bakky.persistence.mongo.MongoEngine;
import io.bakky.persistence.redis.RedisConnector;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

final class HealthControllerTest {
  private final BakkyProperties props = new BakkyProperties();
  private final PooledEngine pooled = mock(PooledEngine.class);

  @SuppressWarnings("unchecked")
  private static <T> ObjectProvider<T> provider(T value) {
    ObjectProvider<T> p = mock(ObjectProvider.class);
    when(p.getIfAvailable()).thenReturn(value);
    return p;
  }

  @Test
  void databaseUp_optionalStoresDisabled() {
    when(pooled.checkConnection()).thenReturn(true);
    HealthController c = new HealthController(props, pooled, provider(null), provider(null));

    ResponseEntity<Map<String, String>> r = c.health();

    assertEquals(HttpStatus.OK, r.getStatusCode());
    assertEquals("UP", r.getBody().get("status"));
    assertEquals("DISABLED", r.getBody().get("mongo"));
    assertEquals("DISABLED", r.getBody().get("redis"));
  }

  @Test
  void databaseDown_reportsServiceUnavailable() {
    when(pooled.checkConnection()).thenReturn(false);
    MongoEngine mongo = mock(MongoEngine.class);
    when(mongo.testConnection()).thenReturn(true);
    RedisConnector redis = mock(RedisConnector.class);
    when(redis.ping(any())).thenReturn(false);

    ResponseEntity<Map<String, String>> r = new HealthController(props, pooled, provider(mongo), provider(redis)).health();

    assertEquals(HttpStatus.SERVICE_UNAVAILABLE, r.getStatusCode());
    assertEquals("DOWN", r.getBody().get("database"));
    assertEquals("UP", r.getBody().get("mongo"));
    assertEquals("DOWN", r.getBody().get("redis"));
  }
}
