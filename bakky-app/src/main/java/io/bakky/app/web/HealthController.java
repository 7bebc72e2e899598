package io.bakky.app.web;

import io.bakky.app.config.BakkyProperties;
import io.bakky.persistence.jdbc.pool.PooledEngine;
import io.bakky.persistence.mongo.MongoEngine;
import io.bakky.persistence.redis.RedisConnector;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("${bakky.app.api-prefix:/api/v1}")
public class HealthController {
  static final String UP = "UP";
  static final String DOWN = "DOWN";
  static final String DISABLED = "DISABLED";

  private final BakkyProperties props;
  private final PooledEngine pooled;
  private final ObjectProvider<MongoEngine> mongo;
  private final ObjectProvider<RedisConnector> redis;

  public HealthController(BakkyProperties props,
                          PooledEngine pooled,
                          ObjectProvider<MongoEngine> mongo,
                          ObjectProvider<RedisConnector> redis) {
    this.props = props;
    this.pooled = pooled;
    this.mongo = mongo;
    this.redis = redis;
  }

  /** 200 when the database answers, 503 otherwise; optional stores are reported but do not decide. */
  @GetMapping("/health")
  public ResponseEntity<Map<String, String>> health() {
    String database = pooled.checkConnection() ? UP : DOWN;

    MongoEngine m = mongo.getIfAvailable();
    String mongoStatus = m == null ? DISABLED : (m.testConnection() ? UP : DOWN);

    RedisConnector r = redis.getIfAvailable();
    String redisStatus = r == null ? DISABLED : (r.ping(props.getRedis().toRedisSettings()) ? UP : DOWN);

    Map<String, String> body = new LinkedHashMap<>();
    body.put("status", UP.equals(database) ? UP : DOWN);
    body.put("app", props.getApp().getName());
    body.put("version", props.getApp().getVersion());
    body.put("database", database);
    body.put("mongo", mongoStatus);
    body.put("redis", redisStatus);
    return ResponseEntity.status(UP.equals(database) ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE).body(body);
  }
}
