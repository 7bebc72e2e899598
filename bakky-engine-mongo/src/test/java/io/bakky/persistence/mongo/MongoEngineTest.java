package io.bakky.persistence.mongo;

import io.bakky.persistence.error.ConnectionException;
import org.bson.Document;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.testcontainers.containers.MongoDBContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static com.mongodb.client.model.Filters.eq;
import static com.mongodb.client.model.Filters.gt;
import static com.mongodb.client.model.Sorts.descending;
import static org.junit.jupiter.api.Assertions.*;

@Testcontainers(disabledWithoutDocker = true)
final class MongoEngineTest {
  @Container
  static final MongoDBContainer MONGO = new MongoDBContainer("mongo:7.0");

  private static MongoClientRegistry registry;
  private MongoEngine engine;
  private MongoData data;

  @BeforeAll
  static void registry() {
    registry = new MongoClientRegistry();
  }

  @AfterAll
  static void closeRegistry() {
    registry.closeAll();
  }

  @BeforeEach
  void setUp() {
    engine = new MongoEngine(registry, MongoSettings.of(MONGO.getConnectionString(), "bakky_test"));
    data = new MongoData(engine);
    engine.database().drop();
  }

  @Test
  void engines_shareOneClientPerUri() {
    MongoEngine other = new MongoEngine(registry, MongoSettings.of(MONGO.getConnectionString(), "other"));

    assertSame(engine.client(), other.client());
    assertTrue(registry.contains(MongoSettings.of(MONGO.getConnectionString(), "any")));
    assertTrue(other.testConnection());
  }

  @Test
  void unreachableServer_failsFastWithConnectionException() {
    MongoClientRegistry isolated = new MongoClientRegistry();
    MongoSettings dead = MongoSettings.of("mongodb://127.0.0.1:1", "x").withServerSelectionTimeout(Duration.ofMillis(300));

    assertThrows(ConnectionException.class, () -> isolated.client(dead));
    assertEquals(0, isolated.size());
    assertFalse(new MongoEngine(isolated, dead).testConnection());
  }

  @Test
  void crud_roundTripsThroughTheServer() {
    String id = data.insertOne("people", new Document("name", "ada").append("age", 36)).orElseThrow();
    data.insertMany("people", List.of(new Document("name", "bob").append("age", 20),
        new Document("name", "cy").append("age", 50))).orElseThrow();

    assertEquals("ada", data.findById("people", id).orElseThrow().get("name"));
    assertEquals(Long.valueOf(2), data.count("people", gt("age", 30)).orElseThrow());

    List<Map<String, Object>> oldestFirst = data.find("people", new Document(), null, descending("age"), 0, 2);
    assertEquals(List.of("cy", "ada"), oldestFirst.stream().map(d -> d.get("name")).toList());

    UpdateSummary up = data.updateOne("people", eq("name", "dee"), new Document("$set", new Document("age", 9)), true)
        .orElseThrow();
    assertTrue(up.upserted());

    Map<String, Object> after = data.findOneAndUpdate("people", eq("name", "bob"),
        new Document("$inc", new Document("age", 1)), true, false).orElseThrow();
    assertEquals(21, after.get("age"));

    assertEquals(List.of(9, 21, 36, 50),
        data.distinct("people", "age", null).orElseThrow().stream().sorted((a, b) -> ((Integer) a) - ((Integer) b)).toList());

    assertEquals(Long.valueOf(1), data.deleteById("people", id).orElseThrow());
    assertEquals(Long.valueOf(3), data.deleteMany("people", new Document()).orElseThrow());
  }
}
