package io.bakky.persistence.mongo;

import com.mongodb.client.MongoClient;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.RETURNS_DEEP_STUBS;
import static org.mockito.Mockito.mock;

final class MongoClientRegistryTest {

  @Test
  void settingsDifferingOnlyInCredentialsGetSeparateClients() {
    List<MongoClient> created = new ArrayList<>();
    MongoClientRegistry registry = new MongoClientRegistry(s -> {
      MongoClient c = mock(MongoClient.class, RETURNS_DEEP_STUBS);
      created.add(c);
      return c;
    });
    MongoSettings base = MongoSettings.of("mongodb://db:27017", "app");

    MongoClient reader = registry.client(base.withCredentials("reader", "r-pass"));
    MongoClient writer = registry.client(base.withCredentials("writer", "w-pass"));
    MongoClient readerAgain = registry.client(base.withCredentials("reader", "r-pass"));

    assertNotSame(reader, writer);
    assertSame(reader, readerAgain);
    assertEquals(2, created.size());
    assertTrue(registry.contains(base.withCredentials("writer", "w-pass")));
    assertFalse(registry.contains(base));
  }
}
