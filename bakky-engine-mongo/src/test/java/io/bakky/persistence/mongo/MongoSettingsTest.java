package io.bakky.persistence.mongo;

import com.mongodb.MongoClientSettings;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

final class MongoSettingsTest {
  @Test
  void defaults_matchDocumentedPoolAndTimeouts() {
    MongoClientSettings s = MongoSettings.of("mongodb://db:27017", "app").toClientSettings();

    assertEquals(0, s.getConnectionPoolSettings().getMinSize());
    assertEquals(100, s.getConnectionPoolSettings().getMaxSize());
    assertEquals(20_000, s.getSocketSettings().getConnectTimeout(TimeUnit.MILLISECONDS));
    assertEquals(20_000, s.getSocketSettings().getReadTimeout(TimeUnit.MILLISECONDS));
    assertEquals(30_000, s.getClusterSettings().getServerSelectionTimeout(TimeUnit.MILLISECONDS));
    assertTrue(s.getRetryWrites());
    assertNull(s.getCredential());
  }

  @Test
  void credentials_authenticateAgainstAdmin() {
    MongoClientSettings s = MongoSettings.of("mongodb://db:27017", "app").withCredentials("mongo", "secret").toClientSettings();

    assertEquals("mongo", s.getCredential().getUserName());
    assertEquals("admin", s.getCredential().getSource());
  }

  @Test
  void toString_hidesPassword() {
    MongoSettings s = MongoSettings.of("mongodb://u:p@db:27017", "app");
    assertFalse(s.toString().contains(":p@"));
  }

  @Test
  void registryKey_separatesCredentialsWithoutExposingThem() {
    MongoSettings plain = MongoSettings.of("mongodb://db:27017", "app");
    MongoSettings alice = plain.withCredentials("alice", "one");
    MongoSettings bob = plain.withCredentials("alice", "two");

    assertEquals("mongodb://db:27017", plain.registryKey());
    assertNotEquals(alice.registryKey(), bob.registryKey());
    assertEquals(alice.registryKey(), plain.withCredentials("alice", "one").registryKey());
    assertFalse(alice.registryKey().contains("one"));
  }

  @Test
  void invalidPoolBounds_areRejected() {
    assertThrows(IllegalArgumentException.class,
        () -> new MongoSettings("mongodb://db", "app", null, null, 5, 1, null, null, null, null, true, true, false));
  }
}
