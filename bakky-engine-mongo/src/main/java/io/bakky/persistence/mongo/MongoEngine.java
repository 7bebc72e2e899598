package io.bakky.persistence.mongo;

import com.mongodb.MongoException;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.MongoDatabase;
import io.bakky.persistence.error.ConnectionException;
import io.bakky.persistence.exec.handle.EngineHandle;
import io.bakky.persistence.registry.ClientRegistry;
import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Mongo engine handle: one database on a registry-owned client.\n
 *
 * The client is resolved on first use. {@link #close()} only forgets it; closing shared clients is the
 * registry's job.
 */
public final class MongoEngine implements EngineHandle<MongoClient>, AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(MongoEngine.class);

  private final MongoClientRegistry registry;
  private final MongoSettings settings;
  private volatile MongoClient client;

  public MongoEngine(MongoClientRegistry registry, MongoSettings settings) {
    this.registry = Objects.requireNonNull(registry, "registry");
    this.settings = Objects.requireNonNull(settings, "settings");
  }

  @Override public String id() { return "mongo:" + ClientRegistry.redact(settings.uri()); }
  @Override public String namespace() { return settings.database(); }

  @Override
  public MongoClient client() {
    MongoClient c = client;
    if (c == null) {
      synchronized (this) {
        if (client == null) client = registry.client(settings);
        c = client;
      }
    }
    return c;
  }

  public MongoSettings settings() { return settings; }

  public MongoDatabase database() {
    return client().getDatabase(settings.database());
  }

  public MongoCollection<Document> collection(String name) {
    return database().getCollection(Objects.requireNonNull(name, "name"));
  }

  /** Pings the server; false instead of an exception when it is unreachable. */
  public boolean testConnection() {
    try {
      client().getDatabase("admin").runCommand(new Document("ping", 1));
      return true;
    } catch (MongoException | ConnectionException e) {
      log.error("bakky.mongo op=PING id={} failed: {}", id(), e.getMessage());
      return false;
    }
  }

  @Override
  public synchronized void close() {
    client = null;
  }
}
