package io.bakky.persistence.mongo;

import com.mongodb.MongoClientSettings;
import com.mongodb.MongoException;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoClients;
import io.bakky.persistence.error.ConnectionException;
import io.bakky.persistence.registry.ClientRegistry;
import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.function.Function;

/** One verified {@link MongoClient} per URI and credentials, shared by every engine pointing at it. */
public final class MongoClientRegistry implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(MongoClientRegistry.class);

  private final ClientRegistry<MongoClient> clients = new ClientRegistry<>("mongo");
  private final Function<MongoClientSettings, MongoClient> factory;

  public MongoClientRegistry() {
    this(MongoClients::create);
  }

  public MongoClientRegistry(Function<MongoClientSettings, MongoClient> factory) {
    this.factory = Objects.requireNonNull(factory, "factory");
  }

  /**
   * Returns the cached client for {@link MongoSettings#registryKey()}, creating and pinging it first if needed.
   *
   * @throws ConnectionException when a new client cannot reach the server
   */
  public MongoClient client(MongoSettings settings) {
    return clients.getOrCreate(settings.registryKey(), key -> connect(settings));
  }

  private MongoClient connect(MongoSettings settings) {
    MongoClient client = factory.apply(settings.toClientSettings());
    try {
      client.getDatabase("admin").runCommand(new Document("ping", 1));
    } catch (MongoException e) {
      client.close();
      log.error("bakky.mongo op=CONNECT uri={} failed: {}", ClientRegistry.redact(settings.uri()), e.getMessage());
      throw new ConnectionException("Cannot connect to MongoDB at " + ClientRegistry.redact(settings.uri()), e);
    }
    log.info("bakky.mongo op=CONNECT uri={} database={}", ClientRegistry.redact(settings.uri()), settings.database());
    return client;
  }

  public boolean contains(MongoSettings settings) { return clients.contains(settings.registryKey()); }
  public int size() { return clients.size(); }

  /** Closes every cached client; returns how many were closed. */
  public int closeAll() {
    return clients.closeAll();
  }

  @Override
  public void close() {
    closeAll();
  }
}
