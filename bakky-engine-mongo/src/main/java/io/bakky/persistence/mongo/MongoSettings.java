package io.bakky.persistence.mongo;

import com.mongodb.ConnectionString;
import com.mongodb.MongoClientSettings;
import com.mongodb.MongoCredential;
import io.bakky.persistence.registry.ClientRegistry;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Connection options for one MongoDB deployment.
 * <p>
 * Credentials given here override any user info in the URI; {@code authSource} is {@code admin}.
 */
public record MongoSettings(String uri,
                            String database,
                            String username,
                            String password,
                            int minPoolSize,
                            int maxPoolSize,
                            Duration maxIdleTime,
                            Duration connectTimeout,
                            Duration socketTimeout,
                            Duration serverSelectionTimeout,
                            boolean retryWrites,
                            boolean retryReads,
                            boolean ssl) {
  public static final String DEFAULT_URI = "mongodb://localhost:27017";

  public MongoSettings {
    Objects.requireNonNull(uri, "uri");
    Objects.requireNonNull(database, "database");
    if (minPoolSize < 0 || maxPoolSize < 1 || minPoolSize > maxPoolSize) {
      throw new IllegalArgumentException("Invalid pool bounds min=" + minPoolSize + " max=" + maxPoolSize);
    }
    maxIdleTime = maxIdleTime == null ? Duration.ZERO : maxIdleTime;
    connectTimeout = connectTimeout == null ? Duration.ofMillis(20_000) : connectTimeout;
    socketTimeout = socketTimeout == null ? Duration.ofMillis(20_000) : socketTimeout;
    serverSelectionTimeout = serverSelectionTimeout == null ? Duration.ofMillis(30_000) : serverSelectionTimeout;
  }

  public static MongoSettings of(String uri, String database) {
    return new MongoSettings(uri, database, null, null, 0, 100, null, null, null, null, true, true, false);
  }

  public MongoSettings withCredentials(String user, String pass) {
    return new MongoSettings(uri, database, user, pass, minPoolSize, maxPoolSize, maxIdleTime,
        connectTimeout, socketTimeout, serverSelectionTimeout, retryWrites, retryReads, ssl);
  }

  public MongoSettings withServerSelectionTimeout(Duration timeout) {
    return new MongoSettings(uri, database, username, password, minPoolSize, maxPoolSize, maxIdleTime,
        connectTimeout, socketTimeout, timeout, retryWrites, retryReads, ssl);
  }

  public boolean hasCredentials() {
    return username != null && !username.isBlank() && password != null && !password.isBlank();
  }

  /** Client registry key: the URI plus a fingerprint of the credentials that override it. */
  public String registryKey() {
    return ClientRegistry.credentialKey(uri, username, password);
  }

  public MongoClientSettings toClientSettings() {
    MongoClientSettings.Builder b = MongoClientSettings.builder()
        .applyConnectionString(new ConnectionString(uri))
        .applyToConnectionPoolSettings(p -> p
            .minSize(minPoolSize)
            .maxSize(maxPoolSize)
            .maxConnectionIdleTime(maxIdleTime.toMillis(), TimeUnit.MILLISECONDS))
        .applyToSocketSettings(s -> s
            .connectTimeout((int) connectTimeout.toMillis(), TimeUnit.MILLISECONDS)
            .readTimeout((int) socketTimeout.toMillis(), TimeUnit.MILLISECONDS))
        .applyToClusterSettings(c -> c.serverSelectionTimeout(serverSelectionTimeout.toMillis(), TimeUnit.MILLISECONDS))
        .applyToSslSettings(s -> s.enabled(ssl))
        .retryWrites(retryWrites)
        .retryReads(retryReads);
    if (hasCredentials()) {
      b.credential(MongoCredential.createCredential(username, "admin", password.toCharArray()));
    }
    return b.build();
  }

  @Override
  public String toString() {
    return "MongoSettings[uri=" + ClientRegistry.redact(uri)
        + ", database=" + database + ", user=" + username + "]";
  }
}
