package io.bakky.persistence.jdbc;

import java.time.Duration;
import java.util.Objects;

/**
 * Immutable connection settings for one relational database.
 * <p>
 * The password never appears in {@link #toString()} or {@link #maskedUrl()}.
 */
public record ConnectionParameters(String host,
                                   int port,
                                   String database,
                                   String user,
                                   String password,
                                   String schema,
                                   String sslMode,
                                   Duration connectTimeout,
                                   Duration statementTimeout) {
  public static final String DEFAULT_SCHEMA = "public";

  public ConnectionParameters {
    Objects.requireNonNull(host, "host");
    Objects.requireNonNull(database, "database");
    Objects.requireNonNull(user, "user");
    if (host.isBlank()) throw new IllegalArgumentException("host is blank");
    if (database.isBlank()) throw new IllegalArgumentException("database is blank");
    if (port <= 0 || port > 65535) throw new IllegalArgumentException("port out of range: " + port);
    password = password == null ? "" : password;
    schema = (schema == null || schema.isBlank()) ? DEFAULT_SCHEMA : schema.trim();
    sslMode = (sslMode == null || sslMode.isBlank()) ? null : sslMode.trim();
    connectTimeout = connectTimeout == null ? Duration.ofSeconds(10) : connectTimeout;
    statementTimeout = statementTimeout == null ? Duration.ZERO : statementTimeout;
  }

  public ConnectionParameters(String host, int port, String database, String user, String password) {
    this(host, port, database, user, password, null, null, null, null);
  }

  public ConnectionParameters withDatabase(String otherDatabase) {
    return new ConnectionParameters(host, port, otherDatabase, user, password, schema, sslMode,
        connectTimeout, statementTimeout);
  }

  public ConnectionParameters withSchema(String otherSchema) {
    return new ConnectionParameters(host, port, database, user, password, otherSchema, sslMode,
        connectTimeout, statementTimeout);
  }

  /** URL for logs and health reports, e.g. {@code postgresql://app:***@db:5432/bakky}. */
  public String maskedUrl() {
    return "postgresql://" + user + ":***@" + host + ":" + port + "/" + database;
  }

  @Override
  public String toString() {
    return "ConnectionParameters[" + maskedUrl() + ", schema=" + schema + ", sslMode=" + sslMode + "]";
  }
}
