package io.bakky.persistence.exec.handle;

/**
 * Resolved runtime handle for a backend client.\n
 *
 * Example:\n
 * - JDBC: client() is javax.sql.DataSource, namespace() is the default schema\n
 * - Mongo: client() is MongoClient, namespace() is the database\n
 */
public interface EngineHandle<TClient> {
  /** Unique identifier for this handle (used in log lines and as registry key). */
  String id();

  /** Native client used by an engine (DataSource, MongoClient, etc.). */
  TClient client();

  /** Namespace (schema/database) for this handle. */
  String namespace();
}
