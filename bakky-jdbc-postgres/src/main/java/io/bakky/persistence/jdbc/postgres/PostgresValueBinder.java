package io.bakky.persistence.jdbc.postgres;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.bakky.persistence.jdbc.bind.ValueBinder;
import org.postgresql.util.PGobject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Array;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Collection;
import java.util.Map;
import java.util.UUID;

/**
 * Postgres-specific binding.\n
 *
 * - Map and JsonNode values become jsonb\n
 * - collections of scalars become native arrays, element type taken from the first non-null element\n
 * - anything else (mixed or nested collections) becomes jsonb\n
 * - Instant is sent as a UTC OffsetDateTime, enums by name\n
 */
public final class PostgresValueBinder implements ValueBinder {
  private static final Logger log = LoggerFactory.getLogger(PostgresValueBinder.class);

  private final ObjectMapper json;

  public PostgresValueBinder(ObjectMapper json) {
    this.json = json;
  }

  @Override
  public void bind(PreparedStatement ps, int index, Object value) throws SQLException {
    if (log.isTraceEnabled()) {
      log.trace("bakky.jdbc bind index={} valueType={}", index, value == null ? "null" : value.getClass().getName());
    }
    if (value == null) {
      ps.setNull(index, Types.OTHER);
    } else if (value instanceof Map<?, ?> || value instanceof JsonNode) {
      ps.setObject(index, jsonb(value));
    } else if (value instanceof Collection<?> c) {
      String elemType = arrayElementType(c);
      if (elemType == null) {
        ps.setObject(index, jsonb(value));
      } else {
        Array arr = ps.getConnection().createArrayOf(elemType, c.toArray());
        ps.setArray(index, arr);
      }
    } else if (value instanceof Instant i) {
      ps.setObject(index, OffsetDateTime.ofInstant(i, ZoneOffset.UTC));
    } else if (value instanceof Enum<?> e) {
      ps.setString(index, e.name());
    } else {
      ps.setObject(index, value);
    }
  }

  PGobject jsonb(Object value) throws SQLException {
    PGobject obj = new PGobject();
    obj.setType("jsonb");
    try {
      obj.setValue(json.writeValueAsString(value));
    } catch (JsonProcessingException e) {
      throw new SQLException("Cannot encode " + value.getClass().getSimpleName() + " as jsonb", "22023", e);
    }
    return obj;
  }

  /** Postgres element type for a homogeneous scalar collection; null when jsonb fits better. */
  static String arrayElementType(Collection<?> values) {
    Class<?> type = null;
    for (Object v : values) {
      if (v == null) continue;
      if (type == null) type = v.getClass();
      else if (type != v.getClass()) return null;
    }
    if (type == null) return "text";
    if (type == String.class) return "text";
    if (type == Integer.class || type == Short.class) return "int4";
    if (type == Long.class) return "int8";
    if (type == Double.class) return "float8";
    if (type == Float.class) return "float4";
    if (type == Boolean.class) return "bool";
    if (type == UUID.class) return "uuid";
    return null;
  }
}
