package io.bakky.persistence.mongo;

import org.bson.BsonValue;
import org.bson.types.Decimal128;
import org.bson.types.ObjectId;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Converts driver documents into plain, JSON-friendly maps. */
public final class MongoDocuments {
  private MongoDocuments() {}

  /** ObjectId becomes its hex string and Date an ISO-8601 instant, at any depth. */
  public static Map<String, Object> normalize(Map<String, ?> doc) {
    if (doc == null) return null;
    Map<String, Object> out = new LinkedHashMap<>();
    for (var e : doc.entrySet()) out.put(e.getKey(), normalizeValue(e.getValue()));
    return out;
  }

  public static List<Map<String, Object>> normalizeAll(Iterable<? extends Map<String, ?>> docs) {
    List<Map<String, Object>> out = new ArrayList<>();
    for (Map<String, ?> d : docs) out.add(normalize(d));
    return out;
  }

  @SuppressWarnings("unchecked")
  public static Object normalizeValue(Object v) {
    if (v instanceof ObjectId id) return id.toHexString();
    if (v instanceof Date d) return d.toInstant().toString();
    if (v instanceof Decimal128 dec) return dec.bigDecimalValue();
    if (v instanceof Map<?, ?> m) return normalize((Map<String, ?>) m);
    if (v instanceof Collection<?> c) {
      List<Object> out = new ArrayList<>(c.size());
      for (Object o : c) out.add(normalizeValue(o));
      return out;
    }
    return v;
  }

  /** Plain Java value for a raw BSON value, as returned by {@code distinct}. */
  public static Object fromBson(BsonValue v) {
    if (v == null || v.isNull()) return null;
    if (v.isString()) return v.asString().getValue();
    if (v.isInt32()) return v.asInt32().getValue();
    if (v.isInt64()) return v.asInt64().getValue();
    if (v.isDouble()) return v.asDouble().getValue();
    if (v.isBoolean()) return v.asBoolean().getValue();
    if (v.isDecimal128()) return v.asDecimal128().getValue().bigDecimalValue();
    if (v.isObjectId()) return v.asObjectId().getValue().toHexString();
    if (v.isDateTime()) return Instant.ofEpochMilli(v.asDateTime().getValue()).toString();
    if (v.isArray()) {
      List<Object> out = new ArrayList<>();
      for (BsonValue item : v.asArray()) out.add(fromBson(item));
      return out;
    }
    if (v.isDocument()) {
      Map<String, Object> out = new LinkedHashMap<>();
      v.asDocument().forEach((k, item) -> out.put(k, fromBson(item)));
      return out;
    }
    return v.toString();
  }

  /** Parses a 24-char hex id; null when it is not one. */
  static ObjectId objectId(String hex) {
    return hex != null && ObjectId.isValid(hex) ? new ObjectId(hex) : null;
  }

  static String idString(BsonValue id) {
    if (id == null) return null;
    if (id.isObjectId()) return id.asObjectId().getValue().toHexString();
    if (id.isString()) return id.asString().getValue();
    if (id.isInt32()) return Integer.toString(id.asInt32().getValue());
    if (id.isInt64()) return Long.toString(id.asInt64().getValue());
    return id.toString();
  }
}
