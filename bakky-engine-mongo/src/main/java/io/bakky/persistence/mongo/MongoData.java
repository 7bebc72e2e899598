package io.bakky.persistence.mongo;

import com.mongodb.MongoException;
import com.mongodb.bulk.BulkWriteResult;
import com.mongodb.bulk.BulkWriteUpsert;
import com.mongodb.client.FindIterable;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.model.FindOneAndUpdateOptions;
import com.mongodb.client.model.ReturnDocument;
import com.mongodb.client.model.UpdateOptions;
import com.mongodb.client.model.WriteModel;
import com.mongodb.client.result.DeleteResult;
import com.mongodb.client.result.InsertManyResult;
import com.mongodb.client.result.InsertOneResult;
import com.mongodb.client.result.UpdateResult;
import io.bakky.persistence.error.ConnectionException;
import org.bson.BsonValue;
import org.bson.Document;
import org.bson.conversions.Bson;
import org.bson.types.ObjectId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * CRUD over the collections of one {@link MongoEngine}.\n
 *
 * Driver and connection failures are logged and come back as {@link Optional#empty()} (or an empty list
 * for {@code find}); they never propagate. Returned documents go through {@link MongoDocuments#normalize}.
 */
public final class MongoData {
  private static final Logger log = LoggerFactory.getLogger(MongoData.class);

  private final MongoEngine engine;

  public MongoData(MongoEngine engine) {
    this.engine = Objects.requireNonNull(engine, "engine");
  }

  public MongoEngine engine() { return engine; }

  public MongoCollection<Document> collection(String name) {
    return engine.collection(name);
  }

  /** @return the inserted id as a hex string */
  public Optional<String> insertOne(String collection, Document document) {
    try {
      InsertOneResult r = collection(collection).insertOne(document);
      String id = MongoDocuments.idString(r.getInsertedId());
      log.info("bakky.mongo op=INSERT_ONE collection={} id={}", collection, id);
      return Optional.ofNullable(id);
    } catch (MongoException | ConnectionException e) {
      return failed("INSERT_ONE", collection, e);
    }
  }

  /** @return inserted ids in input order */
  public Optional<List<String>> insertMany(String collection, List<Document> documents) {
    try {
      InsertManyResult r = collection(collection).insertMany(documents);
      List<String> ids = new TreeMap<>(r.getInsertedIds()).values().stream()
          .map(MongoDocuments::idString)
          .toList();
      log.info("bakky.mongo op=INSERT_MANY collection={} count={}", collection, ids.size());
      return Optional.of(ids);
    } catch (MongoException | ConnectionException e) {
      return failed("INSERT_MANY", collection, e);
    }
  }

  public Optional<Map<String, Object>> findOne(String collection, Bson filter) {
    try {
      Document d = collection(collection).find(filter).first();
      log.debug("bakky.mongo op=FIND_ONE collection={} found={}", collection, d != null);
      return Optional.ofNullable(MongoDocuments.normalize(d));
    } catch (MongoException | ConnectionException e) {
      return failed("FIND_ONE", collection, e);
    }
  }

  /** Empty when {@code id} is not a valid ObjectId hex string or nothing matches. */
  public Optional<Map<String, Object>> findById(String collection, String id) {
    ObjectId oid = MongoDocuments.objectId(id);
    if (oid == null) {
      log.error("bakky.mongo op=FIND_BY_ID collection={} invalid id={}", collection, id);
      return Optional.empty();
    }
    return findOne(collection, new Document("_id", oid));
  }

  public List<Map<String, Object>> find(String collection, Bson filter) {
    return find(collection, filter, null, null, 0, 0);
  }

  /**
   * @param projection fields to include or exclude; null for whole documents
   * @param sort       sort specification, e.g. {@code Sorts.descending("at")}; null for natural order
   * @param skip       documents to skip; 0 for none
   * @param limit      maximum documents; 0 for no limit
   */
  public List<Map<String, Object>> find(String collection, Bson filter, Bson projection, Bson sort, int skip, int limit) {
    try {
      FindIterable<Document> it = collection(collection).find(filter == null ? new Document() : filter);
      if (projection != null) it = it.projection(projection);
      if (sort != null) it = it.sort(sort);
      if (skip > 0) it = it.skip(skip);
      if (limit > 0) it = it.limit(limit);
      List<Document> docs = it.into(new ArrayList<>());
      log.debug("bakky.mongo op=FIND collection={} count={}", collection, docs.size());
      return MongoDocuments.normalizeAll(docs);
    } catch (MongoException | ConnectionException e) {
      log.error("bakky.mongo op=FIND collection={} failed: {}", collection, e.getMessage());
      return List.of();
    }
  }

  public Optional<UpdateSummary> updateOne(String collection, Bson filter, Bson update) {
    return updateOne(collection, filter, update, false);
  }

  public Optional<UpdateSummary> updateOne(String collection, Bson filter, Bson update, boolean upsert) {
    try {
      UpdateResult r = collection(collection).updateOne(filter, update, new UpdateOptions().upsert(upsert));
      UpdateSummary s = summary(r);
      log.info("bakky.mongo op=UPDATE_ONE collection={} result={}", collection, s);
      return Optional.of(s);
    } catch (MongoException | ConnectionException e) {
      return failed("UPDATE_ONE", collection, e);
    }
  }

  public Optional<UpdateSummary> updateById(String collection, String id, Bson update) {
    ObjectId oid = MongoDocuments.objectId(id);
    if (oid == null) {
      log.error("bakky.mongo op=UPDATE_BY_ID collection={} invalid id={}", collection, id);
      return Optional.empty();
    }
    return updateOne(collection, new Document("_id", oid), update);
  }

  public Optional<UpdateSummary> updateMany(String collection, Bson filter, Bson update) {
    try {
      UpdateResult r = collection(collection).updateMany(filter, update);
      UpdateSummary s = summary(r);
      log.info("bakky.mongo op=UPDATE_MANY collection={} result={}", collection, s);
      return Optional.of(s);
    } catch (MongoException | ConnectionException e) {
      return failed("UPDATE_MANY", collection, e);
    }
  }

  public Optional<Long> deleteOne(String collection, Bson filter) {
    try {
      DeleteResult r = collection(collection).deleteOne(filter);
      log.info("bakky.mongo op=DELETE_ONE collection={} deleted={}", collection, r.getDeletedCount());
      return Optional.of(r.getDeletedCount());
    } catch (MongoException | ConnectionException e) {
      return failed("DELETE_ONE", collection, e);
    }
  }

  public Optional<Long> deleteById(String collection, String id) {
    ObjectId oid = MongoDocuments.objectId(id);
    if (oid == null) {
      log.error("bakky.mongo op=DELETE_BY_ID collection={} invalid id={}", collection, id);
      return Optional.empty();
    }
    return deleteOne(collection, new Document("_id", oid));
  }

  public Optional<Long> deleteMany(String collection, Bson filter) {
    try {
      DeleteResult r = collection(collection).deleteMany(filter);
      log.info("bakky.mongo op=DELETE_MANY collection={} deleted={}", collection, r.getDeletedCount());
      return Optional.of(r.getDeletedCount());
    } catch (MongoException | ConnectionException e) {
      return failed("DELETE_MANY", collection, e);
    }
  }

  public Optional<Long> count(String collection, Bson filter) {
    try {
      return Optional.of(collection(collection).countDocuments(filter == null ? new Document() : filter));
    } catch (MongoException | ConnectionException e) {
      return failed("COUNT", collection, e);
    }
  }

  public Optional<List<Map<String, Object>>> aggregate(String collection, List<? extends Bson> pipeline) {
    try {
      List<Document> docs = collection(collection).aggregate(pipeline).into(new ArrayList<>());
      log.debug("bakky.mongo op=AGGREGATE collection={} stages={} count={}", collection, pipeline.size(), docs.size());
      return Optional.of(MongoDocuments.normalizeAll(docs));
    } catch (MongoException | ConnectionException e) {
      return failed("AGGREGATE", collection, e);
    }
  }

  public Optional<List<Object>> distinct(String collection, String field, Bson filter) {
    try {
      List<BsonValue> raw = collection(collection)
          .distinct(field, filter == null ? new Document() : filter, BsonValue.class)
          .into(new ArrayList<>());
      List<Object> out = new ArrayList<>(raw.size());
      for (BsonValue v : raw) out.add(MongoDocuments.fromBson(v));
      return Optional.of(out);
    } catch (MongoException | ConnectionException e) {
      return failed("DISTINCT", collection, e);
    }
  }

  /**
   * Atomic find-and-modify.
   *
   * @param returnUpdated true for the document after the update, false for the one before
   */
  public Optional<Map<String, Object>> findOneAndUpdate(String collection, Bson filter, Bson update,
                                                        boolean returnUpdated, boolean upsert) {
    try {
      FindOneAndUpdateOptions opts = new FindOneAndUpdateOptions()
          .returnDocument(returnUpdated ? ReturnDocument.AFTER : ReturnDocument.BEFORE)
          .upsert(upsert);
      Document d = collection(collection).findOneAndUpdate(filter, update, opts);
      return Optional.ofNullable(MongoDocuments.normalize(d));
    } catch (MongoException | ConnectionException e) {
      return failed("FIND_ONE_AND_UPDATE", collection, e);
    }
  }

  public Optional<Map<String, Object>> findOneAndDelete(String collection, Bson filter) {
    try {
      Document d = collection(collection).findOneAndDelete(filter);
      return Optional.ofNullable(MongoDocuments.normalize(d));
    } catch (MongoException | ConnectionException e) {
      return failed("FIND_ONE_AND_DELETE", collection, e);
    }
  }

  public Optional<BulkSummary> bulkWrite(String collection, List<? extends WriteModel<? extends Document>> operations) {
    try {
      BulkWriteResult r = collection(collection).bulkWrite(operations);
      List<String> upserted = new ArrayList<>();
      for (BulkWriteUpsert u : r.getUpserts()) upserted.add(MongoDocuments.idString(u.getId()));
      BulkSummary s = new BulkSummary(r.getInsertedCount(), r.getMatchedCount(), r.getModifiedCount(),
          r.getDeletedCount(), r.getUpserts().size(), upserted);
      log.info("bakky.mongo op=BULK_WRITE collection={} result={}", collection, s);
      return Optional.of(s);
    } catch (MongoException | ConnectionException e) {
      return failed("BULK_WRITE", collection, e);
    }
  }

  private static UpdateSummary summary(UpdateResult r) {
    return new UpdateSummary(r.getMatchedCount(), r.getModifiedCount(), MongoDocuments.idString(r.getUpsertedId()));
  }

  private static <T> Optional<T> failed(String op, String collection, RuntimeException e) {
    log.error("bakky.mongo op={} collection={} failed: {}", op, collection, e.getMessage());
    return Optional.empty();
  }
}
