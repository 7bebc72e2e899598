package io.bakky.persistence.mongo;

import com.mongodb.MongoTimeoutException;
import com.mongodb.client.FindIterable;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.model.UpdateOptions;
import com.mongodb.client.result.DeleteResult;
import com.mongodb.client.result.InsertManyResult;
import com.mongodb.client.result.InsertOneResult;
import com.mongodb.client.result.UpdateResult;
import io.bakky.persistence.error.ConnectionException;
import org.bson.BsonObjectId;
import org.bson.Document;
import org.bson.types.ObjectId;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

final class MongoDataTest {
  private static final String HEX = "64b64c7f8f8b9a1d4c8e4e9a";

  private MongoEngine engine;
  private MongoCollection<Document> collection;
  private MongoData data;

  @BeforeEach
  @SuppressWarnings("unchecked")
  void setUp() {
    engine = mock(MongoEngine.class);
    collection = mock(MongoCollection.class);
    when(engine.collection("test_collection")).thenReturn(collection);
    data = new MongoData(engine);
  }

  @Test
  void insertOne_returnsHexId() {
    Document doc = new Document("name", "test");
    when(collection.insertOne(doc)).thenReturn(InsertOneResult.acknowledged(new BsonObjectId(new ObjectId(HEX))));

    assertEquals(Optional.of(HEX), data.insertOne("test_collection", doc));
    verify(engine).collection("test_collection");
    verify(collection).insertOne(doc);
  }

  @Test
  @SuppressWarnings("unchecked")
  void findOne_normalizesObjectId() {
    Document query = new Document("name", "test");
    FindIterable<Document> it = mock(FindIterable.class);
    when(collection.find(query)).thenReturn(it);
    when(it.first()).thenReturn(new Document("_id", new ObjectId(HEX)).append("name", "test"));

    Map<String, Object> found = data.findOne("test_collection", query).orElseThrow();

    assertEquals(HEX, found.get("_id"));
    assertEquals("test", found.get("name"));
  }

  @Test
  @SuppressWarnings("unchecked")
  void find_appliesPagingAndReturnsEmptyOnFailure() {
    FindIterable<Document> it = mock(FindIterable.class);
    when(collection.find(any(Document.class))).thenReturn(it);
    when(it.skip(5)).thenReturn(it);
    when(it.limit(10)).thenReturn(it);
    when(it.into(any())).thenAnswer(inv -> {
      List<Document> target = inv.getArgument(0);
      target.add(new Document("n", 1));
      return target;
    });

    List<Map<String, Object>> rows = data.find("test_collection", new Document(), null, null, 5, 10);
    assertEquals(List.of(Map.of("n", 1)), rows);
    verify(it, never()).sort(any());

    when(collection.find(any(Document.class))).thenThrow(new MongoTimeoutException("no server"));
    assertEquals(List.of(), data.find("test_collection", new Document()));
  }

  @Test
  void updateOne_reportsCounts() {
    Document query = new Document("name", "test");
    Document update = new Document("$set", new Document("name", "updated"));
    when(collection.updateOne(eq(query), eq(update), any(UpdateOptions.class)))
        .thenReturn(UpdateResult.acknowledged(1, 1L, null));

    UpdateSummary s = data.updateOne("test_collection", query, update).orElseThrow();

    assertEquals(1, s.matchedCount());
    assertEquals(1, s.modifiedCount());
    assertNull(s.upsertedId());
    assertFalse(s.upserted());
  }

  @Test
  void deleteOne_returnsDeletedCount() {
    Document query = new Document("name", "test");
    when(collection.deleteOne(query)).thenReturn(DeleteResult.acknowledged(1));

    assertEquals(Optional.of(1L), data.deleteOne("test_collection", query));
    verify(collection).deleteOne(query);
  }

  @Test
  void byIdOperations_rejectInvalidIdsWithoutCallingDriver() {
    assertTrue(data.findById("test_collection", "not-an-id").isEmpty());
    assertTrue(data.updateById("test_collection", "xyz", new Document("$set", new Document())).isEmpty());
    assertTrue(data.deleteById("test_collection", null).isEmpty());
    verify(engine, never()).collection(anyString());
  }

  @Test
  void connectionFailure_isReportedAsEmpty() {
    when(engine.collection("offline")).thenThrow(new ConnectionException("Cannot connect"));

    assertTrue(data.insertOne("offline", new Document()).isEmpty());
    assertTrue(data.count("offline", null).isEmpty());
    assertEquals(List.of(), data.find("offline", null));
  }

  @Test
  void insertMany_keepsInputOrder() {
    ObjectId a = new ObjectId();
    ObjectId b = new ObjectId();
    List<Document> docs = new ArrayList<>(List.of(new Document("i", 0), new Document("i", 1)));
    when(collection.insertMany(docs)).thenReturn(InsertManyResult.acknowledged(
        Map.of(1, new BsonObjectId(b), 0, new BsonObjectId(a))));

    assertEquals(Optional.of(List.of(a.toHexString(), b.toHexString())), data.insertMany("test_collection", docs));
  }
}
