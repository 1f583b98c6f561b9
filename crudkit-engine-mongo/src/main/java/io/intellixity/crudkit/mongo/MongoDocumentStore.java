package io.intellixity.crudkit.mongo;

import com.mongodb.ClientSessionOptions;
import com.mongodb.client.ClientSession;
import com.mongodb.client.FindIterable;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.MongoDatabase;
import com.mongodb.client.model.Filters;
import com.mongodb.client.model.Projections;
import com.mongodb.client.result.DeleteResult;
import com.mongodb.client.result.InsertOneResult;
import com.mongodb.client.result.UpdateResult;
import io.intellixity.crudkit.model.FieldSelection;
import io.intellixity.crudkit.query.PageRequest;
import io.intellixity.crudkit.query.SortField;
import io.intellixity.crudkit.result.DeleteOutcome;
import io.intellixity.crudkit.result.UpdateOutcome;
import io.intellixity.crudkit.store.DocumentStore;
import io.intellixity.crudkit.store.Relation;
import org.bson.BsonValue;
import org.bson.Document;
import org.bson.conversions.Bson;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.function.Supplier;

/**
 * {@link DocumentStore} on the official MongoDB Java sync driver.\n
 *
 * Responsibilities:\n
 * - render field selections and sort fields as projection / sort documents\n
 * - update many documents and re-read them by {@code _id}\n
 * - batched populate: one {@code $in} query per relation and page\n
 * - multi-document transactions through a {@link ClientSession} bound to the calling thread\n
 */
public final class MongoDocumentStore implements DocumentStore {
  private static final Logger log = LoggerFactory.getLogger(MongoDocumentStore.class);

  private static final ThreadLocal<TxSlot> TX = new ThreadLocal<>();
  private final Object txMarker = new Object();

  private record TxSlot(Object marker, ClientSession session) {}

  private final MongoHandle handle;
  private final MongoDatabase db;

  public MongoDocumentStore(MongoHandle handle) {
    this.handle = Objects.requireNonNull(handle, "handle");
    this.db = handle.client().getDatabase(handle.database());
  }

  // --- Reads ---

  @Override
  public List<Map<String, Object>> find(String collection, Map<String, Object> filter, FieldSelection projection,
                                        List<SortField> sort, PageRequest page) {
    long start = System.nanoTime();
    debugOp("find", collection);
    FindIterable<Document> find = findIterable(collection, MongoValues.filter(filter));
    Document proj = MongoProjections.projection(projection);
    if (proj != null) find = find.projection(proj);
    Document sortDoc = MongoProjections.sort(sort);
    if (sortDoc != null) find = find.sort(sortDoc);
    if (page != null) {
      if (page.skip() > 0) find = find.skip(page.skip());
      find = find.limit(page.limit());
    }
    List<Map<String, Object>> out = new ArrayList<>();
    for (Document d : find) out.add(d);
    debugDone("find", collection, out.size(), System.nanoTime() - start);
    return out;
  }

  @Override
  public Optional<Map<String, Object>> findOne(String collection, Map<String, Object> filter, FieldSelection projection) {
    debugOp("findOne", collection);
    FindIterable<Document> find = findIterable(collection, MongoValues.filter(filter));
    Document proj = MongoProjections.projection(projection);
    if (proj != null) find = find.projection(proj);
    return Optional.ofNullable(find.limit(1).first());
  }

  // --- Writes ---

  @Override
  public Map<String, Object> insertOne(String collection, Map<String, Object> payload) {
    long start = System.nanoTime();
    debugOp("insertOne", collection);
    MongoCollection<Document> col = db.getCollection(collection);
    Document doc = MongoValues.document(payload);
    ClientSession s = sessionOrNull();
    InsertOneResult r = (s == null) ? col.insertOne(doc) : col.insertOne(s, doc);
    if (doc.get(MongoValues.ID) == null && r.getInsertedId() != null) doc.put(MongoValues.ID, bsonToJava(r.getInsertedId()));
    debugDone("insertOne", collection, 1, System.nanoTime() - start);
    return doc;
  }

  @Override
  public List<Map<String, Object>> insertMany(String collection, List<Map<String, Object>> payloads) {
    long start = System.nanoTime();
    debugOp("insertMany", collection);
    MongoCollection<Document> col = db.getCollection(collection);
    List<Document> docs = new ArrayList<>(payloads.size());
    for (Map<String, Object> p : payloads) docs.add(MongoValues.document(p));
    ClientSession s = sessionOrNull();
    // the driver assigns missing _ids on the documents themselves
    if (s == null) col.insertMany(docs);
    else col.insertMany(s, docs);
    debugDone("insertMany", collection, docs.size(), System.nanoTime() - start);
    return new ArrayList<>(docs);
  }

  @Override
  public UpdateOutcome updateMany(String collection, Map<String, Object> filter, Map<String, Object> update) {
    long start = System.nanoTime();
    debugOp("updateMany", collection);
    Document normalized = MongoUpdates.normalize(update);
    MongoCollection<Document> col = db.getCollection(collection);
    ClientSession s = sessionOrNull();

    // Pin the matched set first: the update may change the fields the filter selects on.
    List<Object> ids = new ArrayList<>();
    for (Document d : findIterable(collection, MongoValues.filter(filter)).projection(Projections.include(MongoValues.ID))) {
      ids.add(d.get(MongoValues.ID));
    }
    if (ids.isEmpty()) {
      debugDone("updateMany", collection, 0, System.nanoTime() - start);
      return UpdateOutcome.none();
    }

    Bson byIds = Filters.in(MongoValues.ID, ids);
    UpdateResult r = (s == null) ? col.updateMany(byIds, normalized) : col.updateMany(s, byIds, normalized);
    List<Map<String, Object>> after = new ArrayList<>(ids.size());
    for (Document d : findIterable(collection, byIds)) after.add(d);
    debugDone("updateMany", collection, r.getModifiedCount(), System.nanoTime() - start);
    return new UpdateOutcome(r.getMatchedCount(), r.getModifiedCount(), after);
  }

  @Override
  public DeleteOutcome deleteMany(String collection, Map<String, Object> filter) {
    long start = System.nanoTime();
    debugOp("deleteMany", collection);
    MongoCollection<Document> col = db.getCollection(collection);
    ClientSession s = sessionOrNull();
    Document where = MongoValues.filter(filter);
    DeleteResult r = (s == null) ? col.deleteMany(where) : col.deleteMany(s, where);
    debugDone("deleteMany", collection, r.getDeletedCount(), System.nanoTime() - start);
    return new DeleteOutcome(r.getDeletedCount());
  }

  // --- Populate ---

  @Override
  public Map<String, Object> populate(Map<String, Object> document, Relation relation) {
    if (document == null) return null;
    List<Map<String, Object>> one = new ArrayList<>(1);
    one.add(document);
    return populateAll(one, relation).get(0);
  }

  @Override
  public List<Map<String, Object>> populateAll(List<Map<String, Object>> documents, Relation relation) {
    List<Object> refs = MongoPopulate.refs(documents, relation.path());
    if (refs.isEmpty()) return MongoPopulate.stitch(documents, relation.path(), Map.of());

    long start = System.nanoTime();
    debugOp("populate", relation.collection());
    FindIterable<Document> find = findIterable(relation.collection(), Filters.in(MongoValues.ID, refs));
    Document proj = MongoProjections.forPopulate(relation);
    if (proj != null) find = find.projection(proj);
    List<Map<String, Object>> targets = new ArrayList<>();
    for (Document d : find) targets.add(d);

    if (relation.nested() != null && !targets.isEmpty()) targets = populateAll(targets, relation.nested());

    FieldSelection keep = relation.targetFields();
    Map<Object, Map<String, Object>> byKey = new HashMap<>();
    for (Map<String, Object> t : targets) {
      byKey.put(MongoPopulate.key(t.get(MongoValues.ID)), keep.apply(t));
    }
    debugDone("populate", relation.collection(), byKey.size(), System.nanoTime() - start);
    return MongoPopulate.stitch(documents, relation.path(), byKey);
  }

  // --- Transactions ---

  /**
   * Runs {@code work} in a multi-document transaction when the handle is transactional; joins a
   * transaction already open on this thread. Otherwise the work runs without isolation.\n
   */
  @Override
  public <T> T inTransaction(Supplier<T> work) {
    Objects.requireNonNull(work, "work");
    if (!handle.transactional() || sessionOrNull() != null) return work.get();

    ClientSession session = handle.client().startSession(ClientSessionOptions.builder().build());
    try {
      session.startTransaction();
      TX.set(new TxSlot(txMarker, session));
      T result;
      try {
        result = work.get();
      } catch (RuntimeException | Error e) {
        abort(session, e);
        throw e;
      } finally {
        TX.remove();
      }
      session.commitTransaction();
      return result;
    } finally {
      session.close();
    }
  }

  private static void abort(ClientSession session, Throwable cause) {
    try {
      session.abortTransaction();
    } catch (RuntimeException abortFailure) {
      cause.addSuppressed(abortFailure);
    }
  }

  private ClientSession sessionOrNull() {
    TxSlot slot = TX.get();
    return (slot != null && slot.marker() == this.txMarker) ? slot.session() : null;
  }

  private FindIterable<Document> findIterable(String collection, Bson filter) {
    MongoCollection<Document> col = db.getCollection(collection);
    ClientSession s = sessionOrNull();
    return (s == null) ? col.find(filter) : col.find(s, filter);
  }

  private void debugOp(String op, String collection) {
    if (!log.isDebugEnabled()) return;
    log.debug("crudkit.mongo op={} collection={} handleId={} database={} inTx={}",
        op, collection, handle.id(), handle.database(), sessionOrNull() != null);
  }

  private static void debugDone(String op, String collection, long result, long durationNanos) {
    if (!log.isDebugEnabled()) return;
    log.debug("crudkit.mongo_done op={} collection={} durationMs={} result={}",
        op, collection, durationNanos / 1_000_000.0, result);
  }

  private static Object bsonToJava(BsonValue v) {
    if (v == null) return null;
    if (v.isObjectId()) return v.asObjectId().getValue();
    if (v.isString()) return v.asString().getValue();
    if (v.isInt32()) return v.asInt32().getValue();
    if (v.isInt64()) return v.asInt64().getValue();
    return v.toString();
  }
}
