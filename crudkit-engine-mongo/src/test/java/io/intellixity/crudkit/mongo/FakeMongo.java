package io.intellixity.crudkit.mongo;

import com.mongodb.MongoClientSettings;
import com.mongodb.client.ClientSession;
import com.mongodb.client.FindIterable;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.MongoCursor;
import com.mongodb.client.MongoDatabase;
import com.mongodb.client.result.DeleteResult;
import com.mongodb.client.result.InsertManyResult;
import com.mongodb.client.result.InsertOneResult;
import com.mongodb.client.result.UpdateResult;
import org.bson.BsonDocument;
import org.bson.BsonDocumentReader;
import org.bson.BsonObjectId;
import org.bson.Document;
import org.bson.codecs.DecoderContext;
import org.bson.codecs.DocumentCodec;
import org.bson.conversions.Bson;
import org.bson.types.ObjectId;

import java.lang.reflect.InvocationHandler;
import java.lang.reflect.Proxy;
import java.util.*;

/**
 * In-memory stand-in for the sync driver, built from interface proxies.\n
 *
 * Supports what {@link MongoDocumentStore} calls: find (equality, {@code $in}, {@code $and}; top-level
 * projection; single-key sort; skip / limit), insertOne / insertMany, updateMany with {@code $set} and
 * deleteMany. Every collection call is recorded in {@link #ops} as {@code "<op> <collection>"}, with an
 * {@code @tx} suffix on the op when a session was passed.\n
 */
final class FakeMongo {
  final Map<String, List<Document>> collections = new LinkedHashMap<>();
  final List<String> ops = new ArrayList<>();
  final List<String> sessionEvents = new ArrayList<>();
  final Map<String, Document> lastProjection = new HashMap<>();
  ObjectId lastInsertedId;

  FakeMongo seed(String collection, Document doc) {
    docs(collection).add(doc);
    return this;
  }

  List<Document> docs(String collection) {
    return collections.computeIfAbsent(collection, c -> new ArrayList<>());
  }

  long count(String op) {
    return ops.stream().filter(op::equals).count();
  }

  MongoClient client() {
    return proxy(MongoClient.class, (p, m, args) -> switch (m.getName()) {
      case "getDatabase" -> database();
      case "startSession" -> session();
      default -> throw new UnsupportedOperationException("MongoClient." + m.getName());
    });
  }

  private MongoDatabase database() {
    return proxy(MongoDatabase.class, (p, m, args) -> {
      if (m.getName().equals("getCollection")) return collection((String) args[0]);
      throw new UnsupportedOperationException("MongoDatabase." + m.getName());
    });
  }

  private ClientSession session() {
    sessionEvents.add("open");
    return proxy(ClientSession.class, (p, m, args) -> {
      switch (m.getName()) {
        case "startTransaction" -> sessionEvents.add("start");
        case "commitTransaction" -> sessionEvents.add("commit");
        case "abortTransaction" -> sessionEvents.add("abort");
        case "close" -> sessionEvents.add("close");
        default -> throw new UnsupportedOperationException("ClientSession." + m.getName());
      }
      return null;
    });
  }

  @SuppressWarnings("unchecked")
  private MongoCollection<Document> collection(String name) {
    return proxy(MongoCollection.class, (p, m, all) -> {
      boolean inTx = all.length > 0 && all[0] instanceof ClientSession;
      Object[] args = inTx ? Arrays.copyOfRange(all, 1, all.length) : all;
      ops.add(m.getName() + (inTx ? "@tx " : " ") + name);
      switch (m.getName()) {
        case "find":
          return find(name, toDocument((Bson) args[0]));
        case "insertOne": {
          Document doc = (Document) args[0];
          Document stored = new Document(doc);
          if (!stored.containsKey("_id")) {
            lastInsertedId = new ObjectId();
            stored.put("_id", lastInsertedId);
          }
          docs(name).add(stored);
          return InsertOneResult.acknowledged(new BsonObjectId(stored.getObjectId("_id")));
        }
        case "insertMany": {
          for (Document doc : (List<Document>) args[0]) {
            if (!doc.containsKey("_id")) doc.put("_id", new ObjectId());
            docs(name).add(new Document(doc));
          }
          return InsertManyResult.acknowledged(Map.of());
        }
        case "updateMany": {
          Document filter = toDocument((Bson) args[0]);
          Document update = toDocument((Bson) args[1]);
          long matched = 0;
          long modified = 0;
          for (Document d : docs(name)) {
            if (!matches(d, filter)) continue;
            matched++;
            Document before = new Document(d);
            for (var e : update.entrySet()) {
              if (!e.getKey().equals("$set")) throw new IllegalArgumentException("Unsupported update key " + e.getKey());
              d.putAll((Document) e.getValue());
            }
            if (!before.equals(d)) modified++;
          }
          return UpdateResult.acknowledged(matched, modified, null);
        }
        case "deleteMany": {
          Document filter = toDocument((Bson) args[0]);
          List<Document> docs = docs(name);
          int before = docs.size();
          docs.removeIf(d -> matches(d, filter));
          return DeleteResult.acknowledged(before - docs.size());
        }
        default:
          throw new UnsupportedOperationException("MongoCollection." + m.getName());
      }
    });
  }

  @SuppressWarnings("unchecked")
  private FindIterable<Document> find(String collection, Document filter) {
    Document[] projection = {null};
    Document[] sort = {null};
    int[] skip = {0};
    int[] limit = {0};
    FindIterable<Document>[] self = new FindIterable[1];
    self[0] = proxy(FindIterable.class, (p, m, args) -> {
      switch (m.getName()) {
        case "projection":
          projection[0] = toDocument((Bson) args[0]);
          lastProjection.put(collection, projection[0]);
          return self[0];
        case "sort":
          sort[0] = toDocument((Bson) args[0]);
          return self[0];
        case "skip":
          skip[0] = (Integer) args[0];
          return self[0];
        case "limit":
          limit[0] = (Integer) args[0];
          return self[0];
        case "first": {
          List<Document> out = results(collection, filter, projection[0], sort[0], skip[0], limit[0]);
          return out.isEmpty() ? null : out.get(0);
        }
        case "iterator":
        case "cursor":
          return cursor(results(collection, filter, projection[0], sort[0], skip[0], limit[0]).iterator());
        default:
          throw new UnsupportedOperationException("FindIterable." + m.getName());
      }
    });
    return self[0];
  }

  private List<Document> results(String collection, Document filter, Document projection, Document sort, int skip, int limit) {
    List<Document> matched = new ArrayList<>();
    for (Document d : docs(collection)) if (matches(d, filter)) matched.add(d);
    if (sort != null && !sort.isEmpty()) {
      String key = sort.keySet().iterator().next();
      Comparator<Document> byKey = (x, y) -> compare(x.get(key), y.get(key));
      matched.sort(((Number) sort.get(key)).intValue() < 0 ? byKey.reversed() : byKey);
    }
    int from = Math.min(skip, matched.size());
    int to = (limit > 0) ? Math.min(from + limit, matched.size()) : matched.size();
    List<Document> out = new ArrayList<>();
    for (Document d : matched.subList(from, to)) out.add(project(d, projection));
    return out;
  }

  @SuppressWarnings({"unchecked", "rawtypes"})
  private static int compare(Object a, Object b) {
    if (a == null || b == null) return (a == null) ? ((b == null) ? 0 : -1) : 1;
    return ((Comparable) a).compareTo(b);
  }

  private static Document project(Document d, Document projection) {
    if (projection == null || projection.isEmpty()) return new Document(d);
    boolean inclusion = projection.values().stream().anyMatch(v -> Objects.equals(v, 1));
    Document out = new Document();
    if (inclusion) {
      if (!Objects.equals(projection.get("_id"), 0) && d.containsKey("_id")) out.put("_id", d.get("_id"));
      for (var e : projection.entrySet()) {
        if (Objects.equals(e.getValue(), 1) && d.containsKey(e.getKey())) out.put(e.getKey(), d.get(e.getKey()));
      }
      return out;
    }
    out.putAll(d);
    for (var e : projection.entrySet()) if (Objects.equals(e.getValue(), 0)) out.remove(e.getKey());
    return out;
  }

  private static MongoCursor<Document> cursor(Iterator<Document> it) {
    return proxy(MongoCursor.class, (p, m, args) -> switch (m.getName()) {
      case "hasNext" -> it.hasNext();
      case "next" -> it.next();
      case "close" -> null;
      default -> throw new UnsupportedOperationException("MongoCursor." + m.getName());
    });
  }

  @SuppressWarnings("unchecked")
  private static boolean matches(Document doc, Document filter) {
    for (var e : filter.entrySet()) {
      if (e.getKey().equals("$and")) {
        for (Object part : (List<Object>) e.getValue()) if (!matches(doc, (Document) part)) return false;
        continue;
      }
      Object actual = doc.get(e.getKey());
      Object cond = e.getValue();
      if (cond instanceof Document ops && !ops.isEmpty() && ops.keySet().iterator().next().startsWith("$")) {
        for (var op : ops.entrySet()) {
          boolean ok = switch (op.getKey()) {
            case "$eq" -> Objects.equals(actual, op.getValue());
            case "$in" -> ((List<Object>) op.getValue()).contains(actual);
            default -> throw new IllegalArgumentException("Unsupported operator " + op.getKey());
          };
          if (!ok) return false;
        }
      } else if (!Objects.equals(actual, cond)) {
        return false;
      }
    }
    return true;
  }

  private static Document toDocument(Bson bson) {
    if (bson instanceof Document d) return d;
    BsonDocument raw = bson.toBsonDocument(BsonDocument.class, MongoClientSettings.getDefaultCodecRegistry());
    return new DocumentCodec(MongoClientSettings.getDefaultCodecRegistry())
        .decode(new BsonDocumentReader(raw), DecoderContext.builder().build());
  }

  @SuppressWarnings("unchecked")
  private static <T> T proxy(Class<?> type, InvocationHandler handler) {
    return (T) Proxy.newProxyInstance(FakeMongo.class.getClassLoader(), new Class<?>[] {type}, (p, m, args) -> {
      if (m.getDeclaringClass() == Object.class) {
        return switch (m.getName()) {
          case "equals" -> p == args[0];
          case "hashCode" -> System.identityHashCode(p);
          default -> type.getSimpleName() + "(fake)";
        };
      }
      return handler.invoke(p, m, (args == null) ? new Object[0] : args);
    });
  }
}
