package io.intellixity.crudkit.mongo;

import org.bson.types.ObjectId;

import java.util.*;

/**
 * Reference collection and stitching for batched populate.\n
 *
 * References are matched by {@link #key}: an ObjectId and its hex string are the same reference.\n
 */
final class MongoPopulate {
  private MongoPopulate() {}

  /** Distinct references held at {@code path}, in the forms to query with ({@code $in}). */
  static List<Object> refs(List<Map<String, Object>> docs, String path) {
    Set<Object> out = new LinkedHashSet<>();
    for (Map<String, Object> d : docs) {
      if (d == null) continue;
      Object v = d.get(path);
      if (v instanceof List<?> list) {
        for (Object x : list) addRef(out, x);
      } else {
        addRef(out, v);
      }
    }
    return new ArrayList<>(out);
  }

  static Object key(Object id) {
    return (id instanceof ObjectId oid) ? oid.toHexString() : id;
  }

  /**
   * Replaces references at {@code path} with the documents in {@code byKey}. A single reference with no
   * match becomes null; unmatched entries of a reference array are dropped. Documents without the path
   * are returned as they are.\n
   */
  static List<Map<String, Object>> stitch(List<Map<String, Object>> docs, String path, Map<Object, Map<String, Object>> byKey) {
    List<Map<String, Object>> out = new ArrayList<>(docs.size());
    for (Map<String, Object> d : docs) {
      if (d == null || !d.containsKey(path)) {
        out.add(d);
        continue;
      }
      Map<String, Object> copy = new LinkedHashMap<>(d);
      Object v = copy.get(path);
      if (v instanceof List<?> list) {
        List<Object> resolved = new ArrayList<>(list.size());
        for (Object x : list) {
          Map<String, Object> hit = (x == null) ? null : byKey.get(key(x));
          if (hit != null) resolved.add(hit);
        }
        copy.put(path, resolved);
      } else {
        copy.put(path, (v == null) ? null : byKey.get(key(v)));
      }
      out.add(copy);
    }
    return out;
  }

  private static void addRef(Set<Object> out, Object ref) {
    if (ref == null) return;
    out.add(ref);
    Object oid = MongoValues.maybeObjectId(ref);
    if (oid != ref) out.add(oid);
  }
}
