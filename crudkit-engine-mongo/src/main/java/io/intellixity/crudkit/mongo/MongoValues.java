package io.intellixity.crudkit.mongo;

import io.intellixity.crudkit.error.CrudValidationException;
import org.bson.Document;
import org.bson.types.ObjectId;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.*;

/**
 * Converts caller-supplied maps into BSON-ready documents.\n
 *
 * Extended JSON wrappers are honoured: {@code {"$oid": "..."}} becomes an {@link ObjectId},
 * {@code {"$date": "..."}} (ISO-8601 or epoch millis) becomes a {@link Date}. In filters, {@code _id}
 * strings that are valid ObjectId hex are matched as ObjectIds.\n
 */
final class MongoValues {
  static final String ID = "_id";

  private MongoValues() {}

  static Document document(Map<String, Object> in) {
    Document out = new Document();
    if (in == null) return out;
    for (var e : in.entrySet()) out.put(e.getKey(), value(e.getValue()));
    return out;
  }

  static Document filter(Map<String, Object> in) {
    Document out = document(in);
    coerceIds(out);
    return out;
  }

  @SuppressWarnings("unchecked")
  static Object value(Object v) {
    if (v instanceof Map<?, ?> m) {
      if (m.size() == 1) {
        Object oid = m.get("$oid");
        if (oid != null) return objectId(oid);
        Object date = m.get("$date");
        if (date != null) return date(date);
      }
      return document((Map<String, Object>) m);
    }
    if (v instanceof List<?> list) {
      List<Object> out = new ArrayList<>(list.size());
      for (Object x : list) out.add(value(x));
      return out;
    }
    return v;
  }

  /** ObjectId for valid hex strings, the value itself otherwise. */
  static Object maybeObjectId(Object v) {
    if (v instanceof String s && ObjectId.isValid(s)) return new ObjectId(s);
    return v;
  }

  @SuppressWarnings("unchecked")
  private static void coerceIds(Document filter) {
    for (var e : filter.entrySet()) {
      String key = e.getKey();
      Object v = e.getValue();
      if (key.equals("$and") || key.equals("$or") || key.equals("$nor")) {
        if (v instanceof List<?> parts) {
          for (Object p : parts) if (p instanceof Document d) coerceIds(d);
        }
      } else if (key.equals(ID)) {
        if (v instanceof Document ops) {
          for (var op : ops.entrySet()) op.setValue(idOperand(op.getValue()));
        } else {
          e.setValue(maybeObjectId(v));
        }
      }
    }
  }

  private static Object idOperand(Object v) {
    if (v instanceof List<?> list) {
      List<Object> out = new ArrayList<>(list.size());
      for (Object x : list) out.add(maybeObjectId(x));
      return out;
    }
    return maybeObjectId(v);
  }

  private static ObjectId objectId(Object raw) {
    String s = String.valueOf(raw);
    if (!ObjectId.isValid(s)) throw new CrudValidationException("Invalid $oid value '" + s + "'");
    return new ObjectId(s);
  }

  private static Date date(Object raw) {
    if (raw instanceof Number n) return new Date(n.longValue());
    String s = String.valueOf(raw);
    try {
      return Date.from(Instant.parse(s));
    } catch (DateTimeParseException e) {
      throw new CrudValidationException("Invalid $date value '" + s + "'", e);
    }
  }
}
