package io.intellixity.crudkit.mongo;

import io.intellixity.crudkit.error.CrudValidationException;
import org.bson.Document;

import java.util.Map;

/** Update-expression normalization. */
final class MongoUpdates {
  private MongoUpdates() {}

  /**
   * Plain fields are moved under {@code $set}; operator keys ({@code $inc}, {@code $push}, ...) pass
   * through. {@code {"name": "x"}} and {@code {"$set": {"name": "x"}}} are equivalent.\n
   */
  static Document normalize(Map<String, Object> update) {
    if (update == null || update.isEmpty()) throw new CrudValidationException("Update expression is empty");
    Document in = MongoValues.document(update);
    Document out = new Document();
    Document plain = new Document();
    for (var e : in.entrySet()) {
      if (e.getKey().startsWith("$")) {
        out.put(e.getKey(), e.getValue());
      } else {
        plain.put(e.getKey(), e.getValue());
      }
    }
    if (plain.isEmpty()) return out;

    Object set = out.get("$set");
    if (set == null) {
      out.put("$set", plain);
    } else if (set instanceof Document d) {
      Document merged = new Document(d);
      merged.putAll(plain);
      out.put("$set", merged);
    } else {
      throw new CrudValidationException("$set must be a document");
    }
    return out;
  }
}
