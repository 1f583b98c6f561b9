package io.intellixity.crudkit.store;

import io.intellixity.crudkit.model.FieldSelection;
import io.intellixity.crudkit.query.PageRequest;
import io.intellixity.crudkit.query.SortField;
import io.intellixity.crudkit.result.DeleteOutcome;
import io.intellixity.crudkit.result.UpdateOutcome;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Minimal capability set the CRUD service needs from a document database.\n
 *
 * Filters and update expressions are store-native documents passed through unmodified. Implementations
 * report failures as unchecked exceptions; the service types them.\n
 */
public interface DocumentStore {
  List<Map<String, Object>> find(String collection,
                                 Map<String, Object> filter,
                                 FieldSelection projection,
                                 List<SortField> sort,
                                 PageRequest page);

  Optional<Map<String, Object>> findOne(String collection, Map<String, Object> filter, FieldSelection projection);

  /** Inserts and returns the stored document, including any generated {@code _id}. */
  Map<String, Object> insertOne(String collection, Map<String, Object> payload);

  List<Map<String, Object>> insertMany(String collection, List<Map<String, Object>> payloads);

  UpdateOutcome updateMany(String collection, Map<String, Object> filter, Map<String, Object> update);

  DeleteOutcome deleteMany(String collection, Map<String, Object> filter);

  /**
   * Replaces the reference(s) at {@code relation.path()} with the referenced documents.\n
   *
   * A single reference with no matching document becomes null; missing entries of a reference array are
   * dropped. Documents without the path are returned unchanged.\n
   */
  Map<String, Object> populate(Map<String, Object> document, Relation relation);

  /** Batch form of {@link #populate}; stores override this to resolve all references in one round trip. */
  default List<Map<String, Object>> populateAll(List<Map<String, Object>> documents, Relation relation) {
    List<Map<String, Object>> out = new ArrayList<>(documents.size());
    for (Map<String, Object> d : documents) out.add(populate(d, relation));
    return out;
  }

  /**
   * Runs {@code work} atomically when the store supports multi-document transactions.\n
   *
   * The default runs the work inline with no isolation.\n
   */
  default <T> T inTransaction(Supplier<T> work) {
    return work.get();
  }
}
