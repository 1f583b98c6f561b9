package io.intellixity.crudkit.exec;

import io.intellixity.crudkit.model.ModelDescriptor;
import io.intellixity.crudkit.model.PopulateSpec;
import io.intellixity.crudkit.query.QueryParams;
import io.intellixity.crudkit.result.DeleteOutcome;
import io.intellixity.crudkit.result.ResultEnvelope;

import java.util.List;
import java.util.Map;

/**
 * Model-agnostic CRUD operations.\n
 *
 * Every call is independent: implementations hold no per-call state. Failures are raised as
 * {@link io.intellixity.crudkit.error.CrudException} subtypes; returned documents never contain the
 * descriptor's exempt fields.\n
 */
public interface CrudService {
  /** Inserts {@code data} unless a document matches {@code check}; a match raises a conflict. */
  <T> ResultEnvelope<Map<String, Object>> create(ModelDescriptor model, T data, Map<String, Object> check);

  /** All-or-nothing: a match on any of {@code checks} rejects the whole batch before anything is inserted. */
  <T> ResultEnvelope<List<Map<String, Object>>> createMany(ModelDescriptor model,
                                                          List<T> data,
                                                          List<Map<String, Object>> checks);

  /**
   * Applies {@code update} to every match of {@code filter}.\n
   *
   * Data is the updated document (one match), the updated documents (several) or the
   * {@link io.intellixity.crudkit.result.UpdateOutcome} metadata (no match, still a success).\n
   */
  ResultEnvelope<Object> update(ModelDescriptor model, Map<String, Object> update, Map<String, Object> filter);

  ResultEnvelope<List<Map<String, Object>>> getMany(ModelDescriptor model,
                                                   QueryParams query,
                                                   List<PopulateSpec> populate,
                                                   Map<String, Object> filter);

  /** Fan-out read: data holds one page per model, in model order; {@code doc_length} is the total. */
  ResultEnvelope<List<List<Map<String, Object>>>> getMany(List<ModelDescriptor> models,
                                                         QueryParams query,
                                                         List<PopulateSpec> populate,
                                                         Map<String, Object> filter);

  /** First match in store order; no match raises {@link io.intellixity.crudkit.error.NotFoundException}. */
  ResultEnvelope<Map<String, Object>> getOne(ModelDescriptor model, Map<String, Object> filter, List<PopulateSpec> populate);

  /** Deletes every match of {@code filter}; deleting nothing is a success. */
  ResultEnvelope<DeleteOutcome> delete(ModelDescriptor model, Map<String, Object> filter);

  default ResultEnvelope<List<Map<String, Object>>> getMany(ModelDescriptor model, QueryParams query) {
    return getMany(model, query, List.of(), null);
  }

  default ResultEnvelope<Map<String, Object>> getOne(ModelDescriptor model, Map<String, Object> filter) {
    return getOne(model, filter, List.of());
  }
}
