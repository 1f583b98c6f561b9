package io.intellixity.crudkit.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.intellixity.crudkit.error.ConflictException;
import io.intellixity.crudkit.error.CrudException;
import io.intellixity.crudkit.error.CrudValidationException;
import io.intellixity.crudkit.error.InternalStoreException;
import io.intellixity.crudkit.error.NotFoundException;
import io.intellixity.crudkit.exec.CrudService;
import io.intellixity.crudkit.model.FieldSelection;
import io.intellixity.crudkit.model.ModelDescriptor;
import io.intellixity.crudkit.model.PopulateSpec;
import io.intellixity.crudkit.query.PageRequest;
import io.intellixity.crudkit.query.QueryParams;
import io.intellixity.crudkit.query.SortField;
import io.intellixity.crudkit.result.DeleteOutcome;
import io.intellixity.crudkit.result.ResultEnvelope;
import io.intellixity.crudkit.result.UpdateOutcome;
import io.intellixity.crudkit.store.DocumentStore;
import io.intellixity.crudkit.store.Filters;

import java.util.*;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.function.Supplier;

/**
 * Stateless {@link CrudService} over a {@link DocumentStore}.\n
 *
 * Responsibilities:\n
 * - validate descriptors, filters and payloads before touching the store\n
 * - duplicate prevention on create (check, then insert)\n
 * - pagination defaults, query-derived filters, populate resolution, multi-model fan-out\n
 * - masking of exempt fields on every returned document\n
 * - typing store failures as {@link InternalStoreException}\n
 *
 * {@link #createMany} runs its checks and the insert inside {@link DocumentStore#inTransaction}. Stores
 * without multi-document transactions leave a window between the last check and the insert in which a
 * concurrent writer can create a duplicate.\n
 */
public final class DefaultCrudService implements CrudService {
  static final String CREATED = "Successfully created";
  static final String FETCHED = "Successfully fetched";
  static final String UPDATED = "Successfully updated";
  static final String DELETED = "Successfully deleted";

  private final DocumentStore store;
  private final CrudSettings settings;
  private final Executor fanOutExecutor;
  private final Payloads payloads;

  public DefaultCrudService(DocumentStore store) {
    this(store, CrudSettings.defaults(), Runnable::run, new ObjectMapper());
  }

  /**
   * @param fanOutExecutor runs the per-model reads of a multi-model {@code getMany}; {@code Runnable::run}
   *                       keeps them on the caller thread\n
   */
  public DefaultCrudService(DocumentStore store, CrudSettings settings, Executor fanOutExecutor, ObjectMapper mapper) {
    this.store = Objects.requireNonNull(store, "store");
    this.settings = (settings == null) ? CrudSettings.defaults() : settings;
    this.fanOutExecutor = (fanOutExecutor == null) ? Runnable::run : fanOutExecutor;
    this.payloads = new Payloads((mapper == null) ? new ObjectMapper() : mapper);
  }

  // --- Writes ---

  @Override
  public <T> ResultEnvelope<Map<String, Object>> create(ModelDescriptor model, T data, Map<String, Object> check) {
    requireModel(model);
    requireFilter(check, "check");
    Map<String, Object> doc = payloads.toDocument(data);

    Map<String, Object> created = guard(model, "create", () -> {
      if (store.findOne(model.collection(), check, FieldSelection.all()).isPresent()) {
        throw new ConflictException("Document already exists in " + model.name());
      }
      return store.insertOne(model.collection(), doc);
    });
    return ResultEnvelope.ok(CREATED, model.exempt().apply(created));
  }

  @Override
  public <T> ResultEnvelope<List<Map<String, Object>>> createMany(ModelDescriptor model,
                                                                 List<T> data,
                                                                 List<Map<String, Object>> checks) {
    requireModel(model);
    if (data == null || checks == null) throw new CrudValidationException("createMany requires data and checks");
    if (data.size() != checks.size()) {
      throw new CrudValidationException("createMany requires one check per document (data=" + data.size()
          + ", checks=" + checks.size() + ")");
    }
    if (data.isEmpty()) throw new CrudValidationException("createMany requires at least one document");
    for (Map<String, Object> c : checks) requireFilter(c, "check");

    List<Map<String, Object>> docs = new ArrayList<>(data.size());
    for (T d : data) docs.add(payloads.toDocument(d));

    List<Map<String, Object>> created = guard(model, "createMany", () -> store.inTransaction(() -> {
      // Sequential on purpose: every check must see the same pre-insert state.
      for (int i = 0; i < checks.size(); i++) {
        if (store.findOne(model.collection(), checks.get(i), FieldSelection.all()).isPresent()) {
          throw new ConflictException("Document already exists in " + model.name() + " (batch index " + i + ")");
        }
      }
      return store.insertMany(model.collection(), docs);
    }));
    return ResultEnvelope.ok(CREATED, mask(model.exempt(), created), created.size());
  }

  @Override
  public ResultEnvelope<Object> update(ModelDescriptor model, Map<String, Object> update, Map<String, Object> filter) {
    requireModel(model);
    if (update == null || update.isEmpty()) throw new CrudValidationException("update requires a non-empty update expression");
    requireFilter(filter, "filter");

    UpdateOutcome outcome = guard(model, "update", () -> store.updateMany(model.collection(), filter, update));
    List<Map<String, Object>> docs = mask(model.exempt(), outcome.documents());
    if (docs.isEmpty()) return ResultEnvelope.ok(UPDATED, outcome);
    if (docs.size() == 1) return ResultEnvelope.ok(UPDATED, docs.get(0));
    return ResultEnvelope.ok(UPDATED, docs, docs.size());
  }

  @Override
  public ResultEnvelope<DeleteOutcome> delete(ModelDescriptor model, Map<String, Object> filter) {
    requireModel(model);
    requireFilter(filter, "filter");
    DeleteOutcome outcome = guard(model, "delete", () -> store.deleteMany(model.collection(), filter));
    return ResultEnvelope.ok(DELETED, outcome);
  }

  // --- Reads ---

  @Override
  public ResultEnvelope<List<Map<String, Object>>> getMany(ModelDescriptor model,
                                                          QueryParams query,
                                                          List<PopulateSpec> populate,
                                                          Map<String, Object> filter) {
    requireModel(model);
    ReadRequest req = ReadRequest.of(query, filter, settings);
    List<Map<String, Object>> docs = readPage(model, req, populate);
    return ResultEnvelope.ok(FETCHED, docs, docs.size());
  }

  @Override
  public ResultEnvelope<List<List<Map<String, Object>>>> getMany(List<ModelDescriptor> models,
                                                                QueryParams query,
                                                                List<PopulateSpec> populate,
                                                                Map<String, Object> filter) {
    if (models == null || models.isEmpty()) throw new CrudValidationException("At least one model descriptor is required");
    for (ModelDescriptor m : models) requireModel(m);
    ReadRequest req = ReadRequest.of(query, filter, settings);

    List<CompletableFuture<List<Map<String, Object>>>> pending = new ArrayList<>(models.size());
    for (ModelDescriptor m : models) {
      pending.add(CompletableFuture.supplyAsync(() -> readPage(m, req, populate), fanOutExecutor));
    }

    List<List<Map<String, Object>>> pages = new ArrayList<>(models.size());
    int total = 0;
    for (CompletableFuture<List<Map<String, Object>>> f : pending) {
      List<Map<String, Object>> page;
      try {
        page = join(f);
      } catch (RuntimeException | Error e) {
        // reads not yet started are skipped
        for (CompletableFuture<?> other : pending) other.cancel(false);
        throw e;
      }
      pages.add(page);
      total += page.size();
    }
    return ResultEnvelope.ok(FETCHED, pages, total);
  }

  @Override
  public ResultEnvelope<Map<String, Object>> getOne(ModelDescriptor model,
                                                   Map<String, Object> filter,
                                                   List<PopulateSpec> populate) {
    requireModel(model);
    requireFilter(filter, "filter");
    PopulatePlan plan = PopulatePlan.resolve(model, populate);

    Map<String, Object> doc = guard(model, "getOne", () -> {
      Optional<Map<String, Object>> found = store.findOne(model.collection(), filter, model.exempt());
      if (found.isEmpty()) return null;
      List<Map<String, Object>> one = new ArrayList<>(1);
      one.add(found.get());
      return plan.apply(store, one).get(0);
    });
    if (doc == null) throw new NotFoundException("Document not found in " + model.name());
    return ResultEnvelope.ok(FETCHED, model.exempt().apply(doc));
  }

  private List<Map<String, Object>> readPage(ModelDescriptor model, ReadRequest req, List<PopulateSpec> populate) {
    PopulatePlan plan = PopulatePlan.resolve(model, populate);
    FieldSelection selection = model.exempt().narrow(req.fields());

    List<Map<String, Object>> docs = guard(model, "getMany", () -> {
      List<Map<String, Object>> found = store.find(model.collection(), req.filter(), selection, req.sort(), req.page());
      if (found.isEmpty() || plan.isEmpty()) return found;
      return plan.apply(store, found);
    });
    return mask(selection, docs);
  }

  /** Per-call read parameters, shared by every model of a fan-out read. */
  private record ReadRequest(PageRequest page, List<SortField> sort, FieldSelection fields, Map<String, Object> filter) {
    static ReadRequest of(QueryParams query, Map<String, Object> explicit, CrudSettings settings) {
      QueryParams q = (query == null) ? QueryParams.empty() : query;
      return new ReadRequest(
          q.page(settings.defaultPageSize()),
          q.sort(),
          q.fields(),
          Filters.and(q.filter(), explicit));
    }
  }

  // --- Helpers ---

  private static void requireModel(ModelDescriptor model) {
    if (model == null) throw new CrudValidationException("Model descriptor is required");
  }

  private static void requireFilter(Map<String, Object> filter, String what) {
    if (filter == null) throw new CrudValidationException("A " + what + " filter is required");
  }

  private static List<Map<String, Object>> mask(FieldSelection selection, List<Map<String, Object>> docs) {
    List<Map<String, Object>> out = new ArrayList<>(docs.size());
    for (Map<String, Object> d : docs) out.add(selection.apply(d));
    return out;
  }

  /**
   * Runs store work, leaving typed failures and cancellation untouched and wrapping anything else.\n
   */
  private static <R> R guard(ModelDescriptor model, String op, Supplier<R> work) {
    try {
      return work.get();
    } catch (CrudException | CancellationException e) {
      throw e;
    } catch (RuntimeException e) {
      if (Thread.currentThread().isInterrupted()) throw e;
      throw new InternalStoreException(op + " failed on " + model.name() + ": " + e.getMessage(), e);
    }
  }

  private static <R> R join(CompletableFuture<R> f) {
    try {
      return f.join();
    } catch (CompletionException e) {
      Throwable cause = e.getCause();
      if (cause instanceof RuntimeException re) throw re;
      if (cause instanceof Error err) throw err;
      throw e;
    }
  }
}
