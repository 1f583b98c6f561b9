package io.intellixity.crudkit.web.http;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.intellixity.crudkit.error.CrudValidationException;
import io.intellixity.crudkit.error.NotFoundException;
import io.intellixity.crudkit.exec.CrudService;
import io.intellixity.crudkit.model.ModelDescriptor;
import io.intellixity.crudkit.model.PopulateSpec;
import io.intellixity.crudkit.query.QueryParams;
import io.intellixity.crudkit.result.DeleteOutcome;
import io.intellixity.crudkit.result.ResultEnvelope;
import io.intellixity.crudkit.web.error.Environment;
import io.intellixity.crudkit.web.error.ErrorNormalizer;
import org.junit.jupiter.api.Test;
import org.springframework.http.ResponseEntity;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;

import java.util.*;

import static org.junit.jupiter.api.Assertions.*;

final class CrudControllerTest {
  private static final ObjectMapper JSON = new ObjectMapper();

  /** Records the arguments of the last call and answers with canned envelopes. */
  private static final class CapturingCrudService implements CrudService {
    String op;
    List<ModelDescriptor> models = new ArrayList<>();
    Object data;
    Map<String, Object> filter;
    QueryParams query;
    List<PopulateSpec> populate;
    RuntimeException failure;

    private void call(String op, Object data, Map<String, Object> filter, ModelDescriptor... models) {
      this.op = op;
      this.data = data;
      this.filter = filter;
      this.models = List.of(models);
      if (failure != null) throw failure;
    }

    @Override
    public <T> ResultEnvelope<Map<String, Object>> create(ModelDescriptor model, T data, Map<String, Object> check) {
      call("create", data, check, model);
      return ResultEnvelope.ok("Successfully created", Map.of("_id", "1"));
    }

    @Override
    public <T> ResultEnvelope<List<Map<String, Object>>> createMany(ModelDescriptor model, List<T> data,
                                                                   List<Map<String, Object>> checks) {
      call("createMany", data, null, model);
      return ResultEnvelope.ok("Successfully created", List.of(), 0);
    }

    @Override
    public ResultEnvelope<Object> update(ModelDescriptor model, Map<String, Object> update, Map<String, Object> filter) {
      call("update", update, filter, model);
      return ResultEnvelope.ok("Successfully updated", Map.of());
    }

    @Override
    public ResultEnvelope<List<Map<String, Object>>> getMany(ModelDescriptor model, QueryParams query,
                                                            List<PopulateSpec> populate, Map<String, Object> filter) {
      this.query = query;
      this.populate = populate;
      call("getMany", null, filter, model);
      return ResultEnvelope.ok("Successfully fetched", List.of(), 0);
    }

    @Override
    public ResultEnvelope<List<List<Map<String, Object>>>> getMany(List<ModelDescriptor> models, QueryParams query,
                                                                  List<PopulateSpec> populate, Map<String, Object> filter) {
      this.query = query;
      this.populate = populate;
      call("getManyFanOut", null, filter, models.toArray(new ModelDescriptor[0]));
      return ResultEnvelope.ok("Successfully fetched", List.of(), 0);
    }

    @Override
    public ResultEnvelope<Map<String, Object>> getOne(ModelDescriptor model, Map<String, Object> filter,
                                                      List<PopulateSpec> populate) {
      this.populate = populate;
      call("getOne", null, filter, model);
      return ResultEnvelope.ok("Successfully fetched", Map.of());
    }

    @Override
    public ResultEnvelope<DeleteOutcome> delete(ModelDescriptor model, Map<String, Object> filter) {
      call("delete", null, filter, model);
      return ResultEnvelope.ok("Successfully deleted", new DeleteOutcome(0));
    }
  }

  private final CapturingCrudService crud = new CapturingCrudService();
  private final ModelRegistry models = new ModelRegistry(List.of(
      ModelDescriptor.of("users", "-password"),
      ModelDescriptor.of("posts").withRelation("author", "users")));

  private CrudController controller(boolean useNext) {
    return new CrudController(crud, models, new CrudResponder(new ErrorNormalizer(Environment.PRODUCTION), useNext));
  }

  @Test
  void create_routesToModel_andAnswers201() {
    ResponseEntity<ResultEnvelope<?>> r = controller(true).create("users",
        new CrudController.CreateRequest(Map.of("name", "a"), Map.of("name", "a")));

    assertEquals(201, r.getStatusCode().value());
    assertEquals("create", crud.op);
    assertEquals("users", crud.models.get(0).name());
    assertEquals(Map.of("name", "a"), crud.filter);
  }

  @Test
  void batch_is201() {
    ResponseEntity<ResultEnvelope<?>> r = controller(true).createMany("users",
        new CrudController.BatchCreateRequest(List.of(Map.of("a", 1)), List.of(Map.of("a", 1))));
    assertEquals(201, r.getStatusCode().value());
    assertEquals("createMany", crud.op);
  }

  @Test
  void list_passesQueryStringAndPopulatePaths() {
    MultiValueMap<String, String> params = new LinkedMultiValueMap<>();
    params.add("page", "2");
    params.add("status", "open");
    params.add("populate", "author");

    ResponseEntity<ResultEnvelope<?>> r = controller(true).list("posts", params);

    assertEquals(200, r.getStatusCode().value());
    assertEquals("getMany", crud.op);
    assertEquals(2, crud.query.page(10).page());
    assertEquals(Map.of("status", "open"), crud.query.filter());
    assertEquals(List.of(PopulateSpec.of("author")), crud.populate);
  }

  @Test
  void searchAll_fansOut_andDropsModelsParamFromFilter() {
    MultiValueMap<String, String> params = new LinkedMultiValueMap<>();
    params.add("models", "posts,users");
    params.add("limit", "5");

    controller(true).searchAll(params);

    assertEquals("getManyFanOut", crud.op);
    assertEquals(List.of("posts", "users"), crud.models.stream().map(ModelDescriptor::name).toList());
    assertTrue(crud.query.filter().isEmpty());
  }

  @Test
  void search_acceptsStructuredPopulate() throws Exception {
    CrudController.SearchRequest req = new CrudController.SearchRequest(
        Map.of("limit", 3),
        JSON.readTree("{\"model\": \"author\", \"fields\": \"name\"}"),
        Map.of("published", true));

    controller(true).search("posts", req);

    assertEquals(3, crud.query.page(10).limit());
    assertEquals("author", crud.populate.get(0).path());
    assertEquals(Map.of("published", true), crud.filter);
  }

  @Test
  void oneUpdateDelete_are200() {
    CrudController c = controller(true);

    assertEquals(200, c.one("users", new CrudController.OneRequest(Map.of("_id", "1"), null)).getStatusCode().value());
    assertEquals("getOne", crud.op);
    assertEquals(200, c.update("users", new CrudController.UpdateRequest(Map.of("_id", "1"), Map.of("name", "b"))).getStatusCode().value());
    assertEquals("update", crud.op);
    assertEquals(200, c.delete("users", new CrudController.DeleteRequest(Map.of("_id", "1"))).getStatusCode().value());
    assertEquals("delete", crud.op);
  }

  @Test
  void unknownModel_isValidation_beforeService() {
    assertThrows(CrudValidationException.class, () ->
        controller(true).delete("orders", new CrudController.DeleteRequest(Map.of())));
    assertNull(crud.op);

    ResponseEntity<ResultEnvelope<?>> r = controller(false).delete("orders", new CrudController.DeleteRequest(Map.of()));
    assertEquals(400, r.getStatusCode().value());
  }

  @Test
  void serviceFailure_inline_usesNormalizer() {
    crud.failure = new NotFoundException("Document not found in users");

    ResponseEntity<ResultEnvelope<?>> r = controller(false).one("users", new CrudController.OneRequest(Map.of("_id", "x"), null));

    assertEquals(404, r.getStatusCode().value());
    assertEquals("Document not found in users", r.getBody().message());
  }

  @Test
  void missingBody_isValidation() {
    ResponseEntity<ResultEnvelope<?>> r = controller(false).create("users", null);
    assertEquals(400, r.getStatusCode().value());
  }
}
