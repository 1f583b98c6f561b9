package io.intellixity.crudkit.web.http;

import com.fasterxml.jackson.databind.JsonNode;
import io.intellixity.crudkit.error.CrudValidationException;
import io.intellixity.crudkit.exec.CrudService;
import io.intellixity.crudkit.model.PopulateSpecs;
import io.intellixity.crudkit.query.QueryParams;
import io.intellixity.crudkit.result.ResultEnvelope;
import org.springframework.http.ResponseEntity;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * Generic CRUD endpoints for every configured model.\n
 *
 * GET query strings go through {@link QueryParams}: {@code page}, {@code limit}, {@code sort},
 * {@code fields}, {@code populate} (comma separated paths); every other key is a filter condition.\n
 */
@RestController
@RequestMapping("/api")
public final class CrudController {
  static final String MODELS_PARAM = "models";

  private final CrudService crud;
  private final ModelRegistry models;
  private final CrudResponder responder;

  public CrudController(CrudService crud, ModelRegistry models, CrudResponder responder) {
    this.crud = crud;
    this.models = models;
    this.responder = responder;
  }

  public record CreateRequest(Object data, Map<String, Object> check) {}

  public record BatchCreateRequest(List<Object> data, List<Map<String, Object>> check) {}

  public record UpdateRequest(Map<String, Object> filter, Map<String, Object> update) {}

  public record SearchRequest(Map<String, Object> query, JsonNode populate, Map<String, Object> filter) {}

  public record OneRequest(Map<String, Object> filter, JsonNode populate) {}

  public record DeleteRequest(Map<String, Object> filter) {}

  @PostMapping("/{model}")
  public ResponseEntity<ResultEnvelope<?>> create(@PathVariable("model") String model, @RequestBody CreateRequest req) {
    return responder.created(() -> crud.create(models.require(model), body(req).data(), req.check()));
  }

  @PostMapping("/{model}/batch")
  public ResponseEntity<ResultEnvelope<?>> createMany(@PathVariable("model") String model, @RequestBody BatchCreateRequest req) {
    return responder.created(() -> crud.createMany(models.require(model), body(req).data(), req.check()));
  }

  @PatchMapping("/{model}")
  public ResponseEntity<ResultEnvelope<?>> update(@PathVariable("model") String model, @RequestBody UpdateRequest req) {
    return responder.ok(() -> crud.update(models.require(model), body(req).update(), req.filter()));
  }

  @GetMapping("/search")
  public ResponseEntity<ResultEnvelope<?>> searchAll(@RequestParam MultiValueMap<String, String> params) {
    return responder.ok(() -> {
      MultiValueMap<String, String> rest = new LinkedMultiValueMap<>(params);
      List<String> names = rest.remove(MODELS_PARAM);
      String csv = (names == null) ? null : String.join(",", names);
      QueryParams query = QueryParams.of(rest);
      return crud.getMany(models.requireAll(csv), query,
          PopulateSpecs.fromPaths(query.first(QueryParams.POPULATE).orElse(null)), null);
    });
  }

  @GetMapping("/{model}")
  public ResponseEntity<ResultEnvelope<?>> list(@PathVariable("model") String model,
                                                @RequestParam MultiValueMap<String, String> params) {
    return responder.ok(() -> {
      QueryParams query = QueryParams.of(params);
      return crud.getMany(models.require(model), query,
          PopulateSpecs.fromPaths(query.first(QueryParams.POPULATE).orElse(null)), null);
    });
  }

  @PostMapping("/{model}/search")
  public ResponseEntity<ResultEnvelope<?>> search(@PathVariable("model") String model,
                                                  @RequestBody(required = false) SearchRequest req) {
    return responder.ok(() -> {
      SearchRequest r = (req == null) ? new SearchRequest(null, null, null) : req;
      return crud.getMany(models.require(model), QueryParams.of(r.query()), PopulateSpecs.fromJson(r.populate()), r.filter());
    });
  }

  @PostMapping("/{model}/one")
  public ResponseEntity<ResultEnvelope<?>> one(@PathVariable("model") String model, @RequestBody OneRequest req) {
    return responder.ok(() -> crud.getOne(models.require(model), body(req).filter(), PopulateSpecs.fromJson(req.populate())));
  }

  @PostMapping("/{model}/delete")
  public ResponseEntity<ResultEnvelope<?>> delete(@PathVariable("model") String model, @RequestBody DeleteRequest req) {
    return responder.ok(() -> crud.delete(models.require(model), body(req).filter()));
  }

  private static <R> R body(R req) {
    if (req == null) throw new CrudValidationException("Request body is required");
    return req;
  }
}
