package io.intellixity.crudkit.model;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.intellixity.crudkit.error.CrudValidationException;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

final class PopulateSpecJsonTest {
  private static final ObjectMapper JSON = new ObjectMapper();

  @Test
  void parsesBareString() throws Exception {
    PopulateSpec s = JSON.readValue("\"author\"", PopulateSpec.class);
    assertEquals("author", s.path());
    assertNull(s.from());
    assertTrue(s.fields().isAll());
    assertNull(s.populate());
  }

  @Test
  void parsesModelFieldsAndSecondLayer() throws Exception {
    String s = """
        {
          "model": "author",
          "fields": "name email",
          "second_layer_populate": { "path": "company", "select": "-revenue" }
        }
        """;
    PopulateSpec p = JSON.readValue(s, PopulateSpec.class);
    assertEquals("author", p.path());
    assertEquals(Set.of("name", "email"), p.fields().fields());
    assertNotNull(p.populate());
    assertEquals("company", p.populate().path());
    assertEquals(FieldSelection.Mode.EXCLUDE, p.populate().fields().mode());
  }

  @Test
  void parsesPathFromAndArrays() throws Exception {
    String s = """
        [ "tags", { "path": "author", "from": "users", "populate": "company" } ]
        """;
    List<PopulateSpec> specs = JSON.readValue(s, new TypeReference<List<PopulateSpec>>() {});
    assertEquals(2, specs.size());
    assertEquals("tags", specs.get(0).path());
    assertEquals("users", specs.get(1).from());
    assertEquals("company", specs.get(1).populate().path());

    assertEquals(specs, PopulateSpecs.fromJson(JSON.readTree(s)));
  }

  @Test
  void thirdLevel_isRejected() {
    String s = """
        { "path": "a", "populate": { "path": "b", "populate": { "path": "c" } } }
        """;
    Exception ex = assertThrows(Exception.class, () -> JSON.readValue(s, PopulateSpec.class));
    assertTrue(ex instanceof CrudValidationException || ex.getCause() instanceof CrudValidationException,
        "unexpected: " + ex);
    assertThrows(CrudValidationException.class, () -> PopulateSpecs.fromJson(JSON.readTree(s)));
  }

  @Test
  void missingPath_isRejected() {
    assertThrows(CrudValidationException.class, () -> PopulateSpecs.fromJson(JSON.readTree("{ \"fields\": \"a\" }")));
    assertThrows(CrudValidationException.class, () -> PopulateSpecs.fromJson(JSON.readTree("42")));
  }

  @Test
  void fromPaths_splitsCsv() {
    assertEquals(List.of(PopulateSpec.of("author"), PopulateSpec.of("tags")), PopulateSpecs.fromPaths("author, tags,"));
    assertEquals(List.of(), PopulateSpecs.fromPaths(null));
    assertEquals(List.of(), PopulateSpecs.fromJson(null));
  }
}
