package io.intellixity.crudkit.mongo;

import io.intellixity.crudkit.error.CrudValidationException;
import org.bson.Document;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class MongoUpdatesTest {

  @Test
  void plainFields_areWrappedInSet() {
    Document u = MongoUpdates.normalize(Map.of("name", "x"));
    assertEquals(new Document("$set", new Document("name", "x")), u);
  }

  @Test
  void operators_passThrough() {
    Document u = MongoUpdates.normalize(Map.of("$inc", Map.of("n", 1)));
    assertEquals(new Document("$inc", new Document("n", 1)), u);
  }

  @Test
  void plainFields_mergeIntoExistingSet() {
    Map<String, Object> in = new LinkedHashMap<>();
    in.put("$set", Map.of("a", 1));
    in.put("b", 2);
    in.put("$unset", Map.of("c", ""));

    Document u = MongoUpdates.normalize(in);

    Document set = (Document) u.get("$set");
    assertEquals(1, set.get("a"));
    assertEquals(2, set.get("b"));
    assertTrue(u.containsKey("$unset"));
  }

  @Test
  void empty_isValidationError() {
    assertThrows(CrudValidationException.class, () -> MongoUpdates.normalize(Map.of()));
    assertThrows(CrudValidationException.class, () -> MongoUpdates.normalize(Map.of("$set", "x", "a", 1)));
  }
}
