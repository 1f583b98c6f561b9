package io.intellixity.crudkit.web.json;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.bson.types.Decimal128;
import org.bson.types.ObjectId;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class BsonJacksonModuleTest {

  @Test
  void objectId_rendersAsHex() throws Exception {
    ObjectMapper json = new ObjectMapper().registerModule(new BsonJacksonModule());
    ObjectId id = new ObjectId("65a1f0c2e4b0a1b2c3d4e5f6");

    String s = json.writeValueAsString(Map.of("_id", id, "price", new Decimal128(new BigDecimal("9.99"))));

    assertTrue(s.contains("\"_id\":\"65a1f0c2e4b0a1b2c3d4e5f6\""));
    assertTrue(s.contains("\"price\":\"9.99\""));
  }
}
