package io.intellixity.crudkit.service;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.intellixity.crudkit.error.CrudValidationException;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/** Converts caller payloads (maps or beans) into document maps. */
final class Payloads {
  private static final TypeReference<LinkedHashMap<String, Object>> DOC = new TypeReference<>() {};

  private final ObjectMapper mapper;

  Payloads(ObjectMapper mapper) {
    this.mapper = Objects.requireNonNull(mapper, "mapper");
  }

  /** Maps are copied as-is so store-native values (ids, dates) survive; beans go through Jackson. */
  Map<String, Object> toDocument(Object data) {
    if (data == null) throw new CrudValidationException("Payload is required");
    if (data instanceof Map<?, ?> m) {
      Map<String, Object> out = new LinkedHashMap<>();
      for (var e : m.entrySet()) {
        if (!(e.getKey() instanceof String k)) {
          throw new CrudValidationException("Payload keys must be strings, got: " + e.getKey());
        }
        out.put(k, e.getValue());
      }
      return out;
    }
    try {
      return mapper.convertValue(data, DOC);
    } catch (IllegalArgumentException e) {
      throw new CrudValidationException("Payload is not convertible to a document: " + data.getClass().getName(), e);
    }
  }
}
