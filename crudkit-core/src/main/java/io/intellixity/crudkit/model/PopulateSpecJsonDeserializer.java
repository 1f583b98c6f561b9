package io.intellixity.crudkit.model;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonNode;

import java.io.IOException;

/** JSON deserializer for a single {@link PopulateSpec}; see {@link PopulateSpecs} for the accepted forms. */
public final class PopulateSpecJsonDeserializer extends JsonDeserializer<PopulateSpec> {
  @Override
  public PopulateSpec deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
    JsonNode root = p.getCodec().readTree(p);
    return PopulateSpecs.one(root, false);
  }
}
