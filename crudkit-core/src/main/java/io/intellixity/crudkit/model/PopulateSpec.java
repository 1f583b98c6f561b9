package io.intellixity.crudkit.model;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import io.intellixity.crudkit.error.CrudValidationException;

/**
 * A relation to resolve while reading.\n
 *
 * @param path field on the document holding the reference (a single id or an array of ids)\n
 * @param from referenced collection; when null the model descriptor's relations are consulted\n
 * @param fields selection applied to the referenced documents\n
 * @param populate optional second-layer relation, resolved inside the referenced documents. It may
 *                 not nest further.\n
 */
@JsonDeserialize(using = PopulateSpecJsonDeserializer.class)
public record PopulateSpec(String path, String from, FieldSelection fields, PopulateSpec populate) {
  public PopulateSpec {
    if (path == null || path.isBlank()) throw new CrudValidationException("Populate spec requires a path");
    path = path.trim();
    from = (from == null || from.isBlank()) ? null : from.trim();
    fields = (fields == null) ? FieldSelection.all() : fields;
    if (populate != null && populate.populate() != null) {
      throw new CrudValidationException("Populate supports at most two levels (path '" + path + "')");
    }
  }

  public static PopulateSpec of(String path) {
    return new PopulateSpec(path, null, null, null);
  }

  public static PopulateSpec of(String path, String fields) {
    return new PopulateSpec(path, null, FieldSelection.parse(fields), null);
  }

  public PopulateSpec from(String collection) {
    return new PopulateSpec(path, collection, fields, populate);
  }

  public PopulateSpec thenPopulate(PopulateSpec nested) {
    return new PopulateSpec(path, from, fields, nested);
  }
}
