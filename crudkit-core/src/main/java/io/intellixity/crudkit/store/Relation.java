package io.intellixity.crudkit.store;

import io.intellixity.crudkit.model.FieldSelection;

import java.util.Objects;

/**
 * A populate spec resolved against its model: the referenced collection is known.\n
 *
 * @param path field holding the reference(s)\n
 * @param collection referenced collection, matched on {@code _id}\n
 * @param fields selection applied to referenced documents\n
 * @param nested optional second hop, resolved inside each referenced document\n
 */
public record Relation(String path, String collection, FieldSelection fields, Relation nested) {
  public Relation {
    Objects.requireNonNull(path, "path");
    Objects.requireNonNull(collection, "collection");
    fields = (fields == null) ? FieldSelection.all() : fields;
  }

  /** Selection for referenced documents: {@link #fields} plus the nested relation's path. */
  public FieldSelection targetFields() {
    return (nested == null) ? fields : fields.keeping(nested.path());
  }
}
