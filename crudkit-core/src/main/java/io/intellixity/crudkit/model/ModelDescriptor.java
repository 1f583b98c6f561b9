package io.intellixity.crudkit.model;

import io.intellixity.crudkit.error.CrudValidationException;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Identifies the collection an operation targets and how its documents are masked.\n
 *
 * @param name logical model name (used in messages; defaults to the collection)\n
 * @param collection target collection\n
 * @param exempt fields removed from every returned document\n
 * @param relations document path to referenced collection; nested paths ({@code "author.company"})
 *                  resolve second-layer populates\n
 */
public record ModelDescriptor(String name, String collection, FieldSelection exempt, Map<String, String> relations) {
  public ModelDescriptor {
    if (collection == null || collection.isBlank()) {
      throw new CrudValidationException("Model descriptor requires a collection");
    }
    collection = collection.trim();
    name = (name == null || name.isBlank()) ? collection : name.trim();
    exempt = (exempt == null) ? FieldSelection.all() : exempt;
    relations = (relations == null) ? Map.of() : Map.copyOf(relations);
  }

  public static ModelDescriptor of(String collection) {
    return new ModelDescriptor(null, collection, FieldSelection.all(), Map.of());
  }

  public static ModelDescriptor of(String collection, String exempt) {
    return new ModelDescriptor(null, collection, FieldSelection.parse(exempt), Map.of());
  }

  public ModelDescriptor withName(String name) {
    return new ModelDescriptor(name, collection, exempt, relations);
  }

  public ModelDescriptor withRelation(String path, String targetCollection) {
    Map<String, String> next = new LinkedHashMap<>(relations);
    next.put(path, targetCollection);
    return new ModelDescriptor(name, collection, exempt, next);
  }

  /** Referenced collection for {@code path}, or null when the relation is not declared. */
  public String relation(String path) {
    return (path == null) ? null : relations.get(path);
  }
}
