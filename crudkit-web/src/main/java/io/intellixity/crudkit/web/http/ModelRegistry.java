package io.intellixity.crudkit.web.http;

import io.intellixity.crudkit.error.CrudValidationException;
import io.intellixity.crudkit.model.FieldSelection;
import io.intellixity.crudkit.model.ModelDescriptor;
import io.intellixity.crudkit.web.config.CrudkitProperties;

import java.util.*;

/** Models exposed over HTTP, by the name used in request paths. */
public final class ModelRegistry {
  private final Map<String, ModelDescriptor> models;

  public ModelRegistry(Collection<ModelDescriptor> models) {
    Map<String, ModelDescriptor> m = new LinkedHashMap<>();
    for (ModelDescriptor d : models) {
      if (m.putIfAbsent(d.name(), d) != null) throw new IllegalArgumentException("Duplicate model name: " + d.name());
    }
    this.models = Collections.unmodifiableMap(m);
  }

  public static ModelRegistry from(Map<String, CrudkitProperties.Model> config) {
    List<ModelDescriptor> out = new ArrayList<>();
    for (var e : config.entrySet()) {
      CrudkitProperties.Model m = e.getValue();
      String collection = (m.getCollection() == null || m.getCollection().isBlank()) ? e.getKey() : m.getCollection();
      out.add(new ModelDescriptor(e.getKey(), collection, FieldSelection.parse(m.getExempt()), m.getRelations()));
    }
    return new ModelRegistry(out);
  }

  public ModelDescriptor require(String name) {
    ModelDescriptor d = (name == null) ? null : models.get(name.trim());
    if (d == null) throw new CrudValidationException("Unknown model '" + name + "'");
    return d;
  }

  /** Comma separated model names, in request order. */
  public List<ModelDescriptor> requireAll(String csv) {
    if (csv == null || csv.isBlank()) throw new CrudValidationException("At least one model name is required");
    List<ModelDescriptor> out = new ArrayList<>();
    for (String n : csv.split(",")) {
      if (!n.isBlank()) out.add(require(n));
    }
    return out;
  }
}
