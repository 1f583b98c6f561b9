package io.intellixity.crudkit.service;

import io.intellixity.crudkit.model.ModelDescriptor;
import io.intellixity.crudkit.model.PopulateSpec;
import io.intellixity.crudkit.store.DocumentStore;
import io.intellixity.crudkit.store.Relation;

import java.util.*;

/**
 * Populate specs resolved against a model descriptor.\n
 *
 * A spec resolves when it names its collection ({@code from}) or the descriptor declares a relation for
 * its path; second-layer specs may also be declared as {@code "path.nested"}. Unresolved relations are not
 * errors: their values are cleared (null, or an empty list for reference arrays).\n
 */
final class PopulatePlan {
  private static final PopulatePlan EMPTY = new PopulatePlan(List.of());

  private record Step(String path, Relation relation, String unresolvedNested) {}

  private final List<Step> steps;

  private PopulatePlan(List<Step> steps) {
    this.steps = steps;
  }

  static PopulatePlan resolve(ModelDescriptor model, List<PopulateSpec> specs) {
    if (specs == null || specs.isEmpty()) return EMPTY;
    List<Step> out = new ArrayList<>();
    for (PopulateSpec spec : specs) {
      if (spec == null) continue;
      String collection = (spec.from() != null) ? spec.from() : model.relation(spec.path());
      if (collection == null) {
        out.add(new Step(spec.path(), null, null));
        continue;
      }

      Relation nested = null;
      String unresolvedNested = null;
      PopulateSpec child = spec.populate();
      if (child != null) {
        String childCollection = (child.from() != null)
            ? child.from()
            : model.relation(spec.path() + "." + child.path());
        if (childCollection == null) {
          unresolvedNested = child.path();
        } else {
          nested = new Relation(child.path(), childCollection, child.fields(), null);
        }
      }
      out.add(new Step(spec.path(), new Relation(spec.path(), collection, spec.fields(), nested), unresolvedNested));
    }
    return new PopulatePlan(List.copyOf(out));
  }

  boolean isEmpty() {
    return steps.isEmpty();
  }

  List<Map<String, Object>> apply(DocumentStore store, List<Map<String, Object>> documents) {
    List<Map<String, Object>> docs = documents;
    for (Step step : steps) {
      if (step.relation() == null) {
        docs = clearAll(docs, step.path());
        continue;
      }
      docs = store.populateAll(docs, step.relation());
      if (step.unresolvedNested() != null) docs = clearNested(docs, step.path(), step.unresolvedNested());
    }
    return docs;
  }

  private static List<Map<String, Object>> clearAll(List<Map<String, Object>> docs, String path) {
    List<Map<String, Object>> out = new ArrayList<>(docs.size());
    for (Map<String, Object> d : docs) out.add(clear(d, path));
    return out;
  }

  @SuppressWarnings("unchecked")
  private static List<Map<String, Object>> clearNested(List<Map<String, Object>> docs, String path, String nested) {
    List<Map<String, Object>> out = new ArrayList<>(docs.size());
    for (Map<String, Object> d : docs) {
      if (d == null || !d.containsKey(path)) {
        out.add(d);
        continue;
      }
      Map<String, Object> copy = new LinkedHashMap<>(d);
      Object v = copy.get(path);
      if (v instanceof Map<?, ?> m) {
        copy.put(path, clear((Map<String, Object>) m, nested));
      } else if (v instanceof List<?> list) {
        List<Object> items = new ArrayList<>(list.size());
        for (Object x : list) items.add((x instanceof Map<?, ?> m) ? clear((Map<String, Object>) m, nested) : x);
        copy.put(path, items);
      }
      out.add(copy);
    }
    return out;
  }

  private static Map<String, Object> clear(Map<String, Object> doc, String path) {
    if (doc == null || !doc.containsKey(path)) return doc;
    Map<String, Object> copy = new LinkedHashMap<>(doc);
    copy.put(path, (copy.get(path) instanceof List<?>) ? new ArrayList<>() : null);
    return copy;
  }
}
