package io.intellixity.crudkit.model;

import com.fasterxml.jackson.databind.JsonNode;
import io.intellixity.crudkit.error.CrudValidationException;

import java.util.ArrayList;
import java.util.List;

/**
 * Parsing for populate specs arriving as JSON or query strings.\n
 *
 * Accepted JSON forms:\n
 * <pre>
 * "author"
 * { "model": "author", "fields": "name email", "second_layer_populate": "company" }
 * { "path": "author", "from": "users", "populate": { "path": "company", "from": "companies" } }
 * [ ...any of the above... ]
 * </pre>
 */
public final class PopulateSpecs {
  private PopulateSpecs() {}

  public static List<PopulateSpec> fromJson(JsonNode node) {
    if (node == null || node.isNull() || node.isMissingNode()) return List.of();
    if (node.isArray()) {
      List<PopulateSpec> out = new ArrayList<>();
      for (JsonNode x : node) {
        PopulateSpec s = one(x, false);
        if (s != null) out.add(s);
      }
      return List.copyOf(out);
    }
    PopulateSpec s = one(node, false);
    return (s == null) ? List.of() : List.of(s);
  }

  /** Comma separated paths, e.g. {@code ?populate=author,tags}. */
  public static List<PopulateSpec> fromPaths(String csv) {
    if (csv == null || csv.isBlank()) return List.of();
    List<PopulateSpec> out = new ArrayList<>();
    for (String p : csv.split(",")) {
      if (!p.isBlank()) out.add(PopulateSpec.of(p.trim()));
    }
    return List.copyOf(out);
  }

  static PopulateSpec one(JsonNode n, boolean nested) {
    if (n == null || n.isNull()) return null;
    if (n.isTextual()) {
      String t = n.asText().trim();
      return t.isEmpty() ? null : PopulateSpec.of(t);
    }
    if (!n.isObject()) throw new CrudValidationException("Populate spec must be a string or an object: " + n);

    String path = textOrNull(n.get("path"));
    if (path == null) path = textOrNull(n.get("model"));
    if (path == null) throw new CrudValidationException("Populate spec requires 'path' or 'model': " + n);

    String fields = textOrNull(n.get("fields"));
    if (fields == null) fields = textOrNull(n.get("select"));

    JsonNode nestedNode = n.get("second_layer_populate");
    if (nestedNode == null) nestedNode = n.get("populate");
    PopulateSpec child = null;
    if (nestedNode != null && !nestedNode.isNull()) {
      if (nested) throw new CrudValidationException("Populate supports at most two levels (path '" + path + "')");
      child = one(nestedNode, true);
    }

    return new PopulateSpec(path, textOrNull(n.get("from")), FieldSelection.parse(fields), child);
  }

  private static String textOrNull(JsonNode n) {
    if (n == null || n.isNull()) return null;
    String t = n.asText();
    return (t == null || t.isBlank()) ? null : t;
  }
}
