package io.intellixity.crudkit.store;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Helpers for combining opaque, store-native filter documents. */
public final class Filters {
  private Filters() {}

  /** Conjunction of the non-empty parts; an empty map when every part is empty. */
  @SafeVarargs
  public static Map<String, Object> and(Map<String, Object>... parts) {
    List<Map<String, Object>> present = new ArrayList<>();
    for (Map<String, Object> p : parts) {
      if (p != null && !p.isEmpty()) present.add(p);
    }
    if (present.isEmpty()) return new LinkedHashMap<>();
    if (present.size() == 1) return present.get(0);
    Map<String, Object> out = new LinkedHashMap<>();
    out.put("$and", List.copyOf(present));
    return out;
  }
}
