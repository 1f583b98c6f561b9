package io.intellixity.crudkit.model;

import io.intellixity.crudkit.error.CrudValidationException;

import java.util.*;

/**
 * Which fields of a document are returned.\n
 *
 * Parsed from select strings: {@code "-password -secret"} excludes, {@code "name email"} includes,
 * {@code "name -_id"} includes without {@code _id}. Tokens are separated by whitespace or commas and
 * may use dotted paths. Inclusion and exclusion can not be mixed (except for {@code -_id}).\n
 */
public final class FieldSelection {
  public static final String ID = "_id";

  public enum Mode { ALL, INCLUDE, EXCLUDE }

  private static final FieldSelection ALL = new FieldSelection(Mode.ALL, Set.of(), false);

  private final Mode mode;
  private final Set<String> fields;
  private final boolean excludeId;

  private FieldSelection(Mode mode, Set<String> fields, boolean excludeId) {
    this.mode = mode;
    this.fields = fields;
    this.excludeId = excludeId;
  }

  public static FieldSelection all() {
    return ALL;
  }

  public static FieldSelection include(Collection<String> fields) {
    return include(fields, false);
  }

  public static FieldSelection include(Collection<String> fields, boolean excludeId) {
    Set<String> out = clean(fields);
    out.remove(ID);
    return new FieldSelection(Mode.INCLUDE, Collections.unmodifiableSet(out), excludeId);
  }

  public static FieldSelection exclude(Collection<String> fields) {
    Set<String> out = clean(fields);
    if (out.isEmpty()) return ALL;
    return new FieldSelection(Mode.EXCLUDE, Collections.unmodifiableSet(out), out.contains(ID));
  }

  public static FieldSelection parse(String spec) {
    if (spec == null || spec.isBlank()) return ALL;

    Set<String> included = new LinkedHashSet<>();
    Set<String> excluded = new LinkedHashSet<>();
    for (String raw : spec.trim().split("[\\s,]+")) {
      if (raw.isEmpty()) continue;
      if (raw.startsWith("-")) {
        String f = raw.substring(1);
        if (!f.isEmpty()) excluded.add(f);
      } else {
        String f = raw.startsWith("+") ? raw.substring(1) : raw;
        if (!f.isEmpty()) included.add(f);
      }
    }

    if (!included.isEmpty()) {
      boolean dropId = excluded.remove(ID);
      if (!excluded.isEmpty()) {
        throw new CrudValidationException("Cannot mix inclusion and exclusion in field selection: '" + spec + "'");
      }
      return include(included, dropId);
    }
    return exclude(excluded);
  }

  public Mode mode() { return mode; }
  public Set<String> fields() { return fields; }
  public boolean isAll() { return mode == Mode.ALL; }

  /** True if {@code _id} is removed from results. */
  public boolean excludesId() { return excludeId; }

  /** True if the top-level field survives this selection. */
  public boolean allows(String field) {
    if (field == null) return false;
    if (ID.equals(field)) return !excludeId;
    return switch (mode) {
      case ALL -> true;
      case EXCLUDE -> !fields.contains(field);
      case INCLUDE -> fields.contains(field) || hasChildPath(field);
    };
  }

  /**
   * The selection allowing only what both {@code this} and {@code other} allow.\n
   *
   * Paths are compared as written; {@code "a"} and {@code "a.b"} are treated as distinct.\n
   */
  public FieldSelection narrow(FieldSelection other) {
    if (other == null || other.isAll()) return this;
    if (this.isAll()) return other;

    boolean dropId = this.excludeId || other.excludeId;
    if (mode == Mode.EXCLUDE && other.mode == Mode.EXCLUDE) {
      Set<String> union = new LinkedHashSet<>(fields);
      union.addAll(other.fields);
      return exclude(union);
    }
    if (mode == Mode.INCLUDE && other.mode == Mode.INCLUDE) {
      Set<String> both = new LinkedHashSet<>(fields);
      both.retainAll(other.fields);
      return include(both, dropId);
    }
    FieldSelection inc = (mode == Mode.INCLUDE) ? this : other;
    FieldSelection exc = (mode == Mode.EXCLUDE) ? this : other;
    Set<String> kept = new LinkedHashSet<>(inc.fields);
    kept.removeAll(exc.fields);
    return include(kept, dropId);
  }

  /** This selection, widened so that {@code path} always survives. */
  public FieldSelection keeping(String path) {
    if (path == null || allows(path)) return this;
    Set<String> out = new LinkedHashSet<>(fields);
    if (mode == Mode.INCLUDE) {
      out.add(path);
      return include(out, excludeId);
    }
    out.remove(path);
    return exclude(out);
  }

  /** Copy of {@code document} with this selection applied; the input is not modified. */
  public Map<String, Object> apply(Map<String, Object> document) {
    if (document == null) return null;
    if (mode == Mode.ALL) return new LinkedHashMap<>(document);

    if (mode == Mode.EXCLUDE) {
      Map<String, Object> out = deepCopy(document);
      for (String path : fields) removePath(out, path.split("\\."), 0);
      return out;
    }

    Map<String, Object> out = new LinkedHashMap<>();
    if (!excludeId && document.containsKey(ID)) out.put(ID, document.get(ID));
    for (String path : fields) copyPath(document, out, path.split("\\."), 0);
    return out;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof FieldSelection that)) return false;
    return mode == that.mode && excludeId == that.excludeId && fields.equals(that.fields);
  }

  @Override
  public int hashCode() {
    return Objects.hash(mode, fields, excludeId);
  }

  /** Renders back to select-string form. */
  @Override
  public String toString() {
    StringJoiner j = new StringJoiner(" ");
    switch (mode) {
      case ALL -> { }
      case EXCLUDE -> fields.forEach(f -> j.add("-" + f));
      case INCLUDE -> {
        fields.forEach(j::add);
        if (excludeId) j.add("-" + ID);
      }
    }
    return j.toString();
  }

  private boolean hasChildPath(String field) {
    String prefix = field + ".";
    for (String f : fields) if (f.startsWith(prefix)) return true;
    return false;
  }

  private static Set<String> clean(Collection<String> fields) {
    Set<String> out = new LinkedHashSet<>();
    if (fields == null) return out;
    for (String f : fields) {
      if (f == null) continue;
      String t = f.trim();
      if (!t.isEmpty()) out.add(t);
    }
    return out;
  }

  @SuppressWarnings("unchecked")
  private static void removePath(Map<String, Object> doc, String[] parts, int i) {
    if (i == parts.length - 1) {
      doc.remove(parts[i]);
      return;
    }
    Object child = doc.get(parts[i]);
    if (child instanceof Map<?, ?> m) {
      removePath((Map<String, Object>) m, parts, i + 1);
    } else if (child instanceof List<?> list) {
      for (Object el : list) {
        if (el instanceof Map<?, ?> m) removePath((Map<String, Object>) m, parts, i + 1);
      }
    }
  }

  @SuppressWarnings("unchecked")
  private static void copyPath(Map<String, Object> src, Map<String, Object> dst, String[] parts, int i) {
    if (!src.containsKey(parts[i])) return;
    Object value = src.get(parts[i]);
    if (i == parts.length - 1) {
      dst.put(parts[i], deepCopyValue(value));
      return;
    }
    if (value instanceof Map<?, ?> m) {
      Object existing = dst.get(parts[i]);
      Map<String, Object> child = (existing instanceof Map<?, ?>) ? (Map<String, Object>) existing : new LinkedHashMap<>();
      copyPath((Map<String, Object>) m, child, parts, i + 1);
      dst.put(parts[i], child);
    } else if (value instanceof List<?> list) {
      Object existing = dst.get(parts[i]);
      List<Object> out = (existing instanceof List<?>) ? (List<Object>) existing : new ArrayList<>();
      int idx = 0;
      for (Object el : list) {
        if (!(el instanceof Map<?, ?> m)) continue;
        Map<String, Object> target;
        if (idx < out.size() && out.get(idx) instanceof Map<?, ?> prev) {
          target = (Map<String, Object>) prev;
        } else {
          target = new LinkedHashMap<>();
          out.add(target);
        }
        copyPath((Map<String, Object>) m, target, parts, i + 1);
        idx++;
      }
      dst.put(parts[i], out);
    }
  }

  @SuppressWarnings("unchecked")
  private static Map<String, Object> deepCopy(Map<String, Object> in) {
    Map<String, Object> out = new LinkedHashMap<>();
    for (var e : in.entrySet()) out.put(e.getKey(), deepCopyValue(e.getValue()));
    return out;
  }

  @SuppressWarnings("unchecked")
  private static Object deepCopyValue(Object v) {
    if (v instanceof Map<?, ?> m) return deepCopy((Map<String, Object>) m);
    if (v instanceof List<?> list) {
      List<Object> out = new ArrayList<>(list.size());
      for (Object el : list) out.add(deepCopyValue(el));
      return out;
    }
    return v;
  }
}
