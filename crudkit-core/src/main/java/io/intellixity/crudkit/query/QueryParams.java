package io.intellixity.crudkit.query;

import io.intellixity.crudkit.error.CrudValidationException;
import io.intellixity.crudkit.model.FieldSelection;

import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Untyped query-string bag for list reads.\n
 *
 * Reserved keys: {@code page}, {@code limit}, {@code sort}, {@code fields}, {@code populate}. Every other
 * key becomes a filter condition: {@code status=open} is an equality, {@code age[gte]=21} maps to
 * {@code {"age": {"$gte": 21}}}. Absent keys fall back to defaults; nothing here is required.\n
 */
public final class QueryParams {
  public static final String PAGE = "page";
  public static final String LIMIT = "limit";
  public static final String SORT = "sort";
  public static final String FIELDS = "fields";
  public static final String POPULATE = "populate";

  public static final Set<String> RESERVED = Set.of(PAGE, LIMIT, SORT, FIELDS, POPULATE);

  private static final Set<String> OPERATORS = Set.of("gt", "gte", "lt", "lte", "ne", "in", "nin");
  private static final Pattern BRACKET = Pattern.compile("^([^\\[\\]]+)\\[([a-zA-Z]+)]$");
  // literals with leading zeros (zip codes, padded ids) stay strings
  private static final Pattern INTEGER = Pattern.compile("^-?(0|[1-9]\\d{0,17})$");
  private static final Pattern DECIMAL = Pattern.compile("^-?(0|[1-9]\\d*)\\.\\d+$");

  private static final QueryParams EMPTY = new QueryParams(Map.of());

  private final Map<String, List<String>> values;

  private QueryParams(Map<String, List<String>> values) {
    this.values = values;
  }

  public static QueryParams empty() {
    return EMPTY;
  }

  /** Accepts single values, arrays and collections; values are kept in their string form. */
  public static QueryParams of(Map<String, ?> raw) {
    if (raw == null || raw.isEmpty()) return EMPTY;
    Map<String, List<String>> out = new LinkedHashMap<>();
    for (var e : raw.entrySet()) {
      if (e.getKey() == null) continue;
      List<String> vs = new ArrayList<>();
      Object v = e.getValue();
      if (v instanceof Collection<?> c) {
        for (Object x : c) if (x != null) vs.add(String.valueOf(x));
      } else if (v instanceof Object[] arr) {
        for (Object x : arr) if (x != null) vs.add(String.valueOf(x));
      } else if (v != null) {
        vs.add(String.valueOf(v));
      }
      out.put(e.getKey(), List.copyOf(vs));
    }
    return new QueryParams(Collections.unmodifiableMap(out));
  }

  public Optional<String> first(String key) {
    List<String> vs = values.get(key);
    if (vs == null || vs.isEmpty()) return Optional.empty();
    return Optional.ofNullable(vs.get(0));
  }

  public Map<String, List<String>> asMap() {
    return values;
  }

  public PageRequest page(int defaultLimit) {
    return PageRequest.of(first(PAGE).orElse(null), first(LIMIT).orElse(null), defaultLimit);
  }

  /** {@code sort=-createdAt,name}; empty when absent (store natural order). */
  public List<SortField> sort() {
    String raw = first(SORT).orElse(null);
    if (raw == null || raw.isBlank()) return List.of();
    List<SortField> out = new ArrayList<>();
    for (String t : raw.split("[\\s,]+")) {
      if (t.isBlank() || t.equals("-") || t.equals("+")) continue;
      out.add(SortField.parse(t));
    }
    return List.copyOf(out);
  }

  /** {@code fields=name,email}; {@link FieldSelection#all()} when absent. */
  public FieldSelection fields() {
    return FieldSelection.parse(first(FIELDS).orElse(null));
  }

  /** Filter derived from the non-reserved keys, in store-native (Mongo operator) form. */
  public Map<String, Object> filter() {
    Map<String, Object> out = new LinkedHashMap<>();
    for (var e : values.entrySet()) {
      String key = e.getKey();
      if (RESERVED.contains(key) || e.getValue().isEmpty()) continue;
      String raw = e.getValue().get(0);

      Matcher m = BRACKET.matcher(key);
      if (!m.matches()) {
        out.put(key, coerce(raw));
        continue;
      }

      String field = m.group(1);
      String op = m.group(2).toLowerCase(Locale.ROOT);
      if (!OPERATORS.contains(op)) {
        throw new CrudValidationException("Unsupported query operator '" + op + "' on field '" + field + "'");
      }
      Object value = (op.equals("in") || op.equals("nin")) ? coerceList(raw) : coerce(raw);
      Object existing = out.get(field);
      @SuppressWarnings("unchecked")
      Map<String, Object> ops = (existing instanceof Map<?, ?>) ? (Map<String, Object>) existing : new LinkedHashMap<>();
      ops.put("$" + op, value);
      out.put(field, ops);
    }
    return out;
  }

  static Object coerce(String raw) {
    if (raw == null) return null;
    String s = raw.trim();
    if (s.equals("true")) return Boolean.TRUE;
    if (s.equals("false")) return Boolean.FALSE;
    if (INTEGER.matcher(s).matches()) {
      long v = Long.parseLong(s);
      return (v >= Integer.MIN_VALUE && v <= Integer.MAX_VALUE) ? (Object) (int) v : (Object) v;
    }
    if (DECIMAL.matcher(s).matches()) return Double.parseDouble(s);
    return raw;
  }

  private static List<Object> coerceList(String raw) {
    List<Object> out = new ArrayList<>();
    for (String p : raw.split(",")) {
      if (!p.isBlank()) out.add(coerce(p.trim()));
    }
    return out;
  }

  @Override
  public String toString() {
    return "QueryParams" + values;
  }
}
