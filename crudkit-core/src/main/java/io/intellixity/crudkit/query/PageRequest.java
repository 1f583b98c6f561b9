package io.intellixity.crudkit.query;

/**
 * 1-based page window.\n
 *
 * Unlike a strict offset page, construction never fails on caller input: {@link #of(Object, Object, int)}
 * maps absent, non-numeric, zero or negative values to the defaults.\n
 */
public record PageRequest(int page, int limit) {
  public static final int DEFAULT_PAGE = 1;
  public static final int DEFAULT_LIMIT = 10;

  public PageRequest {
    if (page <= 0) throw new IllegalArgumentException("page must be > 0");
    if (limit <= 0) throw new IllegalArgumentException("limit must be > 0");
  }

  public static PageRequest first(int limit) {
    return new PageRequest(DEFAULT_PAGE, (limit > 0) ? limit : DEFAULT_LIMIT);
  }

  public static PageRequest of(Object page, Object limit, int defaultLimit) {
    int dl = (defaultLimit > 0) ? defaultLimit : DEFAULT_LIMIT;
    return new PageRequest(positiveOr(page, DEFAULT_PAGE), positiveOr(limit, dl));
  }

  /** Documents to skip; saturates at {@link Integer#MAX_VALUE} for absurd page numbers. */
  public int skip() {
    long s = ((long) page - 1L) * (long) limit;
    return (s > Integer.MAX_VALUE) ? Integer.MAX_VALUE : (int) s;
  }

  private static int positiveOr(Object raw, int def) {
    if (raw == null) return def;
    long v;
    if (raw instanceof Number n) {
      v = n.longValue();
    } else {
      String s = String.valueOf(raw).trim();
      if (s.isEmpty()) return def;
      try {
        v = Long.parseLong(s);
      } catch (NumberFormatException e) {
        return def;
      }
    }
    if (v <= 0) return def;
    return (v > Integer.MAX_VALUE) ? Integer.MAX_VALUE : (int) v;
  }
}
