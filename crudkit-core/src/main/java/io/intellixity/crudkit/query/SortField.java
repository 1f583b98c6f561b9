package io.intellixity.crudkit.query;

import java.util.Objects;

public record SortField(String field, Direction direction) {
  public SortField {
    Objects.requireNonNull(field, "field");
    direction = (direction == null) ? Direction.ASC : direction;
  }

  /** {@code "-createdAt"} sorts descending, {@code "name"} / {@code "+name"} ascending. */
  public static SortField parse(String token) {
    String t = Objects.requireNonNull(token, "token").trim();
    if (t.startsWith("-")) return new SortField(t.substring(1), Direction.DESC);
    if (t.startsWith("+")) return new SortField(t.substring(1), Direction.ASC);
    return new SortField(t, Direction.ASC);
  }

  public enum Direction { ASC, DESC }
}
