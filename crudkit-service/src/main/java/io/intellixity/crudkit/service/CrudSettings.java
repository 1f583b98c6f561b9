package io.intellixity.crudkit.service;

import io.intellixity.crudkit.query.PageRequest;

/** Tunables of {@link DefaultCrudService}. */
public record CrudSettings(int defaultPageSize) {
  public CrudSettings {
    if (defaultPageSize <= 0) defaultPageSize = PageRequest.DEFAULT_LIMIT;
  }

  public static CrudSettings defaults() {
    return new CrudSettings(PageRequest.DEFAULT_LIMIT);
  }
}
