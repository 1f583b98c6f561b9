package io.intellixity.crudkit.web.error;

/** Deployment environment; only {@link #DEVELOPMENT} exposes error details and stack traces. */
public enum Environment {
  DEVELOPMENT,
  PRODUCTION;

  public boolean exposesDetails() {
    return this == DEVELOPMENT;
  }
}
