package io.intellixity.crudkit.error;

/**
 * Raised for a malformed descriptor, filter, payload or populate spec.
 * <p>
 * Always thrown before the store is touched.
 */
public final class CrudValidationException extends CrudException {
  public CrudValidationException(String message) {
    super(ErrorKind.VALIDATION, message);
  }

  public CrudValidationException(String message, Throwable cause) {
    super(ErrorKind.VALIDATION, message, cause);
  }
}
