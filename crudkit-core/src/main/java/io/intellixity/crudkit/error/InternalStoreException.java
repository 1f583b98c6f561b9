package io.intellixity.crudkit.error;

/** Store failure or unexpected exception; the original failure is kept as the cause. */
public final class InternalStoreException extends CrudException {
  public InternalStoreException(String message, Throwable cause) {
    super(ErrorKind.INTERNAL, message, cause);
  }
}
