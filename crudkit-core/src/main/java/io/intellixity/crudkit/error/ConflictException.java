package io.intellixity.crudkit.error;

/** A document matching the duplicate check already exists. */
public final class ConflictException extends CrudException {
  public ConflictException(String message) {
    super(ErrorKind.CONFLICT, message);
  }
}
