package io.intellixity.crudkit.error;

public final class NotFoundException extends CrudException {
  public NotFoundException(String message) {
    super(ErrorKind.NOT_FOUND, message);
  }
}
