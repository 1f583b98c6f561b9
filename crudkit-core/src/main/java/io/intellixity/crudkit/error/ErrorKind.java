package io.intellixity.crudkit.error;

/** Failure classes raised by the service layer, each with its HTTP-style status. */
public enum ErrorKind {
  VALIDATION(400),
  NOT_FOUND(404),
  CONFLICT(409),
  INTERNAL(500);

  private final int status;

  ErrorKind(int status) {
    this.status = status;
  }

  public int status() { return status; }
}
