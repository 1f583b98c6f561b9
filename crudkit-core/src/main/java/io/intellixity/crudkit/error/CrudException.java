package io.intellixity.crudkit.error;

import java.util.Objects;

/**
 * Base of every typed failure raised by {@link io.intellixity.crudkit.exec.CrudService}.
 * <p>
 * The service raises these and never formats them; the request adapter decides how much of the
 * failure is exposed.
 */
public class CrudException extends RuntimeException {
  private final ErrorKind kind;

  protected CrudException(ErrorKind kind, String message) {
    super(message);
    this.kind = Objects.requireNonNull(kind, "kind");
  }

  protected CrudException(ErrorKind kind, String message, Throwable cause) {
    super(message, cause);
    this.kind = Objects.requireNonNull(kind, "kind");
  }

  public ErrorKind kind() { return kind; }

  public int status() { return kind.status(); }
}
