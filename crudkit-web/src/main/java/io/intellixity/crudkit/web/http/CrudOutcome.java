package io.intellixity.crudkit.web.http;

import io.intellixity.crudkit.result.ResultEnvelope;

import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.function.Supplier;

/**
 * Result of one service call: the success envelope or the failure it raised.\n
 *
 * Cancellation is never captured; it propagates from {@link #of}.\n
 */
public final class CrudOutcome<T> {
  private final ResultEnvelope<T> envelope;
  private final RuntimeException failure;

  private CrudOutcome(ResultEnvelope<T> envelope, RuntimeException failure) {
    this.envelope = envelope;
    this.failure = failure;
  }

  public static <T> CrudOutcome<T> success(ResultEnvelope<T> envelope) {
    return new CrudOutcome<>(Objects.requireNonNull(envelope, "envelope"), null);
  }

  public static <T> CrudOutcome<T> failure(RuntimeException failure) {
    return new CrudOutcome<>(null, Objects.requireNonNull(failure, "failure"));
  }

  public static <T> CrudOutcome<T> of(Supplier<ResultEnvelope<T>> call) {
    try {
      return success(call.get());
    } catch (CancellationException e) {
      throw e;
    } catch (RuntimeException e) {
      return failure(e);
    }
  }

  public boolean succeeded() { return failure == null; }
  public ResultEnvelope<T> envelope() { return envelope; }
  public RuntimeException failure() { return failure; }
}
