package io.intellixity.crudkit.web.http;

import io.intellixity.crudkit.result.ResultEnvelope;
import io.intellixity.crudkit.web.error.ErrorNormalizer;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * Turns a service call into an HTTP response.\n
 *
 * Success: 201 for creates, 200 otherwise. Failure: rethrown to Spring's exception-handler chain
 * ({@code useNext}, see {@link CrudExceptionAdvice}) or formatted here by the {@link ErrorNormalizer}.\n
 */
public final class CrudResponder {
  private final ErrorNormalizer normalizer;
  private final boolean useNext;

  public CrudResponder(ErrorNormalizer normalizer, boolean useNext) {
    this.normalizer = Objects.requireNonNull(normalizer, "normalizer");
    this.useNext = useNext;
  }

  public <T> ResponseEntity<ResultEnvelope<?>> created(Supplier<ResultEnvelope<T>> call) {
    return respond(HttpStatus.CREATED, CrudOutcome.of(call));
  }

  public <T> ResponseEntity<ResultEnvelope<?>> ok(Supplier<ResultEnvelope<T>> call) {
    return respond(HttpStatus.OK, CrudOutcome.of(call));
  }

  public <T> ResponseEntity<ResultEnvelope<?>> respond(HttpStatus successStatus, CrudOutcome<T> outcome) {
    if (outcome.succeeded()) return ResponseEntity.status(successStatus).body(outcome.envelope());
    if (useNext) throw outcome.failure();
    return normalizer.toResponse(outcome.failure());
  }
}
