package io.intellixity.crudkit.web.http;

import io.intellixity.crudkit.error.ConflictException;
import io.intellixity.crudkit.error.CrudException;
import io.intellixity.crudkit.error.CrudValidationException;
import io.intellixity.crudkit.error.NotFoundException;
import io.intellixity.crudkit.result.ResultEnvelope;
import io.intellixity.crudkit.web.error.ErrorNormalizer;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/** Global handler: every failure leaving a controller is rendered by the {@link ErrorNormalizer}. */
@RestControllerAdvice
public final class CrudExceptionAdvice {
  private final ErrorNormalizer normalizer;

  public CrudExceptionAdvice(ErrorNormalizer normalizer) {
    this.normalizer = normalizer;
  }

  @ExceptionHandler(CrudException.class)
  public ResponseEntity<ResultEnvelope<?>> crud(CrudException e) {
    return normalizer.toResponse(e);
  }

  @ExceptionHandler({
      HttpMessageNotReadableException.class,
      MethodArgumentTypeMismatchException.class,
      MissingServletRequestParameterException.class
  })
  public ResponseEntity<ResultEnvelope<?>> badRequest(Exception e) {
    return normalizer.toResponse(new CrudValidationException("Malformed request: " + e.getMessage(), e));
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ResultEnvelope<?>> other(Exception e) {
    return normalizer.toResponse(translate(e));
  }

  /** Spring's own 4xx failures (unknown route, wrong method, ...) keep a client status. */
  static Exception translate(Exception e) {
    if (!(e instanceof ErrorResponse er) || !er.getStatusCode().is4xxClientError()) return e;
    int status = er.getStatusCode().value();
    if (status == 404) return new NotFoundException(e.getMessage());
    if (status == 409) return new ConflictException(e.getMessage());
    return new CrudValidationException(e.getMessage(), e);
  }
}
