package io.intellixity.crudkit.web.error;

import io.intellixity.crudkit.error.CrudException;
import io.intellixity.crudkit.result.ResultEnvelope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;

import java.util.*;

/**
 * Maps any failure to a status code and a failure {@link ResultEnvelope}.\n
 *
 * - status: the {@link CrudException} kind's status, 500 for anything else\n
 * - message: the failure's message for 4xx; for 5xx only in {@link Environment#DEVELOPMENT}\n
 * - {@code error} / {@code stack}: only in {@link Environment#DEVELOPMENT}\n
 */
public final class ErrorNormalizer {
  private static final Logger log = LoggerFactory.getLogger(ErrorNormalizer.class);

  public static final String INTERNAL_MESSAGE = "Internal server error";

  private final Environment env;

  public ErrorNormalizer(Environment env) {
    this.env = (env == null) ? Environment.PRODUCTION : env;
  }

  public Environment environment() {
    return env;
  }

  public ResponseEntity<ResultEnvelope<?>> toResponse(Throwable failure) {
    int status = statusOf(failure);
    if (status >= 500) {
      log.error("crudkit.error status={} type={} message={}", status, failure.getClass().getName(), failure.getMessage(), failure);
    } else {
      log.warn("crudkit.error status={} type={} message={}", status, failure.getClass().getSimpleName(), failure.getMessage());
    }
    return ResponseEntity.status(status).body(envelope(failure, status));
  }

  static int statusOf(Throwable failure) {
    return (failure instanceof CrudException ce) ? ce.status() : 500;
  }

  ResultEnvelope<Object> envelope(Throwable failure, int status) {
    boolean details = env.exposesDetails();
    String message = (status < 500 || details) ? messageOf(failure, status) : INTERNAL_MESSAGE;
    if (!details) return ResultEnvelope.failure(message, null, null);

    Map<String, Object> error = new LinkedHashMap<>();
    error.put("type", failure.getClass().getSimpleName());
    if (failure instanceof CrudException ce) error.put("kind", ce.kind().name());
    error.put("message", failure.getMessage());
    return ResultEnvelope.failure(message, error, stackOf(failure));
  }

  private static String messageOf(Throwable failure, int status) {
    String m = failure.getMessage();
    if (m != null && !m.isBlank()) return m;
    return (status >= 500) ? INTERNAL_MESSAGE : "Request failed";
  }

  /** Frames of the failure and of its causes, one string each. */
  static List<String> stackOf(Throwable failure) {
    List<String> out = new ArrayList<>();
    Set<Throwable> seen = Collections.newSetFromMap(new IdentityHashMap<>());
    Throwable t = failure;
    boolean first = true;
    while (t != null && seen.add(t)) {
      out.add((first ? "" : "Caused by: ") + t);
      for (StackTraceElement e : t.getStackTrace()) out.add("at " + e);
      first = false;
      t = t.getCause();
    }
    return out;
  }
}
