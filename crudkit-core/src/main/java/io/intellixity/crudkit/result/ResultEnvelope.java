package io.intellixity.crudkit.result;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Uniform response shape of every CRUD operation.\n
 *
 * <pre>{ "message", "success_status", "data", "doc_length"?, "error"?, "stack"? }</pre>
 */
@JsonPropertyOrder({"message", "success_status", "data", "doc_length", "error", "stack"})
public record ResultEnvelope<T>(
    @JsonProperty("message") String message,
    @JsonProperty("success_status") boolean successStatus,
    @JsonProperty("data") T data,
    @JsonProperty("doc_length") @JsonInclude(JsonInclude.Include.NON_NULL) Integer docLength,
    @JsonProperty("error") @JsonInclude(JsonInclude.Include.NON_NULL) Object error,
    @JsonProperty("stack") @JsonInclude(JsonInclude.Include.NON_NULL) Object stack
) {
  public static <T> ResultEnvelope<T> ok(String message, T data) {
    return new ResultEnvelope<>(message, true, data, null, null, null);
  }

  public static <T> ResultEnvelope<T> ok(String message, T data, int docLength) {
    return new ResultEnvelope<>(message, true, data, docLength, null, null);
  }

  public static <T> ResultEnvelope<T> failure(String message, Object error, Object stack) {
    return new ResultEnvelope<>(message, false, null, null, error, stack);
  }
}
