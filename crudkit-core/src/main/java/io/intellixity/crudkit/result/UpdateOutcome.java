package io.intellixity.crudkit.result;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.List;
import java.util.Map;

/**
 * Result of an update.\n
 *
 * @param documents the updated documents as stored after the write (empty when nothing matched)\n
 */
public record UpdateOutcome(long matchedCount, long modifiedCount, @JsonIgnore List<Map<String, Object>> documents) {
  public UpdateOutcome {
    documents = (documents == null) ? List.of() : List.copyOf(documents);
  }

  public static UpdateOutcome none() {
    return new UpdateOutcome(0, 0, List.of());
  }
}
