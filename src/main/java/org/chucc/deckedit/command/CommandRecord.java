package org.chucc.deckedit.command;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Flat, transport-neutral form of a command, used for audit logging and transport.
 * Never used for normal execute/undo calls.
 *
 * @param id the command id
 * @param type the command type tag
 * @param targetId the target entity id
 * @param targetType the target entity type
 * @param createdAt the creation time
 * @param executedAt the last execution time, null if never executed
 * @param undoneAt the last undo time, null if never undone
 * @param payload forward arguments and captured prior state
 */
public record CommandRecord(
    @JsonProperty("id") String id,
    @JsonProperty("type") String type,
    @JsonProperty("target_id") String targetId,
    @JsonProperty("target_type") String targetType,
    @JsonProperty("created_at") Instant createdAt,
    @JsonProperty("executed_at") Instant executedAt,
    @JsonProperty("undone_at") Instant undoneAt,
    @JsonProperty("payload") Map<String, Object> payload) {

  /**
   * Creates a new CommandRecord with validation.
   *
   * @throws IllegalArgumentException if the type is blank
   */
  public CommandRecord {
    Objects.requireNonNull(id, "Command id cannot be null");
    Objects.requireNonNull(type, "Command type cannot be null");
    Objects.requireNonNull(targetType, "Target type cannot be null");
    Objects.requireNonNull(createdAt, "Created at cannot be null");

    if (type.isBlank()) {
      throw new IllegalArgumentException("Command type cannot be blank");
    }

    // LinkedHashMap rather than Map.copyOf: payload values may be null
    payload = payload == null
        ? Map.of()
        : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
  }
}
