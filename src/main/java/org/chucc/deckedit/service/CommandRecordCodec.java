package org.chucc.deckedit.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.chucc.deckedit.command.Command;
import org.chucc.deckedit.command.CommandRecord;
import org.chucc.deckedit.command.CommandRegistry;
import org.springframework.stereotype.Service;

/**
 * Converts commands to and from their JSON record form
 * ({@code id, type, target_id, target_type, created_at, executed_at, undone_at, payload}).
 * Used for the audit log and for transporting commands; never for normal execute/undo.
 */
@Service
public class CommandRecordCodec {

  private final ObjectMapper objectMapper;
  private final CommandRegistry commandRegistry;

  /**
   * Constructs the codec.
   *
   * @param objectMapper the application object mapper; a copy is configured for ISO-8601
   *     timestamps
   * @param commandRegistry the registry used to rebuild commands
   */
  public CommandRecordCodec(ObjectMapper objectMapper, CommandRegistry commandRegistry) {
    this.objectMapper = objectMapper.copy()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    this.commandRegistry = commandRegistry;
  }

  /**
   * Serializes a record to JSON.
   *
   * @param commandRecord the record
   * @return the JSON text
   * @throws IllegalStateException if the payload cannot be serialized
   */
  public String toJson(CommandRecord commandRecord) {
    try {
      return objectMapper.writeValueAsString(commandRecord);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException(
          "Failed to serialize command record " + commandRecord.id(), e);
    }
  }

  /**
   * Serializes a command to JSON.
   *
   * @param command the command
   * @return the JSON text
   */
  public String toJson(Command command) {
    return toJson(command.toRecord());
  }

  /**
   * Parses a record from JSON.
   *
   * @param json the JSON text
   * @return the record
   * @throws IllegalArgumentException if the JSON is malformed or misses required fields
   */
  public CommandRecord fromJson(String json) {
    try {
      return objectMapper.readValue(json, CommandRecord.class);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Malformed command record: " + e.getOriginalMessage(),
          e);
    }
  }

  /**
   * Parses JSON and rebuilds the command through the registry.
   *
   * @param json the JSON text
   * @return the rebuilt command
   * @throws org.chucc.deckedit.exception.UnknownCommandTypeException if the type is not
   *     registered
   */
  public Command decode(String json) {
    return commandRegistry.create(fromJson(json));
  }
}
