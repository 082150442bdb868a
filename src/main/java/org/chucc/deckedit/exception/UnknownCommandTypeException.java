package org.chucc.deckedit.exception;

import org.springframework.http.HttpStatus;

/**
 * Thrown when a command record names a type that has no registered reconstructor.
 * Indicates version skew between writer and reader; not retryable.
 * Maps to HTTP 500 with error code "unknown_command_type".
 */
public class UnknownCommandTypeException extends EditException {

  private static final long serialVersionUID = 1L;

  private final String commandType;

  /**
   * Constructor with the unknown type tag.
   *
   * @param commandType the type tag, may be null if the record had none
   */
  public UnknownCommandTypeException(String commandType) {
    super("Unknown command type: " + commandType, "unknown_command_type",
        HttpStatus.INTERNAL_SERVER_ERROR);
    this.commandType = commandType;
  }

  public String getCommandType() {
    return commandType;
  }
}
