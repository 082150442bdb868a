package org.chucc.deckedit.exception;

import org.springframework.http.HttpStatus;

/**
 * Thrown when the store rejects the forward operation of a command (on execute or redo).
 * The command is left un-executed and history is unchanged, so the caller may retry.
 * Maps to HTTP 422 Unprocessable Entity with error code "command_execution_failed".
 */
public class CommandExecutionException extends EditException {

  private static final long serialVersionUID = 1L;

  private static final String ERROR_CODE = "command_execution_failed";

  private final String commandType;

  /**
   * Constructor with the failing command type and message.
   *
   * @param commandType the type tag of the command that failed
   * @param message error message
   */
  public CommandExecutionException(String commandType, String message) {
    super(message, ERROR_CODE, HttpStatus.UNPROCESSABLE_ENTITY);
    this.commandType = commandType;
  }

  /**
   * Constructor with the failing command type, message, and cause.
   *
   * @param commandType the type tag of the command that failed
   * @param message error message
   * @param cause the store failure
   */
  public CommandExecutionException(String commandType, String message, Throwable cause) {
    super(message, ERROR_CODE, HttpStatus.UNPROCESSABLE_ENTITY, cause);
    this.commandType = commandType;
  }

  public String getCommandType() {
    return commandType;
  }
}
