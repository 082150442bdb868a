package org.chucc.deckedit.exception;

import org.springframework.http.HttpStatus;

/**
 * Thrown when the store rejects the reversal of a command, typically because the target
 * changed out-of-band since the command executed. The command stays on the undo stack.
 * Maps to HTTP 409 Conflict with error code "command_undo_conflict".
 */
public class CommandUndoException extends EditException {

  private static final long serialVersionUID = 1L;

  private static final String ERROR_CODE = "command_undo_conflict";

  private final String commandType;

  /**
   * Constructor with the failing command type and message.
   *
   * @param commandType the type tag of the command that failed
   * @param message error message
   */
  public CommandUndoException(String commandType, String message) {
    super(message, ERROR_CODE, HttpStatus.CONFLICT);
    this.commandType = commandType;
  }

  /**
   * Constructor with the failing command type, message, and cause.
   *
   * @param commandType the type tag of the command that failed
   * @param message error message
   * @param cause the store failure
   */
  public CommandUndoException(String commandType, String message, Throwable cause) {
    super(message, ERROR_CODE, HttpStatus.CONFLICT, cause);
    this.commandType = commandType;
  }

  public String getCommandType() {
    return commandType;
  }
}
