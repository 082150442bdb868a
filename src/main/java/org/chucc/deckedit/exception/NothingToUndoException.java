package org.chucc.deckedit.exception;

import org.springframework.http.HttpStatus;

/**
 * Thrown when undo is requested but the undo stack is empty.
 * An expected, user-facing condition rather than a fault.
 * Maps to HTTP 409 Conflict with error code "nothing_to_undo".
 */
public class NothingToUndoException extends EditException {

  private static final long serialVersionUID = 1L;

  /**
   * Constructor with the presentation whose history is exhausted.
   *
   * @param presentationId the presentation id
   */
  public NothingToUndoException(String presentationId) {
    super("Nothing to undo for presentation: " + presentationId, "nothing_to_undo",
        HttpStatus.CONFLICT);
  }
}
