package org.chucc.deckedit.exception;

import org.springframework.http.HttpStatus;

/**
 * Thrown when redo is requested but the redo stack is empty.
 * Maps to HTTP 409 Conflict with error code "nothing_to_redo".
 */
public class NothingToRedoException extends EditException {

  private static final long serialVersionUID = 1L;

  /**
   * Constructor with the presentation whose redo stack is empty.
   *
   * @param presentationId the presentation id
   */
  public NothingToRedoException(String presentationId) {
    super("Nothing to redo for presentation: " + presentationId, "nothing_to_redo",
        HttpStatus.CONFLICT);
  }
}
