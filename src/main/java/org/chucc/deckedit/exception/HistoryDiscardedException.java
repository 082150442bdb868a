package org.chucc.deckedit.exception;

import org.springframework.http.HttpStatus;

/**
 * Thrown when an operation reaches a history that was discarded after it was looked up.
 * Callers re-resolve the presentation's current history and try again.
 * Maps to HTTP 409 Conflict with error code "history_discarded".
 */
public class HistoryDiscardedException extends EditException {

  private static final long serialVersionUID = 1L;

  /**
   * Constructor with the presentation whose history was discarded.
   *
   * @param presentationId the presentation id
   */
  public HistoryDiscardedException(String presentationId) {
    super("History of presentation was discarded: " + presentationId, "history_discarded",
        HttpStatus.CONFLICT);
  }
}
