package org.chucc.deckedit.exception;

import org.springframework.http.HttpStatus;

/**
 * Base of all slide editing and undo/redo failures.
 * Each subclass fixes a snake_case error code and the HTTP status it is reported with.
 */
public abstract class EditException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  private final String code;
  private final HttpStatus httpStatus;

  protected EditException(String message, String code, HttpStatus httpStatus) {
    this(message, code, httpStatus, null);
  }

  protected EditException(String message, String code, HttpStatus httpStatus,
      Throwable cause) {
    super(message, cause);
    this.code = code;
    this.httpStatus = httpStatus;
  }

  public String getCode() {
    return code;
  }

  /**
   * Gets the HTTP status code this failure is reported with.
   *
   * @return the status code
   */
  public int getStatus() {
    return httpStatus.value();
  }

  /**
   * Whether the failure points at a fault of this server rather than at the request or the
   * current state of the presentation.
   *
   * @return true for 5xx failures
   */
  public boolean isServerError() {
    return httpStatus.is5xxServerError();
  }
}
