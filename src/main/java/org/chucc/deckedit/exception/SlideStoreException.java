package org.chucc.deckedit.exception;

import org.springframework.http.HttpStatus;

/**
 * Thrown by the slide store when it rejects an operation for a reason other than
 * the target being absent (duplicate id, missing target on update, storage failure).
 */
public class SlideStoreException extends EditException {

  private static final long serialVersionUID = 1L;

  private static final String ERROR_CODE = "slide_store_error";

  public SlideStoreException(String message) {
    super(message, ERROR_CODE, HttpStatus.INTERNAL_SERVER_ERROR);
  }

  public SlideStoreException(String message, Throwable cause) {
    super(message, ERROR_CODE, HttpStatus.INTERNAL_SERVER_ERROR, cause);
  }
}
