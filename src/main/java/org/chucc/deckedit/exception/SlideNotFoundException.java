package org.chucc.deckedit.exception;

import org.springframework.http.HttpStatus;

/**
 * Exception thrown when a requested slide does not exist.
 * Maps to HTTP 404 Not Found with error code "slide_not_found".
 */
public class SlideNotFoundException extends EditException {

  private static final long serialVersionUID = 1L;

  /**
   * Constructor with slide id.
   *
   * @param slideId the id of the slide that was not found
   */
  public SlideNotFoundException(String slideId) {
    super("Slide not found: " + slideId, "slide_not_found", HttpStatus.NOT_FOUND);
  }
}
