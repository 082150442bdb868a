package org.chucc.deckedit.exception;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.MeterRegistry;
import org.chucc.deckedit.dto.ProblemDetail;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

/**
 * Global exception handler for slide editing errors.
 * Converts EditException instances to RFC 7807 problem+json responses.
 */
@ControllerAdvice
public class EditExceptionHandler {

  private static final Logger logger = LoggerFactory.getLogger(EditExceptionHandler.class);

  private static final MediaType PROBLEM_JSON =
      MediaType.parseMediaType("application/problem+json");

  private final MeterRegistry meterRegistry;

  /**
   * Constructs an EditExceptionHandler.
   *
   * @param meterRegistry the meter registry for metrics
   */
  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "MeterRegistry is a Spring-managed bean, not a mutable data structure"
  )
  public EditExceptionHandler(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
  }

  /**
   * Handle an exhausted undo or redo stack. This is an expected outcome, not a fault.
   *
   * @param ex the exception
   * @return RFC 7807 problem+json response with 409 Conflict
   */
  @ExceptionHandler({NothingToUndoException.class, NothingToRedoException.class})
  @SuppressWarnings("PMD.LooseCoupling") // HttpHeaders provides Spring-specific utility methods
  public ResponseEntity<ProblemDetail> handleNothingToDo(EditException ex) {
    logger.debug("{}", ex.getMessage());
    return problem(ex.getMessage(), ex.getStatus(), ex.getCode());
  }

  /**
   * Handle a command type with no registered reconstructor.
   *
   * @param ex the exception
   * @return RFC 7807 problem+json response with 500 Internal Server Error
   */
  @ExceptionHandler(UnknownCommandTypeException.class)
  @SuppressWarnings("PMD.LooseCoupling") // HttpHeaders provides Spring-specific utility methods
  public ResponseEntity<ProblemDetail> handleUnknownCommandType(UnknownCommandTypeException ex) {
    logger.error("Command type not registered: {}", ex.getCommandType());
    meterRegistry.counter("deckedit.errors", "code", ex.getCode()).increment();
    return problem(ex.getMessage(), ex.getStatus(), ex.getCode());
  }

  /**
   * Handle a failed execute, redo or undo. The problem names the command type and, where the
   * store rejected the operation, the underlying cause.
   *
   * @param ex the command failure
   * @return RFC 7807 problem+json response with 422 or 409
   */
  @ExceptionHandler({CommandExecutionException.class, CommandUndoException.class})
  @SuppressWarnings("PMD.LooseCoupling") // HttpHeaders provides Spring-specific utility methods
  public ResponseEntity<ProblemDetail> handleCommandFailure(EditException ex) {
    logger.info("Command rejected ({}): {}", ex.getCode(), ex.getMessage());
    meterRegistry.counter("deckedit.errors", "code", ex.getCode()).increment();

    ProblemDetail problem = new ProblemDetail(ex.getMessage(), ex.getStatus(), ex.getCode());
    if (ex instanceof CommandExecutionException executionFailure) {
      problem.setCommandType(executionFailure.getCommandType());
    } else if (ex instanceof CommandUndoException undoFailure) {
      problem.setCommandType(undoFailure.getCommandType());
    }
    if (ex.getCause() != null) {
      problem.setDetail(ex.getCause().getMessage());
    }
    return problem(problem);
  }

  /**
   * Handle all other edit exceptions.
   *
   * @param ex the edit exception
   * @return RFC 7807 problem+json response
   */
  @ExceptionHandler(EditException.class)
  @SuppressWarnings("PMD.LooseCoupling") // HttpHeaders provides Spring-specific utility methods
  public ResponseEntity<ProblemDetail> handleEditException(EditException ex) {
    if (ex.isServerError()) {
      logger.error("Edit failed: {}", ex.getMessage(), ex);
    } else {
      logger.info("Edit rejected ({}): {}", ex.getCode(), ex.getMessage());
    }
    meterRegistry.counter("deckedit.errors", "code", ex.getCode()).increment();
    return problem(ex.getMessage(), ex.getStatus(), ex.getCode());
  }

  /**
   * Handle IllegalArgumentException (e.g., invalid layout type or unknown field).
   *
   * @param ex the illegal argument exception
   * @return RFC 7807 problem+json response with 400 Bad Request
   */
  @ExceptionHandler(IllegalArgumentException.class)
  @SuppressWarnings("PMD.LooseCoupling") // HttpHeaders provides Spring-specific utility methods
  public ResponseEntity<ProblemDetail> handleIllegalArgument(IllegalArgumentException ex) {
    return problem(ex.getMessage(), HttpStatus.BAD_REQUEST.value(), "invalid_argument");
  }

  private ResponseEntity<ProblemDetail> problem(String title, int status, String code) {
    return problem(new ProblemDetail(title, status, code));
  }

  private ResponseEntity<ProblemDetail> problem(ProblemDetail problem) {
    HttpHeaders headers = new HttpHeaders();
    headers.setContentType(PROBLEM_JSON);

    return new ResponseEntity<>(problem, headers, HttpStatus.valueOf(problem.getStatus()));
  }
}
