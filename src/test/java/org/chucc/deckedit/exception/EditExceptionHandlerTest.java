package org.chucc.deckedit.exception;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.chucc.deckedit.dto.ProblemDetail;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;

/**
 * Unit tests for EditExceptionHandler.
 * Verifies exception to problem+json conversion.
 */
class EditExceptionHandlerTest {

  private static final MediaType PROBLEM_JSON =
      MediaType.parseMediaType("application/problem+json");

  private EditExceptionHandler handler;
  private MeterRegistry meterRegistry;

  @BeforeEach
  void setUp() {
    meterRegistry = new SimpleMeterRegistry();
    handler = new EditExceptionHandler(meterRegistry);
  }

  @Test
  void testHandleNothingToUndo() {
    ResponseEntity<ProblemDetail> response =
        handler.handleNothingToDo(new NothingToUndoException("deck-1"));

    assertEquals(HttpStatus.CONFLICT, response.getStatusCode());
    assertEquals(PROBLEM_JSON, response.getHeaders().getContentType());
    ProblemDetail problem = response.getBody();
    assertNotNull(problem);
    assertEquals("nothing_to_undo", problem.getCode());
    assertEquals(409, problem.getStatus());
  }

  @Test
  void testHandleCommandExecutionFailure() {
    CommandExecutionException ex = new CommandExecutionException("MoveSlideCommand",
        "New order 9 is out of range");

    ResponseEntity<ProblemDetail> response = handler.handleCommandFailure(ex);

    assertEquals(HttpStatus.UNPROCESSABLE_ENTITY, response.getStatusCode());
    ProblemDetail problem = response.getBody();
    assertNotNull(problem);
    assertEquals("command_execution_failed", problem.getCode());
    assertEquals("New order 9 is out of range", problem.getTitle());
    assertEquals("MoveSlideCommand", problem.getCommandType());
    assertEquals("/problems/command-execution-failed", problem.getType());
    assertNull(problem.getDetail());
    assertEquals(1.0, meterRegistry.get("deckedit.errors")
        .tag("code", "command_execution_failed").counter().count());
  }

  @Test
  void testHandleUndoConflict() {
    CommandUndoException ex = new CommandUndoException("DeleteSlideCommand",
        "Undo of DeleteSlideCommand failed on slide s1",
        new SlideStoreException("Slide already exists: s1"));

    ResponseEntity<ProblemDetail> response = handler.handleCommandFailure(ex);

    assertEquals(HttpStatus.CONFLICT, response.getStatusCode());
    assertEquals("command_undo_conflict", response.getBody().getCode());
    assertEquals("Slide already exists: s1", response.getBody().getDetail());
  }

  @Test
  void testHandleSlideNotFound() {
    ResponseEntity<ProblemDetail> response =
        handler.handleEditException(new SlideNotFoundException("s1"));

    assertEquals(HttpStatus.NOT_FOUND, response.getStatusCode());
    assertEquals("slide_not_found", response.getBody().getCode());
  }

  @Test
  void testHandleUnknownCommandType() {
    ResponseEntity<ProblemDetail> response =
        handler.handleUnknownCommandType(new UnknownCommandTypeException("RenameDeckCommand"));

    assertEquals(HttpStatus.INTERNAL_SERVER_ERROR, response.getStatusCode());
    assertEquals("unknown_command_type", response.getBody().getCode());
  }

  @Test
  void testHandleIllegalArgument() {
    ResponseEntity<ProblemDetail> response =
        handler.handleIllegalArgument(new IllegalArgumentException("Unknown layout type: x"));

    assertEquals(HttpStatus.BAD_REQUEST, response.getStatusCode());
    assertEquals("invalid_argument", response.getBody().getCode());
  }
}
