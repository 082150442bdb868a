package org.chucc.deckedit.controller;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import java.util.Map;
import org.chucc.deckedit.dto.CreateSlideRequest;
import org.chucc.deckedit.dto.HistoryResponse;
import org.chucc.deckedit.dto.HistoryStatusResponse;
import org.chucc.deckedit.dto.MoveSlideRequest;
import org.chucc.deckedit.dto.SlideEditResponse;
import org.chucc.deckedit.service.SlideEditService;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Slide editing and undo/redo endpoints.
 */
@RestController
@RequestMapping("/presentations/{presentationId}")
@Tag(name = "Slide Editing", description = "Slide edits with undo/redo history")
public class SlideEditController {

  static final String AUTHOR_HEADER = "X-Author";
  private static final String ANONYMOUS = "anonymous";

  private final SlideEditService slideEditService;

  /**
   * Constructor for SlideEditController.
   *
   * @param slideEditService the slide edit service
   */
  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "Spring-managed beans are intentionally shared references"
  )
  public SlideEditController(SlideEditService slideEditService) {
    this.slideEditService = slideEditService;
  }

  /**
   * Adds a slide to a presentation.
   *
   * @param presentationId the presentation id
   * @param author the acting author
   * @param request the slide to create
   * @return the created slide
   */
  @PostMapping(value = "/slides", consumes = MediaType.APPLICATION_JSON_VALUE,
      produces = MediaType.APPLICATION_JSON_VALUE)
  @Operation(summary = "Create slide", description = "Adds a slide and records the edit")
  @ApiResponse(responseCode = "201", description = "Slide created")
  @ApiResponse(
      responseCode = "400",
      description = "Bad Request - invalid slide fields",
      content = @Content(mediaType = "application/problem+json")
  )
  public ResponseEntity<SlideEditResponse> createSlide(
      @Parameter(description = "Presentation id", required = true)
      @PathVariable String presentationId,
      @RequestHeader(value = AUTHOR_HEADER, required = false, defaultValue = ANONYMOUS)
      String author,
      @RequestBody CreateSlideRequest request
  ) {
    request.validate();
    SlideEditResponse response = slideEditService.createSlide(
        presentationId,
        request.title(),
        request.layoutType(),
        request.content(),
        request.orderIndex(),
        author);
    return ResponseEntity.status(HttpStatus.CREATED).body(response);
  }

  /**
   * Updates editable fields of a slide.
   *
   * @param presentationId the presentation id
   * @param slideId the slide id
   * @param author the acting author
   * @param changes field name to new value
   * @return the updated slide
   */
  @PatchMapping(value = "/slides/{slideId}", consumes = MediaType.APPLICATION_JSON_VALUE,
      produces = MediaType.APPLICATION_JSON_VALUE)
  @Operation(summary = "Update slide",
      description = "Changes title, subtitle, layout_type, content, notes or styling fields")
  @ApiResponse(responseCode = "200", description = "Slide updated")
  @ApiResponse(
      responseCode = "404",
      description = "Slide not found",
      content = @Content(mediaType = "application/problem+json")
  )
  public ResponseEntity<SlideEditResponse> updateSlide(
      @PathVariable String presentationId,
      @PathVariable String slideId,
      @RequestHeader(value = AUTHOR_HEADER, required = false, defaultValue = ANONYMOUS)
      String author,
      @RequestBody Map<String, Object> changes
  ) {
    return ResponseEntity.ok(
        slideEditService.updateSlide(presentationId, slideId, changes, author));
  }

  /**
   * Deletes a slide.
   *
   * @param presentationId the presentation id
   * @param slideId the slide id
   * @param author the acting author
   * @return undo/redo availability
   */
  @DeleteMapping(value = "/slides/{slideId}", produces = MediaType.APPLICATION_JSON_VALUE)
  @Operation(summary = "Delete slide", description = "Deletes a slide; undo restores it")
  @ApiResponse(responseCode = "200", description = "Slide deleted")
  @ApiResponse(
      responseCode = "404",
      description = "Slide not found",
      content = @Content(mediaType = "application/problem+json")
  )
  public ResponseEntity<SlideEditResponse> deleteSlide(
      @PathVariable String presentationId,
      @PathVariable String slideId,
      @RequestHeader(value = AUTHOR_HEADER, required = false, defaultValue = ANONYMOUS)
      String author
  ) {
    return ResponseEntity.ok(slideEditService.deleteSlide(presentationId, slideId, author));
  }

  /**
   * Moves a slide to a new position.
   *
   * @param presentationId the presentation id
   * @param slideId the slide id
   * @param author the acting author
   * @param request the target position
   * @return the moved slide
   */
  @PutMapping(value = "/slides/{slideId}/position", consumes = MediaType.APPLICATION_JSON_VALUE,
      produces = MediaType.APPLICATION_JSON_VALUE)
  @Operation(summary = "Move slide", description = "Moves a slide and renumbers the others")
  @ApiResponse(responseCode = "200", description = "Slide moved")
  @ApiResponse(
      responseCode = "422",
      description = "Position out of range",
      content = @Content(mediaType = "application/problem+json")
  )
  public ResponseEntity<SlideEditResponse> moveSlide(
      @PathVariable String presentationId,
      @PathVariable String slideId,
      @RequestHeader(value = AUTHOR_HEADER, required = false, defaultValue = ANONYMOUS)
      String author,
      @RequestBody MoveSlideRequest request
  ) {
    request.validate();
    return ResponseEntity.ok(slideEditService.moveSlide(
        presentationId, slideId, request.newOrder(), author));
  }

  /**
   * Undoes the most recent edits.
   *
   * @param presentationId the presentation id
   * @param steps number of edits to undo
   * @param author the acting author
   * @return the restored slide state
   */
  @PostMapping(value = "/undo", produces = MediaType.APPLICATION_JSON_VALUE)
  @Operation(summary = "Undo", description = "Reverses the most recent edits")
  @ApiResponse(responseCode = "200", description = "Edit undone")
  @ApiResponse(
      responseCode = "409",
      description = "Nothing to undo, or the slide changed since the edit",
      content = @Content(mediaType = "application/problem+json")
  )
  public ResponseEntity<SlideEditResponse> undo(
      @PathVariable String presentationId,
      @Parameter(description = "Number of edits to undo", example = "1")
      @RequestParam(required = false, defaultValue = "1") Integer steps,
      @RequestHeader(value = AUTHOR_HEADER, required = false, defaultValue = ANONYMOUS)
      String author
  ) {
    requirePositive(steps);
    return ResponseEntity.ok(slideEditService.undo(presentationId, steps, author));
  }

  /**
   * Redoes the most recently undone edits.
   *
   * @param presentationId the presentation id
   * @param steps number of edits to redo
   * @param author the acting author
   * @return the re-applied slide state
   */
  @PostMapping(value = "/redo", produces = MediaType.APPLICATION_JSON_VALUE)
  @Operation(summary = "Redo", description = "Re-applies the most recently undone edits")
  @ApiResponse(responseCode = "200", description = "Edit redone")
  @ApiResponse(
      responseCode = "409",
      description = "Nothing to redo",
      content = @Content(mediaType = "application/problem+json")
  )
  public ResponseEntity<SlideEditResponse> redo(
      @PathVariable String presentationId,
      @Parameter(description = "Number of edits to redo", example = "1")
      @RequestParam(required = false, defaultValue = "1") Integer steps,
      @RequestHeader(value = AUTHOR_HEADER, required = false, defaultValue = ANONYMOUS)
      String author
  ) {
    requirePositive(steps);
    return ResponseEntity.ok(slideEditService.redo(presentationId, steps, author));
  }

  /**
   * Gets undo/redo availability.
   *
   * @param presentationId the presentation id
   * @return the history status
   */
  @GetMapping(value = "/history", produces = MediaType.APPLICATION_JSON_VALUE)
  @Operation(summary = "History status", description = "Undo/redo availability and depths")
  @ApiResponse(responseCode = "200", description = "Status returned")
  public ResponseEntity<HistoryStatusResponse> getStatus(@PathVariable String presentationId) {
    return ResponseEntity.ok(slideEditService.getStatus(presentationId));
  }

  /**
   * Lists the recorded commands.
   *
   * @param presentationId the presentation id
   * @return history entries, oldest first
   */
  @GetMapping(value = "/history/commands", produces = MediaType.APPLICATION_JSON_VALUE)
  @Operation(summary = "History entries",
      description = "Undoable commands oldest first, followed by redoable commands")
  @ApiResponse(responseCode = "200", description = "Entries returned")
  public ResponseEntity<HistoryResponse> getHistory(@PathVariable String presentationId) {
    return ResponseEntity.ok(slideEditService.getHistory(presentationId));
  }

  /**
   * Clears the history without touching slides.
   *
   * @param presentationId the presentation id
   * @return no content
   */
  @DeleteMapping("/history")
  @Operation(summary = "Clear history", description = "Empties the undo and redo stacks")
  @ApiResponse(responseCode = "204", description = "History cleared")
  public ResponseEntity<Void> clearHistory(@PathVariable String presentationId) {
    slideEditService.clearHistory(presentationId);
    return ResponseEntity.noContent().build();
  }

  /**
   * Deletes every slide of a presentation and discards its history.
   *
   * @param presentationId the presentation id
   * @return no content
   */
  @DeleteMapping
  @Operation(summary = "Discard presentation",
      description = "Deletes all slides and releases the undo history")
  @ApiResponse(responseCode = "204", description = "Presentation discarded")
  public ResponseEntity<Void> discardPresentation(@PathVariable String presentationId) {
    slideEditService.discardPresentation(presentationId);
    return ResponseEntity.noContent().build();
  }

  private static void requirePositive(Integer steps) {
    if (steps == null || steps < 1) {
      throw new IllegalArgumentException("Steps must be >= 1");
    }
  }
}
