package org.chucc.deckedit.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;

/**
 * Request DTO for moving a slide to a new position.
 */
@Schema(description = "Request to move a slide")
public record MoveSlideRequest(
    @Schema(description = "Target position (0-based)", example = "2")
    @JsonProperty("new_order")
    Integer newOrder
) {
  /**
   * Validates the request fields.
   *
   * @throws IllegalArgumentException if validation fails
   */
  public void validate() {
    if (newOrder == null) {
      throw new IllegalArgumentException("New order is required");
    }
    if (newOrder < 0) {
      throw new IllegalArgumentException("New order must be >= 0");
    }
  }
}
