package org.chucc.deckedit.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import java.util.Map;

/**
 * Request DTO for creating a slide.
 */
@Schema(description = "Request to add a slide to a presentation")
public record CreateSlideRequest(
    @Schema(description = "Slide title", example = "Quarterly results")
    String title,

    @Schema(description = "Layout type", example = "title_content")
    @JsonProperty(value = "layout_type", required = false)
    String layoutType,

    @Schema(description = "Slide content as a JSON object")
    @JsonProperty(required = false)
    Map<String, Object> content,

    @Schema(description = "Position (0-based); appended after the last slide when omitted",
        example = "0")
    @JsonProperty(value = "order_index", required = false)
    Integer orderIndex
) {
  /**
   * Validates the request fields.
   * Called by controller before command creation.
   *
   * @throws IllegalArgumentException if validation fails
   */
  public void validate() {
    if (title == null || title.isBlank()) {
      throw new IllegalArgumentException("Slide title is required");
    }
    if (orderIndex != null && orderIndex < 0) {
      throw new IllegalArgumentException("Order index must be >= 0");
    }
  }
}
