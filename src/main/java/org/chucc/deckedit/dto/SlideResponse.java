package org.chucc.deckedit.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import java.util.Map;
import org.chucc.deckedit.domain.Slide;

/**
 * Response DTO with the full state of a slide.
 */
public record SlideResponse(
    @JsonProperty("id") String id,
    @JsonProperty("presentation_id") String presentationId,
    @JsonProperty("title") String title,
    @JsonProperty("subtitle") String subtitle,
    @JsonProperty("layout_type") String layoutType,
    @JsonProperty("content") Map<String, Object> content,
    @JsonProperty("notes") String notes,
    @JsonProperty("background_color") String backgroundColor,
    @JsonProperty("text_color") String textColor,
    @JsonProperty("font_family") String fontFamily,
    @JsonProperty("order_index") int orderIndex,
    @JsonProperty("version") int version,
    @JsonProperty("created_at") Instant createdAt,
    @JsonProperty("updated_at") Instant updatedAt) {

  /**
   * Converts a slide to its response form.
   *
   * @param slide the slide
   * @return the response
   */
  public static SlideResponse from(Slide slide) {
    return new SlideResponse(
        slide.getId(),
        slide.getPresentationId(),
        slide.getTitle(),
        slide.getSubtitle(),
        slide.getLayoutType().getValue(),
        slide.getContent(),
        slide.getNotes(),
        slide.getBackgroundColor(),
        slide.getTextColor(),
        slide.getFontFamily(),
        slide.getOrderIndex(),
        slide.getVersion(),
        slide.getCreatedAt(),
        slide.getUpdatedAt());
  }
}
