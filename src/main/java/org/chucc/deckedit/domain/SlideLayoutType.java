package org.chucc.deckedit.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/**
 * Layout of a slide. Serialized by its lower-case wire value.
 */
public enum SlideLayoutType {
  TITLE_ONLY("title_only"),
  TITLE_CONTENT("title_content"),
  TWO_COLUMN("two_column"),
  THREE_COLUMN("three_column"),
  COMPARISON("comparison"),
  IMAGE_LEFT("image_left"),
  IMAGE_RIGHT("image_right"),
  FULL_IMAGE("full_image"),
  BLANK("blank");

  private final String value;

  SlideLayoutType(String value) {
    this.value = value;
  }

  @JsonValue
  public String getValue() {
    return value;
  }

  /**
   * Resolves a layout from its wire value.
   *
   * @param value the wire value (case-insensitive)
   * @return the layout type
   * @throws IllegalArgumentException if the value is unknown
   */
  @JsonCreator
  public static SlideLayoutType fromValue(String value) {
    if (value == null) {
      throw new IllegalArgumentException("Layout type cannot be null");
    }
    String normalized = value.toLowerCase(Locale.ROOT);
    for (SlideLayoutType type : values()) {
      if (type.value.equals(normalized)) {
        return type;
      }
    }
    throw new IllegalArgumentException("Unknown layout type: " + value);
  }
}
