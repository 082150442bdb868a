package org.chucc.deckedit.domain;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Domain entity representing one slide of a presentation.
 *
 * <p>Slides are mutable; the store hands out copies, so a slide obtained from the store can be
 * edited freely and written back with {@code update}. Replacing the content bumps the version.
 */
public final class Slide {

  private final String id;
  private final String presentationId;
  private String title;
  private String subtitle;
  private SlideLayoutType layoutType;
  private Map<String, Object> content;
  private String notes;
  private String backgroundColor;
  private String textColor;
  private String fontFamily;
  private int orderIndex;
  private int version;
  private final Instant createdAt;
  private Instant updatedAt;

  /**
   * Creates a new slide at version 1.
   *
   * @param id the slide id (must be non-null and non-blank)
   * @param presentationId the owning presentation (must be non-null and non-blank)
   * @param title the title (must be non-null)
   * @param layoutType the layout (must be non-null)
   * @param content the content, may be null for empty content
   * @param orderIndex the position within the presentation (must be >= 0)
   * @throws IllegalArgumentException if validation fails
   */
  public Slide(String id, String presentationId, String title, SlideLayoutType layoutType,
      Map<String, Object> content, int orderIndex) {
    this(id, presentationId, title, layoutType, content, orderIndex, 1, Instant.now());
  }

  private Slide(String id, String presentationId, String title, SlideLayoutType layoutType,
      Map<String, Object> content, int orderIndex, int version, Instant createdAt) {
    Objects.requireNonNull(id, "Slide id cannot be null");
    Objects.requireNonNull(presentationId, "Presentation id cannot be null");
    Objects.requireNonNull(title, "Slide title cannot be null");
    Objects.requireNonNull(layoutType, "Layout type cannot be null");

    if (id.isBlank()) {
      throw new IllegalArgumentException("Slide id cannot be blank");
    }
    if (presentationId.isBlank()) {
      throw new IllegalArgumentException("Presentation id cannot be blank");
    }
    if (orderIndex < 0) {
      throw new IllegalArgumentException("Order index must be >= 0 (got: " + orderIndex + ")");
    }

    this.id = id;
    this.presentationId = presentationId;
    this.title = title;
    this.layoutType = layoutType;
    this.content = copyContent(content);
    this.orderIndex = orderIndex;
    this.version = version;
    this.createdAt = createdAt;
    this.updatedAt = createdAt;
  }

  /**
   * Recreates a slide that existed before, keeping its identity, version and creation time.
   *
   * @param id the slide id
   * @param presentationId the owning presentation
   * @param title the title
   * @param layoutType the layout
   * @param content the content
   * @param orderIndex the position
   * @param version the version (must be >= 1)
   * @param createdAt the original creation time, null for now
   * @return the recreated slide
   */
  public static Slide rehydrate(String id, String presentationId, String title,
      SlideLayoutType layoutType, Map<String, Object> content, int orderIndex, int version,
      Instant createdAt) {
    if (version < 1) {
      throw new IllegalArgumentException("Version must be >= 1 (got: " + version + ")");
    }
    return new Slide(id, presentationId, title, layoutType, content, orderIndex, version,
        createdAt != null ? createdAt : Instant.now());
  }

  /**
   * Returns an independent copy of this slide, content included.
   *
   * @return the copy
   */
  public Slide copy() {
    Slide copy = new Slide(id, presentationId, title, layoutType, content, orderIndex,
        version, createdAt);
    copy.subtitle = subtitle;
    copy.notes = notes;
    copy.backgroundColor = backgroundColor;
    copy.textColor = textColor;
    copy.fontFamily = fontFamily;
    copy.updatedAt = updatedAt;
    return copy;
  }

  public String getId() {
    return id;
  }

  public String getPresentationId() {
    return presentationId;
  }

  public String getTitle() {
    return title;
  }

  /**
   * Sets the title.
   *
   * @param title the new title (must be non-null)
   */
  public void setTitle(String title) {
    this.title = Objects.requireNonNull(title, "Slide title cannot be null");
    touch();
  }

  public String getSubtitle() {
    return subtitle;
  }

  public void setSubtitle(String subtitle) {
    this.subtitle = subtitle;
    touch();
  }

  public SlideLayoutType getLayoutType() {
    return layoutType;
  }

  public void setLayoutType(SlideLayoutType layoutType) {
    this.layoutType = Objects.requireNonNull(layoutType, "Layout type cannot be null");
    touch();
  }

  /**
   * Gets a copy of the content.
   *
   * @return the content
   */
  public Map<String, Object> getContent() {
    return copyContent(content);
  }

  /**
   * Replaces the content and increments the version.
   *
   * @param newContent the new content, null for empty content
   */
  public void updateContent(Map<String, Object> newContent) {
    this.content = copyContent(newContent);
    this.version++;
    touch();
  }

  /**
   * Replaces the content without touching the version.
   * Used when restoring a previously captured state.
   *
   * @param restoredContent the content to restore
   */
  public void restoreContent(Map<String, Object> restoredContent) {
    this.content = copyContent(restoredContent);
    touch();
  }

  public String getNotes() {
    return notes;
  }

  public void setNotes(String notes) {
    this.notes = notes;
    touch();
  }

  public String getBackgroundColor() {
    return backgroundColor;
  }

  public void setBackgroundColor(String backgroundColor) {
    this.backgroundColor = backgroundColor;
    touch();
  }

  public String getTextColor() {
    return textColor;
  }

  public void setTextColor(String textColor) {
    this.textColor = textColor;
    touch();
  }

  public String getFontFamily() {
    return fontFamily;
  }

  public void setFontFamily(String fontFamily) {
    this.fontFamily = fontFamily;
    touch();
  }

  public int getOrderIndex() {
    return orderIndex;
  }

  /**
   * Moves the slide to a new position.
   *
   * @param newOrder the new order index (must be >= 0)
   */
  public void moveTo(int newOrder) {
    if (newOrder < 0) {
      throw new IllegalArgumentException("Order index must be >= 0 (got: " + newOrder + ")");
    }
    this.orderIndex = newOrder;
    touch();
  }

  public int getVersion() {
    return version;
  }

  /**
   * Sets the version. Only used when a deleted slide is recreated.
   *
   * @param version the version (must be >= 1)
   */
  public void setVersion(int version) {
    if (version < 1) {
      throw new IllegalArgumentException("Version must be >= 1 (got: " + version + ")");
    }
    this.version = version;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }

  private void touch() {
    this.updatedAt = Instant.now();
  }

  private static Map<String, Object> copyContent(Map<String, Object> source) {
    return source == null ? new LinkedHashMap<>() : new LinkedHashMap<>(source);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    Slide slide = (Slide) o;
    return Objects.equals(id, slide.id);
  }

  @Override
  public int hashCode() {
    return Objects.hash(id);
  }

  @Override
  public String toString() {
    return "Slide{id='" + id + "', presentationId='" + presentationId
        + "', title='" + title + "', orderIndex=" + orderIndex + ", version=" + version + '}';
  }
}
