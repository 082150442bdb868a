package org.chucc.deckedit.domain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A set of changes to the editable fields of a slide, keyed by wire field name.
 *
 * <p>A key that is present is applied even when its value is null (clearing the field);
 * a key that is absent leaves the field untouched. The same type doubles as a snapshot
 * of all editable fields, which is what an update captures before it mutates.
 */
public final class SlideChanges {

  public static final String TITLE = "title";
  public static final String SUBTITLE = "subtitle";
  public static final String LAYOUT_TYPE = "layout_type";
  public static final String CONTENT = "content";
  public static final String NOTES = "notes";
  public static final String BACKGROUND_COLOR = "background_color";
  public static final String TEXT_COLOR = "text_color";
  public static final String FONT_FAMILY = "font_family";

  /**
   * Editable field names, in application order.
   */
  public static final List<String> FIELDS = List.of(
      TITLE, SUBTITLE, LAYOUT_TYPE, CONTENT, NOTES, BACKGROUND_COLOR, TEXT_COLOR, FONT_FAMILY);

  private final Map<String, Object> values;

  private SlideChanges(Map<String, Object> values) {
    this.values = values;
  }

  /**
   * Creates a change set from raw field values.
   *
   * @param changes field name to new value (must be non-null, non-empty)
   * @return the change set
   * @throws IllegalArgumentException if a key is not an editable field or a value has the wrong
   *     type
   */
  public static SlideChanges of(Map<String, ?> changes) {
    Objects.requireNonNull(changes, "Changes cannot be null");
    if (changes.isEmpty()) {
      throw new IllegalArgumentException("Changes cannot be empty");
    }
    Map<String, Object> validated = new LinkedHashMap<>();
    for (Map.Entry<String, ?> entry : changes.entrySet()) {
      String field = entry.getKey();
      if (!FIELDS.contains(field)) {
        throw new IllegalArgumentException("Field is not editable: " + field);
      }
      validated.put(field, validateValue(field, entry.getValue()));
    }
    return new SlideChanges(validated);
  }

  /**
   * Captures every editable field of a slide.
   *
   * @param slide the slide
   * @return a snapshot that restores the slide's current editable state when applied
   */
  public static SlideChanges snapshotOf(Slide slide) {
    Map<String, Object> snapshot = new LinkedHashMap<>();
    snapshot.put(TITLE, slide.getTitle());
    snapshot.put(SUBTITLE, slide.getSubtitle());
    snapshot.put(LAYOUT_TYPE, slide.getLayoutType().getValue());
    snapshot.put(CONTENT, slide.getContent());
    snapshot.put(NOTES, slide.getNotes());
    snapshot.put(BACKGROUND_COLOR, slide.getBackgroundColor());
    snapshot.put(TEXT_COLOR, slide.getTextColor());
    snapshot.put(FONT_FAMILY, slide.getFontFamily());
    return new SlideChanges(snapshot);
  }

  /**
   * Applies the changes as a forward edit. A content change bumps the slide version.
   *
   * @param slide the slide to mutate
   */
  public void applyTo(Slide slide) {
    apply(slide, false);
  }

  /**
   * Applies the changes as a restoration. Content is put back without bumping the version.
   *
   * @param slide the slide to mutate
   */
  public void restoreOnto(Slide slide) {
    apply(slide, true);
  }

  private void apply(Slide slide, boolean restoring) {
    values.forEach((field, value) -> {
      switch (field) {
        case TITLE -> slide.setTitle((String) value);
        case SUBTITLE -> slide.setSubtitle((String) value);
        case LAYOUT_TYPE -> slide.setLayoutType(SlideLayoutType.fromValue((String) value));
        case CONTENT -> {
          Map<String, Object> content = copyContent(value);
          if (restoring) {
            slide.restoreContent(content);
          } else {
            slide.updateContent(content);
          }
        }
        case NOTES -> slide.setNotes((String) value);
        case BACKGROUND_COLOR -> slide.setBackgroundColor((String) value);
        case TEXT_COLOR -> slide.setTextColor((String) value);
        case FONT_FAMILY -> slide.setFontFamily((String) value);
        default -> throw new IllegalStateException("Unhandled field: " + field);
      }
    });
  }

  /**
   * Gets the changed field names.
   *
   * @return the field names
   */
  public List<String> fields() {
    return List.copyOf(values.keySet());
  }

  /**
   * Returns the changes as a plain map, suitable for a command record payload.
   *
   * @return unmodifiable view of the changes
   */
  public Map<String, Object> asMap() {
    return Collections.unmodifiableMap(values);
  }

  private static Object validateValue(String field, Object value) {
    switch (field) {
      case TITLE -> {
        if (!(value instanceof String title) || title.isBlank()) {
          throw new IllegalArgumentException("Title must be a non-blank string");
        }
        return value;
      }
      case LAYOUT_TYPE -> {
        if (value instanceof SlideLayoutType layout) {
          return layout.getValue();
        }
        if (!(value instanceof String layout)) {
          throw new IllegalArgumentException("Layout type must be a string");
        }
        return SlideLayoutType.fromValue(layout).getValue();
      }
      case CONTENT -> {
        return copyContent(value);
      }
      default -> {
        if (value != null && !(value instanceof String)) {
          throw new IllegalArgumentException("Field " + field + " must be a string");
        }
        return value;
      }
    }
  }

  private static Map<String, Object> copyContent(Object value) {
    if (value == null) {
      return null;
    }
    if (!(value instanceof Map<?, ?> content)) {
      throw new IllegalArgumentException("Content must be a JSON object");
    }
    Map<String, Object> copy = new LinkedHashMap<>();
    content.forEach((k, v) -> copy.put(String.valueOf(k), v));
    return copy;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    return values.equals(((SlideChanges) o).values);
  }

  @Override
  public int hashCode() {
    return values.hashCode();
  }

  @Override
  public String toString() {
    return "SlideChanges" + values;
  }
}
