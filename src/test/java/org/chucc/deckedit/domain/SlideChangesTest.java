package org.chucc.deckedit.domain;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for SlideChanges.
 */
class SlideChangesTest {

  @Test
  void of_shouldRejectUnknownOrEmptyChanges() {
    assertThatThrownBy(() -> SlideChanges.of(Map.of("order_index", 3)))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("order_index");
    assertThatThrownBy(() -> SlideChanges.of(Map.of()))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void of_shouldValidateValueTypes() {
    assertThatThrownBy(() -> SlideChanges.of(Map.of("title", "  ")))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> SlideChanges.of(Map.of("content", "not an object")))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> SlideChanges.of(Map.of("layout_type", "hexagon")))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> SlideChanges.of(Map.of("notes", 42)))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void of_shouldNormalizeLayoutAndAllowClearingOptionalFields() {
    Map<String, Object> raw = new HashMap<>();
    raw.put("layout_type", "Image_Left");
    raw.put("subtitle", null);

    SlideChanges changes = SlideChanges.of(raw);

    assertThat(changes.asMap())
        .containsEntry("layout_type", "image_left")
        .containsEntry("subtitle", null);
  }

  @Test
  void applyTo_shouldBumpVersionOnlyForForwardContentChange() {
    Slide slide = new Slide("s1", "deck-1", "Title", SlideLayoutType.BLANK, Map.of("a", 1), 0);
    SlideChanges snapshot = SlideChanges.snapshotOf(slide);

    SlideChanges.of(Map.of("content", Map.of("a", 2))).applyTo(slide);
    assertThat(slide.getVersion()).isEqualTo(2);

    snapshot.restoreOnto(slide);
    assertThat(slide.getVersion()).isEqualTo(2);
    assertThat(slide.getContent()).containsEntry("a", 1);
  }

  @Test
  void applyTo_shouldCopyContentAndTreatNullAsCleared() {
    Slide slide = new Slide("s1", "deck-1", "Title", SlideLayoutType.BLANK, Map.of("a", 1), 0);
    Map<String, Object> content = new HashMap<>();
    content.put("b", 2);
    SlideChanges changes = SlideChanges.of(Map.of("content", content));
    content.put("c", 3);

    changes.applyTo(slide);
    assertThat(slide.getContent()).containsExactly(Map.entry("b", 2));

    Map<String, Object> cleared = new HashMap<>();
    cleared.put("content", null);
    SlideChanges.of(cleared).restoreOnto(slide);
    assertThat(slide.getContent()).isEmpty();
  }

  @Test
  void snapshotOf_shouldCaptureEveryEditableField() {
    Slide slide = new Slide("s1", "deck-1", "Title", SlideLayoutType.BLANK, null, 0);
    slide.setFontFamily("Inter");

    assertThat(SlideChanges.snapshotOf(slide).fields())
        .containsExactlyElementsOf(SlideChanges.FIELDS);
    assertThat(SlideChanges.snapshotOf(slide).asMap()).containsEntry("font_family", "Inter");
  }
}
