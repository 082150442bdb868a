package org.chucc.deckedit.command;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.HashMap;
import java.util.Map;
import org.assertj.core.api.InstanceOfAssertFactories;
import org.chucc.deckedit.domain.Slide;
import org.chucc.deckedit.domain.SlideChanges;
import org.chucc.deckedit.domain.SlideLayoutType;
import org.chucc.deckedit.exception.CommandExecutionException;
import org.chucc.deckedit.exception.SlideNotFoundException;
import org.chucc.deckedit.repository.InMemorySlideRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for UpdateSlideCommand.
 */
class UpdateSlideCommandTest {

  private InMemorySlideRepository store;

  @BeforeEach
  void setUp() {
    store = new InMemorySlideRepository();
    Slide slide = new Slide("s1", "deck-1", "Old title", SlideLayoutType.TITLE_CONTENT,
        Map.of("body", "old"), 0);
    slide.setNotes("speaker notes");
    store.create(slide);
  }

  @Test
  void executeAndUndo_shouldRestoreFieldsAndVersion() {
    // Given
    UpdateSlideCommand command = new UpdateSlideCommand("s1",
        SlideChanges.of(Map.of("title", "New title", "content", Map.of("body", "new"))), store);

    // When
    command.execute();

    // Then
    Slide updated = store.findById("s1").orElseThrow();
    assertEquals("New title", updated.getTitle());
    assertEquals(Map.of("body", "new"), updated.getContent());
    assertEquals(2, updated.getVersion());

    // When undone
    command.undo();

    // Then
    Slide restored = store.findById("s1").orElseThrow();
    assertEquals("Old title", restored.getTitle());
    assertEquals(Map.of("body", "old"), restored.getContent());
    assertEquals("speaker notes", restored.getNotes());
    assertEquals(1, restored.getVersion());
  }

  @Test
  void redo_shouldReapplyAgainstCurrentState() {
    // Given
    UpdateSlideCommand command = new UpdateSlideCommand("s1",
        SlideChanges.of(Map.of("layout_type", "TWO_COLUMN")), store);
    command.execute();
    command.undo();

    // When
    command.execute();

    // Then
    Slide slide = store.findById("s1").orElseThrow();
    assertEquals(SlideLayoutType.TWO_COLUMN, slide.getLayoutType());
    assertEquals(1, slide.getVersion());
  }

  @Test
  void execute_shouldClearFieldWhenValueIsNull() {
    Map<String, Object> changes = new HashMap<>();
    changes.put("notes", null);
    UpdateSlideCommand command = new UpdateSlideCommand("s1", SlideChanges.of(changes), store);

    command.execute();
    assertNull(store.findById("s1").orElseThrow().getNotes());

    command.undo();
    assertEquals("speaker notes", store.findById("s1").orElseThrow().getNotes());
  }

  @Test
  void execute_whenSlideMissing_shouldFailWithoutChanges() {
    UpdateSlideCommand command = new UpdateSlideCommand("missing",
        SlideChanges.of(Map.of("title", "x")), store);

    CommandExecutionException failure =
        assertThrows(CommandExecutionException.class, command::execute);

    assertThat(failure.getCause()).isInstanceOf(SlideNotFoundException.class);
    assertEquals(CommandState.PENDING, command.state());
    assertThat(command.toRecord().payload().get("previous_state")).isNull();
  }

  @Test
  void toRecord_shouldCarryChangesAndCapturedState() {
    UpdateSlideCommand command = new UpdateSlideCommand("s1",
        SlideChanges.of(Map.of("title", "New title")), store);
    command.execute();

    CommandRecord commandRecord = command.toRecord();

    assertEquals(UpdateSlideCommand.TYPE, commandRecord.type());
    assertEquals("s1", commandRecord.targetId());
    assertEquals("slide", commandRecord.targetType());
    assertEquals(Map.of("title", "New title"), commandRecord.payload().get("changes"));
    assertThat(commandRecord.payload().get("previous_state"))
        .asInstanceOf(InstanceOfAssertFactories.MAP)
        .containsEntry("title", "Old title");
    assertEquals(1, commandRecord.payload().get("previous_version"));
  }

  @Test
  void reconstructedCommand_shouldUndoTheOriginalUpdate() {
    UpdateSlideCommand original = new UpdateSlideCommand("s1",
        SlideChanges.of(Map.of("title", "New title")), store);
    original.execute();

    UpdateSlideCommand rebuilt = new UpdateSlideCommand(original.toRecord(), store);
    rebuilt.undo();

    assertEquals("Old title", store.findById("s1").orElseThrow().getTitle());
  }
}
