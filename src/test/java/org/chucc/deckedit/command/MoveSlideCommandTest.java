package org.chucc.deckedit.command;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.chucc.deckedit.domain.Slide;
import org.chucc.deckedit.domain.SlideLayoutType;
import org.chucc.deckedit.exception.CommandExecutionException;
import org.chucc.deckedit.repository.InMemorySlideRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for MoveSlideCommand.
 */
class MoveSlideCommandTest {

  private static final String PRESENTATION = "deck-1";

  private InMemorySlideRepository store;

  @BeforeEach
  void setUp() {
    store = new InMemorySlideRepository();
  }

  private void addSlide(String id, int order) {
    store.create(new Slide(id, PRESENTATION, "Slide " + id, SlideLayoutType.BLANK, null, order));
  }

  private Iterable<String> orderedIds() {
    return store.findAllByPresentation(PRESENTATION).stream().map(Slide::getId).toList();
  }

  @Test
  void executeAndUndo_shouldMoveAndRestoreOrder() {
    // Given
    addSlide("a", 0);
    addSlide("b", 1);
    addSlide("c", 2);
    MoveSlideCommand command = new MoveSlideCommand("c", 0, store);

    // When
    command.execute();

    // Then
    assertThat(orderedIds()).containsExactly("c", "a", "b");
    assertThat(store.findAllByPresentation(PRESENTATION))
        .extracting(Slide::getOrderIndex).containsExactly(0, 1, 2);

    // When undone
    command.undo();

    // Then
    assertThat(orderedIds()).containsExactly("a", "b", "c");
  }

  @Test
  void undo_shouldRestoreOriginalGaps() {
    // Given
    addSlide("a", 0);
    addSlide("b", 5);
    addSlide("c", 9);
    MoveSlideCommand command = new MoveSlideCommand("a", 2, store);
    command.execute();
    assertThat(orderedIds()).containsExactly("b", "c", "a");

    // When
    command.undo();

    // Then
    assertEquals(5, store.findById("b").orElseThrow().getOrderIndex());
    assertEquals(9, store.findById("c").orElseThrow().getOrderIndex());
    assertEquals(0, store.findById("a").orElseThrow().getOrderIndex());
  }

  @Test
  void execute_whenOrderOutOfRange_shouldFailAndChangeNothing() {
    addSlide("a", 0);
    addSlide("b", 1);
    MoveSlideCommand command = new MoveSlideCommand("a", 2, store);

    assertThrows(CommandExecutionException.class, command::execute);

    assertThat(orderedIds()).containsExactly("a", "b");
    assertEquals(CommandState.PENDING, command.state());
  }

  @Test
  void constructor_whenOrderNegative_shouldThrow() {
    assertThrows(IllegalArgumentException.class, () -> new MoveSlideCommand("a", -1, store));
  }

  @Test
  void reconstructedCommand_shouldUndoWithCapturedOrders() {
    addSlide("a", 0);
    addSlide("b", 1);
    MoveSlideCommand command = new MoveSlideCommand("b", 0, store);
    command.execute();

    MoveSlideCommand rebuilt = new MoveSlideCommand(command.toRecord(), store);
    rebuilt.undo();

    assertThat(orderedIds()).containsExactly("a", "b");
  }
}
