package org.chucc.deckedit.command;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.mock;

import java.time.Instant;
import java.util.Map;
import org.chucc.deckedit.config.CommandRegistryConfig;
import org.chucc.deckedit.domain.SlideChanges;
import org.chucc.deckedit.exception.UnknownCommandTypeException;
import org.chucc.deckedit.repository.InMemorySlideRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for CommandRegistry and its slide command registrations.
 */
class CommandRegistryTest {

  private InMemorySlideRepository store;
  private CommandRegistry registry;

  @BeforeEach
  void setUp() {
    store = new InMemorySlideRepository();
    registry = new CommandRegistryConfig().commandRegistry(store);
  }

  @Test
  void registeredTypes_shouldContainAllSlideCommands() {
    assertThat(registry.registeredTypes()).containsExactlyInAnyOrder(
        CreateSlideCommand.TYPE,
        UpdateSlideCommand.TYPE,
        DeleteSlideCommand.TYPE,
        MoveSlideCommand.TYPE);
  }

  @Test
  void create_shouldRebuildCommandOfRecordedType() {
    // Given
    CommandRecord commandRecord = new UpdateSlideCommand("s1",
        SlideChanges.of(Map.of("title", "New")), store).toRecord();

    // When
    Command command = registry.create(commandRecord);

    // Then
    assertInstanceOf(UpdateSlideCommand.class, command);
    assertEquals(commandRecord.id(), command.id());
    assertEquals(CommandState.PENDING, command.state());
  }

  @Test
  void create_whenTypeUnknown_shouldThrow() {
    CommandRecord commandRecord = new CommandRecord("id-1", "RenameDeckCommand", "deck-1",
        "presentation", Instant.now(), null, null, Map.of());

    UnknownCommandTypeException failure = assertThrows(UnknownCommandTypeException.class,
        () -> registry.create(commandRecord));

    assertEquals("RenameDeckCommand", failure.getCommandType());
    assertEquals("unknown_command_type", failure.getCode());
    assertEquals(500, failure.getStatus());
  }

  @Test
  void register_shouldReplacePreviousReconstructor() {
    // Given
    Command replacement = mock(Command.class);
    registry.register(DeleteSlideCommand.TYPE, commandRecord -> replacement);
    CommandRecord commandRecord = new CommandRecord("id-1", DeleteSlideCommand.TYPE, "s1",
        "slide", Instant.now(), null, null, Map.of("slide_id", "s1"));

    // When
    Command command = registry.create(commandRecord);

    // Then
    assertSame(replacement, command);
  }

  @Test
  void register_whenTypeBlank_shouldThrow() {
    assertThrows(IllegalArgumentException.class,
        () -> registry.register(" ", commandRecord -> null));
    assertFalse(registry.isRegistered(" "));
    assertFalse(registry.isRegistered(null));
  }
}
