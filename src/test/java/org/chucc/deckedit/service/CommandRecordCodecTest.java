package org.chucc.deckedit.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Map;
import org.chucc.deckedit.command.Command;
import org.chucc.deckedit.command.CommandRecord;
import org.chucc.deckedit.command.CommandState;
import org.chucc.deckedit.command.MoveSlideCommand;
import org.chucc.deckedit.command.UpdateSlideCommand;
import org.chucc.deckedit.config.CommandRegistryConfig;
import org.chucc.deckedit.domain.Slide;
import org.chucc.deckedit.domain.SlideChanges;
import org.chucc.deckedit.domain.SlideLayoutType;
import org.chucc.deckedit.exception.UnknownCommandTypeException;
import org.chucc.deckedit.repository.InMemorySlideRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for CommandRecordCodec.
 */
class CommandRecordCodecTest {

  private InMemorySlideRepository store;
  private CommandRecordCodec codec;

  @BeforeEach
  void setUp() {
    store = new InMemorySlideRepository();
    store.create(new Slide("s1", "deck-1", "Old", SlideLayoutType.BLANK, null, 0));
    store.create(new Slide("s2", "deck-1", "Other", SlideLayoutType.BLANK, null, 1));
    codec = new CommandRecordCodec(new ObjectMapper(),
        new CommandRegistryConfig().commandRegistry(store));
  }

  @Test
  void toJson_shouldUseSnakeCaseKeysAndIsoTimestamps() {
    UpdateSlideCommand command = new UpdateSlideCommand("s1",
        SlideChanges.of(Map.of("title", "New")), store);
    command.execute();

    String json = codec.toJson(command);

    assertThat(json)
        .contains("\"type\":\"UpdateSlideCommand\"")
        .contains("\"target_id\":\"s1\"")
        .contains("\"target_type\":\"slide\"")
        .contains("\"created_at\":\"" + command.createdAt() + "\"")
        .contains("\"undone_at\":null")
        .contains("\"previous_version\":1");
  }

  @Test
  void decode_shouldRebuildCommandThatCanStillBeUndone() {
    // Given
    MoveSlideCommand command = new MoveSlideCommand("s2", 0, store);
    command.execute();
    String json = codec.toJson(command);

    // When
    Command decoded = codec.decode(json);
    decoded.undo();

    // Then
    assertInstanceOf(MoveSlideCommand.class, decoded);
    assertEquals(CommandState.UNDONE, decoded.state());
    assertEquals(0, store.findById("s1").orElseThrow().getOrderIndex());
    assertEquals(1, store.findById("s2").orElseThrow().getOrderIndex());
  }

  @Test
  void fromJson_whenMalformed_shouldThrowIllegalArgument() {
    assertThrows(IllegalArgumentException.class, () -> codec.fromJson("{not json"));
    assertThrows(IllegalArgumentException.class,
        () -> codec.fromJson("{\"type\":\"UpdateSlideCommand\"}"));
  }

  @Test
  void decode_whenTypeUnknown_shouldThrow() {
    CommandRecord parsed = codec.fromJson("""
        {"id":"c1","type":"RenameDeckCommand","target_id":"deck-1",
         "target_type":"presentation","created_at":"2025-03-01T10:00:00Z","payload":{}}
        """);
    assertEquals("RenameDeckCommand", parsed.type());

    assertThrows(UnknownCommandTypeException.class, () -> codec.decode("""
        {"id":"c1","type":"RenameDeckCommand","target_id":"deck-1",
         "target_type":"presentation","created_at":"2025-03-01T10:00:00Z","payload":{}}
        """));
  }
}
