package org.chucc.deckedit.command;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import org.chucc.deckedit.repository.InMemorySlideRepository;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for CommandRecord and lifecycle state recovery from records.
 */
class CommandRecordTest {

  private static final Instant CREATED = Instant.parse("2025-03-01T10:00:00Z");
  private static final Instant EXECUTED = Instant.parse("2025-03-01T10:00:01Z");

  @Test
  void constructor_shouldRejectMissingRequiredFields() {
    assertThrows(NullPointerException.class,
        () -> new CommandRecord(null, "T", "x", "slide", CREATED, null, null, null));
    assertThrows(NullPointerException.class,
        () -> new CommandRecord("id", "T", "x", "slide", null, null, null, null));
    assertThrows(IllegalArgumentException.class,
        () -> new CommandRecord("id", "  ", "x", "slide", CREATED, null, null, null));
  }

  @Test
  void payload_shouldBeImmutableCopyAllowingNullValues() {
    Map<String, Object> payload = new HashMap<>();
    payload.put("previous_state", null);

    CommandRecord commandRecord =
        new CommandRecord("id", "T", "x", "slide", CREATED, null, null, payload);
    payload.put("later", "ignored");

    assertThat(commandRecord.payload()).containsOnlyKeys("previous_state");
    assertThrows(UnsupportedOperationException.class,
        () -> commandRecord.payload().put("k", "v"));
    assertEquals(Map.of(),
        new CommandRecord("id", "T", "x", "slide", CREATED, null, null, null).payload());
  }

  @Test
  void reconstructedState_shouldFollowTimestamps() {
    InMemorySlideRepository store = new InMemorySlideRepository();
    Map<String, Object> payload = Map.of("slide_id", "s1");

    DeleteSlideCommand pending = new DeleteSlideCommand(new CommandRecord("1",
        DeleteSlideCommand.TYPE, "s1", "slide", CREATED, null, null, payload), store);
    DeleteSlideCommand executed = new DeleteSlideCommand(new CommandRecord("2",
        DeleteSlideCommand.TYPE, "s1", "slide", CREATED, EXECUTED, null, payload), store);
    DeleteSlideCommand undone = new DeleteSlideCommand(new CommandRecord("3",
        DeleteSlideCommand.TYPE, "s1", "slide", CREATED, EXECUTED,
        EXECUTED.plusSeconds(5), payload), store);
    DeleteSlideCommand redone = new DeleteSlideCommand(new CommandRecord("4",
        DeleteSlideCommand.TYPE, "s1", "slide", CREATED, EXECUTED.plusSeconds(9),
        EXECUTED.plusSeconds(5), payload), store);

    assertEquals(CommandState.PENDING, pending.state());
    assertEquals(CommandState.EXECUTED, executed.state());
    assertEquals(CommandState.UNDONE, undone.state());
    assertEquals(CommandState.EXECUTED, redone.state());
  }
}
