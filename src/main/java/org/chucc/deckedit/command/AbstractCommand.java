package org.chucc.deckedit.command;

import com.github.f4b6a3.uuid.UuidCreator;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import org.chucc.deckedit.exception.CommandExecutionException;
import org.chucc.deckedit.exception.CommandUndoException;

/**
 * Base class for commands. Enforces the lifecycle and timestamps, and converts store failures
 * into {@link CommandExecutionException} / {@link CommandUndoException}.
 *
 * <p>Subclasses implement {@link #doExecute()} and {@link #doUndo()}. {@code doExecute} must
 * capture whatever it needs for {@code doUndo} before it mutates anything; it runs again on
 * every redo, so it must recompute from the current store state rather than reuse earlier
 * results.
 */
public abstract class AbstractCommand implements Command {

  private final String id;
  private final Instant createdAt;
  private Instant executedAt;
  private Instant undoneAt;
  private CommandState state;

  /**
   * Creates a new pending command with a fresh UUIDv7 id.
   */
  protected AbstractCommand() {
    this.id = UuidCreator.getTimeOrderedEpoch().toString();
    this.createdAt = Instant.now();
    this.state = CommandState.PENDING;
  }

  /**
   * Restores identity, timestamps and lifecycle state from a record.
   *
   * @param commandRecord the record
   */
  protected AbstractCommand(CommandRecord commandRecord) {
    this.id = commandRecord.id();
    this.createdAt = commandRecord.createdAt();
    this.executedAt = commandRecord.executedAt();
    this.undoneAt = commandRecord.undoneAt();
    this.state = stateOf(commandRecord);
  }

  private static CommandState stateOf(CommandRecord commandRecord) {
    if (commandRecord.executedAt() == null) {
      return CommandState.PENDING;
    }
    if (commandRecord.undoneAt() != null
        && !commandRecord.undoneAt().isBefore(commandRecord.executedAt())) {
      return CommandState.UNDONE;
    }
    return CommandState.EXECUTED;
  }

  /**
   * Performs the forward operation against the store.
   */
  protected abstract void doExecute();

  /**
   * Reverses the last forward operation against the store.
   */
  protected abstract void doUndo();

  /**
   * Gets the command-specific payload: forward arguments plus captured prior state.
   *
   * @return the payload
   */
  protected abstract Map<String, Object> payload();

  @Override
  public final synchronized void execute() {
    if (state == CommandState.EXECUTED) {
      throw new IllegalStateException("Command " + id + " (" + commandType()
          + ") is already executed");
    }
    try {
      doExecute();
    } catch (CommandExecutionException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new CommandExecutionException(commandType(),
          commandType() + " failed on " + targetType() + " " + targetId() + ": "
              + e.getMessage(), e);
    }
    executedAt = Instant.now();
    state = CommandState.EXECUTED;
  }

  @Override
  public final synchronized void undo() {
    if (state != CommandState.EXECUTED) {
      throw new IllegalStateException("Command " + id + " (" + commandType()
          + ") cannot be undone in state " + state);
    }
    try {
      doUndo();
    } catch (CommandUndoException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new CommandUndoException(commandType(),
          "Undo of " + commandType() + " failed on " + targetType() + " " + targetId() + ": "
              + e.getMessage(), e);
    }
    undoneAt = Instant.now();
    state = CommandState.UNDONE;
  }

  @Override
  public synchronized CommandRecord toRecord() {
    return new CommandRecord(id, commandType(), targetId(), targetType(), createdAt,
        executedAt, undoneAt, new LinkedHashMap<>(payload()));
  }

  @Override
  public String id() {
    return id;
  }

  @Override
  public synchronized CommandState state() {
    return state;
  }

  @Override
  public Instant createdAt() {
    return createdAt;
  }

  @Override
  public synchronized Instant executedAt() {
    return executedAt;
  }

  @Override
  public synchronized Instant undoneAt() {
    return undoneAt;
  }

  @Override
  public String toString() {
    return commandType() + "{id=" + id + ", target=" + targetType() + ":" + targetId()
        + ", state=" + state() + '}';
  }

  /**
   * Reads a required string from a payload.
   *
   * @param payload the payload
   * @param key the key
   * @return the value
   * @throws IllegalArgumentException if missing or not a string
   */
  protected static String requireString(Map<String, Object> payload, String key) {
    Object value = payload.get(key);
    if (!(value instanceof String text)) {
      throw new IllegalArgumentException("Payload field '" + key + "' must be a string");
    }
    return text;
  }

  /**
   * Reads an optional string from a payload.
   *
   * @param payload the payload
   * @param key the key
   * @return the value, or null if absent
   */
  protected static String optionalString(Map<String, Object> payload, String key) {
    Object value = payload.get(key);
    if (value == null) {
      return null;
    }
    if (!(value instanceof String text)) {
      throw new IllegalArgumentException("Payload field '" + key + "' must be a string");
    }
    return text;
  }

  /**
   * Reads an optional integer from a payload. JSON numbers may arrive as any Number type.
   *
   * @param payload the payload
   * @param key the key
   * @return the value, or null if absent
   */
  protected static Integer optionalInt(Map<String, Object> payload, String key) {
    Object value = payload.get(key);
    if (value == null) {
      return null;
    }
    if (!(value instanceof Number number)) {
      throw new IllegalArgumentException("Payload field '" + key + "' must be a number");
    }
    return number.intValue();
  }

  /**
   * Reads an optional JSON object from a payload.
   *
   * @param payload the payload
   * @param key the key
   * @return a mutable copy of the value, or null if absent
   */
  protected static Map<String, Object> optionalMap(Map<String, Object> payload, String key) {
    Object value = payload.get(key);
    if (value == null) {
      return null;
    }
    if (!(value instanceof Map<?, ?> map)) {
      throw new IllegalArgumentException("Payload field '" + key + "' must be an object");
    }
    Map<String, Object> copy = new LinkedHashMap<>();
    map.forEach((k, v) -> copy.put(String.valueOf(k), v));
    return copy;
  }
}
