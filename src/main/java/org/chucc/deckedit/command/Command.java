package org.chucc.deckedit.command;

import java.time.Instant;

/**
 * A reversible unit of change against one target entity.
 *
 * <p>Lifecycle: {@link CommandState#PENDING} → {@link #execute()} → {@link CommandState#EXECUTED}
 * → {@link #undo()} → {@link CommandState#UNDONE} → {@link #execute()} (redo) → ...
 * A command is executed at most once before being undone, cannot be undone before it has been
 * executed, and can only be re-executed right after an undo.
 */
public interface Command {

  /**
   * Gets the unique command id (UUIDv7).
   *
   * @return the command id
   */
  String id();

  /**
   * Gets the type tag used to look up a reconstructor in the {@link CommandRegistry}.
   *
   * @return the command type tag
   */
  String commandType();

  /**
   * Gets the id of the entity this command targets.
   *
   * @return the target id
   */
  String targetId();

  /**
   * Gets the type tag of the entity this command targets.
   *
   * @return the target type
   */
  String targetType();

  /**
   * Gets the current lifecycle state.
   *
   * @return the state
   */
  CommandState state();

  Instant createdAt();

  /**
   * Gets the time of the last successful execution.
   *
   * @return the execution time, or null if never executed
   */
  Instant executedAt();

  /**
   * Gets the time of the last successful undo.
   *
   * @return the undo time, or null if never undone
   */
  Instant undoneAt();

  /**
   * Performs the forward operation, capturing the state needed to reverse it first.
   * On failure the command stays in its previous state.
   *
   * @throws org.chucc.deckedit.exception.CommandExecutionException if the store rejects the
   *     operation
   * @throws IllegalStateException if the command is already executed
   */
  void execute();

  /**
   * Restores the state captured by the last execution.
   * On failure the command stays executed.
   *
   * @throws org.chucc.deckedit.exception.CommandUndoException if the store rejects the
   *     restoration
   * @throws IllegalStateException if the command is not executed
   */
  void undo();

  /**
   * Serializes the command into a transport-neutral record.
   *
   * @return the record
   */
  CommandRecord toRecord();
}
