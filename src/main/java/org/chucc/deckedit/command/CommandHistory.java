package org.chucc.deckedit.command;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;
import org.chucc.deckedit.exception.HistoryDiscardedException;
import org.chucc.deckedit.exception.NothingToRedoException;
import org.chucc.deckedit.exception.NothingToUndoException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Bounded undo/redo history of one aggregate (one presentation).
 *
 * <p>Invariants:
 * <ul>
 * <li>The undo stack never holds more than {@code maxDepth} commands; the oldest is evicted
 * first.</li>
 * <li>Executing a new command clears the redo stack.</li>
 * <li>Commands are moved between the stacks, never copied or dropped, except by eviction and
 * {@link #clear()}.</li>
 * <li>A failed execute, undo or redo leaves both stacks exactly as they were.</li>
 * </ul>
 *
 * <p>Thread Safety: every operation, including reads, runs under one fair lock per history.
 * The lock is held across the store round-trip of the command, so a second operation on the
 * same presentation only sees the completed result of the first. The reporter variants of
 * execute, undo and redo also build their result under that lock. Histories of different
 * presentations share nothing.
 *
 * <p>A history removed from its directory is retired: execute, undo and redo then fail with
 * {@link HistoryDiscardedException} and leave the command untouched.
 */
public class CommandHistory {

  private static final Logger logger = LoggerFactory.getLogger(CommandHistory.class);

  public static final int DEFAULT_MAX_DEPTH = 50;

  private final String aggregateId;
  private final int maxDepth;

  // Both stacks: last element is the top
  private final Deque<Command> undoStack = new ArrayDeque<>();
  private final Deque<Command> redoStack = new ArrayDeque<>();

  private final ReentrantLock lock = new ReentrantLock(true);

  // Guarded by lock
  private boolean retired;

  /**
   * Creates an empty history.
   *
   * @param aggregateId the aggregate (presentation) id
   * @param maxDepth the maximum number of undoable commands (must be >= 1)
   * @throws IllegalArgumentException if maxDepth &lt; 1
   */
  public CommandHistory(String aggregateId, int maxDepth) {
    this.aggregateId = Objects.requireNonNull(aggregateId, "Aggregate id cannot be null");
    if (maxDepth < 1) {
      throw new IllegalArgumentException("maxDepth must be >= 1 (got: " + maxDepth + ")");
    }
    this.maxDepth = maxDepth;
  }

  /**
   * Executes a new command and records it.
   *
   * @param command the command
   * @return the executed command
   * @throws org.chucc.deckedit.exception.CommandExecutionException if execution fails; history
   *     is unchanged
   * @throws HistoryDiscardedException if this history was retired
   */
  public Command execute(Command command) {
    return execute(command, executed -> executed);
  }

  /**
   * Executes a new command, records it and reports the outcome before any other operation
   * on this history can run.
   *
   * @param command the command
   * @param reporter builds the result from the executed command, runs under the history lock
   * @param <R> the result type
   * @return the reporter's result
   * @throws HistoryDiscardedException if this history was retired
   */
  public <R> R execute(Command command, Function<? super Command, ? extends R> reporter) {
    Objects.requireNonNull(command, "Command cannot be null");
    lock.lock();
    try {
      requireActive();
      try {
        command.execute();
      } catch (RuntimeException e) {
        logger.warn("Execute of {} {} failed for {}: {}",
            command.commandType(), command.id(), aggregateId, e.getMessage());
        throw e;
      }

      undoStack.addLast(command);
      evictOverflow();
      if (!redoStack.isEmpty()) {
        logger.debug("Discarding {} redoable command(s) for {} after new edit",
            redoStack.size(), aggregateId);
        redoStack.clear();
      }

      logger.debug("Executed {} {} for {} (undo={}, redo={})",
          command.commandType(), command.id(), aggregateId, undoStack.size(), redoStack.size());
      return reporter.apply(command);
    } finally {
      lock.unlock();
    }
  }

  /**
   * Undoes the most recent command.
   *
   * @return the undone command
   * @throws NothingToUndoException if the undo stack is empty
   * @throws org.chucc.deckedit.exception.CommandUndoException if the reversal fails; the command
   *     stays on the undo stack
   */
  public Command undo() {
    lock.lock();
    try {
      requireActive();
      return undoOne();
    } finally {
      lock.unlock();
    }
  }

  /**
   * Re-executes the most recently undone command.
   *
   * @return the redone command
   * @throws NothingToRedoException if the redo stack is empty
   * @throws org.chucc.deckedit.exception.CommandExecutionException if re-execution fails; the
   *     command stays on the redo stack
   */
  public Command redo() {
    lock.lock();
    try {
      requireActive();
      return redoOne();
    } finally {
      lock.unlock();
    }
  }

  /**
   * Undoes up to {@code count} commands in one exclusive step.
   * Stops early when the undo stack runs empty. If one undo fails, the ones before it stay
   * undone and the failure propagates.
   *
   * @param count the number of commands to undo (must be >= 1)
   * @return the undone commands, most recent first
   * @throws NothingToUndoException if the undo stack is empty to begin with
   */
  public List<Command> undoMany(int count) {
    return undoMany(count, undone -> undone);
  }

  /**
   * Undoes up to {@code count} commands and reports the outcome under the same lock.
   *
   * @param count the number of commands to undo (must be >= 1)
   * @param reporter builds the result from the undone commands, most recent first
   * @param <R> the result type
   * @return the reporter's result
   * @throws NothingToUndoException if the undo stack is empty to begin with
   * @throws HistoryDiscardedException if this history was retired
   */
  public <R> R undoMany(int count, Function<? super List<Command>, ? extends R> reporter) {
    requirePositive(count);
    lock.lock();
    try {
      requireActive();
      List<Command> undone = new ArrayList<>();
      undone.add(undoOne());
      while (undone.size() < count && !undoStack.isEmpty()) {
        undone.add(undoOne());
      }
      return reporter.apply(undone);
    } finally {
      lock.unlock();
    }
  }

  /**
   * Redoes up to {@code count} commands in one exclusive step.
   * Stops early when the redo stack runs empty. If one redo fails, the ones before it stay
   * redone and the failure propagates.
   *
   * @param count the number of commands to redo (must be >= 1)
   * @return the redone commands, in redo order
   * @throws NothingToRedoException if the redo stack is empty to begin with
   */
  public List<Command> redoMany(int count) {
    return redoMany(count, redone -> redone);
  }

  /**
   * Redoes up to {@code count} commands and reports the outcome under the same lock.
   *
   * @param count the number of commands to redo (must be >= 1)
   * @param reporter builds the result from the redone commands, in redo order
   * @param <R> the result type
   * @return the reporter's result
   * @throws NothingToRedoException if the redo stack is empty to begin with
   * @throws HistoryDiscardedException if this history was retired
   */
  public <R> R redoMany(int count, Function<? super List<Command>, ? extends R> reporter) {
    requirePositive(count);
    lock.lock();
    try {
      requireActive();
      List<Command> redone = new ArrayList<>();
      redone.add(redoOne());
      while (redone.size() < count && !redoStack.isEmpty()) {
        redone.add(redoOne());
      }
      return reporter.apply(redone);
    } finally {
      lock.unlock();
    }
  }

  /**
   * Drops both stacks.
   */
  public void clear() {
    lock.lock();
    try {
      logger.debug("Clearing history for {} (undo={}, redo={})",
          aggregateId, undoStack.size(), redoStack.size());
      undoStack.clear();
      redoStack.clear();
    } finally {
      lock.unlock();
    }
  }

  /**
   * Retires this history once the operation in flight, if any, has finished.
   * The cleanup runs first, under the history lock; if it throws, the history stays active
   * and keeps its stacks.
   *
   * @param cleanup work that must complete before the history is retired
   */
  public void retire(Runnable cleanup) {
    Objects.requireNonNull(cleanup, "Cleanup cannot be null");
    lock.lock();
    try {
      cleanup.run();
      undoStack.clear();
      redoStack.clear();
      retired = true;
      logger.debug("Retired history for {}", aggregateId);
    } finally {
      lock.unlock();
    }
  }

  /**
   * Whether this history was retired and no longer accepts operations.
   *
   * @return true once {@link #retire(Runnable)} completed
   */
  public boolean isRetired() {
    lock.lock();
    try {
      return retired;
    } finally {
      lock.unlock();
    }
  }

  public boolean canUndo() {
    return undoCount() > 0;
  }

  public boolean canRedo() {
    return redoCount() > 0;
  }

  /**
   * Gets the number of undoable commands.
   *
   * @return the undo stack size
   */
  public int undoCount() {
    lock.lock();
    try {
      return undoStack.size();
    } finally {
      lock.unlock();
    }
  }

  /**
   * Gets the number of redoable commands.
   *
   * @return the redo stack size
   */
  public int redoCount() {
    lock.lock();
    try {
      return redoStack.size();
    } finally {
      lock.unlock();
    }
  }

  /**
   * Lists the history as a timeline: undoable commands oldest first, followed by redoable
   * commands in the order they would be redone.
   *
   * @return the entries
   */
  public List<HistoryEntry> entries() {
    lock.lock();
    try {
      List<HistoryEntry> entries = new ArrayList<>(undoStack.size() + redoStack.size());
      int index = 0;
      int top = undoStack.size() - 1;
      for (Command command : undoStack) {
        entries.add(new HistoryEntry(index, command.toRecord(), true, index == top));
        index++;
      }
      Iterator<Command> redoOrder = redoStack.descendingIterator();
      while (redoOrder.hasNext()) {
        entries.add(new HistoryEntry(index++, redoOrder.next().toRecord(), false, false));
      }
      return entries;
    } finally {
      lock.unlock();
    }
  }

  public String getAggregateId() {
    return aggregateId;
  }

  public int getMaxDepth() {
    return maxDepth;
  }

  private void requireActive() {
    if (retired) {
      throw new HistoryDiscardedException(aggregateId);
    }
  }

  private Command undoOne() {
    Command command = undoStack.peekLast();
    if (command == null) {
      throw new NothingToUndoException(aggregateId);
    }
    try {
      command.undo();
    } catch (RuntimeException e) {
      logger.warn("Undo of {} {} failed for {}: {}",
          command.commandType(), command.id(), aggregateId, e.getMessage());
      throw e;
    }
    undoStack.removeLast();
    redoStack.addLast(command);
    logger.debug("Undid {} {} for {} (undo={}, redo={})",
        command.commandType(), command.id(), aggregateId, undoStack.size(), redoStack.size());
    return command;
  }

  private Command redoOne() {
    Command command = redoStack.peekLast();
    if (command == null) {
      throw new NothingToRedoException(aggregateId);
    }
    try {
      command.execute();
    } catch (RuntimeException e) {
      logger.warn("Redo of {} {} failed for {}: {}",
          command.commandType(), command.id(), aggregateId, e.getMessage());
      throw e;
    }
    redoStack.removeLast();
    undoStack.addLast(command);
    evictOverflow();
    logger.debug("Redid {} {} for {} (undo={}, redo={})",
        command.commandType(), command.id(), aggregateId, undoStack.size(), redoStack.size());
    return command;
  }

  private void evictOverflow() {
    while (undoStack.size() > maxDepth) {
      Command evicted = undoStack.removeFirst();
      logger.debug("Evicted oldest command {} {} from history of {}",
          evicted.commandType(), evicted.id(), aggregateId);
    }
  }

  private static void requirePositive(int count) {
    if (count < 1) {
      throw new IllegalArgumentException("Count must be >= 1 (got: " + count + ")");
    }
  }
}
