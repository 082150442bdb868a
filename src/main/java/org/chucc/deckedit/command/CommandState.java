package org.chucc.deckedit.command;

/**
 * Lifecycle state of a {@link Command}.
 */
public enum CommandState {
  PENDING,
  EXECUTED,
  UNDONE
}
