package org.chucc.deckedit.command;

/**
 * One command in a history, as shown in a history listing.
 *
 * @param index position in the timeline, oldest first
 * @param command the command record
 * @param undoable true if the command is on the undo stack, false if it is on the redo stack
 * @param current true for the most recent undoable command
 */
public record HistoryEntry(
    int index,
    CommandRecord command,
    boolean undoable,
    boolean current) {
}
