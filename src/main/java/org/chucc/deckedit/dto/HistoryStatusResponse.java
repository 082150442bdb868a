package org.chucc.deckedit.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Response DTO with the undo/redo availability of a presentation.
 */
public record HistoryStatusResponse(
    @JsonProperty("can_undo") boolean canUndo,
    @JsonProperty("can_redo") boolean canRedo,
    @JsonProperty("undo_count") int undoCount,
    @JsonProperty("redo_count") int redoCount,
    @JsonProperty("max_depth") int maxDepth) {
}
