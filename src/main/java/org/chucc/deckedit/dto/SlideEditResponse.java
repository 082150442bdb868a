package org.chucc.deckedit.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Response DTO for an edit, undo or redo.
 *
 * @param slideId the slide the command targeted
 * @param commandType the type of the executed, undone or redone command
 * @param description human-readable summary of what happened
 * @param state the slide after the operation, null if it no longer exists
 * @param canUndo whether the presentation has anything left to undo
 * @param canRedo whether the presentation has anything to redo
 */
public record SlideEditResponse(
    @JsonProperty("slide_id") String slideId,
    @JsonProperty("command_type") String commandType,
    @JsonProperty("description") String description,
    @JsonProperty("state") SlideResponse state,
    @JsonProperty("can_undo") boolean canUndo,
    @JsonProperty("can_redo") boolean canRedo) {
}
