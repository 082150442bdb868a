package org.chucc.deckedit.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import org.chucc.deckedit.command.HistoryEntry;

/**
 * Response DTO listing the commands in a presentation's history.
 */
public record HistoryResponse(
    @JsonProperty("presentation_id") String presentationId,
    @JsonProperty("entries") List<HistoryEntry> entries) {

  /**
   * Creates a new HistoryResponse with a defensive copy of the entries.
   */
  public HistoryResponse {
    entries = entries != null ? List.copyOf(entries) : List.of();
  }
}
