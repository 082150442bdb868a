package org.chucc.deckedit.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration properties for undo/redo histories.
 *
 * <p>Configuration prefix: {@code deckedit.history}
 *
 * <p>Example configuration in {@code application.yml}:
 * <pre>
 * deckedit:
 *   history:
 *     max-depth: 50
 *     idle-expiry: 12h
 *     record-stats: true
 * </pre>
 */
@Configuration
@ConfigurationProperties(prefix = "deckedit.history")
public class HistoryProperties {

  private int maxDepth = 50;
  private Duration idleExpiry;
  private boolean recordStats = true;

  /**
   * Get the maximum number of undoable commands kept per presentation.
   *
   * <p>Applies to histories created after the value is set; existing histories keep the bound
   * they were created with.
   *
   * @return maximum depth (default: 50)
   */
  public int getMaxDepth() {
    return maxDepth;
  }

  /**
   * Set the maximum number of undoable commands kept per presentation.
   *
   * @param maxDepth maximum depth (must be >= 1)
   * @throws IllegalArgumentException if maxDepth &lt; 1
   */
  public void setMaxDepth(int maxDepth) {
    final int minMaxDepth = 1;
    if (maxDepth < minMaxDepth) {
      throw new IllegalArgumentException(
          "maxDepth must be >= " + minMaxDepth + " (got: " + maxDepth + ")");
    }
    this.maxDepth = maxDepth;
  }

  /**
   * Get how long a history may stay untouched before it is dropped.
   *
   * <p>Null (the default) means histories are only dropped explicitly, when their presentation
   * is discarded.
   *
   * @return idle expiry, or null for none
   */
  public Duration getIdleExpiry() {
    return idleExpiry;
  }

  /**
   * Set how long a history may stay untouched before it is dropped.
   *
   * @param idleExpiry idle expiry (must be positive), or null for none
   * @throws IllegalArgumentException if idleExpiry is zero or negative
   */
  public void setIdleExpiry(Duration idleExpiry) {
    if (idleExpiry != null && (idleExpiry.isZero() || idleExpiry.isNegative())) {
      throw new IllegalArgumentException("idleExpiry must be positive (got: " + idleExpiry + ")");
    }
    this.idleExpiry = idleExpiry;
  }

  /**
   * Check if directory cache statistics are recorded.
   *
   * @return true if enabled (default: true)
   */
  public boolean isRecordStats() {
    return recordStats;
  }

  public void setRecordStats(boolean recordStats) {
    this.recordStats = recordStats;
  }
}
