package org.chucc.deckedit.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for HistoryProperties.
 */
class HistoryPropertiesTest {

  @Test
  void defaults_shouldMatchDocumentedValues() {
    HistoryProperties properties = new HistoryProperties();

    assertEquals(50, properties.getMaxDepth());
    assertNull(properties.getIdleExpiry());
    assertTrue(properties.isRecordStats());
  }

  @Test
  void setMaxDepth_whenBelowOne_shouldThrow() {
    HistoryProperties properties = new HistoryProperties();

    assertThrows(IllegalArgumentException.class, () -> properties.setMaxDepth(0));
    properties.setMaxDepth(1);
    assertEquals(1, properties.getMaxDepth());
  }

  @Test
  void setIdleExpiry_whenNotPositive_shouldThrow() {
    HistoryProperties properties = new HistoryProperties();

    assertThrows(IllegalArgumentException.class, () -> properties.setIdleExpiry(Duration.ZERO));
    assertThrows(IllegalArgumentException.class,
        () -> properties.setIdleExpiry(Duration.ofMinutes(-1)));
    properties.setIdleExpiry(Duration.ofHours(2));
    assertEquals(Duration.ofHours(2), properties.getIdleExpiry());
  }
}
