package org.chucc.deckedit.config;

import static org.assertj.core.api.Assertions.assertThat;

import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for MetricsConfiguration.
 */
class MetricsConfigurationTest {

  private SimpleMeterRegistry registry;

  @BeforeEach
  void setUp() {
    registry = new SimpleMeterRegistry();
    registry.config().meterFilter(new MetricsConfiguration().editLatencyPercentiles());
  }

  @Test
  void editTimers_shouldPublishPercentiles() {
    Timer timer = registry.timer("deckedit.history", "operation", "undo");
    timer.record(Duration.ofMillis(5));

    assertThat(timer.takeSnapshot().percentileValues()).hasSize(3);
  }

  @Test
  void otherTimers_shouldBeLeftAlone() {
    Timer timer = registry.timer("http.server.requests");
    timer.record(Duration.ofMillis(5));

    assertThat(timer.takeSnapshot().percentileValues()).isEmpty();
  }
}
