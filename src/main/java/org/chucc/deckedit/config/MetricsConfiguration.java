package org.chucc.deckedit.config;

import io.micrometer.core.aop.CountedAspect;
import io.micrometer.core.aop.TimedAspect;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.config.MeterFilter;
import io.micrometer.core.instrument.distribution.DistributionStatisticConfig;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.EnableAspectJAutoProxy;

/**
 * Metrics for slide edits and undo/redo.
 *
 * <p>Enables {@code @Timed} and {@code @Counted} on the edit service, and publishes
 * p50/p95/p99 for the {@code deckedit.edit} and {@code deckedit.history} timers, which cover
 * the store round-trip done while a presentation's history is locked.
 */
@Configuration
@EnableAspectJAutoProxy
public class MetricsConfiguration {

  static final String EDIT_TIMER_PREFIX = "deckedit.";

  /**
   * Aspect for {@code @Timed} on edit, undo and redo.
   *
   * @param registry the meter registry
   * @return the timed aspect
   */
  @Bean
  public TimedAspect timedAspect(MeterRegistry registry) {
    return new TimedAspect(registry);
  }

  /**
   * Aspect for {@code @Counted} undo/redo requests.
   *
   * @param registry the meter registry
   * @return the counted aspect
   */
  @Bean
  public CountedAspect countedAspect(MeterRegistry registry) {
    return new CountedAspect(registry);
  }

  /**
   * Publishes percentiles for edit and history timers.
   *
   * @return the meter filter
   */
  @Bean
  public MeterFilter editLatencyPercentiles() {
    return new MeterFilter() {
      @Override
      public DistributionStatisticConfig configure(Meter.Id id,
          DistributionStatisticConfig config) {
        if (id.getType() == Meter.Type.TIMER && id.getName().startsWith(EDIT_TIMER_PREFIX)) {
          return DistributionStatisticConfig.builder()
              .percentiles(0.5, 0.95, 0.99)
              .build()
              .merge(config);
        }
        return config;
      }
    };
  }
}
