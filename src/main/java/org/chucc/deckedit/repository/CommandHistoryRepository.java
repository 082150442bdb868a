package org.chucc.deckedit.repository;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.RemovalCause;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.cache.CaffeineCacheMetrics;
import jakarta.annotation.PostConstruct;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import org.chucc.deckedit.command.CommandHistory;
import org.chucc.deckedit.config.HistoryProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;

/**
 * Directory of undo/redo histories, one per presentation, created lazily.
 *
 * <p>Backed by a Caffeine cache. {@link #getOrCreate(String, int)} is atomic per key, so
 * concurrent first access to a presentation yields exactly one history (first writer wins).
 * A history that leaves the directory is retired, so an operation that looked it up earlier
 * fails instead of landing in a history nobody can reach again.
 *
 * <p>Memory Management:
 * <ul>
 * <li>Without {@code deckedit.history.idle-expiry} a history lives until
 * {@link #remove(String)} is called for its presentation</li>
 * <li>With an idle expiry, histories not accessed for that long are dropped and retired</li>
 * </ul>
 */
@Repository
public class CommandHistoryRepository {

  private static final Logger logger = LoggerFactory.getLogger(CommandHistoryRepository.class);

  // Key: presentation id → Value: its history
  private final Cache<String, CommandHistory> histories;

  private final MeterRegistry meterRegistry;
  private final HistoryProperties properties;

  /**
   * Constructs the directory.
   *
   * @param meterRegistry the meter registry for metrics
   * @param properties the history configuration properties
   */
  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "All dependencies are Spring-managed beans and are intentionally shared")
  public CommandHistoryRepository(MeterRegistry meterRegistry, HistoryProperties properties) {
    this.meterRegistry = meterRegistry;
    this.properties = properties;

    Caffeine<String, CommandHistory> cacheBuilder = Caffeine.newBuilder()
        .evictionListener(this::onEviction);

    if (properties.getIdleExpiry() != null) {
      cacheBuilder.expireAfterAccess(properties.getIdleExpiry());
    }
    if (properties.isRecordStats()) {
      cacheBuilder.recordStats();
    }

    this.histories = cacheBuilder.build();

    logger.info("Initialized CommandHistoryRepository with max-depth={}, idle-expiry={}",
        properties.getMaxDepth(),
        properties.getIdleExpiry() != null ? properties.getIdleExpiry() : "none");
  }

  /**
   * Registers directory metrics after construction.
   */
  @PostConstruct
  public void initializeMetrics() {
    CaffeineCacheMetrics.monitor(meterRegistry, histories, "command_histories");

    Gauge.builder("deckedit.history.active", this, CommandHistoryRepository::size)
        .description("Number of presentations with an undo/redo history")
        .register(meterRegistry);
  }

  /**
   * Eviction listener, called by Caffeine when an idle history expires.
   *
   * @param presentationId the presentation id
   * @param history the evicted history
   * @param cause eviction reason
   */
  private void onEviction(String presentationId, CommandHistory history, RemovalCause cause) {
    logger.info("Evicted idle history of presentation {} (reason: {})", presentationId, cause);
    if (history != null) {
      history.retire(() -> { });
    }
  }

  /**
   * Gets the history of a presentation, creating it with the configured depth if needed.
   *
   * @param presentationId the presentation id
   * @return the history, never null
   */
  public CommandHistory getOrCreate(String presentationId) {
    return getOrCreate(presentationId, properties.getMaxDepth());
  }

  /**
   * Gets the history of a presentation, creating it with the given depth if needed.
   * An existing history keeps the depth it was created with.
   *
   * @param presentationId the presentation id
   * @param maxDepth the depth for a newly created history (must be >= 1)
   * @return the history, never null
   */
  public CommandHistory getOrCreate(String presentationId, int maxDepth) {
    Objects.requireNonNull(presentationId, "Presentation id cannot be null");
    return histories.get(presentationId, id -> {
      logger.info("Creating history for presentation {} with max-depth={}", id, maxDepth);
      return new CommandHistory(id, maxDepth);
    });
  }

  /**
   * Finds the history of a presentation without creating one.
   *
   * @param presentationId the presentation id
   * @return the history, or empty if none exists
   */
  public Optional<CommandHistory> find(String presentationId) {
    return Optional.ofNullable(histories.getIfPresent(presentationId));
  }

  /**
   * Discards the history of a presentation entirely and retires it.
   *
   * @param presentationId the presentation id
   * @return true if a history existed
   */
  public boolean remove(String presentationId) {
    return remove(presentationId, () -> { });
  }

  /**
   * Discards the history of a presentation and runs a cleanup step in the same atomic step.
   *
   * <p>The cleanup runs after an in-flight operation on the old history has finished and
   * before {@link #getOrCreate(String)} can hand out a new history for the presentation.
   * It runs even when no history exists. If it throws, the history stays in place.
   *
   * @param presentationId the presentation id
   * @param cleanup work tied to the discard, such as deleting the presentation's slides
   * @return true if a history existed
   */
  public boolean remove(String presentationId, Runnable cleanup) {
    Objects.requireNonNull(presentationId, "Presentation id cannot be null");
    Objects.requireNonNull(cleanup, "Cleanup cannot be null");
    AtomicBoolean existed = new AtomicBoolean();
    histories.asMap().compute(presentationId, (id, history) -> {
      if (history == null) {
        cleanup.run();
      } else {
        history.retire(cleanup);
        existed.set(true);
      }
      return null;
    });
    if (existed.get()) {
      logger.info("Discarded history of presentation {}", presentationId);
    }
    return existed.get();
  }

  /**
   * Gets the number of live histories.
   *
   * @return the count
   */
  public long size() {
    return histories.estimatedSize();
  }
}
