package org.chucc.deckedit.service;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.annotation.Counted;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;
import org.chucc.deckedit.command.Command;
import org.chucc.deckedit.command.CommandHistory;
import org.chucc.deckedit.command.CreateSlideCommand;
import org.chucc.deckedit.command.DeleteSlideCommand;
import org.chucc.deckedit.command.MoveSlideCommand;
import org.chucc.deckedit.command.UpdateSlideCommand;
import org.chucc.deckedit.config.HistoryProperties;
import org.chucc.deckedit.domain.Slide;
import org.chucc.deckedit.domain.SlideChanges;
import org.chucc.deckedit.domain.SlideLayoutType;
import org.chucc.deckedit.dto.HistoryResponse;
import org.chucc.deckedit.dto.HistoryStatusResponse;
import org.chucc.deckedit.dto.SlideEditResponse;
import org.chucc.deckedit.dto.SlideResponse;
import org.chucc.deckedit.exception.EditException;
import org.chucc.deckedit.exception.HistoryDiscardedException;
import org.chucc.deckedit.exception.NothingToRedoException;
import org.chucc.deckedit.exception.NothingToUndoException;
import org.chucc.deckedit.exception.SlideNotFoundException;
import org.chucc.deckedit.repository.CommandHistoryRepository;
import org.chucc.deckedit.repository.SlideStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Service for slide edits with undo/redo.
 *
 * <p>Every edit is turned into a command and executed through the history of the slide's
 * presentation. Undo and redo replay the history against the slide store. Each response is
 * read while the history is still locked, so it reflects exactly the operation that produced
 * it. An operation that meets a history discarded in the meantime re-resolves the
 * presentation's current history. Authorization of the acting author is done before this
 * service is called.
 */
@Service
public class SlideEditService {

  private static final Logger logger = LoggerFactory.getLogger(SlideEditService.class);
  private static final Logger auditLogger = LoggerFactory.getLogger("org.chucc.deckedit.audit");

  private static final String OPERATIONS_METRIC = "deckedit.history.operations";

  private final SlideStore slideStore;
  private final CommandHistoryRepository historyRepository;
  private final CommandRecordCodec recordCodec;
  private final HistoryProperties historyProperties;
  private final MeterRegistry meterRegistry;

  /**
   * Constructor for SlideEditService.
   *
   * @param slideStore the slide store
   * @param historyRepository the history directory
   * @param recordCodec the command record codec for audit logging
   * @param historyProperties the history configuration
   * @param meterRegistry the meter registry
   */
  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "Spring-managed beans are intentionally shared references"
  )
  public SlideEditService(
      SlideStore slideStore,
      CommandHistoryRepository historyRepository,
      CommandRecordCodec recordCodec,
      HistoryProperties historyProperties,
      MeterRegistry meterRegistry) {
    this.slideStore = slideStore;
    this.historyRepository = historyRepository;
    this.recordCodec = recordCodec;
    this.historyProperties = historyProperties;
    this.meterRegistry = meterRegistry;
  }

  /**
   * Adds a slide to a presentation.
   *
   * @param presentationId the presentation id
   * @param title the slide title
   * @param layoutType the layout wire value, null for the default layout
   * @param content the initial content, may be null
   * @param orderIndex the position, null to append
   * @param author the acting author
   * @return the created slide and undo/redo availability
   * @throws org.chucc.deckedit.exception.CommandExecutionException if the store rejects it
   */
  @Timed(value = "deckedit.edit", extraTags = {"operation", "create"},
      description = "Slide edit execution time")
  public SlideEditResponse createSlide(String presentationId, String title, String layoutType,
      Map<String, Object> content, Integer orderIndex, String author) {
    SlideLayoutType layout = layoutType != null ? SlideLayoutType.fromValue(layoutType) : null;
    Command command = new CreateSlideCommand(
        presentationId, title, layout, content, orderIndex, slideStore);
    return executeEdit(presentationId, command, author);
  }

  /**
   * Updates editable fields of a slide.
   *
   * @param presentationId the presentation id
   * @param slideId the slide id
   * @param changes field name to new value
   * @param author the acting author
   * @return the updated slide and undo/redo availability
   * @throws SlideNotFoundException if the slide is not part of the presentation
   */
  @Timed(value = "deckedit.edit", extraTags = {"operation", "update"},
      description = "Slide edit execution time")
  public SlideEditResponse updateSlide(String presentationId, String slideId,
      Map<String, Object> changes, String author) {
    requireSlideInPresentation(presentationId, slideId);
    Command command = new UpdateSlideCommand(slideId, SlideChanges.of(changes), slideStore);
    return executeEdit(presentationId, command, author);
  }

  /**
   * Deletes a slide.
   *
   * @param presentationId the presentation id
   * @param slideId the slide id
   * @param author the acting author
   * @return undo/redo availability; the state is null
   * @throws SlideNotFoundException if the slide is not part of the presentation
   */
  @Timed(value = "deckedit.edit", extraTags = {"operation", "delete"},
      description = "Slide edit execution time")
  public SlideEditResponse deleteSlide(String presentationId, String slideId, String author) {
    requireSlideInPresentation(presentationId, slideId);
    Command command = new DeleteSlideCommand(slideId, slideStore);
    return executeEdit(presentationId, command, author);
  }

  /**
   * Moves a slide to a new position.
   *
   * @param presentationId the presentation id
   * @param slideId the slide id
   * @param newOrder the target position
   * @param author the acting author
   * @return the moved slide and undo/redo availability
   * @throws SlideNotFoundException if the slide is not part of the presentation
   */
  @Timed(value = "deckedit.edit", extraTags = {"operation", "move"},
      description = "Slide edit execution time")
  public SlideEditResponse moveSlide(String presentationId, String slideId, int newOrder,
      String author) {
    requireSlideInPresentation(presentationId, slideId);
    Command command = new MoveSlideCommand(slideId, newOrder, slideStore);
    return executeEdit(presentationId, command, author);
  }

  /**
   * Undoes the most recent edit of a presentation.
   *
   * @param presentationId the presentation id
   * @param author the acting author
   * @return the restored slide and undo/redo availability
   * @throws NothingToUndoException if there is nothing to undo
   * @throws org.chucc.deckedit.exception.CommandUndoException if the slide changed out-of-band
   */
  public SlideEditResponse undo(String presentationId, String author) {
    return undo(presentationId, 1, author);
  }

  /**
   * Undoes up to {@code steps} edits of a presentation.
   *
   * @param presentationId the presentation id
   * @param steps the number of edits to undo (must be >= 1)
   * @param author the acting author
   * @return the state of the slide targeted by the last undone edit
   * @throws NothingToUndoException if there is nothing to undo
   */
  @Timed(value = "deckedit.history", extraTags = {"operation", "undo"},
      description = "Undo execution time")
  @Counted(value = "deckedit.undo.requests", description = "Undo requests")
  public SlideEditResponse undo(String presentationId, int steps, String author) {
    return track("undo", presentationId, () -> {
      while (true) {
        CommandHistory history = historyRepository.find(presentationId)
            .orElseThrow(() -> new NothingToUndoException(presentationId));
        try {
          return history.undoMany(steps,
              undone -> report("undo", presentationId, history, undone, "Undid", author));
        } catch (HistoryDiscardedException e) {
          logRetry("undo", presentationId);
        }
      }
    });
  }

  /**
   * Redoes the most recently undone edit of a presentation.
   *
   * @param presentationId the presentation id
   * @param author the acting author
   * @return the re-applied slide state and undo/redo availability
   * @throws NothingToRedoException if there is nothing to redo
   */
  public SlideEditResponse redo(String presentationId, String author) {
    return redo(presentationId, 1, author);
  }

  /**
   * Redoes up to {@code steps} undone edits of a presentation.
   *
   * @param presentationId the presentation id
   * @param steps the number of edits to redo (must be >= 1)
   * @param author the acting author
   * @return the state of the slide targeted by the last redone edit
   * @throws NothingToRedoException if there is nothing to redo
   */
  @Timed(value = "deckedit.history", extraTags = {"operation", "redo"},
      description = "Redo execution time")
  @Counted(value = "deckedit.redo.requests", description = "Redo requests")
  public SlideEditResponse redo(String presentationId, int steps, String author) {
    return track("redo", presentationId, () -> {
      while (true) {
        CommandHistory history = historyRepository.find(presentationId)
            .orElseThrow(() -> new NothingToRedoException(presentationId));
        try {
          return history.redoMany(steps,
              redone -> report("redo", presentationId, history, redone, "Redid", author));
        } catch (HistoryDiscardedException e) {
          logRetry("redo", presentationId);
        }
      }
    });
  }

  /**
   * Gets the undo/redo availability of a presentation.
   *
   * @param presentationId the presentation id
   * @return the status; a presentation without history reports empty stacks
   */
  public HistoryStatusResponse getStatus(String presentationId) {
    return historyRepository.find(presentationId)
        .map(history -> new HistoryStatusResponse(
            history.canUndo(),
            history.canRedo(),
            history.undoCount(),
            history.redoCount(),
            history.getMaxDepth()))
        .orElseGet(() -> new HistoryStatusResponse(
            false, false, 0, 0, historyProperties.getMaxDepth()));
  }

  /**
   * Lists the commands in a presentation's history.
   *
   * @param presentationId the presentation id
   * @return the history, empty if none exists
   */
  public HistoryResponse getHistory(String presentationId) {
    return new HistoryResponse(presentationId,
        historyRepository.find(presentationId)
            .map(CommandHistory::entries)
            .orElse(List.of()));
  }

  /**
   * Clears the undo and redo stacks of a presentation. Slides are not touched.
   *
   * @param presentationId the presentation id
   */
  public void clearHistory(String presentationId) {
    historyRepository.find(presentationId).ifPresent(history -> {
      history.clear();
      logger.info("Cleared history of presentation {}", presentationId);
    });
  }

  /**
   * Deletes all slides of a presentation and discards its history.
   * An edit in flight on the presentation completes before the slides are deleted; an edit
   * that starts later lands in a new history.
   *
   * @param presentationId the presentation id
   * @return the number of deleted slides
   */
  public int discardPresentation(String presentationId) {
    AtomicInteger deleted = new AtomicInteger();
    historyRepository.remove(presentationId,
        () -> deleted.set(slideStore.deleteAllByPresentation(presentationId)));
    logger.info("Discarded presentation {} ({} slides)", presentationId, deleted.get());
    return deleted.get();
  }

  private SlideEditResponse executeEdit(String presentationId, Command command, String author) {
    logger.debug("{} requested {} on slide {} of presentation {}",
        author, command.commandType(), command.targetId(), presentationId);
    return track("execute", presentationId, () -> {
      while (true) {
        CommandHistory history = historyRepository.getOrCreate(presentationId);
        try {
          return history.execute(command, executed -> report(
              "execute", presentationId, history, List.of(executed), "Executed", author));
        } catch (HistoryDiscardedException e) {
          logRetry("execute", presentationId);
        }
      }
    });
  }

  private void requireSlideInPresentation(String presentationId, String slideId) {
    Slide slide = slideStore.findById(slideId)
        .orElseThrow(() -> new SlideNotFoundException(slideId));
    if (!slide.getPresentationId().equals(presentationId)) {
      throw new SlideNotFoundException(slideId);
    }
  }

  // Runs under the history lock
  private SlideEditResponse report(String action, String presentationId,
      CommandHistory history, List<Command> commands, String verb, String author) {
    commands.forEach(command -> audit(action, presentationId, command, author));
    return respond(history, commands.get(commands.size() - 1), verb);
  }

  private SlideEditResponse respond(CommandHistory history, Command command, String verb) {
    SlideResponse state = slideStore.findById(command.targetId())
        .map(SlideResponse::from)
        .orElse(null);
    return new SlideEditResponse(
        command.targetId(),
        command.commandType(),
        verb + " " + command.commandType(),
        state,
        history.canUndo(),
        history.canRedo());
  }

  private <T> T track(String operation, String presentationId,
      Supplier<T> action) {
    try {
      T result = action.get();
      count(operation, "success");
      return result;
    } catch (NothingToUndoException | NothingToRedoException e) {
      count(operation, "nothing");
      logger.debug("{} on presentation {}: {}", operation, presentationId, e.getMessage());
      throw e;
    } catch (EditException e) {
      count(operation, "failure");
      throw e;
    }
  }

  private void logRetry(String operation, String presentationId) {
    logger.debug("History of presentation {} was discarded during {}, retrying",
        presentationId, operation);
  }

  private void count(String operation, String outcome) {
    meterRegistry.counter(OPERATIONS_METRIC, "operation", operation, "outcome", outcome)
        .increment();
  }

  private void audit(String action, String presentationId, Command command, String author) {
    if (auditLogger.isDebugEnabled()) {
      auditLogger.debug("{} presentation={} author={} command={}",
          action, presentationId, author, recordCodec.toJson(command));
    }
  }
}
