package org.chucc.deckedit.command;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import org.chucc.deckedit.domain.Slide;
import org.chucc.deckedit.exception.SlideNotFoundException;
import org.chucc.deckedit.repository.SlideStore;

/**
 * Deletes a slide. Undo recreates it with the same id, content, position and version.
 */
public class DeleteSlideCommand extends SlideCommand {

  public static final String TYPE = "DeleteSlideCommand";

  private final String slideId;
  private Slide deletedSlide;

  /**
   * Creates a new DeleteSlideCommand.
   *
   * @param slideId the slide to delete
   * @param slideStore the slide store
   */
  public DeleteSlideCommand(String slideId, SlideStore slideStore) {
    super(slideStore);
    this.slideId = Objects.requireNonNull(slideId, "Slide id cannot be null");
  }

  /**
   * Rebuilds a DeleteSlideCommand from its record.
   *
   * @param commandRecord the record
   * @param slideStore the slide store
   */
  public DeleteSlideCommand(CommandRecord commandRecord, SlideStore slideStore) {
    super(commandRecord, slideStore);
    Map<String, Object> payload = commandRecord.payload();
    this.slideId = requireString(payload, "slide_id");
    Map<String, Object> deleted = optionalMap(payload, "deleted_slide");
    this.deletedSlide = deleted != null ? slideFromPayload(deleted) : null;
  }

  @Override
  public String commandType() {
    return TYPE;
  }

  @Override
  public String targetId() {
    return slideId;
  }

  @Override
  protected void doExecute() {
    Slide captured = loadSlide(slideId);
    if (!slideStore.delete(slideId)) {
      throw new SlideNotFoundException(slideId);
    }
    deletedSlide = captured;
  }

  @Override
  protected void doUndo() {
    if (deletedSlide == null) {
      throw new IllegalStateException("No deleted slide captured for " + slideId);
    }
    slideStore.create(deletedSlide.copy());
  }

  @Override
  protected Map<String, Object> payload() {
    Map<String, Object> payload = new LinkedHashMap<>();
    payload.put("slide_id", slideId);
    payload.put("deleted_slide", deletedSlide != null ? slideToPayload(deletedSlide) : null);
    return payload;
  }
}
