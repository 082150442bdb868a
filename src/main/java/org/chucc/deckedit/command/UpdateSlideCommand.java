package org.chucc.deckedit.command;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import org.chucc.deckedit.domain.Slide;
import org.chucc.deckedit.domain.SlideChanges;
import org.chucc.deckedit.repository.SlideStore;

/**
 * Updates editable fields of a slide. Undo reapplies the snapshot taken before the update,
 * version included.
 */
public class UpdateSlideCommand extends SlideCommand {

  public static final String TYPE = "UpdateSlideCommand";

  private final String slideId;
  private final SlideChanges changes;
  private SlideChanges previousState;
  private Integer previousVersion;

  /**
   * Creates a new UpdateSlideCommand.
   *
   * @param slideId the slide to update
   * @param changes the changes to apply
   * @param slideStore the slide store
   */
  public UpdateSlideCommand(String slideId, SlideChanges changes, SlideStore slideStore) {
    super(slideStore);
    this.slideId = Objects.requireNonNull(slideId, "Slide id cannot be null");
    this.changes = Objects.requireNonNull(changes, "Changes cannot be null");
  }

  /**
   * Rebuilds an UpdateSlideCommand from its record.
   *
   * @param commandRecord the record
   * @param slideStore the slide store
   */
  public UpdateSlideCommand(CommandRecord commandRecord, SlideStore slideStore) {
    super(commandRecord, slideStore);
    Map<String, Object> payload = commandRecord.payload();
    this.slideId = requireString(payload, "slide_id");
    Map<String, Object> rawChanges = optionalMap(payload, "changes");
    if (rawChanges == null) {
      throw new IllegalArgumentException("Payload field 'changes' is required");
    }
    this.changes = SlideChanges.of(rawChanges);
    Map<String, Object> rawPrevious = optionalMap(payload, "previous_state");
    this.previousState = rawPrevious != null ? SlideChanges.of(rawPrevious) : null;
    this.previousVersion = optionalInt(payload, "previous_version");
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
    Slide slide = loadSlide(slideId);
    SlideChanges captured = SlideChanges.snapshotOf(slide);
    int capturedVersion = slide.getVersion();

    changes.applyTo(slide);
    slideStore.update(slide);

    previousState = captured;
    previousVersion = capturedVersion;
  }

  @Override
  protected void doUndo() {
    if (previousState == null) {
      throw new IllegalStateException("No previous state captured for slide " + slideId);
    }
    Slide slide = loadSlide(slideId);
    previousState.restoreOnto(slide);
    if (previousVersion != null) {
      slide.setVersion(previousVersion);
    }
    slideStore.update(slide);
  }

  @Override
  protected Map<String, Object> payload() {
    Map<String, Object> payload = new LinkedHashMap<>();
    payload.put("slide_id", slideId);
    payload.put("changes", new LinkedHashMap<>(changes.asMap()));
    payload.put("previous_state",
        previousState != null ? new LinkedHashMap<>(previousState.asMap()) : null);
    payload.put("previous_version", previousVersion);
    return payload;
  }
}
