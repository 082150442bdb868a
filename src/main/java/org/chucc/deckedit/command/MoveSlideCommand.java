package org.chucc.deckedit.command;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.chucc.deckedit.domain.Slide;
import org.chucc.deckedit.repository.SlideStore;

/**
 * Moves a slide to a new position and renumbers the presentation's slides 0..n-1.
 * Undo puts every slide back at the order index it had before the move.
 */
public class MoveSlideCommand extends SlideCommand {

  public static final String TYPE = "MoveSlideCommand";

  private final String slideId;
  private final int newOrder;
  private String presentationId;
  private Map<String, Integer> previousOrders;

  /**
   * Creates a new MoveSlideCommand.
   *
   * @param slideId the slide to move
   * @param newOrder the target position (0-based, must be >= 0)
   * @param slideStore the slide store
   */
  public MoveSlideCommand(String slideId, int newOrder, SlideStore slideStore) {
    super(slideStore);
    this.slideId = Objects.requireNonNull(slideId, "Slide id cannot be null");
    if (newOrder < 0) {
      throw new IllegalArgumentException("New order must be >= 0 (got: " + newOrder + ")");
    }
    this.newOrder = newOrder;
  }

  /**
   * Rebuilds a MoveSlideCommand from its record.
   *
   * @param commandRecord the record
   * @param slideStore the slide store
   */
  public MoveSlideCommand(CommandRecord commandRecord, SlideStore slideStore) {
    super(commandRecord, slideStore);
    Map<String, Object> payload = commandRecord.payload();
    this.slideId = requireString(payload, "slide_id");
    Integer order = optionalInt(payload, "new_order");
    if (order == null || order < 0) {
      throw new IllegalArgumentException("Payload field 'new_order' must be >= 0");
    }
    this.newOrder = order;
    this.presentationId = optionalString(payload, "presentation_id");
    Map<String, Object> rawOrders = optionalMap(payload, "previous_orders");
    if (rawOrders != null) {
      Map<String, Integer> orders = new LinkedHashMap<>();
      rawOrders.forEach((id, value) -> orders.put(id, optionalInt(rawOrders, id)));
      this.previousOrders = orders;
    }
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
    Slide moving = loadSlide(slideId);
    List<Slide> slides = slideStore.findAllByPresentation(moving.getPresentationId());
    if (newOrder >= slides.size()) {
      throw new IllegalArgumentException("New order " + newOrder
          + " is out of range for a presentation with " + slides.size() + " slides");
    }

    Map<String, Integer> captured = new LinkedHashMap<>();
    List<String> ids = new ArrayList<>();
    for (Slide slide : slides) {
      captured.put(slide.getId(), slide.getOrderIndex());
      if (!slide.getId().equals(slideId)) {
        ids.add(slide.getId());
      }
    }
    ids.add(newOrder, slideId);

    Map<String, Integer> reordered = new LinkedHashMap<>();
    for (int i = 0; i < ids.size(); i++) {
      reordered.put(ids.get(i), i);
    }
    slideStore.reorder(moving.getPresentationId(), reordered);

    presentationId = moving.getPresentationId();
    previousOrders = captured;
  }

  @Override
  protected void doUndo() {
    if (previousOrders == null || presentationId == null) {
      throw new IllegalStateException("No previous order captured for slide " + slideId);
    }
    slideStore.reorder(presentationId, previousOrders);
  }

  @Override
  protected Map<String, Object> payload() {
    Map<String, Object> payload = new LinkedHashMap<>();
    payload.put("slide_id", slideId);
    payload.put("new_order", newOrder);
    payload.put("presentation_id", presentationId);
    payload.put("previous_orders",
        previousOrders != null ? new LinkedHashMap<>(previousOrders) : null);
    return payload;
  }
}
