package org.chucc.deckedit.command;

import com.github.f4b6a3.uuid.UuidCreator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import org.chucc.deckedit.domain.Slide;
import org.chucc.deckedit.domain.SlideLayoutType;
import org.chucc.deckedit.exception.SlideNotFoundException;
import org.chucc.deckedit.repository.SlideStore;

/**
 * Creates a slide. Undo deletes it; redo recreates it under the same id.
 */
public class CreateSlideCommand extends SlideCommand {

  public static final String TYPE = "CreateSlideCommand";

  private final String slideId;
  private final String presentationId;
  private final String title;
  private final SlideLayoutType layoutType;
  private final Map<String, Object> content;
  private final Integer requestedOrder;
  private Integer assignedOrder;

  /**
   * Creates a new CreateSlideCommand.
   *
   * @param presentationId the presentation to add the slide to
   * @param title the slide title (must be non-blank)
   * @param layoutType the layout, null for title_content
   * @param content the initial content, may be null
   * @param orderIndex the position, null to append after the last slide
   * @param slideStore the slide store
   */
  public CreateSlideCommand(String presentationId, String title, SlideLayoutType layoutType,
      Map<String, Object> content, Integer orderIndex, SlideStore slideStore) {
    super(slideStore);
    Objects.requireNonNull(presentationId, "Presentation id cannot be null");
    Objects.requireNonNull(title, "Title cannot be null");
    if (title.isBlank()) {
      throw new IllegalArgumentException("Title cannot be blank");
    }
    if (orderIndex != null && orderIndex < 0) {
      throw new IllegalArgumentException("Order index must be >= 0 (got: " + orderIndex + ")");
    }
    this.slideId = UuidCreator.getTimeOrderedEpoch().toString();
    this.presentationId = presentationId;
    this.title = title;
    this.layoutType = layoutType != null ? layoutType : SlideLayoutType.TITLE_CONTENT;
    this.content = content != null ? new LinkedHashMap<>(content) : new LinkedHashMap<>();
    this.requestedOrder = orderIndex;
  }

  /**
   * Rebuilds a CreateSlideCommand from its record.
   *
   * @param commandRecord the record
   * @param slideStore the slide store
   */
  public CreateSlideCommand(CommandRecord commandRecord, SlideStore slideStore) {
    super(commandRecord, slideStore);
    Map<String, Object> payload = commandRecord.payload();
    this.slideId = requireString(payload, "slide_id");
    this.presentationId = requireString(payload, "presentation_id");
    this.title = requireString(payload, "title");
    this.layoutType = SlideLayoutType.fromValue(requireString(payload, "layout_type"));
    Map<String, Object> restoredContent = optionalMap(payload, "content");
    this.content = restoredContent != null ? restoredContent : new LinkedHashMap<>();
    this.requestedOrder = optionalInt(payload, "order_index");
    this.assignedOrder = optionalInt(payload, "assigned_order");
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
    int order = requestedOrder != null
        ? requestedOrder
        : slideStore.findMaxOrder(presentationId) + 1;
    slideStore.create(new Slide(slideId, presentationId, title, layoutType, content, order));
    assignedOrder = order;
  }

  @Override
  protected void doUndo() {
    if (!slideStore.delete(slideId)) {
      throw new SlideNotFoundException(slideId);
    }
  }

  @Override
  protected Map<String, Object> payload() {
    Map<String, Object> payload = new LinkedHashMap<>();
    payload.put("slide_id", slideId);
    payload.put("presentation_id", presentationId);
    payload.put("title", title);
    payload.put("layout_type", layoutType.getValue());
    payload.put("content", new LinkedHashMap<>(content));
    payload.put("order_index", requestedOrder);
    payload.put("assigned_order", assignedOrder);
    return payload;
  }
}
