package org.chucc.deckedit.command;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import org.chucc.deckedit.domain.Slide;
import org.chucc.deckedit.domain.SlideChanges;
import org.chucc.deckedit.domain.SlideLayoutType;
import org.chucc.deckedit.exception.SlideNotFoundException;
import org.chucc.deckedit.repository.SlideStore;

/**
 * Base class for commands that target a single slide.
 */
public abstract class SlideCommand extends AbstractCommand {

  public static final String TARGET_TYPE = "slide";

  protected final SlideStore slideStore;

  protected SlideCommand(SlideStore slideStore) {
    this.slideStore = Objects.requireNonNull(slideStore, "Slide store cannot be null");
  }

  protected SlideCommand(CommandRecord commandRecord, SlideStore slideStore) {
    super(commandRecord);
    this.slideStore = Objects.requireNonNull(slideStore, "Slide store cannot be null");
  }

  @Override
  public String targetType() {
    return TARGET_TYPE;
  }

  /**
   * Fetches a slide or fails.
   *
   * @param slideId the slide id
   * @return the slide
   * @throws SlideNotFoundException if the slide does not exist
   */
  protected Slide loadSlide(String slideId) {
    return slideStore.findById(slideId)
        .orElseThrow(() -> new SlideNotFoundException(slideId));
  }

  /**
   * Converts a full slide into a payload map.
   *
   * @param slide the slide
   * @return the map
   */
  protected static Map<String, Object> slideToPayload(Slide slide) {
    Map<String, Object> map = new LinkedHashMap<>(SlideChanges.snapshotOf(slide).asMap());
    map.put("id", slide.getId());
    map.put("presentation_id", slide.getPresentationId());
    map.put("order_index", slide.getOrderIndex());
    map.put("version", slide.getVersion());
    map.put("created_at", slide.getCreatedAt().toString());
    return map;
  }

  /**
   * Rebuilds a full slide from a payload map written by {@link #slideToPayload(Slide)}.
   *
   * @param map the map
   * @return the slide
   */
  protected static Slide slideFromPayload(Map<String, Object> map) {
    String createdAt = optionalString(map, "created_at");
    Integer orderIndex = optionalInt(map, "order_index");
    Integer version = optionalInt(map, "version");
    Slide slide = Slide.rehydrate(
        requireString(map, "id"),
        requireString(map, "presentation_id"),
        requireString(map, SlideChanges.TITLE),
        SlideLayoutType.fromValue(requireString(map, SlideChanges.LAYOUT_TYPE)),
        optionalMap(map, SlideChanges.CONTENT),
        orderIndex != null ? orderIndex : 0,
        version != null ? version : 1,
        createdAt != null ? Instant.parse(createdAt) : null);
    slide.setSubtitle(optionalString(map, SlideChanges.SUBTITLE));
    slide.setNotes(optionalString(map, SlideChanges.NOTES));
    slide.setBackgroundColor(optionalString(map, SlideChanges.BACKGROUND_COLOR));
    slide.setTextColor(optionalString(map, SlideChanges.TEXT_COLOR));
    slide.setFontFamily(optionalString(map, SlideChanges.FONT_FAMILY));
    return slide;
  }
}
