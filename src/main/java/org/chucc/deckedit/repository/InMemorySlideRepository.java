package org.chucc.deckedit.repository;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.chucc.deckedit.domain.Slide;
import org.chucc.deckedit.exception.SlideStoreException;
import org.springframework.stereotype.Repository;

/**
 * In-memory slide store.
 * Thread-safe implementation using ConcurrentHashMap; slides are copied on the way in and out
 * so callers never share state with the store.
 */
@Repository
public class InMemorySlideRepository implements SlideStore {

  private final Map<String, Slide> slides = new ConcurrentHashMap<>();

  @Override
  public Optional<Slide> findById(String slideId) {
    return Optional.ofNullable(slides.get(slideId)).map(Slide::copy);
  }

  @Override
  public List<Slide> findAllByPresentation(String presentationId) {
    return slides.values().stream()
        .filter(slide -> slide.getPresentationId().equals(presentationId))
        .sorted(Comparator.comparingInt(Slide::getOrderIndex)
            .thenComparing(Slide::getCreatedAt))
        .map(Slide::copy)
        .toList();
  }

  @Override
  public int findMaxOrder(String presentationId) {
    return slides.values().stream()
        .filter(slide -> slide.getPresentationId().equals(presentationId))
        .mapToInt(Slide::getOrderIndex)
        .max()
        .orElse(-1);
  }

  @Override
  public Slide create(Slide slide) {
    Slide stored = slide.copy();
    if (slides.putIfAbsent(stored.getId(), stored) != null) {
      throw new SlideStoreException("Slide already exists: " + slide.getId());
    }
    return stored.copy();
  }

  @Override
  public Slide update(Slide slide) {
    Slide stored = slide.copy();
    if (slides.computeIfPresent(stored.getId(), (id, existing) -> stored) == null) {
      throw new SlideStoreException("Cannot update missing slide: " + slide.getId());
    }
    return stored.copy();
  }

  @Override
  public boolean delete(String slideId) {
    return slides.remove(slideId) != null;
  }

  @Override
  public synchronized void reorder(String presentationId, Map<String, Integer> slideOrders) {
    // Validate everything first so a rejected reorder changes nothing
    for (String slideId : slideOrders.keySet()) {
      Slide slide = slides.get(slideId);
      if (slide == null || !slide.getPresentationId().equals(presentationId)) {
        throw new SlideStoreException(
            "Slide " + slideId + " not found in presentation " + presentationId);
      }
    }
    slideOrders.forEach((slideId, order) -> slides.computeIfPresent(slideId, (id, existing) -> {
      Slide moved = existing.copy();
      moved.moveTo(order);
      return moved;
    }));
  }

  @Override
  public int deleteAllByPresentation(String presentationId) {
    List<String> ids = slides.values().stream()
        .filter(slide -> slide.getPresentationId().equals(presentationId))
        .map(Slide::getId)
        .toList();
    int deleted = 0;
    for (String id : ids) {
      if (slides.remove(id) != null) {
        deleted++;
      }
    }
    return deleted;
  }
}
