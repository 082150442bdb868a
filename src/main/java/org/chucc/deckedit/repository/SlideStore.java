package org.chucc.deckedit.repository;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.chucc.deckedit.domain.Slide;

/**
 * Store holding slide state. Commands delegate every mutation to it.
 *
 * <p>Absence is reported through the return value ({@link Optional#empty()} or {@code false});
 * rejection of an operation is reported by throwing
 * {@link org.chucc.deckedit.exception.SlideStoreException}. Implementations must be thread-safe.
 */
public interface SlideStore {

  /**
   * Fetches a slide by id.
   *
   * @param slideId the slide id
   * @return a copy of the slide, or empty if it does not exist
   */
  Optional<Slide> findById(String slideId);

  /**
   * Lists the slides of a presentation ordered by order index.
   *
   * @param presentationId the presentation id
   * @return copies of the slides, empty if there are none
   */
  List<Slide> findAllByPresentation(String presentationId);

  /**
   * Gets the highest order index used in a presentation.
   *
   * @param presentationId the presentation id
   * @return the highest order index, or -1 if the presentation has no slides
   */
  int findMaxOrder(String presentationId);

  /**
   * Creates a slide.
   *
   * @param slide the slide to create
   * @return a copy of the stored slide
   * @throws org.chucc.deckedit.exception.SlideStoreException if a slide with the id exists
   */
  Slide create(Slide slide);

  /**
   * Writes back an edited slide.
   *
   * @param slide the slide
   * @return a copy of the stored slide
   * @throws org.chucc.deckedit.exception.SlideStoreException if the slide does not exist
   */
  Slide update(Slide slide);

  /**
   * Deletes a slide.
   *
   * @param slideId the slide id
   * @return true if the slide was deleted, false if it did not exist
   */
  boolean delete(String slideId);

  /**
   * Applies new order indexes to slides of a presentation.
   *
   * @param presentationId the presentation id
   * @param slideOrders slide id to new order index
   * @throws org.chucc.deckedit.exception.SlideStoreException if a slide is missing or belongs to
   *     another presentation
   */
  void reorder(String presentationId, Map<String, Integer> slideOrders);

  /**
   * Deletes all slides of a presentation.
   *
   * @param presentationId the presentation id
   * @return the number of deleted slides
   */
  int deleteAllByPresentation(String presentationId);
}
