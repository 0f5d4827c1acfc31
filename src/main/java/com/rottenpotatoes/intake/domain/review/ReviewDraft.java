package com.rottenpotatoes.intake.domain.review;

import java.util.Objects;

/**
 * Review that has not been assigned a store identifier yet, as found in the seed dataset.
 *
 * @param movieId referenced movie identifier
 * @param text review body; never {@code null}
 * @param positive sentiment flag recorded with the dataset
 * @since 0.1.0
 */
public record ReviewDraft(int movieId, String text, boolean positive) {

  /**
   * Validates the review text reference.
   */
  public ReviewDraft {
    text = Objects.requireNonNull(text, "text");
  }
}
