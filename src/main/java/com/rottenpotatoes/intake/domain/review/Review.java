package com.rottenpotatoes.intake.domain.review;

import java.util.Objects;

/**
 * Persisted review carrying the sentiment flag computed at submission time.
 *
 * <p>Reviews are never mutated or deleted. The {@code movieId} is not checked against the movie
 * catalog by the intake core.</p>
 *
 * @param id store-assigned identifier; increases with assignment order
 * @param movieId referenced movie identifier
 * @param text review body; never {@code null}
 * @param positive {@code true} when the classifier labelled the review positive
 * @since 0.1.0
 */
public record Review(long id, int movieId, String text, boolean positive) {

  /**
   * Validates the review text reference.
   */
  public Review {
    text = Objects.requireNonNull(text, "text");
  }
}
