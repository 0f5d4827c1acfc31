package com.rottenpotatoes.intake.application.pipeline;

import com.rottenpotatoes.intake.application.port.PersistencePort;
import com.rottenpotatoes.intake.domain.review.Movie;
import com.rottenpotatoes.intake.domain.review.Review;
import java.util.List;
import java.util.Objects;

/**
 * Read-only catalog lookups: the movie list and the newest reviews of a movie.
 *
 * @since 0.1.0
 */
public final class CatalogQueries {
  /** Smallest accepted page size. */
  public static final int MIN_LIMIT = 1;
  /** Largest accepted page size. */
  public static final int MAX_LIMIT = 100;

  private final PersistencePort persistence;
  private final int defaultLimit;

  /**
   * @param persistence review store
   * @param defaultLimit page size used by {@link #recentReviews(int)}; clamped to {@code [1, 100]}
   */
  public CatalogQueries(PersistencePort persistence, int defaultLimit) {
    this.persistence = Objects.requireNonNull(persistence, "persistence");
    this.defaultLimit = clamp(defaultLimit);
  }

  public List<Movie> movies() {
    return persistence.listMovies();
  }

  public List<Review> recentReviews(int movieId) {
    return recentReviews(movieId, defaultLimit);
  }

  /**
   * Returns the newest reviews of a movie, newest first.
   *
   * @param movieId movie id
   * @param limit requested page size; values outside {@code [1, 100]} are clamped
   * @return at most {@code limit} reviews ordered by descending id
   */
  public List<Review> recentReviews(int movieId, int limit) {
    return persistence.listRecentReviews(movieId, clamp(limit));
  }

  public int defaultLimit() {
    return defaultLimit;
  }

  static int clamp(int limit) {
    return Math.max(MIN_LIMIT, Math.min(MAX_LIMIT, limit));
  }
}
