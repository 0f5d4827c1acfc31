package com.rottenpotatoes.intake.application.port;

import com.rottenpotatoes.intake.domain.review.Movie;
import com.rottenpotatoes.intake.domain.review.Review;
import com.rottenpotatoes.intake.domain.review.ReviewDraft;
import java.util.List;

/**
 * <strong>What:</strong> Store port for movies and reviews.
 * <p><strong>Why:</strong> The intake core never defines the schema; it only needs these operations.</p>
 * <p><strong>Role:</strong> Outbound port on the persistence side of the hexagonal architecture.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Create one review per call as a single atomic write.</li>
 *   <li>Answer count and listing queries against the committed review set.</li>
 *   <li>Populate an empty store from a bootstrap dataset exactly once.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Implementations provide their own isolation (connection per
 * operation or internal locking); the pipeline invokes them from concurrent request threads.</p>
 * <p><strong>Observability:</strong> Failures surface as {@link PersistenceException}; callers report them.</p>
 *
 * @since 0.1.0
 */
public interface PersistencePort extends AutoCloseable {
  /**
   * Persists a new review and commits it.
   *
   * @param movieId referenced movie; not validated for existence
   * @param text review body; never {@code null}
   * @param positive sentiment flag produced at submission time
   * @return store-assigned identifier, increasing with assignment order
   * @throws PersistenceException if the write or commit fails
   */
  long createReview(int movieId, String text, boolean positive);

  /**
   * Counts all reviews stored for a movie.
   *
   * @param movieId movie identifier
   * @return review count; {@code 0} for unknown movies
   * @throws PersistenceException if the store cannot be queried
   */
  int countReviews(int movieId);

  /**
   * Counts the reviews flagged positive for a movie.
   *
   * @param movieId movie identifier
   * @return positive review count
   * @throws PersistenceException if the store cannot be queried
   */
  int countPositiveReviews(int movieId);

  /**
   * Lists the most recent reviews of a movie, newest first by assignment order.
   *
   * @param movieId movie identifier
   * @param limit maximum number of reviews returned; must be positive
   * @return at most {@code limit} reviews
   * @throws PersistenceException if the store cannot be queried
   */
  List<Review> listRecentReviews(int movieId, int limit);

  /**
   * Lists the movie catalog ordered by identifier.
   *
   * @return all movies
   * @throws PersistenceException if the store cannot be queried
   */
  List<Movie> listMovies();

  /**
   * Seeds the store when it holds neither movies nor reviews; otherwise does nothing.
   *
   * @param movies movies to insert
   * @param reviews reviews to insert after the movies
   * @return {@code true} when the dataset was written, {@code false} when the store was not empty
   * @throws PersistenceException if the seed transaction fails
   */
  boolean seedIfEmpty(List<Movie> movies, List<ReviewDraft> reviews);

  /**
   * Releases store resources.
   */
  @Override
  default void close() {}
}
