package com.rottenpotatoes.intake.infrastructure.persistence;

import com.rottenpotatoes.intake.application.port.PersistenceException;
import com.rottenpotatoes.intake.application.port.PersistencePort;
import com.rottenpotatoes.intake.domain.review.Movie;
import com.rottenpotatoes.intake.domain.review.Review;
import com.rottenpotatoes.intake.domain.review.ReviewDraft;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;

/**
 * Process-local review store. Review ids are assigned from 1 in write order.
 *
 * @since 0.1.0
 */
public final class InMemoryReviewStore implements PersistencePort {
  private final Map<Integer, Movie> movies = new TreeMap<>();
  private final List<Review> reviews = new ArrayList<>();
  private long nextReviewId = 1;

  @Override
  public synchronized long createReview(int movieId, String text, boolean positive) {
    Review review = new Review(nextReviewId, movieId, Objects.requireNonNull(text, "text"), positive);
    reviews.add(review);
    nextReviewId++;
    return review.id();
  }

  @Override
  public synchronized int countReviews(int movieId) {
    int count = 0;
    for (Review review : reviews) {
      if (review.movieId() == movieId) {
        count++;
      }
    }
    return count;
  }

  @Override
  public synchronized int countPositiveReviews(int movieId) {
    int count = 0;
    for (Review review : reviews) {
      if (review.movieId() == movieId && review.positive()) {
        count++;
      }
    }
    return count;
  }

  @Override
  public synchronized List<Review> listRecentReviews(int movieId, int limit) {
    List<Review> recent = new ArrayList<>();
    for (int i = reviews.size() - 1; i >= 0 && recent.size() < limit; i--) {
      Review review = reviews.get(i);
      if (review.movieId() == movieId) {
        recent.add(review);
      }
    }
    return List.copyOf(recent);
  }

  @Override
  public synchronized List<Movie> listMovies() {
    return List.copyOf(movies.values());
  }

  @Override
  public synchronized boolean seedIfEmpty(List<Movie> seedMovies, List<ReviewDraft> seedReviews) {
    if (!movies.isEmpty() || !reviews.isEmpty()) {
      return false;
    }
    Set<String> names = new HashSet<>();
    for (Movie movie : seedMovies) {
      if (!names.add(movie.name()) || movies.containsKey(movie.id())) {
        movies.clear();
        throw new PersistenceException("duplicate movie " + movie.id() + " / " + movie.name());
      }
      movies.put(movie.id(), movie);
    }
    for (ReviewDraft draft : seedReviews) {
      createReview(draft.movieId(), draft.text(), draft.positive());
    }
    return true;
  }
}
