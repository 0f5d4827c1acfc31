package com.rottenpotatoes.intake.infrastructure.persistence;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.rottenpotatoes.intake.application.port.PersistenceException;
import com.rottenpotatoes.intake.domain.review.Movie;
import com.rottenpotatoes.intake.domain.review.Review;
import com.rottenpotatoes.intake.domain.review.ReviewDraft;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

class InMemoryReviewStoreTest {

  @Test
  void idsIncreaseAndCountsTrackFlags() {
    InMemoryReviewStore store = new InMemoryReviewStore();

    long first = store.createReview(4, "Beautiful", true);
    long second = store.createReview(4, "Slow", false);

    assertTrue(second > first);
    assertEquals(2, store.countReviews(4));
    assertEquals(1, store.countPositiveReviews(4));
    assertEquals(0, store.countReviews(5));
    assertEquals(second, store.listRecentReviews(4, 1).get(0).id());
  }

  @Test
  void seedIfEmptyOnlyWritesOnce() {
    InMemoryReviewStore store = new InMemoryReviewStore();
    List<Movie> movies = List.of(new Movie(2, "B", ""), new Movie(1, "A", "first"));

    assertTrue(store.seedIfEmpty(movies, List.of(new ReviewDraft(1, "ok", true))));
    assertFalse(store.seedIfEmpty(movies, List.of(new ReviewDraft(1, "again", true))));

    assertEquals(List.of(1, 2), store.listMovies().stream().map(Movie::id).toList());
    assertEquals(1, store.countReviews(1));
  }

  @Test
  void storeHoldingOnlySubmittedReviewsIsNotSeeded() {
    InMemoryReviewStore store = new InMemoryReviewStore();
    store.createReview(1, "user review", true);

    assertFalse(store.seedIfEmpty(List.of(new Movie(1, "A", "")), List.of(new ReviewDraft(1, "seeded", false))));

    assertTrue(store.listMovies().isEmpty());
    assertEquals(1, store.countReviews(1));
  }

  @Test
  void datasetWithoutMoviesSeedsReviewsOnce() {
    InMemoryReviewStore store = new InMemoryReviewStore();
    List<ReviewDraft> drafts = List.of(new ReviewDraft(1, "orphan", true));

    assertTrue(store.seedIfEmpty(List.of(), drafts));
    assertFalse(store.seedIfEmpty(List.of(), drafts));

    assertEquals(1, store.countReviews(1));
  }

  @Test
  void recentReviewsAreCappedNewestFirst() {
    InMemoryReviewStore store = new InMemoryReviewStore();
    for (int i = 0; i < 5; i++) {
      store.createReview(7, "mine " + i, i % 2 == 0);
      store.createReview(8, "other " + i, true);
    }

    List<Long> ids = store.listRecentReviews(7, 3).stream().map(Review::id).toList();

    assertEquals(List.of(9L, 7L, 5L), ids);
    assertTrue(store.listRecentReviews(7, 3).stream().allMatch(r -> r.movieId() == 7));
  }

  @Test
  void duplicateMovieNameFailsSeeding() {
    InMemoryReviewStore store = new InMemoryReviewStore();

    assertThrows(PersistenceException.class,
        () -> store.seedIfEmpty(List.of(new Movie(1, "A", ""), new Movie(2, "A", "")), List.of()));
    assertTrue(store.listMovies().isEmpty());
  }

  @Test
  void concurrentSubmissionsAreAllCounted() throws Exception {
    InMemoryReviewStore store = new InMemoryReviewStore();
    ExecutorService pool = Executors.newFixedThreadPool(4);
    for (int i = 0; i < 200; i++) {
      boolean positive = i % 4 == 0;
      pool.submit(() -> store.createReview(1, "r", positive));
    }
    pool.shutdown();
    assertTrue(pool.awaitTermination(10, TimeUnit.SECONDS));

    assertEquals(200, store.countReviews(1));
    assertEquals(50, store.countPositiveReviews(1));
  }
}
