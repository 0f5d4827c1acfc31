package com.rottenpotatoes.intake.domain.review;

import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Static bootstrap dataset: the movie catalog plus pre-classified reviews.
 *
 * @param movies movies to seed; identifiers and names are unique
 * @param reviews reviews to seed
 * @since 0.1.0
 */
public record SeedDataset(List<Movie> movies, List<ReviewDraft> reviews) {

  /**
   * Copies the lists and validates identifier and name uniqueness.
   */
  public SeedDataset {
    movies = List.copyOf(Objects.requireNonNull(movies, "movies"));
    reviews = List.copyOf(Objects.requireNonNull(reviews, "reviews"));
    Set<Integer> ids = new HashSet<>();
    Set<String> names = new HashSet<>();
    for (Movie movie : movies) {
      if (!ids.add(movie.id())) {
        throw new IllegalArgumentException("duplicate movie id " + movie.id());
      }
      if (!names.add(movie.name())) {
        throw new IllegalArgumentException("duplicate movie name " + movie.name());
      }
    }
  }
}
