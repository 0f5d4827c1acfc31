package com.rottenpotatoes.intake.domain.review;

import java.util.Objects;

/**
 * Immutable movie entry as seeded into the review store.
 *
 * @param id store identifier; positive
 * @param name unique display name; never {@code null}
 * @param description free-text description; {@code null} is normalized to an empty string
 * @since 0.1.0
 */
public record Movie(int id, String name, String description) {

  /**
   * Validates identifiers and normalizes the description.
   */
  public Movie {
    if (id <= 0) {
      throw new IllegalArgumentException("id must be positive (was " + id + ")");
    }
    name = Objects.requireNonNull(name, "name");
    description = description == null ? "" : description;
  }
}
