package com.rottenpotatoes.intake.application.seed;

import com.rottenpotatoes.intake.domain.review.IntakeErrorKind;
import java.util.Objects;
import java.util.Optional;

/**
 * Result of one seeding attempt.
 *
 * @param outcome what happened
 * @param movies number of movies written (0 unless {@link Outcome#SEEDED})
 * @param reviews number of reviews written (0 unless {@link Outcome#SEEDED})
 * @param detail human-readable description; failure reason when {@link Outcome#FAILED}
 * @since 0.1.0
 */
public record SeedReport(Outcome outcome, int movies, int reviews, String detail) {

  /** Seeding outcomes. */
  public enum Outcome {
    SEEDED,
    SKIPPED,
    FAILED
  }

  public SeedReport {
    outcome = Objects.requireNonNull(outcome, "outcome");
    detail = detail == null ? "" : detail;
  }

  static SeedReport seeded(int movies, int reviews, String source) {
    return new SeedReport(Outcome.SEEDED, movies, reviews, source);
  }

  static SeedReport skipped(String source) {
    return new SeedReport(Outcome.SKIPPED, 0, 0, "store already populated; " + source + " ignored");
  }

  static SeedReport failed(String reason) {
    return new SeedReport(Outcome.FAILED, 0, 0, reason);
  }

  public Optional<IntakeErrorKind> errorKind() {
    return outcome == Outcome.FAILED ? Optional.of(IntakeErrorKind.SEEDING_FAILED) : Optional.empty();
  }
}
