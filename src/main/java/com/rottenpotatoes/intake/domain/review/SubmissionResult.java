package com.rottenpotatoes.intake.domain.review;

import java.util.Objects;
import java.util.Optional;

/**
 * Result returned to the caller for one review submission.
 *
 * @param outcome terminal state of the submission; never {@code null}
 * @param movieId movie the review was submitted for
 * @param reviewId store identifier when committed; {@code null} otherwise
 * @param label raw classifier label when classification succeeded; {@code null} otherwise
 * @param modelVersion version tag of the classifier that served the request; never {@code null}
 * @param detail human-readable failure description; {@code null} when committed
 * @since 0.1.0
 */
public record SubmissionResult(
    SubmissionOutcome outcome,
    int movieId,
    Long reviewId,
    String label,
    String modelVersion,
    String detail) {

  /**
   * Validates the outcome and version references.
   */
  public SubmissionResult {
    outcome = Objects.requireNonNull(outcome, "outcome");
    modelVersion = Objects.requireNonNull(modelVersion, "modelVersion");
  }

  /**
   * Builds the committed result.
   *
   * @param movieId movie identifier
   * @param reviewId store-assigned review id
   * @param label raw classifier label
   * @param modelVersion classifier version tag
   * @return committed result
   */
  public static SubmissionResult committed(int movieId, long reviewId, String label, String modelVersion) {
    return new SubmissionResult(SubmissionOutcome.COMMITTED, movieId, reviewId, label, modelVersion, null);
  }

  /**
   * Builds a failed result.
   *
   * @param outcome failure outcome; must not be {@link SubmissionOutcome#COMMITTED}
   * @param movieId movie identifier
   * @param label raw label when classification already succeeded; may be {@code null}
   * @param modelVersion classifier version tag
   * @param detail failure description
   * @return failed result
   */
  public static SubmissionResult failed(
      SubmissionOutcome outcome, int movieId, String label, String modelVersion, String detail) {
    if (outcome == SubmissionOutcome.COMMITTED) {
      throw new IllegalArgumentException("failed result requires a failure outcome");
    }
    return new SubmissionResult(outcome, movieId, null, label, modelVersion, detail);
  }

  /**
   * Returns whether the review was committed.
   *
   * @return {@code true} when committed
   */
  public boolean committed() {
    return outcome == SubmissionOutcome.COMMITTED;
  }

  /**
   * Returns the collapsed sentiment when a label is available.
   *
   * @return sentiment, empty if classification never succeeded
   */
  public Optional<Sentiment> sentiment() {
    return Optional.ofNullable(label).map(Sentiment::fromLabel);
  }

  /**
   * Returns the error kind for failed submissions.
   *
   * @return error kind, empty when committed
   */
  public Optional<IntakeErrorKind> errorKind() {
    return outcome.errorKind();
  }
}
