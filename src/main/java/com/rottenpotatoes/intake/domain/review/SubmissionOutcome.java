package com.rottenpotatoes.intake.domain.review;

import java.util.Optional;

/**
 * Terminal states of a single review submission.
 *
 * <p>A submission moves {@code Received -> Classifying -> Persisting -> Committed}; every other
 * constant is a terminal failure reached before the review was committed. No state is retried.</p>
 *
 * @since 0.1.0
 */
public enum SubmissionOutcome {
  COMMITTED(null),
  MODEL_UNAVAILABLE(IntakeErrorKind.MODEL_UNAVAILABLE),
  CLASSIFICATION_FAILED(IntakeErrorKind.CLASSIFICATION_FAILED),
  PERSISTENCE_FAILED(IntakeErrorKind.PERSISTENCE_FAILED);

  private final IntakeErrorKind errorKind;

  SubmissionOutcome(IntakeErrorKind errorKind) {
    this.errorKind = errorKind;
  }

  /**
   * Returns the error kind surfaced for this outcome.
   *
   * @return error kind, empty for {@link #COMMITTED}
   */
  public Optional<IntakeErrorKind> errorKind() {
    return Optional.ofNullable(errorKind);
  }
}
