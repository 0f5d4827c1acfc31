package com.rottenpotatoes.intake.domain.review;

/**
 * <strong>What:</strong> Stable error kinds surfaced by the intake core to its callers.
 * <p><strong>Why:</strong> The routing layer and operators key off these names; they must never be
 * conflated or renamed.</p>
 * <p><strong>Role:</strong> Domain error taxonomy shared by the ingestion pipeline and the seeder.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable.</p>
 *
 * @since 0.1.0
 */
public enum IntakeErrorKind {
  /** No classifier artifact was found or it failed to load; the service stays up. */
  MODEL_UNAVAILABLE,
  /** The artifact reported an internal failure for the submitted text. */
  CLASSIFICATION_FAILED,
  /** Classification succeeded but the review could not be written to the store. */
  PERSISTENCE_FAILED,
  /** The bootstrap dataset was missing or malformed; the store was left unseeded. */
  SEEDING_FAILED
}
