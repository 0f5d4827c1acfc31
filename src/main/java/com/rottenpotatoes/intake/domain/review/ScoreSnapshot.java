package com.rottenpotatoes.intake.domain.review;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Freshness score for a movie, computed from the persisted reviews at query time and never cached.
 *
 * <p><strong>Invariants:</strong> {@code 0 <= positiveCount <= totalReviews} and
 * {@code score} lies in {@code [0, 100]}, rounded half-up to two decimal places.</p>
 *
 * @param movieId movie the snapshot describes
 * @param totalReviews number of reviews stored for the movie
 * @param positiveCount number of those reviews flagged positive
 * @param score {@code positiveCount / totalReviews * 100}, or {@code 0.0} without reviews
 * @since 0.1.0
 */
public record ScoreSnapshot(int movieId, int totalReviews, int positiveCount, double score) {

  /**
   * Validates count and percentage invariants.
   */
  public ScoreSnapshot {
    if (totalReviews < 0 || positiveCount < 0 || positiveCount > totalReviews) {
      throw new IllegalArgumentException(
          "invalid counts: total=" + totalReviews + ", positive=" + positiveCount);
    }
    if (score < 0.0 || score > 100.0 || Double.isNaN(score)) {
      throw new IllegalArgumentException("score must be within [0, 100] (was " + score + ")");
    }
  }

  /**
   * Computes a snapshot from raw counts.
   *
   * @param movieId movie the counts belong to
   * @param totalReviews total review count
   * @param positiveCount positive review count
   * @return snapshot with the rounded percentage
   * @throws IllegalArgumentException if the counts are inconsistent
   */
  public static ScoreSnapshot of(int movieId, int totalReviews, int positiveCount) {
    if (totalReviews == 0) {
      return new ScoreSnapshot(movieId, 0, positiveCount, 0.0);
    }
    double score = BigDecimal.valueOf(positiveCount)
        .multiply(BigDecimal.valueOf(100))
        .divide(BigDecimal.valueOf(totalReviews), 2, RoundingMode.HALF_UP)
        .doubleValue();
    return new ScoreSnapshot(movieId, totalReviews, positiveCount, score);
  }

  /**
   * Returns the display tier for this snapshot.
   *
   * @return freshness tier
   */
  public FreshnessStatus status() {
    return FreshnessStatus.of(totalReviews, score);
  }
}
