package com.rottenpotatoes.intake.domain.review;

/**
 * Display tier derived from a freshness percentage.
 *
 * @since 0.1.0
 */
public enum FreshnessStatus {
  /** Percentage of at least 75. */
  CERTIFIED_HOT,
  /** Percentage of at least 60. */
  FRESH,
  /** Percentage below 60. */
  ROTTEN,
  /** Movie has no reviews yet. */
  NO_REVIEWS;

  static final double CERTIFIED_HOT_THRESHOLD = 75.0;
  static final double FRESH_THRESHOLD = 60.0;

  /**
   * Classifies a score snapshot.
   *
   * @param totalReviews number of reviews counted
   * @param score freshness percentage in {@code [0, 100]}
   * @return matching tier
   */
  public static FreshnessStatus of(int totalReviews, double score) {
    if (totalReviews == 0) {
      return NO_REVIEWS;
    }
    if (score >= CERTIFIED_HOT_THRESHOLD) {
      return CERTIFIED_HOT;
    }
    if (score >= FRESH_THRESHOLD) {
      return FRESH;
    }
    return ROTTEN;
  }
}
