package com.rottenpotatoes.intake.domain.review;

import java.util.Locale;

/**
 * Binary sentiment classes recognized by the intake core.
 *
 * <p>Classifier labels are collapsed: a case-insensitive match of {@code positive} is
 * {@link #POSITIVE}; every other label, including multi-class or abstention labels, is
 * {@link #NEGATIVE}.</p>
 *
 * @since 0.1.0
 */
public enum Sentiment {
  POSITIVE,
  NEGATIVE;

  private static final String POSITIVE_LABEL = "positive";

  /**
   * Maps a raw classifier label onto the binary sentiment classes.
   *
   * @param label raw label; {@code null} maps to {@link #NEGATIVE}
   * @return collapsed sentiment
   */
  public static Sentiment fromLabel(String label) {
    if (label != null && label.trim().toLowerCase(Locale.ROOT).equals(POSITIVE_LABEL)) {
      return POSITIVE;
    }
    return NEGATIVE;
  }

  /**
   * Returns whether this sentiment is persisted as the positive flag.
   *
   * @return {@code true} for {@link #POSITIVE}
   */
  public boolean isPositive() {
    return this == POSITIVE;
  }
}
