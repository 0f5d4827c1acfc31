package com.rottenpotatoes.intake.application.port;

import com.rottenpotatoes.intake.domain.model.Prediction;

/**
 * <strong>What:</strong> Capability wrapping a loaded classifier artifact's predict operation.
 * <p><strong>Why:</strong> Keeps the ingestion pipeline independent of the artifact format and lets tests
 * substitute deterministic fakes.</p>
 * <p><strong>Role:</strong> Outbound port produced once at startup by the artifact resolver.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be safe for concurrent invocation and hold no
 * mutable shared state once loaded.</p>
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface ClassifierPort {
  /**
   * Classifies a review text.
   *
   * @param text review body; never {@code null}
   * @return prediction; internal artifact failures are reported with {@code ok=false} and must not be
   *     thrown
   */
  Prediction predict(String text);
}
