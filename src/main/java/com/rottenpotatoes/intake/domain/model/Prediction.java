package com.rottenpotatoes.intake.domain.model;

/**
 * Outcome of one classifier invocation.
 *
 * <p>{@code ok=false} reports an internal artifact failure (malformed input, runtime error) in
 * place of an exception; the label is then {@code null}.</p>
 *
 * @param label raw label chosen by the artifact; {@code null} when {@code ok} is {@code false}
 * @param ok whether the artifact produced a label
 * @param error failure description when {@code ok} is {@code false}; otherwise {@code null}
 * @since 0.1.0
 */
public record Prediction(String label, boolean ok, String error) {

  /**
   * Validates that successful predictions carry a label.
   */
  public Prediction {
    if (ok && label == null) {
      throw new IllegalArgumentException("successful prediction requires a label");
    }
  }

  /**
   * Creates a successful prediction.
   *
   * @param label raw label; must not be {@code null}
   * @return successful prediction
   */
  public static Prediction of(String label) {
    return new Prediction(label, true, null);
  }

  /**
   * Creates a failed prediction.
   *
   * @param error failure description
   * @return failed prediction
   */
  public static Prediction failed(String error) {
    return new Prediction(null, false, error == null ? "unknown error" : error);
  }
}
