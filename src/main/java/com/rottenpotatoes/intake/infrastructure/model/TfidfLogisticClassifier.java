package com.rottenpotatoes.intake.infrastructure.model;

import com.rottenpotatoes.intake.application.port.ClassifierPort;
import com.rottenpotatoes.intake.domain.model.Prediction;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Binary text classifier evaluating a TF-IDF vectorizer followed by a logistic-regression decision function.
 *
 * <p>Instances are immutable once built by {@link TfidfLogisticArtifactLoader}; all arrays are private copies.
 * {@link #predict(String)} returns the second class label when the decision value is positive and the first
 * otherwise.</p>
 *
 * @since 0.1.0
 */
public final class TfidfLogisticClassifier implements ClassifierPort {
  private final List<String> classes;
  private final Map<String, Integer> vocabulary;
  private final double[] idf;
  private final double[] coef;
  private final double intercept;
  private final boolean lowercase;
  private final Pattern tokenPattern;
  private final boolean sublinearTf;
  private final boolean l2Norm;

  TfidfLogisticClassifier(
      List<String> classes,
      Map<String, Integer> vocabulary,
      double[] idf,
      double[] coef,
      double intercept,
      boolean lowercase,
      Pattern tokenPattern,
      boolean sublinearTf,
      boolean l2Norm) {
    this.classes = List.copyOf(classes);
    if (this.classes.size() != 2) {
      throw new IllegalArgumentException("exactly two classes required (was " + this.classes.size() + ")");
    }
    this.vocabulary = Map.copyOf(vocabulary);
    this.idf = idf.clone();
    this.coef = coef.clone();
    if (this.idf.length != this.coef.length) {
      throw new IllegalArgumentException("idf and coef lengths differ");
    }
    this.intercept = intercept;
    this.lowercase = lowercase;
    this.tokenPattern = Objects.requireNonNull(tokenPattern, "tokenPattern");
    this.sublinearTf = sublinearTf;
    this.l2Norm = l2Norm;
  }

  @Override
  public Prediction predict(String text) {
    if (text == null) {
      return Prediction.failed("text is null");
    }
    try {
      double decision = decisionValue(text);
      if (Double.isNaN(decision)) {
        return Prediction.failed("decision value is NaN");
      }
      return Prediction.of(decision > 0 ? classes.get(1) : classes.get(0));
    } catch (RuntimeException ex) {
      return Prediction.failed(ex.getClass().getSimpleName() + ": " + ex.getMessage());
    }
  }

  /**
   * Computes {@code intercept + w . x} for the TF-IDF vector {@code x} of {@code text}.
   *
   * @param text input document
   * @return raw decision value
   */
  double decisionValue(String text) {
    Map<Integer, Integer> counts = termCounts(lowercase ? text.toLowerCase(Locale.ROOT) : text);
    int[] columns = new int[counts.size()];
    double[] weights = new double[counts.size()];
    double squaredNorm = 0.0;
    int i = 0;
    for (Map.Entry<Integer, Integer> entry : counts.entrySet()) {
      int column = entry.getKey();
      double tf = sublinearTf ? 1.0 + Math.log(entry.getValue()) : entry.getValue();
      double weight = tf * idf[column];
      columns[i] = column;
      weights[i] = weight;
      squaredNorm += weight * weight;
      i++;
    }
    double scale = l2Norm && squaredNorm > 0.0 ? 1.0 / Math.sqrt(squaredNorm) : 1.0;
    double decision = intercept;
    for (int j = 0; j < weights.length; j++) {
      decision += weights[j] * scale * coef[columns[j]];
    }
    return decision;
  }

  List<String> classes() {
    return classes;
  }

  private Map<Integer, Integer> termCounts(String text) {
    Map<Integer, Integer> counts = new HashMap<>();
    Matcher matcher = tokenPattern.matcher(text);
    while (matcher.find()) {
      Integer column = vocabulary.get(matcher.group());
      if (column != null) {
        counts.merge(column, 1, Integer::sum);
      }
    }
    return counts;
  }
}
