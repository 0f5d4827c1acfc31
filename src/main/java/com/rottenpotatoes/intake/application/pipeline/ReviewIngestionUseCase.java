package com.rottenpotatoes.intake.application.pipeline;

import com.rottenpotatoes.intake.application.model.ActiveModel;
import com.rottenpotatoes.intake.application.port.ClassifierPort;
import com.rottenpotatoes.intake.application.port.EventEmitter;
import com.rottenpotatoes.intake.application.port.MetricsPort;
import com.rottenpotatoes.intake.application.port.PersistencePort;
import com.rottenpotatoes.intake.domain.events.EventLevel;
import com.rottenpotatoes.intake.domain.model.Prediction;
import com.rottenpotatoes.intake.domain.review.Sentiment;
import com.rottenpotatoes.intake.domain.review.SubmissionOutcome;
import com.rottenpotatoes.intake.domain.review.SubmissionResult;
import com.rottenpotatoes.intake.logging.Logs;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Classifies a submitted review, persists it, and reports the outcome.
 * <p><strong>Why:</strong> Central orchestrator of the intake core; owns the partial-failure contract between
 * classification and storage.</p>
 * <p><strong>Role:</strong> Application-layer use case exposed to the outer surface.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Refuse submissions while no classifier is loaded, without touching persistence.</li>
 *   <li>Map classifier failures to {@link SubmissionOutcome#CLASSIFICATION_FAILED} without persisting.</li>
 *   <li>Write exactly one review per successful classification and report storage failures distinctly.</li>
 *   <li>Emit exactly one event per submission and count each outcome; a failing emitter never changes the
 *   outcome.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless apart from immutable collaborators; safe for concurrent
 * submissions provided the persistence port is.</p>
 * <p><strong>Observability:</strong> Events {@code review.committed} / {@code review.rejected}; metrics
 * {@code intake.submit.*}; the movie id is placed in the MDC under {@code movieId} for the call.</p>
 *
 * <p>State machine per submission:
 * {@code Received -> Classifying -> (ClassificationFailed | Persisting -> (PersistenceFailed | Committed))}.
 * No step is retried.</p>
 *
 * @since 0.1.0
 * @see ScoreAggregator
 */
public final class ReviewIngestionUseCase {
  private static final Logger log = LoggerFactory.getLogger(ReviewIngestionUseCase.class);

  static final String REASON_NOT_LOADED = "not loaded";
  static final String REASON_CLASSIFICATION = "classification failed";
  static final String REASON_PERSISTENCE = "persistence failed";

  private final ActiveModel model;
  private final PersistencePort persistence;
  private final EventEmitter events;
  private final MetricsPort metrics;

  /**
   * Creates the use case.
   *
   * @param model immutable classifier state published at startup; must not be {@code null}
   * @param persistence review store; must not be {@code null}
   * @param events structured event emitter; must not be {@code null}
   * @param metrics metrics sink; must not be {@code null}
   */
  public ReviewIngestionUseCase(
      ActiveModel model, PersistencePort persistence, EventEmitter events, MetricsPort metrics) {
    this.model = Objects.requireNonNull(model, "model");
    this.persistence = Objects.requireNonNull(persistence, "persistence");
    this.events = Objects.requireNonNull(events, "events");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Submits a review for classification and storage.
   *
   * @param movieId target movie id; must be positive (existence is not checked)
   * @param text review text; must not be {@code null}
   * @return terminal outcome of the submission; never {@code null}
   * @throws IllegalArgumentException if {@code movieId} is not positive or {@code text} is {@code null}
   */
  public SubmissionResult submit(int movieId, String text) {
    if (movieId <= 0) {
      throw new IllegalArgumentException("movieId must be positive (was " + movieId + ")");
    }
    if (text == null) {
      throw new IllegalArgumentException("text must not be null");
    }
    long started = System.nanoTime();
    String previousMovieId = MDC.get("movieId");
    try {
      MDC.put("movieId", Integer.toString(movieId));
      return process(movieId, text);
    } finally {
      metrics.observe("intake.submit.latencyNanos", System.nanoTime() - started);
      if (previousMovieId == null) {
        MDC.remove("movieId");
      } else {
        MDC.put("movieId", previousMovieId);
      }
    }
  }

  private SubmissionResult process(int movieId, String text) {
    String version = model.versionTag();
    Optional<ClassifierPort> classifier = model.classifierIfLoaded();
    if (classifier.isEmpty()) {
      metrics.increment("intake.submit.modelUnavailable");
      report(EventLevel.ERROR, "Review rejected", rejection(REASON_NOT_LOADED, movieId, "precondition"));
      return SubmissionResult.failed(
          SubmissionOutcome.MODEL_UNAVAILABLE, movieId, null, version, "classifier not loaded");
    }

    Prediction prediction = classify(classifier.get(), text);
    if (!prediction.ok()) {
      metrics.increment("intake.submit.classificationFailed");
      Map<String, Object> fields = rejection(REASON_CLASSIFICATION, movieId, "classify");
      fields.put("model_version", version);
      fields.put("error", prediction.error());
      report(EventLevel.ERROR, "Review rejected", fields);
      return SubmissionResult.failed(
          SubmissionOutcome.CLASSIFICATION_FAILED, movieId, null, version, prediction.error());
    }

    String label = prediction.label();
    boolean positive = Sentiment.fromLabel(label).isPositive();
    long reviewId;
    try {
      reviewId = persistence.createReview(movieId, text, positive);
    } catch (RuntimeException ex) {
      log.warn("Review for movie {} classified as '{}' but not stored: {}", movieId, label, Logs.excerpt(text), ex);
      metrics.increment("intake.submit.persistenceFailed");
      Map<String, Object> fields = rejection(REASON_PERSISTENCE, movieId, "persist");
      fields.put("prediction_succeeded", true);
      fields.put("storage_succeeded", false);
      fields.put("sentiment", label);
      fields.put("model_version", version);
      fields.put("error", String.valueOf(ex.getMessage()));
      report(EventLevel.ERROR, "Review rejected", fields);
      return SubmissionResult.failed(
          SubmissionOutcome.PERSISTENCE_FAILED, movieId, label, version, String.valueOf(ex.getMessage()));
    }

    metrics.increment("intake.submit.committed");
    Map<String, Object> fields = new LinkedHashMap<>();
    fields.put("event", "review.committed");
    fields.put("movie_id", movieId);
    fields.put("review_id", reviewId);
    fields.put("sentiment", label);
    fields.put("is_positive", positive);
    fields.put("model_version", version);
    report(EventLevel.INFO, "Review submitted", fields);
    return SubmissionResult.committed(movieId, reviewId, label, version);
  }

  private void report(EventLevel level, String message, Map<String, Object> fields) {
    try {
      events.emit(level, message, fields);
    } catch (RuntimeException ex) {
      log.debug("Event {} for movie {} not emitted", fields.get("event"), fields.get("movie_id"), ex);
    }
  }

  private Prediction classify(ClassifierPort classifier, String text) {
    try {
      Prediction prediction = classifier.predict(text);
      return prediction == null ? Prediction.failed("classifier returned no prediction") : prediction;
    } catch (RuntimeException ex) {
      log.debug("Classifier raised on input '{}'", Logs.excerpt(text), ex);
      return Prediction.failed(ex.getClass().getSimpleName() + ": " + ex.getMessage());
    }
  }

  private static Map<String, Object> rejection(String reason, int movieId, String stage) {
    Map<String, Object> fields = new LinkedHashMap<>();
    fields.put("event", "review.rejected");
    fields.put("reason", reason);
    fields.put("movie_id", movieId);
    fields.put("stage", stage);
    return fields;
  }
}
