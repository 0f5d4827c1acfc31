package com.rottenpotatoes.intake.application.pipeline;

import com.rottenpotatoes.intake.application.port.EventEmitter;
import com.rottenpotatoes.intake.application.port.MetricsPort;
import com.rottenpotatoes.intake.application.port.PersistencePort;
import com.rottenpotatoes.intake.domain.events.EventLevel;
import com.rottenpotatoes.intake.domain.review.ScoreSnapshot;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Computes a movie's freshness score from persisted review counts.
 * <p><strong>Why:</strong> Read-only counterpart of {@link ReviewIngestionUseCase}; recomputed on every call so
 * there is no cache to invalidate.</p>
 * <p><strong>Thread-safety:</strong> Safe for concurrent use.</p>
 * <p><strong>Observability:</strong> Best-effort DEBUG {@code score.computed} event and
 * {@code intake.score.computed} counter.</p>
 *
 * @since 0.1.0
 */
public final class ScoreAggregator {
  private static final Logger log = LoggerFactory.getLogger(ScoreAggregator.class);

  private final PersistencePort persistence;
  private final EventEmitter events;
  private final MetricsPort metrics;

  public ScoreAggregator(PersistencePort persistence, EventEmitter events, MetricsPort metrics) {
    this.persistence = Objects.requireNonNull(persistence, "persistence");
    this.events = Objects.requireNonNull(events, "events");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Counts the reviews of a movie and derives its score.
   *
   * @param movieId movie id; unknown ids simply have zero reviews
   * @return snapshot with a percentage in {@code [0, 100]}
   * @throws com.rottenpotatoes.intake.application.port.PersistenceException if the store cannot be read
   */
  public ScoreSnapshot score(int movieId) {
    // Positive first: a concurrent insert between the two reads can only raise the total.
    int positive = persistence.countPositiveReviews(movieId);
    int total = Math.max(persistence.countReviews(movieId), positive);
    ScoreSnapshot snapshot = ScoreSnapshot.of(movieId, total, positive);
    metrics.increment("intake.score.computed");
    report(snapshot);
    return snapshot;
  }

  private void report(ScoreSnapshot snapshot) {
    try {
      Map<String, Object> fields = new LinkedHashMap<>();
      fields.put("event", "score.computed");
      fields.put("movie_id", snapshot.movieId());
      fields.put("total_reviews", snapshot.totalReviews());
      fields.put("positive_count", snapshot.positiveCount());
      fields.put("score", snapshot.score());
      events.emit(EventLevel.DEBUG, "Score computed", fields);
    } catch (RuntimeException ex) {
      log.debug("Score event for movie {} not emitted", snapshot.movieId(), ex);
    }
  }
}
