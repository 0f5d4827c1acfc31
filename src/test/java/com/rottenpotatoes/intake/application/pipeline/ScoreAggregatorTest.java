package com.rottenpotatoes.intake.application.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;

import com.rottenpotatoes.intake.application.port.EventEmitter;
import com.rottenpotatoes.intake.domain.events.EventLevel;
import com.rottenpotatoes.intake.domain.review.FreshnessStatus;
import com.rottenpotatoes.intake.domain.review.ScoreSnapshot;
import com.rottenpotatoes.intake.infrastructure.persistence.InMemoryReviewStore;
import com.rottenpotatoes.intake.support.RecordingEventEmitter;
import com.rottenpotatoes.intake.support.RecordingMetricsPort;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ScoreAggregatorTest {

  @Test
  void computesPercentageFromStoredFlags() {
    InMemoryReviewStore store = new InMemoryReviewStore();
    store.createReview(1, "a", true);
    store.createReview(1, "b", true);
    store.createReview(1, "c", false);
    store.createReview(2, "other movie", true);
    RecordingEventEmitter events = new RecordingEventEmitter();
    RecordingMetricsPort metrics = new RecordingMetricsPort();

    ScoreSnapshot snapshot = new ScoreAggregator(store, events, metrics).score(1);

    assertEquals(3, snapshot.totalReviews());
    assertEquals(2, snapshot.positiveCount());
    assertEquals(66.67, snapshot.score());
    assertEquals(FreshnessStatus.FRESH, snapshot.status());
    assertEquals(1, metrics.count("intake.score.computed"));
    assertEquals(EventLevel.DEBUG, events.named("score.computed").get(0).level());
  }

  @Test
  void movieWithoutReviewsScoresZero() {
    ScoreSnapshot snapshot = new ScoreAggregator(
        new InMemoryReviewStore(), EventEmitter.NO_OP, new RecordingMetricsPort()).score(99);

    assertEquals(0, snapshot.totalReviews());
    assertEquals(0.0, snapshot.score());
  }

  @Test
  void eventFailureDoesNotBreakScoring() {
    InMemoryReviewStore store = new InMemoryReviewStore();
    store.createReview(1, "a", true);
    EventEmitter broken = new EventEmitter() {
      @Override
      public void emit(EventLevel level, String message, Map<String, ?> fields) {
        throw new IllegalStateException("sink down");
      }
    };

    assertEquals(100.0, new ScoreAggregator(store, broken, new RecordingMetricsPort()).score(1).score());
  }
}
