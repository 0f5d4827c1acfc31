package com.rottenpotatoes.intake.domain.review;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class SentimentTest {

  @Test
  void onlyPositiveLabelMapsToPositive() {
    assertEquals(Sentiment.POSITIVE, Sentiment.fromLabel("positive"));
    assertEquals(Sentiment.POSITIVE, Sentiment.fromLabel(" Positive "));
    assertEquals(Sentiment.NEGATIVE, Sentiment.fromLabel("negative"));
    assertEquals(Sentiment.NEGATIVE, Sentiment.fromLabel("neutral"));
    assertEquals(Sentiment.NEGATIVE, Sentiment.fromLabel(null));
  }

  @Test
  void submissionResultExposesCollapsedSentiment() {
    SubmissionResult committed = SubmissionResult.committed(3, 7L, "positive", "run-1");
    SubmissionResult failed = SubmissionResult.failed(
        SubmissionOutcome.MODEL_UNAVAILABLE, 3, null, "unknown", "classifier not loaded");

    assertTrue(committed.committed());
    assertTrue(committed.sentiment().orElseThrow().isPositive());
    assertTrue(committed.errorKind().isEmpty());
    assertFalse(failed.committed());
    assertTrue(failed.sentiment().isEmpty());
    assertEquals(IntakeErrorKind.MODEL_UNAVAILABLE, failed.errorKind().orElseThrow());
  }
}
