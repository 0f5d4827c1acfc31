package com.rottenpotatoes.intake.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.rottenpotatoes.intake.application.seed.SeedReport;
import com.rottenpotatoes.intake.domain.review.SubmissionResult;
import com.rottenpotatoes.intake.infrastructure.events.FanOutEventEmitter;
import com.rottenpotatoes.intake.infrastructure.events.HttpEventSink;
import com.rottenpotatoes.intake.infrastructure.events.LoggingEventSink;
import com.rottenpotatoes.intake.support.ModelFixtures;
import com.rottenpotatoes.intake.support.RecordingMetricsPort;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CompositionRootTest {
  @TempDir Path tempDir;

  private final RecordingMetricsPort metrics = new RecordingMetricsPort();

  @Test
  void wiresSeededStoreAndLoadedModel() {
    ModelFixtures.writeModel(tempDir.resolve("mlruns"), "0", "run-42");

    try (CompositionRoot root = new CompositionRoot(config(Map.of()), metrics, () -> 0L)) {
      assertTrue(root.model().loaded());
      assertEquals("run-42", root.model().versionTag());
      assertEquals(SeedReport.Outcome.SEEDED, root.startupSeed().orElseThrow().outcome());
      assertEquals(5, root.catalog().movies().size());

      int before = root.scores().score(1).totalReviews();
      SubmissionResult result = root.ingestion().submit(1, "great and loved");

      assertTrue(result.committed());
      assertEquals(before + 1, root.scores().score(1).totalReviews());
      assertEquals(SeedReport.Outcome.SKIPPED, root.seed().outcome());
    }
  }

  @Test
  void missingModelLeavesServiceUsable() {
    try (CompositionRoot root = new CompositionRoot(config(Map.of("seedOnStart", "false")), metrics, () -> 0L)) {
      assertFalse(root.model().loaded());
      assertTrue(root.startupSeed().isEmpty());
      assertTrue(root.catalog().movies().isEmpty());
      assertFalse(root.ingestion().submit(1, "great").committed());
      assertEquals(0, root.scores().score(1).totalReviews());
    }
  }

  @Test
  void remoteSinkIsAddedWhenConfigured() {
    Map<String, String> overrides = Map.of("remoteSink.url", "http://127.0.0.1:9/events", "seedOnStart", "false");
    try (CompositionRoot root = new CompositionRoot(config(overrides), metrics, () -> 0L)) {
      FanOutEventEmitter events = assertInstanceOf(FanOutEventEmitter.class, root.events());
      assertEquals(2, events.sinks().size());
      assertInstanceOf(LoggingEventSink.class, events.sinks().get(0));
      assertInstanceOf(HttpEventSink.class, events.sinks().get(1));
    }
  }

  private IntakeConfig config(Map<String, String> overrides) {
    Map<String, String> values = new HashMap<>();
    values.put(IntakeConfig.MODEL_ROOT, tempDir.resolve("mlruns").toString());
    values.putAll(overrides);
    return IntakeConfig.fromMap(values);
  }
}
