package com.rottenpotatoes.intake.application.seed;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.rottenpotatoes.intake.application.port.SeedDatasetSource;
import com.rottenpotatoes.intake.domain.review.IntakeErrorKind;
import com.rottenpotatoes.intake.domain.review.Movie;
import com.rottenpotatoes.intake.domain.review.ReviewDraft;
import com.rottenpotatoes.intake.domain.review.SeedDataset;
import com.rottenpotatoes.intake.infrastructure.persistence.InMemoryReviewStore;
import com.rottenpotatoes.intake.infrastructure.persistence.jdbc.JdbcReviewStore;
import com.rottenpotatoes.intake.support.RecordingEventEmitter;
import com.rottenpotatoes.intake.support.RecordingMetricsPort;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class BootstrapSeederTest {
  private final InMemoryReviewStore store = new InMemoryReviewStore();
  private final RecordingEventEmitter events = new RecordingEventEmitter();
  private final RecordingMetricsPort metrics = new RecordingMetricsPort();
  private final BootstrapSeeder seeder = new BootstrapSeeder(store, events, metrics);

  @Test
  void seedsEmptyStoreOnceThenSkips() {
    SeedDatasetSource source = source(new SeedDataset(
        List.of(new Movie(1, "Inception", "dreams"), new Movie(2, "Cats", "cats")),
        List.of(new ReviewDraft(1, "Mind-bending", true), new ReviewDraft(2, "Why", false))));

    SeedReport first = seeder.seed(source);
    SeedReport second = seeder.seed(source);

    assertEquals(SeedReport.Outcome.SEEDED, first.outcome());
    assertEquals(2, first.movies());
    assertEquals(2, first.reviews());
    assertEquals(SeedReport.Outcome.SKIPPED, second.outcome());
    assertEquals(2, store.listMovies().size());
    assertEquals(1, store.countReviews(1));
    assertEquals(1, events.named("seed.completed").size());
    assertEquals(1, events.named("seed.skipped").size());
    assertEquals(List.of(2L), metrics.observed("seed.movies"));
  }

  @Test
  void sqliteStoreWithSubmittedReviewsIsSkipped(@TempDir Path tempDir) {
    JdbcReviewStore sqlite = JdbcReviewStore.open(tempDir.resolve("intake.db"));
    sqlite.createReview(1, "user review", true);
    BootstrapSeeder sqliteSeeder = new BootstrapSeeder(sqlite, events, metrics);

    SeedReport report = sqliteSeeder.seed(source(new SeedDataset(
        List.of(new Movie(1, "Inception", "dreams")),
        List.of(new ReviewDraft(1, "Mind-bending", true)))));

    assertEquals(SeedReport.Outcome.SKIPPED, report.outcome());
    assertTrue(sqlite.listMovies().isEmpty());
    assertEquals(1, sqlite.countReviews(1));
    assertEquals(1, events.named("seed.skipped").size());
  }

  @Test
  void reviewOnlyDatasetIsWrittenOnce() {
    SeedDatasetSource source = source(new SeedDataset(List.of(), List.of(new ReviewDraft(1, "Lonely", false))));

    SeedReport first = seeder.seed(source);
    SeedReport second = seeder.seed(source);

    assertEquals(SeedReport.Outcome.SEEDED, first.outcome());
    assertEquals(SeedReport.Outcome.SKIPPED, second.outcome());
    assertEquals(1, store.countReviews(1));
  }

  @Test
  void unreadableDatasetReportsFailure() {
    SeedDatasetSource source = new SeedDatasetSource() {
      @Override
      public SeedDataset load() throws IOException {
        throw new IOException("malformed seed dataset broken.json");
      }

      @Override
      public String describe() {
        return "broken.json";
      }
    };

    SeedReport report = seeder.seed(source);

    assertEquals(SeedReport.Outcome.FAILED, report.outcome());
    assertEquals(IntakeErrorKind.SEEDING_FAILED, report.errorKind().orElseThrow());
    assertTrue(report.detail().contains("broken.json"));
    assertTrue(store.listMovies().isEmpty());
    assertEquals(1, events.named("seed.failed").size());
  }

  private static SeedDatasetSource source(SeedDataset dataset) {
    return new SeedDatasetSource() {
      @Override
      public SeedDataset load() {
        return dataset;
      }

      @Override
      public String describe() {
        return "inline";
      }
    };
  }
}
