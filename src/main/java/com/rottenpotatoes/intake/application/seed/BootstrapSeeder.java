package com.rottenpotatoes.intake.application.seed;

import com.rottenpotatoes.intake.application.port.EventEmitter;
import com.rottenpotatoes.intake.application.port.MetricsPort;
import com.rottenpotatoes.intake.application.port.PersistencePort;
import com.rottenpotatoes.intake.application.port.SeedDatasetSource;
import com.rottenpotatoes.intake.domain.events.EventLevel;
import com.rottenpotatoes.intake.domain.review.SeedDataset;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Populates an empty review store from a static dataset at process start.
 * <p><strong>Why:</strong> Gives a fresh deployment a browsable catalog without a separate migration step.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Write movies and reviews in one store transaction, only when the store holds no movies and no reviews.</li>
 *   <li>Map a missing or malformed dataset to {@link SeedReport.Outcome#FAILED}; never throw.</li>
 * </ul>
 * <p><strong>Observability:</strong> Events {@code seed.completed}, {@code seed.skipped}, {@code seed.failed};
 * observations {@code seed.movies} and {@code seed.reviews}.</p>
 *
 * @since 0.1.0
 */
public final class BootstrapSeeder {
  private static final Logger log = LoggerFactory.getLogger(BootstrapSeeder.class);

  private final PersistencePort persistence;
  private final EventEmitter events;
  private final MetricsPort metrics;

  public BootstrapSeeder(PersistencePort persistence, EventEmitter events, MetricsPort metrics) {
    this.persistence = Objects.requireNonNull(persistence, "persistence");
    this.events = Objects.requireNonNull(events, "events");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Seeds the store when it is empty. Running it again against a populated store is a no-op.
   *
   * @param source dataset source
   * @return seeding report; never {@code null}
   */
  public SeedReport seed(SeedDatasetSource source) {
    Objects.requireNonNull(source, "source");
    String description = source.describe();
    SeedDataset dataset;
    try {
      dataset = source.load();
    } catch (IOException | RuntimeException ex) {
      log.debug("Seed dataset {} could not be loaded", description, ex);
      return failed("dataset " + description + " unavailable or malformed: " + ex.getMessage());
    }

    boolean written;
    try {
      written = persistence.seedIfEmpty(dataset.movies(), dataset.reviews());
    } catch (RuntimeException ex) {
      log.debug("Seeding store from {} failed", description, ex);
      return failed("store rejected dataset " + description + ": " + ex.getMessage());
    }

    if (!written) {
      Map<String, Object> fields = new LinkedHashMap<>();
      fields.put("event", "seed.skipped");
      fields.put("source", description);
      events.emit(EventLevel.INFO, "Seed skipped; store not empty", fields);
      return SeedReport.skipped(description);
    }

    int movies = dataset.movies().size();
    int reviews = dataset.reviews().size();
    metrics.observe("seed.movies", movies);
    metrics.observe("seed.reviews", reviews);
    Map<String, Object> fields = new LinkedHashMap<>();
    fields.put("event", "seed.completed");
    fields.put("source", description);
    fields.put("movies", movies);
    fields.put("reviews", reviews);
    events.info("Seed data loaded", fields);
    return SeedReport.seeded(movies, reviews, description);
  }

  private SeedReport failed(String reason) {
    Map<String, Object> fields = new LinkedHashMap<>();
    fields.put("event", "seed.failed");
    fields.put("reason", reason);
    events.error("Seeding failed", fields);
    return SeedReport.failed(reason);
  }
}
