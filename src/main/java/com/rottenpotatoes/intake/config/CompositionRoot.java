package com.rottenpotatoes.intake.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.rottenpotatoes.intake.application.model.ActiveModel;
import com.rottenpotatoes.intake.application.model.ArtifactResolver;
import com.rottenpotatoes.intake.application.pipeline.CatalogQueries;
import com.rottenpotatoes.intake.application.pipeline.ReviewIngestionUseCase;
import com.rottenpotatoes.intake.application.pipeline.ScoreAggregator;
import com.rottenpotatoes.intake.application.port.ClockPort;
import com.rottenpotatoes.intake.application.port.EventEmitter;
import com.rottenpotatoes.intake.application.port.EventSink;
import com.rottenpotatoes.intake.application.port.MetricsPort;
import com.rottenpotatoes.intake.application.port.PersistencePort;
import com.rottenpotatoes.intake.application.seed.BootstrapSeeder;
import com.rottenpotatoes.intake.application.seed.SeedReport;
import com.rottenpotatoes.intake.infrastructure.events.FanOutEventEmitter;
import com.rottenpotatoes.intake.infrastructure.events.HttpEventSink;
import com.rottenpotatoes.intake.infrastructure.events.LoggingEventSink;
import com.rottenpotatoes.intake.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import com.rottenpotatoes.intake.infrastructure.model.AncestorVersionTagResolver;
import com.rottenpotatoes.intake.infrastructure.model.TfidfLogisticArtifactLoader;
import com.rottenpotatoes.intake.infrastructure.persistence.InMemoryReviewStore;
import com.rottenpotatoes.intake.infrastructure.persistence.jdbc.JdbcReviewStore;
import com.rottenpotatoes.intake.infrastructure.seed.JsonSeedDatasetSource;
import com.rottenpotatoes.intake.infrastructure.time.SystemClockAdapter;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Wires the intake use cases to concrete adapters for one process.
 * <p><strong>Why:</strong> Keeps adapter selection in one place so use cases only see ports.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Build the local and optional remote event sinks behind one emitter.</li>
 *   <li>Open the configured review store.</li>
 *   <li>Resolve the classifier artifact exactly once and publish it as an immutable {@link ActiveModel}.</li>
 *   <li>Seed the store on start when enabled.</li>
 *   <li>Close everything it opened.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Construct on one thread; the exposed use cases are then safe to share.</p>
 * <p><strong>Observability:</strong> Emits {@code model.*} and {@code seed.*} events during construction.</p>
 *
 * @since 0.1.0
 * @see ReviewIngestionUseCase
 * @see ScoreAggregator
 */
public final class CompositionRoot implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(CompositionRoot.class);

  private final IntakeConfig config;
  private final MetricsPort metrics;
  private final AutoCloseable ownedMetrics;
  private final ObjectMapper mapper = new ObjectMapper();
  private final FanOutEventEmitter events;
  private final PersistencePort store;
  private final ActiveModel model;
  private final BootstrapSeeder seeder;
  private final SeedReport startupSeed;
  private final ReviewIngestionUseCase ingestion;
  private final ScoreAggregator scores;
  private final CatalogQueries catalog;

  /**
   * Creates a root exporting metrics through OpenTelemetry.
   *
   * @param config validated configuration
   */
  public CompositionRoot(IntakeConfig config) {
    this(config, new OpenTelemetryMetricsAdapter(), new SystemClockAdapter());
  }

  /**
   * Creates a root with explicit metrics and clock adapters.
   *
   * @param config validated configuration
   * @param metrics metrics adapter; closed with this root when it is {@link AutoCloseable}
   * @param clock timestamp source for event envelopes
   */
  public CompositionRoot(IntakeConfig config, MetricsPort metrics, ClockPort clock) {
    this.config = Objects.requireNonNull(config, "config");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.ownedMetrics = metrics instanceof AutoCloseable closeable ? closeable : null;
    this.events = new FanOutEventEmitter(config.eventsLogger(), clock, metrics, sinks(config));
    try {
      this.store = openStore(config);
    } catch (RuntimeException ex) {
      events.close();
      throw ex;
    }
    this.model = resolveModel(config);
    this.seeder = new BootstrapSeeder(store, events, metrics);
    this.startupSeed = config.seedOnStart() ? seed() : null;
    this.ingestion = new ReviewIngestionUseCase(model, store, events, metrics);
    this.scores = new ScoreAggregator(store, events, metrics);
    this.catalog = new CatalogQueries(store, config.recentLimit());
  }

  public IntakeConfig config() {
    return config;
  }

  public ActiveModel model() {
    return model;
  }

  public EventEmitter events() {
    return events;
  }

  public ReviewIngestionUseCase ingestion() {
    return ingestion;
  }

  public ScoreAggregator scores() {
    return scores;
  }

  public CatalogQueries catalog() {
    return catalog;
  }

  /**
   * Returns the report of the seeding run performed during construction.
   *
   * @return report when {@code seedOnStart} was enabled
   */
  public Optional<SeedReport> startupSeed() {
    return Optional.ofNullable(startupSeed);
  }

  /**
   * Runs the seeder against the configured dataset.
   *
   * @return seeding report; a populated store yields {@link SeedReport.Outcome#SKIPPED}
   */
  public SeedReport seed() {
    return seeder.seed(new JsonSeedDatasetSource(config.seedDataset(), mapper));
  }

  @Override
  public void close() {
    events.close();
    try {
      store.close();
    } catch (RuntimeException ex) {
      log.warn("Failed to close review store", ex);
    }
    if (ownedMetrics != null) {
      try {
        ownedMetrics.close();
      } catch (Exception ex) {
        log.warn("Failed to close metrics adapter", ex);
      }
    }
  }

  private List<EventSink> sinks(IntakeConfig config) {
    List<EventSink> sinks = new ArrayList<>();
    sinks.add(new LoggingEventSink(config.eventsLogger()));
    config.remoteSink().ifPresent(url -> {
      sinks.add(new HttpEventSink(
          url, config.remoteSinkTimeout(), config.remoteSinkMaxInFlight(), metrics, mapper));
      log.info("Remote event sink enabled at {}", url);
    });
    return sinks;
  }

  private static PersistencePort openStore(IntakeConfig config) {
    return switch (config.store()) {
      case MEMORY -> new InMemoryReviewStore();
      case SQLITE -> JdbcReviewStore.open(config.sqlitePath());
    };
  }

  private ActiveModel resolveModel(IntakeConfig config) {
    ArtifactResolver resolver = new ArtifactResolver(
        config.modelMarker(),
        new TfidfLogisticArtifactLoader(config.modelMarker(), mapper),
        new AncestorVersionTagResolver(config.versionDepth()),
        events);
    return resolver.resolve(config.modelRoot());
  }
}
