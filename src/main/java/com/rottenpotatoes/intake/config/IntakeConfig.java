package com.rottenpotatoes.intake.config;

import com.rottenpotatoes.intake.infrastructure.model.AncestorVersionTagResolver;
import com.rottenpotatoes.intake.infrastructure.seed.JsonSeedDatasetSource;
import com.rottenpotatoes.intake.validation.Net;
import com.rottenpotatoes.intake.validation.Numbers;
import com.rottenpotatoes.intake.validation.Strings;
import java.net.URI;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Immutable settings for one intake process.
 * <p><strong>Why:</strong> Keeps adapters free of string parsing; every knob is validated once at startup.</p>
 * <p><strong>Role:</strong> Configuration aggregate consumed by {@link CompositionRoot}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Publish the built-in defaults as a flat map for {@link ConfigMerger}.</li>
 *   <li>Parse and range-check merged key/value settings.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable; safe for concurrent reads.</p>
 *
 * @param modelRoot directory searched for the classifier artifact
 * @param modelMarker marker file naming the artifact directory
 * @param versionDepth ancestor levels above the artifact directory naming its version
 * @param store review store implementation
 * @param sqlitePath database file used when {@code store} is {@link StoreKind#SQLITE}
 * @param seedDataset seed dataset location ({@code classpath:} prefix or filesystem path)
 * @param seedOnStart whether the seeder runs during startup
 * @param remoteSinkUrl remote search-index endpoint; {@code null} disables the remote sink
 * @param remoteSinkTimeout per-request bound for the remote sink
 * @param remoteSinkMaxInFlight outstanding remote requests before events are dropped
 * @param eventsLogger SLF4J logger name of the local sink and envelope logger identity
 * @param recentLimit default number of reviews returned by recent-review queries
 * @since 0.1.0
 */
public record IntakeConfig(
    Path modelRoot,
    String modelMarker,
    int versionDepth,
    StoreKind store,
    Path sqlitePath,
    String seedDataset,
    boolean seedOnStart,
    URI remoteSinkUrl,
    Duration remoteSinkTimeout,
    int remoteSinkMaxInFlight,
    String eventsLogger,
    int recentLimit) {

  public static final String MODEL_ROOT = "modelRoot";
  public static final String MODEL_MARKER = "modelMarker";
  public static final String VERSION_DEPTH = "versionDepth";
  public static final String STORE = "store";
  public static final String SQLITE_PATH = "sqlitePath";
  public static final String SEED_DATASET = "seedDataset";
  public static final String SEED_ON_START = "seedOnStart";
  public static final String REMOTE_SINK_URL = "remoteSink.url";
  public static final String REMOTE_SINK_TIMEOUT_MS = "remoteSink.timeoutMs";
  public static final String REMOTE_SINK_MAX_IN_FLIGHT = "remoteSink.maxInFlight";
  public static final String EVENTS_LOGGER = "events.logger";
  public static final String RECENT_LIMIT = "recentLimit";

  private static final Map<String, String> DEFAULTS = buildDefaults();

  public IntakeConfig {
    Objects.requireNonNull(modelRoot, "modelRoot");
    modelMarker = Strings.requireNonBlank(MODEL_MARKER, modelMarker);
    Numbers.requireRange(VERSION_DEPTH, versionDepth, 0, AncestorVersionTagResolver.MAX_DEPTH);
    Objects.requireNonNull(store, "store");
    Objects.requireNonNull(sqlitePath, "sqlitePath");
    seedDataset = Strings.requireNonBlank(SEED_DATASET, seedDataset);
    Objects.requireNonNull(remoteSinkTimeout, "remoteSinkTimeout");
    Numbers.requireRange(REMOTE_SINK_TIMEOUT_MS, remoteSinkTimeout.toMillis(), 50, 30_000);
    Numbers.requireRange(REMOTE_SINK_MAX_IN_FLIGHT, remoteSinkMaxInFlight, 1, 10_000);
    eventsLogger = Strings.requireIdentifier(EVENTS_LOGGER, eventsLogger);
    Numbers.requireRange(RECENT_LIMIT, recentLimit, 1, 100);
  }

  /**
   * Returns the built-in configuration.
   *
   * @return defaults: memory store, bundled seed data, remote sink disabled
   */
  public static IntakeConfig defaults() {
    return fromMap(DEFAULTS);
  }

  /**
   * Returns the built-in defaults as flat string pairs, the lowest-precedence layer of {@link ConfigMerger}.
   *
   * @return unmodifiable defaults map
   */
  public static Map<String, String> defaultsAsMap() {
    return DEFAULTS;
  }

  /**
   * Builds a configuration from flat key/value pairs. Missing keys take their defaults; unknown keys are
   * ignored so command arguments may share the map.
   *
   * @param values merged settings; must not be {@code null}
   * @return validated configuration
   * @throws IllegalArgumentException if any value is malformed or out of range
   */
  public static IntakeConfig fromMap(Map<String, String> values) {
    Objects.requireNonNull(values, "values");
    String remote = value(values, REMOTE_SINK_URL);
    return new IntakeConfig(
        path(MODEL_ROOT, value(values, MODEL_ROOT)),
        value(values, MODEL_MARKER),
        Numbers.parseInt(VERSION_DEPTH, value(values, VERSION_DEPTH), 2, 0, AncestorVersionTagResolver.MAX_DEPTH),
        StoreKind.fromString(value(values, STORE)),
        path(SQLITE_PATH, value(values, SQLITE_PATH)),
        value(values, SEED_DATASET),
        bool(SEED_ON_START, value(values, SEED_ON_START)),
        remote == null || remote.isBlank() ? null : Net.validateHttpEndpoint(REMOTE_SINK_URL, remote),
        Duration.ofMillis(Numbers.parseInt(REMOTE_SINK_TIMEOUT_MS, value(values, REMOTE_SINK_TIMEOUT_MS), 1000, 50, 30_000)),
        Numbers.parseInt(REMOTE_SINK_MAX_IN_FLIGHT, value(values, REMOTE_SINK_MAX_IN_FLIGHT), 64, 1, 10_000),
        value(values, EVENTS_LOGGER),
        Numbers.parseInt(RECENT_LIMIT, value(values, RECENT_LIMIT), 5, 1, 100));
  }

  public Optional<URI> remoteSink() {
    return Optional.ofNullable(remoteSinkUrl);
  }

  private static String value(Map<String, String> values, String key) {
    String value = values.get(key);
    if (value == null || value.isBlank()) {
      return DEFAULTS.get(key);
    }
    return value.trim();
  }

  private static Path path(String key, String raw) {
    try {
      return Path.of(Strings.requireNonBlank(key, raw));
    } catch (InvalidPathException ex) {
      throw new IllegalArgumentException(key + " is not a valid path: " + ex.getMessage(), ex);
    }
  }

  private static boolean bool(String key, String raw) {
    String normalized = raw == null ? "" : raw.trim().toLowerCase(Locale.ROOT);
    return switch (normalized) {
      case "true", "yes", "1" -> true;
      case "false", "no", "0" -> false;
      default -> throw new IllegalArgumentException(key + " must be true or false (was " + raw + ")");
    };
  }

  private static Map<String, String> buildDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put(MODEL_ROOT, "mlruns");
    map.put(MODEL_MARKER, "model.json");
    map.put(VERSION_DEPTH, "2");
    map.put(STORE, "memory");
    map.put(SQLITE_PATH, "data/reviews.db");
    map.put(SEED_DATASET, JsonSeedDatasetSource.CLASSPATH_PREFIX + "/seed/movies.json");
    map.put(SEED_ON_START, "true");
    map.put(REMOTE_SINK_URL, "");
    map.put(REMOTE_SINK_TIMEOUT_MS, "1000");
    map.put(REMOTE_SINK_MAX_IN_FLIGHT, "64");
    map.put(EVENTS_LOGGER, "review-intake.events");
    map.put(RECENT_LIMIT, "5");
    return Collections.unmodifiableMap(map);
  }
}
