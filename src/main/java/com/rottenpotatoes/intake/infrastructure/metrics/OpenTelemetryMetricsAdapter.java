package com.rottenpotatoes.intake.infrastructure.metrics;

import com.rottenpotatoes.intake.application.port.MetricsPort;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.LongHistogram;
import io.opentelemetry.api.metrics.Meter;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Forwards intake counters and observations to OpenTelemetry instruments.
 *
 * <p>Each key maps lazily to one instrument; the original key is attached as the
 * {@code intake.metric.key} attribute so sanitized names remain traceable.</p>
 *
 * @since 0.1.0
 */
public final class OpenTelemetryMetricsAdapter implements MetricsPort, AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(OpenTelemetryMetricsAdapter.class);
  private static final AttributeKey<String> METRIC_KEY_ATTRIBUTE = AttributeKey.stringKey("intake.metric.key");
  private static final String FALLBACK_METRIC_NAME = "intake.metric";
  private static final Pattern INVALID_CHARS = Pattern.compile("[^a-z0-9_.\\-]");

  private final OpenTelemetryBootstrap.BootstrapResult bootstrap;
  private final Meter meter;
  private final ConcurrentMap<String, Instrument<LongCounter>> counters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Instrument<LongHistogram>> histograms = new ConcurrentHashMap<>();

  /**
   * Creates an adapter wired to the environment-configured exporter.
   */
  public OpenTelemetryMetricsAdapter() {
    this(OpenTelemetryBootstrap.initialize());
  }

  OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.BootstrapResult bootstrap) {
    this.bootstrap = Objects.requireNonNull(bootstrap, "bootstrap");
    this.meter = bootstrap.meter();
    if (bootstrap.isNoop()) {
      log.debug("OpenTelemetry metrics adapter running in noop mode");
    }
  }

  @Override
  public void increment(String key) {
    Instrument<LongCounter> instrument = counters.computeIfAbsent(Objects.requireNonNull(key, "key"), k ->
        new Instrument<>(meter.counterBuilder(instrumentName(k))
            .setUnit("1")
            .setDescription("Intake counter for " + k)
            .build(), Attributes.of(METRIC_KEY_ATTRIBUTE, k)));
    instrument.handle().add(1, instrument.attributes());
  }

  @Override
  public void observe(String key, long value) {
    Instrument<LongHistogram> instrument = histograms.computeIfAbsent(Objects.requireNonNull(key, "key"), k ->
        new Instrument<>(meter.histogramBuilder(instrumentName(k))
            .ofLongs()
            .setDescription("Intake observation for " + k)
            .build(), Attributes.of(METRIC_KEY_ATTRIBUTE, k)));
    instrument.handle().record(value, instrument.attributes());
  }

  void forceFlush() {
    bootstrap.forceFlush();
  }

  @Override
  public void close() {
    bootstrap.close();
  }

  /**
   * Maps a metric key onto the OpenTelemetry instrument name grammar.
   *
   * @param key metric key such as {@code intake.submit.committed}
   * @return lower-case name starting with a letter; {@code intake.metric} for blank keys
   */
  static String instrumentName(String key) {
    if (key == null || key.isBlank()) {
      return FALLBACK_METRIC_NAME;
    }
    String name = INVALID_CHARS.matcher(key.trim().toLowerCase(Locale.ROOT)).replaceAll("_");
    if (!Character.isLetter(name.charAt(0))) {
      name = "m" + name;
    }
    if (!name.equals(key)) {
      log.debug("Sanitized metric name '{}' -> '{}'", key, name);
    }
    return name;
  }

  private record Instrument<T>(T handle, Attributes attributes) {}
}
