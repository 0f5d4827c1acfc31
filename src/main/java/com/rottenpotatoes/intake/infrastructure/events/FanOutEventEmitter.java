package com.rottenpotatoes.intake.infrastructure.events;

import com.rottenpotatoes.intake.application.port.ClockPort;
import com.rottenpotatoes.intake.application.port.EventEmitter;
import com.rottenpotatoes.intake.application.port.EventSink;
import com.rottenpotatoes.intake.application.port.MetricsPort;
import com.rottenpotatoes.intake.domain.events.EventLevel;
import com.rottenpotatoes.intake.domain.events.LogEvent;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link EventEmitter} that stamps an envelope and hands each event to every sink in order.
 * <p><strong>Why:</strong> Local and remote sinks are independent failure domains; neither may fail the
 * operation that emitted the event.</p>
 * <p><strong>Thread-safety:</strong> Immutable sink list; safe for concurrent emitters. Ordering per emitting
 * thread follows the local sink's own ordering.</p>
 * <p><strong>Observability:</strong> A sink that throws increments {@code events.<kind>.failed}.</p>
 *
 * @since 0.1.0
 */
public final class FanOutEventEmitter implements EventEmitter {
  private static final Logger log = LoggerFactory.getLogger(FanOutEventEmitter.class);

  private final String loggerName;
  private final ClockPort clock;
  private final MetricsPort metrics;
  private final List<EventSink> sinks;

  /**
   * @param loggerName logger identity written into each envelope
   * @param clock timestamp source
   * @param metrics metrics sink; {@code null} falls back to {@link MetricsPort#NO_OP}
   * @param sinks destinations, written in list order
   */
  public FanOutEventEmitter(String loggerName, ClockPort clock, MetricsPort metrics, List<EventSink> sinks) {
    this.loggerName = Objects.requireNonNull(loggerName, "loggerName");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
    this.sinks = List.copyOf(Objects.requireNonNull(sinks, "sinks"));
  }

  @Override
  public void emit(EventLevel level, String message, Map<String, ?> fields) {
    LogEvent event;
    try {
      event = new LogEvent(
          Instant.ofEpochMilli(clock.nowMillis()), level, String.valueOf(message), loggerName,
          fields == null ? Map.<String, Object>of() : new LinkedHashMap<String, Object>(fields));
    } catch (RuntimeException ex) {
      log.warn("Dropping malformed event '{}'", message, ex);
      return;
    }
    for (EventSink sink : sinks) {
      try {
        sink.write(event);
      } catch (RuntimeException ex) {
        metrics.increment("events." + sink.kind().name().toLowerCase(Locale.ROOT) + ".failed");
        log.warn("{} event sink failed for '{}'", sink.kind(), event.message(), ex);
      }
    }
  }

  public List<EventSink> sinks() {
    return sinks;
  }

  @Override
  public void close() {
    for (EventSink sink : sinks) {
      try {
        sink.close();
      } catch (Exception ex) {
        log.warn("Failed to close {} event sink", sink.kind(), ex);
      }
    }
  }
}
