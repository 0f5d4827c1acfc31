package com.rottenpotatoes.intake.infrastructure.events;

import com.rottenpotatoes.intake.application.port.EventSink;
import com.rottenpotatoes.intake.domain.events.LogEvent;
import com.rottenpotatoes.intake.validation.Strings;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.StringJoiner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Writes events to a named SLF4J logger, synchronously on the emitting thread.
 *
 * <p>Context fields are rendered as {@code key=value} pairs after the message and are also placed in the MDC
 * for the duration of the write; previous MDC values are restored afterwards.</p>
 *
 * @since 0.1.0
 */
public final class LoggingEventSink implements EventSink {
  private final Logger events;

  /**
   * @param loggerName SLF4J logger receiving events, e.g. {@code review-intake.events}
   */
  public LoggingEventSink(String loggerName) {
    this.events = LoggerFactory.getLogger(Strings.requireIdentifier("events.logger", loggerName));
  }

  @Override
  public Kind kind() {
    return Kind.LOCAL;
  }

  @Override
  public void write(LogEvent event) {
    Objects.requireNonNull(event, "event");
    if (!enabled(event)) {
      return;
    }
    Map<String, String> previous = new HashMap<>();
    StringJoiner rendered = new StringJoiner(" ");
    for (Map.Entry<String, Object> field : event.fields().entrySet()) {
      String value = String.valueOf(field.getValue());
      previous.put(field.getKey(), MDC.get(field.getKey()));
      MDC.put(field.getKey(), value);
      rendered.add(field.getKey() + "=" + value);
    }
    try {
      log(event, rendered.toString());
    } finally {
      for (Map.Entry<String, String> entry : previous.entrySet()) {
        if (entry.getValue() == null) {
          MDC.remove(entry.getKey());
        } else {
          MDC.put(entry.getKey(), entry.getValue());
        }
      }
    }
  }

  private boolean enabled(LogEvent event) {
    return switch (event.level()) {
      case DEBUG -> events.isDebugEnabled();
      case INFO -> events.isInfoEnabled();
      case WARN -> events.isWarnEnabled();
      case ERROR -> events.isErrorEnabled();
    };
  }

  private void log(LogEvent event, String fields) {
    switch (event.level()) {
      case DEBUG -> events.debug("{} {}", event.message(), fields);
      case INFO -> events.info("{} {}", event.message(), fields);
      case WARN -> events.warn("{} {}", event.message(), fields);
      case ERROR -> events.error("{} {}", event.message(), fields);
      default -> throw new IllegalStateException("Unhandled level " + event.level());
    }
  }
}
