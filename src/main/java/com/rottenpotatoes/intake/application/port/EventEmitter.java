package com.rottenpotatoes.intake.application.port;

import com.rottenpotatoes.intake.domain.events.EventLevel;
import java.util.Map;

/**
 * <strong>What:</strong> Port for emitting structured operational events from the intake use cases.
 * <p><strong>Why:</strong> Keeps business logic decoupled from event transports; observability must never
 * become a reliability dependency of the operations it instruments.</p>
 * <p><strong>Role:</strong> Outbound port implemented by the fan-out emitter.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be safe for concurrent invocations.</p>
 * <p><strong>Performance:</strong> Calls must not block beyond the local sink write.</p>
 *
 * @since 0.1.0
 */
public interface EventEmitter extends AutoCloseable {
  /**
   * Emits an event. Never throws because of sink failures.
   *
   * @param level severity; never {@code null}
   * @param message message; never {@code null}
   * @param fields additional context fields; may be {@code null}
   */
  void emit(EventLevel level, String message, Map<String, ?> fields);

  /**
   * Emits an {@link EventLevel#INFO} event.
   *
   * @param message message
   * @param fields context fields
   */
  default void info(String message, Map<String, ?> fields) {
    emit(EventLevel.INFO, message, fields);
  }

  /**
   * Emits an {@link EventLevel#ERROR} event.
   *
   * @param message message
   * @param fields context fields
   */
  default void error(String message, Map<String, ?> fields) {
    emit(EventLevel.ERROR, message, fields);
  }

  /**
   * Default no-op implementation for tests or disabled pipelines.
   */
  EventEmitter NO_OP = new EventEmitter() {
    @Override public void emit(EventLevel level, String message, Map<String, ?> fields) {}

    @Override public void close() {}
  };

  @Override
  default void close() {}
}
