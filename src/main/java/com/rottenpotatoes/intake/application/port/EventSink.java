package com.rottenpotatoes.intake.application.port;

import com.rottenpotatoes.intake.domain.events.LogEvent;

/**
 * <strong>What:</strong> Destination for structured {@link LogEvent}s.
 * <p><strong>Why:</strong> Lets the emitter fan out to a local and a remote destination that are
 * independently swappable in tests.</p>
 * <p><strong>Role:</strong> Outbound port implemented by the logging sink and the search-index sink.</p>
 * <p><strong>Thread-safety:</strong> Implementations must accept concurrent writes.</p>
 *
 * @since 0.1.0
 */
public interface EventSink extends AutoCloseable {
  /**
   * Sink categories with distinct delivery guarantees.
   */
  enum Kind {
    /** Synchronous, ordered per emitting thread. */
    LOCAL,
    /** Best-effort, time-bounded, at-most-once. */
    REMOTE
  }

  /**
   * Returns the delivery category of this sink.
   *
   * @return sink kind
   */
  Kind kind();

  /**
   * Delivers an event.
   *
   * @param event event to deliver; never {@code null}
   */
  void write(LogEvent event);

  /**
   * Releases sink resources, waiting a bounded time for pending deliveries.
   */
  @Override
  default void close() {}
}
