package com.rottenpotatoes.intake.infrastructure.events;

import com.rottenpotatoes.intake.application.port.EventSink;
import com.rottenpotatoes.intake.domain.events.LogEvent;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-memory sink used for tests and diagnostics.
 *
 * @since 0.1.0
 */
public final class InMemoryEventSink implements EventSink {
  private final CopyOnWriteArrayList<LogEvent> events = new CopyOnWriteArrayList<>();
  private final Kind kind;

  public InMemoryEventSink() {
    this(Kind.LOCAL);
  }

  public InMemoryEventSink(Kind kind) {
    this.kind = Objects.requireNonNull(kind, "kind");
  }

  @Override
  public Kind kind() {
    return kind;
  }

  @Override
  public void write(LogEvent event) {
    events.add(Objects.requireNonNull(event, "event"));
  }

  /**
   * Returns a snapshot of written events.
   *
   * @return immutable list of events
   */
  public List<LogEvent> snapshot() {
    return List.copyOf(events);
  }

  public void clear() {
    events.clear();
  }
}
