package com.rottenpotatoes.intake.infrastructure.events;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.rottenpotatoes.intake.application.port.EventSink;
import com.rottenpotatoes.intake.domain.events.EventLevel;
import com.rottenpotatoes.intake.domain.events.LogEvent;
import com.rottenpotatoes.intake.support.RecordingMetricsPort;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class FanOutEventEmitterTest {
  private static final long NOW = Instant.parse("2024-03-01T10:00:00Z").toEpochMilli();

  private final RecordingMetricsPort metrics = new RecordingMetricsPort();

  @Test
  void failingSinkDoesNotStopOtherSinks() {
    InMemoryEventSink local = new InMemoryEventSink();
    FanOutEventEmitter emitter = new FanOutEventEmitter(
        "review-intake.events", () -> NOW, metrics, List.of(new ThrowingSink(), local));

    emitter.info("Review submitted", Map.of("event", "review.committed"));

    assertEquals(1, local.snapshot().size());
    assertEquals(1, metrics.count("events.remote.failed"));
  }

  @Test
  void envelopeUsesClockAndLoggerName() {
    InMemoryEventSink local = new InMemoryEventSink();
    FanOutEventEmitter emitter = new FanOutEventEmitter("review-intake.events", () -> NOW, metrics, List.of(local));
    Map<String, Object> fields = new HashMap<>();
    fields.put("level", "caller");
    fields.put("detail", null);

    emitter.error("Review rejected", fields);

    LogEvent event = local.snapshot().get(0);
    assertEquals(Instant.ofEpochMilli(NOW), event.timestamp());
    assertEquals(EventLevel.ERROR, event.level());
    assertEquals("review-intake.events", event.logger());
    assertEquals("caller", event.fields().get("ctx_level"));
    assertTrue(event.fields().containsKey("detail"));
    assertNull(event.fields().get("detail"));
  }

  @Test
  void closeClosesEverySink() {
    ThrowingSink remote = new ThrowingSink();
    InMemoryEventSink local = new InMemoryEventSink();
    FanOutEventEmitter emitter = new FanOutEventEmitter("events", () -> NOW, metrics, List.of(remote, local));

    emitter.close();

    assertTrue(remote.closed);
    assertEquals(2, emitter.sinks().size());
  }

  private static final class ThrowingSink implements EventSink {
    private boolean closed;

    @Override
    public Kind kind() {
      return Kind.REMOTE;
    }

    @Override
    public void write(LogEvent event) {
      throw new IllegalStateException("collector down");
    }

    @Override
    public void close() {
      closed = true;
    }
  }
}
