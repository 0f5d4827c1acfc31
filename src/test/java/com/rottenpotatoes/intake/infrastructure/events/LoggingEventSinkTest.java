package com.rottenpotatoes.intake.infrastructure.events;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.rottenpotatoes.intake.domain.events.EventLevel;
import com.rottenpotatoes.intake.domain.events.LogEvent;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

class LoggingEventSinkTest {
  private static final String LOGGER = "test.intake.events";

  private Logger logger;
  private ListAppender<ILoggingEvent> appender;

  @BeforeEach
  void setUp() {
    logger = (Logger) LoggerFactory.getLogger(LOGGER);
    logger.setLevel(Level.INFO);
    appender = new ListAppender<>();
    appender.start();
    logger.addAppender(appender);
  }

  @AfterEach
  void tearDown() {
    logger.detachAppender(appender);
    logger.setLevel(null);
    appender.stop();
  }

  @Test
  void writesMessageWithFieldsAtEventLevel() {
    Map<String, Object> fields = new LinkedHashMap<>();
    fields.put("event", "review.rejected");
    fields.put("movie_id", 3);
    LoggingEventSink sink = new LoggingEventSink(LOGGER);

    sink.write(event(EventLevel.ERROR, fields));

    assertEquals(1, appender.list.size());
    ILoggingEvent logged = appender.list.get(0);
    assertEquals(Level.ERROR, logged.getLevel());
    assertEquals("Review rejected event=review.rejected movie_id=3", logged.getFormattedMessage());
  }

  @Test
  void restoresCallerMdc() {
    LoggingEventSink sink = new LoggingEventSink(LOGGER);
    MDC.put("event", "outer");
    try {
      sink.write(event(EventLevel.INFO, Map.of("event", "inner", "movie_id", 1)));
      assertEquals("outer", MDC.get("event"));
      assertNull(MDC.get("movie_id"));
    } finally {
      MDC.remove("event");
    }
  }

  @Test
  void disabledLevelsAreSkipped() {
    new LoggingEventSink(LOGGER).write(event(EventLevel.DEBUG, Map.of("event", "score.computed")));

    assertTrue(appender.list.isEmpty());
  }

  @Test
  void rejectsInvalidLoggerName() {
    assertThrows(IllegalArgumentException.class, () -> new LoggingEventSink("bad logger"));
  }

  private static LogEvent event(EventLevel level, Map<String, Object> fields) {
    return new LogEvent(Instant.EPOCH, level, "Review rejected", LOGGER, fields);
  }
}
