package com.rottenpotatoes.intake.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

class IntakeConfigTest {

  @Test
  void defaultsDescribeLocalDevelopmentSetup() {
    IntakeConfig config = IntakeConfig.defaults();

    assertEquals(Path.of("mlruns"), config.modelRoot());
    assertEquals("model.json", config.modelMarker());
    assertEquals(2, config.versionDepth());
    assertEquals(StoreKind.MEMORY, config.store());
    assertTrue(config.seedOnStart());
    assertTrue(config.remoteSink().isEmpty());
    assertEquals(Duration.ofSeconds(1), config.remoteSinkTimeout());
    assertEquals("review-intake.events", config.eventsLogger());
    assertEquals(5, config.recentLimit());
  }

  @Test
  void overridesAreParsedAndBlankValuesFallBack() {
    Map<String, String> values = new HashMap<>();
    values.put("store", "SQLite");
    values.put("sqlitePath", "/tmp/r.db");
    values.put("seedOnStart", "no");
    values.put("remoteSink.url", "http://collector:9000/events");
    values.put("recentLimit", " ");
    values.put("unrelated", "ignored");

    IntakeConfig config = IntakeConfig.fromMap(values);

    assertEquals(StoreKind.SQLITE, config.store());
    assertEquals(Path.of("/tmp/r.db"), config.sqlitePath());
    assertFalse(config.seedOnStart());
    assertEquals(9000, config.remoteSink().orElseThrow().getPort());
    assertEquals(5, config.recentLimit());
  }

  @Test
  void invalidValuesAreRejected() {
    assertThrows(IllegalArgumentException.class, () -> IntakeConfig.fromMap(Map.of("store", "redis")));
    assertThrows(IllegalArgumentException.class, () -> IntakeConfig.fromMap(Map.of("seedOnStart", "maybe")));
    assertThrows(IllegalArgumentException.class, () -> IntakeConfig.fromMap(Map.of("versionDepth", "17")));
    assertThrows(IllegalArgumentException.class, () -> IntakeConfig.fromMap(Map.of("remoteSink.url", "tcp://x")));
    assertThrows(IllegalArgumentException.class, () -> IntakeConfig.fromMap(Map.of("remoteSink.timeoutMs", "10")));
    assertThrows(IllegalArgumentException.class, () -> IntakeConfig.fromMap(Map.of("events.logger", "a b")));
  }
}
