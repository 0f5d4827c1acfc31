package com.rottenpotatoes.intake.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class YamlConfigLoaderTest {
  @TempDir Path tempDir;

  @Test
  void mergesCommonAndIntakeSectionsWithNestedKeys() throws Exception {
    Path file = tempDir.resolve("intake.yaml");
    Files.writeString(file, """
        common:
          store: sqlite
          recentLimit: 3
        intake:
          recentLimit: 8
          remoteSink:
            url: http://collector:9000/events
            timeoutMs: 500
        other:
          store: memory
        """);

    Map<String, String> values = YamlConfigLoader.load(file, YamlConfigLoader.INTAKE_SECTION).orElseThrow();

    assertEquals("sqlite", values.get("store"));
    assertEquals("8", values.get("recentLimit"));
    assertEquals("http://collector:9000/events", values.get("remoteSink.url"));
    assertEquals("500", values.get("remoteSink.timeoutMs"));
  }

  @Test
  void missingFileIsEmpty() throws Exception {
    assertTrue(YamlConfigLoader.load(tempDir.resolve("absent.yaml"), "intake").isEmpty());
  }

  @Test
  void listsAreRejected() throws Exception {
    Path file = tempDir.resolve("lists.yaml");
    Files.writeString(file, "intake:\n  modelRoot:\n    - a\n    - b\n");

    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(file, "intake"));
  }
}
