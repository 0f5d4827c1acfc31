package com.rottenpotatoes.intake.application.model;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.rottenpotatoes.intake.application.port.ArtifactLoadException;
import com.rottenpotatoes.intake.application.port.ArtifactLoader;
import com.rottenpotatoes.intake.application.port.ClassifierPort;
import com.rottenpotatoes.intake.domain.model.Prediction;
import com.rottenpotatoes.intake.support.ModelFixtures;
import com.rottenpotatoes.intake.support.RecordingEventEmitter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ArtifactResolverTest {
  private static final ClassifierPort FIXED = text -> Prediction.of("positive");

  @TempDir Path tempDir;

  @Test
  void resolvesFirstArtifactInSortedOrderAndTagsVersion() throws Exception {
    Path later = ModelFixtures.writeModel(tempDir, "0", "run-b");
    Path earlier = ModelFixtures.writeModel(tempDir, "0", "run-a");
    List<Path> loaded = new ArrayList<>();
    ArtifactLoader loader = dir -> {
      loaded.add(dir);
      return FIXED;
    };
    RecordingEventEmitter events = new RecordingEventEmitter();
    ArtifactResolver resolver = new ArtifactResolver(
        ModelFixtures.MARKER, loader, dir -> dir.getParent().getParent().getFileName().toString(), events);

    ActiveModel model = resolver.resolve(tempDir);

    assertTrue(model.loaded());
    assertSame(FIXED, model.classifier());
    assertEquals("run-a", model.versionTag());
    assertEquals(earlier, model.location());
    assertEquals(List.of(earlier), loaded);
    assertTrue(Files.exists(later));
    assertEquals(1, events.events().size());
    assertEquals("model.resolved", events.events().get(0).fields().get("event"));
    assertEquals("run-a", events.events().get(0).fields().get("model_version"));
  }

  @Test
  void missingRootYieldsUnavailableModelWithOneEvent() {
    RecordingEventEmitter events = new RecordingEventEmitter();
    ArtifactResolver resolver = new ArtifactResolver(ModelFixtures.MARKER, dir -> FIXED, dir -> "v", events);

    ActiveModel model = resolver.resolve(tempDir.resolve("absent"));

    assertFalse(model.loaded());
    assertEquals("unknown", model.versionTag());
    assertTrue(model.locationIfLoaded().isEmpty());
    assertEquals(1, events.named("model.unavailable").size());
    assertEquals(1, events.events().size());
  }

  @Test
  void loaderFailureDegradesInsteadOfThrowing() throws Exception {
    ModelFixtures.writeModel(tempDir, "0", "run-a");
    RecordingEventEmitter events = new RecordingEventEmitter();
    ArtifactLoader broken = dir -> {
      throw new ArtifactLoadException("truncated artifact");
    };
    ArtifactResolver resolver = new ArtifactResolver(ModelFixtures.MARKER, broken, dir -> "v", events);

    ActiveModel model = resolver.resolve(tempDir);

    assertFalse(model.loaded());
    assertEquals(1, events.events().size());
    String reason = (String) events.events().get(0).fields().get("reason");
    assertTrue(reason.contains("truncated artifact"), reason);
  }

  @Test
  void blankVersionTagFallsBackToUnknown() {
    ModelFixtures.writeModel(tempDir, "0", "run-a");
    ArtifactResolver resolver = new ArtifactResolver(ModelFixtures.MARKER, dir -> FIXED, dir -> " ", null);

    assertEquals("unknown", resolver.resolve(tempDir).versionTag());
  }

  @Test
  void markerDirectlyUnderRootIsFound() throws Exception {
    Files.writeString(tempDir.resolve(ModelFixtures.MARKER), "{}");
    ArtifactResolver resolver = new ArtifactResolver(ModelFixtures.MARKER, dir -> FIXED, dir -> "v", null);

    assertEquals(tempDir, resolver.locate(tempDir).orElseThrow());
  }
}
