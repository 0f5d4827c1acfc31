package com.rottenpotatoes.intake.application.model;

import com.rottenpotatoes.intake.application.port.ArtifactLoadException;
import com.rottenpotatoes.intake.application.port.ArtifactLoader;
import com.rottenpotatoes.intake.application.port.ClassifierPort;
import com.rottenpotatoes.intake.application.port.EventEmitter;
import com.rottenpotatoes.intake.application.port.VersionTagResolver;
import com.rottenpotatoes.intake.validation.Strings;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Locates the active classifier artifact on a filesystem tree and loads it.
 * <p><strong>Why:</strong> The training job drops artifacts into a versioned directory tree; the service must
 * find one at startup without knowing the exact layout.</p>
 * <p><strong>Role:</strong> Startup use case producing the immutable {@link ActiveModel}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Depth-first search for the marker file; a directory's own files are checked before its
 *   subdirectories, which are visited in lexical order. Symbolic links are not followed.</li>
 *   <li>Load the artifact through the {@link ArtifactLoader} and derive a version tag.</li>
 *   <li>Fall back to a degraded model instead of failing process start.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Run once on the startup thread before requests are served.</p>
 * <p><strong>Observability:</strong> Emits exactly one event per {@link #resolve(Path)} call:
 * {@code model.resolved} or {@code model.unavailable}.</p>
 *
 * @since 0.1.0
 */
public final class ArtifactResolver {
  private static final Logger log = LoggerFactory.getLogger(ArtifactResolver.class);

  private final String markerFileName;
  private final ArtifactLoader loader;
  private final VersionTagResolver versions;
  private final EventEmitter events;

  /**
   * Creates a resolver.
   *
   * @param markerFileName file name identifying an artifact directory (e.g., {@code model.json})
   * @param loader loader invoked on the located directory
   * @param versions version tag resolver
   * @param events event emitter; {@code null} falls back to {@link EventEmitter#NO_OP}
   */
  public ArtifactResolver(
      String markerFileName, ArtifactLoader loader, VersionTagResolver versions, EventEmitter events) {
    this.markerFileName = Strings.requireNonBlank("markerFileName", markerFileName);
    this.loader = Objects.requireNonNull(loader, "loader");
    this.versions = Objects.requireNonNull(versions, "versions");
    this.events = events == null ? EventEmitter.NO_OP : events;
  }

  /**
   * Searches {@code root} for an artifact and loads it. Never throws.
   *
   * @param root root of the artifact tree; may be {@code null} or missing
   * @return loaded model, or {@link ActiveModel#unavailable()} with the reason recorded in an event
   */
  public ActiveModel resolve(Path root) {
    Optional<Path> located = locate(root);
    if (located.isEmpty()) {
      return unavailable(root, "could not find '" + markerFileName + "' under " + root);
    }
    Path directory = located.get();
    ClassifierPort classifier;
    try {
      classifier = loader.load(directory);
    } catch (ArtifactLoadException | RuntimeException ex) {
      log.debug("Artifact load failed for {}", directory, ex);
      return unavailable(root, "failed to load artifact at " + directory + ": " + ex.getMessage());
    }
    String version = versionOf(directory);
    Map<String, Object> fields = new LinkedHashMap<>();
    fields.put("event", "model.resolved");
    fields.put("path", directory.toString());
    fields.put("model_version", version);
    events.info("Model loaded successfully", fields);
    return ActiveModel.loaded(classifier, version, directory);
  }

  /**
   * Finds the first directory under {@code root} holding the marker file.
   *
   * @param root tree root; {@code null} or a non-directory yields empty
   * @return artifact directory if found
   */
  public Optional<Path> locate(Path root) {
    if (root == null || !Files.isDirectory(root)) {
      return Optional.empty();
    }
    return search(root);
  }

  private Optional<Path> search(Path directory) {
    if (Files.isRegularFile(directory.resolve(markerFileName), LinkOption.NOFOLLOW_LINKS)) {
      return Optional.of(directory);
    }
    List<Path> children;
    try (Stream<Path> entries = Files.list(directory)) {
      children = entries
          .filter(path -> Files.isDirectory(path, LinkOption.NOFOLLOW_LINKS))
          .sorted(Comparator.comparing(path -> path.getFileName().toString()))
          .toList();
    } catch (IOException ex) {
      log.debug("Skipping unreadable directory {}", directory, ex);
      return Optional.empty();
    }
    for (Path child : children) {
      Optional<Path> found = search(child);
      if (found.isPresent()) {
        return found;
      }
    }
    return Optional.empty();
  }

  private String versionOf(Path directory) {
    try {
      String tag = versions.resolve(directory);
      return tag == null || tag.isBlank() ? VersionTagResolver.UNKNOWN : tag;
    } catch (RuntimeException ex) {
      log.warn("Version tag resolution failed for {}; using '{}'", directory, VersionTagResolver.UNKNOWN, ex);
      return VersionTagResolver.UNKNOWN;
    }
  }

  private ActiveModel unavailable(Path root, String reason) {
    Map<String, Object> fields = new LinkedHashMap<>();
    fields.put("event", "model.unavailable");
    fields.put("reason", reason);
    fields.put("model_root", String.valueOf(root));
    events.error("Could not load model", fields);
    return ActiveModel.unavailable();
  }
}
