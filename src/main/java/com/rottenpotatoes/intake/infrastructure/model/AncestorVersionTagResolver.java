package com.rottenpotatoes.intake.infrastructure.model;

import com.rottenpotatoes.intake.application.port.VersionTagResolver;
import com.rottenpotatoes.intake.validation.Numbers;
import java.nio.file.Path;

/**
 * Names a model by the directory {@code depth} levels above its artifact directory.
 *
 * <p>For the MLflow layout {@code mlruns/<experiment>/<run-id>/artifacts/model}, depth 2 yields the run id.
 * Depth 0 names the artifact directory itself. Climbing past the filesystem root yields
 * {@link VersionTagResolver#UNKNOWN}.</p>
 *
 * @since 0.1.0
 */
public final class AncestorVersionTagResolver implements VersionTagResolver {
  /** Maximum supported depth. */
  public static final int MAX_DEPTH = 16;

  private final int depth;

  public AncestorVersionTagResolver(int depth) {
    this.depth = (int) Numbers.requireRange("versionDepth", depth, 0, MAX_DEPTH);
  }

  @Override
  public String resolve(Path artifactDirectory) {
    if (artifactDirectory == null) {
      return UNKNOWN;
    }
    Path current = artifactDirectory.toAbsolutePath().normalize();
    for (int i = 0; i < depth && current != null; i++) {
      current = current.getParent();
    }
    if (current == null || current.getFileName() == null) {
      return UNKNOWN;
    }
    String name = current.getFileName().toString();
    return name.isBlank() ? UNKNOWN : name;
  }

  public int depth() {
    return depth;
  }
}
