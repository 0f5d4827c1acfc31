package com.rottenpotatoes.intake.application.port;

import java.nio.file.Path;

/**
 * Derives a human-readable version tag for a located artifact.
 *
 * <p>The tag is whatever identifier the training and versioning process encoded in the directory
 * layout; the intake core treats it as an opaque string.</p>
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface VersionTagResolver {
  /** Sentinel tag used when no artifact is loaded or no tag can be derived. */
  String UNKNOWN = "unknown";

  /**
   * Resolves the tag for an artifact directory.
   *
   * @param artifactDirectory directory holding the marker file; never {@code null}
   * @return version tag; {@link #UNKNOWN} when none can be derived
   */
  String resolve(Path artifactDirectory);
}
