package com.rottenpotatoes.intake.application.port;

import java.nio.file.Path;

/**
 * <strong>What:</strong> Loads a classifier artifact from the directory that holds its marker file.
 * <p><strong>Why:</strong> Decouples artifact discovery from the serialization format written by the
 * training job.</p>
 * <p><strong>Role:</strong> Outbound port consumed by {@code ArtifactResolver} during startup.</p>
 * <p><strong>Thread-safety:</strong> Invoked once on the startup thread.</p>
 *
 * @since 0.1.0
 */
public interface ArtifactLoader {
  /**
   * Loads the artifact rooted at {@code artifactDirectory}.
   *
   * @param artifactDirectory directory containing the marker file
   * @return ready-to-use classifier capability
   * @throws ArtifactLoadException if the artifact is missing, unreadable, or malformed
   */
  ClassifierPort load(Path artifactDirectory) throws ArtifactLoadException;
}
