package com.rottenpotatoes.intake.application.model;

import com.rottenpotatoes.intake.application.port.ClassifierPort;
import com.rottenpotatoes.intake.application.port.VersionTagResolver;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Immutable result of startup artifact resolution.
 * <p><strong>Why:</strong> Replaces process-global mutable model state with a value constructed once and
 * handed to every request handler.</p>
 * <p><strong>Thread-safety:</strong> Immutable; safe to publish to concurrent readers without locking.</p>
 *
 * @param classifier loaded classifier; {@code null} when the service runs degraded
 * @param versionTag version tag; {@link VersionTagResolver#UNKNOWN} when unavailable
 * @param location directory the artifact was loaded from; {@code null} when unavailable
 * @since 0.1.0
 */
public record ActiveModel(ClassifierPort classifier, String versionTag, Path location) {

  /**
   * Validates that a loaded model names its version and location.
   */
  public ActiveModel {
    versionTag = versionTag == null || versionTag.isBlank() ? VersionTagResolver.UNKNOWN : versionTag;
    if (classifier != null) {
      Objects.requireNonNull(location, "location");
    }
  }

  /**
   * Creates a loaded model value.
   *
   * @param classifier classifier capability; must not be {@code null}
   * @param versionTag derived version tag
   * @param location artifact directory
   * @return loaded model
   */
  public static ActiveModel loaded(ClassifierPort classifier, String versionTag, Path location) {
    return new ActiveModel(Objects.requireNonNull(classifier, "classifier"), versionTag, location);
  }

  /**
   * Creates the degraded model value used when no artifact could be loaded.
   *
   * @return model without classifier and with the {@code unknown} version tag
   */
  public static ActiveModel unavailable() {
    return new ActiveModel(null, VersionTagResolver.UNKNOWN, null);
  }

  /**
   * Returns the classifier if one was loaded.
   *
   * @return optional classifier
   */
  public Optional<ClassifierPort> classifierIfLoaded() {
    return Optional.ofNullable(classifier);
  }

  /**
   * Returns the artifact directory if one was loaded.
   *
   * @return optional location
   */
  public Optional<Path> locationIfLoaded() {
    return Optional.ofNullable(location);
  }

  /**
   * Returns whether a classifier is available.
   *
   * @return {@code true} when loaded
   */
  public boolean loaded() {
    return classifier != null;
  }
}
