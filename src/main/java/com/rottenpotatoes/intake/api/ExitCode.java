package com.rottenpotatoes.intake.api;

import com.rottenpotatoes.intake.domain.review.IntakeErrorKind;
import java.util.Objects;

/**
 * <strong>What:</strong> Process exit codes returned by intake CLI commands.
 * <p><strong>Why:</strong> Lets scripts tell invalid input and degraded states apart without parsing output.</p>
 * <p><strong>Role:</strong> Adapter-layer contract between CLI entry points and the shell.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable and globally shareable.</p>
 *
 * @since 0.1.0
 */
public enum ExitCode {
  /** Command finished successfully. */
  SUCCESS(0),
  /** Arguments were missing or malformed. */
  INVALID_ARGS(2),
  /** A configuration or dataset file could not be read. */
  IO_ERROR(3),
  /** Configuration values were rejected. */
  CONFIG_ERROR(4),
  /** Unexpected runtime failure. */
  RUNTIME_FAILURE(5),
  /** No classifier artifact is loaded. */
  MODEL_UNAVAILABLE(6),
  /** The classifier failed on the submitted text. */
  CLASSIFICATION_FAILED(7),
  /** The review store rejected a read or write. */
  PERSISTENCE_FAILED(8),
  /** The seed dataset was missing, malformed, or rejected. */
  SEEDING_FAILED(9);

  private final int code;

  ExitCode(int code) {
    this.code = code;
  }

  /**
   * Returns the numeric process exit code.
   *
   * @return exit status passed to {@link System#exit(int)}
   */
  public int code() {
    return code;
  }

  /**
   * Maps a stable intake error kind to its exit code.
   *
   * @param kind error kind; must not be {@code null}
   * @return matching exit code
   */
  public static ExitCode forError(IntakeErrorKind kind) {
    return switch (Objects.requireNonNull(kind, "kind")) {
      case MODEL_UNAVAILABLE -> MODEL_UNAVAILABLE;
      case CLASSIFICATION_FAILED -> CLASSIFICATION_FAILED;
      case PERSISTENCE_FAILED -> PERSISTENCE_FAILED;
      case SEEDING_FAILED -> SEEDING_FAILED;
    };
  }
}
