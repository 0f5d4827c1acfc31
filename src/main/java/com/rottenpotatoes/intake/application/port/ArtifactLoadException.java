package com.rottenpotatoes.intake.application.port;

/**
 * Signals that a classifier artifact could not be loaded.
 *
 * @since 0.1.0
 */
public class ArtifactLoadException extends Exception {
  private static final long serialVersionUID = 1L;

  /**
   * Creates an exception with a message.
   *
   * @param message failure description
   */
  public ArtifactLoadException(String message) {
    super(message);
  }

  /**
   * Creates an exception with a message and cause.
   *
   * @param message failure description
   * @param cause underlying failure
   */
  public ArtifactLoadException(String message, Throwable cause) {
    super(message, cause);
  }
}
