package com.rottenpotatoes.intake.application.port;

/**
 * Unchecked failure raised by {@link PersistencePort} adapters when the store rejects an operation.
 *
 * @since 0.1.0
 */
public class PersistenceException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  /**
   * Creates an exception with a message.
   *
   * @param message failure description
   */
  public PersistenceException(String message) {
    super(message);
  }

  /**
   * Creates an exception with a message and cause.
   *
   * @param message failure description
   * @param cause underlying failure
   */
  public PersistenceException(String message, Throwable cause) {
    super(message, cause);
  }
}
