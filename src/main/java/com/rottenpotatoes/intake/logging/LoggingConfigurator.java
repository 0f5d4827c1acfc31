package com.rottenpotatoes.intake.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Adjusts intake logging verbosity for CLI-driven workflows.
 * <p><strong>Why:</strong> {@code --verbose} must surface DEBUG diagnostics (remote sink failures, score events)
 * without editing {@code logback.xml}.</p>
 * <p><strong>Thread-safety:</strong> Intended for the single CLI bootstrap thread.</p>
 *
 * @implNote Tailored for Logback; other SLF4J bindings log a warning and keep their defaults.
 * @since 0.1.0
 * @see Logs
 */
public final class LoggingConfigurator {
  private static final org.slf4j.Logger log = LoggerFactory.getLogger(LoggingConfigurator.class);

  private LoggingConfigurator() {
    // Utility
  }

  /**
   * Elevates the root logger and the event logger to DEBUG within the running JVM.
   *
   * @param eventLoggerName name of the structured event logger; {@code null} adjusts only the root logger
   */
  public static void enableVerboseLogging(String eventLoggerName) {
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (factory instanceof LoggerContext context) {
      raise(context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME));
      if (eventLoggerName != null && !eventLoggerName.isBlank()) {
        raise(context.getLogger(eventLoggerName));
      }
      return;
    }
    log.warn("Verbose logging requested but backend {} does not support dynamic level updates",
        factory.getClass().getName());
  }

  private static void raise(Logger logger) {
    if (!Level.DEBUG.equals(logger.getLevel())) {
      logger.setLevel(Level.DEBUG);
    }
  }
}
