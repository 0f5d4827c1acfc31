package com.rottenpotatoes.intake.domain.events;

/**
 * Severity attached to a {@link LogEvent}.
 *
 * @since 0.1.0
 */
public enum EventLevel {
  DEBUG,
  INFO,
  WARN,
  ERROR
}
