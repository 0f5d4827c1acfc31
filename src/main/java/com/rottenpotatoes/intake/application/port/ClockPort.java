package com.rottenpotatoes.intake.application.port;

/**
 * <strong>What:</strong> Port supplying wall-clock timestamps to event envelopes and latency measurements.
 * <p><strong>Why:</strong> Provides a deterministic time source abstraction for tests.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be thread-safe; clock reads occur on request threads.</p>
 *
 * @since 0.1.0
 * @see com.rottenpotatoes.intake.infrastructure.time.SystemClockAdapter
 */
public interface ClockPort {
  /**
   * Returns the current epoch time in milliseconds.
   *
   * @return milliseconds since 1970-01-01T00:00:00Z
   */
  long nowMillis();
}
