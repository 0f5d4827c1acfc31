package com.rottenpotatoes.intake.infrastructure.time;

import com.rottenpotatoes.intake.application.port.ClockPort;
import java.time.Clock;
import java.util.Objects;

/**
 * {@link ClockPort} backed by a {@link java.time.Clock}; the event envelope timestamps come from here.
 *
 * @since 0.1.0
 */
public final class SystemClockAdapter implements ClockPort {
  private final Clock clock;

  /** Creates an adapter on the UTC system clock. */
  public SystemClockAdapter() {
    this(Clock.systemUTC());
  }

  /**
   * @param clock clock to read; a fixed clock makes event timestamps deterministic in tests
   */
  public SystemClockAdapter(Clock clock) {
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  @Override
  public long nowMillis() {
    return clock.millis();
  }
}
