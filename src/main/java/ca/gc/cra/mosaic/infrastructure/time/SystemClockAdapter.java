package ca.gc.cra.mosaic.infrastructure.time;

import ca.gc.cra.mosaic.application.port.ClockPort;

/**
 * {@link ClockPort} reading the host wall clock; stamps encryption tokens and checks their age.
 *
 * @since 0.1.0
 */
public final class SystemClockAdapter implements ClockPort {
  /** Creates a system clock adapter. */
  public SystemClockAdapter() {}

  @Override
  public long nowMillis() {
    return System.currentTimeMillis();
  }
}
