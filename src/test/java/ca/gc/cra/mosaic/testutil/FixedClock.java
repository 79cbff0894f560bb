package ca.gc.cra.mosaic.testutil;

import ca.gc.cra.mosaic.application.port.ClockPort;

/** Manually advanced clock. */
public final class FixedClock implements ClockPort {
  private long millis;

  public FixedClock(long millis) {
    this.millis = millis;
  }

  @Override
  public long nowMillis() {
    return millis;
  }

  public void advanceSeconds(long seconds) {
    millis += seconds * 1000L;
  }
}
