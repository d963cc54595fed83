package ca.gc.cra.warden.infrastructure.time;

import ca.gc.cra.warden.application.port.ClockPort;
import java.time.Duration;

/**
 * {@link ClockPort} implementation backed by {@link System#currentTimeMillis()} and {@link Thread#sleep(long)}.
 *
 * @since 0.1.0
 */
public final class SystemClockAdapter implements ClockPort {
  /** Creates a system clock adapter. */
  public SystemClockAdapter() {}

  /**
   * Returns the current epoch milliseconds.
   *
   * @return current epoch milliseconds
   * @implNote Delegates to {@link System#currentTimeMillis()} without smoothing; a clock that steps
   *     backwards is tolerated by the invite windows, which clamp out-of-order stamps.
   */
  @Override
  public long nowMillis() {
    return System.currentTimeMillis();
  }

  @Override
  public void sleep(Duration duration) throws InterruptedException {
    if (duration == null || duration.isZero() || duration.isNegative()) {
      return;
    }
    Thread.sleep(duration.toMillis());
  }
}
