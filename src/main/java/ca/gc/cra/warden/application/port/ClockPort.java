package ca.gc.cra.warden.application.port;

import java.time.Duration;

/**
 * <strong>What:</strong> Port supplying wall-clock timestamps and cooperative waits to moderation flows.
 * <p><strong>Why:</strong> Audit attribution waits for propagation and self-throttles; abstracting time keeps
 * those waits deterministic under test.</p>
 * <p><strong>Role:</strong> Domain port consumed by application services.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Expose the current epoch time in milliseconds.</li>
 *   <li>Suspend the calling event task for a bounded duration.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Implementations must be thread-safe; clock reads and sleeps occur on
 * every event worker thread.</p>
 *
 * @implNote Default implementation delegates to {@link System#currentTimeMillis()} and {@link Thread#sleep(long)}.
 * @since 0.1.0
 * @see ca.gc.cra.warden.infrastructure.time.SystemClockAdapter
 */
public interface ClockPort {
  /**
   * Returns the current epoch time in milliseconds.
   *
   * @return milliseconds since 1970-01-01T00:00:00Z
   */
  long nowMillis();

  /**
   * Suspends the calling thread for the given duration.
   *
   * @param duration time to wait; zero or negative durations return immediately
   * @throws InterruptedException if the calling thread is interrupted while waiting
   */
  default void sleep(Duration duration) throws InterruptedException {
    if (duration == null || duration.isZero() || duration.isNegative()) {
      return;
    }
    Thread.sleep(duration.toMillis());
  }

  /**
   * Default {@link ClockPort} using {@link System#currentTimeMillis()}.
   */
  ClockPort SYSTEM = System::currentTimeMillis;
}
