package ca.gc.cra.warden.testutil;

import ca.gc.cra.warden.application.port.ClockPort;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Manual clock; {@link #sleep(Duration)} advances time instead of blocking.
 */
public final class FakeClock implements ClockPort {
  private final AtomicLong now;
  private final List<Duration> sleeps = new ArrayList<>();

  public FakeClock(long startMillis) {
    this.now = new AtomicLong(startMillis);
  }

  @Override
  public long nowMillis() {
    return now.get();
  }

  @Override
  public synchronized void sleep(Duration duration) {
    sleeps.add(duration);
    now.addAndGet(duration.toMillis());
  }

  public void advance(Duration duration) {
    now.addAndGet(duration.toMillis());
  }

  public synchronized List<Duration> sleeps() {
    return List.copyOf(sleeps);
  }
}
