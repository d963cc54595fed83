package ca.gc.cra.warden.infrastructure.time;

import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import org.junit.jupiter.api.Test;

class SystemClockAdapterTest {

  @Test
  void sleepAdvancesWallClock() throws InterruptedException {
    SystemClockAdapter clock = new SystemClockAdapter();
    long before = clock.nowMillis();

    clock.sleep(Duration.ofMillis(20));

    assertTrue(clock.nowMillis() - before >= 15);
  }

  @Test
  void nonPositiveSleepReturnsImmediately() throws InterruptedException {
    SystemClockAdapter clock = new SystemClockAdapter();
    long before = System.nanoTime();

    clock.sleep(Duration.ZERO);
    clock.sleep(Duration.ofMillis(-5));
    clock.sleep(null);

    assertTrue(System.nanoTime() - before < Duration.ofSeconds(1).toNanos());
  }
}
