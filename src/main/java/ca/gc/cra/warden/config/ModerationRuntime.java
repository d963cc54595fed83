package ca.gc.cra.warden.config;

import ca.gc.cra.warden.application.moderation.ModerationEventRouter;
import ca.gc.cra.warden.infrastructure.exec.ExecutorFactories;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ScheduledExecutorService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Running moderation graph: the event router plus the executors it owns.
 *
 * <p>Closing stops the sweeper, then drains in-flight events for up to five seconds.</p>
 *
 * @since 0.1.0
 */
public final class ModerationRuntime implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(ModerationRuntime.class);
  static final Duration DRAIN_TIMEOUT = Duration.ofSeconds(5);

  private final ModerationEventRouter router;
  private final ExecutorService events;
  private final ScheduledExecutorService housekeeping;
  private boolean closed;

  ModerationRuntime(ModerationEventRouter router, ExecutorService events, ScheduledExecutorService housekeeping) {
    this.router = Objects.requireNonNull(router, "router");
    this.events = Objects.requireNonNull(events, "events");
    this.housekeeping = Objects.requireNonNull(housekeeping, "housekeeping");
  }

  /**
   * Returns the router receiving platform events.
   *
   * @return event router
   */
  public ModerationEventRouter router() {
    return router;
  }

  @Override
  public synchronized void close() {
    if (closed) {
      return;
    }
    closed = true;
    housekeeping.shutdownNow();
    boolean drained = ExecutorFactories.shutdownGracefully(events, DRAIN_TIMEOUT);
    log.info("Moderation stopped (events drained: {})", drained);
  }
}
