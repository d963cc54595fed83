package ca.gc.cra.warden.application.moderation;

import ca.gc.cra.warden.application.port.ClockPort;
import ca.gc.cra.warden.application.port.MetricsPort;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Periodic task reclaiming idle per-key moderation state.
 *
 * <p>Invite windows, audit throttle entries and processed audit-record ids are purged lazily on use; this task
 * removes the keys nobody touches anymore. Failures are logged and never propagate, so a scheduled executor
 * keeps running the task.</p>
 *
 * @since 0.1.0
 */
public final class StateSweeper implements Runnable {
  private static final Logger log = LoggerFactory.getLogger(StateSweeper.class);

  private final InviteSpamDetector inviteDetector;
  private final AuditCorrelator correlator;
  private final ModerationEventRouter router;
  private final ClockPort clock;
  private final MetricsPort metrics;

  public StateSweeper(
      InviteSpamDetector inviteDetector,
      AuditCorrelator correlator,
      ModerationEventRouter router,
      ClockPort clock,
      MetricsPort metrics) {
    this.inviteDetector = Objects.requireNonNull(inviteDetector, "inviteDetector");
    this.correlator = Objects.requireNonNull(correlator, "correlator");
    this.router = Objects.requireNonNull(router, "router");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
  }

  @Override
  public void run() {
    try {
      long now = clock.nowMillis();
      int windows = inviteDetector.sweep(now);
      int throttles = correlator.sweep(now);
      int processed = router.sweepProcessed(now);
      metrics.observe("sweep.invite.removed", windows);
      metrics.observe("sweep.audit.removed", throttles);
      metrics.observe("sweep.processed.removed", processed);
      if (windows + throttles + processed > 0) {
        log.debug("Swept {} invite windows, {} audit throttle entries, {} processed records",
            windows, throttles, processed);
      }
    } catch (RuntimeException ex) {
      metrics.increment("sweep.failed");
      log.error("State sweep failed", ex);
    }
  }
}
