package ca.gc.cra.warden.config;

import ca.gc.cra.warden.application.moderation.AuditCorrelator;
import ca.gc.cra.warden.application.moderation.EnforcementActuator;
import ca.gc.cra.warden.application.moderation.InviteSpamDetector;
import ca.gc.cra.warden.application.moderation.ModerationEventRouter;
import ca.gc.cra.warden.application.moderation.StateSweeper;
import ca.gc.cra.warden.application.moderation.TrustRegistry;
import ca.gc.cra.warden.application.moderation.WebhookLocator;
import ca.gc.cra.warden.application.moderation.WebhookViolationTracker;
import ca.gc.cra.warden.application.port.AuditDirectoryPort;
import ca.gc.cra.warden.application.port.ClockPort;
import ca.gc.cra.warden.application.port.MetricsPort;
import ca.gc.cra.warden.application.port.PlatformGatewayPort;
import ca.gc.cra.warden.infrastructure.exec.ExecutorFactories;
import ca.gc.cra.warden.infrastructure.metrics.NoOpMetricsAdapter;
import ca.gc.cra.warden.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Central composition root that wires the moderation services to concrete ports.
 * <p><strong>Why:</strong> Translates one validated {@link ModerationConfig} into a running agent in a single
 * place, so the CLI and integration tests build the exact same graph.</p>
 * <p><strong>Role:</strong> Adapter composition root between configuration and the application layer.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Build the trust registry, always including the agent's own account.</li>
 *   <li>Construct detector, correlator, actuator, tracker, locator and router from configuration.</li>
 *   <li>Own the event pool and the housekeeping scheduler through {@link ModerationRuntime}.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Holds immutable references; {@link #start} is meant to be called once.</p>
 *
 * @since 0.1.0
 */
public final class CompositionRoot {
  private static final Logger log = LoggerFactory.getLogger(CompositionRoot.class);

  private final ModerationConfig config;
  private final ClockPort clock;
  private final MetricsPort metrics;

  /**
   * Creates a composition root.
   *
   * @param config validated configuration
   * @param clock clock used by every service
   * @param metrics metrics sink; {@code null} disables metrics
   */
  public CompositionRoot(ModerationConfig config, ClockPort clock, MetricsPort metrics) {
    this.config = Objects.requireNonNull(config, "config");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
  }

  /**
   * Creates the metrics adapter for the configured exporter.
   *
   * @param exporter {@code otlp} or {@code none}
   * @return metrics adapter
   */
  public static MetricsPort metricsFor(String exporter) {
    String normalized = exporter == null ? "none" : exporter.trim().toLowerCase(Locale.ROOT);
    return normalized.equals("otlp") ? new OpenTelemetryMetricsAdapter() : new NoOpMetricsAdapter();
  }

  /**
   * Returns the trust registry for an agent running as {@code selfAccountId}.
   *
   * @param selfAccountId the agent's own account
   * @return registry with the configured accounts plus the agent itself
   */
  public TrustRegistry trustRegistry(long selfAccountId) {
    return new TrustRegistry(config.trustedAccounts()).withAccount(selfAccountId);
  }

  /**
   * Returns the router policy derived from configuration.
   *
   * @return router policy
   */
  public ModerationEventRouter.Policy policy() {
    return new ModerationEventRouter.Policy(
        config.timeout(),
        ModerationEventRouter.Policy.inviteSpamReason(config.inviteThreshold(), config.inviteWindow().toSeconds()),
        config.deleteTrustedInvites(),
        config.auditFreshness(),
        config.webhookFreshness(),
        config.webhookPageSize(),
        config.propagationDelay());
  }

  /**
   * Builds the moderation graph on top of the given ports and starts its executors.
   *
   * @param gateway platform gateway
   * @param directory audit directory
   * @return running moderation runtime; close it to stop
   */
  public ModerationRuntime start(PlatformGatewayPort gateway, AuditDirectoryPort directory) {
    Objects.requireNonNull(gateway, "gateway");
    Objects.requireNonNull(directory, "directory");
    TrustRegistry trust = trustRegistry(gateway.selfAccountId());
    InviteSpamDetector detector =
        new InviteSpamDetector(config.inviteWindow(), config.inviteThreshold(), config.inviteCapacity());
    AuditCorrelator correlator = new AuditCorrelator(
        directory, clock, metrics, config.auditThrottle(), config.auditPageSize(), config.auditRetries());
    EnforcementActuator actuator = new EnforcementActuator(gateway, trust, clock, metrics);
    WebhookViolationTracker tracker = new WebhookViolationTracker(config.webhookThreshold());
    WebhookLocator locator = new WebhookLocator(gateway, metrics, config.webhookSearchChannelLimit());

    ExecutorService events = ExecutorFactories.newEventPool(
        config.eventWorkers(), config.eventQueueCapacity(), "warden-event", null);
    ModerationEventRouter router = new ModerationEventRouter(
        trust, detector, correlator, actuator, tracker, locator, gateway, clock, metrics, events, policy());

    ScheduledExecutorService housekeeping = ExecutorFactories.newHousekeepingScheduler("warden-sweep");
    long period = config.sweepInterval().toMillis();
    housekeeping.scheduleAtFixedRate(
        new StateSweeper(detector, correlator, router, clock, metrics), period, period, TimeUnit.MILLISECONDS);

    log.info("Moderation started: {} trusted accounts, {} event workers, queue {}",
        trust.size(), config.eventWorkers(), config.eventQueueCapacity());
    return new ModerationRuntime(router, events, housekeeping);
  }
}
