package ca.gc.cra.warden.application.moderation;

import ca.gc.cra.warden.application.port.ClockPort;
import ca.gc.cra.warden.application.port.GatewayException;
import ca.gc.cra.warden.application.port.MetricsPort;
import ca.gc.cra.warden.application.port.PlatformEventListener;
import ca.gc.cra.warden.application.port.PlatformGatewayPort;
import ca.gc.cra.warden.domain.audit.AuditActionKind;
import ca.gc.cra.warden.domain.audit.AuditRecord;
import ca.gc.cra.warden.domain.events.PlatformEvent;
import ca.gc.cra.warden.domain.events.PlatformEvent.ChannelDeleted;
import ca.gc.cra.warden.domain.events.PlatformEvent.MemberBanned;
import ca.gc.cra.warden.domain.events.PlatformEvent.MemberJoined;
import ca.gc.cra.warden.domain.events.PlatformEvent.MemberRemoved;
import ca.gc.cra.warden.domain.events.PlatformEvent.MessageReceived;
import ca.gc.cra.warden.domain.events.PlatformEvent.RoleDeleted;
import ca.gc.cra.warden.domain.events.PlatformEvent.WebhooksUpdated;
import ca.gc.cra.warden.domain.moderation.EnforcementOutcome;
import ca.gc.cra.warden.logging.Logs;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Dispatches each platform event to its moderation policy.
 * <p><strong>Why:</strong> Encodes the escalation rules: invite spam is deleted and rate limited, unauthorized
 * administrative actions get their actor removed, and repeated webhook creation escalates to a kick.</p>
 * <p><strong>Role:</strong> Application use case; the platform adapter delivers events through
 * {@link #onEvent(PlatformEvent)}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Schedule one independent task per event so slow audit lookups never block the gateway thread.</li>
 *   <li>Wait for audit propagation before attributing administrative events.</li>
 *   <li>Convert each webhook-creation audit record into at most one violation.</li>
 *   <li>Absorb every failure; nothing escapes a task.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Tasks for different events run concurrently; shared state lives in the
 * collaborating services and in a concurrent processed-record map.</p>
 * <p><strong>Observability:</strong> Counts {@code events.received.<name>}, {@code events.rejected},
 * {@code events.failed}, {@code invite.*} and {@code webhook.violation}; observes
 * {@code events.handle.latencyMillis}. Tasks run with {@code communityId} and {@code event} in the MDC.</p>
 *
 * @since 0.1.0
 */
public final class ModerationEventRouter implements PlatformEventListener {
  private static final Logger log = LoggerFactory.getLogger(ModerationEventRouter.class);
  private static final int LOGGED_CONTENT_BYTES = 120;
  private static final long MIN_PROCESSED_RETENTION_MILLIS = Duration.ofMinutes(5).toMillis();

  static final String REASON_INVITE_DELETE = "Invite links are not allowed";
  static final String REASON_BOT_ADDED = "Unauthorized bot addition";
  static final String REASON_BOT_INVITER = "Added a bot without authorization";
  static final String REASON_CHANNEL_DELETE = "Unauthorized channel deletion";
  static final String REASON_ROLE_DELETE = "Unauthorized role deletion";
  static final String REASON_BAN = "Unauthorized ban";
  static final String REASON_KICK = "Unauthorized kick";
  static final String REASON_WEBHOOK_DELETE = "Unauthorized webhook creation";
  static final String REASON_WEBHOOK_KICK = "Repeated unauthorized webhook creation";

  private final TrustRegistry trust;
  private final InviteSpamDetector inviteDetector;
  private final AuditCorrelator correlator;
  private final EnforcementActuator actuator;
  private final WebhookViolationTracker webhookTracker;
  private final WebhookLocator webhookLocator;
  private final PlatformGatewayPort gateway;
  private final ClockPort clock;
  private final MetricsPort metrics;
  private final Executor executor;
  private final Policy policy;
  private final long processedRetentionMillis;
  private final ConcurrentMap<Long, Long> processedAuditRecords = new ConcurrentHashMap<>();

  /**
   * Creates a router.
   *
   * @param trust exempt accounts
   * @param inviteDetector invite posting rate detector
   * @param correlator audit attribution service
   * @param actuator enforcement service
   * @param webhookTracker webhook violation counter
   * @param webhookLocator webhook search and delete service
   * @param gateway platform gateway used for message deletion
   * @param clock clock used for timestamps and propagation waits
   * @param metrics metrics sink; {@code null} disables metrics
   * @param executor executor running one task per event
   * @param policy moderation settings
   */
  public ModerationEventRouter(
      TrustRegistry trust,
      InviteSpamDetector inviteDetector,
      AuditCorrelator correlator,
      EnforcementActuator actuator,
      WebhookViolationTracker webhookTracker,
      WebhookLocator webhookLocator,
      PlatformGatewayPort gateway,
      ClockPort clock,
      MetricsPort metrics,
      Executor executor,
      Policy policy) {
    this.trust = Objects.requireNonNull(trust, "trust");
    this.inviteDetector = Objects.requireNonNull(inviteDetector, "inviteDetector");
    this.correlator = Objects.requireNonNull(correlator, "correlator");
    this.actuator = Objects.requireNonNull(actuator, "actuator");
    this.webhookTracker = Objects.requireNonNull(webhookTracker, "webhookTracker");
    this.webhookLocator = Objects.requireNonNull(webhookLocator, "webhookLocator");
    this.gateway = Objects.requireNonNull(gateway, "gateway");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
    this.executor = Objects.requireNonNull(executor, "executor");
    this.policy = Objects.requireNonNull(policy, "policy");
    this.processedRetentionMillis =
        Math.max(MIN_PROCESSED_RETENTION_MILLIS, policy.webhookFreshness().toMillis() * 2);
  }

  @Override
  public void onEvent(PlatformEvent event) {
    submit(event);
  }

  /**
   * Schedules the event on the executor. Never blocks; a saturated executor drops the event.
   *
   * @param event platform event
   * @return {@code true} when the event was accepted
   */
  public boolean submit(PlatformEvent event) {
    Objects.requireNonNull(event, "event");
    try {
      executor.execute(() -> runTask(event));
      return true;
    } catch (RejectedExecutionException ex) {
      metrics.increment("events.rejected");
      log.warn("Dropped {} event for community {}: event pool saturated or stopped",
          event.name(), event.communityId());
      return false;
    }
  }

  /**
   * Runs the moderation policy for one event on the calling thread.
   *
   * @param event platform event
   * @throws InterruptedException if interrupted while waiting for audit propagation or throttling
   */
  public void handle(PlatformEvent event) throws InterruptedException {
    metrics.increment("events.received." + event.name());
    if (event instanceof MessageReceived message) {
      onMessage(message);
    } else if (event instanceof MemberJoined joined) {
      if (joined.bot()) {
        onBotJoined(joined);
      }
    } else if (event instanceof MemberRemoved removed) {
      punishActor(removed.communityId(), AuditActionKind.MEMBER_KICK, removed.accountId(), REASON_KICK);
    } else if (event instanceof MemberBanned banned) {
      punishActor(banned.communityId(), AuditActionKind.MEMBER_BAN, banned.accountId(), REASON_BAN);
    } else if (event instanceof ChannelDeleted channel) {
      punishActor(channel.communityId(), AuditActionKind.CHANNEL_DELETE, channel.channelId(), REASON_CHANNEL_DELETE);
    } else if (event instanceof RoleDeleted role) {
      punishActor(role.communityId(), AuditActionKind.ROLE_DELETE, role.roleId(), REASON_ROLE_DELETE);
    } else if (event instanceof WebhooksUpdated webhooks) {
      onWebhooksUpdated(webhooks);
    } else {
      log.debug("Ignoring unsupported event {}", event.getClass().getSimpleName());
    }
  }

  /**
   * Drops processed audit-record ids that can no longer reappear inside the webhook freshness window.
   *
   * @param nowMillis reference epoch milliseconds
   * @return number of ids removed
   */
  public int sweepProcessed(long nowMillis) {
    int before = processedAuditRecords.size();
    processedAuditRecords.entrySet().removeIf(e -> nowMillis - e.getValue() > processedRetentionMillis);
    return Math.max(0, before - processedAuditRecords.size());
  }

  int processedRecordCount() {
    return processedAuditRecords.size();
  }

  private void runTask(PlatformEvent event) {
    long start = System.nanoTime();
    MDC.put("communityId", Long.toString(event.communityId()));
    MDC.put("event", event.name());
    try {
      handle(event);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      metrics.increment("events.interrupted");
      log.info("Abandoned {} event: interrupted", event.name());
    } catch (RuntimeException ex) {
      metrics.increment("events.failed");
      log.error("Handling {} event for community {} failed", event.name(), event.communityId(), ex);
    } finally {
      metrics.observe("events.handle.latencyMillis", (System.nanoTime() - start) / 1_000_000L);
      MDC.remove("communityId");
      MDC.remove("event");
    }
  }

  private void onMessage(MessageReceived message) {
    if (message.authorBot() || !InviteLinkMatcher.containsInvite(message.content())) {
      return;
    }
    long author = message.authorId();
    boolean trusted = trust.isTrusted(author);
    metrics.increment("invite.detected");
    if (trusted && !policy.deleteTrustedInvites()) {
      log.debug("Invite link from trusted account {} left in place", author);
      return;
    }
    log.info("Invite link from {} in channel {}: {}",
        author, message.channelId(), Logs.truncate(message.content(), LOGGED_CONTENT_BYTES));
    deleteInviteMessage(message);
    if (trusted) {
      return;
    }
    if (inviteDetector.recordPostAndCheck(author, clock.nowMillis())) {
      metrics.increment("invite.threshold.crossed");
      EnforcementOutcome outcome =
          actuator.timeoutOrKick(message.communityId(), author, policy.timeout(), policy.inviteReason());
      log.info("Invite spam by {} in community {}: {}", author, message.communityId(), outcome);
    }
  }

  private void deleteInviteMessage(MessageReceived message) {
    try {
      gateway.deleteMessage(message.communityId(), message.channelId(), message.messageId());
      metrics.increment("invite.deleted");
    } catch (GatewayException ex) {
      metrics.increment("invite.delete.failed");
      if (ex.isPermissionDenied()) {
        log.debug("Missing permission to delete message {} in channel {}", message.messageId(), message.channelId());
      } else if (!ex.isNotFound()) {
        log.warn("Deleting message {} in channel {} failed: {}",
            message.messageId(), message.channelId(), ex.getMessage());
      }
    }
  }

  private void onBotJoined(MemberJoined joined) throws InterruptedException {
    clock.sleep(policy.propagationDelay());
    Optional<Long> inviter = correlator.attribute(
        joined.communityId(), AuditActionKind.BOT_ADD, OptionalLong.of(joined.accountId()), policy.auditFreshness());
    if (inviter.isEmpty()) {
      log.debug("No inviter found for bot {}", joined.accountId());
      return;
    }
    long actor = inviter.get();
    if (trust.isTrusted(actor)) {
      log.info("Bot {} added by trusted account {}", joined.accountId(), actor);
      return;
    }
    log.warn("Bot {} added by untrusted account {}", joined.accountId(), actor);
    actuator.kick(joined.communityId(), joined.accountId(), REASON_BOT_ADDED);
    actuator.kick(joined.communityId(), actor, REASON_BOT_INVITER);
  }

  private void punishActor(long communityId, AuditActionKind kind, long targetId, String reason)
      throws InterruptedException {
    clock.sleep(policy.propagationDelay());
    Optional<Long> resolved =
        correlator.attribute(communityId, kind, OptionalLong.of(targetId), policy.auditFreshness());
    if (resolved.isEmpty()) {
      log.debug("No {} actor found for target {}", kind, targetId);
      return;
    }
    long actor = resolved.get();
    if (trust.isTrusted(actor)) {
      log.debug("{} on {} performed by trusted account {}", kind, targetId, actor);
      return;
    }
    log.warn("{} on {} performed by untrusted account {}", kind, targetId, actor);
    actuator.kick(communityId, actor, reason);
  }

  private void onWebhooksUpdated(WebhooksUpdated event) throws InterruptedException {
    clock.sleep(policy.propagationDelay());
    List<AuditRecord> records = correlator.recentRecords(
        event.communityId(), AuditActionKind.WEBHOOK_CREATE, policy.webhookFreshness(), policy.webhookPageSize());
    for (AuditRecord record : records) {
      if (record.actorId().isEmpty() || record.targetId().isEmpty()) {
        continue;
      }
      long actor = record.actorId().getAsLong();
      long webhookId = record.targetId().getAsLong();
      if (trust.isTrusted(actor)) {
        continue;
      }
      if (processedAuditRecords.putIfAbsent(record.recordId(), clock.nowMillis()) != null) {
        log.debug("Audit record {} already handled", record.recordId());
        continue;
      }
      boolean deleted =
          webhookLocator.locateAndDelete(event.communityId(), event.channelId(), webhookId, REASON_WEBHOOK_DELETE);
      int count = webhookTracker.recordViolationAndRelease(actor);
      metrics.increment("webhook.violation");
      log.warn("Webhook {} created by untrusted account {} (deleted={}, violations={})",
          webhookId, actor, deleted, count);
      if (webhookTracker.shouldKick(count)) {
        actuator.kick(event.communityId(), actor, REASON_WEBHOOK_KICK);
      }
    }
  }

  /**
   * Moderation settings applied by the router.
   *
   * @param timeout invite-spam timeout length
   * @param inviteReason audit reason for invite-spam timeouts
   * @param deleteTrustedInvites whether invite links from trusted accounts are deleted
   * @param auditFreshness maximum audit record age for attribution
   * @param webhookFreshness maximum audit record age for webhook creations
   * @param webhookPageSize webhook-creation records inspected per event
   * @param propagationDelay wait before the first audit lookup
   */
  public record Policy(
      Duration timeout,
      String inviteReason,
      boolean deleteTrustedInvites,
      Duration auditFreshness,
      Duration webhookFreshness,
      int webhookPageSize,
      Duration propagationDelay) {
    /**
     * Normalizes settings, defaulting missing values.
     */
    public Policy {
      timeout = Objects.requireNonNullElse(timeout, Duration.ofHours(1));
      inviteReason = inviteReason == null || inviteReason.isBlank() ? inviteSpamReason(5, 15) : inviteReason;
      auditFreshness = Objects.requireNonNullElse(auditFreshness, Duration.ofSeconds(20));
      webhookFreshness = Objects.requireNonNullElse(webhookFreshness, Duration.ofSeconds(30));
      webhookPageSize = Math.max(1, webhookPageSize);
      propagationDelay = Objects.requireNonNullElse(propagationDelay, Duration.ZERO);
    }

    /**
     * Returns the default policy.
     *
     * @return defaults matching an empty configuration
     */
    public static Policy defaults() {
      return new Policy(
          Duration.ofHours(1),
          inviteSpamReason(5, 15),
          false,
          Duration.ofSeconds(20),
          Duration.ofSeconds(30),
          6,
          Duration.ofSeconds(1));
    }

    /**
     * Builds the audit reason attached to invite-spam timeouts.
     *
     * @param threshold posts that trigger enforcement
     * @param windowSeconds detection window in seconds
     * @return reason text
     */
    public static String inviteSpamReason(int threshold, long windowSeconds) {
      return "Invite-Spam: >=" + threshold + " in " + windowSeconds + "s";
    }
  }
}
