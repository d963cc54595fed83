package ca.gc.cra.warden.application.moderation;

import static ca.gc.cra.warden.testutil.FakeAuditDirectory.record;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.warden.application.port.AuditDirectoryPort;
import ca.gc.cra.warden.application.port.GatewayErrorKind;
import ca.gc.cra.warden.domain.audit.AuditActionKind;
import ca.gc.cra.warden.domain.events.PlatformEvent.ChannelDeleted;
import ca.gc.cra.warden.domain.events.PlatformEvent.MemberBanned;
import ca.gc.cra.warden.domain.events.PlatformEvent.MemberJoined;
import ca.gc.cra.warden.domain.events.PlatformEvent.MemberRemoved;
import ca.gc.cra.warden.domain.events.PlatformEvent.MessageReceived;
import ca.gc.cra.warden.domain.events.PlatformEvent.RoleDeleted;
import ca.gc.cra.warden.domain.events.PlatformEvent.WebhooksUpdated;
import ca.gc.cra.warden.testutil.FakeAuditDirectory;
import ca.gc.cra.warden.testutil.FakeClock;
import ca.gc.cra.warden.testutil.FakePlatformGateway;
import ca.gc.cra.warden.testutil.RecordingMetrics;
import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

class ModerationEventRouterTest {
  private static final long COMMUNITY = 1L;
  private static final long SELF = 999L;
  private static final long TRUSTED = 8L;
  private static final long SPAMMER = 7L;
  private static final long ROGUE_ADMIN = 500L;
  private static final long T0 = 1_700_000_000_000L;
  private static final Executor DIRECT = Runnable::run;

  private FakeClock clock;
  private FakePlatformGateway gateway;
  private FakeAuditDirectory directory;
  private RecordingMetrics metrics;
  private WebhookViolationTracker webhookTracker;
  private ListAppender<ILoggingEvent> appender;
  private Logger routerLogger;

  @BeforeEach
  void setUp() {
    clock = new FakeClock(T0);
    gateway = new FakePlatformGateway(SELF).member(SPAMMER, TRUSTED, ROGUE_ADMIN);
    directory = new FakeAuditDirectory();
    metrics = new RecordingMetrics();
    webhookTracker = new WebhookViolationTracker(3);
    routerLogger = (Logger) LoggerFactory.getLogger(ModerationEventRouter.class);
    appender = new ListAppender<>();
    appender.start();
    routerLogger.addAppender(appender);
  }

  @AfterEach
  void tearDown() {
    routerLogger.detachAppender(appender);
  }

  private ModerationEventRouter router(ModerationEventRouter.Policy policy, Executor executor) {
    return router(policy, executor, directory);
  }

  private ModerationEventRouter router(
      ModerationEventRouter.Policy policy, Executor executor, AuditDirectoryPort audit) {
    TrustRegistry trust = new TrustRegistry(Set.of(TRUSTED)).withAccount(SELF);
    return new ModerationEventRouter(
        trust,
        new InviteSpamDetector(Duration.ofSeconds(15), 5, 50),
        new AuditCorrelator(audit, clock, metrics, Duration.ofSeconds(1), 8, 1),
        new EnforcementActuator(gateway, trust, clock, metrics),
        webhookTracker,
        new WebhookLocator(gateway, metrics, 50),
        gateway,
        clock,
        metrics,
        executor,
        policy);
  }

  private static ModerationEventRouter.Policy policy(boolean deleteTrustedInvites) {
    return new ModerationEventRouter.Policy(
        Duration.ofHours(1),
        ModerationEventRouter.Policy.inviteSpamReason(5, 15),
        deleteTrustedInvites,
        Duration.ofSeconds(20),
        Duration.ofSeconds(30),
        6,
        Duration.ofSeconds(1));
  }

  private static MessageReceived invite(long author, long messageId) {
    return new MessageReceived(COMMUNITY, 10L, messageId, author, false, "join discord.gg/spam" + messageId);
  }

  @Test
  void inviteSpamIsDeletedAndTimedOutOnFifthPost() {
    ModerationEventRouter router = router(policy(false), DIRECT);

    for (int i = 1; i <= 5; i++) {
      assertTrue(router.submit(invite(SPAMMER, i)));
      clock.advance(Duration.ofSeconds(1));
    }

    assertEquals(List.of(1L, 2L, 3L, 4L, 5L), gateway.deletedMessages());
    assertEquals(List.of(SPAMMER), gateway.timedOut());
    assertEquals(1, metrics.count("invite.threshold.crossed"));
    assertEquals(5, metrics.count("events.received.message"));
  }

  @Test
  void forbiddenTimeoutEscalatesToKick() {
    gateway.fail("timeout", GatewayErrorKind.PERMISSION_DENIED);
    ModerationEventRouter router = router(policy(false), DIRECT);

    for (int i = 1; i <= 5; i++) {
      router.submit(invite(SPAMMER, i));
    }

    assertTrue(gateway.timedOut().isEmpty());
    assertEquals(List.of(SPAMMER), gateway.kicked());
  }

  @Test
  void slowInvitePostingIsOnlyDeleted() {
    ModerationEventRouter router = router(policy(false), DIRECT);

    for (int i = 1; i <= 5; i++) {
      router.submit(invite(SPAMMER, i));
      clock.advance(Duration.ofSeconds(4));
    }

    assertEquals(5, gateway.deletedMessages().size());
    assertTrue(gateway.timedOut().isEmpty());
  }

  @Test
  void trustedInvitesAreLeftAloneByDefault() {
    ModerationEventRouter router = router(policy(false), DIRECT);

    for (int i = 1; i <= 10; i++) {
      router.submit(invite(TRUSTED, i));
    }

    assertTrue(gateway.deletedMessages().isEmpty());
    assertTrue(gateway.timedOut().isEmpty());
    assertEquals(10, metrics.count("invite.detected"));
  }

  @Test
  void trustedInvitesCanBeDeletedWithoutEnforcement() {
    ModerationEventRouter router = router(policy(true), DIRECT);

    for (int i = 1; i <= 6; i++) {
      router.submit(invite(TRUSTED, i));
    }

    assertEquals(6, gateway.deletedMessages().size());
    assertTrue(gateway.timedOut().isEmpty());
    assertTrue(gateway.kicked().isEmpty());
  }

  @Test
  void botAuthorsAndPlainMessagesAreIgnored() {
    ModerationEventRouter router = router(policy(false), DIRECT);

    router.submit(new MessageReceived(COMMUNITY, 10L, 1L, SPAMMER, true, "discord.gg/abc"));
    router.submit(new MessageReceived(COMMUNITY, 10L, 2L, SPAMMER, false, "hello there"));

    assertTrue(gateway.deletedMessages().isEmpty());
    assertEquals(0, metrics.count("invite.detected"));
  }

  @Test
  void failedMessageDeleteStillCountsTowardThreshold() {
    gateway.fail("delete", GatewayErrorKind.NOT_FOUND);
    ModerationEventRouter router = router(policy(false), DIRECT);

    for (int i = 1; i <= 5; i++) {
      router.submit(invite(SPAMMER, i));
    }

    assertEquals(5, metrics.count("invite.delete.failed"));
    assertEquals(List.of(SPAMMER), gateway.timedOut());
  }

  @Test
  void botAddedByUntrustedAccountRemovesBotAndInviter() {
    gateway.member(300L);
    directory.add(record(1, AuditActionKind.BOT_ADD, ROGUE_ADMIN, 300L, Instant.ofEpochMilli(T0)));
    ModerationEventRouter router = router(policy(false), DIRECT);

    router.submit(new MemberJoined(COMMUNITY, 300L, true));

    assertEquals(List.of(300L, ROGUE_ADMIN), gateway.kicked());
    assertEquals(
        List.of(ModerationEventRouter.REASON_BOT_ADDED, ModerationEventRouter.REASON_BOT_INVITER),
        gateway.kickReasons());
    assertEquals(List.of(Duration.ofSeconds(1)), clock.sleeps());
  }

  @Test
  void botAddedByTrustedAccountStays() {
    gateway.member(300L);
    directory.add(record(1, AuditActionKind.BOT_ADD, TRUSTED, 300L, Instant.ofEpochMilli(T0)));
    ModerationEventRouter router = router(policy(false), DIRECT);

    router.submit(new MemberJoined(COMMUNITY, 300L, true));
    router.submit(new MemberJoined(COMMUNITY, 301L, false));

    assertTrue(gateway.kicked().isEmpty());
    assertEquals(1, directory.calls());
  }

  @Test
  void unauthorizedAdministrativeActionsRemoveActor() {
    directory.add(record(1, AuditActionKind.CHANNEL_DELETE, ROGUE_ADMIN, 42L, Instant.ofEpochMilli(T0)));
    ModerationEventRouter router = router(policy(false), DIRECT);

    router.submit(new ChannelDeleted(COMMUNITY, 42L));

    assertEquals(List.of(ROGUE_ADMIN), gateway.kicked());
    assertEquals(List.of(ModerationEventRouter.REASON_CHANNEL_DELETE), gateway.kickReasons());
  }

  @Test
  void eachAdministrativeKindUsesItsReason() {
    directory.add(record(1, AuditActionKind.ROLE_DELETE, 501L, 43L, Instant.ofEpochMilli(T0)));
    directory.add(record(2, AuditActionKind.MEMBER_BAN, 502L, 44L, Instant.ofEpochMilli(T0)));
    directory.add(record(3, AuditActionKind.MEMBER_KICK, 503L, 45L, Instant.ofEpochMilli(T0)));
    gateway.member(501L, 502L, 503L);
    ModerationEventRouter router = router(policy(false), DIRECT);

    router.submit(new RoleDeleted(COMMUNITY, 43L));
    router.submit(new MemberBanned(COMMUNITY, 44L));
    router.submit(new MemberRemoved(COMMUNITY, 45L));

    assertEquals(List.of(501L, 502L, 503L), gateway.kicked());
    assertEquals(
        List.of(
            ModerationEventRouter.REASON_ROLE_DELETE,
            ModerationEventRouter.REASON_BAN,
            ModerationEventRouter.REASON_KICK),
        gateway.kickReasons());
  }

  @Test
  void voluntaryLeaveWithoutAuditRecordDoesNothing() {
    ModerationEventRouter router = router(policy(false), DIRECT);

    router.submit(new MemberRemoved(COMMUNITY, SPAMMER));

    assertTrue(gateway.kicked().isEmpty());
    assertEquals(1, metrics.count("audit.attribution.none"));
  }

  @Test
  void trustedActorIsNotPunished() {
    directory.add(record(1, AuditActionKind.MEMBER_BAN, TRUSTED, 44L, Instant.ofEpochMilli(T0)));
    ModerationEventRouter router = router(policy(false), DIRECT);

    router.submit(new MemberBanned(COMMUNITY, 44L));

    assertTrue(gateway.kicked().isEmpty());
  }

  @Test
  void repeatedWebhookCreationEscalatesToKick() {
    gateway.channel(10L, 901L, 902L, 903L);
    ModerationEventRouter router = router(policy(false), DIRECT);

    for (int i = 1; i <= 3; i++) {
      directory.add(record(i, AuditActionKind.WEBHOOK_CREATE, ROGUE_ADMIN, 900L + i, Instant.ofEpochMilli(
          clock.nowMillis())));
      router.submit(new WebhooksUpdated(COMMUNITY, 10L));
    }

    assertEquals(List.of(901L, 902L, 903L), gateway.deletedWebhooks());
    assertEquals(3, metrics.count("webhook.violation"));
    assertEquals(List.of(ROGUE_ADMIN), gateway.kicked());
    assertEquals(List.of(ModerationEventRouter.REASON_WEBHOOK_KICK), gateway.kickReasons());
    assertEquals(0, webhookTracker.count(ROGUE_ADMIN));
  }

  @Test
  void violationRecordedWhileKickIsInFlightIsKept() {
    gateway.channel(10L, 901L, 902L, 903L);
    gateway.duringKick(() -> webhookTracker.recordViolationAndRelease(ROGUE_ADMIN));
    ModerationEventRouter router = router(policy(false), DIRECT);

    for (int i = 1; i <= 3; i++) {
      directory.add(record(i, AuditActionKind.WEBHOOK_CREATE, ROGUE_ADMIN, 900L + i, Instant.ofEpochMilli(
          clock.nowMillis())));
      router.submit(new WebhooksUpdated(COMMUNITY, 10L));
    }

    assertEquals(List.of(ROGUE_ADMIN), gateway.kicked());
    assertEquals(1, webhookTracker.count(ROGUE_ADMIN));
  }

  @Test
  void sameAuditRecordCountsOnce() {
    gateway.channel(10L, 901L);
    directory.add(record(1, AuditActionKind.WEBHOOK_CREATE, ROGUE_ADMIN, 901L, Instant.ofEpochMilli(T0)));
    ModerationEventRouter router = router(policy(false), DIRECT);

    router.submit(new WebhooksUpdated(COMMUNITY, 10L));
    router.submit(new WebhooksUpdated(COMMUNITY, 10L));
    router.submit(new WebhooksUpdated(COMMUNITY, 10L));

    assertEquals(1, metrics.count("webhook.violation"));
    assertTrue(gateway.kicked().isEmpty());
    assertEquals(1, router.processedRecordCount());
  }

  @Test
  void trustedWebhookCreatorIsIgnored() {
    gateway.channel(10L, 901L);
    directory.add(record(1, AuditActionKind.WEBHOOK_CREATE, TRUSTED, 901L, Instant.ofEpochMilli(T0)));
    ModerationEventRouter router = router(policy(false), DIRECT);

    router.submit(new WebhooksUpdated(COMMUNITY, 10L));

    assertTrue(gateway.deletedWebhooks().isEmpty());
    assertEquals(0, metrics.count("webhook.violation"));
  }

  @Test
  void processedRecordsExpireAfterRetention() {
    gateway.channel(10L, 901L);
    directory.add(record(1, AuditActionKind.WEBHOOK_CREATE, ROGUE_ADMIN, 901L, Instant.ofEpochMilli(T0)));
    ModerationEventRouter router = router(policy(false), DIRECT);
    router.submit(new WebhooksUpdated(COMMUNITY, 10L));

    assertEquals(0, router.sweepProcessed(clock.nowMillis() + Duration.ofMinutes(1).toMillis()));
    assertEquals(1, router.sweepProcessed(clock.nowMillis() + Duration.ofMinutes(6).toMillis()));
  }

  @Test
  void saturatedExecutorDropsEvent() {
    Executor rejecting = task -> {
      throw new RejectedExecutionException("full");
    };
    ModerationEventRouter router = router(policy(false), rejecting);

    assertFalse(router.submit(invite(SPAMMER, 1)));

    assertEquals(1, metrics.count("events.rejected"));
    assertTrue(gateway.deletedMessages().isEmpty());
    assertTrue(appender.list.stream()
        .anyMatch(e -> e.getLevel() == Level.WARN && e.getFormattedMessage().startsWith("Dropped message event")));
  }

  @Test
  void taskFailureIsContainedAndCounted() {
    AuditDirectoryPort broken = (communityId, kind, limit) -> {
      throw new IllegalStateException("boom");
    };
    ModerationEventRouter router = router(policy(false), DIRECT, broken);

    assertTrue(router.submit(new ChannelDeleted(COMMUNITY, 42L)));

    assertEquals(1, metrics.count("events.failed"));
    assertEquals(1, metrics.observed("events.handle.latencyMillis").size());
  }

  @Test
  void tasksRunWithEventContext() {
    List<String> seen = new ArrayList<>();
    AuditDirectoryPort recording = (communityId, kind, limit) -> {
      seen.add(MDC.get("communityId") + "/" + MDC.get("event"));
      return List.of();
    };
    ModerationEventRouter router = router(policy(false), DIRECT, recording);

    router.submit(new RoleDeleted(COMMUNITY, 43L));

    assertFalse(seen.isEmpty());
    assertEquals("1/role.deleted", seen.get(0));
    assertNull(MDC.get("event"));
  }
}
