package ca.gc.cra.warden.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.warden.application.moderation.ModerationEventRouter;
import ca.gc.cra.warden.application.moderation.TrustRegistry;
import ca.gc.cra.warden.domain.events.PlatformEvent.MessageReceived;
import ca.gc.cra.warden.infrastructure.metrics.NoOpMetricsAdapter;
import ca.gc.cra.warden.testutil.FakeAuditDirectory;
import ca.gc.cra.warden.testutil.FakeClock;
import ca.gc.cra.warden.testutil.FakePlatformGateway;
import ca.gc.cra.warden.testutil.RecordingMetrics;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class CompositionRootTest {
  private static final long SELF = 999L;

  @Test
  void selfAccountIsAlwaysTrusted() {
    CompositionRoot root = new CompositionRoot(
        ModerationConfig.fromMap(Map.of("trustedAccounts", "5")), new FakeClock(0L), null);

    TrustRegistry trust = root.trustRegistry(SELF);

    assertTrue(trust.isTrusted(SELF));
    assertTrue(trust.isTrusted(5L));
    assertEquals(2, trust.size());
  }

  @Test
  void policyReflectsConfiguration() {
    ModerationConfig config = ModerationConfig.fromMap(Map.of(
        "invite.threshold", "3",
        "invite.windowSeconds", "10",
        "timeoutMinutes", "5",
        "invite.deleteTrusted", "true"));

    ModerationEventRouter.Policy policy = new CompositionRoot(config, new FakeClock(0L), null).policy();

    assertEquals("Invite-Spam: >=3 in 10s", policy.inviteReason());
    assertEquals(Duration.ofMinutes(5), policy.timeout());
    assertTrue(policy.deleteTrustedInvites());
    assertEquals(Duration.ofSeconds(1), policy.propagationDelay());
  }

  @Test
  void metricsForSelectsAdapter() {
    assertInstanceOf(NoOpMetricsAdapter.class, CompositionRoot.metricsFor("none"));
    assertInstanceOf(NoOpMetricsAdapter.class, CompositionRoot.metricsFor(null));
  }

  @Test
  void startedRuntimeModeratesAndDrainsOnClose() {
    ModerationConfig config = ModerationConfig.fromMap(Map.of(
        "invite.threshold", "2",
        "events.workers", "2",
        "events.queueCapacity", "16"));
    FakePlatformGateway gateway = new FakePlatformGateway(SELF).member(7L);
    RecordingMetrics metrics = new RecordingMetrics();
    CompositionRoot root = new CompositionRoot(config, new FakeClock(1_700_000_000_000L), metrics);

    ModerationRuntime runtime = root.start(gateway, new FakeAuditDirectory());
    ModerationEventRouter router = runtime.router();
    assertTrue(router.submit(new MessageReceived(1L, 10L, 1L, 7L, false, "discord.gg/a")));
    assertTrue(router.submit(new MessageReceived(1L, 10L, 2L, 7L, false, "discord.gg/b")));
    runtime.close();
    runtime.close();

    assertEquals(2, gateway.deletedMessages().size());
    assertEquals(List.of(7L), gateway.timedOut());
    assertFalse(router.submit(new MessageReceived(1L, 10L, 3L, 7L, false, "discord.gg/c")));
    assertEquals(1, metrics.count("events.rejected"));
  }
}
