package ca.gc.cra.warden.application.moderation;

import ca.gc.cra.warden.application.port.ClockPort;
import ca.gc.cra.warden.application.port.GatewayException;
import ca.gc.cra.warden.application.port.MetricsPort;
import ca.gc.cra.warden.application.port.PlatformGatewayPort;
import ca.gc.cra.warden.domain.moderation.EnforcementOutcome;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Applies graduated enforcement (timeout, then kick) against a community member.
 * <p><strong>Why:</strong> A temporary timeout is preferred over removal; when the platform refuses the timeout
 * the member is removed instead.</p>
 * <p><strong>Role:</strong> Application service invoked by the event router.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Re-check membership immediately before each mutation so late duplicate events are no-ops.</li>
 *   <li>Refuse to act on trusted accounts.</li>
 *   <li>Absorb every failure and report a definite {@link EnforcementOutcome}.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless apart from immutable collaborators; safe for concurrent use.</p>
 * <p><strong>Observability:</strong> Logs each applied action at INFO and failures at WARN; counts
 * {@code enforcement.timeout.*} and {@code enforcement.kick.*}.</p>
 *
 * @since 0.1.0
 */
public final class EnforcementActuator {
  private static final Logger log = LoggerFactory.getLogger(EnforcementActuator.class);

  private final PlatformGatewayPort gateway;
  private final TrustRegistry trust;
  private final ClockPort clock;
  private final MetricsPort metrics;

  /**
   * Creates an actuator.
   *
   * @param gateway platform gateway used for membership checks and mutations
   * @param trust accounts that must never be penalized
   * @param clock clock used to compute timeout deadlines
   * @param metrics metrics sink; {@code null} disables metrics
   */
  public EnforcementActuator(
      PlatformGatewayPort gateway, TrustRegistry trust, ClockPort clock, MetricsPort metrics) {
    this.gateway = Objects.requireNonNull(gateway, "gateway");
    this.trust = Objects.requireNonNull(trust, "trust");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
  }

  /**
   * Times out a member, falling back to a kick when the timeout is refused or fails.
   *
   * @param communityId community identifier
   * @param accountId member to restrict
   * @param duration timeout length
   * @param reason audit reason
   * @return {@link EnforcementOutcome#TIMED_OUT}, {@link EnforcementOutcome#KICKED} or
   *     {@link EnforcementOutcome#NO_ACTION}; never throws
   */
  public EnforcementOutcome timeoutOrKick(long communityId, long accountId, Duration duration, String reason) {
    if (!eligible(communityId, accountId, "timeout")) {
      return EnforcementOutcome.NO_ACTION;
    }
    Instant until = Instant.ofEpochMilli(clock.nowMillis()).plus(duration);
    try {
      gateway.timeoutUntil(communityId, accountId, until, reason);
      metrics.increment("enforcement.timeout.success");
      log.info("Timed out {} in community {} for {}: {}", accountId, communityId, duration, reason);
      return EnforcementOutcome.TIMED_OUT;
    } catch (GatewayException ex) {
      metrics.increment("enforcement.timeout.failed");
      if (ex.isNotFound()) {
        log.info("Member {} left community {} before the timeout applied", accountId, communityId);
        return EnforcementOutcome.NO_ACTION;
      }
      if (ex.isPermissionDenied()) {
        log.warn("Timeout forbidden for {} in community {}; attempting kick", accountId, communityId);
      } else {
        log.warn("Timeout failed for {} in community {}: {}; attempting kick",
            accountId, communityId, ex.getMessage());
      }
    } catch (RuntimeException ex) {
      metrics.increment("enforcement.timeout.failed");
      log.warn("Unexpected timeout failure for {} in community {}; attempting kick", accountId, communityId, ex);
    }
    return kick(communityId, accountId, reason) ? EnforcementOutcome.KICKED : EnforcementOutcome.NO_ACTION;
  }

  /**
   * Removes a member without attempting a timeout first.
   *
   * @param communityId community identifier
   * @param accountId member to remove
   * @param reason audit reason
   * @return {@code true} when the kick was applied; never throws
   */
  public boolean kick(long communityId, long accountId, String reason) {
    if (!eligible(communityId, accountId, "kick")) {
      return false;
    }
    try {
      gateway.kick(communityId, accountId, reason);
      metrics.increment("enforcement.kick.success");
      log.info("Kicked {} from community {}: {}", accountId, communityId, reason);
      return true;
    } catch (GatewayException ex) {
      metrics.increment("enforcement.kick.failed");
      if (ex.isNotFound()) {
        log.info("Member {} already left community {}", accountId, communityId);
      } else if (ex.isPermissionDenied()) {
        log.warn("Kick forbidden for {} in community {}; missing permission or role hierarchy",
            accountId, communityId);
      } else {
        log.warn("Kick failed for {} in community {}: {}", accountId, communityId, ex.getMessage());
      }
    } catch (RuntimeException ex) {
      metrics.increment("enforcement.kick.failed");
      log.warn("Unexpected kick failure for {} in community {}", accountId, communityId, ex);
    }
    return false;
  }

  private boolean eligible(long communityId, long accountId, String action) {
    if (trust.isTrusted(accountId)) {
      metrics.increment("enforcement.skipped.trusted");
      log.debug("Skipping {} for trusted account {}", action, accountId);
      return false;
    }
    boolean member;
    try {
      member = gateway.isMember(communityId, accountId);
    } catch (RuntimeException ex) {
      log.warn("Membership check failed for {} in community {}", accountId, communityId, ex);
      return false;
    }
    if (!member) {
      metrics.increment("enforcement.skipped.absent");
      log.debug("Skipping {} for {}: no longer a member of community {}", action, accountId, communityId);
      return false;
    }
    return true;
  }
}
