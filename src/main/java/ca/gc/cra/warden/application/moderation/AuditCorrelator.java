package ca.gc.cra.warden.application.moderation;

import ca.gc.cra.warden.application.port.AuditDirectoryPort;
import ca.gc.cra.warden.application.port.ClockPort;
import ca.gc.cra.warden.application.port.GatewayException;
import ca.gc.cra.warden.application.port.MetricsPort;
import ca.gc.cra.warden.domain.audit.AuditActionKind;
import ca.gc.cra.warden.domain.audit.AuditRecord;
import ca.gc.cra.warden.validation.Numbers;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Attributes an observed side effect to the account that caused it using the audit log.
 * <p><strong>Why:</strong> Platform events such as a channel deletion do not name the actor; the audit log does,
 * but it is written asynchronously and may lag or be unavailable.</p>
 * <p><strong>Role:</strong> Application service used by the event router for administrative events.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Self-throttle so two lookups for the same (community, action, target) key are at least the throttle
 *   interval apart.</li>
 *   <li>Query a small page of the newest records of one action kind and pick the first fresh, matching one.</li>
 *   <li>Retry a bounded number of times when nothing matches yet.</li>
 *   <li>Absorb directory failures, reporting them as "no attribution".</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Throttle reservations are made with {@code compute} on a concurrent map,
 * so concurrent callers for one key are spaced out instead of querying together.</p>
 * <p><strong>Observability:</strong> Counts {@code audit.lookup}, {@code audit.lookup.failed},
 * {@code audit.lookup.throttled}, {@code audit.attribution.resolved} and {@code audit.attribution.none}.</p>
 *
 * @since 0.1.0
 */
public final class AuditCorrelator {
  private static final Logger log = LoggerFactory.getLogger(AuditCorrelator.class);
  private static final long THROTTLE_RETENTION_MILLIS = Duration.ofMinutes(1).toMillis();

  private final AuditDirectoryPort directory;
  private final ClockPort clock;
  private final MetricsPort metrics;
  private final long throttleMillis;
  private final int pageSize;
  private final int retries;
  private final ConcurrentMap<ThrottleKey, Long> lastLookups = new ConcurrentHashMap<>();

  /**
   * Creates a correlator.
   *
   * @param directory audit directory port
   * @param clock clock used for freshness checks and throttle waits
   * @param metrics metrics sink; {@code null} disables metrics
   * @param throttle minimum spacing between lookups for one key
   * @param pageSize records requested per attribution query (1-100)
   * @param retries additional attempts when no record matches (0-5)
   */
  public AuditCorrelator(
      AuditDirectoryPort directory,
      ClockPort clock,
      MetricsPort metrics,
      Duration throttle,
      int pageSize,
      int retries) {
    this.directory = Objects.requireNonNull(directory, "directory");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
    this.throttleMillis = Math.max(0L, Objects.requireNonNull(throttle, "throttle").toMillis());
    this.pageSize = (int) Numbers.requireRange("pageSize", pageSize, 1, 100);
    this.retries = (int) Numbers.requireRange("retries", retries, 0, 5);
  }

  /**
   * Finds the actor of the most recent fresh audit record matching the action and optional target.
   *
   * @param communityId community identifier
   * @param kind action category
   * @param targetId affected entity; empty matches any target
   * @param freshness maximum record age
   * @return actor account, or empty when no fresh matching record exists or the directory failed
   * @throws InterruptedException if interrupted while waiting on the throttle
   */
  public Optional<Long> attribute(
      long communityId, AuditActionKind kind, OptionalLong targetId, Duration freshness)
      throws InterruptedException {
    Objects.requireNonNull(kind, "kind");
    OptionalLong target = Objects.requireNonNullElse(targetId, OptionalLong.empty());
    long freshnessMillis = Objects.requireNonNull(freshness, "freshness").toMillis();
    ThrottleKey key = new ThrottleKey(communityId, kind, target);

    for (int attempt = 0; attempt <= retries; attempt++) {
      Optional<List<AuditRecord>> page = lookup(key, pageSize);
      if (page.isEmpty()) {
        break;
      }
      long now = clock.nowMillis();
      for (AuditRecord record : page.get()) {
        if (record.ageMillis(now) > freshnessMillis) {
          continue;
        }
        if (target.isPresent() && !record.targets(target.getAsLong())) {
          continue;
        }
        if (record.actorId().isEmpty()) {
          continue;
        }
        metrics.increment("audit.attribution.resolved");
        return Optional.of(record.actorId().getAsLong());
      }
      if (attempt < retries) {
        log.debug("No {} audit record for target {} yet (attempt {})", kind, describe(target), attempt + 1);
      }
    }
    metrics.increment("audit.attribution.none");
    return Optional.empty();
  }

  /**
   * Returns the fresh records of one action kind, newest first.
   *
   * @param communityId community identifier
   * @param kind action category
   * @param freshness maximum record age
   * @param limit maximum records to inspect
   * @return fresh records; empty when none or when the directory failed
   * @throws InterruptedException if interrupted while waiting on the throttle
   */
  public List<AuditRecord> recentRecords(
      long communityId, AuditActionKind kind, Duration freshness, int limit) throws InterruptedException {
    Objects.requireNonNull(kind, "kind");
    long freshnessMillis = Objects.requireNonNull(freshness, "freshness").toMillis();
    Optional<List<AuditRecord>> page =
        lookup(new ThrottleKey(communityId, kind, OptionalLong.empty()), Math.max(1, limit));
    if (page.isEmpty()) {
      return List.of();
    }
    long now = clock.nowMillis();
    List<AuditRecord> fresh = new ArrayList<>();
    for (AuditRecord record : page.get()) {
      if (record.ageMillis(now) <= freshnessMillis) {
        fresh.add(record);
      }
    }
    return List.copyOf(fresh);
  }

  /**
   * Drops throttle entries that can no longer delay a lookup.
   *
   * @param nowMillis reference epoch milliseconds
   * @return number of entries removed
   */
  public int sweep(long nowMillis) {
    int before = lastLookups.size();
    lastLookups.entrySet().removeIf(entry -> nowMillis - entry.getValue() > THROTTLE_RETENTION_MILLIS);
    return Math.max(0, before - lastLookups.size());
  }

  int throttleEntries() {
    return lastLookups.size();
  }

  private Optional<List<AuditRecord>> lookup(ThrottleKey key, int limit) throws InterruptedException {
    awaitThrottle(key);
    metrics.increment("audit.lookup");
    try {
      return Optional.of(directory.recent(key.communityId(), key.kind(), limit));
    } catch (GatewayException ex) {
      metrics.increment("audit.lookup.failed");
      if (ex.isPermissionDenied()) {
        log.warn("Missing permission to view the audit log of community {}", key.communityId());
      } else {
        log.warn("Audit log query for {} in community {} failed: {}",
            key.kind(), key.communityId(), ex.getMessage());
      }
      return Optional.empty();
    }
  }

  private void awaitThrottle(ThrottleKey key) throws InterruptedException {
    long now = clock.nowMillis();
    long[] wait = new long[1];
    lastLookups.compute(key, (k, previous) -> {
      long slot = previous == null ? now : Math.max(now, previous + throttleMillis);
      wait[0] = slot - now;
      return slot;
    });
    if (wait[0] > 0) {
      metrics.increment("audit.lookup.throttled");
      clock.sleep(Duration.ofMillis(wait[0]));
    }
  }

  private static String describe(OptionalLong target) {
    return target.isPresent() ? Long.toString(target.getAsLong()) : "<any>";
  }

  private record ThrottleKey(long communityId, AuditActionKind kind, OptionalLong targetId) {}
}
