package ca.gc.cra.warden.domain.audit;

import java.time.Instant;
import java.util.Objects;
import java.util.OptionalLong;

/**
 * <strong>What:</strong> Immutable view of a platform audit-log entry.
 * <p><strong>Why:</strong> Audit records are the only evidence linking an observed side effect (a deletion, a
 * ban, a webhook) to the account that caused it.</p>
 * <p><strong>Role:</strong> Domain value returned by the audit directory port; never written by WARDEN.</p>
 * <p><strong>Thread-safety:</strong> Immutable record; safe to share.</p>
 *
 * @param recordId platform identifier of the audit entry; unique per community
 * @param kind action category
 * @param actorId account that performed the action, when the platform reports one
 * @param targetId identifier of the affected entity (member, channel, role, webhook), when present
 * @param createdAt creation time of the entry
 * @since 0.1.0
 */
public record AuditRecord(
    long recordId,
    AuditActionKind kind,
    OptionalLong actorId,
    OptionalLong targetId,
    Instant createdAt) {

  /**
   * Validates record components.
   */
  public AuditRecord {
    Objects.requireNonNull(kind, "kind");
    actorId = Objects.requireNonNullElse(actorId, OptionalLong.empty());
    targetId = Objects.requireNonNullElse(targetId, OptionalLong.empty());
    Objects.requireNonNull(createdAt, "createdAt");
  }

  /**
   * Returns the age of the entry relative to {@code nowMillis}.
   *
   * @param nowMillis reference epoch milliseconds
   * @return elapsed milliseconds; negative when the platform clock runs ahead of ours
   */
  public long ageMillis(long nowMillis) {
    return nowMillis - createdAt.toEpochMilli();
  }

  /**
   * Checks whether the entry targets the given entity.
   *
   * @param id entity identifier
   * @return {@code true} when the target is present and equal to {@code id}
   */
  public boolean targets(long id) {
    return targetId.isPresent() && targetId.getAsLong() == id;
  }
}
