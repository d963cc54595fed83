package ca.gc.cra.warden.domain.audit;

/**
 * Audit record categories the moderation engine correlates against.
 *
 * @since 0.1.0
 */
public enum AuditActionKind {
  /** A bot account was added to the community. */
  BOT_ADD,
  /** A channel was deleted. */
  CHANNEL_DELETE,
  /** A role was deleted. */
  ROLE_DELETE,
  /** A member was banned. */
  MEMBER_BAN,
  /** A member was kicked. */
  MEMBER_KICK,
  /** A webhook was created. */
  WEBHOOK_CREATE
}
