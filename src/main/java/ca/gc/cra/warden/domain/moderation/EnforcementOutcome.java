package ca.gc.cra.warden.domain.moderation;

/**
 * Result of a graduated enforcement attempt.
 *
 * @since 0.1.0
 */
public enum EnforcementOutcome {
  /** The member was timed out. */
  TIMED_OUT,
  /** The timeout failed and the member was kicked instead, or a direct kick succeeded. */
  KICKED,
  /** Nothing was applied: the member was gone, trusted, or every attempt failed. */
  NO_ACTION
}
