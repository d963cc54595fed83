package ca.gc.cra.warden.application.port;

/**
 * Failure categories reported by the platform gateway and audit directory ports.
 *
 * @since 0.1.0
 */
public enum GatewayErrorKind {
  /** The agent's account lacks the rights for the requested mutation or query. */
  PERMISSION_DENIED,
  /** The target (member, message, webhook, channel) no longer exists. */
  NOT_FOUND,
  /** Rate limiting, network failure, or any other recoverable platform error. */
  TRANSIENT
}
