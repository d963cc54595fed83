package ca.gc.cra.warden.application.port;

import java.util.Objects;

/**
 * Checked failure raised by {@link PlatformGatewayPort} and {@link AuditDirectoryPort} implementations.
 *
 * <p>Adapters translate library specific exceptions into one of the {@link GatewayErrorKind} categories so
 * moderation flows can decide between fallback, skip, and log without knowing the platform SDK.</p>
 *
 * @since 0.1.0
 */
public class GatewayException extends Exception {
  private static final long serialVersionUID = 1L;

  private final GatewayErrorKind kind;

  /**
   * Creates a gateway failure.
   *
   * @param kind failure category; must not be {@code null}
   * @param message diagnostic message
   */
  public GatewayException(GatewayErrorKind kind, String message) {
    super(message);
    this.kind = Objects.requireNonNull(kind, "kind");
  }

  /**
   * Creates a gateway failure wrapping the library exception.
   *
   * @param kind failure category; must not be {@code null}
   * @param message diagnostic message
   * @param cause underlying exception
   */
  public GatewayException(GatewayErrorKind kind, String message, Throwable cause) {
    super(message, cause);
    this.kind = Objects.requireNonNull(kind, "kind");
  }

  /**
   * Returns the failure category.
   *
   * @return failure category
   */
  public GatewayErrorKind kind() {
    return kind;
  }

  /**
   * Convenience for {@code kind() == PERMISSION_DENIED}.
   *
   * @return {@code true} when the agent lacked rights
   */
  public boolean isPermissionDenied() {
    return kind == GatewayErrorKind.PERMISSION_DENIED;
  }

  /**
   * Convenience for {@code kind() == NOT_FOUND}.
   *
   * @return {@code true} when the target was already gone
   */
  public boolean isNotFound() {
    return kind == GatewayErrorKind.NOT_FOUND;
  }
}
