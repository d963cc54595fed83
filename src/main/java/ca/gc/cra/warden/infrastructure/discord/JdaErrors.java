package ca.gc.cra.warden.infrastructure.discord;

import ca.gc.cra.warden.application.port.GatewayErrorKind;
import ca.gc.cra.warden.application.port.GatewayException;
import ca.gc.cra.warden.domain.audit.AuditActionKind;
import net.dv8tion.jda.api.audit.ActionType;
import net.dv8tion.jda.api.exceptions.ErrorResponseException;
import net.dv8tion.jda.api.exceptions.PermissionException;
import net.dv8tion.jda.api.requests.ErrorResponse;

/**
 * Translation between JDA types and the gateway port vocabulary.
 *
 * @since 0.1.0
 */
final class JdaErrors {
  private JdaErrors() {}

  /**
   * Wraps a JDA failure in a {@link GatewayException} of the matching kind.
   *
   * @param action short description of the failed call, used in the message
   * @param failure exception raised by JDA
   * @return translated exception with {@code failure} as cause
   */
  static GatewayException translate(String action, RuntimeException failure) {
    GatewayErrorKind kind;
    if (failure instanceof PermissionException) {
      kind = GatewayErrorKind.PERMISSION_DENIED;
    } else if (failure instanceof ErrorResponseException response) {
      kind = kindOf(response.getErrorResponse());
    } else {
      kind = GatewayErrorKind.TRANSIENT;
    }
    return new GatewayException(kind, action + " failed: " + failure.getMessage(), failure);
  }

  static GatewayErrorKind kindOf(ErrorResponse response) {
    if (response == null) {
      return GatewayErrorKind.TRANSIENT;
    }
    return switch (response) {
      case MISSING_PERMISSIONS, MISSING_ACCESS -> GatewayErrorKind.PERMISSION_DENIED;
      case UNKNOWN_MEMBER, UNKNOWN_MESSAGE, UNKNOWN_WEBHOOK, UNKNOWN_CHANNEL, UNKNOWN_USER, UNKNOWN_GUILD ->
          GatewayErrorKind.NOT_FOUND;
      default -> GatewayErrorKind.TRANSIENT;
    };
  }

  static ActionType actionType(AuditActionKind kind) {
    return switch (kind) {
      case BOT_ADD -> ActionType.BOT_ADD;
      case CHANNEL_DELETE -> ActionType.CHANNEL_DELETE;
      case ROLE_DELETE -> ActionType.ROLE_DELETE;
      case MEMBER_BAN -> ActionType.BAN;
      case MEMBER_KICK -> ActionType.KICK;
      case WEBHOOK_CREATE -> ActionType.WEBHOOK_CREATE;
    };
  }
}
