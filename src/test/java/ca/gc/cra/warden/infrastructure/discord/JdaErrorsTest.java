package ca.gc.cra.warden.infrastructure.discord;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.warden.application.port.GatewayErrorKind;
import ca.gc.cra.warden.application.port.GatewayException;
import ca.gc.cra.warden.domain.audit.AuditActionKind;
import net.dv8tion.jda.api.audit.ActionType;
import net.dv8tion.jda.api.exceptions.HierarchyException;
import net.dv8tion.jda.api.requests.ErrorResponse;
import org.junit.jupiter.api.Test;

class JdaErrorsTest {

  @Test
  void mapsErrorResponsesToKinds() {
    assertEquals(GatewayErrorKind.PERMISSION_DENIED, JdaErrors.kindOf(ErrorResponse.MISSING_PERMISSIONS));
    assertEquals(GatewayErrorKind.PERMISSION_DENIED, JdaErrors.kindOf(ErrorResponse.MISSING_ACCESS));
    assertEquals(GatewayErrorKind.NOT_FOUND, JdaErrors.kindOf(ErrorResponse.UNKNOWN_MEMBER));
    assertEquals(GatewayErrorKind.NOT_FOUND, JdaErrors.kindOf(ErrorResponse.UNKNOWN_WEBHOOK));
    assertEquals(GatewayErrorKind.NOT_FOUND, JdaErrors.kindOf(ErrorResponse.UNKNOWN_MESSAGE));
    assertEquals(GatewayErrorKind.TRANSIENT, JdaErrors.kindOf(ErrorResponse.SERVER_ERROR));
    assertEquals(GatewayErrorKind.TRANSIENT, JdaErrors.kindOf(null));
  }

  @Test
  void roleHierarchyViolationIsPermissionDenied() {
    HierarchyException failure = new HierarchyException("Can't modify a member with higher or equal highest role");

    GatewayException translated = JdaErrors.translate("kick", failure);

    assertTrue(translated.isPermissionDenied());
    assertSame(failure, translated.getCause());
    assertTrue(translated.getMessage().startsWith("kick failed"));
  }

  @Test
  void unexpectedFailureIsTransient() {
    GatewayException translated = JdaErrors.translate("timeout", new IllegalStateException("socket closed"));

    assertEquals(GatewayErrorKind.TRANSIENT, translated.kind());
  }

  @Test
  void mapsAuditKindsToActionTypes() {
    assertEquals(ActionType.BOT_ADD, JdaErrors.actionType(AuditActionKind.BOT_ADD));
    assertEquals(ActionType.CHANNEL_DELETE, JdaErrors.actionType(AuditActionKind.CHANNEL_DELETE));
    assertEquals(ActionType.ROLE_DELETE, JdaErrors.actionType(AuditActionKind.ROLE_DELETE));
    assertEquals(ActionType.BAN, JdaErrors.actionType(AuditActionKind.MEMBER_BAN));
    assertEquals(ActionType.KICK, JdaErrors.actionType(AuditActionKind.MEMBER_KICK));
    assertEquals(ActionType.WEBHOOK_CREATE, JdaErrors.actionType(AuditActionKind.WEBHOOK_CREATE));
  }
}
