package ca.gc.cra.warden.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Map;
import org.junit.jupiter.api.Test;

class DefaultsForModeTest {

  @Test
  void runDefaultsCoverCommonAndModerationKeys() {
    Map<String, String> defaults = DefaultsForMode.asFlatMap(" RUN ");

    assertEquals("none", defaults.get("metricsExporter"));
    assertEquals("false", defaults.get("dryRun"));
    assertEquals("DISCORD_TOKEN", defaults.get("tokenEnv"));
    assertEquals("5", defaults.get("invite.threshold"));
    assertEquals("15", defaults.get("invite.windowSeconds"));
    assertEquals("60", defaults.get("timeoutMinutes"));
    assertEquals("3", defaults.get("webhook.threshold"));
    assertEquals("", defaults.get("trustedAccounts"));
  }

  @Test
  void defaultsRoundTripIntoConfig() {
    assertEquals(ModerationConfig.defaults(), ModerationConfig.fromMap(DefaultsForMode.asFlatMap("run")));
  }

  @Test
  void unknownModeRejected() {
    assertThrows(IllegalArgumentException.class, () -> DefaultsForMode.asFlatMap("capture"));
  }
}
