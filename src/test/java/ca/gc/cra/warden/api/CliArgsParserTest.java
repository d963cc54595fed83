package ca.gc.cra.warden.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Map;
import org.junit.jupiter.api.Test;

class CliArgsParserTest {

  @Test
  void parsesKeyValuePairs() {
    Map<String, String> map = CliArgsParser.toMap(new String[] {"invite.threshold=7", " tokenEnv = MY_TOKEN "});

    assertEquals("7", map.get("invite.threshold"));
    assertEquals("MY_TOKEN", map.get("tokenEnv"));
  }

  @Test
  void repeatedTrustedAccountsAccumulate() {
    Map<String, String> map = CliArgsParser.toMap(
        new String[] {"trustedAccounts=1", "trustedAccounts=2,3", "trustedAccounts="});

    assertEquals("1,2,3", map.get("trustedAccounts"));
  }

  @Test
  void laterValueWinsForOtherKeys() {
    Map<String, String> map = CliArgsParser.toMap(new String[] {"events.workers=2", "events.workers=4"});

    assertEquals("4", map.get("events.workers"));
  }

  @Test
  void refusesTokensOnTheCommandLine() {
    IllegalArgumentException ex = assertThrows(
        IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"token=abc.def"}));
    assertTrue(ex.getMessage().contains("tokenEnv"));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"BotToken=x"}));
  }

  @Test
  void rejectsMalformedArguments() {
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"novalue"}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"=value"}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"bad key=1"}));
  }

  @Test
  void nullArgsYieldEmptyMap() {
    assertTrue(CliArgsParser.toMap(null).isEmpty());
  }
}
