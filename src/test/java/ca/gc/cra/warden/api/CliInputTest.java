package ca.gc.cra.warden.api;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Set;
import org.junit.jupiter.api.Test;

class CliInputTest {

  @Test
  void separatesFlagsFromKeyValues() {
    CliInput input = CliInput.parse(new String[] {"--dry-run", "invite.threshold=3", "-v", "--colour"});

    assertTrue(input.dryRun());
    assertTrue(input.verbose());
    assertFalse(input.help());
    assertArrayEquals(new String[] {"invite.threshold=3"}, input.keyValueArgs());
    assertEquals(Set.of("--colour"), input.unknownFlags());
    assertTrue(input.hasFlag("--COLOUR"));
  }

  @Test
  void recognisesHelpAliases() {
    assertTrue(CliInput.parse(new String[] {"-h"}).help());
    assertTrue(CliInput.parse(new String[] {"help"}).help());
    assertTrue(CliInput.parse(new String[] {"--HELP"}).help());
  }

  @Test
  void nullArgumentsAreTolerated() {
    CliInput input = CliInput.parse(new String[] {null, " "});

    assertEquals(0, input.keyValueArgs().length);
    assertTrue(CliInput.parse(null).unknownFlags().isEmpty());
  }
}
