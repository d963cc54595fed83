package ca.gc.cra.warden.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class YamlConfigLoaderTest {

  @TempDir Path tempDir;

  @Test
  void loadMergesCommonAndRunSectionsIntoDottedKeys() throws IOException {
    Path yaml = tempDir.resolve("warden.yaml");
    Files.writeString(yaml, """
        common:
          metricsExporter: none
        run:
          tokenEnv: MY_TOKEN
          invite:
            threshold: 7
            windowSeconds: 20
        """);

    Optional<Map<String, String>> result = YamlConfigLoader.load(yaml, "run");

    assertTrue(result.isPresent());
    Map<String, String> map = result.orElseThrow();
    assertEquals("none", map.get("metricsExporter"));
    assertEquals("MY_TOKEN", map.get("tokenEnv"));
    assertEquals("7", map.get("invite.threshold"));
    assertEquals("20", map.get("invite.windowSeconds"));
  }

  @Test
  void runSectionOverridesCommon() throws IOException {
    Path yaml = tempDir.resolve("override.yaml");
    Files.writeString(yaml, """
        common:
          timeoutMinutes: 10
        RUN:
          timeoutMinutes: 30
        """);

    assertEquals("30", YamlConfigLoader.load(yaml, "run").orElseThrow().get("timeoutMinutes"));
  }

  @Test
  void trustedAccountsListIsJoined() throws IOException {
    Path yaml = tempDir.resolve("trusted.yaml");
    Files.writeString(yaml, """
        run:
          trustedAccounts:
            - 111111111111111111
            - 222222222222222222
        """);

    Map<String, String> map = YamlConfigLoader.load(yaml, "run").orElseThrow();

    assertEquals("111111111111111111,222222222222222222", map.get("trustedAccounts"));
  }

  @Test
  void listsAreRejectedForOtherKeys() throws IOException {
    Path yaml = tempDir.resolve("list.yaml");
    Files.writeString(yaml, """
        run:
          invite:
            threshold: [1, 2]
        """);

    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(yaml, "run"));
  }

  @Test
  void missingFileReturnsEmptyOptional() throws IOException {
    assertFalse(YamlConfigLoader.load(tempDir.resolve("missing.yaml"), "run").isPresent());
  }

  @Test
  void emptyDocumentYieldsEmptyMap() throws IOException {
    Path yaml = tempDir.resolve("empty.yaml");
    Files.writeString(yaml, "");

    assertEquals(Map.of(), YamlConfigLoader.load(yaml, "run").orElseThrow());
  }

  @Test
  void malformedYamlThrows() throws IOException {
    Path yaml = tempDir.resolve("broken.yaml");
    Files.writeString(yaml, "run: [unclosed\n");

    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(yaml, "run"));
  }

  @Test
  void rootMustBeMapping() throws IOException {
    Path yaml = tempDir.resolve("seq.yaml");
    Files.writeString(yaml, "- run\n");

    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(yaml, "run"));
  }
}
