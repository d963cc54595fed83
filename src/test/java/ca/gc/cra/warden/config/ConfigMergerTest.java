package ca.gc.cra.warden.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class ConfigMergerTest {

  @Test
  void cliOverridesYamlOverridesDefaults() {
    Map<String, String> defaults = DefaultsForMode.asFlatMap("run");
    Map<String, String> yaml = Map.of("invite.threshold", "7", "timeoutMinutes", "30");
    Map<String, String> cli = Map.of("invite.threshold", "9");
    List<String> warnings = new ArrayList<>();

    Map<String, String> merged =
        ConfigMerger.buildEffectiveConfig("run", Optional.of(yaml), cli, defaults, warnings::add);

    assertEquals("9", merged.get("invite.threshold"));
    assertEquals("30", merged.get("timeoutMinutes"));
    assertEquals("3", merged.get("webhook.threshold"));
    assertEquals(List.of("CLI overrides YAML for key: invite.threshold"), warnings);
  }

  @Test
  void unknownKeysProduceWarnings() {
    List<String> warnings = new ArrayList<>();

    ConfigMerger.buildEffectiveConfig(
        "run",
        Optional.of(Map.of("invite.treshold", "7")),
        Map.of("evnts.workers", "2"),
        DefaultsForMode.asFlatMap("run"),
        warnings::add);

    assertTrue(warnings.contains("Ignoring unrecognized YAML key: invite.treshold"));
    assertTrue(warnings.contains("Ignoring unrecognized CLI key: evnts.workers"));
  }

  @Test
  void endpointRequiresOtlpExporter() {
    assertThrows(
        IllegalArgumentException.class,
        () -> ConfigMerger.buildEffectiveConfig(
            "run",
            Optional.empty(),
            Map.of("otelEndpoint", "http://collector:4317"),
            DefaultsForMode.asFlatMap("run"),
            msg -> {}));
  }

  @Test
  void endpointAcceptedWithOtlpExporter() {
    Map<String, String> merged = ConfigMerger.buildEffectiveConfig(
        "run",
        Optional.empty(),
        Map.of("otelEndpoint", "http://collector:4317", "metricsExporter", "otlp"),
        DefaultsForMode.asFlatMap("run"),
        msg -> {});

    assertEquals("otlp", merged.get("metricsExporter"));
  }
}
