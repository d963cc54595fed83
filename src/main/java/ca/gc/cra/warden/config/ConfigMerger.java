package ca.gc.cra.warden.config;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Merges configuration from defaults, YAML, and CLI sources with precedence CLI &gt; YAML &gt; defaults.
 */
public final class ConfigMerger {

  private ConfigMerger() {}

  /**
   * Builds an effective configuration map.
   *
   * @param mode active CLI command
   * @param yaml optional YAML-derived settings for the command
   * @param cli CLI key/value overrides (may be empty)
   * @param defaults embedded defaults for the command; their keys are the recognized keys
   * @param warn consumer invoked for overridden YAML keys and unrecognized keys
   * @return immutable merged configuration map
   * @throws IllegalArgumentException when validation fails
   */
  public static Map<String, String> buildEffectiveConfig(
      String mode,
      Optional<Map<String, String>> yaml,
      Map<String, String> cli,
      Map<String, String> defaults,
      Consumer<String> warn) {
    Objects.requireNonNull(mode, "mode");
    Objects.requireNonNull(yaml, "yaml");
    Map<String, String> defaultsCopy = defaults == null ? Map.of() : defaults;
    Map<String, String> yamlCopy = yaml.orElse(Map.of());
    Map<String, String> cliCopy = cli == null ? Map.of() : cli;
    Consumer<String> sink = warn == null ? message -> { } : warn;

    Map<String, String> merged = new LinkedHashMap<>(defaultsCopy);
    for (Map.Entry<String, String> entry : yamlCopy.entrySet()) {
      warnIfUnknown(entry.getKey(), defaultsCopy, "YAML", sink);
      merged.put(entry.getKey(), entry.getValue());
    }
    for (Map.Entry<String, String> entry : cliCopy.entrySet()) {
      String key = entry.getKey();
      if (key == null) {
        continue;
      }
      warnIfUnknown(key, defaultsCopy, "CLI", sink);
      if (yamlCopy.containsKey(key)) {
        sink.accept("CLI overrides YAML for key: " + key);
      }
      if (entry.getValue() != null) {
        merged.put(key, entry.getValue());
      }
    }

    validate(mode, merged);
    return Map.copyOf(merged);
  }

  private static void validate(String mode, Map<String, String> effective) {
    String exporter = trim(effective.get("metricsExporter"));
    String endpoint = trim(effective.get("otelEndpoint"));
    if (exporter.equalsIgnoreCase("none") && !endpoint.isEmpty()) {
      throw new IllegalArgumentException("otelEndpoint requires metricsExporter=otlp for " + mode);
    }
  }

  private static void warnIfUnknown(
      String key, Map<String, String> defaults, String source, Consumer<String> warn) {
    if (!defaults.isEmpty() && !defaults.containsKey(key)) {
      warn.accept("Ignoring unrecognized " + source + " key: " + key);
    }
  }

  private static String trim(String value) {
    return value == null ? "" : value.trim();
  }
}
