package ca.gc.cra.warden.config;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Supplies flattened default configuration maps for each WARDEN CLI command.
 *
 * <p>The key set doubles as the list of recognized configuration keys.</p>
 */
public final class DefaultsForMode {
  private static final Map<String, String> COMMON_DEFAULTS = buildCommonDefaults();

  private DefaultsForMode() {}

  /**
   * Returns a flattened map of defaults for the requested command merged with common defaults.
   *
   * @param mode target CLI command ({@code run})
   * @return unmodifiable map of default key/value pairs as strings
   * @throws IllegalArgumentException for an unknown command
   */
  public static Map<String, String> asFlatMap(String mode) {
    Objects.requireNonNull(mode, "mode");
    String normalized = mode.trim().toLowerCase(Locale.ROOT);
    Map<String, String> defaults = new LinkedHashMap<>(COMMON_DEFAULTS);
    if (!normalized.equals("run")) {
      throw new IllegalArgumentException("Unsupported mode: " + mode);
    }
    defaults.putAll(ModerationConfig.defaults().toFlatMap());
    defaults.put("dryRun", "false");
    return Map.copyOf(defaults);
  }

  private static Map<String, String> buildCommonDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("metricsExporter", "none");
    map.put("otelEndpoint", "");
    map.put("otelResourceAttributes", "");
    map.put("verbose", "false");
    return Map.copyOf(map);
  }
}
