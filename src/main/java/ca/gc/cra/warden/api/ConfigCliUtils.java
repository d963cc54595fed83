package ca.gc.cra.warden.api;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.function.Function;

/**
 * Resolves the configuration file location from CLI arguments and the environment.
 */
final class ConfigCliUtils {
  static final String CONFIG_ENV = "WARDEN_CONFIG";
  static final Path DEFAULT_CONFIG = Path.of("warden.yaml");

  private ConfigCliUtils() {}

  /**
   * Removes and returns the configuration path. Lookup order: {@code config=} argument, the
   * {@value #CONFIG_ENV} variable, then {@code ./warden.yaml} when it exists.
   *
   * @param args mutable CLI map; the {@code config} key is removed
   * @param env environment lookup
   * @return configuration path, or {@code null} when none applies
   */
  static Path extractConfigPath(Map<String, String> args, Function<String, String> env) {
    if (args != null) {
      for (String key : new String[] {"config", "--config"}) {
        String value = args.remove(key);
        if (value != null && !value.isBlank()) {
          return Path.of(value.trim());
        }
      }
    }
    String fromEnv = env == null ? null : env.apply(CONFIG_ENV);
    if (fromEnv != null && !fromEnv.isBlank()) {
      return Path.of(fromEnv.trim());
    }
    return Files.isRegularFile(DEFAULT_CONFIG) ? DEFAULT_CONFIG : null;
  }

  static boolean parseBoolean(Map<String, String> map, String key) {
    if (map == null) {
      return false;
    }
    String value = map.get(key);
    return value != null && Boolean.parseBoolean(value.trim());
  }
}
