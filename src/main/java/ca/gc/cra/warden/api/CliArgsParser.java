package ca.gc.cra.warden.api;

import ca.gc.cra.warden.validation.Strings;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Turns {@code key=value} CLI arguments into a lookup map.
 *
 * <p>Repeated {@code trustedAccounts} arguments accumulate into one comma-separated value; any other repeated key
 * keeps its last value. Credentials are refused on the command line, where they would leak into process
 * listings.</p>
 *
 * @since 0.1.0
 */
public final class CliArgsParser {
  private static final Pattern KEY_PATTERN = Pattern.compile("^[A-Za-z0-9._-]+$");
  private static final String ACCUMULATED_KEY = "trustedAccounts";
  private static final Set<String> SECRET_KEYS = Set.of("token", "bottoken", "discordtoken");

  private CliArgsParser() {}

  /**
   * Converts command-line arguments into a mutable map split on the first {@code '='}.
   *
   * @param args raw CLI arguments; {@code null} returns an empty map
   * @return mutable map keyed by the argument prefix prior to {@code '='}
   * @throws IllegalArgumentException for malformed arguments or a credential passed inline
   */
  public static Map<String, String> toMap(String[] args) {
    Map<String, String> map = new LinkedHashMap<>();
    if (args == null) {
      return map;
    }
    for (String raw : args) {
      String arg = raw == null ? "" : raw.trim();
      if (arg.isEmpty()) {
        continue;
      }
      int idx = arg.indexOf('=');
      if (idx <= 0) {
        throw new IllegalArgumentException("argument must be key=value (was '" + arg + "')");
      }
      String key = arg.substring(0, idx).trim();
      String value = arg.substring(idx + 1).trim();
      if (!KEY_PATTERN.matcher(key).matches()) {
        throw new IllegalArgumentException("invalid argument name: " + key);
      }
      if (SECRET_KEYS.contains(key.toLowerCase(Locale.ROOT))) {
        throw new IllegalArgumentException(
            "do not pass the token as an argument; export it and set tokenEnv=<variable name>");
      }
      if (!value.isEmpty()) {
        Strings.requireNonBlank(key, value);
      }
      if (key.equals(ACCUMULATED_KEY) && map.containsKey(key)) {
        String previous = map.get(key);
        if (!value.isEmpty()) {
          map.put(key, previous.isEmpty() ? value : previous + "," + value);
        }
      } else {
        map.put(key, value);
      }
    }
    return map;
  }
}
