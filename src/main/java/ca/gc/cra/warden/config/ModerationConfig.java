package ca.gc.cra.warden.config;

import ca.gc.cra.warden.validation.Numbers;
import ca.gc.cra.warden.validation.Strings;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * <strong>What:</strong> Immutable moderation settings for one agent process.
 * <p><strong>Why:</strong> Centralizes thresholds, windows and pool sizing so every service is built from one
 * validated source.</p>
 * <p><strong>Role:</strong> Configuration record consumed by {@link CompositionRoot}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Parse flat {@code key=value} maps produced by the YAML loader and CLI.</li>
 *   <li>Reject out-of-range values with {@link IllegalArgumentException}.</li>
 *   <li>Expose its own defaults as a flat map for {@link DefaultsForMode}.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable record; safe to share.</p>
 *
 * @param trustedAccounts accounts exempt from enforcement
 * @param tokenEnv environment variable holding the bot token
 * @param inviteWindow invite detection window
 * @param inviteThreshold invite posts within the window that trigger enforcement
 * @param inviteCapacity per-account invite window capacity
 * @param deleteTrustedInvites whether invite links from trusted accounts are deleted
 * @param timeout invite-spam timeout length
 * @param webhookThreshold webhook violations before a kick
 * @param webhookFreshness maximum age of webhook-creation audit records
 * @param webhookPageSize webhook-creation audit records inspected per event
 * @param webhookSearchChannelLimit channels inspected by the webhook fallback search
 * @param auditFreshness maximum age of audit records used for attribution
 * @param auditPageSize audit records per attribution query
 * @param auditRetries extra attribution attempts when nothing matches
 * @param propagationDelay wait before the first audit lookup of an event
 * @param auditThrottle minimum spacing between lookups for one key
 * @param eventWorkers event worker threads
 * @param eventQueueCapacity pending event bound
 * @param sweepInterval idle state sweep period
 * @since 0.1.0
 */
public record ModerationConfig(
    Set<Long> trustedAccounts,
    String tokenEnv,
    Duration inviteWindow,
    int inviteThreshold,
    int inviteCapacity,
    boolean deleteTrustedInvites,
    Duration timeout,
    int webhookThreshold,
    Duration webhookFreshness,
    int webhookPageSize,
    int webhookSearchChannelLimit,
    Duration auditFreshness,
    int auditPageSize,
    int auditRetries,
    Duration propagationDelay,
    Duration auditThrottle,
    int eventWorkers,
    int eventQueueCapacity,
    Duration sweepInterval) {

  private static final Pattern ENV_NAME = Pattern.compile("^[A-Za-z_][A-Za-z0-9_]*$");
  /** Platform limit for member timeouts. */
  private static final long MAX_TIMEOUT_MINUTES = Duration.ofDays(28).toMinutes();

  /**
   * Validates every setting.
   *
   * @throws IllegalArgumentException when a value is out of range
   */
  public ModerationConfig {
    trustedAccounts = Set.copyOf(Objects.requireNonNullElse(trustedAccounts, Set.of()));
    for (Long id : trustedAccounts) {
      if (id <= 0) {
        throw new IllegalArgumentException("trustedAccounts must contain positive ids (was " + id + ")");
      }
    }
    tokenEnv = Strings.requirePrintableAscii("tokenEnv", Objects.requireNonNullElse(tokenEnv, ""), 128);
    if (!ENV_NAME.matcher(tokenEnv).matches()) {
      throw new IllegalArgumentException("tokenEnv must be a valid environment variable name");
    }
    requireSeconds("invite.windowSeconds", inviteWindow, 1, 3_600);
    Numbers.requireRange("invite.threshold", inviteThreshold, 1, 1_000);
    Numbers.requireRange("invite.capacity", inviteCapacity, inviteThreshold, 10_000);
    requireMinutes("timeoutMinutes", timeout, 1, MAX_TIMEOUT_MINUTES);
    Numbers.requireRange("webhook.threshold", webhookThreshold, 1, 100);
    requireSeconds("webhook.freshnessSeconds", webhookFreshness, 1, 3_600);
    Numbers.requireRange("webhook.pageSize", webhookPageSize, 1, 100);
    Numbers.requireRange("webhook.searchChannelLimit", webhookSearchChannelLimit, 0, 10_000);
    requireSeconds("audit.freshnessSeconds", auditFreshness, 1, 3_600);
    Numbers.requireRange("audit.pageSize", auditPageSize, 1, 100);
    Numbers.requireRange("audit.retries", auditRetries, 0, 5);
    requireMillis("audit.propagationDelayMillis", propagationDelay, 0, 60_000);
    requireMillis("audit.throttleMillis", auditThrottle, 0, 60_000);
    Numbers.requireRange("events.workers", eventWorkers, 1, 256);
    Numbers.requireRange("events.queueCapacity", eventQueueCapacity, 1, 1_000_000);
    requireSeconds("sweep.intervalSeconds", sweepInterval, 1, 86_400);
  }

  /**
   * Returns the built-in defaults.
   *
   * @return default configuration with no trusted accounts
   */
  public static ModerationConfig defaults() {
    return new ModerationConfig(
        Set.of(),
        "DISCORD_TOKEN",
        Duration.ofSeconds(15),
        5,
        50,
        false,
        Duration.ofMinutes(60),
        3,
        Duration.ofSeconds(30),
        6,
        50,
        Duration.ofSeconds(20),
        8,
        1,
        Duration.ofMillis(1_000),
        Duration.ofMillis(1_000),
        8,
        1_024,
        Duration.ofSeconds(60));
  }

  /**
   * Builds a configuration from a flat map; absent or blank keys keep their defaults.
   *
   * @param options flat configuration map
   * @return validated configuration
   * @throws IllegalArgumentException when a value is malformed or out of range
   */
  public static ModerationConfig fromMap(Map<String, String> options) {
    Objects.requireNonNull(options, "options");
    ModerationConfig d = defaults();
    return new ModerationConfig(
        parseAccounts(options.get("trustedAccounts")),
        text(options, "tokenEnv", d.tokenEnv()),
        Duration.ofSeconds(number(options, "invite.windowSeconds", d.inviteWindow().toSeconds(), 1, 3_600)),
        intNumber(options, "invite.threshold", d.inviteThreshold(), 1, 1_000),
        intNumber(options, "invite.capacity", d.inviteCapacity(), 1, 10_000),
        bool(options, "invite.deleteTrusted", d.deleteTrustedInvites()),
        Duration.ofMinutes(number(options, "timeoutMinutes", d.timeout().toMinutes(), 1, MAX_TIMEOUT_MINUTES)),
        intNumber(options, "webhook.threshold", d.webhookThreshold(), 1, 100),
        Duration.ofSeconds(
            number(options, "webhook.freshnessSeconds", d.webhookFreshness().toSeconds(), 1, 3_600)),
        intNumber(options, "webhook.pageSize", d.webhookPageSize(), 1, 100),
        intNumber(options, "webhook.searchChannelLimit", d.webhookSearchChannelLimit(), 0, 10_000),
        Duration.ofSeconds(number(options, "audit.freshnessSeconds", d.auditFreshness().toSeconds(), 1, 3_600)),
        intNumber(options, "audit.pageSize", d.auditPageSize(), 1, 100),
        intNumber(options, "audit.retries", d.auditRetries(), 0, 5),
        Duration.ofMillis(
            number(options, "audit.propagationDelayMillis", d.propagationDelay().toMillis(), 0, 60_000)),
        Duration.ofMillis(number(options, "audit.throttleMillis", d.auditThrottle().toMillis(), 0, 60_000)),
        intNumber(options, "events.workers", d.eventWorkers(), 1, 256),
        intNumber(options, "events.queueCapacity", d.eventQueueCapacity(), 1, 1_000_000),
        Duration.ofSeconds(number(options, "sweep.intervalSeconds", d.sweepInterval().toSeconds(), 1, 86_400)));
  }

  /**
   * Flattens this configuration back into the key space accepted by {@link #fromMap(Map)}.
   *
   * @return ordered flat map
   */
  public Map<String, String> toFlatMap() {
    Map<String, String> map = new LinkedHashMap<>();
    StringBuilder accounts = new StringBuilder();
    for (Long id : trustedAccounts) {
      if (accounts.length() > 0) {
        accounts.append(',');
      }
      accounts.append(id);
    }
    map.put("trustedAccounts", accounts.toString());
    map.put("tokenEnv", tokenEnv);
    map.put("invite.windowSeconds", Long.toString(inviteWindow.toSeconds()));
    map.put("invite.threshold", Integer.toString(inviteThreshold));
    map.put("invite.capacity", Integer.toString(inviteCapacity));
    map.put("invite.deleteTrusted", Boolean.toString(deleteTrustedInvites));
    map.put("timeoutMinutes", Long.toString(timeout.toMinutes()));
    map.put("webhook.threshold", Integer.toString(webhookThreshold));
    map.put("webhook.freshnessSeconds", Long.toString(webhookFreshness.toSeconds()));
    map.put("webhook.pageSize", Integer.toString(webhookPageSize));
    map.put("webhook.searchChannelLimit", Integer.toString(webhookSearchChannelLimit));
    map.put("audit.freshnessSeconds", Long.toString(auditFreshness.toSeconds()));
    map.put("audit.pageSize", Integer.toString(auditPageSize));
    map.put("audit.retries", Integer.toString(auditRetries));
    map.put("audit.propagationDelayMillis", Long.toString(propagationDelay.toMillis()));
    map.put("audit.throttleMillis", Long.toString(auditThrottle.toMillis()));
    map.put("events.workers", Integer.toString(eventWorkers));
    map.put("events.queueCapacity", Integer.toString(eventQueueCapacity));
    map.put("sweep.intervalSeconds", Long.toString(sweepInterval.toSeconds()));
    return map;
  }

  static Set<Long> parseAccounts(String raw) {
    if (raw == null || raw.isBlank()) {
      return Set.of();
    }
    Set<Long> ids = new LinkedHashSet<>();
    for (String token : raw.split("[,\\s]+")) {
      if (token.isEmpty()) {
        continue;
      }
      ids.add(Numbers.parseRange("trustedAccounts", token, 1, Long.MAX_VALUE));
    }
    return ids;
  }

  private static String text(Map<String, String> options, String key, String defaultValue) {
    String value = options.get(key);
    return value == null || value.isBlank() ? defaultValue : value.trim();
  }

  /** Values are range-checked before narrowing or {@link Duration} conversion. */
  private static long number(Map<String, String> options, String key, long defaultValue, long min, long max) {
    String value = options.get(key);
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    return Numbers.parseRange(key, value, min, max);
  }

  private static int intNumber(Map<String, String> options, String key, int defaultValue, int min, int max) {
    return Math.toIntExact(number(options, key, defaultValue, min, max));
  }

  private static boolean bool(Map<String, String> options, String key, boolean defaultValue) {
    String value = options.get(key);
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    String normalized = value.trim().toLowerCase(Locale.ROOT);
    if (normalized.equals("true")) {
      return true;
    }
    if (normalized.equals("false")) {
      return false;
    }
    throw new IllegalArgumentException(key + " must be true or false (was " + value.trim() + ")");
  }

  private static void requireSeconds(String name, Duration value, long min, long max) {
    Numbers.requireRange(name, Objects.requireNonNull(value, name).toSeconds(), min, max);
  }

  private static void requireMinutes(String name, Duration value, long min, long max) {
    Numbers.requireRange(name, Objects.requireNonNull(value, name).toMinutes(), min, max);
  }

  private static void requireMillis(String name, Duration value, long min, long max) {
    Numbers.requireRange(name, Objects.requireNonNull(value, name).toMillis(), min, max);
  }
}
