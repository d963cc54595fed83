package ca.gc.cra.warden.validation;

/**
 * <strong>What:</strong> Numeric validation helpers used by WARDEN configuration parsing and services.
 * <p><strong>Why:</strong> Rejects invalid thresholds, window lengths and pool sizes before the agent connects.
 * <p><strong>Thread-safety:</strong> Immutable stateless utility.
 *
 * @since 0.1.0
 * @see Strings
 */
public final class Numbers {
  private Numbers() {
    // Utility
  }

  /**
   * Validates that a numeric value falls within an inclusive range.
   *
   * @param name logical parameter name included in diagnostics; defaults to {@code "value"} when blank
   * @param value candidate value
   * @param min minimum inclusive value
   * @param max maximum inclusive value
   * @return the validated value for fluent call sites
   * @throws IllegalArgumentException if {@code value} lies outside {@code [min, max]}
   */
  public static long requireRange(String name, long value, long min, long max) {
    if (value < min || value > max) {
      throw new IllegalArgumentException(
          (name == null || name.isBlank() ? "value" : name)
              + " must be between " + min + " and " + max + " (was " + value + ")");
    }
    return value;
  }

  /**
   * Parses a decimal long and validates its range.
   *
   * @param name logical parameter name included in diagnostics
   * @param raw candidate text; surrounding whitespace is ignored
   * @param min minimum inclusive value
   * @param max maximum inclusive value
   * @return parsed value
   * @throws IllegalArgumentException if the text is not a number or lies outside {@code [min, max]}
   */
  public static long parseRange(String name, String raw, long min, long max) {
    String label = name == null || name.isBlank() ? "value" : name;
    if (raw == null || raw.isBlank()) {
      throw new IllegalArgumentException(label + " must be a number");
    }
    long value;
    try {
      value = Long.parseLong(raw.trim());
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(label + " must be a number (was " + raw.trim() + ")", ex);
    }
    return requireRange(label, value, min, max);
  }
}
