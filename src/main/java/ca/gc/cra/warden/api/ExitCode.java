package ca.gc.cra.warden.api;

/**
 * <strong>What:</strong> Process exit codes returned by the WARDEN command line.
 * <p><strong>Why:</strong> Service managers restart on some failures (runtime) and not on others (bad
 * configuration); distinct codes let them tell the difference.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable.</p>
 *
 * @since 0.1.0
 */
public enum ExitCode {
  /** Clean shutdown or successful dry run. */
  SUCCESS(0),
  /** Command-line arguments were invalid. */
  INVALID_ARGS(2),
  /** The configuration file could not be read. */
  IO_ERROR(3),
  /** Configuration was rejected, including a missing or invalid token. */
  CONFIG_ERROR(4),
  /** Unexpected runtime failure, such as losing the gateway session during startup. */
  RUNTIME_FAILURE(5),
  /** Interrupted while connecting or running. */
  INTERRUPTED(130);

  private final int code;

  ExitCode(int code) {
    this.code = code;
  }

  /**
   * Returns the numeric value handed to {@link System#exit(int)}.
   *
   * @return numeric exit code
   */
  public int code() {
    return code;
  }
}
