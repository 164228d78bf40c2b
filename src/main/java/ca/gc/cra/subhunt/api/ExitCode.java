package ca.gc.cra.subhunt.api;

/**
 * <strong>What:</strong> Canonical exit codes returned by the SubHunt command-line tool.
 * <p><strong>Why:</strong> Provides consistent process status semantics so operators and automation can react deterministically.</p>
 * <p><strong>Role:</strong> Adapter-facing enum returned by the CLI entry point.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable and thread-safe.</p>
 *
 * @since 0.1.0
 */
public enum ExitCode {
  /** Successful execution, including runs that found no hosts. */
  SUCCESS(0),
  /** Command-line arguments or the target domain were invalid. */
  INVALID_ARGS(2),
  /** IO failure occurred while running the CLI. */
  IO_ERROR(3),
  /** Configuration was missing or malformed. */
  CONFIG_ERROR(4),
  /** Unexpected runtime failure occurred. */
  RUNTIME_FAILURE(5),
  /** The primary upstream failed permanently or returned an unusable response. */
  UPSTREAM_FAILURE(6),
  /** Process was interrupted (e.g., SIGINT). */
  INTERRUPTED(130);

  private final int code;

  ExitCode(int code) {
    this.code = code;
  }

  /**
   * Returns the numeric value encoded by this exit code.
   *
   * @return numeric exit code
   */
  public int code() {
    return code;
  }
}
