package ca.gc.cra.subhunt.validation;

/**
 * <strong>What:</strong> Numeric validation helpers used by SubHunt CLI and configuration parsing.
 * <p><strong>Why:</strong> Guards against invalid worker counts, in-flight caps, backoff windows and page
 * sizes before the pipeline allocates threads or starts talking to upstream services.
 * <p><strong>Role:</strong> Domain support utilities invoked by configuration loaders.
 * <p><strong>Thread-safety:</strong> Immutable stateless utility.
 * <p><strong>Observability:</strong> Emits no metrics or logs; throws {@link IllegalArgumentException} when
 * validation fails.
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
   * @param value candidate value expressed in the caller's units (e.g., ms, threads)
   * @param min minimum inclusive value in the same units as {@code value}
   * @param max maximum inclusive value in the same units as {@code value}
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
   * Validates that {@code lower <= upper}, used for cross-field pairs such as backoff bounds.
   *
   * @param lowerName name of the lower-bound field
   * @param lower lower value
   * @param upperName name of the upper-bound field
   * @param upper upper value
   * @throws IllegalArgumentException when {@code lower > upper}
   */
  public static void requireOrdered(String lowerName, long lower, String upperName, long upper) {
    if (lower > upper) {
      throw new IllegalArgumentException(
          lowerName + " (" + lower + ") must not exceed " + upperName + " (" + upper + ")");
    }
  }
}
