package ca.gc.cra.subhunt.infrastructure.http;

import java.time.Duration;
import java.util.Objects;

/**
 * Bounded exponential backoff settings for upstream HTTP calls.
 *
 * @param maxAttempts total attempts including the first; at least one
 * @param baseBackoff delay after the first failed attempt, before jitter
 * @param maxBackoff ceiling applied before jitter
 * @since 0.1.0
 */
public record RetryPolicy(int maxAttempts, Duration baseBackoff, Duration maxBackoff) {
  /** Lowest jitter factor applied to a computed delay. */
  public static final double MIN_JITTER = 0.85;
  /** Highest jitter factor applied to a computed delay. */
  public static final double MAX_JITTER = 1.15;

  private static final int MAX_EXPONENT = 30;

  public RetryPolicy {
    if (maxAttempts < 1) {
      throw new IllegalArgumentException("maxAttempts must be at least 1 (was " + maxAttempts + ")");
    }
    Objects.requireNonNull(baseBackoff, "baseBackoff");
    Objects.requireNonNull(maxBackoff, "maxBackoff");
    if (baseBackoff.isNegative() || maxBackoff.isNegative()) {
      throw new IllegalArgumentException("backoff durations must not be negative");
    }
    if (baseBackoff.compareTo(maxBackoff) > 0) {
      throw new IllegalArgumentException("baseBackoff must not exceed maxBackoff");
    }
  }

  /**
   * Six attempts, 500 ms base, 20 s ceiling.
   *
   * @return default policy for the primary lookup source
   */
  public static RetryPolicy defaults() {
    return new RetryPolicy(6, Duration.ofMillis(500), Duration.ofSeconds(20));
  }

  /**
   * Returns a copy with a different attempt budget.
   *
   * @param attempts new attempt count
   * @return adjusted policy
   */
  public RetryPolicy withMaxAttempts(int attempts) {
    return new RetryPolicy(attempts, baseBackoff, maxBackoff);
  }

  /**
   * Computes {@code min(maxBackoff, baseBackoff * 2^attempt) * jitter}.
   *
   * @param attempt zero-based index of the attempt that just failed
   * @param jitter multiplicative factor, clamped to [{@value #MIN_JITTER}, {@value #MAX_JITTER}]
   * @return delay before the next attempt
   */
  public Duration delayFor(int attempt, double jitter) {
    int exponent = Math.max(0, Math.min(attempt, MAX_EXPONENT));
    long baseMillis = baseBackoff.toMillis();
    long maxMillis = maxBackoff.toMillis();
    long capped = baseMillis > (maxMillis >> exponent) ? maxMillis : Math.min(maxMillis, baseMillis << exponent);
    double factor = Math.max(MIN_JITTER, Math.min(MAX_JITTER, jitter));
    return Duration.ofMillis(Math.round(capped * factor));
  }
}
