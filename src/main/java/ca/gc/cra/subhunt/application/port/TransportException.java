package ca.gc.cra.subhunt.application.port;

import java.util.Objects;

/**
 * Fatal failure talking to an upstream service after the retry policy has been applied.
 *
 * <p>Raised for non-retryable HTTP statuses, malformed bodies on successful responses, and
 * exhausted retry budgets. The CLI maps it to the upstream-failure exit code.</p>
 *
 * @since 0.1.0
 */
public final class TransportException extends Exception {
  private static final long serialVersionUID = 1L;

  /** Why the request was given up on. */
  public enum Reason {
    /** Non-transient, non-2xx status. */
    HTTP_STATUS,
    /** 2xx response whose body is not valid JSON. */
    MALFORMED_RESPONSE,
    /** Every attempt failed with a transient error. */
    RETRIES_EXHAUSTED
  }

  private final Reason reason;
  private final int status;
  private final int attempts;

  public TransportException(Reason reason, String message, int status, int attempts, Throwable cause) {
    super(message, cause);
    this.reason = Objects.requireNonNull(reason, "reason");
    this.status = status;
    this.attempts = attempts;
  }

  public Reason reason() {
    return reason;
  }

  /**
   * Returns the last HTTP status observed.
   *
   * @return status code, or {@code -1} when the failure was not an HTTP response
   */
  public int status() {
    return status;
  }

  public int attempts() {
    return attempts;
  }
}
