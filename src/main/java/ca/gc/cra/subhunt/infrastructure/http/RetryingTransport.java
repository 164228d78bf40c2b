package ca.gc.cra.subhunt.infrastructure.http;

import ca.gc.cra.subhunt.application.port.HttpPort;
import ca.gc.cra.subhunt.application.port.MetricsPort;
import ca.gc.cra.subhunt.application.port.Sleeper;
import ca.gc.cra.subhunt.application.port.TransportException;
import ca.gc.cra.subhunt.domain.json.JsonTree;
import ca.gc.cra.subhunt.infrastructure.json.JsonTreeParser;
import ca.gc.cra.subhunt.logging.Logs;
import java.io.IOException;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.DoubleSupplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Sends a JSON request with bounded retries and returns the parsed body.
 * <p><strong>Why:</strong> Public reconnaissance APIs rate-limit and flap; transient failures must not abort
 * a long discovery run, while permanent ones must fail fast.</p>
 * <p><strong>Role:</strong> Infrastructure helper shared by every HTTP candidate source.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Retry connection errors and transient statuses (408, 425, 429, any 5xx) with exponential backoff and
 *       jitter, honouring a numeric {@code Retry-After} on 429 as a lower bound.</li>
 *   <li>Fail immediately on other non-2xx statuses and on 2xx bodies that are not JSON.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless between calls; retry state is local to each
 * {@link #request(HttpPort.Request)} invocation.</p>
 * <p><strong>Observability:</strong> WARN per retry; counters {@code transport.retry} and
 * {@code transport.failure}.</p>
 *
 * @since 0.1.0
 */
public final class RetryingTransport {
  private static final Logger log = LoggerFactory.getLogger(RetryingTransport.class);
  private static final Set<Integer> TRANSIENT_STATUSES = Set.of(408, 425, 429, 500, 502, 503, 504);
  private static final int SNIPPET_CHARS = 200;
  private static final int DEBUG_BODY_BYTES = 512;

  private final String name;
  private final HttpPort http;
  private final RetryPolicy policy;
  private final JsonTreeParser parser;
  private final Sleeper sleeper;
  private final DoubleSupplier jitter;
  private final MetricsPort metrics;

  /**
   * Creates a transport.
   *
   * @param name label used in logs
   * @param http wire adapter
   * @param policy retry policy
   * @param parser JSON parser
   * @param sleeper delay primitive
   * @param jitter source of jitter factors
   * @param metrics metrics sink
   */
  public RetryingTransport(
      String name,
      HttpPort http,
      RetryPolicy policy,
      JsonTreeParser parser,
      Sleeper sleeper,
      DoubleSupplier jitter,
      MetricsPort metrics) {
    this.name = Objects.requireNonNull(name, "name");
    this.http = Objects.requireNonNull(http, "http");
    this.policy = Objects.requireNonNull(policy, "policy");
    this.parser = Objects.requireNonNull(parser, "parser");
    this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
    this.jitter = Objects.requireNonNull(jitter, "jitter");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Executes {@code request} until it succeeds, fails permanently, or the attempt budget runs out.
   *
   * @param request request to send; replayed verbatim on retry
   * @return parsed JSON body of the first 2xx response
   * @throws TransportException when the request fails permanently or retries are exhausted
   * @throws InterruptedException if interrupted while waiting on the network or a backoff delay
   */
  public JsonTree request(HttpPort.Request request) throws TransportException, InterruptedException {
    Objects.requireNonNull(request, "request");
    int maxAttempts = policy.maxAttempts();
    String lastError = "none";
    int lastStatus = -1;
    IOException lastCause = null;

    for (int attempt = 0; attempt < maxAttempts; attempt++) {
      Duration floor = Duration.ZERO;
      try {
        HttpPort.Response response = http.exchange(request);
        int status = response.status();
        if (response.isSuccess()) {
          return parse(request, response, attempt + 1);
        }
        if (!isTransient(status)) {
          metrics.increment("transport.failure");
          log.debug("{} {} {} returned {} body={}", name, request.method(), request.uri(), status,
              Logs.truncate(response.body(), DEBUG_BODY_BYTES));
          throw new TransportException(
              TransportException.Reason.HTTP_STATUS,
              name + " request to " + request.uri() + " failed with HTTP " + status,
              status,
              attempt + 1,
              null);
        }
        lastStatus = status;
        lastError = "HTTP " + status;
        lastCause = null;
        if (status == 429) {
          floor = retryAfter(response).orElse(Duration.ZERO);
        }
      } catch (IOException ex) {
        lastStatus = -1;
        lastError = ex.getClass().getSimpleName() + ": " + ex.getMessage();
        lastCause = ex;
      }

      if (attempt + 1 < maxAttempts) {
        Duration delay = policy.delayFor(attempt, jitter.getAsDouble());
        if (delay.compareTo(floor) < 0) {
          delay = floor;
        }
        metrics.increment("transport.retry");
        log.warn("{} attempt {}/{} failed ({}); retrying in {} ms",
            name, attempt + 1, maxAttempts, lastError, delay.toMillis());
        sleeper.sleep(delay);
      }
    }

    metrics.increment("transport.failure");
    throw new TransportException(
        TransportException.Reason.RETRIES_EXHAUSTED,
        name + " request to " + request.uri() + " failed after " + maxAttempts
            + " attempts; last error: " + lastError,
        lastStatus,
        maxAttempts,
        lastCause);
  }

  static boolean isTransient(int status) {
    return TRANSIENT_STATUSES.contains(status) || (status >= 500 && status <= 599);
  }

  private JsonTree parse(HttpPort.Request request, HttpPort.Response response, int attempts)
      throws TransportException {
    try {
      return parser.parse(response.body());
    } catch (IllegalArgumentException ex) {
      metrics.increment("transport.failure");
      throw new TransportException(
          TransportException.Reason.MALFORMED_RESPONSE,
          name + " returned non-JSON body from " + request.uri() + ": "
              + Logs.snippet(response.body(), SNIPPET_CHARS),
          response.status(),
          attempts,
          ex);
    }
  }

  private static Optional<Duration> retryAfter(HttpPort.Response response) {
    Optional<String> header = response.header("Retry-After");
    if (header.isEmpty()) {
      return Optional.empty();
    }
    try {
      long seconds = Long.parseLong(header.get().trim());
      return seconds > 0 ? Optional.of(Duration.ofSeconds(seconds)) : Optional.empty();
    } catch (NumberFormatException ex) {
      log.debug("Ignoring non-numeric Retry-After value '{}'", header.get());
      return Optional.empty();
    }
  }
}
