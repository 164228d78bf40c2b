package ca.gc.cra.subhunt.application.port;

/**
 * <strong>What:</strong> Domain port abstracting SubHunt metrics emission.
 * <p><strong>Why:</strong> Lets the discovery pipeline record counters and durations without binding to a vendor SDK.</p>
 * <p><strong>Role:</strong> Domain port implemented by adapters such as {@code OpenTelemetryMetricsAdapter}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Expose counter increments for events like resolution misses or transport retries.</li>
 *   <li>Record numeric observations such as run duration.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Implementations must be safe for concurrent updates from the producer
 * thread and HTTP callers.</p>
 * <p><strong>Observability:</strong> Defines the metric name contract (e.g., {@code resolve.wildcard}).</p>
 *
 * @implNote Consumers must not pass {@code null} metric keys; adapters may normalize names.
 * @since 0.1.0
 */
public interface MetricsPort {
  /**
   * Increments the named counter by one.
   *
   * @param key metric identifier using dotted naming (e.g., {@code transport.retry}); must not be {@code null}
   */
  void increment(String key);

  /**
   * Records an observation for a histogram style metric.
   *
   * @param key metric identifier using dotted naming; must not be {@code null}
   * @param value observed value; semantics defined by the caller
   */
  void observe(String key, long value);

  /** Metrics implementation that ignores all updates; useful for tests. */
  MetricsPort NO_OP = new MetricsPort() {
    @Override public void increment(String key) {}

    @Override public void observe(String key, long value) {}
  };
}
