package ca.gc.cra.subhunt.infrastructure.source;

import ca.gc.cra.subhunt.application.port.CandidateConsumer;
import ca.gc.cra.subhunt.application.port.CandidateSource;
import ca.gc.cra.subhunt.application.port.HttpPort;
import ca.gc.cra.subhunt.application.port.MetricsPort;
import ca.gc.cra.subhunt.application.port.TransportException;
import ca.gc.cra.subhunt.domain.json.JsonTree;
import ca.gc.cra.subhunt.infrastructure.http.RetryingTransport;
import java.net.URI;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Base for secondary sources that answer in a single response.
 *
 * <p>A secondary source is best-effort: a {@link TransportException} is logged at WARN, counted as
 * {@code source.degraded}, and the run carries on with zero candidates from it.</p>
 */
abstract class OneShotSource implements CandidateSource {
  private static final Logger log = LoggerFactory.getLogger(OneShotSource.class);

  private final RetryingTransport transport;
  private final MetricsPort metrics;
  private final String userAgent;

  OneShotSource(RetryingTransport transport, MetricsPort metrics, String userAgent) {
    this.transport = Objects.requireNonNull(transport, "transport");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.userAgent = Objects.requireNonNull(userAgent, "userAgent");
  }

  @Override
  public final void collect(String domain, CandidateConsumer consumer) throws InterruptedException {
    Objects.requireNonNull(domain, "domain");
    Objects.requireNonNull(consumer, "consumer");
    JsonTree document;
    try {
      document = transport.request(HttpPort.Request.get(buildUri(domain), headers()));
    } catch (TransportException ex) {
      metrics.increment("source.degraded");
      log.warn("{} unavailable for {}; continuing without it: {}", name(), domain, ex.getMessage());
      return;
    }
    int emitted = 0;
    Iterator<String> candidates = candidates(document).iterator();
    while (candidates.hasNext()) {
      consumer.accept(candidates.next());
      emitted++;
    }
    consumer.pageCompleted(1);
    log.info("{} yielded {} raw candidates", name(), emitted);
  }

  /** Builds the single request target for {@code domain}. */
  abstract URI buildUri(String domain);

  /** Maps the parsed response to raw candidates. */
  abstract Stream<String> candidates(JsonTree document);

  private Map<String, String> headers() {
    Map<String, String> headers = new LinkedHashMap<>();
    headers.put("Accept", "application/json");
    headers.put("User-Agent", userAgent);
    return headers;
  }
}
