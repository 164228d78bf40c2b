package ca.gc.cra.subhunt.infrastructure.source;

import ca.gc.cra.subhunt.application.extract.HeuristicExtractor;
import ca.gc.cra.subhunt.application.port.MetricsPort;
import ca.gc.cra.subhunt.domain.Hostnames;
import ca.gc.cra.subhunt.domain.json.JsonTree;
import ca.gc.cra.subhunt.infrastructure.http.RetryingTransport;
import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.stream.Stream;

/**
 * Secondary source reading archived URLs from the Wayback Machine CDX API.
 *
 * <p>Rows are URLs such as {@code https://a.example.com:8443/login?x=1}; each is reduced to its
 * host. The CDX header row ({@code original}) falls out at the scope filter.</p>
 *
 * @since 0.1.0
 */
public final class WaybackArchiveSource extends OneShotSource {
  private final URI endpoint;
  private final int limit;
  private final HeuristicExtractor extractor;

  /**
   * Creates the source.
   *
   * @param endpoint CDX search endpoint, without query
   * @param limit maximum rows requested
   * @param userAgent User-Agent header value
   * @param transport retrying transport (normally with a small attempt budget)
   * @param metrics metrics sink
   */
  public WaybackArchiveSource(
      URI endpoint, int limit, String userAgent, RetryingTransport transport, MetricsPort metrics) {
    super(transport, metrics, userAgent);
    this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
    if (limit <= 0) {
      throw new IllegalArgumentException("limit must be positive");
    }
    this.limit = limit;
    this.extractor = new HeuristicExtractor();
  }

  @Override
  public String name() {
    return "wayback";
  }

  @Override
  URI buildUri(String domain) {
    String query = "url=" + URLEncoder.encode("*." + domain + "/*", StandardCharsets.UTF_8)
        + "&output=json&fl=original&collapse=urlkey&limit=" + limit;
    return URI.create(endpoint + "?" + query);
  }

  @Override
  Stream<String> candidates(JsonTree document) {
    return extractor.extractCandidates(document)
        .map(Hostnames::hostOf)
        .filter(host -> !host.isEmpty());
  }
}
