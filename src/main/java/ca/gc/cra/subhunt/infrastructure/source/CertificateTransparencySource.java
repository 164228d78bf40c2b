package ca.gc.cra.subhunt.infrastructure.source;

import ca.gc.cra.subhunt.application.extract.HeuristicExtractor;
import ca.gc.cra.subhunt.application.port.MetricsPort;
import ca.gc.cra.subhunt.domain.Hostnames;
import ca.gc.cra.subhunt.domain.json.JsonTree;
import ca.gc.cra.subhunt.infrastructure.http.RetryingTransport;
import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.stream.Stream;

/**
 * Secondary source reading certificate transparency entries from crt.sh.
 *
 * <p>{@code name_value} may hold several names separated by newlines; wildcard names contribute
 * their base ({@code *.dev.example.com} yields {@code dev.example.com}).</p>
 *
 * @since 0.1.0
 */
public final class CertificateTransparencySource extends OneShotSource {
  private static final List<String> NAME_KEYS = List.of("name_value", "common_name");

  private final URI endpoint;
  private final HeuristicExtractor extractor =
      new HeuristicExtractor(NAME_KEYS, List.of(), List.of());

  /**
   * Creates the source.
   *
   * @param endpoint crt.sh base URL, without query
   * @param userAgent User-Agent header value
   * @param transport retrying transport (normally with a small attempt budget)
   * @param metrics metrics sink
   */
  public CertificateTransparencySource(
      URI endpoint, String userAgent, RetryingTransport transport, MetricsPort metrics) {
    super(transport, metrics, userAgent);
    this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
  }

  @Override
  public String name() {
    return "crtsh";
  }

  @Override
  URI buildUri(String domain) {
    String query = "q=" + URLEncoder.encode("%." + domain, StandardCharsets.UTF_8) + "&output=json";
    return URI.create(endpoint + "?" + query);
  }

  @Override
  Stream<String> candidates(JsonTree document) {
    return extractor.extractCandidates(document)
        .flatMap(value -> Arrays.stream(value.split("\n")))
        .map(Hostnames::stripWildcard)
        .filter(name -> !name.isEmpty());
  }
}
