package ca.gc.cra.subhunt.infrastructure.source;

import ca.gc.cra.subhunt.application.extract.HeuristicExtractor;
import ca.gc.cra.subhunt.application.port.CandidateConsumer;
import ca.gc.cra.subhunt.application.port.CandidateSource;
import ca.gc.cra.subhunt.application.port.HttpPort;
import ca.gc.cra.subhunt.application.port.Sleeper;
import ca.gc.cra.subhunt.application.port.TransportException;
import ca.gc.cra.subhunt.domain.json.JsonTree;
import ca.gc.cra.subhunt.infrastructure.http.RetryingTransport;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.net.URI;
import java.time.Duration;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Primary candidate source backed by the ip.thc.org subdomain lookup API.
 * <p><strong>Role:</strong> Paginated {@link CandidateSource}; each page is fetched, its candidates pushed to
 * the consumer, and the page boundary signalled before the next cursor is followed.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>POST {@code {"domain","limit","page_state"}} starting from an empty cursor.</li>
 *   <li>Stop when the response carries no cursor or repeats the current one.</li>
 *   <li>Pace pages with a fixed delay.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Runs entirely on the calling thread; instances hold no per-run state.</p>
 * <p><strong>Observability:</strong> DEBUG per page, INFO on completion. Transport failures propagate.</p>
 *
 * @since 0.1.0
 */
public final class ThcLookupSource implements CandidateSource {
  private static final Logger log = LoggerFactory.getLogger(ThcLookupSource.class);
  private static final String CONTENT_TYPE = "application/x-www-form-urlencoded";
  private static final String ACCEPT = "application/json, */*";

  private final Settings settings;
  private final RetryingTransport transport;
  private final HeuristicExtractor extractor;
  private final Sleeper sleeper;
  private final JsonFactory jsonFactory = new JsonFactory();

  /**
   * Creates the source.
   *
   * @param settings endpoint and paging settings
   * @param transport retrying JSON transport
   * @param extractor candidate and cursor extractor
   * @param sleeper delay primitive for inter-page pacing
   */
  public ThcLookupSource(
      Settings settings, RetryingTransport transport, HeuristicExtractor extractor, Sleeper sleeper) {
    this.settings = Objects.requireNonNull(settings, "settings");
    this.transport = Objects.requireNonNull(transport, "transport");
    this.extractor = Objects.requireNonNull(extractor, "extractor");
    this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
  }

  @Override
  public String name() {
    return "thc";
  }

  @Override
  public void collect(String domain, CandidateConsumer consumer)
      throws TransportException, InterruptedException {
    Objects.requireNonNull(domain, "domain");
    Objects.requireNonNull(consumer, "consumer");
    String cursor = "";
    int page = 0;
    long total = 0;
    while (true) {
      page++;
      JsonTree document = transport.request(
          HttpPort.Request.post(settings.endpoint(), headers(), requestBody(domain, cursor)));

      int emitted = 0;
      Iterator<String> candidates = extractor.extractCandidates(document).iterator();
      while (candidates.hasNext()) {
        consumer.accept(candidates.next());
        emitted++;
      }
      total += emitted;
      log.debug("{} page {} yielded {} raw candidates", name(), page, emitted);
      consumer.pageCompleted(page);

      Optional<String> next = extractor.extractCursor(document);
      if (next.isEmpty()) {
        break;
      }
      if (next.get().equals(cursor)) {
        log.debug("{} cursor repeated on page {}; stopping", name(), page);
        break;
      }
      cursor = next.get();
      sleeper.sleep(settings.pageDelay());
    }
    log.info("{} finished after {} page(s) with {} raw candidates", name(), page, total);
  }

  private Map<String, String> headers() {
    Map<String, String> headers = new LinkedHashMap<>();
    headers.put("Content-Type", CONTENT_TYPE);
    headers.put("Accept", ACCEPT);
    headers.put("User-Agent", settings.userAgent());
    return headers;
  }

  String requestBody(String domain, String cursor) {
    StringWriter out = new StringWriter();
    try (JsonGenerator generator = jsonFactory.createGenerator(out)) {
      generator.writeStartObject();
      generator.writeStringField("domain", domain);
      generator.writeNumberField("limit", settings.pageLimit());
      generator.writeStringField("page_state", cursor);
      generator.writeEndObject();
    } catch (IOException ex) {
      throw new UncheckedIOException("Failed to encode lookup request", ex);
    }
    return out.toString();
  }

  /**
   * Endpoint and paging settings.
   *
   * @param endpoint lookup URL
   * @param userAgent User-Agent header value
   * @param pageLimit results requested per page
   * @param pageDelay pause between pages
   */
  public record Settings(URI endpoint, String userAgent, int pageLimit, Duration pageDelay) {
    public Settings {
      Objects.requireNonNull(endpoint, "endpoint");
      Objects.requireNonNull(userAgent, "userAgent");
      Objects.requireNonNull(pageDelay, "pageDelay");
      if (pageLimit <= 0) {
        throw new IllegalArgumentException("pageLimit must be positive");
      }
    }
  }
}
