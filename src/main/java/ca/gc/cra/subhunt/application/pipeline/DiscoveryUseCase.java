package ca.gc.cra.subhunt.application.pipeline;

import ca.gc.cra.subhunt.application.port.CandidateConsumer;
import ca.gc.cra.subhunt.application.port.CandidateSource;
import ca.gc.cra.subhunt.application.port.HostResolver;
import ca.gc.cra.subhunt.application.port.HostSink;
import ca.gc.cra.subhunt.application.port.MetricsPort;
import ca.gc.cra.subhunt.application.port.ReportPort;
import ca.gc.cra.subhunt.application.port.TransportException;
import ca.gc.cra.subhunt.domain.AddressSet;
import ca.gc.cra.subhunt.domain.ResolvedHost;
import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Runs one discovery: wildcard detection, candidate collection, resolution and reporting.
 * <p><strong>Role:</strong> Application use case invoked by the CLI through the composition root.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Compute the wildcard signature before any candidate is resolved.</li>
 *   <li>Feed the primary source into the {@link ResolutionPipeline}, draining finished lookups after every page,
 *       then the secondary sources.</li>
 *   <li>Flush outstanding lookups and write the optional report.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> A single instance may run several domains one after another, not
 * concurrently; the calling thread is the producer for the whole run.</p>
 * <p><strong>Observability:</strong> MDC {@code pipeline=discover}; counter {@code discover.candidates};
 * histogram {@code discover.durationMs}.</p>
 *
 * @since 0.1.0
 */
public final class DiscoveryUseCase {
  private static final Logger log = LoggerFactory.getLogger(DiscoveryUseCase.class);

  private final CandidateSource primary;
  private final List<CandidateSource> secondaries;
  private final HostResolver resolver;
  private final WildcardDetector detector;
  private final HostSink sink;
  private final Optional<ReportPort> report;
  private final MetricsPort metrics;
  private final ResolutionPipeline.Settings settings;

  /**
   * Creates the use case.
   *
   * @param primary paginated source whose failures abort the run
   * @param secondaries best-effort sources run after the primary; may be empty
   * @param resolver resolver shared by the pipeline
   * @param detector wildcard detector
   * @param sink receiver of validated hosts as they are confirmed
   * @param report optional report writer
   * @param metrics metrics sink
   * @param settings pipeline sizing
   */
  public DiscoveryUseCase(
      CandidateSource primary,
      List<CandidateSource> secondaries,
      HostResolver resolver,
      WildcardDetector detector,
      HostSink sink,
      Optional<ReportPort> report,
      MetricsPort metrics,
      ResolutionPipeline.Settings settings) {
    this.primary = Objects.requireNonNull(primary, "primary");
    this.secondaries = List.copyOf(secondaries);
    this.resolver = Objects.requireNonNull(resolver, "resolver");
    this.detector = Objects.requireNonNull(detector, "detector");
    this.sink = Objects.requireNonNull(sink, "sink");
    this.report = Objects.requireNonNull(report, "report");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.settings = Objects.requireNonNull(settings, "settings");
  }

  /**
   * Discovers and validates subdomains of {@code domain}.
   *
   * @param domain validated, normalized target domain
   * @return run summary
   * @throws TransportException when the primary source fails
   * @throws InterruptedException if the run is interrupted
   */
  public DiscoveryReport run(String domain) throws TransportException, InterruptedException {
    Objects.requireNonNull(domain, "domain");
    MDC.put("pipeline", "discover");
    long started = System.nanoTime();
    try {
      log.info("Starting discovery for {} (sources: {})", domain, sourceNames());
      Optional<AddressSet> wildcard = detector.detect(domain);

      List<ResolvedHost> live = new ArrayList<>();
      HostSink collecting = host -> {
        live.add(host);
        sink.accept(host);
      };

      CandidateFeed feed;
      int submitted;
      try (ResolutionPipeline pipeline =
          new ResolutionPipeline(domain, resolver, wildcard, collecting, metrics, settings)) {
        feed = new CandidateFeed(pipeline, metrics);
        primary.collect(domain, feed);
        for (CandidateSource source : secondaries) {
          log.info("Querying secondary source {}", source.name());
          source.collect(domain, feed);
        }
        pipeline.flush();
        submitted = pipeline.seenCount();
        log.debug("Pipeline peaked at {} in-flight lookups", pipeline.highWaterMark());
      }

      live.sort(Comparator.comparing(ResolvedHost::hostname));
      report.ifPresent(port -> writeReport(port, domain, live));

      Duration elapsed = Duration.ofNanos(System.nanoTime() - started);
      metrics.observe("discover.durationMs", elapsed.toMillis());
      log.info("Discovery for {} finished in {} ms: {} candidates, {} resolved, {} live",
          domain, elapsed.toMillis(), feed.candidates(), submitted, live.size());
      return new DiscoveryReport(domain, feed.candidates(), submitted, live, wildcard, elapsed);
    } finally {
      MDC.remove("pipeline");
    }
  }

  private void writeReport(ReportPort port, String domain, List<ResolvedHost> hosts) {
    try {
      port.write(domain, hosts);
    } catch (IOException ex) {
      log.warn("Failed to write report for {}: {}", domain, ex.getMessage(), ex);
    }
  }

  private List<String> sourceNames() {
    List<String> names = new ArrayList<>();
    names.add(primary.name());
    secondaries.forEach(source -> names.add(source.name()));
    return names;
  }

  /** Bridges sources to the pipeline on the producer thread. */
  private static final class CandidateFeed implements CandidateConsumer {
    private final ResolutionPipeline pipeline;
    private final MetricsPort metrics;
    private long candidates;

    private CandidateFeed(ResolutionPipeline pipeline, MetricsPort metrics) {
      this.pipeline = pipeline;
      this.metrics = metrics;
    }

    @Override
    public void accept(String candidate) throws InterruptedException {
      candidates++;
      metrics.increment("discover.candidates");
      pipeline.submit(candidate);
    }

    @Override
    public void pageCompleted(int pageNumber) throws InterruptedException {
      pipeline.drainAvailable();
    }

    long candidates() {
      return candidates;
    }
  }
}
