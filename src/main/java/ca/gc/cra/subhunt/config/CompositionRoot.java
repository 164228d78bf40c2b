package ca.gc.cra.subhunt.config;

import ca.gc.cra.subhunt.application.extract.HeuristicExtractor;
import ca.gc.cra.subhunt.application.pipeline.DiscoveryUseCase;
import ca.gc.cra.subhunt.application.pipeline.ResolutionPipeline;
import ca.gc.cra.subhunt.application.pipeline.WildcardDetector;
import ca.gc.cra.subhunt.application.port.CandidateSource;
import ca.gc.cra.subhunt.application.port.HostResolver;
import ca.gc.cra.subhunt.application.port.HostSink;
import ca.gc.cra.subhunt.application.port.HttpPort;
import ca.gc.cra.subhunt.application.port.MetricsPort;
import ca.gc.cra.subhunt.application.port.ReportPort;
import ca.gc.cra.subhunt.application.port.Sleeper;
import ca.gc.cra.subhunt.infrastructure.dns.SystemHostResolver;
import ca.gc.cra.subhunt.infrastructure.http.JdkHttpAdapter;
import ca.gc.cra.subhunt.infrastructure.http.RetryPolicy;
import ca.gc.cra.subhunt.infrastructure.http.RetryingTransport;
import ca.gc.cra.subhunt.infrastructure.json.JsonTreeParser;
import ca.gc.cra.subhunt.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.subhunt.infrastructure.output.MarkdownReportWriter;
import ca.gc.cra.subhunt.infrastructure.source.CertificateTransparencySource;
import ca.gc.cra.subhunt.infrastructure.source.ThcLookupSource;
import ca.gc.cra.subhunt.infrastructure.source.WaybackArchiveSource;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * <strong>What:</strong> Central composition root that wires the discovery use case to concrete adapters.
 * <p><strong>Why:</strong> Provides a single place to translate {@link DiscoveryConfig} into a runnable pipeline.</p>
 * <p><strong>Role:</strong> Adapter composition root spanning sources -> resolution -> sink and report.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Build the primary lookup source and, when requested, the secondary sources with a reduced attempt budget.</li>
 *   <li>Share one HTTP adapter, one resolver and one metrics adapter across the graph.</li>
 *   <li>Release telemetry resources on {@link #close()}.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Holds immutable references; factory methods are not synchronized and are
 * invoked once during startup.</p>
 *
 * @since 0.1.0
 * @see DiscoveryUseCase
 */
public final class CompositionRoot implements AutoCloseable {
  /** Attempt budget for best-effort secondary sources. */
  static final int SECONDARY_MAX_ATTEMPTS = 2;

  private final DiscoveryConfig config;
  private final HostSink sink;
  private final MetricsPort metrics;
  private final OpenTelemetryMetricsAdapter telemetry;
  private final HttpPort http;
  private final HostResolver resolver;
  private final Sleeper sleeper;
  private final DoubleSupplier jitter;

  /**
   * Creates a root backed by the JDK HTTP client, the system resolver and OpenTelemetry metrics.
   *
   * @param config discovery configuration
   * @param sink receiver of validated hosts
   */
  public CompositionRoot(DiscoveryConfig config, HostSink sink) {
    this(config, sink, new OpenTelemetryMetricsAdapter());
  }

  private CompositionRoot(DiscoveryConfig config, HostSink sink, OpenTelemetryMetricsAdapter metrics) {
    this(
        config,
        sink,
        metrics,
        metrics,
        new JdkHttpAdapter(config.httpTimeout()),
        new SystemHostResolver(),
        Sleeper.SYSTEM,
        () -> ThreadLocalRandom.current().nextDouble(RetryPolicy.MIN_JITTER, RetryPolicy.MAX_JITTER));
  }

  /**
   * Creates a root with injected adapters, used by tests to run the full graph offline.
   *
   * @param config discovery configuration
   * @param sink receiver of validated hosts
   * @param metrics metrics sink
   * @param http wire adapter shared by every source
   * @param resolver DNS resolver
   * @param sleeper delay primitive for paging and backoff
   */
  public CompositionRoot(
      DiscoveryConfig config,
      HostSink sink,
      MetricsPort metrics,
      HttpPort http,
      HostResolver resolver,
      Sleeper sleeper) {
    this(config, sink, metrics, null, http, resolver, sleeper, () -> 1.0);
  }

  private CompositionRoot(
      DiscoveryConfig config,
      HostSink sink,
      MetricsPort metrics,
      OpenTelemetryMetricsAdapter telemetry,
      HttpPort http,
      HostResolver resolver,
      Sleeper sleeper,
      DoubleSupplier jitter) {
    this.config = Objects.requireNonNull(config, "config");
    this.sink = Objects.requireNonNull(sink, "sink");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.telemetry = telemetry;
    this.http = Objects.requireNonNull(http, "http");
    this.resolver = Objects.requireNonNull(resolver, "resolver");
    this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
    this.jitter = Objects.requireNonNull(jitter, "jitter");
  }

  /**
   * Builds the discovery use case described by the configuration.
   *
   * @return runnable use case
   */
  public DiscoveryUseCase discoveryUseCase() {
    RetryPolicy policy =
        new RetryPolicy(config.maxAttempts(), config.baseBackoff(), config.maxBackoff());
    CandidateSource primary = new ThcLookupSource(
        new ThcLookupSource.Settings(
            config.lookupUrl(), config.userAgent(), config.pageLimit(), config.pageDelay()),
        transport("thc", policy),
        new HeuristicExtractor(),
        sleeper);

    List<CandidateSource> secondaries = new ArrayList<>();
    if (config.allSources()) {
      RetryPolicy secondaryPolicy =
          policy.withMaxAttempts(Math.min(SECONDARY_MAX_ATTEMPTS, policy.maxAttempts()));
      secondaries.add(new WaybackArchiveSource(
          config.waybackUrl(),
          config.archiveLimit(),
          config.userAgent(),
          transport("wayback", secondaryPolicy),
          metrics));
      secondaries.add(new CertificateTransparencySource(
          config.crtshUrl(), config.userAgent(), transport("crtsh", secondaryPolicy), metrics));
    }

    Optional<ReportPort> report = config.reportPath().map(MarkdownReportWriter::new);
    return new DiscoveryUseCase(
        primary,
        secondaries,
        resolver,
        new WildcardDetector(resolver, config.wildcardProbes(), config.wildcardLabelLength()),
        sink,
        report,
        metrics,
        new ResolutionPipeline.Settings(config.workers(), config.maxInFlight()));
  }

  /**
   * Returns the shared metrics adapter.
   *
   * @return metrics port
   */
  public MetricsPort metrics() {
    return metrics;
  }

  /**
   * Flushes and releases telemetry resources owned by this root.
   */
  @Override
  public void close() {
    if (telemetry != null) {
      telemetry.close();
    }
  }

  private RetryingTransport transport(String name, RetryPolicy policy) {
    return new RetryingTransport(name, http, policy, new JsonTreeParser(), sleeper, jitter, metrics);
  }
}
