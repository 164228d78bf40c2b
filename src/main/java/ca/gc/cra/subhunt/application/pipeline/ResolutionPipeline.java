package ca.gc.cra.subhunt.application.pipeline;

import ca.gc.cra.subhunt.application.port.HostResolver;
import ca.gc.cra.subhunt.application.port.HostSink;
import ca.gc.cra.subhunt.application.port.MetricsPort;
import ca.gc.cra.subhunt.domain.AddressSet;
import ca.gc.cra.subhunt.domain.Hostnames;
import ca.gc.cra.subhunt.domain.ResolvedHost;
import ca.gc.cra.subhunt.infrastructure.exec.ExecutorFactories;
import java.util.HashSet;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Bounded-concurrency DNS validation stage between candidate sources and the sink.
 * <p><strong>Why:</strong> Sources can produce hundreds of thousands of names; resolving them must overlap with
 * fetching without letting outstanding lookups grow without bound.</p>
 * <p><strong>Role:</strong> Application pipeline stage owned by {@link DiscoveryUseCase}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Normalize, scope-check and deduplicate candidates before they cost a lookup.</li>
 *   <li>Hold at most {@code maxInFlight} lookups outstanding, blocking the producer on a completion when full.</li>
 *   <li>Drop misses and answers equal to the wildcard signature; emit every other host once.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Not thread-safe. Every public method must be called from the single producer
 * thread; worker threads only run lookups, so the seen and found sets need no locking.</p>
 * <p><strong>Observability:</strong> Counters {@code discover.submitted}, {@code resolve.live},
 * {@code resolve.miss}, {@code resolve.wildcard}.</p>
 *
 * @since 0.1.0
 */
public final class ResolutionPipeline implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(ResolutionPipeline.class);

  private final String domain;
  private final HostResolver resolver;
  private final Optional<AddressSet> wildcard;
  private final HostSink sink;
  private final MetricsPort metrics;
  private final ExecutorService executor;
  private final CompletionService<Resolution> completions;
  private final int maxInFlight;

  private final Set<String> seen = new HashSet<>();
  private final Set<String> found = new HashSet<>();
  private int inFlight;
  private int highWaterMark;

  /**
   * Creates the pipeline and starts its worker pool.
   *
   * @param domain normalized target domain used for scope checks
   * @param resolver blocking resolver run on worker threads
   * @param wildcard wildcard signature computed before the run; empty disables suppression
   * @param sink receiver of validated hosts, called on the producer thread
   * @param metrics metrics sink
   * @param settings worker and in-flight bounds
   */
  public ResolutionPipeline(
      String domain,
      HostResolver resolver,
      Optional<AddressSet> wildcard,
      HostSink sink,
      MetricsPort metrics,
      Settings settings) {
    this.domain = Objects.requireNonNull(domain, "domain");
    this.resolver = Objects.requireNonNull(resolver, "resolver");
    this.wildcard = Objects.requireNonNull(wildcard, "wildcard");
    this.sink = Objects.requireNonNull(sink, "sink");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    Objects.requireNonNull(settings, "settings");
    this.maxInFlight = settings.maxInFlight();
    this.executor = ExecutorFactories.newResolverPool(
        settings.workers(),
        settings.maxInFlight(),
        "subhunt-resolve",
        (thread, ex) -> log.error("Resolver worker {} failed", thread.getName(), ex));
    this.completions = new ExecutorCompletionService<>(executor);
  }

  /**
   * Offers a raw candidate for resolution.
   *
   * @param rawCandidate candidate as produced by a source
   * @return {@code true} when the candidate was scheduled; {@code false} when it was blank, out of scope or
   *         already seen
   * @throws InterruptedException if interrupted while waiting for capacity
   */
  public boolean submit(String rawCandidate) throws InterruptedException {
    String host = Hostnames.normalize(rawCandidate);
    if (host.isEmpty() || !Hostnames.inScope(host, domain) || !seen.add(host)) {
      return false;
    }
    while (inFlight >= maxInFlight) {
      handle(completions.take());
    }
    completions.submit(() -> new Resolution(host, resolveQuietly(host)));
    inFlight++;
    if (inFlight > highWaterMark) {
      highWaterMark = inFlight;
    }
    metrics.increment("discover.submitted");
    return true;
  }

  /**
   * Handles every lookup that has already completed, without blocking.
   *
   * @return number of completions handled
   * @throws InterruptedException if interrupted while handling a completion
   */
  public int drainAvailable() throws InterruptedException {
    int drained = 0;
    Future<Resolution> done;
    while ((done = completions.poll()) != null) {
      handle(done);
      drained++;
    }
    if (drained > 0) {
      log.debug("Drained {} completed lookups; {} still in flight", drained, inFlight);
    }
    return drained;
  }

  /**
   * Blocks until every submitted lookup has completed and been handled.
   *
   * @throws InterruptedException if interrupted while waiting
   */
  public void flush() throws InterruptedException {
    if (inFlight > 0) {
      log.debug("Waiting for {} outstanding lookups", inFlight);
    }
    while (inFlight > 0) {
      handle(completions.take());
    }
  }

  public int inFlight() {
    return inFlight;
  }

  public int highWaterMark() {
    return highWaterMark;
  }

  public int seenCount() {
    return seen.size();
  }

  public int foundCount() {
    return found.size();
  }

  /**
   * Stops the worker pool immediately; outstanding lookups are abandoned.
   */
  @Override
  public void close() {
    if (inFlight > 0) {
      log.warn("Abandoning {} in-flight lookups", inFlight);
    }
    executor.shutdownNow();
  }

  private void handle(Future<Resolution> done) throws InterruptedException {
    inFlight--;
    Resolution resolution;
    try {
      resolution = done.get();
    } catch (ExecutionException | CancellationException ex) {
      metrics.increment("resolve.miss");
      log.warn("Lookup task failed unexpectedly", ex);
      return;
    }
    String host = resolution.hostname();
    AddressSet addresses = resolution.addresses();
    if (addresses.isEmpty()) {
      metrics.increment("resolve.miss");
      log.trace("{} did not resolve", host);
      return;
    }
    if (wildcard.isPresent() && wildcard.get().equals(addresses)) {
      metrics.increment("resolve.wildcard");
      log.debug("{} matches wildcard signature; suppressed", host);
      return;
    }
    if (found.add(host)) {
      metrics.increment("resolve.live");
      sink.accept(new ResolvedHost(host, addresses));
    }
  }

  private AddressSet resolveQuietly(String host) {
    try {
      AddressSet addresses = resolver.resolve(host);
      return addresses == null ? AddressSet.EMPTY : addresses;
    } catch (RuntimeException ex) {
      log.debug("Lookup of {} failed: {}", host, ex.toString());
      return AddressSet.EMPTY;
    }
  }

  private record Resolution(String hostname, AddressSet addresses) {}

  /**
   * Worker pool sizing.
   *
   * @param workers concurrent lookups
   * @param maxInFlight submitted-but-unhandled lookups allowed before {@link #submit(String)} blocks
   */
  public record Settings(int workers, int maxInFlight) {
    public Settings {
      if (workers < 1) {
        throw new IllegalArgumentException("workers must be at least 1");
      }
      if (maxInFlight < workers) {
        throw new IllegalArgumentException("maxInFlight must be at least workers (" + workers + ")");
      }
    }
  }
}
