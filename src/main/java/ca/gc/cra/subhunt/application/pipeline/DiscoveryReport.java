package ca.gc.cra.subhunt.application.pipeline;

import ca.gc.cra.subhunt.domain.AddressSet;
import ca.gc.cra.subhunt.domain.ResolvedHost;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Summary of one discovery run.
 *
 * @param domain target domain
 * @param candidates raw candidates received from all sources, before filtering
 * @param submitted unique in-scope names sent for resolution
 * @param liveHosts validated hosts sorted by hostname
 * @param wildcard wildcard signature in effect, if any
 * @param duration wall-clock duration of the run
 * @since 0.1.0
 */
public record DiscoveryReport(
    String domain,
    long candidates,
    int submitted,
    List<ResolvedHost> liveHosts,
    Optional<AddressSet> wildcard,
    Duration duration) {
  public DiscoveryReport {
    Objects.requireNonNull(domain, "domain");
    liveHosts = List.copyOf(liveHosts);
    Objects.requireNonNull(wildcard, "wildcard");
    Objects.requireNonNull(duration, "duration");
  }
}
