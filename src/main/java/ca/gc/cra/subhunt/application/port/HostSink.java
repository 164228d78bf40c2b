package ca.gc.cra.subhunt.application.port;

import ca.gc.cra.subhunt.domain.ResolvedHost;

/**
 * Receives validated hosts as soon as they are confirmed.
 *
 * <p>Invoked only from the producer thread, at most once per hostname per run.</p>
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface HostSink {
  void accept(ResolvedHost host);

  /** Sink that discards everything. */
  HostSink DISCARD = host -> {};
}
