package ca.gc.cra.subhunt.application.port;

/**
 * <strong>What:</strong> Port for a passive reconnaissance source that yields raw hostname candidates.
 * <p><strong>Role:</strong> Driven-side port implemented by HTTP adapters (lookup API, web archive,
 * certificate transparency).</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Push candidates one at a time as they are extracted, without filtering or normalizing them.</li>
 *   <li>Signal page boundaries so the caller can drain finished work between pages.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> {@link #collect(String, CandidateConsumer)} runs on the caller's thread;
 * implementations must not call the consumer from any other thread.</p>
 *
 * @since 0.1.0
 */
public interface CandidateSource {

  /**
   * Short, stable name used in logs and metrics (e.g., {@code thc}).
   *
   * @return source name
   */
  String name();

  /**
   * Collects candidates for {@code domain}, pushing each one to {@code consumer}.
   *
   * @param domain validated, normalized target domain
   * @param consumer receiver of candidates; may block to apply backpressure
   * @throws TransportException when the source cannot be queried
   * @throws InterruptedException if interrupted while waiting on the network, a delay or the consumer
   */
  void collect(String domain, CandidateConsumer consumer) throws TransportException, InterruptedException;
}
