package ca.gc.cra.subhunt.application.port;

/**
 * Receiver of raw candidates produced by a {@link CandidateSource}.
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface CandidateConsumer {

  /**
   * Accepts one raw candidate. May block while downstream capacity is exhausted.
   *
   * @param candidate raw hostname text as found upstream
   * @throws InterruptedException if interrupted while blocked
   */
  void accept(String candidate) throws InterruptedException;

  /**
   * Called after every page of a paginated source has been pushed.
   *
   * @param pageNumber one-based page index
   * @throws InterruptedException if interrupted while handling the boundary
   */
  default void pageCompleted(int pageNumber) throws InterruptedException {
    // nothing by default
  }
}
