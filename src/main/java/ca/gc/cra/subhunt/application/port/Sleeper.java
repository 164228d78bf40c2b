package ca.gc.cra.subhunt.application.port;

import java.time.Duration;

/**
 * Delay primitive used for inter-page pacing and retry backoff; replaced by a recorder in tests.
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface Sleeper {
  void sleep(Duration duration) throws InterruptedException;

  /** Sleeper backed by {@link Thread#sleep(long)}. */
  Sleeper SYSTEM = duration -> {
    long millis = duration.toMillis();
    if (millis > 0) {
      Thread.sleep(millis);
    }
  };
}
