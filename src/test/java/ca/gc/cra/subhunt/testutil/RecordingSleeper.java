package ca.gc.cra.subhunt.testutil;

import ca.gc.cra.subhunt.application.port.Sleeper;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/** {@link Sleeper} that records requested delays instead of waiting. */
public final class RecordingSleeper implements Sleeper {
  private final List<Duration> delays = new ArrayList<>();

  @Override
  public synchronized void sleep(Duration duration) {
    delays.add(duration);
  }

  public synchronized List<Duration> delays() {
    return List.copyOf(delays);
  }
}
