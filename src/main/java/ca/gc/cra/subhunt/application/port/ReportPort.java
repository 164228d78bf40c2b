package ca.gc.cra.subhunt.application.port;

import ca.gc.cra.subhunt.domain.ResolvedHost;
import java.io.IOException;
import java.util.List;

/**
 * Persists the final results table of a run.
 *
 * @since 0.1.0
 */
public interface ReportPort {

  /**
   * Writes the report for {@code domain}.
   *
   * @param domain target domain
   * @param hosts validated hosts sorted by hostname
   * @throws IOException when the report cannot be written
   */
  void write(String domain, List<ResolvedHost> hosts) throws IOException;
}
