package ca.gc.cra.subhunt.api;

import ca.gc.cra.subhunt.application.port.HostSink;
import ca.gc.cra.subhunt.domain.ResolvedHost;

/**
 * Streams each validated hostname to stdout, one per line, as soon as it is confirmed.
 */
final class ConsoleHostSink implements HostSink {
  @Override
  public void accept(ResolvedHost host) {
    CliPrinter.println(host.hostname());
  }
}
