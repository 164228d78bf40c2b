package ca.gc.cra.subhunt.infrastructure.dns;

import ca.gc.cra.subhunt.application.port.HostResolver;
import ca.gc.cra.subhunt.domain.AddressSet;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.LinkedHashSet;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link HostResolver} backed by the platform resolver via {@link InetAddress#getAllByName(String)}.
 *
 * <p>Blocking; intended to run on resolver worker threads. Any lookup failure is reported as
 * {@link AddressSet#EMPTY}.</p>
 *
 * @since 0.1.0
 */
public final class SystemHostResolver implements HostResolver {
  private static final Logger log = LoggerFactory.getLogger(SystemHostResolver.class);

  @Override
  public AddressSet resolve(String hostname) {
    try {
      InetAddress[] addresses = InetAddress.getAllByName(hostname);
      Set<String> result = new LinkedHashSet<>();
      for (InetAddress address : addresses) {
        result.add(address.getHostAddress());
      }
      return AddressSet.copyOf(result);
    } catch (UnknownHostException ex) {
      log.trace("No addresses for {}", hostname);
      return AddressSet.EMPTY;
    } catch (RuntimeException ex) {
      log.debug("Lookup of {} failed: {}", hostname, ex.toString());
      return AddressSet.EMPTY;
    }
  }
}
