package ca.gc.cra.subhunt.application.port;

import ca.gc.cra.subhunt.domain.AddressSet;

/**
 * Resolves a hostname to its address set.
 *
 * <p>Implementations are called concurrently from resolver worker threads and must be thread-safe.
 * A name that does not resolve yields {@link AddressSet#EMPTY}; callers also treat any thrown
 * exception as a miss.</p>
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface HostResolver {
  AddressSet resolve(String hostname);
}
