package ca.gc.cra.subhunt.domain;

import java.util.Objects;

/**
 * A validated hostname together with the addresses it resolved to.
 *
 * @param hostname normalized hostname
 * @param addresses non-empty address set
 * @since 0.1.0
 */
public record ResolvedHost(String hostname, AddressSet addresses) {
  public ResolvedHost {
    Objects.requireNonNull(hostname, "hostname");
    Objects.requireNonNull(addresses, "addresses");
  }
}
