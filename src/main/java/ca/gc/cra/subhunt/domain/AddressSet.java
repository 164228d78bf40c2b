package ca.gc.cra.subhunt.domain;

import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Immutable, unordered set of IP address strings returned for one hostname lookup.
 *
 * <p>An empty set means the name did not resolve. Equality is plain set equality, which is what
 * wildcard signature comparison relies on.</p>
 *
 * @param addresses textual IPv4/IPv6 addresses; copied defensively
 * @since 0.1.0
 */
public record AddressSet(Set<String> addresses) {
  /** Set returned for names that did not resolve. */
  public static final AddressSet EMPTY = new AddressSet(Set.of());

  public AddressSet {
    Objects.requireNonNull(addresses, "addresses");
    addresses = Set.copyOf(addresses);
  }

  /**
   * Builds a set from the supplied addresses; duplicates collapse.
   *
   * @param addresses textual addresses
   * @return address set
   */
  public static AddressSet of(String... addresses) {
    if (addresses == null || addresses.length == 0) {
      return EMPTY;
    }
    return new AddressSet(Set.copyOf(Arrays.asList(addresses)));
  }

  /**
   * Builds a set from an arbitrary collection, tolerating duplicates.
   *
   * @param addresses textual addresses
   * @return address set
   */
  public static AddressSet copyOf(Collection<String> addresses) {
    if (addresses == null || addresses.isEmpty()) {
      return EMPTY;
    }
    return new AddressSet(Set.copyOf(addresses));
  }

  public boolean isEmpty() {
    return addresses.isEmpty();
  }

  public int size() {
    return addresses.size();
  }

  /**
   * Returns the addresses in lexical order for stable rendering.
   *
   * @return sorted immutable list
   */
  public List<String> sorted() {
    return addresses.stream().sorted().collect(Collectors.toUnmodifiableList());
  }

  /**
   * Renders the sorted addresses joined by {@code ", "}.
   *
   * @return display string; empty when the set is empty
   */
  public String joined() {
    return String.join(", ", sorted());
  }
}
