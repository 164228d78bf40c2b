package ca.gc.cra.subhunt.application.pipeline;

import ca.gc.cra.subhunt.application.port.HostResolver;
import ca.gc.cra.subhunt.domain.AddressSet;
import java.security.SecureRandom;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.IntFunction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Detects wildcard DNS for a domain by resolving random labels that should not exist.
 *
 * <p>Only a majority answer becomes the signature: at least two probes must resolve, and the
 * most frequent answer must be shared by at least two of them. Load-balanced wildcards that rotate
 * their answers therefore produce no signature, and nothing is suppressed.</p>
 *
 * @since 0.1.0
 */
public final class WildcardDetector {
  private static final Logger log = LoggerFactory.getLogger(WildcardDetector.class);
  private static final char[] ALPHABET = "abcdefghijklmnopqrstuvwxyz0123456789".toCharArray();
  private static final int MIN_AGREEING = 2;

  private final HostResolver resolver;
  private final int probes;
  private final int labelLength;
  private final IntFunction<String> labels;

  public WildcardDetector(HostResolver resolver, int probes, int labelLength) {
    this(resolver, probes, labelLength, randomLabels(new SecureRandom()));
  }

  /**
   * Creates a detector with an explicit label generator.
   *
   * @param resolver resolver used for probes
   * @param probes number of probes, at least two
   * @param labelLength probe label length, 1..63
   * @param labels generator producing a label of the requested length
   */
  public WildcardDetector(HostResolver resolver, int probes, int labelLength, IntFunction<String> labels) {
    this.resolver = Objects.requireNonNull(resolver, "resolver");
    this.labels = Objects.requireNonNull(labels, "labels");
    if (probes < MIN_AGREEING) {
      throw new IllegalArgumentException("probes must be at least " + MIN_AGREEING);
    }
    if (labelLength < 1 || labelLength > 63) {
      throw new IllegalArgumentException("labelLength must be between 1 and 63");
    }
    this.probes = probes;
    this.labelLength = labelLength;
  }

  /**
   * Computes the wildcard signature for {@code domain}.
   *
   * @param domain normalized target domain
   * @return the majority address set, or empty when no consistent wildcard answer was seen
   */
  public Optional<AddressSet> detect(String domain) {
    Objects.requireNonNull(domain, "domain");
    List<AddressSet> answers = new ArrayList<>(probes);
    for (int i = 0; i < probes; i++) {
      String probe = labels.apply(labelLength) + "." + domain;
      AddressSet answer = resolveQuietly(probe);
      log.debug("Wildcard probe {} -> {}", probe, answer.isEmpty() ? "<none>" : answer.joined());
      if (!answer.isEmpty()) {
        answers.add(answer);
      }
    }
    if (answers.size() < MIN_AGREEING) {
      log.debug("No wildcard DNS for {} ({} of {} probes resolved)", domain, answers.size(), probes);
      return Optional.empty();
    }

    Map<AddressSet, Integer> counts = new LinkedHashMap<>();
    for (AddressSet answer : answers) {
      counts.merge(answer, 1, Integer::sum);
    }
    AddressSet best = null;
    int bestCount = 0;
    for (Map.Entry<AddressSet, Integer> entry : counts.entrySet()) {
      if (entry.getValue() > bestCount) {
        best = entry.getKey();
        bestCount = entry.getValue();
      }
    }
    if (bestCount >= MIN_AGREEING) {
      log.info("Wildcard DNS detected for {}: {} ({} of {} probes)", domain, best.joined(), bestCount, probes);
      return Optional.of(best);
    }
    log.info("Wildcard probes for {} resolved inconsistently; no filtering applied", domain);
    return Optional.empty();
  }

  private AddressSet resolveQuietly(String probe) {
    try {
      AddressSet answer = resolver.resolve(probe);
      return answer == null ? AddressSet.EMPTY : answer;
    } catch (RuntimeException ex) {
      log.debug("Wildcard probe {} failed: {}", probe, ex.toString());
      return AddressSet.EMPTY;
    }
  }

  static IntFunction<String> randomLabels(SecureRandom random) {
    return length -> {
      char[] label = new char[length];
      for (int i = 0; i < length; i++) {
        label[i] = ALPHABET[random.nextInt(ALPHABET.length)];
      }
      return new String(label);
    };
  }
}
