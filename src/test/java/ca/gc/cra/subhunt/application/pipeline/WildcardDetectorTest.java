package ca.gc.cra.subhunt.application.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.subhunt.domain.AddressSet;
import ca.gc.cra.subhunt.testutil.StaticResolver;
import java.security.SecureRandom;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.IntFunction;
import org.junit.jupiter.api.Test;

class WildcardDetectorTest {

  private static IntFunction<String> sequentialLabels() {
    AtomicInteger next = new AtomicInteger();
    return length -> "probe" + next.incrementAndGet();
  }

  @Test
  void majorityAnswerBecomesSignature() {
    StaticResolver resolver = new StaticResolver()
        .answer("probe1.example.com", "203.0.113.7")
        .answer("probe2.example.com", "203.0.113.7")
        .answer("probe3.example.com", "203.0.113.8");

    Optional<AddressSet> signature =
        new WildcardDetector(resolver, 3, 18, sequentialLabels()).detect("example.com");

    assertEquals(Optional.of(AddressSet.of("203.0.113.7")), signature);
  }

  @Test
  void fewerThanTwoResolvingProbesMeansNoWildcard() {
    StaticResolver resolver = new StaticResolver().answer("probe2.example.com", "203.0.113.7");

    assertEquals(
        Optional.empty(),
        new WildcardDetector(resolver, 3, 18, sequentialLabels()).detect("example.com"));
  }

  @Test
  void allDistinctAnswersMeanNoWildcard() {
    StaticResolver resolver = new StaticResolver()
        .answer("probe1.example.com", "203.0.113.1")
        .answer("probe2.example.com", "203.0.113.2")
        .answer("probe3.example.com", "203.0.113.3");

    assertEquals(
        Optional.empty(),
        new WildcardDetector(resolver, 3, 18, sequentialLabels()).detect("example.com"));
  }

  @Test
  void multiAddressAnswersCompareAsSets() {
    StaticResolver resolver = new StaticResolver()
        .answer("probe1.example.com", "198.51.100.1", "198.51.100.2")
        .answer("probe2.example.com", "198.51.100.2", "198.51.100.1")
        .answer("probe3.example.com");

    assertEquals(
        Optional.of(AddressSet.of("198.51.100.1", "198.51.100.2")),
        new WildcardDetector(resolver, 3, 18, sequentialLabels()).detect("example.com"));
  }

  @Test
  void resolverFailuresCountAsMisses() {
    WildcardDetector detector = new WildcardDetector(host -> {
      throw new IllegalStateException("resolver down");
    }, 3, 18, sequentialLabels());

    assertEquals(Optional.empty(), detector.detect("example.com"));
  }

  @Test
  void randomLabelsHaveRequestedLengthAndAlphabet() {
    String label = WildcardDetector.randomLabels(new SecureRandom()).apply(18);
    assertEquals(18, label.length());
    assertTrue(label.matches("[a-z0-9]{18}"));
  }

  @Test
  void rejectsTooFewProbes() {
    assertThrows(IllegalArgumentException.class, () -> new WildcardDetector(new StaticResolver(), 1, 18));
    assertThrows(IllegalArgumentException.class, () -> new WildcardDetector(new StaticResolver(), 3, 64));
  }
}
