package ca.gc.cra.subhunt.application.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.subhunt.application.port.HostResolver;
import ca.gc.cra.subhunt.domain.AddressSet;
import ca.gc.cra.subhunt.domain.ResolvedHost;
import ca.gc.cra.subhunt.testutil.RecordingMetrics;
import ca.gc.cra.subhunt.testutil.StaticResolver;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;

class ResolutionPipelineTest {
  private final RecordingMetrics metrics = new RecordingMetrics();
  private final List<ResolvedHost> emitted = Collections.synchronizedList(new ArrayList<>());

  private ResolutionPipeline pipeline(HostResolver resolver, Optional<AddressSet> wildcard, int workers, int cap) {
    return new ResolutionPipeline(
        "example.com", resolver, wildcard, emitted::add, metrics, new ResolutionPipeline.Settings(workers, cap));
  }

  @Test
  void normalizesFiltersScopeAndDeduplicates() throws Exception {
    StaticResolver resolver = new StaticResolver()
        .answer("api.example.com", "192.0.2.1")
        .answer("example.com", "192.0.2.2");

    try (ResolutionPipeline pipeline = pipeline(resolver, Optional.empty(), 2, 4)) {
      assertTrue(pipeline.submit(" API.Example.com. "));
      assertFalse(pipeline.submit("api.example.com"));
      assertTrue(pipeline.submit("example.com"));
      assertFalse(pipeline.submit("example.com.evil.net"));
      assertFalse(pipeline.submit("notexample.com"));
      assertFalse(pipeline.submit("   "));
      pipeline.flush();

      assertEquals(2, pipeline.seenCount());
      assertEquals(0, pipeline.inFlight());
    }

    assertEquals(1, resolver.lookups("api.example.com"));
    assertEquals(List.of("api.example.com", "example.com"),
        emitted.stream().map(ResolvedHost::hostname).sorted().collect(Collectors.toList()));
    assertEquals(2, metrics.count("discover.submitted"));
    assertEquals(2, metrics.count("resolve.live"));
  }

  @Test
  void dropsMissesAndWildcardMatches() throws Exception {
    StaticResolver resolver = new StaticResolver()
        .answer("real.example.com", "192.0.2.10")
        .answer("mixed.example.com", "203.0.113.7", "192.0.2.11")
        .answer("gone.example.com")
        .wildcard("203.0.113.7");

    try (ResolutionPipeline pipeline =
        pipeline(resolver, Optional.of(AddressSet.of("203.0.113.7")), 2, 4)) {
      pipeline.submit("real.example.com");
      pipeline.submit("mixed.example.com");
      pipeline.submit("gone.example.com");
      pipeline.submit("random-junk.example.com");
      pipeline.flush();
    }

    assertEquals(List.of("mixed.example.com", "real.example.com"),
        emitted.stream().map(ResolvedHost::hostname).sorted().collect(Collectors.toList()));
    assertEquals(1, metrics.count("resolve.miss"));
    assertEquals(1, metrics.count("resolve.wildcard"));
    assertEquals(2, metrics.count("resolve.live"));
  }

  @Test
  void resolverExceptionsAreMisses() throws Exception {
    HostResolver failing = host -> {
      throw new IllegalStateException("boom");
    };
    try (ResolutionPipeline pipeline = pipeline(failing, Optional.empty(), 1, 1)) {
      pipeline.submit("a.example.com");
      pipeline.flush();
    }
    assertTrue(emitted.isEmpty());
    assertEquals(1, metrics.count("resolve.miss"));
  }

  @Test
  void inFlightNeverExceedsCap() throws Exception {
    AtomicInteger concurrent = new AtomicInteger();
    AtomicInteger maxConcurrent = new AtomicInteger();
    HostResolver slow = host -> {
      int now = concurrent.incrementAndGet();
      maxConcurrent.accumulateAndGet(now, Math::max);
      try {
        Thread.sleep(2);
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
      } finally {
        concurrent.decrementAndGet();
      }
      return AddressSet.of("192.0.2.1");
    };

    try (ResolutionPipeline pipeline = pipeline(slow, Optional.empty(), 2, 5)) {
      for (int i = 0; i < 200; i++) {
        pipeline.submit("h" + i + ".example.com");
        assertTrue(pipeline.inFlight() <= 5, "in-flight exceeded cap");
      }
      pipeline.flush();
      assertTrue(pipeline.highWaterMark() <= 5);
      assertEquals(200, pipeline.foundCount());
    }

    assertEquals(200, emitted.size());
    assertTrue(maxConcurrent.get() <= 2);
  }

  @Test
  void drainAvailableHandlesCompletedWorkWithoutBlocking() throws Exception {
    StaticResolver resolver = new StaticResolver().answer("a.example.com", "192.0.2.1");
    try (ResolutionPipeline pipeline = pipeline(resolver, Optional.empty(), 1, 4)) {
      pipeline.submit("a.example.com");
      long deadline = System.nanoTime() + 5_000_000_000L;
      while (pipeline.inFlight() > 0 && System.nanoTime() < deadline) {
        pipeline.drainAvailable();
        Thread.sleep(1);
      }
      assertEquals(0, pipeline.inFlight());
      assertEquals(0, pipeline.drainAvailable());
    }
    assertEquals(1, emitted.size());
  }

  @Test
  void settingsRejectCapBelowWorkers() {
    assertThrows(IllegalArgumentException.class, () -> new ResolutionPipeline.Settings(4, 3));
    assertThrows(IllegalArgumentException.class, () -> new ResolutionPipeline.Settings(0, 3));
  }
}
