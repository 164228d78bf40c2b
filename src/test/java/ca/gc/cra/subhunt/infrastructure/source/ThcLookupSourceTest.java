package ca.gc.cra.subhunt.infrastructure.source;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.subhunt.application.extract.HeuristicExtractor;
import ca.gc.cra.subhunt.application.port.HttpPort;
import ca.gc.cra.subhunt.application.port.TransportException;
import ca.gc.cra.subhunt.infrastructure.http.RetryPolicy;
import ca.gc.cra.subhunt.infrastructure.http.RetryingTransport;
import ca.gc.cra.subhunt.infrastructure.json.JsonTreeParser;
import ca.gc.cra.subhunt.testutil.RecordingMetrics;
import ca.gc.cra.subhunt.testutil.RecordingSleeper;
import ca.gc.cra.subhunt.testutil.ScriptedHttp;
import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ThcLookupSourceTest {
  private static final URI ENDPOINT = URI.create("https://lookup.test/api/v1/lookup/subdomains");

  private final ScriptedHttp http = new ScriptedHttp();
  private final RecordingSleeper sleeper = new RecordingSleeper();

  private ThcLookupSource source(int maxAttempts) {
    RetryingTransport transport = new RetryingTransport(
        "thc",
        http,
        new RetryPolicy(maxAttempts, Duration.ZERO, Duration.ZERO),
        new JsonTreeParser(),
        sleeper,
        () -> 1.0,
        new RecordingMetrics());
    return new ThcLookupSource(
        new ThcLookupSource.Settings(ENDPOINT, "thc-subd-cli/1.0", 500, Duration.ofMillis(150)),
        transport,
        new HeuristicExtractor(),
        sleeper);
  }

  @Test
  void followsCursorUntilItIsAbsent() throws Exception {
    http.then(ScriptedHttp.json(
            "{\"results\":[{\"domain\":\"a.example.com\"}],\"page_state\":\"p2\"}"))
        .then(ScriptedHttp.json(
            "{\"results\":[{\"domain\":\"b.example.com\"},{\"domain\":\"c.example.com\"}]}"));
    RecordingConsumer consumer = new RecordingConsumer();

    source(3).collect("example.com", consumer);

    assertEquals(List.of("a.example.com", "b.example.com", "c.example.com"), consumer.candidates);
    assertEquals(List.of(1, 2), consumer.pages);
    assertEquals(List.of(1, 3), consumer.candidatesAtPageEnd);
    assertEquals(List.of(Duration.ofMillis(150)), sleeper.delays());
  }

  @Test
  void stopsAfterExactlyNPagesWhenCursorRepeats() throws Exception {
    http.then(ScriptedHttp.json("{\"subdomains\":[\"a.example.com\"],\"next\":\"c1\"}"))
        .then(ScriptedHttp.json("{\"subdomains\":[\"b.example.com\"],\"next\":\"c2\"}"))
        .then(ScriptedHttp.json("{\"subdomains\":[\"b.example.com\"],\"next\":\"c2\"}"));
    RecordingConsumer consumer = new RecordingConsumer();

    source(3).collect("example.com", consumer);

    assertEquals(3, http.requestCount());
    assertEquals(List.of(1, 2, 3), consumer.pages);
  }

  @Test
  void postsJsonBodyWithCursorAndHeaders() throws Exception {
    http.then(ScriptedHttp.json("{\"page_state\":\"abc\"}"))
        .then(ScriptedHttp.json("{}"));

    source(3).collect("example.com", new RecordingConsumer());

    List<HttpPort.Request> requests = http.requests();
    assertEquals(2, requests.size());
    HttpPort.Request first = requests.get(0);
    assertEquals("POST", first.method());
    assertEquals(ENDPOINT, first.uri());
    assertEquals("{\"domain\":\"example.com\",\"limit\":500,\"page_state\":\"\"}", first.body());
    assertEquals("application/x-www-form-urlencoded", first.headers().get("Content-Type"));
    assertEquals("application/json, */*", first.headers().get("Accept"));
    assertEquals("thc-subd-cli/1.0", first.headers().get("User-Agent"));
    assertEquals("{\"domain\":\"example.com\",\"limit\":500,\"page_state\":\"abc\"}", requests.get(1).body());
  }

  @Test
  void requestBodyEscapesCursor() {
    String body = source(1).requestBody("example.com", "a\"b");
    assertEquals("{\"domain\":\"example.com\",\"limit\":500,\"page_state\":\"a\\\"b\"}", body);
  }

  @Test
  void transportFailurePropagates() {
    http.otherwise(request -> ScriptedHttp.status(503));

    TransportException ex = assertThrows(
        TransportException.class, () -> source(2).collect("example.com", new RecordingConsumer()));

    assertEquals(TransportException.Reason.RETRIES_EXHAUSTED, ex.reason());
    assertEquals(2, http.requestCount());
  }

  @Test
  void malformedPrimaryResponseIsFatal() {
    http.then(new HttpPort.Response(200, Map.of(), "Too many requests, slow down"));

    TransportException ex = assertThrows(
        TransportException.class, () -> source(3).collect("example.com", new RecordingConsumer()));

    assertEquals(TransportException.Reason.MALFORMED_RESPONSE, ex.reason());
    assertTrue(ex.getMessage().contains("Too many requests"));
  }
}
