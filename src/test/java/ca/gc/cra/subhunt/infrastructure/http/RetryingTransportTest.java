package ca.gc.cra.subhunt.infrastructure.http;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.subhunt.application.port.HttpPort;
import ca.gc.cra.subhunt.application.port.TransportException;
import ca.gc.cra.subhunt.domain.json.JsonTree;
import ca.gc.cra.subhunt.infrastructure.json.JsonTreeParser;
import ca.gc.cra.subhunt.testutil.RecordingMetrics;
import ca.gc.cra.subhunt.testutil.RecordingSleeper;
import ca.gc.cra.subhunt.testutil.ScriptedHttp;
import java.io.IOException;
import java.net.ConnectException;
import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class RetryingTransportTest {
  private static final HttpPort.Request REQUEST =
      HttpPort.Request.post(URI.create("https://lookup.test/api"), Map.of(), "{}");

  private final ScriptedHttp http = new ScriptedHttp();
  private final RecordingSleeper sleeper = new RecordingSleeper();
  private final RecordingMetrics metrics = new RecordingMetrics();

  private RetryingTransport transport(int maxAttempts) {
    RetryPolicy policy = new RetryPolicy(maxAttempts, Duration.ofMillis(100), Duration.ofSeconds(2));
    return new RetryingTransport("test", http, policy, new JsonTreeParser(), sleeper, () -> 1.0, metrics);
  }

  @Test
  void returnsParsedBodyOnFirstSuccess() throws Exception {
    http.then(ScriptedHttp.json("{\"domain\":\"a.example.com\"}"));

    JsonTree tree = transport(3).request(REQUEST);

    JsonTree.Mapping mapping = assertInstanceOf(JsonTree.Mapping.class, tree);
    assertEquals(new JsonTree.Text("a.example.com"), mapping.get("domain"));
    assertEquals(1, http.requestCount());
    assertTrue(sleeper.delays().isEmpty());
  }

  @Test
  void alwaysUnavailableMakesExactlyMaxAttemptsThenFails() {
    http.otherwise(request -> ScriptedHttp.status(503));

    TransportException ex = assertThrows(TransportException.class, () -> transport(4).request(REQUEST));

    assertEquals(TransportException.Reason.RETRIES_EXHAUSTED, ex.reason());
    assertEquals(4, ex.attempts());
    assertEquals(503, ex.status());
    assertEquals(4, http.requestCount());
    assertEquals(
        List.of(Duration.ofMillis(100), Duration.ofMillis(200), Duration.ofMillis(400)),
        sleeper.delays());
    assertEquals(3, metrics.count("transport.retry"));
    assertEquals(1, metrics.count("transport.failure"));
    assertTrue(ex.getMessage().contains("HTTP 503"));
  }

  @Test
  void permanentStatusFailsWithoutRetry() {
    http.then(new HttpPort.Response(400, Map.of(), "bad request"));

    TransportException ex = assertThrows(TransportException.class, () -> transport(5).request(REQUEST));

    assertEquals(TransportException.Reason.HTTP_STATUS, ex.reason());
    assertEquals(400, ex.status());
    assertEquals(1, ex.attempts());
    assertEquals(1, http.requestCount());
    assertTrue(sleeper.delays().isEmpty());
  }

  @Test
  void transientFailuresRecover() throws Exception {
    http.thenFail(new ConnectException("refused"))
        .then(ScriptedHttp.status(502))
        .then(ScriptedHttp.json("[]"));

    JsonTree tree = transport(5).request(REQUEST);

    assertEquals(new JsonTree.Sequence(List.of()), tree);
    assertEquals(3, http.requestCount());
    assertEquals(2, sleeper.delays().size());
    assertEquals(0, metrics.count("transport.failure"));
  }

  @Test
  void retryAfterActsAsLowerBoundOnRateLimit() throws Exception {
    http.then(new HttpPort.Response(429, Map.of("Retry-After", "3"), ""))
        .then(new HttpPort.Response(429, Map.of("Retry-After", "soon"), ""))
        .then(ScriptedHttp.json("{}"));

    transport(3).request(REQUEST);

    assertEquals(List.of(Duration.ofSeconds(3), Duration.ofMillis(200)), sleeper.delays());
  }

  @Test
  void nonJsonSuccessBodyIsFatalWithSnippet() {
    String html = "<html>" + "x".repeat(500) + "</html>";
    http.then(new HttpPort.Response(200, Map.of(), html));

    TransportException ex = assertThrows(TransportException.class, () -> transport(3).request(REQUEST));

    assertEquals(TransportException.Reason.MALFORMED_RESPONSE, ex.reason());
    assertEquals(1, http.requestCount());
    assertTrue(ex.getMessage().contains("<html>xxx"));
    assertFalse(ex.getMessage().contains("</html>"));
  }

  @Test
  void exhaustedConnectionErrorsKeepCause() {
    IOException failure = new IOException("reset");
    http.otherwise(request -> {
      throw new AssertionError("unused");
    });
    http.thenFail(failure).thenFail(failure);

    TransportException ex = assertThrows(TransportException.class, () -> transport(2).request(REQUEST));

    assertEquals(TransportException.Reason.RETRIES_EXHAUSTED, ex.reason());
    assertEquals(-1, ex.status());
    assertEquals(failure, ex.getCause());
  }

  @Test
  void classifiesTransientStatuses() {
    assertTrue(RetryingTransport.isTransient(408));
    assertTrue(RetryingTransport.isTransient(425));
    assertTrue(RetryingTransport.isTransient(429));
    assertTrue(RetryingTransport.isTransient(500));
    assertTrue(RetryingTransport.isTransient(599));
    assertFalse(RetryingTransport.isTransient(404));
    assertFalse(RetryingTransport.isTransient(401));
  }
}
