package ca.gc.cra.subhunt.infrastructure.http;

import ca.gc.cra.subhunt.application.port.HttpPort;
import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * {@link HttpPort} backed by {@link java.net.http.HttpClient}.
 *
 * <p>Follows redirects under {@link HttpClient.Redirect#NORMAL}: same-scheme and http to https are
 * followed, https to http is not. One timeout applies to both connect and whole-request phases.
 * Thread-safe; the underlying client is shared.</p>
 *
 * @since 0.1.0
 */
public final class JdkHttpAdapter implements HttpPort {
  private final HttpClient client;
  private final Duration timeout;

  /**
   * Creates an adapter with its own HTTP/1.1 client.
   *
   * @param timeout connect and request timeout
   */
  public JdkHttpAdapter(Duration timeout) {
    this.timeout = Objects.requireNonNull(timeout, "timeout");
    this.client = HttpClient.newBuilder()
        .followRedirects(HttpClient.Redirect.NORMAL)
        .connectTimeout(timeout)
        .version(HttpClient.Version.HTTP_1_1)
        .build();
  }

  @Override
  public Response exchange(Request request) throws IOException, InterruptedException {
    HttpRequest.Builder builder = HttpRequest.newBuilder()
        .uri(request.uri())
        .timeout(timeout);
    request.headers().forEach(builder::header);
    if ("GET".equals(request.method()) && request.body() == null) {
      builder.GET();
    } else {
      HttpRequest.BodyPublisher publisher = request.body() == null
          ? HttpRequest.BodyPublishers.noBody()
          : HttpRequest.BodyPublishers.ofString(request.body(), StandardCharsets.UTF_8);
      builder.method(request.method(), publisher);
    }
    HttpResponse<String> response =
        client.send(builder.build(), HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
    return new Response(response.statusCode(), firstValues(response.headers().map()), response.body());
  }

  HttpClient.Redirect redirectPolicy() {
    return client.followRedirects();
  }

  private static Map<String, String> firstValues(Map<String, List<String>> headers) {
    Map<String, String> result = new LinkedHashMap<>();
    headers.forEach((name, values) -> {
      if (!values.isEmpty()) {
        result.put(name, values.get(0));
      }
    });
    return result;
  }
}
