package ca.gc.cra.subhunt.application.port;

import java.io.IOException;
import java.net.URI;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Port performing a single HTTP exchange.
 * <p><strong>Why:</strong> Separates retry and parsing policy from the wire client so the retry rules can be
 * exercised against scripted responses.</p>
 * <p><strong>Thread-safety:</strong> Implementations must tolerate concurrent calls.</p>
 *
 * @since 0.1.0
 */
public interface HttpPort {

  /**
   * Sends one request and returns whatever the server answered, whatever the status.
   *
   * @param request request to send
   * @return response; non-2xx statuses are returned, not thrown
   * @throws IOException on connection, timeout or protocol failure
   * @throws InterruptedException if the calling thread is interrupted
   */
  Response exchange(Request request) throws IOException, InterruptedException;

  /**
   * Outgoing request.
   *
   * @param method HTTP method, upper-case
   * @param uri absolute target
   * @param headers request headers in insertion order
   * @param body request body; {@code null} for none
   */
  record Request(String method, URI uri, Map<String, String> headers, String body) {
    public Request {
      Objects.requireNonNull(method, "method");
      Objects.requireNonNull(uri, "uri");
      headers = headers == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(headers));
    }

    public static Request get(URI uri, Map<String, String> headers) {
      return new Request("GET", uri, headers, null);
    }

    public static Request post(URI uri, Map<String, String> headers, String body) {
      return new Request("POST", uri, headers, body);
    }
  }

  /**
   * Received response.
   *
   * @param status HTTP status code
   * @param headers first value per header, names lower-cased
   * @param body decoded body text; never {@code null}
   */
  record Response(int status, Map<String, String> headers, String body) {
    public Response {
      Map<String, String> lowered = new LinkedHashMap<>();
      if (headers != null) {
        headers.forEach((k, v) -> lowered.put(k.toLowerCase(Locale.ROOT), v));
      }
      headers = Collections.unmodifiableMap(lowered);
      body = body == null ? "" : body;
    }

    public Optional<String> header(String name) {
      return Optional.ofNullable(headers.get(name.toLowerCase(Locale.ROOT)));
    }

    public boolean isSuccess() {
      return status >= 200 && status < 300;
    }
  }
}
