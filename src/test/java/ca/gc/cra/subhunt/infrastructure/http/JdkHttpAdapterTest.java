package ca.gc.cra.subhunt.infrastructure.http;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.net.http.HttpClient;
import java.time.Duration;
import org.junit.jupiter.api.Test;

class JdkHttpAdapterTest {
  @Test
  void followsRedirectsExceptHttpsDowngrades() {
    JdkHttpAdapter adapter = new JdkHttpAdapter(Duration.ofSeconds(5));

    assertEquals(HttpClient.Redirect.NORMAL, adapter.redirectPolicy());
  }

  @Test
  void requiresTimeout() {
    assertThrows(NullPointerException.class, () -> new JdkHttpAdapter(null));
  }
}
