package ca.gc.cra.subhunt.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.net.URI;
import org.junit.jupiter.api.Test;

class NetTest {

  @Test
  void validateDomainAcceptsHostnames() {
    assertEquals("example.com", Net.validateDomain("example.com"));
    assertEquals("xn--bcher-kva.example", Net.validateDomain("xn--bcher-kva.example"));
    assertEquals("a-b.c1.example.org", Net.validateDomain("a-b.c1.example.org"));
  }

  @Test
  void validateDomainRejectsUrlsAndWhitespace() {
    IllegalArgumentException ex = assertThrows(
        IllegalArgumentException.class, () -> Net.validateDomain("https://example.com/"));
    assertTrue(ex.getMessage().contains("/"));
    assertThrows(IllegalArgumentException.class, () -> Net.validateDomain("exa mple.com"));
  }

  @Test
  void validateDomainRejectsMalformedLabels() {
    assertThrows(IllegalArgumentException.class, () -> Net.validateDomain(""));
    assertThrows(IllegalArgumentException.class, () -> Net.validateDomain("-bad.example.com"));
    assertThrows(IllegalArgumentException.class, () -> Net.validateDomain("bad..example.com"));
    assertThrows(IllegalArgumentException.class, () -> Net.validateDomain("under_score.com"));
    assertThrows(IllegalArgumentException.class, () -> Net.validateDomain("a".repeat(64) + ".com"));
  }

  @Test
  void validateDomainRejectsIpv4Literals() {
    assertThrows(IllegalArgumentException.class, () -> Net.validateDomain("192.0.2.1"));
  }

  @Test
  void validateHttpUrlAcceptsHttpAndHttps() {
    URI uri = Net.validateHttpUrl("lookupUrl", "https://ip.thc.org/api/v1/lookup/subdomains");
    assertEquals("ip.thc.org", uri.getHost());
    assertEquals("localhost", Net.validateHttpUrl("otelEndpoint", "http://localhost:4317").getHost());
  }

  @Test
  void validateHttpUrlRejectsOtherSchemesAndMissingHosts() {
    assertThrows(IllegalArgumentException.class, () -> Net.validateHttpUrl("lookupUrl", "ftp://example.com"));
    assertThrows(IllegalArgumentException.class, () -> Net.validateHttpUrl("lookupUrl", "example.com/path"));
    assertThrows(IllegalArgumentException.class, () -> Net.validateHttpUrl("lookupUrl", "http:///nohost"));
    assertThrows(IllegalArgumentException.class, () -> Net.validateHttpUrl("lookupUrl", " "));
  }
}
