package ca.gc.cra.subhunt.validation;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Network input validation for SubHunt: target domains and upstream endpoint URLs.
 */
public final class Net {

  // RFC-conservative bounds
  private static final int MAX_HOSTNAME_LENGTH = 253;   // total length
  private static final int MAX_LABEL_LENGTH    = 63;    // per label

  private static final Pattern IPV4_PATTERN = Pattern.compile("\\A\\d{1,3}(?:\\.\\d{1,3}){3}\\z");

  private Net() {
    // Utility
  }

  /**
   * Validates a target domain such as {@code example.com}.
   *
   * <p>The value is expected to be normalized already (lower-case, no trailing dot). Slashes and
   * whitespace are rejected up front so that pasted URLs fail with a clear message.</p>
   *
   * @param value candidate domain
   * @return the validated domain
   * @throws IllegalArgumentException when the value is not a usable DNS name
   */
  public static String validateDomain(String value) {
    if (value == null || value.isEmpty()) {
      throw new IllegalArgumentException("domain must not be empty");
    }
    if (value.indexOf('/') >= 0) {
      throw new IllegalArgumentException("domain must not contain '/' (pass a bare name, not a URL)");
    }
    for (int i = 0; i < value.length(); i++) {
      if (Character.isWhitespace(value.charAt(i))) {
        throw new IllegalArgumentException("domain must not contain whitespace");
      }
    }
    if (IPV4_PATTERN.matcher(value).matches()) {
      throw new IllegalArgumentException("domain must be a DNS name, not an IP address: " + value);
    }
    validateHostname(value);
    return value;
  }

  /**
   * Validates an upstream endpoint URL.
   *
   * @param name configuration key used in diagnostics
   * @param raw URL text
   * @return parsed URI
   * @throws IllegalArgumentException unless the URL is absolute http(s) with a host
   */
  public static URI validateHttpUrl(String name, String raw) {
    String trimmed = Strings.requireNonBlank(name, raw);
    try {
      URI uri = new URI(trimmed);
      String scheme = uri.getScheme();
      if (scheme == null) {
        throw new IllegalArgumentException(name + " must use http or https scheme");
      }
      String lower = scheme.toLowerCase(Locale.ROOT);
      if (!lower.equals("http") && !lower.equals("https")) {
        throw new IllegalArgumentException(name + " must use http or https scheme");
      }
      if (uri.getHost() == null || uri.getHost().isBlank()) {
        throw new IllegalArgumentException(name + " must include a host");
      }
      return uri;
    } catch (URISyntaxException ex) {
      throw new IllegalArgumentException(name + " must be a valid URI", ex);
    }
  }

  /** Deterministic hostname validator (ASCII/Punycode). */
  private static void validateHostname(String host) {
    final int len = host.length();
    if (len > MAX_HOSTNAME_LENGTH) {
      throw new IllegalArgumentException("invalid domain length: " + len + " (must be 1.." + MAX_HOSTNAME_LENGTH + ')');
    }

    int start = 0;
    while (true) {
      final int dot = host.indexOf('.', start);
      final int end = (dot == -1) ? len : dot;
      validateLabel(host, start, end);
      if (dot == -1) {
        break;
      }
      start = dot + 1;
      if (start == len) {
        throw new IllegalArgumentException("invalid domain: empty trailing label");
      }
    }
  }

  /**
   * Validates a single label [start,end):
   * - length 1..63
   * - first/last are alnum
   * - interior chars are alnum or '-'
   */
  private static void validateLabel(String s, int start, int end) {
    final int labelLen = end - start;
    if (labelLen <= 0 || labelLen > MAX_LABEL_LENGTH) {
      throw new IllegalArgumentException("invalid domain: label length " + labelLen + " (must be 1.." + MAX_LABEL_LENGTH + ")");
    }

    final char first = s.charAt(start);
    final char last  = s.charAt(end - 1);
    if (!isAsciiAlnum(first) || !isAsciiAlnum(last)) {
      throw new IllegalArgumentException("invalid domain: labels must start/end with alphanumeric");
    }

    for (int i = start + 1; i < end - 1; i++) {
      final char c = s.charAt(i);
      if (!(isAsciiAlnum(c) || c == '-')) {
        throw new IllegalArgumentException("invalid domain: illegal character '" + c + '\'');
      }
    }
  }

  /** Fast ASCII alphanumeric check (no locale). */
  private static boolean isAsciiAlnum(char c) {
    return (c >= 'a' && c <= 'z')
        || (c >= 'A' && c <= 'Z')
        || (c >= '0' && c <= '9');
  }
}
