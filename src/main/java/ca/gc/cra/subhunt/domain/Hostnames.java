package ca.gc.cra.subhunt.domain;

import java.util.Locale;

/**
 * Hostname normalization and scope rules shared by every candidate source.
 *
 * <p>Stateless and thread-safe.</p>
 *
 * @since 0.1.0
 */
public final class Hostnames {
  private static final String WILDCARD_PREFIX = "*.";

  private Hostnames() {
    // Utility
  }

  /**
   * Trims, lower-cases and strips trailing dots.
   *
   * @param raw candidate text; {@code null} yields an empty string
   * @return normalized hostname, possibly empty
   */
  public static String normalize(String raw) {
    if (raw == null) {
      return "";
    }
    String value = raw.trim().toLowerCase(Locale.ROOT);
    int end = value.length();
    while (end > 0 && value.charAt(end - 1) == '.') {
      end--;
    }
    return value.substring(0, end);
  }

  /**
   * Checks whether {@code host} is the target domain or one of its subdomains.
   *
   * <p>Both arguments are expected to be normalized. {@code example.com.evil.net} and
   * {@code notexample.com} are out of scope for {@code example.com}.</p>
   *
   * @param host normalized candidate
   * @param domain normalized target domain
   * @return {@code true} when in scope
   */
  public static boolean inScope(String host, String domain) {
    if (host == null || domain == null || host.isEmpty() || domain.isEmpty()) {
      return false;
    }
    return host.equals(domain) || host.endsWith("." + domain);
  }

  /**
   * Removes leading {@code *.} labels as found in certificate names.
   *
   * @param name raw certificate or DNS name
   * @return name without wildcard prefixes
   */
  public static String stripWildcard(String name) {
    if (name == null) {
      return "";
    }
    String value = name.trim();
    while (value.startsWith(WILDCARD_PREFIX)) {
      value = value.substring(WILDCARD_PREFIX.length());
    }
    return value;
  }

  /**
   * Reduces a URL-ish string (as archived by crawlers) to its host part.
   *
   * <p>Handles missing schemes, user info, ports, paths, queries and fragments. Bracketed IPv6
   * literals keep their brackets stripped.</p>
   *
   * @param url raw URL or bare host
   * @return host part, possibly empty
   */
  public static String hostOf(String url) {
    if (url == null) {
      return "";
    }
    String value = url.trim();
    int scheme = value.indexOf("://");
    if (scheme >= 0) {
      value = value.substring(scheme + 3);
    }
    value = cutAtFirst(value, '/', '?', '#');
    int at = value.lastIndexOf('@');
    if (at >= 0) {
      value = value.substring(at + 1);
    }
    if (value.startsWith("[")) {
      int close = value.indexOf(']');
      return close > 0 ? value.substring(1, close) : "";
    }
    int colon = value.indexOf(':');
    if (colon >= 0) {
      value = value.substring(0, colon);
    }
    return value;
  }

  private static String cutAtFirst(String value, char... delimiters) {
    int end = value.length();
    for (char delimiter : delimiters) {
      int idx = value.indexOf(delimiter);
      if (idx >= 0 && idx < end) {
        end = idx;
      }
    }
    return value.substring(0, end);
  }
}
