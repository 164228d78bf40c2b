package ca.gc.cra.subhunt.config;

import ca.gc.cra.subhunt.validation.Net;
import ca.gc.cra.subhunt.validation.Numbers;
import ca.gc.cra.subhunt.validation.Paths;
import ca.gc.cra.subhunt.validation.Strings;
import java.net.URI;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Settings for one discovery run: upstream endpoints, paging, retry, resolution and output.
 *
 * @param lookupUrl primary subdomain lookup endpoint
 * @param waybackUrl Wayback Machine CDX endpoint used with {@code --all}
 * @param crtshUrl crt.sh endpoint used with {@code --all}
 * @param userAgent User-Agent sent to every upstream
 * @param pageLimit results requested per lookup page
 * @param pageDelay pause between lookup pages
 * @param httpTimeout connect and request timeout
 * @param maxAttempts attempt budget for the primary source
 * @param baseBackoff first retry delay before jitter
 * @param maxBackoff retry delay ceiling before jitter
 * @param workers concurrent DNS lookups
 * @param maxInFlight outstanding lookups before candidate intake blocks
 * @param wildcardProbes random labels resolved to detect wildcard DNS
 * @param wildcardLabelLength length of each random label
 * @param archiveLimit row ceiling requested from the web archive
 * @param allSources whether secondary sources run after the primary one
 * @param reportPath Markdown report destination, when requested
 * @since 0.1.0
 */
public record DiscoveryConfig(
    URI lookupUrl,
    URI waybackUrl,
    URI crtshUrl,
    String userAgent,
    int pageLimit,
    Duration pageDelay,
    Duration httpTimeout,
    int maxAttempts,
    Duration baseBackoff,
    Duration maxBackoff,
    int workers,
    int maxInFlight,
    int wildcardProbes,
    int wildcardLabelLength,
    int archiveLimit,
    boolean allSources,
    Optional<Path> reportPath) {

  static final String DEFAULT_LOOKUP_URL = "https://ip.thc.org/api/v1/lookup/subdomains";
  static final String DEFAULT_WAYBACK_URL = "https://web.archive.org/cdx/search/cdx";
  static final String DEFAULT_CRTSH_URL = "https://crt.sh/";
  static final String DEFAULT_USER_AGENT = "thc-subd-cli/1.0";
  private static final int DEFAULT_PAGE_LIMIT = 500;
  private static final int DEFAULT_PAGE_DELAY_MS = 150;
  private static final int DEFAULT_HTTP_TIMEOUT_MS = 30_000;
  private static final int DEFAULT_MAX_ATTEMPTS = 6;
  private static final int DEFAULT_BASE_BACKOFF_MS = 500;
  private static final int DEFAULT_MAX_BACKOFF_MS = 20_000;
  private static final int DEFAULT_WORKERS = 60;
  private static final int DEFAULT_MAX_IN_FLIGHT = 2_500;
  private static final int DEFAULT_WILDCARD_PROBES = 3;
  private static final int DEFAULT_WILDCARD_LABEL_LENGTH = 18;
  private static final int DEFAULT_ARCHIVE_LIMIT = 100_000;
  private static final int MAX_USER_AGENT_LENGTH = 256;

  public DiscoveryConfig {
    Objects.requireNonNull(lookupUrl, "lookupUrl");
    Objects.requireNonNull(waybackUrl, "waybackUrl");
    Objects.requireNonNull(crtshUrl, "crtshUrl");
    Objects.requireNonNull(userAgent, "userAgent");
    Objects.requireNonNull(pageDelay, "pageDelay");
    Objects.requireNonNull(httpTimeout, "httpTimeout");
    Objects.requireNonNull(baseBackoff, "baseBackoff");
    Objects.requireNonNull(maxBackoff, "maxBackoff");
    Objects.requireNonNull(reportPath, "reportPath");
    Numbers.requireOrdered("workers", workers, "maxInFlight", maxInFlight);
    Numbers.requireOrdered("baseBackoffMs", baseBackoff.toMillis(), "maxBackoffMs", maxBackoff.toMillis());
  }

  /**
   * Returns the built-in defaults: primary source only, 60 workers, 2500 in flight, no report.
   *
   * @return default configuration
   */
  public static DiscoveryConfig defaults() {
    return new DiscoveryConfig(
        URI.create(DEFAULT_LOOKUP_URL),
        URI.create(DEFAULT_WAYBACK_URL),
        URI.create(DEFAULT_CRTSH_URL),
        DEFAULT_USER_AGENT,
        DEFAULT_PAGE_LIMIT,
        Duration.ofMillis(DEFAULT_PAGE_DELAY_MS),
        Duration.ofMillis(DEFAULT_HTTP_TIMEOUT_MS),
        DEFAULT_MAX_ATTEMPTS,
        Duration.ofMillis(DEFAULT_BASE_BACKOFF_MS),
        Duration.ofMillis(DEFAULT_MAX_BACKOFF_MS),
        DEFAULT_WORKERS,
        DEFAULT_MAX_IN_FLIGHT,
        DEFAULT_WILDCARD_PROBES,
        DEFAULT_WILDCARD_LABEL_LENGTH,
        DEFAULT_ARCHIVE_LIMIT,
        false,
        Optional.empty());
  }

  /**
   * Builds a configuration from flattened key/value settings, falling back to defaults for absent keys.
   *
   * @param kv effective settings (CLI, YAML and defaults already merged)
   * @return validated configuration
   * @throws IllegalArgumentException when a value is malformed or out of range
   */
  public static DiscoveryConfig fromMap(Map<String, String> kv) {
    Objects.requireNonNull(kv, "kv");
    String userAgent = firstNonBlank(kv, "userAgent");
    return new DiscoveryConfig(
        parseUrl(kv, "lookupUrl", DEFAULT_LOOKUP_URL),
        parseUrl(kv, "waybackUrl", DEFAULT_WAYBACK_URL),
        parseUrl(kv, "crtshUrl", DEFAULT_CRTSH_URL),
        userAgent == null
            ? DEFAULT_USER_AGENT
            : Strings.requirePrintableAscii("userAgent", userAgent, MAX_USER_AGENT_LENGTH),
        parseBoundedInt(kv, "pageLimit", DEFAULT_PAGE_LIMIT, 1, 10_000),
        Duration.ofMillis(parseBoundedInt(kv, "pageDelayMs", DEFAULT_PAGE_DELAY_MS, 0, 60_000)),
        Duration.ofMillis(parseBoundedInt(kv, "httpTimeoutMs", DEFAULT_HTTP_TIMEOUT_MS, 1_000, 300_000)),
        parseBoundedInt(kv, "maxAttempts", DEFAULT_MAX_ATTEMPTS, 1, 20),
        Duration.ofMillis(parseBoundedInt(kv, "baseBackoffMs", DEFAULT_BASE_BACKOFF_MS, 0, 60_000)),
        Duration.ofMillis(parseBoundedInt(kv, "maxBackoffMs", DEFAULT_MAX_BACKOFF_MS, 0, 600_000)),
        parseBoundedInt(kv, "workers", DEFAULT_WORKERS, 1, 1_024),
        parseBoundedInt(kv, "maxInFlight", DEFAULT_MAX_IN_FLIGHT, 1, 100_000),
        parseBoundedInt(kv, "wildcardProbes", DEFAULT_WILDCARD_PROBES, 2, 16),
        parseBoundedInt(kv, "wildcardLabelLength", DEFAULT_WILDCARD_LABEL_LENGTH, 8, 63),
        parseBoundedInt(kv, "archiveLimit", DEFAULT_ARCHIVE_LIMIT, 1, 1_000_000),
        parseBoolean("allSources", kv.get("allSources"), false),
        parseOptionalPath("out", kv.get("out")));
  }

  private static URI parseUrl(Map<String, String> kv, String key, String defaultValue) {
    String raw = firstNonBlank(kv, key);
    return Net.validateHttpUrl(key, raw == null ? defaultValue : raw);
  }

  private static int parseBoundedInt(
      Map<String, String> kv, String key, int defaultValue, int min, int max) {
    String raw = kv.get(key);
    if (raw == null || raw.isBlank()) {
      Numbers.requireRange(key, defaultValue, min, max);
      return defaultValue;
    }
    try {
      int parsed = Integer.parseInt(raw.trim());
      Numbers.requireRange(key, parsed, min, max);
      return parsed;
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(key + " must be an integer between " + min + " and " + max, ex);
    }
  }

  private static boolean parseBoolean(String name, String value, boolean fallback) {
    if (value == null || value.isBlank()) {
      return fallback;
    }
    String trimmed = value.trim();
    if (!trimmed.equalsIgnoreCase("true") && !trimmed.equalsIgnoreCase("false")) {
      throw new IllegalArgumentException(name + " must be true or false (was " + trimmed + ")");
    }
    return Boolean.parseBoolean(trimmed);
  }

  private static Optional<Path> parseOptionalPath(String name, String value) {
    if (value == null || value.isBlank()) {
      return Optional.empty();
    }
    return Optional.of(Paths.validateOutputFile(name, value));
  }

  private static String firstNonBlank(Map<String, String> map, String... keys) {
    for (String key : keys) {
      String val = map.get(key);
      if (val != null && !val.isBlank()) {
        return val;
      }
    }
    return null;
  }
}
