package ca.gc.cra.subhunt.config;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Supplies the flattened default configuration for a discovery run.
 *
 * <p>The key set doubles as the list of recognised settings: YAML and CLI keys outside it are
 * rejected by {@link ConfigMerger}.</p>
 */
public final class DiscoveryDefaults {
  private static final Map<String, String> DEFAULTS = buildDefaults();

  private DiscoveryDefaults() {}

  /**
   * Returns every recognised key mapped to its default value as a string.
   *
   * @return unmodifiable map of default key/value pairs
   */
  public static Map<String, String> asFlatMap() {
    return DEFAULTS;
  }

  private static Map<String, String> buildDefaults() {
    DiscoveryConfig defaults = DiscoveryConfig.defaults();
    Map<String, String> map = new LinkedHashMap<>();
    // Blank telemetry values leave OTEL_* environment variables in charge.
    map.put("metricsExporter", "");
    map.put("otelEndpoint", "");
    map.put("otelResourceAttributes", "");
    map.put("lookupUrl", defaults.lookupUrl().toString());
    map.put("waybackUrl", defaults.waybackUrl().toString());
    map.put("crtshUrl", defaults.crtshUrl().toString());
    map.put("userAgent", defaults.userAgent());
    map.put("pageLimit", Integer.toString(defaults.pageLimit()));
    map.put("pageDelayMs", Long.toString(defaults.pageDelay().toMillis()));
    map.put("httpTimeoutMs", Long.toString(defaults.httpTimeout().toMillis()));
    map.put("maxAttempts", Integer.toString(defaults.maxAttempts()));
    map.put("baseBackoffMs", Long.toString(defaults.baseBackoff().toMillis()));
    map.put("maxBackoffMs", Long.toString(defaults.maxBackoff().toMillis()));
    map.put("workers", Integer.toString(defaults.workers()));
    map.put("maxInFlight", Integer.toString(defaults.maxInFlight()));
    map.put("wildcardProbes", Integer.toString(defaults.wildcardProbes()));
    map.put("wildcardLabelLength", Integer.toString(defaults.wildcardLabelLength()));
    map.put("archiveLimit", Integer.toString(defaults.archiveLimit()));
    map.put("allSources", Boolean.toString(defaults.allSources()));
    map.put("out", "");
    return Map.copyOf(map);
  }
}
