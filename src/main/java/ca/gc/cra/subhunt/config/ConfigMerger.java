package ca.gc.cra.subhunt.config;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Merges configuration from defaults, YAML, and CLI sources while enforcing precedence and invariants.
 */
public final class ConfigMerger {

  private ConfigMerger() {}

  /**
   * Builds an effective configuration map using precedence CLI &gt; YAML &gt; defaults.
   *
   * @param yaml optional YAML-derived settings
   * @param cli CLI key/value overrides (may be empty)
   * @param defaults embedded defaults; their key set is the set of recognised keys
   * @param warn consumer invoked when a CLI key overrides a YAML key
   * @return immutable merged configuration map
   * @throws IllegalArgumentException when a key is unknown or cross-field validation fails
   */
  public static Map<String, String> buildEffectiveConfig(
      Optional<Map<String, String>> yaml,
      Map<String, String> cli,
      Map<String, String> defaults,
      Consumer<String> warn) {
    Objects.requireNonNull(yaml, "yaml");
    Map<String, String> defaultsCopy = defaults == null ? Map.of() : defaults;
    Map<String, String> yamlCopy = yaml.orElse(Map.of());
    Map<String, String> cliCopy = cli == null ? Map.of() : cli;

    requireKnown("YAML", yamlCopy, defaultsCopy);
    requireKnown("CLI", cliCopy, defaultsCopy);

    Map<String, String> merged = new LinkedHashMap<>(defaultsCopy);
    merged.putAll(yamlCopy);
    for (Map.Entry<String, String> entry : cliCopy.entrySet()) {
      String key = entry.getKey();
      if (yamlCopy.containsKey(key) && warn != null) {
        warn.accept("CLI overrides YAML for key: " + key);
      }
      if (entry.getValue() != null) {
        merged.put(key, entry.getValue());
      }
    }

    validate(merged);
    return Map.copyOf(merged);
  }

  private static void requireKnown(
      String origin, Map<String, String> settings, Map<String, String> defaults) {
    if (defaults.isEmpty()) {
      return;
    }
    for (String key : settings.keySet()) {
      if (!defaults.containsKey(key)) {
        throw new IllegalArgumentException("Unknown " + origin + " setting: " + key);
      }
    }
  }

  // Unparseable values are left for DiscoveryConfig.fromMap to report with range details.
  private static void validate(Map<String, String> effective) {
    requireNotGreater(effective, "workers", "maxInFlight");
    requireNotGreater(effective, "baseBackoffMs", "maxBackoffMs");
  }

  private static void requireNotGreater(Map<String, String> effective, String lowerKey, String upperKey) {
    Long lower = parseLong(effective.get(lowerKey));
    Long upper = parseLong(effective.get(upperKey));
    if (lower != null && upper != null && lower > upper) {
      throw new IllegalArgumentException(
          lowerKey + " (" + lower + ") must not exceed " + upperKey + " (" + upper + ")");
    }
  }

  private static Long parseLong(String value) {
    if (value == null || value.isBlank()) {
      return null;
    }
    try {
      return Long.parseLong(value.trim());
    } catch (NumberFormatException ex) {
      return null;
    }
  }
}
