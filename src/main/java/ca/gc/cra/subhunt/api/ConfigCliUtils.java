package ca.gc.cra.subhunt.api;

import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;

/**
 * Shared helpers for mixing CLI arguments with YAML based configuration sources.
 */
final class ConfigCliUtils {
  static final String CONFIG_KEY = "config";
  static final String ALL_SOURCES_FLAG = "--all";

  private ConfigCliUtils() {}

  /**
   * Removes the {@code config=} entry from {@code args} so it is not treated as a setting.
   *
   * @param args mutable CLI key/value map
   * @return configured YAML path, when given and non-blank
   */
  static Optional<Path> extractConfigPath(Map<String, String> args) {
    if (args == null || args.isEmpty()) {
      return Optional.empty();
    }
    String value = args.remove(CONFIG_KEY);
    if (value == null || value.isBlank()) {
      return Optional.empty();
    }
    return Optional.of(Path.of(value.trim()));
  }

  /**
   * Folds boolean flags into their key/value equivalents.
   *
   * @param input parsed CLI input
   * @param args mutable CLI key/value map
   * @throws IllegalArgumentException when a flag is also given as a conflicting key/value pair
   */
  static void applyFlags(CliInput input, Map<String, String> args) {
    if (!input.hasFlag(ALL_SOURCES_FLAG)) {
      return;
    }
    String explicit = args.get("allSources");
    if (explicit != null && explicit.trim().equalsIgnoreCase("false")) {
      throw new IllegalArgumentException("--all conflicts with allSources=false");
    }
    args.put("allSources", "true");
  }
}
