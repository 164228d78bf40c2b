package ca.gc.cra.subhunt.api;

import ca.gc.cra.subhunt.validation.Strings;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Utility for turning {@code key=value} CLI arguments into a lookup map.
 * <p>Keys may carry a leading {@code --} ({@code --out=report.md} is the same as {@code out=report.md}).
 * An empty value is kept and clears the corresponding YAML setting. Stateless and thread-safe.</p>
 *
 * @since 0.1.0
 */
public final class CliArgsParser {
  private static final Pattern KEY_PATTERN = Pattern.compile("^[A-Za-z][A-Za-z0-9._]*$");

  private CliArgsParser() {}

  /**
   * Converts command-line arguments into a mutable map split on the first {@code '='}.
   *
   * @param args raw CLI arguments; {@code null} returns an empty map
   * @return mutable map keyed by the argument prefix prior to {@code '='}, in command-line order
   * @throws IllegalArgumentException when an argument is malformed or a key repeats
   */
  public static Map<String, String> toMap(String[] args) {
    Map<String, String> map = new LinkedHashMap<>();
    if (args == null) {
      return map;
    }
    for (String raw : args) {
      if (raw == null) {
        continue;
      }
      String arg = raw.trim();
      if (arg.isEmpty()) {
        continue;
      }
      int idx = arg.indexOf('=');
      if (idx < 0) {
        throw new IllegalArgumentException("argument must be key=value (was '" + raw + "')");
      }
      String key = stripDashes(arg.substring(0, idx).trim());
      String value = arg.substring(idx + 1).trim();
      validateKey(key, raw);
      validateValue(key, value);
      if (map.putIfAbsent(key, value) != null) {
        throw new IllegalArgumentException("argument " + key + " given more than once");
      }
    }
    return map;
  }

  private static String stripDashes(String key) {
    if (key.startsWith("--")) {
      return key.substring(2);
    }
    return key;
  }

  private static void validateKey(String key, String raw) {
    if (key.isEmpty()) {
      throw new IllegalArgumentException("argument must be key=value (was '" + raw + "')");
    }
    if (!KEY_PATTERN.matcher(key).matches()) {
      throw new IllegalArgumentException("invalid argument name: " + key);
    }
  }

  private static void validateValue(String key, String value) {
    if (value.indexOf('\0') >= 0) {
      throw new IllegalArgumentException("argument " + key + " must not contain null bytes");
    }
    if (!value.isEmpty()) {
      Strings.requireNonBlank(key, value);
    }
  }
}
