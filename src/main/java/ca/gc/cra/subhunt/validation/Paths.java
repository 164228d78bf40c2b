package ca.gc.cra.subhunt.validation;

import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.LinkOption;
import java.nio.file.Path;

/**
 * <strong>What:</strong> Filesystem validation for the optional results report.
 * <p><strong>Why:</strong> Fails fast on an unusable {@code out=} target so that a long discovery run is not
 * wasted on a report that can never be written.
 * <p><strong>Thread-safety:</strong> Stateless methods; concurrency limited by underlying filesystem semantics.</p>
 *
 * @implNote Checks use {@link LinkOption#NOFOLLOW_LINKS} when inspecting the target itself.
 * @since 0.1.0
 * @see Strings
 */
public final class Paths {
  private Paths() {
    // Utility
  }

  /**
   * Parses and validates a report file location.
   *
   * <p>The parent directory must exist and be writable; the target may exist (it is replaced) but
   * must not be a directory.</p>
   *
   * @param name configuration key used in diagnostics
   * @param raw path text
   * @return absolute, normalized path
   * @throws IllegalArgumentException if the path is malformed or cannot be written
   */
  public static Path validateOutputFile(String name, String raw) {
    String value = Strings.requireNonBlank(name, raw);
    if (value.indexOf('\0') >= 0) {
      throw new IllegalArgumentException(name + " must not contain null bytes");
    }
    Path normalized;
    try {
      normalized = Path.of(value).toAbsolutePath().normalize();
    } catch (InvalidPathException ex) {
      throw new IllegalArgumentException(name + " is not a valid path: " + value, ex);
    }
    if (Files.isDirectory(normalized, LinkOption.NOFOLLOW_LINKS)) {
      throw new IllegalArgumentException(name + " points to a directory: " + normalized);
    }
    Path parent = normalized.getParent();
    if (parent == null || !Files.isDirectory(parent)) {
      throw new IllegalArgumentException(name + " parent directory does not exist: " + parent);
    }
    if (!Files.isWritable(parent)) {
      throw new IllegalArgumentException(name + " parent directory is not writable: " + parent);
    }
    return normalized;
  }
}
