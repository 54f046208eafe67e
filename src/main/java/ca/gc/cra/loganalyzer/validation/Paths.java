package ca.gc.cra.loganalyzer.validation;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;

/**
 * <strong>What:</strong> Filesystem validation for search input files.
 * <p><strong>Why:</strong> A missing or unreadable log file is an operator error and should be reported
 * as a configuration problem before any worker starts.</p>
 * <p><strong>Thread-safety:</strong> Stateless; results may be invalidated by concurrent filesystem
 * changes.</p>
 *
 * @since 0.1.0
 * @see Strings
 */
public final class Paths {
  private Paths() {
    // Utility
  }

  /**
   * Parses a path string supplied by an operator.
   *
   * @param name logical parameter name for diagnostics
   * @param raw path text
   * @return absolute, normalized path
   * @throws IllegalArgumentException if the text is blank, contains control characters, or is not a path
   */
  public static Path parse(String name, String raw) {
    String value = Strings.requireNonBlank(name, raw);
    try {
      return Path.of(value).toAbsolutePath().normalize();
    } catch (InvalidPathException ex) {
      throw new IllegalArgumentException(name + " is not a valid path: " + value, ex);
    }
  }

  /**
   * Validates that {@code path} names an existing, readable regular file.
   *
   * @param path candidate input file; must not be {@code null}
   * @return real path of the file with symbolic links resolved
   * @throws IllegalArgumentException if the file is missing, a directory, or unreadable
   */
  public static Path validateReadableFile(Path path) {
    if (path == null) {
      throw new IllegalArgumentException("path must not be null");
    }
    if (Strings.containsControl(path.toString())) {
      throw new IllegalArgumentException("path must not contain control characters");
    }
    Path normalized = path.toAbsolutePath().normalize();
    if (!Files.exists(normalized)) {
      throw new IllegalArgumentException("input file does not exist: " + normalized);
    }
    if (!Files.isRegularFile(normalized)) {
      throw new IllegalArgumentException("input is not a regular file: " + normalized);
    }
    if (!Files.isReadable(normalized)) {
      throw new IllegalArgumentException("input file is not readable: " + normalized);
    }
    try {
      return normalized.toRealPath();
    } catch (IOException ex) {
      throw new IllegalArgumentException("unable to resolve input file " + normalized + ": " + ex.getMessage(), ex);
    }
  }
}
