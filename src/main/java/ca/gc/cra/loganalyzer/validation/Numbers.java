package ca.gc.cra.loganalyzer.validation;

/**
 * <strong>What:</strong> Numeric validation helpers used by CLI and configuration parsing.
 * <p><strong>Why:</strong> Rejects worker counts, queue capacities and delays outside their supported
 * range before any thread or buffer is allocated.</p>
 * <p><strong>Thread-safety:</strong> Stateless utility.</p>
 * <p><strong>Observability:</strong> Emits no logs; throws {@link IllegalArgumentException} when validation
 * fails.</p>
 *
 * @since 0.1.0
 * @see Strings
 */
public final class Numbers {
  private Numbers() {
    // Utility
  }

  /**
   * Validates that a numeric value falls within an inclusive range.
   *
   * @param name logical parameter name included in diagnostics; defaults to {@code "value"} when blank
   * @param value candidate value
   * @param min minimum inclusive value
   * @param max maximum inclusive value
   * @return the validated value for fluent call sites
   * @throws IllegalArgumentException if {@code value} lies outside {@code [min, max]}
   */
  public static long requireRange(String name, long value, long min, long max) {
    if (value < min || value > max) {
      throw new IllegalArgumentException(
          label(name) + " must be between " + min + " and " + max + " (was " + value + ")");
    }
    return value;
  }

  /**
   * Parses a decimal integer and checks it against an inclusive range.
   *
   * @param name logical parameter name included in diagnostics
   * @param raw text to parse; surrounding whitespace is ignored
   * @param min minimum inclusive value
   * @param max maximum inclusive value
   * @return parsed value
   * @throws IllegalArgumentException if {@code raw} is blank, not an integer, or out of range
   */
  public static int parseIntInRange(String name, String raw, int min, int max) {
    if (raw == null || raw.isBlank()) {
      throw new IllegalArgumentException(label(name) + " must not be blank");
    }
    long parsed;
    try {
      parsed = Long.parseLong(raw.trim());
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(label(name) + " must be an integer (was '" + raw.trim() + "')", ex);
    }
    return (int) requireRange(name, parsed, min, max);
  }

  private static String label(String name) {
    return name == null || name.isBlank() ? "value" : name;
  }
}
