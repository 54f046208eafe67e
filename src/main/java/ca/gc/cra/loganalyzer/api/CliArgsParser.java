package ca.gc.cra.loganalyzer.api;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Turns {@code key=value} tokens, or the four-token positional form, into an option map.
 * <p>Stateless and thread-safe.</p>
 *
 * @since 0.1.0
 */
public final class CliArgsParser {
  private static final Pattern KEY_PATTERN = Pattern.compile("^[A-Za-z0-9._-]+$");
  private static final Pattern INTEGER = Pattern.compile("^[+-]?\\d+$");

  private CliArgsParser() {}

  /**
   * Converts {@code key=value} arguments into a mutable map split on the first {@code '='}. Keys are
   * trimmed; values are not.
   *
   * @param args raw CLI arguments; {@code null} returns an empty map
   * @return mutable map in argument order
   * @throws IllegalArgumentException if a token is not {@code key=value} or contains control characters
   */
  public static Map<String, String> toMap(String[] args) {
    Map<String, String> map = new LinkedHashMap<>();
    if (args == null) {
      return map;
    }
    for (String raw : args) {
      if (raw == null || raw.isBlank()) {
        continue;
      }
      int idx = raw.indexOf('=');
      if (idx <= 0 || idx == raw.length() - 1) {
        throw new IllegalArgumentException("argument must be key=value (was '" + raw + "')");
      }
      // values are kept as typed; a search term may start or end with spaces
      String key = raw.substring(0, idx).trim();
      String value = raw.substring(idx + 1);
      validateKey(key);
      validateValue(key, value);
      map.put(key, value);
    }
    return map;
  }

  /**
   * Recognises {@code <capacity> <workers> <log_file> <search_term>}: exactly four tokens whose first two
   * are integers.
   *
   * @param args non-flag tokens
   * @return {@code true} when the tokens use the positional form
   */
  public static boolean isPositional(String[] args) {
    return args != null
        && args.length == 4
        && args[0] != null
        && args[1] != null
        && INTEGER.matcher(args[0].trim()).matches()
        && INTEGER.matcher(args[1].trim()).matches();
  }

  /**
   * Maps the positional form onto the {@code capacity}, {@code workers}, {@code in}, {@code term} keys.
   * Range checks happen later, in {@code SearchConfig}.
   *
   * @param args four positional tokens
   * @return mutable option map
   * @throws IllegalArgumentException if {@code args} is not in positional form
   */
  public static Map<String, String> fromPositional(String[] args) {
    if (!isPositional(args)) {
      throw new IllegalArgumentException(
          "expected <capacity> <workers> <log_file> <search_term>");
    }
    Map<String, String> map = new LinkedHashMap<>();
    map.put("capacity", args[0].trim());
    map.put("workers", args[1].trim());
    map.put("in", args[2]);
    validateValue("term", args[3]);
    map.put("term", args[3]);
    return map;
  }

  private static void validateKey(String key) {
    if (!KEY_PATTERN.matcher(key).matches()) {
      throw new IllegalArgumentException("invalid argument name: " + key);
    }
  }

  private static void validateValue(String key, String value) {
    for (int i = 0; i < value.length(); i++) {
      if (Character.isISOControl(value.charAt(i))) {
        throw new IllegalArgumentException("argument " + key + " must not contain control characters");
      }
    }
  }
}
