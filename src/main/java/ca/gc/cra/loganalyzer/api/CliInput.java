package ca.gc.cra.loganalyzer.api;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Parsed command line split into flags and the remaining tokens.
 *
 * <p>Tokens starting with {@code -} that carry no {@code '='} are flags; everything else (key/value
 * pairs, positional values, the subcommand) is kept in order.</p>
 */
public final class CliInput {
  private static final Set<String> HELP_FLAGS = Set.of("--help", "-h", "help");
  private static final Set<String> VERBOSE_FLAGS = Set.of("--verbose", "-v", "--debug");

  private final String[] keyValueArgs;
  private final Set<String> flags;
  private final boolean help;
  private final boolean verbose;

  private CliInput(String[] keyValueArgs, Set<String> flags, boolean help, boolean verbose) {
    this.keyValueArgs = keyValueArgs;
    this.flags = flags;
    this.help = help;
    this.verbose = verbose;
  }

  /**
   * Parses raw arguments into flags and remaining tokens. Blank and {@code null} tokens are dropped;
   * remaining tokens keep their surrounding whitespace so a positional search term is used verbatim.
   *
   * @param args raw CLI arguments (may be {@code null})
   * @return parsed representation of the arguments
   */
  public static CliInput parse(String[] args) {
    if (args == null || args.length == 0) {
      return new CliInput(new String[0], Set.of(), false, false);
    }

    List<String> remaining = new ArrayList<>();
    Set<String> flags = new LinkedHashSet<>();
    boolean help = false;
    boolean verbose = false;
    for (String raw : args) {
      if (raw == null || raw.isBlank()) {
        continue;
      }
      String arg = raw.trim();
      String lower = arg.toLowerCase(Locale.ROOT);
      if (HELP_FLAGS.contains(lower)) {
        help = true;
        flags.add("--help");
        continue;
      }
      if (VERBOSE_FLAGS.contains(lower)) {
        verbose = true;
        flags.add("--verbose");
        continue;
      }
      if (isFlag(arg)) {
        flags.add(lower);
        continue;
      }
      remaining.add(raw);
    }
    return new CliInput(remaining.toArray(String[]::new), Set.copyOf(flags), help, verbose);
  }

  /**
   * Returns the non-flag tokens in their original order.
   *
   * @return copy of the remaining arguments
   */
  public String[] keyValueArgs() {
    return Arrays.copyOf(keyValueArgs, keyValueArgs.length);
  }

  public boolean help() {
    return help;
  }

  public boolean verbose() {
    return verbose;
  }

  /**
   * Checks whether a normalized flag such as {@code --dry-run} was provided.
   *
   * @param flag flag to query (case-insensitive)
   * @return {@code true} if the flag was supplied
   */
  public boolean hasFlag(String flag) {
    if (flag == null || flag.isBlank()) {
      return false;
    }
    return flags.contains(flag.trim().toLowerCase(Locale.ROOT));
  }

  /**
   * Returns all normalized flags supplied on the command line.
   *
   * @return set of lowercase flags
   */
  public Set<String> flags() {
    return flags;
  }

  // "-5" is a value, not a flag.
  static boolean isFlag(String arg) {
    if (!arg.startsWith("-") || arg.contains("=") || arg.length() < 2) {
      return false;
    }
    return !Character.isDigit(arg.charAt(1));
  }
}
