package ca.gc.cra.loganalyzer.api;

import ca.gc.cra.loganalyzer.logging.LoggingConfigurator;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command dispatcher for the loganalyzer executable.
 *
 * <p>{@code search} runs a search. Four bare tokens whose first two are integers
 * ({@code <capacity> <workers> <log_file> <search_term>}) also run a search without naming the
 * subcommand.</p>
 *
 * @since 0.1.0
 */
public final class Main {
  private static final Logger log = LoggerFactory.getLogger(Main.class);
  static final String SUMMARY_USAGE =
      "usage: loganalyzer search [options] | loganalyzer <capacity> <workers> <log_file> <search_term>";
  private static final String HELP_TEXT = """
      loganalyzer: parallel literal search over a log file

      Usage:
        loganalyzer <command> [options]
        loganalyzer <capacity> <workers> <log_file> <search_term>

      Commands:
        search      Count lines containing a term (search --help for details)

      Global flags:
        --help      Show this message
        --verbose   Enable DEBUG logging before dispatching to the command
      """;

  private Main() {}

  /**
   * Entry point invoked by the JVM.
   *
   * @param args raw CLI arguments
   */
  public static void main(String[] args) {
    ExitCode exit = run(args);
    System.exit(exit.code());
  }

  /**
   * Dispatches a command and returns its exit code without terminating the JVM.
   *
   * @param args dispatcher arguments
   * @return exit code reported by the command
   */
  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    String[] remainder = input.keyValueArgs();
    if (input.help() && remainder.length == 0) {
      CliPrinter.printBlock(HELP_TEXT);
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for dispatcher");
    }
    if (remainder.length == 0) {
      log.error("Missing command");
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    if (CliArgsParser.isPositional(remainder)) {
      return SearchCli.run(args);
    }

    String command = remainder[0].trim().toLowerCase(Locale.ROOT);
    return switch (command) {
      case "search" -> SearchCli.run(withoutCommand(args, remainder[0]));
      default -> {
        log.error("Unknown command: {}", command);
        CliPrinter.println(SUMMARY_USAGE);
        yield ExitCode.INVALID_ARGS;
      }
    };
  }

  // Flags such as --dry-run may sit before or after the command; they are passed through.
  static String[] withoutCommand(String[] args, String command) {
    List<String> delegate = new ArrayList<>(args.length);
    boolean removed = false;
    for (String arg : args) {
      if (!removed && arg != null && arg.equals(command)) {
        removed = true;
        continue;
      }
      delegate.add(arg);
    }
    return delegate.toArray(String[]::new);
  }
}
