package ca.gc.cra.loganalyzer.api;

import ca.gc.cra.loganalyzer.application.pipeline.SearchUseCase;
import ca.gc.cra.loganalyzer.config.CompositionRoot;
import ca.gc.cra.loganalyzer.config.ConfigMerger;
import ca.gc.cra.loganalyzer.config.DefaultsForMode;
import ca.gc.cra.loganalyzer.config.SearchConfig;
import ca.gc.cra.loganalyzer.config.YamlConfigLoader;
import ca.gc.cra.loganalyzer.domain.search.RunOutcome;
import ca.gc.cra.loganalyzer.domain.search.SearchSummary;
import ca.gc.cra.loganalyzer.infrastructure.exec.ShutdownController;
import ca.gc.cra.loganalyzer.infrastructure.signal.InterruptBridge;
import ca.gc.cra.loganalyzer.logging.LoggingConfigurator;
import ca.gc.cra.loganalyzer.logging.Logs;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for counting the lines of a log file that contain a literal term.
 *
 * @since 0.1.0
 */
public final class SearchCli {
  private static final Logger log = LoggerFactory.getLogger(SearchCli.class);
  private static final String MODE = "search";
  static final String SUMMARY_USAGE =
      "usage: search in=PATH term=TEXT [workers=N] [capacity=N] [produceDelayMs=MS] "
          + "[ignoreCase=true|false] [printWorkerCounts=true|false] [config=PATH] [--dry-run] "
          + "[metricsExporter=otlp|none] [otelEndpoint=URL] [otelResourceAttributes=K=V,...] "
          + "| search <capacity> <workers> <log_file> <search_term>";
  private static final String HELP_TEXT = """
      loganalyzer search

      Usage:
        search in=/var/log/app.log term=ERROR [options]
        search 64 4 /var/log/app.log ERROR

      Required:
        in=PATH                    Log file to scan (readable regular file)
        term=TEXT                  Literal term; a line matches when it contains it

      Optional (validated):
        workers=N                  Search workers, 1-256 (default: available processors)
        capacity=N                 Hand-off queue capacity, 1-65536 (default 64)
        produceDelayMs=MS          Pause after each line, 0-60000 (default 0)
        ignoreCase=true|false      Case-insensitive matching (default false)
        printWorkerCounts=true|false  Print one line per worker after the total (default false)
        config=PATH                YAML file with common/search sections
        metricsExporter=otlp|none  Metrics exporter (default none)
        otelEndpoint=URL           OTLP metrics endpoint when exporter=otlp
        otelResourceAttributes=K=V Comma-separated OTel resource attributes
        --dry-run                  Validate inputs and print the plan without searching
        --verbose                  Enable DEBUG logging
        --help                     Show this message

      Notes:
        Ctrl-C stops the search early and prints the partial total (exit 130).
      """;

  private SearchCli() {}

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
   * Runs a search with a SIGINT handler installed for its duration.
   *
   * @param args raw CLI arguments
   * @return exit code capturing the outcome
   */
  static ExitCode run(String[] args) {
    return run(args, new ShutdownController(), true);
  }

  /**
   * Runs a search against a caller-supplied shutdown controller.
   *
   * @param args raw CLI arguments
   * @param shutdown shutdown flag for the run
   * @param installInterruptHandler whether to route SIGINT to {@code shutdown}
   * @return exit code capturing the outcome
   */
  static ExitCode run(String[] args, ShutdownController shutdown, boolean installInterruptHandler) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.printBlock(HELP_TEXT);
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for search CLI");
    }

    boolean dryRunFlag = input.hasFlag("--dry-run");

    Map<String, String> kv;
    try {
      String[] tokens = input.keyValueArgs();
      kv = CliArgsParser.isPositional(tokens)
          ? CliArgsParser.fromPositional(tokens)
          : CliArgsParser.toMap(tokens);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    String configPath = ConfigCliUtils.extractConfigPath(kv);

    Optional<Map<String, String>> yamlConfig = Optional.empty();
    if (configPath != null) {
      Path yamlPath = Path.of(configPath);
      if (!Files.exists(yamlPath)) {
        log.error("Configuration file does not exist: {}", yamlPath);
        CliPrinter.println(SUMMARY_USAGE);
        return ExitCode.INVALID_ARGS;
      }
      try {
        yamlConfig = YamlConfigLoader.load(yamlPath, MODE);
      } catch (IllegalArgumentException ex) {
        log.error("Invalid YAML configuration: {}", ex.getMessage());
        CliPrinter.println(SUMMARY_USAGE);
        return ExitCode.INVALID_ARGS;
      } catch (IOException ex) {
        log.error("Unable to read configuration file {}", yamlPath, ex);
        return ExitCode.IO_ERROR;
      }
    }

    Map<String, String> configInputs;
    String metricsExporter;
    SearchConfig config;
    boolean dryRun;
    try {
      Map<String, String> effective = ConfigMerger.buildEffectiveConfig(
          MODE, yamlConfig, kv, DefaultsForMode.asFlatMap(MODE), log::warn);
      dryRun = dryRunFlag || ConfigCliUtils.parseBoolean(effective, "dryRun", false);
      configInputs = new LinkedHashMap<>(effective);
      configInputs.remove("dryRun");
      configInputs.remove("verbose");
      metricsExporter = TelemetryConfigurator.configureMetrics(configInputs);
      config = SearchConfig.fromMap(configInputs);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid search arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    if (dryRun) {
      printDryRunPlan(config, metricsExporter);
      return ExitCode.SUCCESS;
    }

    InterruptBridge bridge = installInterruptHandler ? InterruptBridge.install(shutdown, System.err) : null;
    try (CompositionRoot root = CompositionRoot.forExporter(metricsExporter)) {
      log.info(
          "Configured search: input={}, term='{}', workers={}, capacity={}, metricsExporter={}",
          config.input(),
          Logs.truncate(config.term()),
          config.workers(),
          config.queueCapacity(),
          metricsExporter);
      SearchUseCase<String> useCase = root.searchUseCase(config, shutdown);
      SearchSummary summary = useCase.run();
      printSummary(summary, config.printWorkerCounts());
      ExitCode exit = exitCodeFor(summary.outcome());
      log.debug("Search finished with outcome {} (exit {})", summary.outcome(), exit.code());
      return exit;
    } catch (IllegalArgumentException ex) {
      log.error("Search configuration error: {}", ex.getMessage(), ex);
      return ExitCode.CONFIG_ERROR;
    } catch (IOException ex) {
      log.error("Search I/O failure while reading {}", config.input(), ex);
      return ExitCode.IO_ERROR;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure in search pipeline", ex);
      return ExitCode.RUNTIME_FAILURE;
    } finally {
      if (bridge != null) {
        bridge.close();
      }
    }
  }

  static ExitCode exitCodeFor(RunOutcome outcome) {
    return switch (outcome) {
      case COMPLETED -> ExitCode.SUCCESS;
      case INTERRUPTED -> ExitCode.INTERRUPTED;
      case FAILED -> ExitCode.RUNTIME_FAILURE;
    };
  }

  static List<String> summaryLines(SearchSummary summary, boolean printWorkerCounts) {
    List<String> lines = new ArrayList<>();
    if (summary.totalMatches().isPresent()) {
      lines.add("Total matches found: " + summary.totalMatches().getAsLong());
    } else {
      lines.add("Total matches unavailable");
    }
    if (printWorkerCounts) {
      long[] perWorker = summary.workerMatches();
      for (int i = 0; i < perWorker.length; i++) {
        lines.add("Worker " + i + " found " + perWorker[i] + " matches.");
      }
    }
    return lines;
  }

  private static void printSummary(SearchSummary summary, boolean printWorkerCounts) {
    CliPrinter.printLines(summaryLines(summary, printWorkerCounts));
  }

  private static void printDryRunPlan(SearchConfig config, String metricsExporter) {
    CliPrinter.printLines(List.of(
        "Search dry-run plan:",
        "  input=" + config.input(),
        "  term=" + Logs.truncate(config.term()),
        "  ignoreCase=" + config.ignoreCase(),
        "  workers=" + config.workers(),
        "  capacity=" + config.queueCapacity(),
        "  produceDelayMs=" + config.produceDelay().toMillis(),
        "  printWorkerCounts=" + config.printWorkerCounts(),
        "  metricsExporter=" + metricsExporter));
  }
}
