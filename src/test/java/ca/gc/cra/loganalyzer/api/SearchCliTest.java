package ca.gc.cra.loganalyzer.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.loganalyzer.domain.search.RunOutcome;
import ca.gc.cra.loganalyzer.domain.search.SearchSummary;
import ca.gc.cra.loganalyzer.infrastructure.exec.ShutdownController;
import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.OptionalLong;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;

class SearchCliTest {
  @TempDir Path tempDir;

  private ListAppender<ILoggingEvent> appender;
  private Logger logger;
  private boolean originalAdditive;
  private StringWriter buffer;
  private String previousExporter;
  private Path log;

  @BeforeEach
  void setUp() throws IOException {
    logger = (Logger) LoggerFactory.getLogger(SearchCli.class);
    originalAdditive = logger.isAdditive();
    logger.setAdditive(false);
    appender = new ListAppender<>();
    appender.start();
    logger.addAppender(appender);
    buffer = new StringWriter();
    CliPrinter.setWriterForTesting(new PrintWriter(buffer));
    previousExporter = System.getProperty(TelemetryConfigurator.EXPORTER_PROPERTY);
    log = Files.writeString(tempDir.resolve("app.log"), String.join("\n",
        "10:00:01 INFO  request ok",
        "10:00:02 ERROR upstream timeout",
        "10:00:03 WARN  slow response",
        "10:00:04 ERROR disk full",
        "10:00:05 INFO  request ok") + "\n");
  }

  @AfterEach
  void tearDown() {
    logger.detachAppender(appender);
    appender.stop();
    logger.setAdditive(originalAdditive);
    CliPrinter.clearTestWriter();
    if (previousExporter == null) {
      System.clearProperty(TelemetryConfigurator.EXPORTER_PROPERTY);
    } else {
      System.setProperty(TelemetryConfigurator.EXPORTER_PROPERTY, previousExporter);
    }
  }

  @Test
  void keyValueSearchPrintsTotal() {
    ExitCode code = run("in=" + log, "term=ERROR", "workers=2", "capacity=2");

    assertEquals(ExitCode.SUCCESS, code);
    assertEquals(List.of("Total matches found: 2"), outputLines());
  }

  @Test
  void positionalFormCountsMatchingLines() {
    ExitCode code = run("2", "3", log.toString(), "request ok");

    assertEquals(ExitCode.SUCCESS, code);
    assertEquals(List.of("Total matches found: 2"), outputLines());
  }

  @Test
  void keyValueTermKeepsSurroundingSpaces() {
    ExitCode code = run("in=" + log, "term=ok ");

    assertEquals(ExitCode.SUCCESS, code);
    assertEquals(List.of("Total matches found: 0"), outputLines());
  }

  @Test
  void workerCountsFollowTotalWhenRequested() {
    ExitCode code = run("in=" + log, "term=ERROR", "workers=3", "printWorkerCounts=true");

    assertEquals(ExitCode.SUCCESS, code);
    List<String> lines = outputLines();
    assertEquals(4, lines.size());
    assertEquals("Total matches found: 2", lines.get(0));
    long perWorkerTotal = 0;
    for (int i = 0; i < 3; i++) {
      String line = lines.get(i + 1);
      assertTrue(line.startsWith("Worker " + i + " found "), line);
      perWorkerTotal += Long.parseLong(line.split(" ")[3]);
    }
    assertEquals(2, perWorkerTotal);
  }

  @Test
  void ignoreCaseWidensMatches() {
    ExitCode code = run("in=" + log, "term=error", "ignoreCase=true");

    assertEquals(ExitCode.SUCCESS, code);
    assertEquals(List.of("Total matches found: 2"), outputLines());
  }

  @Test
  void shutdownBeforeStartReportsInterrupted() {
    ShutdownController shutdown = new ShutdownController();
    shutdown.requestShutdown();

    ExitCode code = SearchCli.run(new String[] {"in=" + log, "term=ERROR"}, shutdown, false);

    assertEquals(ExitCode.INTERRUPTED, code);
    assertEquals(130, code.code());
    assertEquals(List.of("Total matches found: 0"), outputLines());
  }

  @Test
  void missingInputReturnsUsageAndInvalidArgs() {
    ExitCode code = run("in=" + tempDir.resolve("missing.log"), "term=ERROR");

    assertEquals(ExitCode.INVALID_ARGS, code);
    assertTrue(buffer.toString().contains("usage: search"));
    assertTrue(appender.list.stream()
        .anyMatch(event -> event.getLevel() == Level.ERROR
            && event.getFormattedMessage().contains("input file does not exist")));
  }

  @Test
  void malformedTokenReturnsInvalidArgs() {
    ExitCode code = run("in=" + log, "ERROR");

    assertEquals(ExitCode.INVALID_ARGS, code);
    assertTrue(buffer.toString().contains("usage: search"));
  }

  @Test
  void outOfRangeWorkersReturnInvalidArgs() {
    assertEquals(ExitCode.INVALID_ARGS, run("in=" + log, "term=ERROR", "workers=0"));
    assertEquals(ExitCode.INVALID_ARGS, run("0", "2", log.toString(), "ERROR"));
  }

  @Test
  void dryRunPrintsPlanWithoutSearching() {
    ExitCode code = run("in=" + log, "term=ERROR", "workers=2", "--dry-run");

    assertEquals(ExitCode.SUCCESS, code);
    String output = buffer.toString();
    assertTrue(output.contains("Search dry-run plan:"));
    assertTrue(output.contains("  workers=2"));
    assertFalse(output.contains("Total matches"));
  }

  @Test
  void yamlConfigSuppliesValuesAndCliOverrides() throws IOException {
    Path yaml = Files.writeString(tempDir.resolve("search.yaml"), """
        search:
          in: %s
          term: WARN
          workers: 2
        """.formatted(log.toString()));

    ExitCode code = run("config=" + yaml, "term=ERROR");

    assertEquals(ExitCode.SUCCESS, code);
    assertEquals(List.of("Total matches found: 2"), outputLines());
    assertTrue(appender.list.stream()
        .anyMatch(event -> event.getLevel() == Level.WARN
            && event.getFormattedMessage().contains("CLI overrides YAML for key: term")));
  }

  @Test
  void missingConfigFileReturnsInvalidArgs() {
    ExitCode code = run("config=" + tempDir.resolve("absent.yaml"), "in=" + log, "term=ERROR");

    assertEquals(ExitCode.INVALID_ARGS, code);
  }

  @Test
  void helpPrintsUsage() {
    assertEquals(ExitCode.SUCCESS, run("--help"));
    assertTrue(buffer.toString().contains("loganalyzer search"));
  }

  @Test
  void outcomesMapToExitCodes() {
    assertEquals(ExitCode.SUCCESS, SearchCli.exitCodeFor(RunOutcome.COMPLETED));
    assertEquals(ExitCode.INTERRUPTED, SearchCli.exitCodeFor(RunOutcome.INTERRUPTED));
    assertEquals(ExitCode.RUNTIME_FAILURE, SearchCli.exitCodeFor(RunOutcome.FAILED));
  }

  @Test
  void missingAggregateIsReportedAsUnavailable() {
    SearchSummary failed = new SearchSummary(
        RunOutcome.FAILED, OptionalLong.empty(), new long[] {1, 0}, 3, 0, Duration.ZERO);

    assertEquals(List.of("Total matches unavailable"), SearchCli.summaryLines(failed, false));
    assertEquals(
        List.of("Total matches unavailable", "Worker 0 found 1 matches.", "Worker 1 found 0 matches."),
        SearchCli.summaryLines(failed, true));
  }

  private ExitCode run(String... args) {
    return SearchCli.run(args, new ShutdownController(), false);
  }

  private List<String> outputLines() {
    return buffer.toString().lines().toList();
  }
}
