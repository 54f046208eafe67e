package ca.gc.cra.loganalyzer.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;

import ca.gc.cra.loganalyzer.application.pipeline.SearchUseCase;
import ca.gc.cra.loganalyzer.domain.search.RunOutcome;
import ca.gc.cra.loganalyzer.domain.search.SearchSummary;
import ca.gc.cra.loganalyzer.infrastructure.exec.ShutdownController;
import ca.gc.cra.loganalyzer.infrastructure.metrics.NoOpMetricsAdapter;
import ca.gc.cra.loganalyzer.support.RecordingMetricsPort;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.OptionalLong;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CompositionRootTest {
  @TempDir Path tempDir;

  @Test
  void noneExporterUsesNoOpMetrics() {
    try (CompositionRoot root = CompositionRoot.forExporter("none")) {
      assertInstanceOf(NoOpMetricsAdapter.class, root.metrics());
    }
    try (CompositionRoot root = CompositionRoot.forExporter(null)) {
      assertInstanceOf(NoOpMetricsAdapter.class, root.metrics());
    }
  }

  @Test
  void searchUseCaseReadsConfiguredFile() throws IOException {
    Path log = Files.writeString(tempDir.resolve("app.log"), "ok\nerror one\nok\nERROR two\n");
    SearchConfig config = new SearchConfig(log, "error", 2, 4, Duration.ZERO, true, false);
    RecordingMetricsPort metrics = new RecordingMetricsPort();

    try (CompositionRoot root = new CompositionRoot(metrics)) {
      assertSame(metrics, root.metrics());
      SearchUseCase<String> useCase = root.searchUseCase(config, new ShutdownController());
      SearchSummary summary = useCase.run();

      assertEquals(RunOutcome.COMPLETED, summary.outcome());
      assertEquals(OptionalLong.of(2), summary.totalMatches());
      assertEquals(4, metrics.count("search.records.produced"));
    }
  }
}
