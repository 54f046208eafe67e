package ca.gc.cra.loganalyzer.api;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class CliPrinterTest {
  private StringWriter buffer;

  @BeforeEach
  void setUp() {
    buffer = new StringWriter();
    CliPrinter.setWriterForTesting(new PrintWriter(buffer));
  }

  @AfterEach
  void tearDown() {
    CliPrinter.clearTestWriter();
  }

  @Test
  void blockDropsTrailingBlankLines() {
    CliPrinter.printBlock("usage: search\n  term=TEXT\n\n\n");
    CliPrinter.printBlock(null);

    assertEquals(List.of("usage: search", "  term=TEXT"), buffer.toString().lines().toList());
  }

  @Test
  void linesArePrintedInOrderAndFlushed() {
    CliPrinter.printLines(List.of("Total matches found: 3", "Worker 0 found 3 matches."));

    assertEquals(
        List.of("Total matches found: 3", "Worker 0 found 3 matches."), buffer.toString().lines().toList());
  }
}
