package ca.gc.cra.loganalyzer.api;

import java.io.FileDescriptor;
import java.io.FileOutputStream;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Stdout for the search CLI: usage blocks, the dry-run plan and result lines.
 *
 * <p>Log output goes to stderr through logback, so everything printed here can be piped.</p>
 */
public final class CliPrinter {
  private static final PrintWriter STDOUT = new PrintWriter(
      new OutputStreamWriter(new FileOutputStream(FileDescriptor.out), StandardCharsets.UTF_8), true);
  private static volatile PrintWriter override;

  private CliPrinter() {
    // Utility
  }

  /**
   * Prints one line.
   *
   * @param message line to emit
   */
  public static void println(String message) {
    out().println(message);
  }

  /**
   * Prints a multi-line text block such as help text, dropping trailing blank lines.
   *
   * @param block text to emit; {@code null} prints nothing
   */
  public static void printBlock(String block) {
    if (block == null) {
      return;
    }
    out().println(block.stripTrailing());
  }

  /**
   * Prints result lines in order and flushes once, so a summary is never interleaved with a late
   * shutdown notice.
   *
   * @param lines lines to emit
   */
  public static void printLines(List<String> lines) {
    PrintWriter writer = out();
    for (String line : lines) {
      writer.println(line);
    }
    writer.flush();
  }

  static void setWriterForTesting(PrintWriter writer) {
    override = writer;
  }

  static void clearTestWriter() {
    override = null;
  }

  private static PrintWriter out() {
    PrintWriter current = override;
    return current != null ? current : STDOUT;
  }
}
