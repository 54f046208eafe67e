package ca.gc.cra.loganalyzer.infrastructure.source;

import ca.gc.cra.loganalyzer.application.port.RecordSource;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link RecordSource} that reads a UTF-8 text file one line at a time.
 * <p><strong>Why:</strong> Log files are searched line by line; each line becomes one record with its
 * terminator stripped. Only {@code \n} ends a line. A {@code \r} directly before it is dropped with the
 * terminator; any other {@code \r} stays in the record.</p>
 * <p><strong>Role:</strong> Infrastructure adapter wired by {@code CompositionRoot}.</p>
 * <p><strong>Thread-safety:</strong> Not thread-safe; polled by the producer thread only.</p>
 * <p><strong>Observability:</strong> Logs open and close at DEBUG with the number of lines read.</p>
 *
 * @implNote Malformed UTF-8 sequences are replaced rather than rejected, so a stray binary line does not
 *     abort a search over an otherwise readable log.
 * @since 0.1.0
 */
public final class FileRecordSource implements RecordSource<String> {
  private static final Logger log = LoggerFactory.getLogger(FileRecordSource.class);

  private final Path path;
  private final BufferedReader reader;
  private long linesRead;
  private boolean closed;

  private FileRecordSource(Path path, BufferedReader reader) {
    this.path = path;
    this.reader = reader;
  }

  /**
   * Opens {@code path} for reading.
   *
   * @param path file to read; must exist and be readable
   * @return open source positioned at the first line
   * @throws IOException if the file cannot be opened
   */
  public static FileRecordSource open(Path path) throws IOException {
    Objects.requireNonNull(path, "path");
    BufferedReader reader =
        new BufferedReader(new InputStreamReader(Files.newInputStream(path), StandardCharsets.UTF_8));
    log.debug("Opened {} for search", path);
    return new FileRecordSource(path, reader);
  }

  @Override
  public Optional<String> next() throws IOException {
    if (closed) {
      throw new IOException("record source already closed: " + path);
    }
    String line = readLine();
    if (line == null) {
      return Optional.empty();
    }
    linesRead++;
    return Optional.of(line);
  }

  private String readLine() throws IOException {
    StringBuilder line = new StringBuilder();
    int ch;
    while ((ch = reader.read()) != -1) {
      if (ch == '\n') {
        int last = line.length() - 1;
        if (last >= 0 && line.charAt(last) == '\r') {
          line.setLength(last);
        }
        return line.toString();
      }
      line.append((char) ch);
    }
    return line.length() == 0 ? null : line.toString();
  }

  /**
   * Returns the number of lines handed out so far.
   *
   * @return line count
   */
  public long linesRead() {
    return linesRead;
  }

  public Path path() {
    return path;
  }

  @Override
  public void close() throws IOException {
    if (closed) {
      return;
    }
    closed = true;
    reader.close();
    log.debug("Closed {} after {} lines", path, linesRead);
  }
}
