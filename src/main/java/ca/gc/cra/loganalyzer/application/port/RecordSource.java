package ca.gc.cra.loganalyzer.application.port;

import java.io.IOException;
import java.util.Optional;

/**
 * <strong>What:</strong> Port that supplies input records to a search run, one at a time.
 * <p><strong>Why:</strong> Keeps the producer loop agnostic to where records come from (file, test list).</p>
 * <p><strong>Role:</strong> Port implemented by adapters such as {@code FileRecordSource}.</p>
 * <p><strong>Thread-safety:</strong> Polled only by the producer thread; no internal synchronization
 * required.</p>
 * <p><strong>Observability:</strong> Adapters may log open and close at DEBUG.</p>
 *
 * @param <T> record type
 * @implNote Callers must always invoke {@link #close()} to release file handles, including after a failed
 *     {@link #next()}.
 * @since 0.1.0
 */
public interface RecordSource<T> extends AutoCloseable {
  /**
   * Returns the next record.
   *
   * @return next record, or empty once the source is exhausted
   * @throws IOException if the underlying input cannot be read
   */
  Optional<T> next() throws IOException;

  /**
   * Releases the underlying input.
   *
   * @throws IOException if the input cannot be closed cleanly
   */
  @Override
  void close() throws IOException;
}
