package ca.gc.cra.loganalyzer.application.pipeline;

import ca.gc.cra.loganalyzer.application.port.MetricsPort;
import ca.gc.cra.loganalyzer.domain.search.WorkItem;
import ca.gc.cra.loganalyzer.infrastructure.buffer.BoundedQueue;
import ca.gc.cra.loganalyzer.infrastructure.exec.Rendezvous;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Predicate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Consumes work items until it sees its end-of-stream marker or a shut-down, empty queue, counting
 * records that satisfy the predicate.
 *
 * <p>On exit the worker writes its count into its own slot and arrives at the rendezvous, whichever
 * path ended the loop and even when the predicate threw. Each worker owns exactly one slot, so slots
 * need no synchronization beyond the rendezvous itself.</p>
 *
 * @param <T> record type
 * @since 0.1.0
 */
public final class SearchWorker<T> implements Runnable {
  private static final Logger log = LoggerFactory.getLogger(SearchWorker.class);

  private final int id;
  private final BoundedQueue<WorkItem<T>> queue;
  private final Predicate<? super T> predicate;
  private final long[] slots;
  private final Rendezvous rendezvous;
  private final MetricsPort metrics;
  private final Runnable onFailure;

  private volatile Rendezvous.Arrival arrival;

  /**
   * Creates a worker.
   *
   * @param id worker index; selects the slot this worker writes
   * @param queue shared hand-off queue
   * @param predicate match test applied to each record
   * @param slots per-worker result array shared by the run
   * @param rendezvous end-of-run barrier
   * @param metrics metrics sink
   * @param onFailure invoked when the predicate throws, before the worker exits
   */
  public SearchWorker(
      int id,
      BoundedQueue<WorkItem<T>> queue,
      Predicate<? super T> predicate,
      long[] slots,
      Rendezvous rendezvous,
      MetricsPort metrics,
      Runnable onFailure) {
    this.slots = Objects.requireNonNull(slots, "slots");
    if (id < 0 || id >= slots.length) {
      throw new IllegalArgumentException("worker id " + id + " outside slot range 0.." + (slots.length - 1));
    }
    this.id = id;
    this.queue = Objects.requireNonNull(queue, "queue");
    this.predicate = Objects.requireNonNull(predicate, "predicate");
    this.rendezvous = Objects.requireNonNull(rendezvous, "rendezvous");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.onFailure = Objects.requireNonNull(onFailure, "onFailure");
  }

  @Override
  public void run() {
    MDC.put("worker", Integer.toString(id));
    log.info("Worker {} started.", id);
    long records = 0;
    long matches = 0;
    try {
      while (true) {
        Optional<WorkItem<T>> next = queue.pop();
        if (next.isEmpty()) {
          log.debug("Worker {} stopping: queue shut down and empty", id);
          break;
        }
        WorkItem<T> item = next.get();
        if (item.isEndOfStream()) {
          log.debug("Worker {} stopping: end of stream", id);
          break;
        }
        records++;
        if (predicate.test(item.payload())) {
          matches++;
        }
      }
    } catch (RuntimeException ex) {
      log.error("Worker {} failed after {} records; requesting shutdown", id, records, ex);
      onFailure.run();
    } finally {
      slots[id] = matches;
      log.info("Worker {} found {} matches.", id, matches);
      metrics.observe("search.worker.records", records);
      metrics.observe("search.worker.matches", matches);
      try {
        Rendezvous.Arrival result = rendezvous.await();
        arrival = result;
        if (result.leader()) {
          log.debug("Worker {} aggregated total {}", id, result.total());
        }
      } finally {
        MDC.remove("worker");
      }
    }
  }

  /**
   * Returns this worker's rendezvous arrival once it has exited.
   *
   * @return arrival, or empty while the worker is still running
   */
  public Optional<Rendezvous.Arrival> arrival() {
    return Optional.ofNullable(arrival);
  }
}
