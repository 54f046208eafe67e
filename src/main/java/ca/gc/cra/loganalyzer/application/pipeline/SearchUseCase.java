package ca.gc.cra.loganalyzer.application.pipeline;

import ca.gc.cra.loganalyzer.application.port.MetricsPort;
import ca.gc.cra.loganalyzer.application.port.RecordSource;
import ca.gc.cra.loganalyzer.domain.search.RunOutcome;
import ca.gc.cra.loganalyzer.domain.search.SearchSummary;
import ca.gc.cra.loganalyzer.domain.search.WorkItem;
import ca.gc.cra.loganalyzer.infrastructure.buffer.BoundedQueue;
import ca.gc.cra.loganalyzer.infrastructure.exec.ExecutorFactories;
import ca.gc.cra.loganalyzer.infrastructure.exec.Rendezvous;
import ca.gc.cra.loganalyzer.infrastructure.exec.ShutdownController;
import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Predicate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Runs one parallel search: a producer feeding a bounded queue, N workers counting
 * matches, and a rendezvous that aggregates their counts exactly once.
 * <p><strong>Why:</strong> Owns every piece of run state (queue, result slots, rendezvous, shutdown
 * listener) so nothing lives in process-wide globals.</p>
 * <p><strong>Role:</strong> Application use case invoked by {@code SearchCli} through
 * {@code CompositionRoot}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Start the worker pool; on a spawn failure, shut down and break the rendezvous.</li>
 *   <li>Produce records with backpressure, then one end-of-stream marker per worker.</li>
 *   <li>Join every worker, read the aggregate, and release records left in the queue.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Instances are single-use; {@link #run()} may be invoked once.
 * {@link #phase()} may be read from any thread.</p>
 * <p><strong>Observability:</strong> MDC {@code pipeline=search}; metrics {@code search.records.produced},
 * {@code search.push.rejected}, {@code search.sentinel.undelivered}, {@code search.records.released},
 * {@code search.rendezvous.broken}, {@code search.queue.highWater} and {@code search.run.elapsedMillis}.</p>
 *
 * @param <T> record type
 * @since 0.1.0
 */
public final class SearchUseCase<T> {
  private static final Logger log = LoggerFactory.getLogger(SearchUseCase.class);

  private static final Duration POOL_SHUTDOWN_TIMEOUT = Duration.ofSeconds(5);

  private final SearchSettings settings;
  private final RecordSource<T> source;
  private final Predicate<? super T> predicate;
  private final ShutdownController shutdown;
  private final MetricsPort metrics;
  private final ThreadFactory workerThreads;
  private final AtomicBoolean used = new AtomicBoolean();
  private final AtomicReference<Throwable> workerFailure = new AtomicReference<>();

  private volatile RunPhase phase = RunPhase.INIT;
  private long produced;
  private boolean interrupted;

  /**
   * Creates a search run with workers named {@code search-worker-<i>}.
   *
   * @param settings worker count, queue capacity and producer pacing
   * @param source record input; closed when the run ends
   * @param predicate match test applied by every worker
   * @param shutdown shutdown flag shared with the interrupt handler
   * @param metrics metrics sink
   */
  public SearchUseCase(
      SearchSettings settings,
      RecordSource<T> source,
      Predicate<? super T> predicate,
      ShutdownController shutdown,
      MetricsPort metrics) {
    this(settings, source, predicate, shutdown, metrics, null);
  }

  /**
   * Creates a search run with a custom worker thread factory.
   *
   * @param settings worker count, queue capacity and producer pacing
   * @param source record input; closed when the run ends
   * @param predicate match test applied by every worker
   * @param shutdown shutdown flag shared with the interrupt handler
   * @param metrics metrics sink
   * @param workerThreads thread factory for the pool; {@code null} selects named non-daemon threads
   */
  public SearchUseCase(
      SearchSettings settings,
      RecordSource<T> source,
      Predicate<? super T> predicate,
      ShutdownController shutdown,
      MetricsPort metrics,
      ThreadFactory workerThreads) {
    this.settings = Objects.requireNonNull(settings, "settings");
    this.source = Objects.requireNonNull(source, "source");
    this.predicate = Objects.requireNonNull(predicate, "predicate");
    this.shutdown = Objects.requireNonNull(shutdown, "shutdown");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.workerThreads = workerThreads != null
        ? workerThreads
        : ExecutorFactories.namedThreads("search-worker");
  }

  /**
   * Executes the run to completion.
   *
   * @return summary of the run; the aggregate is empty when the rendezvous did not complete
   * @throws IOException if the record source failed; raised only after workers are joined and the
   *     queue is released
   * @throws IllegalStateException if this instance was already run or the shutdown controller was
   *     closed by an earlier run
   */
  public SearchSummary run() throws IOException {
    if (shutdown.isClosed()) {
      throw new IllegalStateException("shutdown controller already closed; use a new one per run");
    }
    if (!used.compareAndSet(false, true)) {
      throw new IllegalStateException("search run already executed");
    }
    MDC.put("pipeline", "search");
    long startNanos = System.nanoTime();
    int workerCount = settings.workers();
    BoundedQueue<WorkItem<T>> queue = new BoundedQueue<>(settings.queueCapacity());
    long[] slots = new long[workerCount];
    Rendezvous rendezvous = new Rendezvous(workerCount, () -> sum(slots));
    Runnable stopAll = () -> {
      shutdown.requestShutdown();
      queue.signalShutdown();
    };

    Throwable spawnFailure = null;
    IOException ioFailure = null;
    RuntimeException producerFailure = null;
    long released = 0;
    ExecutorService pool = null;
    List<Future<?>> futures = new ArrayList<>(workerCount);
    try {
      shutdown.onShutdown(queue::signalShutdown);
      shutdown.start();

      pool = ExecutorFactories.newWorkerPool(workerCount, workerThreads);
      for (int i = 0; i < workerCount; i++) {
        SearchWorker<T> worker =
            new SearchWorker<>(i, queue, predicate, slots, rendezvous, metrics, () -> {
              workerFailure.compareAndSet(null, new IllegalStateException("search worker failed"));
              stopAll.run();
            });
        try {
          futures.add(pool.submit(worker));
        } catch (RejectedExecutionException | OutOfMemoryError ex) {
          spawnFailure = ex;
          log.error("Could not start worker {} of {}; shutting down started workers", i, workerCount, ex);
          stopAll.run();
          rendezvous.abort();
          break;
        }
      }

      if (spawnFailure == null) {
        transition(RunPhase.RUNNING);
        log.info(
            "Search started with {} workers and queue capacity {}", workerCount, settings.queueCapacity());
        try {
          produce(queue);
        } catch (IOException ex) {
          ioFailure = ex;
          log.error("Reading input failed; shutting down", ex);
          stopAll.run();
        } catch (RuntimeException ex) {
          producerFailure = ex;
          log.error("Producer failed; shutting down", ex);
          stopAll.run();
        }

        transition(RunPhase.DRAINING);
        pushEndOfStream(queue, workerCount);
      }

      transition(RunPhase.TERMINATING);
      joinWorkers(futures, stopAll);
    } finally {
      stopPool(pool);
      List<WorkItem<T>> leftovers = queue.drain();
      for (WorkItem<T> item : leftovers) {
        if (!item.isEndOfStream()) {
          released++;
          metrics.increment("search.records.released");
        }
      }
      if (released > 0) {
        log.warn("Released {} queued records that no worker consumed", released);
      }
      shutdown.close();
      try {
        source.close();
      } catch (IOException ex) {
        log.error("Failed to close record source", ex);
        if (ioFailure == null) {
          ioFailure = ex;
        }
      }
      metrics.observe("search.queue.highWater", queue.highWater());
      MDC.remove("pipeline");
      if (interrupted) {
        Thread.currentThread().interrupt();
      }
    }

    transition(RunPhase.AGGREGATING);
    OptionalLong total = spawnFailure == null ? rendezvous.result() : OptionalLong.empty();
    if (rendezvous.isBroken()) {
      metrics.increment("search.rendezvous.broken");
    }
    Duration elapsed = Duration.ofNanos(System.nanoTime() - startNanos);
    metrics.observe("search.run.elapsedMillis", elapsed.toMillis());

    boolean failed = spawnFailure != null || producerFailure != null || workerFailure.get() != null;
    transition(failed || ioFailure != null ? RunPhase.FAILED : RunPhase.DONE);
    if (ioFailure != null) {
      throw ioFailure;
    }

    RunOutcome outcome;
    if (failed) {
      outcome = RunOutcome.FAILED;
    } else if (shutdown.isRequested()) {
      outcome = RunOutcome.INTERRUPTED;
    } else {
      outcome = RunOutcome.COMPLETED;
    }
    SearchSummary summary = new SearchSummary(outcome, total, slots, produced, released, elapsed);
    log.info(
        "Search {} after {} records in {} ms; total matches {}",
        outcome,
        produced,
        elapsed.toMillis(),
        total.isPresent() ? total.getAsLong() : "unavailable");
    return summary;
  }

  /**
   * Returns the current lifecycle phase.
   *
   * @return phase; {@link RunPhase#INIT} before {@link #run()} starts
   */
  public RunPhase phase() {
    return phase;
  }

  private void produce(BoundedQueue<WorkItem<T>> queue) throws IOException {
    Duration delay = settings.produceDelay();
    while (true) {
      if (shutdown.isRequested()) {
        log.info("Shutdown requested; producer stopping after {} records", produced);
        queue.signalShutdown();
        break;
      }
      Optional<T> next = source.next();
      if (next.isEmpty()) {
        log.debug("Input exhausted after {} records", produced);
        break;
      }
      if (!queue.push(WorkItem.payload(next.get()))) {
        metrics.increment("search.push.rejected");
        log.debug("Push rejected; queue shutting down");
        break;
      }
      produced++;
      metrics.increment("search.records.produced");
      if (!delay.isZero()) {
        pause(delay);
      }
    }
  }

  private void pause(Duration delay) {
    try {
      shutdown.awaitRequested(delay);
    } catch (InterruptedException ex) {
      interrupted = true;
      log.warn("Producer interrupted; requesting shutdown");
      shutdown.requestShutdown();
    }
  }

  private void pushEndOfStream(BoundedQueue<WorkItem<T>> queue, int workerCount) {
    for (int i = 0; i < workerCount; i++) {
      if (!queue.push(WorkItem.endOfStream())) {
        int undelivered = workerCount - i;
        for (int j = 0; j < undelivered; j++) {
          metrics.increment("search.sentinel.undelivered");
        }
        log.debug("{} end-of-stream markers undelivered; those workers exit on shutdown", undelivered);
        return;
      }
    }
  }

  private void joinWorkers(List<Future<?>> futures, Runnable stopAll) {
    for (Future<?> future : futures) {
      while (true) {
        try {
          future.get();
          break;
        } catch (InterruptedException ex) {
          interrupted = true;
          log.warn("Interrupted while joining workers; requesting shutdown");
          stopAll.run();
        } catch (ExecutionException ex) {
          workerFailure.compareAndSet(null, ex.getCause());
          log.error("Search worker terminated abnormally", ex.getCause());
          break;
        }
      }
    }
  }

  private void stopPool(ExecutorService pool) {
    if (pool == null) {
      return;
    }
    pool.shutdown();
    try {
      if (!pool.awaitTermination(POOL_SHUTDOWN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS)) {
        log.warn("Search workers active after {} ms; forcing shutdown", POOL_SHUTDOWN_TIMEOUT.toMillis());
        pool.shutdownNow();
      }
    } catch (InterruptedException ex) {
      interrupted = true;
      pool.shutdownNow();
    }
  }

  private void transition(RunPhase next) {
    RunPhase previous = phase;
    phase = next;
    log.debug("Search phase {} -> {}", previous, next);
  }

  private static long sum(long[] slots) {
    long total = 0;
    for (long slot : slots) {
      total += slot;
    }
    return total;
  }
}
