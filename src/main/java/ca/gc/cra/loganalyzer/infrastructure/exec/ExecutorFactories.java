package ca.gc.cra.loganalyzer.infrastructure.exec;

import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Factory helpers for the fixed worker pools used by search runs.
 */
public final class ExecutorFactories {

  private ExecutorFactories() {}

  /**
   * Builds a fixed-size pool of named, non-daemon worker threads.
   *
   * @param size number of worker threads to allocate
   * @param prefix thread-name prefix used to tag worker threads
   * @return configured executor service
   */
  public static ExecutorService newWorkerPool(int size, String prefix) {
    return newWorkerPool(size, namedThreads(prefix));
  }

  /**
   * Builds a fixed-size pool over a caller-supplied thread factory. Tasks are handed off directly; a
   * task that cannot get a thread of its own is rejected with
   * {@link java.util.concurrent.RejectedExecutionException}.
   *
   * @param size number of worker threads to allocate
   * @param factory creates worker threads; may return {@code null} to refuse a thread
   * @return configured executor service
   */
  public static ExecutorService newWorkerPool(int size, ThreadFactory factory) {
    if (size <= 0) {
      throw new IllegalArgumentException("size must be positive");
    }
    Objects.requireNonNull(factory, "factory");
    return new ThreadPoolExecutor(
        size,
        size,
        0L,
        TimeUnit.MILLISECONDS,
        new SynchronousQueue<>(),
        factory,
        new ThreadPoolExecutor.AbortPolicy());
  }

  /**
   * Creates a factory producing {@code prefix-0}, {@code prefix-1}, ... non-daemon threads. Task
   * failures reach the submitter through its {@link java.util.concurrent.Future}.
   *
   * @param prefix thread-name prefix; defaults to {@code search-worker} when blank
   * @return thread factory
   */
  public static ThreadFactory namedThreads(String prefix) {
    String threadPrefix = (prefix == null || prefix.isBlank()) ? "search-worker" : prefix;
    AtomicInteger index = new AtomicInteger();
    return runnable -> {
      Thread thread = new Thread(runnable);
      thread.setName(threadPrefix + "-" + index.getAndIncrement());
      thread.setDaemon(false);
      return thread;
    };
  }
}
