package ca.gc.cra.loganalyzer.infrastructure.exec;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> One-way shutdown flag shared by the interrupt handler, the producer and the
 * orchestrator of a search run.
 * <p><strong>Why:</strong> A signal handler may only flip a flag. Waking threads blocked on the queue
 * needs a lock, so that work is handed to a dedicated bridge thread.</p>
 * <p><strong>Role:</strong> Infrastructure cancellation primitive; listeners typically call
 * {@code BoundedQueue::signalShutdown}.</p>
 * <p><strong>Thread-safety:</strong> {@link #requestShutdown()} and {@link #isRequested()} are lock-free
 * and safe from any context. Listeners run on the bridge thread, at most once.</p>
 * <p><strong>Lifecycle:</strong> Single-use. Once {@link #close()} has run the bridge cannot be started
 * again; create a new controller for each search run.</p>
 * <p><strong>Observability:</strong> Logs the first request at INFO and listener failures at ERROR.</p>
 *
 * @since 0.1.0
 */
public final class ShutdownController implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(ShutdownController.class);
  private static final String BRIDGE_THREAD_NAME = "search-shutdown-bridge";

  private final AtomicBoolean requested = new AtomicBoolean();
  private final CountDownLatch requestedLatch = new CountDownLatch(1);
  private final AtomicBoolean fired = new AtomicBoolean();
  private final AtomicBoolean started = new AtomicBoolean();
  private final List<Runnable> listeners = new CopyOnWriteArrayList<>();
  private volatile boolean closed;
  private volatile Thread bridge;

  /**
   * Requests shutdown. Safe to call from a signal handler: one CAS plus a latch release.
   *
   * @return {@code true} only for the call that moved the flag from unset to set
   */
  public boolean requestShutdown() {
    if (!requested.compareAndSet(false, true)) {
      return false;
    }
    requestedLatch.countDown();
    return true;
  }

  /**
   * Reads the flag without blocking.
   *
   * @return {@code true} once shutdown was requested
   */
  public boolean isRequested() {
    return requested.get();
  }

  /**
   * Waits until shutdown is requested or the timeout elapses.
   *
   * @param timeout maximum wait; zero or negative returns immediately
   * @return {@code true} if shutdown was requested
   * @throws InterruptedException if the calling thread is interrupted while waiting
   */
  public boolean awaitRequested(Duration timeout) throws InterruptedException {
    Objects.requireNonNull(timeout, "timeout");
    if (timeout.isZero() || timeout.isNegative()) {
      return isRequested();
    }
    return requestedLatch.await(timeout.toNanos(), TimeUnit.NANOSECONDS);
  }

  /**
   * Registers an action to run on the bridge thread once shutdown is requested. If the listeners have
   * already fired, the action runs immediately on the calling thread.
   *
   * @param listener action to run; must not be {@code null}
   */
  public void onShutdown(Runnable listener) {
    Objects.requireNonNull(listener, "listener");
    listeners.add(listener);
    if (fired.get() && listeners.remove(listener)) {
      runListener(listener);
    }
  }

  /**
   * Starts the bridge thread. Repeated calls before {@link #close()} are no-ops.
   *
   * @throws IllegalStateException if the controller was already closed
   */
  public void start() {
    if (closed) {
      throw new IllegalStateException("shutdown controller already closed");
    }
    if (!started.compareAndSet(false, true)) {
      return;
    }
    Thread thread = new Thread(this::bridgeLoop, BRIDGE_THREAD_NAME);
    thread.setDaemon(true);
    bridge = thread;
    thread.start();
  }

  /**
   * Indicates whether {@link #close()} has run.
   *
   * @return {@code true} once closed
   */
  public boolean isClosed() {
    return closed;
  }

  /**
   * Stops the bridge without firing listeners if shutdown was never requested. Listeners already
   * running are allowed to finish.
   */
  @Override
  public void close() {
    closed = true;
    Thread thread = bridge;
    if (thread == null || thread == Thread.currentThread()) {
      listeners.clear();
      return;
    }
    thread.interrupt();
    try {
      thread.join(TimeUnit.SECONDS.toMillis(5));
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
    }
    listeners.clear();
  }

  private void bridgeLoop() {
    try {
      requestedLatch.await();
    } catch (InterruptedException ex) {
      if (!isRequested()) {
        log.debug("Shutdown bridge stopped before any shutdown request");
        return;
      }
    }
    log.info("Shutdown requested; waking blocked producer and workers");
    fireListeners();
  }

  private void fireListeners() {
    if (!fired.compareAndSet(false, true)) {
      return;
    }
    for (Runnable listener : listeners) {
      if (listeners.remove(listener)) {
        runListener(listener);
      }
    }
  }

  private static void runListener(Runnable listener) {
    try {
      listener.run();
    } catch (RuntimeException ex) {
      log.error("Shutdown listener failed", ex);
    }
  }
}
