package ca.gc.cra.loganalyzer.infrastructure.signal;

import ca.gc.cra.loganalyzer.infrastructure.exec.ShutdownController;
import java.io.PrintStream;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sun.misc.Signal;
import sun.misc.SignalHandler;

/**
 * <strong>What:</strong> Routes the terminal interrupt (SIGINT) to a {@link ShutdownController}.
 * <p><strong>Why:</strong> Ctrl-C should stop a search cooperatively and still print the partial total,
 * instead of killing the JVM mid-run.</p>
 * <p><strong>Role:</strong> Infrastructure adapter installed by {@code SearchCli} for the duration of a
 * run.</p>
 * <p><strong>Thread-safety:</strong> The handler only flips the shutdown flag and writes one notice line;
 * it never touches the queue lock. Waking blocked threads is left to the controller's bridge thread.</p>
 * <p><strong>Observability:</strong> Writes {@code SIGINT received, initiating shutdown...} to the notice
 * stream on the first interrupt.</p>
 *
 * @implNote When the platform refuses a SIGINT handler, a JVM shutdown hook is registered instead. The hook
 *     requests shutdown and waits, bounded, for {@link #runFinished()} so the summary can still be printed.
 * @since 0.1.0
 */
public final class InterruptBridge implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(InterruptBridge.class);
  private static final String NOTICE = "\nSIGINT received, initiating shutdown...\n";
  private static final Duration HOOK_WAIT = Duration.ofSeconds(10);

  private final ShutdownController controller;
  private final PrintStream notices;
  private final CountDownLatch finished = new CountDownLatch(1);

  private SignalHandler previous;
  private Thread hook;
  private boolean closed;

  private InterruptBridge(ShutdownController controller, PrintStream notices) {
    this.controller = controller;
    this.notices = notices;
  }

  /**
   * Installs a SIGINT handler, falling back to a shutdown hook where signals are unsupported.
   *
   * @param controller shutdown flag to set on interrupt
   * @param notices stream receiving the one-line interrupt notice; typically {@code System.err}
   * @return installed bridge; close it once the run has finished
   */
  public static InterruptBridge install(ShutdownController controller, PrintStream notices) {
    InterruptBridge bridge =
        new InterruptBridge(
            Objects.requireNonNull(controller, "controller"), Objects.requireNonNull(notices, "notices"));
    try {
      bridge.previous = Signal.handle(new Signal("INT"), signal -> bridge.onInterrupt());
      log.debug("SIGINT handler installed");
    } catch (IllegalArgumentException ex) {
      log.debug("Signal handling not available ({}); using shutdown hook", ex.getMessage());
      bridge.hook = new Thread(bridge::onJvmShutdown, "search-interrupt-hook");
      Runtime.getRuntime().addShutdownHook(bridge.hook);
    }
    return bridge;
  }

  /**
   * Handles one interrupt. Only the first interrupt writes the notice.
   */
  void onInterrupt() {
    if (controller.requestShutdown()) {
      notices.print(NOTICE);
      notices.flush();
    }
  }

  /**
   * Marks the run as finished, releasing a shutdown hook that is waiting for the summary.
   */
  public void runFinished() {
    finished.countDown();
  }

  /**
   * Restores the previous SIGINT handler or removes the shutdown hook.
   */
  @Override
  public void close() {
    if (closed) {
      return;
    }
    closed = true;
    runFinished();
    if (previous != null) {
      try {
        Signal.handle(new Signal("INT"), previous);
      } catch (IllegalArgumentException ex) {
        log.debug("Could not restore previous SIGINT handler: {}", ex.getMessage());
      }
    }
    if (hook != null) {
      try {
        Runtime.getRuntime().removeShutdownHook(hook);
      } catch (IllegalStateException ex) {
        log.debug("JVM already shutting down; hook left in place");
      }
    }
  }

  private void onJvmShutdown() {
    onInterrupt();
    try {
      if (!finished.await(HOOK_WAIT.toMillis(), TimeUnit.MILLISECONDS)) {
        log.warn("Search did not finish within {} ms of JVM shutdown", HOOK_WAIT.toMillis());
      }
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
    }
  }
}
