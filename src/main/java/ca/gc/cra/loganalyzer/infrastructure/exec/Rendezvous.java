package ca.gc.cra.loganalyzer.infrastructure.exec;

import java.util.Objects;
import java.util.OptionalLong;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.LongSupplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> One-shot barrier for a fixed number of parties whose last arrival computes an
 * aggregate exactly once.
 * <p><strong>Why:</strong> Every worker publishes its own counter; the total must be summed once, after
 * all of them, and never from a partial set.</p>
 * <p><strong>Role:</strong> Infrastructure synchronization point at the end of a search run.</p>
 * <p><strong>Thread-safety:</strong> Guarded by its own lock, independent of the queue lock. Writes a
 * party makes before {@link #await()} happen-before the aggregator runs, and the aggregate is published
 * to every party before it returns.</p>
 * <p><strong>Observability:</strong> Logs a broken barrier at ERROR.</p>
 *
 * @implNote {@link #abort()} breaks the barrier permanently. Parties arriving afterwards fail immediately
 *     rather than waiting for parties that will never come.
 * @since 0.1.0
 */
public final class Rendezvous {
  private static final Logger log = LoggerFactory.getLogger(Rendezvous.class);

  /**
   * Result of one party's arrival.
   *
   * @param leader {@code true} for the single party that ran the aggregator
   * @param total aggregate; empty when the barrier was broken
   */
  public record Arrival(boolean leader, OptionalLong total) {
    public Arrival {
      Objects.requireNonNull(total, "total");
    }

    /**
     * Indicates whether the barrier failed for this party.
     *
     * @return {@code true} when no aggregate is available
     */
    public boolean broken() {
      return total.isEmpty();
    }
  }

  private final int parties;
  private final LongSupplier aggregator;
  private final ReentrantLock lock = new ReentrantLock();
  private final Condition tripped = lock.newCondition();

  private int arrived;
  private boolean released;
  private boolean broken;
  private OptionalLong result = OptionalLong.empty();

  /**
   * Creates a barrier.
   *
   * @param parties number of parties that must arrive; must be positive
   * @param aggregator computes the total; invoked once by the last party to arrive
   */
  public Rendezvous(int parties, LongSupplier aggregator) {
    if (parties <= 0) {
      throw new IllegalArgumentException("parties must be positive (was " + parties + ")");
    }
    this.parties = parties;
    this.aggregator = Objects.requireNonNull(aggregator, "aggregator");
  }

  /**
   * Arrives at the barrier and waits for the remaining parties.
   *
   * @return this party's arrival, carrying the aggregate unless the barrier broke
   * @throws IllegalStateException if more than {@code parties} arrivals are attempted
   */
  public Arrival await() {
    lock.lock();
    try {
      if (broken) {
        return new Arrival(false, OptionalLong.empty());
      }
      if (arrived == parties) {
        throw new IllegalStateException("rendezvous already used by " + parties + " parties");
      }
      arrived++;
      if (arrived == parties) {
        return lead();
      }
      while (!released && !broken) {
        try {
          tripped.await();
        } catch (InterruptedException ex) {
          Thread.currentThread().interrupt();
          breakBarrier("party interrupted while waiting", ex);
        }
      }
      return new Arrival(false, result);
    } finally {
      lock.unlock();
    }
  }

  /**
   * Breaks the barrier, releasing waiting parties with a failure. Idempotent; no effect once released.
   */
  public void abort() {
    lock.lock();
    try {
      if (!released && !broken) {
        broken = true;
        tripped.signalAll();
        log.warn("Rendezvous aborted with {}/{} parties arrived", arrived, parties);
      }
    } finally {
      lock.unlock();
    }
  }

  /**
   * Returns the published aggregate.
   *
   * @return aggregate once every party arrived; empty before that or when broken
   */
  public OptionalLong result() {
    lock.lock();
    try {
      return result;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Indicates whether the barrier broke.
   *
   * @return {@code true} after {@link #abort()}, an interrupted wait, or a failing aggregator
   */
  public boolean isBroken() {
    lock.lock();
    try {
      return broken;
    } finally {
      lock.unlock();
    }
  }

  // Caller holds the lock and is the last party to arrive.
  private Arrival lead() {
    long total;
    try {
      total = aggregator.getAsLong();
    } catch (RuntimeException ex) {
      breakBarrier("aggregator failed", ex);
      return new Arrival(true, OptionalLong.empty());
    }
    result = OptionalLong.of(total);
    released = true;
    tripped.signalAll();
    return new Arrival(true, result);
  }

  private void breakBarrier(String reason, Exception cause) {
    if (!broken) {
      broken = true;
      result = OptionalLong.empty();
      tripped.signalAll();
      log.error("Rendezvous broken: {}; aggregate unavailable", reason, cause);
    }
  }
}
