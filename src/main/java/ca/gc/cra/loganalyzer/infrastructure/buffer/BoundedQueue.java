package ca.gc.cra.loganalyzer.infrastructure.buffer;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * <strong>What:</strong> Fixed-capacity FIFO ring buffer shared by one producer and N search workers.
 * <p><strong>Why:</strong> Applies backpressure so a fast record source cannot outrun the workers, and
 * gives every blocked party a way out once shutdown is signalled.</p>
 * <p><strong>Role:</strong> Infrastructure hand-off between the producer loop and the worker pool.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Block producers while full and consumers while empty, unless shutdown was signalled.</li>
 *   <li>Wake exactly one opposite-side waiter per successful push or pop.</li>
 *   <li>Wake every waiter on shutdown; shutdown never discards items already queued.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> All state is guarded by a single {@link ReentrantLock} with
 * {@code notFull} and {@code notEmpty} conditions. The lock is never held while calling out.</p>
 * <p><strong>Performance:</strong> O(1) push and pop over a preallocated array; no allocation after
 * construction except in {@link #drain()}.</p>
 * <p><strong>Observability:</strong> Exposes {@link #size()} and {@link #highWater()} snapshots for
 * queue-depth metrics; emits no logs.</p>
 *
 * @param <T> element type; {@code null} elements are rejected
 * @implNote Waits are uninterruptible. Cancellation goes through {@link #signalShutdown()} only, so a stray
 *     thread interrupt can never make a producer drop a record or a worker miss its end-of-stream marker.
 * @since 0.1.0
 */
public final class BoundedQueue<T> {
  private final Object[] slots;
  private final ReentrantLock lock = new ReentrantLock();
  private final Condition notFull = lock.newCondition();
  private final Condition notEmpty = lock.newCondition();

  private int head;
  private int tail;
  private int count;
  private int highWater;
  private boolean shuttingDown;

  /**
   * Creates an empty queue.
   *
   * @param capacity maximum number of queued elements; must be positive
   * @throws IllegalArgumentException if {@code capacity} is not positive
   */
  public BoundedQueue(int capacity) {
    if (capacity <= 0) {
      throw new IllegalArgumentException("capacity must be positive (was " + capacity + ")");
    }
    this.slots = new Object[capacity];
  }

  /**
   * Appends an element, blocking while the queue is full.
   *
   * @param item element to enqueue; must not be {@code null}
   * @return {@code true} when enqueued; {@code false} when shutdown was observed and nothing was enqueued
   * @throws NullPointerException if {@code item} is {@code null}
   */
  public boolean push(T item) {
    Objects.requireNonNull(item, "item");
    lock.lock();
    try {
      while (count == slots.length && !shuttingDown) {
        notFull.awaitUninterruptibly();
      }
      if (shuttingDown) {
        return false;
      }
      slots[tail] = item;
      tail = (tail + 1) % slots.length;
      count++;
      if (count > highWater) {
        highWater = count;
      }
      notEmpty.signal();
      return true;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Removes the oldest element, blocking while the queue is empty.
   *
   * <p>After shutdown, remaining elements are still handed out in order; only an empty queue reports
   * exhaustion.</p>
   *
   * @return the oldest element, or empty when shutdown was signalled and no element remains
   */
  public Optional<T> pop() {
    lock.lock();
    try {
      while (count == 0 && !shuttingDown) {
        notEmpty.awaitUninterruptibly();
      }
      if (count == 0) {
        return Optional.empty();
      }
      T item = take();
      notFull.signal();
      return Optional.of(item);
    } finally {
      lock.unlock();
    }
  }

  /**
   * Marks the queue as shutting down and wakes every blocked producer and consumer. Idempotent.
   */
  public void signalShutdown() {
    lock.lock();
    try {
      shuttingDown = true;
      notFull.signalAll();
      notEmpty.signalAll();
    } finally {
      lock.unlock();
    }
  }

  /**
   * Removes every remaining element in FIFO order without blocking.
   *
   * @return elements still queued; empty list when none remain
   */
  public List<T> drain() {
    lock.lock();
    try {
      List<T> remaining = new ArrayList<>(count);
      while (count > 0) {
        remaining.add(take());
      }
      notFull.signalAll();
      return remaining;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Returns the number of queued elements at the time of the call.
   *
   * @return element count in {@code [0, capacity]}
   */
  public int size() {
    lock.lock();
    try {
      return count;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Returns the largest element count observed since construction.
   *
   * @return high-water mark in {@code [0, capacity]}
   */
  public int highWater() {
    lock.lock();
    try {
      return highWater;
    } finally {
      lock.unlock();
    }
  }

  public int capacity() {
    return slots.length;
  }

  /**
   * Indicates whether {@link #signalShutdown()} has been called.
   *
   * @return {@code true} once shutdown was signalled
   */
  public boolean isShutdown() {
    lock.lock();
    try {
      return shuttingDown;
    } finally {
      lock.unlock();
    }
  }

  // Caller holds the lock and has checked count > 0.
  @SuppressWarnings("unchecked")
  private T take() {
    T item = (T) slots[head];
    slots[head] = null;
    head = (head + 1) % slots.length;
    count--;
    return item;
  }
}
