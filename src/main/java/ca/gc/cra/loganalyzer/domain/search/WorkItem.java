package ca.gc.cra.loganalyzer.domain.search;

import java.util.Objects;

/**
 * <strong>What:</strong> Unit of work handed from the producer to exactly one search worker.
 * <p><strong>Why:</strong> Keeps the end-of-stream marker a distinct value so a worker never mistakes
 * "no more input for me" for "the queue is momentarily empty".</p>
 * <p><strong>Role:</strong> Domain value flowing through the bounded hand-off queue.</p>
 * <p><strong>Thread-safety:</strong> Immutable; safe to publish across threads.</p>
 *
 * @param <T> record payload type
 * @since 0.1.0
 */
public final class WorkItem<T> {
  private static final WorkItem<?> END_OF_STREAM = new WorkItem<>(null);

  private final T payload;

  private WorkItem(T payload) {
    this.payload = payload;
  }

  /**
   * Wraps a record for delivery to a worker.
   *
   * @param payload record to search; must not be {@code null}
   * @param <T> record payload type
   * @return work item carrying {@code payload}
   */
  public static <T> WorkItem<T> payload(T payload) {
    return new WorkItem<>(Objects.requireNonNull(payload, "payload"));
  }

  /**
   * Returns the shared end-of-stream marker. One marker is pushed per worker once input ends.
   *
   * @param <T> record payload type expected by the receiving worker
   * @return end-of-stream marker
   */
  @SuppressWarnings("unchecked")
  public static <T> WorkItem<T> endOfStream() {
    return (WorkItem<T>) END_OF_STREAM;
  }

  /**
   * Indicates whether this item is the end-of-stream marker.
   *
   * @return {@code true} for the marker
   */
  public boolean isEndOfStream() {
    return this == END_OF_STREAM;
  }

  /**
   * Returns the carried record.
   *
   * @return record payload
   * @throws IllegalStateException when called on the end-of-stream marker
   */
  public T payload() {
    if (isEndOfStream()) {
      throw new IllegalStateException("end-of-stream marker carries no payload");
    }
    return payload;
  }

  @Override
  public String toString() {
    return isEndOfStream() ? "WorkItem[END_OF_STREAM]" : "WorkItem[" + payload + "]";
  }
}
