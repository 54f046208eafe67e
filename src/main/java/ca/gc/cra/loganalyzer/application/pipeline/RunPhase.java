package ca.gc.cra.loganalyzer.application.pipeline;

/**
 * Lifecycle of a single search run.
 *
 * <p>Normal order is {@code INIT -> RUNNING -> DRAINING -> TERMINATING -> AGGREGATING -> DONE}.
 * {@code FAILED} replaces {@code DONE} when the pool could not start or the producer failed.</p>
 *
 * @since 0.1.0
 */
public enum RunPhase {
  /** Queue, slots and rendezvous allocated; workers not yet started. */
  INIT,
  /** Workers started; the producer is pushing records. */
  RUNNING,
  /** Input ended; end-of-stream markers are being pushed. */
  DRAINING,
  /** Waiting for every worker to exit. */
  TERMINATING,
  /** Reading the aggregate published by the rendezvous. */
  AGGREGATING,
  /** Run finished and resources released. */
  DONE,
  /** Run finished after a setup or producer failure. */
  FAILED
}
