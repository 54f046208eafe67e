package ca.gc.cra.loganalyzer.domain.search;

/**
 * Terminal state of a search run.
 *
 * @since 0.1.0
 */
public enum RunOutcome {
  /** Input was exhausted and every worker drained its share. */
  COMPLETED,
  /** Shutdown was requested before input was exhausted; counts are partial. */
  INTERRUPTED,
  /** The worker pool could not be started or the producer failed; the aggregate may be unavailable. */
  FAILED
}
