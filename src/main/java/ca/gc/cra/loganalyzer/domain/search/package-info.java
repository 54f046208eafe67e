/**
 * <strong>Purpose:</strong> Domain values for the parallel log search: work items, the match predicate,
 * and the run summary.
 * <p><strong>Pipeline role:</strong> Shared vocabulary between the producer, the workers, and the CLI.
 * <p><strong>Concurrency:</strong> All types are immutable and safe to publish across threads.
 *
 * @since 0.1.0
 */
package ca.gc.cra.loganalyzer.domain.search;
