/**
 * <strong>Purpose:</strong> Execution primitives for search runs: the worker pool factory, the shutdown
 * flag with its bridge thread, and the end-of-run rendezvous.
 * <p><strong>Concurrency:</strong> Every type here is thread-safe; see each class for its guarantees.
 *
 * @since 0.1.0
 */
package ca.gc.cra.loganalyzer.infrastructure.exec;
