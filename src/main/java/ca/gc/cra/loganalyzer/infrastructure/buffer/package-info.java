/**
 * Bounded hand-off buffer between the record producer and the search workers.
 *
 * @since 0.1.0
 */
package ca.gc.cra.loganalyzer.infrastructure.buffer;
