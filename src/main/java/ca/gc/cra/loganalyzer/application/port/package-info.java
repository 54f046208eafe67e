/**
 * <strong>Purpose:</strong> Ports the search pipeline depends on: record input and metrics.
 * <p><strong>Pipeline role:</strong> Implemented by infrastructure adapters and wired by
 * {@code CompositionRoot}.
 *
 * @since 0.1.0
 */
package ca.gc.cra.loganalyzer.application.port;
