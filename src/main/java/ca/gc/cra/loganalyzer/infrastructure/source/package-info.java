/**
 * Record source adapters.
 *
 * @since 0.1.0
 */
package ca.gc.cra.loganalyzer.infrastructure.source;
