/**
 * Operating-system interrupt handling for search runs.
 *
 * @since 0.1.0
 */
package ca.gc.cra.loganalyzer.infrastructure.signal;
