/**
 * <strong>Purpose:</strong> Validation helpers used during CLI parsing and configuration bootstrap.
 * <p><strong>Pipeline role:</strong> Rejects invalid inputs before the search run allocates its queue or
 * starts workers.
 * <p><strong>Observability:</strong> No direct metrics or logging; failures surface via
 * {@link IllegalArgumentException}.
 *
 * @since 0.1.0
 */
package ca.gc.cra.loganalyzer.validation;
