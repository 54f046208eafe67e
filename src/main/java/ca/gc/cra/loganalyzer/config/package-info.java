/**
 * <strong>Purpose:</strong> Configuration loading and wiring for search runs.
 * <p><strong>Precedence:</strong> CLI {@code key=value} arguments override the YAML file given by
 * {@code config=PATH}, which overrides {@link ca.gc.cra.loganalyzer.config.DefaultsForMode}.
 *
 * @since 0.1.0
 */
package ca.gc.cra.loganalyzer.config;
