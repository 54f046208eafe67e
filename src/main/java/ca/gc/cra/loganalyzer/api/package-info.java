/**
 * <strong>Purpose:</strong> Command-line entry points: the dispatcher, the search command, argument
 * parsing, telemetry wiring, and exit codes.
 * <p><strong>Pipeline role:</strong> Outermost layer; turns arguments into a {@code SearchConfig} and
 * prints the {@code SearchSummary}.
 * <p><strong>Concurrency:</strong> Entry points run on the main thread; SIGINT handling is delegated to
 * {@code InterruptBridge}.
 * <p><strong>Logging:</strong> Results go to stdout via {@link ca.gc.cra.loganalyzer.api.CliPrinter};
 * diagnostics go through SLF4J.
 *
 * @since 0.1.0
 */
package ca.gc.cra.loganalyzer.api;
