/**
 * <strong>Purpose:</strong> The search run: one producer, a fixed pool of {@link
 * ca.gc.cra.loganalyzer.application.pipeline.SearchWorker}s, and the orchestrating {@link
 * ca.gc.cra.loganalyzer.application.pipeline.SearchUseCase}.
 * <p><strong>Concurrency:</strong> The producer runs on the calling thread; workers run on a dedicated
 * pool and meet at a rendezvous before the run returns.
 * <p><strong>Metrics:</strong> Emits {@code search.*} counters through {@code MetricsPort}.
 *
 * @since 0.1.0
 */
package ca.gc.cra.loganalyzer.application.pipeline;
