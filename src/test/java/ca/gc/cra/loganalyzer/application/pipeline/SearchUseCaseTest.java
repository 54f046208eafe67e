package ca.gc.cra.loganalyzer.application.pipeline;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTimeoutPreemptively;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.loganalyzer.application.port.MetricsPort;
import ca.gc.cra.loganalyzer.domain.search.RunOutcome;
import ca.gc.cra.loganalyzer.domain.search.SearchSummary;
import ca.gc.cra.loganalyzer.domain.search.SubstringMatcher;
import ca.gc.cra.loganalyzer.infrastructure.exec.ShutdownController;
import ca.gc.cra.loganalyzer.support.ListRecordSource;
import ca.gc.cra.loganalyzer.support.RecordingMetricsPort;
import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.OptionalLong;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Predicate;
import org.junit.jupiter.api.Test;

class SearchUseCaseTest {
  private static final Duration RUN_TIMEOUT = Duration.ofSeconds(20);

  @Test
  void countsSingleMatchWithTwoWorkersAndCapacityTwo() throws Exception {
    ListRecordSource<String> source = ListRecordSource.of(List.of("alpha", "beta-match", "gamma"));
    RecordingMetricsPort metrics = new RecordingMetricsPort();
    SearchUseCase<String> useCase = new SearchUseCase<>(
        SearchSettings.of(2, 2), source, SubstringMatcher.of("match"), new ShutdownController(), metrics);

    SearchSummary summary = assertTimeoutPreemptively(RUN_TIMEOUT, useCase::run);

    assertEquals(RunOutcome.COMPLETED, summary.outcome());
    assertEquals(OptionalLong.of(1), summary.totalMatches());
    assertEquals(1, sum(summary.workerMatches()));
    assertEquals(2, summary.workerMatches().length);
    assertEquals(3, summary.recordsProduced());
    assertEquals(0, summary.recordsReleased());
    assertEquals(RunPhase.DONE, useCase.phase());
    assertTrue(source.isClosed());
    assertEquals(3, metrics.count("search.records.produced"));
    assertTrue(metrics.hasObservation("search.queue.highWater"));
    assertTrue(metrics.observed("search.queue.highWater").get(0) <= 2);
    assertEquals(2, metrics.observed("search.worker.matches").size());
  }

  @Test
  void emptyInputCompletesWithZeroTotal() throws Exception {
    SearchUseCase<String> useCase = new SearchUseCase<>(
        SearchSettings.of(3, 1),
        ListRecordSource.of(List.of()),
        SubstringMatcher.of("x"),
        new ShutdownController(),
        MetricsPort.NO_OP);

    SearchSummary summary = assertTimeoutPreemptively(RUN_TIMEOUT, useCase::run);

    assertEquals(RunOutcome.COMPLETED, summary.outcome());
    assertEquals(OptionalLong.of(0), summary.totalMatches());
    assertArrayEquals(new long[3], summary.workerMatches());
  }

  @Test
  void totalsMatchSequentialCountAcrossRandomSizing() throws Exception {
    ThreadLocalRandom rnd = ThreadLocalRandom.current();
    for (int run = 0; run < 15; run++) {
      int lines = 500 + rnd.nextInt(2_000);
      List<String> records = new ArrayList<>(lines);
      long expected = 0;
      for (int i = 0; i < lines; i++) {
        boolean hit = rnd.nextInt(5) == 0;
        records.add("2024-01-01 req=" + i + (hit ? " ERROR timeout" : " INFO ok"));
        if (hit) {
          expected++;
        }
      }
      int workers = 1 + rnd.nextInt(8);
      int capacity = 1 + rnd.nextInt(16);
      SearchUseCase<String> useCase = new SearchUseCase<>(
          SearchSettings.of(workers, capacity),
          ListRecordSource.of(records),
          SubstringMatcher.of("ERROR"),
          new ShutdownController(),
          MetricsPort.NO_OP);

      SearchSummary summary = assertTimeoutPreemptively(RUN_TIMEOUT, useCase::run);

      String tag = "run=" + run + " workers=" + workers + " capacity=" + capacity;
      assertEquals(RunOutcome.COMPLETED, summary.outcome(), tag);
      assertEquals(OptionalLong.of(expected), summary.totalMatches(), tag);
      assertEquals(expected, sum(summary.workerMatches()), tag);
      assertEquals(lines, summary.recordsProduced(), tag);
    }
  }

  @Test
  void shutdownWhileProducerBlockedReportsPartialTotal() throws Exception {
    List<String> records = new ArrayList<>();
    for (int i = 0; i < 100; i++) {
      records.add("line " + i + " match");
    }
    ListRecordSource<String> source = ListRecordSource.of(records);
    CountDownLatch gate = new CountDownLatch(1);
    Predicate<String> gated = line -> {
      try {
        gate.await();
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
        throw new IllegalStateException(ex);
      }
      return line.contains("match");
    };
    ShutdownController shutdown = new ShutdownController();
    SearchUseCase<String> useCase = new SearchUseCase<>(
        SearchSettings.of(1, 2), source, gated, shutdown, MetricsPort.NO_OP);
    AtomicReference<SearchSummary> result = new AtomicReference<>();
    AtomicReference<Throwable> failure = new AtomicReference<>();
    Thread runner = new Thread(() -> {
      try {
        result.set(useCase.run());
      } catch (Throwable ex) {
        failure.set(ex);
      }
    }, "search-runner");
    runner.start();

    // One record held by the worker, two queued, the fourth blocks the producer.
    long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
    while (source.served() < 4 && System.nanoTime() < deadline) {
      Thread.sleep(5);
    }
    assertEquals(4, source.served());
    assertEquals(RunPhase.RUNNING, useCase.phase());

    shutdown.requestShutdown();
    gate.countDown();
    runner.join(RUN_TIMEOUT.toMillis());

    assertFalse(runner.isAlive(), "run should finish after shutdown");
    assertEquals(null, failure.get());
    SearchSummary summary = result.get();
    assertEquals(RunOutcome.INTERRUPTED, summary.outcome());
    assertEquals(3, summary.recordsProduced());
    assertTrue(summary.totalMatches().isPresent());
    assertEquals(
        summary.recordsProduced() - summary.recordsReleased(), summary.totalMatches().getAsLong());
    assertTrue(source.isClosed());
  }

  @Test
  void shutdownRequestedBeforeRunProducesNothing() throws Exception {
    ShutdownController shutdown = new ShutdownController();
    shutdown.requestShutdown();
    ListRecordSource<String> source = ListRecordSource.of(List.of("a match", "b match"));
    SearchUseCase<String> useCase = new SearchUseCase<>(
        SearchSettings.of(2, 4), source, SubstringMatcher.of("match"), shutdown, MetricsPort.NO_OP);

    SearchSummary summary = assertTimeoutPreemptively(RUN_TIMEOUT, useCase::run);

    assertEquals(RunOutcome.INTERRUPTED, summary.outcome());
    assertEquals(0, summary.recordsProduced());
    assertEquals(OptionalLong.of(0), summary.totalMatches());
  }

  @Test
  void shutdownCutsProducerDelayShort() throws Exception {
    ShutdownController shutdown = new ShutdownController();
    ListRecordSource<String> source = ListRecordSource.of(List.of("one", "two", "three"));
    SearchUseCase<String> useCase = new SearchUseCase<>(
        new SearchSettings(1, 4, Duration.ofSeconds(30)),
        source,
        SubstringMatcher.of("o"),
        shutdown,
        MetricsPort.NO_OP);
    Thread requester = new Thread(() -> {
      while (source.served() < 1) {
        Thread.onSpinWait();
      }
      shutdown.requestShutdown();
    }, "shutdown-requester");
    requester.start();

    SearchSummary summary = assertTimeoutPreemptively(Duration.ofSeconds(10), useCase::run);

    requester.join();
    assertEquals(RunOutcome.INTERRUPTED, summary.outcome());
    assertEquals(1, summary.recordsProduced());
  }

  @Test
  void workerSpawnFailureFailsRunWithoutAggregate() throws Exception {
    AtomicInteger created = new AtomicInteger();
    ThreadFactory oneThreadOnly = runnable -> {
      if (created.getAndIncrement() > 0) {
        return null;
      }
      return new Thread(runnable, "only-worker");
    };
    ListRecordSource<String> source = ListRecordSource.of(List.of("match"));
    RecordingMetricsPort metrics = new RecordingMetricsPort();
    SearchUseCase<String> useCase = new SearchUseCase<>(
        SearchSettings.of(3, 2),
        source,
        SubstringMatcher.of("match"),
        new ShutdownController(),
        metrics,
        oneThreadOnly);

    SearchSummary summary = assertTimeoutPreemptively(RUN_TIMEOUT, useCase::run);

    assertEquals(RunOutcome.FAILED, summary.outcome());
    assertFalse(summary.aggregateAvailable());
    assertEquals(0, summary.recordsProduced());
    assertEquals(RunPhase.FAILED, useCase.phase());
    assertEquals(1, metrics.count("search.rendezvous.broken"));
    assertTrue(source.isClosed());
  }

  @Test
  void readFailureIsRethrownAfterTeardown() {
    ListRecordSource<String> source = ListRecordSource.failingAfter(List.of("a", "b", "c"), 2);
    SearchUseCase<String> useCase = new SearchUseCase<>(
        SearchSettings.of(2, 1), source, SubstringMatcher.of("a"), new ShutdownController(), MetricsPort.NO_OP);

    IOException thrown = assertTimeoutPreemptively(
        RUN_TIMEOUT, () -> assertThrows(IOException.class, useCase::run));

    assertTrue(thrown.getMessage().contains("simulated read failure"));
    assertEquals(RunPhase.FAILED, useCase.phase());
    assertTrue(source.isClosed());
  }

  @Test
  void failingPredicateFailsRun() throws Exception {
    List<String> records = new ArrayList<>();
    for (int i = 0; i < 50; i++) {
      records.add(i == 10 ? "poison" : "line " + i);
    }
    Predicate<String> predicate = line -> {
      if (line.equals("poison")) {
        throw new IllegalArgumentException("cannot match poison");
      }
      return true;
    };
    SearchUseCase<String> useCase = new SearchUseCase<>(
        SearchSettings.of(2, 4),
        ListRecordSource.of(records),
        predicate,
        new ShutdownController(),
        MetricsPort.NO_OP);

    SearchSummary summary = assertTimeoutPreemptively(RUN_TIMEOUT, useCase::run);

    assertEquals(RunOutcome.FAILED, summary.outcome());
    assertEquals(RunPhase.FAILED, useCase.phase());
  }

  @Test
  void runIsSingleUse() throws Exception {
    SearchUseCase<String> useCase = new SearchUseCase<>(
        SearchSettings.of(1, 1),
        ListRecordSource.of(List.of("x")),
        SubstringMatcher.of("x"),
        new ShutdownController(),
        MetricsPort.NO_OP);
    assertEquals(RunPhase.INIT, useCase.phase());

    assertTimeoutPreemptively(RUN_TIMEOUT, useCase::run);

    assertThrows(IllegalStateException.class, useCase::run);
  }

  @Test
  void controllerFromFinishedRunIsRejectedBeforeStarting() throws Exception {
    ShutdownController shutdown = new ShutdownController();
    SearchUseCase<String> first = new SearchUseCase<>(
        SearchSettings.of(1, 2),
        ListRecordSource.of(List.of("match")),
        SubstringMatcher.of("match"),
        shutdown,
        MetricsPort.NO_OP);
    assertEquals(RunOutcome.COMPLETED, assertTimeoutPreemptively(RUN_TIMEOUT, first::run).outcome());

    ListRecordSource<String> source = ListRecordSource.of(List.of("a match", "b match", "c match"));
    SearchUseCase<String> second = new SearchUseCase<>(
        SearchSettings.of(1, 2), source, SubstringMatcher.of("match"), shutdown, MetricsPort.NO_OP);

    assertThrows(IllegalStateException.class, second::run);
    assertEquals(0, source.served());
    assertEquals(RunPhase.INIT, second.phase());
  }

  private static long sum(long[] values) {
    long total = 0;
    for (long value : values) {
      total += value;
    }
    return total;
  }
}
