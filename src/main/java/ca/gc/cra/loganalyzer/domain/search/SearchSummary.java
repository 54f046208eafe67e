package ca.gc.cra.loganalyzer.domain.search;

import java.time.Duration;
import java.util.Arrays;
import java.util.Objects;
import java.util.OptionalLong;

/**
 * <strong>What:</strong> Immutable result of one search run.
 * <p><strong>Why:</strong> Separates "the aggregate is zero" from "the aggregate could not be computed" so
 * a broken rendezvous never surfaces as a silently wrong total.</p>
 * <p><strong>Role:</strong> Domain value returned by the search use case and rendered by the CLI.</p>
 * <p><strong>Thread-safety:</strong> Immutable; per-worker counts are defensively copied.</p>
 *
 * @param outcome terminal state of the run
 * @param totalMatches aggregate computed by the rendezvous leader; empty when unavailable
 * @param workerMatches per-worker counters indexed by worker id (diagnostics only)
 * @param recordsProduced records successfully handed to the queue
 * @param recordsReleased records still queued at teardown and released unprocessed
 * @param elapsed wall-clock duration of the run
 * @since 0.1.0
 */
public record SearchSummary(
    RunOutcome outcome,
    OptionalLong totalMatches,
    long[] workerMatches,
    long recordsProduced,
    long recordsReleased,
    Duration elapsed) {

  /**
   * Validates and copies the summary components.
   */
  public SearchSummary {
    Objects.requireNonNull(outcome, "outcome");
    totalMatches = Objects.requireNonNullElse(totalMatches, OptionalLong.empty());
    workerMatches = workerMatches == null ? new long[0] : workerMatches.clone();
    if (recordsProduced < 0 || recordsReleased < 0) {
      throw new IllegalArgumentException("record counts must be non-negative");
    }
    elapsed = Objects.requireNonNullElse(elapsed, Duration.ZERO);
  }

  /**
   * Returns a copy of the per-worker counters.
   *
   * @return per-worker match counts indexed by worker id
   */
  @Override
  public long[] workerMatches() {
    return workerMatches.clone();
  }

  /**
   * Indicates whether the aggregate was computed.
   *
   * @return {@code true} when {@link #totalMatches()} holds a value
   */
  public boolean aggregateAvailable() {
    return totalMatches.isPresent();
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    }
    if (!(other instanceof SearchSummary that)) {
      return false;
    }
    return recordsProduced == that.recordsProduced
        && recordsReleased == that.recordsReleased
        && outcome == that.outcome
        && totalMatches.equals(that.totalMatches)
        && Arrays.equals(workerMatches, that.workerMatches)
        && elapsed.equals(that.elapsed);
  }

  @Override
  public int hashCode() {
    int result = Objects.hash(outcome, totalMatches, recordsProduced, recordsReleased, elapsed);
    return 31 * result + Arrays.hashCode(workerMatches);
  }

  @Override
  public String toString() {
    return "SearchSummary[outcome=" + outcome
        + ", totalMatches=" + totalMatches
        + ", workerMatches=" + Arrays.toString(workerMatches)
        + ", recordsProduced=" + recordsProduced
        + ", recordsReleased=" + recordsReleased
        + ", elapsed=" + elapsed + "]";
  }
}
