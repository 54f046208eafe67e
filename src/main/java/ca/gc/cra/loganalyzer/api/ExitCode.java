package ca.gc.cra.loganalyzer.api;

/**
 * <strong>What:</strong> Canonical exit codes returned by the loganalyzer command line.
 * <p><strong>Why:</strong> Lets scripts tell an interrupted search (partial total) from a failed one.</p>
 * <p><strong>Role:</strong> Returned by {@code Main} and {@code SearchCli}.</p>
 * <p><strong>Observability:</strong> The chosen value is logged at DEBUG by {@code SearchCli}.</p>
 *
 * @since 0.1.0
 */
public enum ExitCode {
  /** Successful execution. */
  SUCCESS(0),
  /** Command-line arguments were invalid. */
  INVALID_ARGS(2),
  /** The input file could not be opened or read. */
  IO_ERROR(3),
  /** Configuration was missing or malformed. */
  CONFIG_ERROR(4),
  /** The run failed: workers could not start, or a worker or the producer crashed. */
  RUNTIME_FAILURE(5),
  /** The search was interrupted (SIGINT); the printed total is partial. */
  INTERRUPTED(130);

  private final int code;

  ExitCode(int code) {
    this.code = code;
  }

  /**
   * Returns the numeric process status.
   *
   * @return numeric exit code
   */
  public int code() {
    return code;
  }
}
