package ca.gc.cra.calsync.api;

/**
 * <strong>What:</strong> Process exit codes of the calsync commands.
 * <p><strong>Why:</strong> Lets the scheduler tell setup failures apart from runs that completed with per-event
 * failures, which still exit with {@link #SUCCESS}.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable.</p>
 *
 * @since 0.1.0
 */
public enum ExitCode {
  /** Run completed, possibly with individual mutation failures. */
  SUCCESS(0),
  /** Command-line arguments were invalid. */
  INVALID_ARGS(2),
  /** The calendar store could not be read or written. */
  IO_ERROR(3),
  /** Configuration was wrong, including an unknown calendar name. */
  CONFIG_ERROR(4),
  /** Unexpected runtime failure occurred. */
  RUNTIME_FAILURE(5);

  private final int code;

  ExitCode(int code) {
    this.code = code;
  }

  /**
   * Returns the numeric value encoded by this exit code.
   *
   * @return numeric exit code
   */
  public int code() {
    return code;
  }
}
