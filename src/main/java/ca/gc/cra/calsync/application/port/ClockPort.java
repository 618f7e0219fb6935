package ca.gc.cra.calsync.application.port;

/**
 * <strong>What:</strong> Port supplying wall-clock time to the sync use case.
 * <p><strong>Why:</strong> The sync window is anchored on "today"; tests inject a fixed clock.</p>
 *
 * @since 0.1.0
 * @see ca.gc.cra.calsync.infrastructure.time.SystemClockAdapter
 */
public interface ClockPort {
  /**
   * Returns the current epoch time in milliseconds.
   *
   * @return milliseconds since 1970-01-01T00:00:00Z
   */
  long nowMillis();
}
