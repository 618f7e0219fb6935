package ca.gc.cra.calsync.application.port;

/**
 * Raised when a calendar store cannot complete an operation.
 *
 * @since 0.1.0
 */
public class CalendarStoreException extends Exception {
  private static final long serialVersionUID = 1L;

  /**
   * Creates an exception with a message.
   *
   * @param message description of the failure
   */
  public CalendarStoreException(String message) {
    super(message);
  }

  /**
   * Creates an exception with a message and cause.
   *
   * @param message description of the failure
   * @param cause underlying failure
   */
  public CalendarStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
