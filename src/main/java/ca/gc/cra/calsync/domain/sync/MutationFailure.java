package ca.gc.cra.calsync.domain.sync;

import java.util.Objects;

/**
 * Diagnostic for one mutation that failed.
 *
 * @param operation failed operation
 * @param identity identity of the affected event
 * @param title title of the affected event
 * @param message failure description
 * @since 0.1.0
 */
public record MutationFailure(MutationOperation operation, String identity, String title, String message) {
  /**
   * Validates fields.
   */
  public MutationFailure {
    Objects.requireNonNull(operation, "operation");
    Objects.requireNonNull(identity, "identity");
    title = title == null ? "" : title;
    message = message == null || message.isBlank() ? "unknown error" : message;
  }
}
