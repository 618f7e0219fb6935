package ca.gc.cra.calsync.domain.sync;

import java.util.Objects;

/**
 * Tracked event scheduled for deletion.
 *
 * @param tracked event to delete
 * @param reason why it is deleted
 * @since 0.1.0
 */
public record PlannedDelete(TrackedEvent tracked, DeleteReason reason) {
  /**
   * Validates fields.
   */
  public PlannedDelete {
    Objects.requireNonNull(tracked, "tracked");
    Objects.requireNonNull(reason, "reason");
  }
}
