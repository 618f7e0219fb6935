package ca.gc.cra.calsync.domain.sync;

import java.util.Objects;

/**
 * Pairing of a tracked destination event with the candidate sharing its identity.
 *
 * @param existing authoritative tracked event
 * @param candidate source candidate
 * @since 0.1.0
 */
public record PlannedUpdate(TrackedEvent existing, SyncCandidate candidate) {
  /**
   * Validates fields.
   */
  public PlannedUpdate {
    Objects.requireNonNull(existing, "existing");
    Objects.requireNonNull(candidate, "candidate");
  }

  /**
   * Identity shared by both sides.
   *
   * @return identity
   */
  public String identity() {
    return candidate.identity();
  }
}
