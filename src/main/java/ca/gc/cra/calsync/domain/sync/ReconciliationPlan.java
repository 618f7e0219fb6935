package ca.gc.cra.calsync.domain.sync;

import java.util.List;

/**
 * <strong>What:</strong> Outcome of reconciling candidates against the destination snapshot.
 * <p><strong>Role:</strong> Handed from the reconciler to the mutation applier, and reported as-is on dry runs.</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * <p>Identities of {@code creates}, {@code updates}, {@code unchanged} and the {@link DeleteReason#ORPHANED}
 * deletes never overlap. {@link DeleteReason#DUPLICATE} deletes share their identity with the tracked event kept in
 * one of the other sets.</p>
 *
 * @param creates candidates with no tracked counterpart
 * @param updates pairs whose fingerprints differ
 * @param unchanged pairs whose fingerprints match
 * @param deletes tracked events to remove
 * @param collisions number of candidates that shared an identity with an earlier candidate
 * @since 0.1.0
 */
public record ReconciliationPlan(
    List<SyncCandidate> creates,
    List<PlannedUpdate> updates,
    List<PlannedUpdate> unchanged,
    List<PlannedDelete> deletes,
    int collisions) {

  /**
   * Defensively copies the sets.
   */
  public ReconciliationPlan {
    creates = List.copyOf(creates);
    updates = List.copyOf(updates);
    unchanged = List.copyOf(unchanged);
    deletes = List.copyOf(deletes);
  }

  /**
   * Plan that changes nothing.
   *
   * @return empty plan
   */
  public static ReconciliationPlan empty() {
    return new ReconciliationPlan(List.of(), List.of(), List.of(), List.of(), 0);
  }

  /**
   * Whether applying the plan would mutate the destination.
   *
   * @return {@code true} when any create, update or delete is planned
   */
  public boolean hasMutations() {
    return !creates.isEmpty() || !updates.isEmpty() || !deletes.isEmpty();
  }
}
