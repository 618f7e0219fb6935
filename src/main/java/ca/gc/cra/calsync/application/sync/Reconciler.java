package ca.gc.cra.calsync.application.sync;

import ca.gc.cra.calsync.domain.calendar.CalendarEvent;
import ca.gc.cra.calsync.domain.sync.DeleteReason;
import ca.gc.cra.calsync.domain.sync.PlannedDelete;
import ca.gc.cra.calsync.domain.sync.PlannedUpdate;
import ca.gc.cra.calsync.domain.sync.ReconciliationPlan;
import ca.gc.cra.calsync.domain.sync.SyncCandidate;
import ca.gc.cra.calsync.domain.sync.TrackedEvent;
import ca.gc.cra.calsync.logging.Logs;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Computes the create/update/unchanged/delete partition of a sync run.
 * <p><strong>Why:</strong> The destination snapshot is the only state carried between runs, so every decision is
 * derived from tags found in it.</p>
 * <p><strong>Role:</strong> Pure application service between identity derivation and mutation.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Index tracked destination events by identity; the first one scanned is authoritative.</li>
 *   <li>Send later duplicates of an identity to the delete set.</li>
 *   <li>Leave untagged destination events alone.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless.</p>
 *
 * @since 0.1.0
 */
public final class Reconciler {
  private static final Logger log = LoggerFactory.getLogger(Reconciler.class);

  /**
   * Reconciles {@code candidates} against {@code destinationEvents}.
   *
   * @param candidates sync candidates in source order
   * @param destinationEvents destination events in scan order; untagged ones are ignored
   * @param forceRecreate delete every tracked event and create every candidate
   * @return reconciliation plan
   */
  public ReconciliationPlan reconcile(
      List<SyncCandidate> candidates, List<CalendarEvent> destinationEvents, boolean forceRecreate) {
    Map<String, SyncCandidate> byIdentity = new LinkedHashMap<>();
    int collisions = 0;
    for (SyncCandidate candidate : candidates) {
      SyncCandidate previous = byIdentity.put(candidate.identity(), candidate);
      if (previous != null) {
        collisions++;
        log.warn("Identity collision for '{}' at {}; later event wins",
            Logs.truncate(candidate.event().title()), candidate.event().start());
      }
    }

    Map<String, TrackedEvent> tracked = new LinkedHashMap<>();
    List<PlannedDelete> deletes = new ArrayList<>();
    for (CalendarEvent event : destinationEvents) {
      Optional<TrackedEvent> maybeTracked = TrackedEvent.from(event);
      if (maybeTracked.isEmpty()) {
        continue;
      }
      TrackedEvent current = maybeTracked.get();
      if (forceRecreate) {
        deletes.add(new PlannedDelete(current, DeleteReason.RECREATE));
      } else if (tracked.containsKey(current.identity())) {
        log.info("Duplicate tracked event {} for identity {}", current.event().ref().eventId(), current.identity());
        deletes.add(new PlannedDelete(current, DeleteReason.DUPLICATE));
      } else {
        tracked.put(current.identity(), current);
      }
    }

    List<SyncCandidate> creates = new ArrayList<>();
    List<PlannedUpdate> updates = new ArrayList<>();
    List<PlannedUpdate> unchanged = new ArrayList<>();
    for (SyncCandidate candidate : byIdentity.values()) {
      TrackedEvent existing = tracked.remove(candidate.identity());
      if (existing == null) {
        creates.add(candidate);
      } else if (existing.fingerprint().equals(candidate.fingerprint())) {
        unchanged.add(new PlannedUpdate(existing, candidate));
      } else {
        updates.add(new PlannedUpdate(existing, candidate));
      }
    }
    for (TrackedEvent orphan : tracked.values()) {
      deletes.add(new PlannedDelete(orphan, DeleteReason.ORPHANED));
    }

    log.debug("Reconciled {} candidates: {} create, {} update, {} unchanged, {} delete",
        byIdentity.size(), creates.size(), updates.size(), unchanged.size(), deletes.size());
    return new ReconciliationPlan(creates, updates, unchanged, deletes, collisions);
  }
}
