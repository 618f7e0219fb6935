package ca.gc.cra.calsync.application.sync;

import ca.gc.cra.calsync.application.port.CalendarStore;
import ca.gc.cra.calsync.application.port.CalendarStoreException;
import ca.gc.cra.calsync.application.port.MetricsPort;
import ca.gc.cra.calsync.domain.calendar.CalendarEvent;
import ca.gc.cra.calsync.domain.calendar.CalendarHandle;
import ca.gc.cra.calsync.domain.calendar.EventFields;
import ca.gc.cra.calsync.domain.calendar.EventRef;
import ca.gc.cra.calsync.domain.calendar.SourceTag;
import ca.gc.cra.calsync.domain.sync.MutationFailure;
import ca.gc.cra.calsync.domain.sync.MutationOperation;
import ca.gc.cra.calsync.domain.sync.MutationReport;
import ca.gc.cra.calsync.domain.sync.PlannedDelete;
import ca.gc.cra.calsync.domain.sync.PlannedUpdate;
import ca.gc.cra.calsync.domain.sync.ReconciliationPlan;
import ca.gc.cra.calsync.domain.sync.SyncCandidate;
import ca.gc.cra.calsync.domain.sync.TrackedEvent;
import ca.gc.cra.calsync.logging.Logs;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Writes a reconciliation plan to the destination calendar.
 * <p><strong>Why:</strong> One broken event must not keep the rest of the calendar out of step.</p>
 * <p><strong>Role:</strong> Last stage of a sync run; the only component that mutates the destination.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Write the {@code SOURCE_ID} tag line on every create and update.</li>
 *   <li>Keep user-authored destination notes outside the tag line on update.</li>
 *   <li>Record each failed item and carry on with the next one.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Not thread-safe; one applier per run.</p>
 * <p><strong>Observability:</strong> Increments {@code sync.mutation.*} counters per item.</p>
 *
 * @since 0.1.0
 */
public final class MutationApplier {
  private static final Logger log = LoggerFactory.getLogger(MutationApplier.class);

  private final CalendarStore store;
  private final MetricsPort metrics;

  /**
   * Creates an applier.
   *
   * @param store destination store
   * @param metrics metrics sink
   */
  public MutationApplier(CalendarStore store, MetricsPort metrics) {
    this.store = Objects.requireNonNull(store, "store");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Creates the destination copy of {@code candidate}.
   *
   * @param calendar destination calendar
   * @param candidate candidate to copy
   * @return reference of the new event
   * @throws CalendarStoreException if the store rejects the write
   */
  public EventRef create(CalendarHandle calendar, SyncCandidate candidate) throws CalendarStoreException {
    String notes = SourceTag.apply(candidate.event().notes(), candidate.identity());
    return store.createEvent(calendar, fieldsFor(candidate, notes));
  }

  /**
   * Overwrites a tracked event with the current candidate fields.
   *
   * @param existing tracked destination event
   * @param candidate candidate carrying the new values
   * @throws CalendarStoreException if the store rejects the write
   */
  public void update(TrackedEvent existing, SyncCandidate candidate) throws CalendarStoreException {
    String notes = SourceTag.apply(existing.event().notes(), candidate.identity());
    store.updateEvent(existing.event().ref(), fieldsFor(candidate, notes));
  }

  /**
   * Deletes a tracked event.
   *
   * @param tracked tracked destination event
   * @throws CalendarStoreException if the store rejects the delete
   */
  public void delete(TrackedEvent tracked) throws CalendarStoreException {
    store.deleteEvent(tracked.event().ref());
  }

  /**
   * Applies {@code plan}: creates, then updates, then deletes.
   *
   * @param calendar destination calendar
   * @param plan reconciliation plan
   * @return counts and per-item failures
   */
  public MutationReport apply(CalendarHandle calendar, ReconciliationPlan plan) {
    Objects.requireNonNull(calendar, "calendar");
    Objects.requireNonNull(plan, "plan");
    List<MutationFailure> failures = new ArrayList<>();
    int created = 0;
    int updated = 0;
    int deleted = 0;

    for (SyncCandidate candidate : plan.creates()) {
      try {
        EventRef ref = create(calendar, candidate);
        created++;
        metrics.increment("sync.mutation.created");
        log.debug("Created '{}' as {}", Logs.truncate(candidate.event().title()), ref.eventId());
      } catch (CalendarStoreException | RuntimeException ex) {
        failures.add(fail(MutationOperation.CREATE, candidate.identity(), candidate.event(), ex));
      }
    }
    for (PlannedUpdate pair : plan.updates()) {
      try {
        update(pair.existing(), pair.candidate());
        updated++;
        metrics.increment("sync.mutation.updated");
        log.debug("Updated '{}' ({})", Logs.truncate(pair.candidate().event().title()),
            pair.existing().event().ref().eventId());
      } catch (CalendarStoreException | RuntimeException ex) {
        failures.add(fail(MutationOperation.UPDATE, pair.identity(), pair.candidate().event(), ex));
      }
    }
    for (PlannedDelete planned : plan.deletes()) {
      TrackedEvent tracked = planned.tracked();
      try {
        delete(tracked);
        deleted++;
        metrics.increment("sync.mutation.deleted");
        log.debug("Deleted '{}' ({}, {})", Logs.truncate(tracked.event().title()),
            tracked.event().ref().eventId(), planned.reason());
      } catch (CalendarStoreException | RuntimeException ex) {
        failures.add(fail(MutationOperation.DELETE, tracked.identity(), tracked.event(), ex));
      }
    }
    return new MutationReport(created, updated, deleted, failures);
  }

  /**
   * Builds the field values written for {@code candidate}.
   *
   * @param candidate sync candidate
   * @param notes notes already carrying the tag line
   * @return fields to write
   */
  static EventFields fieldsFor(SyncCandidate candidate, String notes) {
    CalendarEvent source = candidate.event();
    return new EventFields(
        source.title(),
        source.start(),
        source.end(),
        source.allDay(),
        source.location(),
        notes,
        candidate.availability());
  }

  private MutationFailure fail(MutationOperation operation, String identity, CalendarEvent event, Exception ex) {
    metrics.increment("sync.mutation.failed");
    String title = Logs.truncate(event.title());
    log.warn("Failed to {} '{}': {}", operation.name().toLowerCase(Locale.ROOT), title,
        ex.getMessage(), ex);
    String message = ex.getMessage() != null ? ex.getMessage() : ex.getClass().getSimpleName();
    return new MutationFailure(operation, identity, event.title(), message);
  }
}
