package ca.gc.cra.calsync.application.sync;

import static ca.gc.cra.calsync.application.sync.TestEvents.candidate;
import static ca.gc.cra.calsync.application.sync.TestEvents.source;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.calsync.domain.calendar.Availability;
import ca.gc.cra.calsync.domain.calendar.CalendarEvent;
import ca.gc.cra.calsync.domain.calendar.CalendarHandle;
import ca.gc.cra.calsync.domain.calendar.EventFields;
import ca.gc.cra.calsync.domain.calendar.EventRef;
import ca.gc.cra.calsync.domain.calendar.SourceTag;
import ca.gc.cra.calsync.domain.sync.DeleteReason;
import ca.gc.cra.calsync.domain.sync.MutationFailure;
import ca.gc.cra.calsync.domain.sync.MutationOperation;
import ca.gc.cra.calsync.domain.sync.MutationReport;
import ca.gc.cra.calsync.domain.sync.PlannedDelete;
import ca.gc.cra.calsync.domain.sync.PlannedUpdate;
import ca.gc.cra.calsync.domain.sync.ReconciliationPlan;
import ca.gc.cra.calsync.domain.sync.SyncCandidate;
import ca.gc.cra.calsync.domain.sync.TrackedEvent;
import ca.gc.cra.calsync.infrastructure.store.memory.InMemoryCalendarStore;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class MutationApplierTest {
  private InMemoryCalendarStore store;
  private CalendarHandle mirror;
  private RecordingMetricsPort metrics;

  @BeforeEach
  void setUp() {
    store = new InMemoryCalendarStore();
    mirror = store.addCalendar("Mirror");
    metrics = new RecordingMetricsPort();
  }

  @Test
  void declinedEventsAreWrittenFreeAndOthersBusy() throws Exception {
    MutationApplier applier = new MutationApplier(store, metrics);
    CalendarEvent skipped = source("1", "Vendor pitch", "13:00", "14:00");
    CalendarEvent attending = source("2", "Standup", "09:00", "09:15");

    EventRef free = applier.create(mirror, SyncCandidate.of(skipped, true));
    EventRef busy = applier.create(mirror, SyncCandidate.of(attending, false));

    assertEquals(Availability.FREE, find(free).availability());
    assertEquals(Availability.BUSY, find(busy).availability());
  }

  @Test
  void createWritesTagAheadOfSourceNotes() throws Exception {
    CalendarEvent withNotes = new CalendarEvent(new EventRef("Work", "1"), "Planning",
        TestEvents.at("10:00"), TestEvents.at("11:00"), false, "Room 4", "Agenda:\n- roadmap",
        Availability.BUSY, List.of());
    SyncCandidate planning = candidate(withNotes);

    EventRef ref = new MutationApplier(store, metrics).create(mirror, planning);

    CalendarEvent written = find(ref);
    assertEquals("SOURCE_ID: " + planning.identity() + "\nAgenda:\n- roadmap", written.notes());
    assertEquals("Room 4", written.location());
    assertEquals(Optional.of(planning.identity()), TrackedEvent.from(written).map(TrackedEvent::identity));
  }

  @Test
  void updateKeepsUserAuthoredDestinationNotes() throws Exception {
    CalendarEvent event = source("1", "Review", "10:00", "11:00");
    SyncCandidate declined = SyncCandidate.of(event, true);
    String notes = "my own reminder\n" + SourceTag.line(declined.identity()) + "\ntrailing note";
    EventRef existingRef = store.addEvent("Mirror", new EventFields("Review", event.start(), event.end(), false,
        null, notes, Availability.BUSY));
    TrackedEvent existing = TrackedEvent.from(find(existingRef)).orElseThrow();

    new MutationApplier(store, metrics).update(existing, declined);

    CalendarEvent updated = find(existingRef);
    assertEquals(notes, updated.notes());
    assertEquals(Availability.FREE, updated.availability());
  }

  @Test
  void oneFailureDoesNotStopTheRemainingItems() throws Exception {
    SyncCandidate good = candidate(source("1", "Good", "08:00", "09:00"));
    SyncCandidate bad = candidate(source("2", "Bad", "09:00", "10:00"));
    SyncCandidate later = candidate(source("3", "Later", "10:00", "11:00"));
    TrackedEvent brokenUpdate = seedTracked(candidate(source("4", "Moved", "11:00", "12:00")));
    TrackedEvent orphan = seedTracked(candidate(source("5", "Orphan", "12:00", "13:00")));
    TrackedEvent stuck = seedTracked(candidate(source("6", "Stuck", "13:00", "14:00")));
    SyncCandidate movedNow = SyncCandidate.of(brokenUpdate.event(), true);

    FailingCalendarStore failing = new FailingCalendarStore(store, Set.of("Bad"),
        Set.of(brokenUpdate.event().ref().eventId(), stuck.event().ref().eventId()));
    ReconciliationPlan plan = new ReconciliationPlan(
        List.of(good, bad, later),
        List.of(new PlannedUpdate(brokenUpdate, movedNow)),
        List.of(),
        List.of(new PlannedDelete(orphan, DeleteReason.ORPHANED), new PlannedDelete(stuck, DeleteReason.ORPHANED)),
        0);

    MutationReport report = new MutationApplier(failing, metrics).apply(mirror, plan);

    assertEquals(2, report.created());
    assertEquals(0, report.updated());
    assertEquals(1, report.deleted());
    assertEquals(3, report.failed());
    List<MutationOperation> operations = report.failures().stream().map(MutationFailure::operation).toList();
    assertEquals(List.of(MutationOperation.CREATE, MutationOperation.UPDATE, MutationOperation.DELETE), operations);
    assertEquals("Bad", report.failures().get(0).title());
    assertEquals("backend exploded", report.failures().get(1).message());
    assertEquals(2L, metrics.count("sync.mutation.created"));
    assertEquals(1L, metrics.count("sync.mutation.deleted"));
    assertEquals(3L, metrics.count("sync.mutation.failed"));
    assertTrue(store.events("Mirror").stream().anyMatch(e -> e.title().equals("Later")));
    assertTrue(store.events("Mirror").stream().noneMatch(e -> e.title().equals("Orphan")));
  }

  private TrackedEvent seedTracked(SyncCandidate candidate) throws Exception {
    EventRef ref = store.addEvent("Mirror",
        MutationApplier.fieldsFor(candidate, SourceTag.apply(null, candidate.identity())));
    return TrackedEvent.from(find(ref)).orElseThrow();
  }

  private CalendarEvent find(EventRef ref) {
    return store.events(ref.calendarId()).stream()
        .filter(event -> event.ref().equals(ref))
        .findFirst()
        .orElseThrow();
  }
}
