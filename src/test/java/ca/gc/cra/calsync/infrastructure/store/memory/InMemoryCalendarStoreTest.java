package ca.gc.cra.calsync.infrastructure.store.memory;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.calsync.application.port.CalendarNotFoundException;
import ca.gc.cra.calsync.application.port.CalendarStoreException;
import ca.gc.cra.calsync.domain.calendar.Attendee;
import ca.gc.cra.calsync.domain.calendar.Availability;
import ca.gc.cra.calsync.domain.calendar.CalendarEvent;
import ca.gc.cra.calsync.domain.calendar.CalendarHandle;
import ca.gc.cra.calsync.domain.calendar.EventFields;
import ca.gc.cra.calsync.domain.calendar.EventRef;
import ca.gc.cra.calsync.domain.calendar.ParticipationStatus;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Test;

class InMemoryCalendarStoreTest {
  private static final Instant NINE = Instant.parse("2024-05-01T09:00:00Z");

  @Test
  void queryReturnsOverlappingEventsOrderedByStart() throws Exception {
    InMemoryCalendarStore store = new InMemoryCalendarStore();
    store.addEvent("Work", fields("Late", 8, 9));
    store.addEvent("Work", fields("Early", 1, 2));
    store.addEvent("Work", fields("Outside", 30, 31));
    CalendarHandle work = store.findCalendar("Work");

    List<CalendarEvent> events = store.queryEvents(work, NINE, NINE.plusSeconds(24 * 3600));

    assertEquals(List.of("Early", "Late"), events.stream().map(CalendarEvent::title).toList());
  }

  @Test
  void unknownCalendarListsAvailableNames() {
    InMemoryCalendarStore store = new InMemoryCalendarStore();
    store.addCalendar("Work");
    store.addCalendar("Home");

    CalendarNotFoundException ex = assertThrows(CalendarNotFoundException.class,
        () -> store.findCalendar("Personal"));

    assertEquals(List.of("Home", "Work"), List.copyOf(ex.availableNames()));
    assertTrue(ex.getMessage().contains("Personal"));
  }

  @Test
  void mutationsAreCountedButSeedingIsNot() throws Exception {
    InMemoryCalendarStore store = new InMemoryCalendarStore();
    EventRef seeded = store.addEvent("Mirror", fields("Seed", 0, 1));
    CalendarHandle mirror = store.findCalendar("Mirror");

    EventRef created = store.createEvent(mirror, fields("New", 2, 3));
    store.updateEvent(seeded, fields("Seed v2", 0, 1));
    store.deleteEvent(created);

    assertEquals(3, store.mutationCount());
    assertEquals(List.of("Seed v2"), store.events("Mirror").stream().map(CalendarEvent::title).toList());
  }

  @Test
  void updateKeepsAttendees() throws Exception {
    InMemoryCalendarStore store = new InMemoryCalendarStore();
    Attendee me = new Attendee("me@example.com", ParticipationStatus.ACCEPTED, true);
    EventRef ref = store.addEvent("Work", fields("Review", 0, 1), List.of(me));

    store.updateEvent(ref, fields("Review", 1, 2));

    assertEquals(List.of(me), store.events("Work").get(0).attendees());
  }

  @Test
  void writingMissingEventFails() {
    InMemoryCalendarStore store = new InMemoryCalendarStore();
    store.addCalendar("Mirror");
    EventRef missing = new EventRef("Mirror", "nope");

    assertThrows(CalendarStoreException.class, () -> store.updateEvent(missing, fields("x", 0, 1)));
    assertThrows(CalendarStoreException.class, () -> store.deleteEvent(missing));
  }

  @Test
  void snapshotRoundTripRejectsDuplicateIds() {
    CalendarEvent event = new CalendarEvent(new EventRef("Work", "dup"), "A", NINE, NINE, false, null, null,
        Availability.BUSY, List.of());

    assertThrows(IllegalArgumentException.class,
        () -> InMemoryCalendarStore.fromSnapshot(Map.of("Work", List.of(event, event)), () -> "id"));
  }

  @Test
  void snapshotPreservesCalendarsAndIds() {
    InMemoryCalendarStore store = new InMemoryCalendarStore();
    store.addCalendar("Empty");
    EventRef ref = store.addEvent("Work", fields("A", 0, 1));

    InMemoryCalendarStore copy = InMemoryCalendarStore.fromSnapshot(store.snapshot(), () -> "unused");

    assertEquals(Set.of("Empty", "Work"), copy.listCalendars());
    assertEquals(ref, copy.events("Work").get(0).ref());
  }

  private static EventFields fields(String title, int fromHour, int toHour) {
    return new EventFields(title, NINE.plusSeconds(fromHour * 3600L), NINE.plusSeconds(toHour * 3600L), false,
        null, null, Availability.BUSY);
  }
}
