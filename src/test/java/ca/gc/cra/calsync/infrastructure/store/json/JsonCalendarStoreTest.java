package ca.gc.cra.calsync.infrastructure.store.json;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.calsync.application.port.CalendarNotFoundException;
import ca.gc.cra.calsync.application.port.CalendarStoreException;
import ca.gc.cra.calsync.domain.calendar.Availability;
import ca.gc.cra.calsync.domain.calendar.CalendarEvent;
import ca.gc.cra.calsync.domain.calendar.CalendarHandle;
import ca.gc.cra.calsync.domain.calendar.EventFields;
import ca.gc.cra.calsync.domain.calendar.EventRef;
import ca.gc.cra.calsync.domain.calendar.ParticipationStatus;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class JsonCalendarStoreTest {
  private static final String DOCUMENT = """
      {
        "version": 1,
        "calendars": [
          {"name": "Work", "color": "blue", "events": [
            {"id": "w2", "title": "Review", "start": "2024-05-01T15:00:00Z", "end": "2024-05-01T16:00:00Z"},
            {"id": "w1", "title": "Standup", "start": "2024-05-01T09:00:00-04:00",
             "end": "2024-05-01T09:15:00-04:00", "location": "Room 4", "notes": "daily",
             "attendees": [{"email": "me@example.com", "status": "declined", "self": true}]}
          ]},
          {"name": "Mirror", "events": []}
        ]
      }
      """;

  @TempDir Path tempDir;

  @Test
  void missingFileHasNoCalendars() throws Exception {
    JsonCalendarStore store = new JsonCalendarStore(tempDir.resolve("absent.json"));

    assertTrue(store.listCalendars().isEmpty());
    assertThrows(CalendarNotFoundException.class, () -> store.findCalendar("Work"));
  }

  @Test
  void readsEventsAndAttendees() throws Exception {
    JsonCalendarStore store = new JsonCalendarStore(write(DOCUMENT));
    CalendarHandle work = store.findCalendar("Work");

    List<CalendarEvent> events = store.queryEvents(work,
        Instant.parse("2024-05-01T00:00:00Z"), Instant.parse("2024-05-02T00:00:00Z"));

    assertEquals(Set.of("Work", "Mirror"), store.listCalendars());
    assertEquals(List.of("Standup", "Review"), events.stream().map(CalendarEvent::title).toList());
    CalendarEvent standup = events.get(0);
    assertEquals(Instant.parse("2024-05-01T13:00:00Z"), standup.start());
    assertEquals("Room 4", standup.location());
    assertEquals(Availability.BUSY, standup.availability());
    assertEquals(ParticipationStatus.DECLINED, standup.attendees().get(0).status());
    assertTrue(standup.attendees().get(0).self());
  }

  @Test
  void writesArePersistedAndVisibleToANewStore() throws Exception {
    Path file = write(DOCUMENT);
    JsonCalendarStore store = new JsonCalendarStore(file);
    CalendarHandle mirror = store.findCalendar("Mirror");
    EventFields fields = new EventFields("Standup", Instant.parse("2024-05-01T13:00:00Z"),
        Instant.parse("2024-05-01T13:15:00Z"), false, null, "SOURCE_ID: " + "ab".repeat(32), Availability.FREE);

    EventRef ref = store.createEvent(mirror, fields);
    store.deleteEvent(new EventRef("Work", "w2"));

    JsonCalendarStore reopened = new JsonCalendarStore(file);
    List<CalendarEvent> mirrored = reopened.queryEvents(reopened.findCalendar("Mirror"),
        Instant.parse("2024-05-01T00:00:00Z"), Instant.parse("2024-05-02T00:00:00Z"));
    assertEquals(1, mirrored.size());
    assertEquals(ref, mirrored.get(0).ref());
    assertEquals(Availability.FREE, mirrored.get(0).availability());
    assertEquals(fields.notes(), mirrored.get(0).notes());
    List<CalendarEvent> work = reopened.queryEvents(reopened.findCalendar("Work"),
        Instant.parse("2024-05-01T00:00:00Z"), Instant.parse("2024-05-02T00:00:00Z"));
    assertEquals(List.of("w1"), work.stream().map(event -> event.ref().eventId()).toList());
    try (var entries = Files.list(tempDir)) {
      assertEquals(1L, entries.count(), "temporary files must not be left behind");
    }
  }

  @Test
  void forceRefreshPicksUpExternalEdits() throws Exception {
    Path file = write(DOCUMENT);
    JsonCalendarStore store = new JsonCalendarStore(file);
    assertEquals(Set.of("Work", "Mirror"), store.listCalendars());

    Files.writeString(file, "{\"calendars\":[{\"name\":\"Home\",\"events\":[]}]}", StandardCharsets.UTF_8);
    assertFalse(store.listCalendars().contains("Home"));

    store.forceRefresh();
    assertEquals(Set.of("Home"), store.listCalendars());
  }

  @Test
  void malformedDocumentsSurfaceAsStoreErrors() throws Exception {
    JsonCalendarStore broken = new JsonCalendarStore(write("{\"calendars\": [ {\"name\": "));
    JsonCalendarStore invalid = new JsonCalendarStore(write(
        "{\"calendars\":[{\"name\":\"Work\",\"events\":[{\"title\":\"x\",\"start\":\"tomorrow\",\"end\":\"later\"}]}]}"));

    assertThrows(CalendarStoreException.class, broken::listCalendars);
    CalendarStoreException ex = assertThrows(CalendarStoreException.class, invalid::listCalendars);
    assertTrue(ex.getMessage().contains("Invalid calendar store"));
  }

  @Test
  void duplicateCalendarNamesAreRejected() throws Exception {
    JsonCalendarStore store = new JsonCalendarStore(write(
        "{\"calendars\":[{\"name\":\"Work\"},{\"name\":\"Work\"}]}"));

    assertThrows(CalendarStoreException.class, store::listCalendars);
  }

  private Path write(String json) throws Exception {
    Path file = tempDir.resolve("calendars.json");
    Files.writeString(file, json, StandardCharsets.UTF_8);
    return file;
  }
}
