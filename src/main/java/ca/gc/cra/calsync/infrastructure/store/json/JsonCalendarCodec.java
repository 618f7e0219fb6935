package ca.gc.cra.calsync.infrastructure.store.json;

import ca.gc.cra.calsync.domain.calendar.Attendee;
import ca.gc.cra.calsync.domain.calendar.Availability;
import ca.gc.cra.calsync.domain.calendar.CalendarEvent;
import ca.gc.cra.calsync.domain.calendar.EventRef;
import ca.gc.cra.calsync.domain.calendar.ParticipationStatus;
import com.fasterxml.jackson.core.JsonEncoding;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Streaming codec for the calendar document:
 *
 * <pre>{@code
 * {"calendars":[{"name":"Work","events":[{"id":"...","title":"Standup",
 *   "start":"2024-05-01T13:00:00Z","end":"2024-05-01T13:15:00Z","allDay":false,
 *   "location":null,"notes":null,"availability":"BUSY",
 *   "attendees":[{"email":"me@example.com","status":"ACCEPTED","self":true}]}]}]}
 * }</pre>
 *
 * <p>Unknown fields are skipped. Events without an {@code id} get a random one on read.</p>
 *
 * @since 0.1.0
 */
final class JsonCalendarCodec {
  private final JsonFactory factory = new JsonFactory();

  /**
   * Reads a document.
   *
   * @param in UTF-8 JSON input
   * @return events by calendar name in document order
   * @throws IOException if the input is not well-formed JSON
   * @throws IllegalArgumentException if a value is invalid
   */
  Map<String, List<CalendarEvent>> read(InputStream in) throws IOException {
    Objects.requireNonNull(in, "in");
    Map<String, List<CalendarEvent>> calendars = new LinkedHashMap<>();
    try (JsonParser parser = factory.createParser(in)) {
      JsonToken token = parser.nextToken();
      if (token == null) {
        return calendars;
      }
      expect(parser, token, JsonToken.START_OBJECT);
      while (parser.nextToken() == JsonToken.FIELD_NAME) {
        String field = parser.getCurrentName();
        JsonToken value = parser.nextToken();
        if ("calendars".equals(field) && value == JsonToken.START_ARRAY) {
          while (parser.nextToken() == JsonToken.START_OBJECT) {
            readCalendar(parser, calendars);
          }
        } else {
          parser.skipChildren();
        }
      }
    }
    return calendars;
  }

  /**
   * Writes a document.
   *
   * @param out destination stream; left open
   * @param calendars events by calendar name
   * @throws IOException if writing fails
   */
  void write(OutputStream out, Map<String, List<CalendarEvent>> calendars) throws IOException {
    Objects.requireNonNull(out, "out");
    try (JsonGenerator gen = factory.createGenerator(out, JsonEncoding.UTF8)) {
      gen.disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET);
      gen.useDefaultPrettyPrinter();
      gen.writeStartObject();
      gen.writeArrayFieldStart("calendars");
      for (Map.Entry<String, List<CalendarEvent>> calendar : calendars.entrySet()) {
        gen.writeStartObject();
        gen.writeStringField("name", calendar.getKey());
        gen.writeArrayFieldStart("events");
        for (CalendarEvent event : calendar.getValue()) {
          writeEvent(gen, event);
        }
        gen.writeEndArray();
        gen.writeEndObject();
      }
      gen.writeEndArray();
      gen.writeEndObject();
    }
  }

  private void readCalendar(JsonParser parser, Map<String, List<CalendarEvent>> calendars) throws IOException {
    String name = null;
    List<RawEvent> events = new ArrayList<>();
    while (parser.nextToken() == JsonToken.FIELD_NAME) {
      String field = parser.getCurrentName();
      JsonToken value = parser.nextToken();
      switch (field) {
        case "name" -> name = text(parser, value);
        case "events" -> {
          expect(parser, value, JsonToken.START_ARRAY);
          while (parser.nextToken() == JsonToken.START_OBJECT) {
            events.add(readEvent(parser));
          }
        }
        default -> parser.skipChildren();
      }
    }
    if (name == null || name.isBlank()) {
      throw new IllegalArgumentException("calendar without a name");
    }
    String calendarName = name.trim();
    if (calendars.containsKey(calendarName)) {
      throw new IllegalArgumentException("duplicate calendar name '" + calendarName + "'");
    }
    List<CalendarEvent> resolved = new ArrayList<>(events.size());
    for (RawEvent raw : events) {
      resolved.add(raw.toEvent(calendarName));
    }
    calendars.put(calendarName, resolved);
  }

  private RawEvent readEvent(JsonParser parser) throws IOException {
    RawEvent event = new RawEvent();
    while (parser.nextToken() == JsonToken.FIELD_NAME) {
      String field = parser.getCurrentName();
      JsonToken value = parser.nextToken();
      switch (field) {
        case "id" -> event.id = text(parser, value);
        case "title" -> event.title = text(parser, value);
        case "start" -> event.start = instant("start", text(parser, value));
        case "end" -> event.end = instant("end", text(parser, value));
        case "allDay" -> event.allDay = value == JsonToken.VALUE_TRUE;
        case "location" -> event.location = text(parser, value);
        case "notes" -> event.notes = text(parser, value);
        case "availability" -> event.availability = Availability.fromString(text(parser, value));
        case "attendees" -> {
          expect(parser, value, JsonToken.START_ARRAY);
          while (parser.nextToken() == JsonToken.START_OBJECT) {
            event.attendees.add(readAttendee(parser));
          }
        }
        default -> parser.skipChildren();
      }
    }
    return event;
  }

  private Attendee readAttendee(JsonParser parser) throws IOException {
    String email = null;
    ParticipationStatus status = ParticipationStatus.UNKNOWN;
    boolean self = false;
    while (parser.nextToken() == JsonToken.FIELD_NAME) {
      String field = parser.getCurrentName();
      JsonToken value = parser.nextToken();
      switch (field) {
        case "email" -> email = text(parser, value);
        case "status" -> status = ParticipationStatus.fromString(text(parser, value));
        case "self" -> self = value == JsonToken.VALUE_TRUE;
        default -> parser.skipChildren();
      }
    }
    return new Attendee(email, status, self);
  }

  private void writeEvent(JsonGenerator gen, CalendarEvent event) throws IOException {
    gen.writeStartObject();
    gen.writeStringField("id", event.ref().eventId());
    gen.writeStringField("title", event.title());
    gen.writeStringField("start", event.start().toString());
    gen.writeStringField("end", event.end().toString());
    gen.writeBooleanField("allDay", event.allDay());
    if (event.location() != null) {
      gen.writeStringField("location", event.location());
    }
    if (event.notes() != null) {
      gen.writeStringField("notes", event.notes());
    }
    gen.writeStringField("availability", event.availability().name());
    gen.writeArrayFieldStart("attendees");
    for (Attendee attendee : event.attendees()) {
      gen.writeStartObject();
      if (attendee.email() != null) {
        gen.writeStringField("email", attendee.email());
      }
      gen.writeStringField("status", attendee.status().name());
      gen.writeBooleanField("self", attendee.self());
      gen.writeEndObject();
    }
    gen.writeEndArray();
    gen.writeEndObject();
  }

  private static String text(JsonParser parser, JsonToken token) throws IOException {
    if (token == JsonToken.VALUE_NULL) {
      return null;
    }
    if (token == JsonToken.START_OBJECT || token == JsonToken.START_ARRAY) {
      throw new IllegalArgumentException("expected a scalar for '" + parser.getCurrentName() + "'");
    }
    return parser.getText();
  }

  private static Instant instant(String field, String raw) {
    if (raw == null || raw.isBlank()) {
      throw new IllegalArgumentException(field + " must not be empty");
    }
    try {
      return Instant.parse(raw.trim());
    } catch (DateTimeParseException ex) {
      try {
        return OffsetDateTime.parse(raw.trim()).toInstant();
      } catch (DateTimeParseException nested) {
        throw new IllegalArgumentException(field + " is not an ISO-8601 instant: " + raw, nested);
      }
    }
  }

  private static void expect(JsonParser parser, JsonToken actual, JsonToken expected) {
    if (actual != expected) {
      throw new IllegalArgumentException(
          "expected " + expected + " but found " + actual + " at " + parser.getCurrentLocation());
    }
  }

  private static final class RawEvent {
    private String id;
    private String title;
    private Instant start;
    private Instant end;
    private boolean allDay;
    private String location;
    private String notes;
    private Availability availability = Availability.BUSY;
    private final List<Attendee> attendees = new ArrayList<>();

    private CalendarEvent toEvent(String calendarName) {
      if (start == null || end == null) {
        throw new IllegalArgumentException("event '" + title + "' in '" + calendarName + "' needs start and end");
      }
      String eventId = id == null || id.isBlank() ? UUID.randomUUID().toString() : id.trim();
      return new CalendarEvent(new EventRef(calendarName, eventId), title, start, end, allDay,
          location, notes, availability, attendees);
    }
  }
}
