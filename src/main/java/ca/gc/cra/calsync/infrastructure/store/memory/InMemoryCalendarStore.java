package ca.gc.cra.calsync.infrastructure.store.memory;

import ca.gc.cra.calsync.application.port.CalendarNotFoundException;
import ca.gc.cra.calsync.application.port.CalendarStore;
import ca.gc.cra.calsync.application.port.CalendarStoreException;
import ca.gc.cra.calsync.domain.calendar.Attendee;
import ca.gc.cra.calsync.domain.calendar.CalendarEvent;
import ca.gc.cra.calsync.domain.calendar.CalendarHandle;
import ca.gc.cra.calsync.domain.calendar.EventFields;
import ca.gc.cra.calsync.domain.calendar.EventRef;
import ca.gc.cra.calsync.domain.sync.SyncWindow;
import ca.gc.cra.calsync.validation.Strings;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Supplier;

/**
 * <strong>What:</strong> {@link CalendarStore} holding calendars in process memory.
 * <p><strong>Role:</strong> Backing model of the JSON file store and the store used by engine tests.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Keep calendars and events in insertion order; calendars are identified by their display name.</li>
 *   <li>Assign event identifiers through the supplied generator.</li>
 *   <li>Count successful mutations so callers can assert that nothing was written.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Not thread-safe.</p>
 *
 * @since 0.1.0
 */
public final class InMemoryCalendarStore implements CalendarStore {
  private static final Comparator<CalendarEvent> START_ORDER = Comparator
      .comparing(CalendarEvent::start)
      .thenComparing(CalendarEvent::end);

  private final Map<String, Map<String, CalendarEvent>> calendars = new LinkedHashMap<>();
  private final Supplier<String> idGenerator;
  private int mutations;

  /**
   * Creates an empty store with sequential event identifiers.
   */
  public InMemoryCalendarStore() {
    this(new SequentialIds());
  }

  /**
   * Creates an empty store.
   *
   * @param idGenerator source of new event identifiers
   */
  public InMemoryCalendarStore(Supplier<String> idGenerator) {
    this.idGenerator = Objects.requireNonNull(idGenerator, "idGenerator");
  }

  /**
   * Creates a store pre-populated from a snapshot; event identifiers are kept.
   *
   * @param snapshot events by calendar name
   * @param idGenerator source of identifiers for events created later
   * @return populated store
   */
  public static InMemoryCalendarStore fromSnapshot(
      Map<String, List<CalendarEvent>> snapshot, Supplier<String> idGenerator) {
    InMemoryCalendarStore store = new InMemoryCalendarStore(idGenerator);
    snapshot.forEach((name, events) -> {
      Map<String, CalendarEvent> byId = store.calendarFor(name);
      for (CalendarEvent event : events) {
        CalendarEvent stored = withRef(event, new EventRef(name, event.ref().eventId()));
        if (byId.put(stored.ref().eventId(), stored) != null) {
          throw new IllegalArgumentException(
              "duplicate event id '" + stored.ref().eventId() + "' in calendar '" + name + "'");
        }
      }
    });
    return store;
  }

  /**
   * Copies the current contents.
   *
   * @return events by calendar name, in insertion order
   */
  public Map<String, List<CalendarEvent>> snapshot() {
    Map<String, List<CalendarEvent>> copy = new LinkedHashMap<>();
    calendars.forEach((name, events) -> copy.put(name, List.copyOf(events.values())));
    return copy;
  }

  /**
   * Adds an empty calendar, or returns the existing one.
   *
   * @param name display name
   * @return handle of the calendar
   */
  public CalendarHandle addCalendar(String name) {
    String trimmed = Strings.requireNonBlank("name", name).trim();
    calendarFor(trimmed);
    return new CalendarHandle(trimmed, trimmed);
  }

  /**
   * Adds an event without attendees, creating the calendar when missing.
   *
   * @param calendarName calendar display name
   * @param fields event fields
   * @return reference of the stored event
   */
  public EventRef addEvent(String calendarName, EventFields fields) {
    return addEvent(calendarName, fields, List.of());
  }

  /**
   * Adds an event, creating the calendar when missing. Seeding does not count as a mutation.
   *
   * @param calendarName calendar display name
   * @param fields event fields
   * @param attendees attendee records
   * @return reference of the stored event
   */
  public EventRef addEvent(String calendarName, EventFields fields, List<Attendee> attendees) {
    CalendarHandle calendar = addCalendar(calendarName);
    EventRef ref = new EventRef(calendar.id(), idGenerator.get());
    calendars.get(calendar.id()).put(ref.eventId(), toEvent(ref, fields, attendees));
    return ref;
  }

  /**
   * Returns every event of a calendar regardless of time.
   *
   * @param calendarName calendar display name
   * @return events in insertion order; empty for an unknown calendar
   */
  public List<CalendarEvent> events(String calendarName) {
    Map<String, CalendarEvent> events = calendars.get(calendarName);
    return events == null ? List.of() : List.copyOf(events.values());
  }

  /**
   * Number of successful create, update and delete calls since construction.
   *
   * @return mutation count
   */
  public int mutationCount() {
    return mutations;
  }

  @Override
  public Set<String> listCalendars() {
    return new LinkedHashSet<>(calendars.keySet());
  }

  @Override
  public CalendarHandle findCalendar(String name) throws CalendarNotFoundException {
    String key = name == null ? "" : name.trim();
    if (!calendars.containsKey(key)) {
      throw new CalendarNotFoundException(key, calendars.keySet());
    }
    return new CalendarHandle(key, key);
  }

  @Override
  public List<CalendarEvent> queryEvents(CalendarHandle calendar, Instant start, Instant end)
      throws CalendarStoreException {
    SyncWindow window = new SyncWindow(start, end);
    List<CalendarEvent> matches = new ArrayList<>();
    for (CalendarEvent event : existing(calendar).values()) {
      if (window.overlaps(event.start(), event.end())) {
        matches.add(event);
      }
    }
    matches.sort(START_ORDER);
    return matches;
  }

  @Override
  public EventRef createEvent(CalendarHandle calendar, EventFields fields) throws CalendarStoreException {
    Map<String, CalendarEvent> events = existing(calendar);
    EventRef ref = new EventRef(calendar.id(), idGenerator.get());
    events.put(ref.eventId(), toEvent(ref, fields, List.of()));
    mutations++;
    return ref;
  }

  @Override
  public void updateEvent(EventRef ref, EventFields fields) throws CalendarStoreException {
    Map<String, CalendarEvent> events = eventsOf(ref);
    CalendarEvent current = events.get(ref.eventId());
    if (current == null) {
      throw new CalendarStoreException("Event " + ref.eventId() + " not found in '" + ref.calendarId() + "'");
    }
    events.put(ref.eventId(), toEvent(ref, fields, current.attendees()));
    mutations++;
  }

  @Override
  public void deleteEvent(EventRef ref) throws CalendarStoreException {
    if (eventsOf(ref).remove(ref.eventId()) == null) {
      throw new CalendarStoreException("Event " + ref.eventId() + " not found in '" + ref.calendarId() + "'");
    }
    mutations++;
  }

  private Map<String, CalendarEvent> calendarFor(String name) {
    return calendars.computeIfAbsent(name, key -> new LinkedHashMap<>());
  }

  private Map<String, CalendarEvent> existing(CalendarHandle calendar) throws CalendarNotFoundException {
    Objects.requireNonNull(calendar, "calendar");
    Map<String, CalendarEvent> events = calendars.get(calendar.id());
    if (events == null) {
      throw new CalendarNotFoundException(calendar.name(), calendars.keySet());
    }
    return events;
  }

  private Map<String, CalendarEvent> eventsOf(EventRef ref) throws CalendarStoreException {
    Objects.requireNonNull(ref, "ref");
    Map<String, CalendarEvent> events = calendars.get(ref.calendarId());
    if (events == null) {
      throw new CalendarNotFoundException(ref.calendarId(), calendars.keySet());
    }
    return events;
  }

  private static CalendarEvent toEvent(EventRef ref, EventFields fields, List<Attendee> attendees) {
    Objects.requireNonNull(fields, "fields");
    return new CalendarEvent(ref, fields.title(), fields.start(), fields.end(), fields.allDay(),
        fields.location(), fields.notes(), fields.availability(), attendees);
  }

  private static CalendarEvent withRef(CalendarEvent event, EventRef ref) {
    return new CalendarEvent(ref, event.title(), event.start(), event.end(), event.allDay(),
        event.location(), event.notes(), event.availability(), event.attendees());
  }

  /** Identifiers {@code evt-1}, {@code evt-2}, ... */
  private static final class SequentialIds implements Supplier<String> {
    private long next = 1;

    @Override
    public String get() {
      return "evt-" + next++;
    }
  }
}
