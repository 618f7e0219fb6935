package ca.gc.cra.calsync.application.sync;

import ca.gc.cra.calsync.application.port.CalendarStore;
import ca.gc.cra.calsync.application.port.CalendarStoreException;
import ca.gc.cra.calsync.domain.calendar.CalendarEvent;
import ca.gc.cra.calsync.domain.calendar.CalendarHandle;
import ca.gc.cra.calsync.domain.sync.SyncWindow;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Read-only access to the source calendar.
 *
 * @since 0.1.0
 */
public final class EventSource {
  private static final Logger log = LoggerFactory.getLogger(EventSource.class);
  static final Comparator<CalendarEvent> START_ORDER = Comparator
      .comparing(CalendarEvent::start)
      .thenComparing(CalendarEvent::end)
      .thenComparing(CalendarEvent::title);

  private final CalendarStore store;

  /**
   * Creates a source over {@code store}.
   *
   * @param store calendar store holding the source calendar
   */
  public EventSource(CalendarStore store) {
    this.store = Objects.requireNonNull(store, "store");
  }

  /**
   * Lists the calendars of the underlying store.
   *
   * @return calendar names
   * @throws CalendarStoreException if the store cannot be read
   */
  public Set<String> listCalendars() throws CalendarStoreException {
    return store.listCalendars();
  }

  /**
   * Asks the store to refresh its upstream sources. A failed refresh is logged and otherwise ignored.
   */
  public void forceRefresh() {
    try {
      log.info("Forcing calendar store refresh");
      store.forceRefresh();
    } catch (CalendarStoreException ex) {
      log.warn("Calendar store refresh failed; continuing with current data: {}", ex.getMessage(), ex);
    }
  }

  /**
   * Queries the events of {@code calendarName} overlapping {@code window}.
   *
   * @param calendarName source calendar display name
   * @param window query window
   * @return events ordered by start time, then end time and title
   * @throws ca.gc.cra.calsync.application.port.CalendarNotFoundException if the calendar does not exist
   * @throws CalendarStoreException if the store cannot be read
   */
  public List<CalendarEvent> queryEvents(String calendarName, SyncWindow window) throws CalendarStoreException {
    Objects.requireNonNull(window, "window");
    CalendarHandle calendar = store.findCalendar(calendarName);
    List<CalendarEvent> events = new ArrayList<>(store.queryEvents(calendar, window.start(), window.end()));
    // List.sort is stable, so events the store returned in a meaningful order keep it on ties.
    events.sort(START_ORDER);
    log.debug("Fetched {} events from '{}' between {} and {}",
        events.size(), calendar.name(), window.start(), window.end());
    return List.copyOf(events);
  }
}
