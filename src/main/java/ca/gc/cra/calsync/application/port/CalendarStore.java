package ca.gc.cra.calsync.application.port;

import ca.gc.cra.calsync.domain.calendar.CalendarEvent;
import ca.gc.cra.calsync.domain.calendar.CalendarHandle;
import ca.gc.cra.calsync.domain.calendar.EventFields;
import ca.gc.cra.calsync.domain.calendar.EventRef;
import java.time.Instant;
import java.util.List;
import java.util.Set;

/**
 * <strong>What:</strong> Port onto a calendar backend that the sync engine reads from and writes to.
 * <p><strong>Why:</strong> Keeps reconciliation independent of whichever backend holds the calendars (local
 * file, device calendar service, CalDAV, hosted calendar API).</p>
 * <p><strong>Role:</strong> Driven port implemented by adapters under {@code ca.gc.cra.calsync.infrastructure.store}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Resolve calendars by display name and report the valid names when a lookup fails.</li>
 *   <li>Return events overlapping a window, ordered by start time.</li>
 *   <li>Create, update and delete single events.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Implementations need not be thread-safe; a run calls the store from one thread.</p>
 * <p><strong>Performance:</strong> Calls are synchronous and may block on I/O; the engine applies no timeout.</p>
 *
 * @since 0.1.0
 */
public interface CalendarStore {
  /**
   * Lists the display names of all calendars.
   *
   * @return calendar names
   * @throws CalendarStoreException if the store cannot be read
   */
  Set<String> listCalendars() throws CalendarStoreException;

  /**
   * Resolves a calendar by display name.
   *
   * @param name calendar display name
   * @return handle to the calendar
   * @throws CalendarNotFoundException if no calendar has that name; carries the available names
   * @throws CalendarStoreException if the store cannot be read
   */
  CalendarHandle findCalendar(String name) throws CalendarStoreException;

  /**
   * Returns the events of {@code calendar} overlapping {@code [start, end)}.
   *
   * @param calendar resolved calendar
   * @param start inclusive window start
   * @param end exclusive window end
   * @return events ordered by start time, then end time
   * @throws CalendarStoreException if the store cannot be read
   */
  List<CalendarEvent> queryEvents(CalendarHandle calendar, Instant start, Instant end)
      throws CalendarStoreException;

  /**
   * Creates an event in {@code calendar}.
   *
   * @param calendar destination calendar
   * @param fields field values to write
   * @return reference of the new event
   * @throws CalendarStoreException if the event cannot be written
   */
  EventRef createEvent(CalendarHandle calendar, EventFields fields) throws CalendarStoreException;

  /**
   * Overwrites the fields of an existing event.
   *
   * @param ref event to update
   * @param fields new field values
   * @throws CalendarStoreException if the event is missing or cannot be written
   */
  void updateEvent(EventRef ref, EventFields fields) throws CalendarStoreException;

  /**
   * Deletes an event.
   *
   * @param ref event to delete
   * @throws CalendarStoreException if the event is missing or cannot be removed
   */
  void deleteEvent(EventRef ref) throws CalendarStoreException;

  /**
   * Asks the store to resynchronise its own upstream sources before the next query.
   *
   * <p>Best effort; the default does nothing and a refresh never guarantees fresh data.</p>
   *
   * @throws CalendarStoreException if the refresh attempt fails outright
   */
  default void forceRefresh() throws CalendarStoreException {}
}
