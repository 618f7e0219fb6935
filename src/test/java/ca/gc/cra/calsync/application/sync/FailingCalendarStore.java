package ca.gc.cra.calsync.application.sync;

import ca.gc.cra.calsync.application.port.CalendarStore;
import ca.gc.cra.calsync.application.port.CalendarStoreException;
import ca.gc.cra.calsync.domain.calendar.CalendarEvent;
import ca.gc.cra.calsync.domain.calendar.CalendarHandle;
import ca.gc.cra.calsync.domain.calendar.EventFields;
import ca.gc.cra.calsync.domain.calendar.EventRef;
import java.time.Instant;
import java.util.List;
import java.util.Set;

/** Delegating store that rejects writes for chosen titles or event ids. */
final class FailingCalendarStore implements CalendarStore {
  private final CalendarStore delegate;
  private final Set<String> failingTitles;
  private final Set<String> failingEventIds;
  int refreshCalls;

  FailingCalendarStore(CalendarStore delegate, Set<String> failingTitles, Set<String> failingEventIds) {
    this.delegate = delegate;
    this.failingTitles = failingTitles;
    this.failingEventIds = failingEventIds;
  }

  @Override
  public Set<String> listCalendars() throws CalendarStoreException {
    return delegate.listCalendars();
  }

  @Override
  public CalendarHandle findCalendar(String name) throws CalendarStoreException {
    return delegate.findCalendar(name);
  }

  @Override
  public List<CalendarEvent> queryEvents(CalendarHandle calendar, Instant start, Instant end)
      throws CalendarStoreException {
    return delegate.queryEvents(calendar, start, end);
  }

  @Override
  public EventRef createEvent(CalendarHandle calendar, EventFields fields) throws CalendarStoreException {
    if (failingTitles.contains(fields.title())) {
      throw new CalendarStoreException("create rejected for " + fields.title());
    }
    return delegate.createEvent(calendar, fields);
  }

  @Override
  public void updateEvent(EventRef ref, EventFields fields) throws CalendarStoreException {
    if (failingEventIds.contains(ref.eventId())) {
      throw new IllegalStateException("backend exploded");
    }
    delegate.updateEvent(ref, fields);
  }

  @Override
  public void deleteEvent(EventRef ref) throws CalendarStoreException {
    if (failingEventIds.contains(ref.eventId())) {
      throw new CalendarStoreException("delete rejected for " + ref.eventId());
    }
    delegate.deleteEvent(ref);
  }

  @Override
  public void forceRefresh() throws CalendarStoreException {
    refreshCalls++;
    throw new CalendarStoreException("refresh unavailable");
  }
}
