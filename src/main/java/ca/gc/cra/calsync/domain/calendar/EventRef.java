package ca.gc.cra.calsync.domain.calendar;

import ca.gc.cra.calsync.validation.Strings;

/**
 * Opaque reference to an event held by a calendar store.
 *
 * @param calendarId identifier of the owning calendar; never blank
 * @param eventId store-assigned event identifier; never blank
 * @since 0.1.0
 */
public record EventRef(String calendarId, String eventId) {
  /**
   * Validates that both identifiers are present.
   */
  public EventRef {
    calendarId = Strings.requireNonBlank("calendarId", calendarId);
    eventId = Strings.requireNonBlank("eventId", eventId);
  }
}
