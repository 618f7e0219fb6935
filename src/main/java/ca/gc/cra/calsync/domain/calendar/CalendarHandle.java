package ca.gc.cra.calsync.domain.calendar;

import ca.gc.cra.calsync.validation.Strings;

/**
 * Resolved calendar returned by {@code CalendarStore#findCalendar(String)}.
 *
 * @param id store identifier of the calendar
 * @param name display name the calendar was looked up by
 * @since 0.1.0
 */
public record CalendarHandle(String id, String name) {
  /**
   * Validates handle fields.
   */
  public CalendarHandle {
    id = Strings.requireNonBlank("id", id);
    name = Strings.requireNonBlank("name", name);
  }
}
