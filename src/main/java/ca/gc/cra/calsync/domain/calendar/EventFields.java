package ca.gc.cra.calsync.domain.calendar;

import java.time.Instant;
import java.util.Objects;

/**
 * Field values written to a calendar store on create or update.
 *
 * @param title title to write; {@code null} becomes empty
 * @param start start instant
 * @param end end instant
 * @param allDay all-day flag
 * @param location optional location
 * @param notes notes text including the source tag line
 * @param availability availability to write
 * @since 0.1.0
 */
public record EventFields(
    String title,
    Instant start,
    Instant end,
    boolean allDay,
    String location,
    String notes,
    Availability availability) {

  /**
   * Validates required fields.
   */
  public EventFields {
    title = title == null ? "" : title;
    start = Objects.requireNonNull(start, "start");
    end = Objects.requireNonNull(end, "end");
    if (end.isBefore(start)) {
      throw new IllegalArgumentException("event end " + end + " precedes start " + start);
    }
    availability = Objects.requireNonNull(availability, "availability");
  }
}
