package ca.gc.cra.calsync.domain.calendar;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Immutable snapshot of a calendar entry as read from a calendar store.
 * <p><strong>Why:</strong> Gives the sync engine one store-independent view of source and destination events.</p>
 * <p><strong>Role:</strong> Domain value returned by {@code CalendarStore#queryEvents}; lives for a single run only.</p>
 * <p><strong>Thread-safety:</strong> Immutable; attendee list is defensively copied.</p>
 *
 * @param ref store reference of the event; never {@code null}
 * @param title event title; {@code null} is normalized to the empty string
 * @param start start instant; never {@code null}
 * @param end end instant; never before {@code start}
 * @param allDay whether the event spans whole days
 * @param location optional location text
 * @param notes optional free-text notes
 * @param availability free/busy contribution; {@code null} defaults to {@link Availability#BUSY}
 * @param attendees attendee participation records; {@code null} becomes empty
 * @since 0.1.0
 */
public record CalendarEvent(
    EventRef ref,
    String title,
    Instant start,
    Instant end,
    boolean allDay,
    String location,
    String notes,
    Availability availability,
    List<Attendee> attendees) {

  /**
   * Validates time bounds and normalizes optional fields.
   *
   * @throws IllegalArgumentException if {@code end} precedes {@code start}
   */
  public CalendarEvent {
    ref = Objects.requireNonNull(ref, "ref");
    title = title == null ? "" : title;
    start = Objects.requireNonNull(start, "start");
    end = Objects.requireNonNull(end, "end");
    if (end.isBefore(start)) {
      throw new IllegalArgumentException("event end " + end + " precedes start " + start);
    }
    availability = Objects.requireNonNullElse(availability, Availability.BUSY);
    attendees = attendees == null ? List.of() : List.copyOf(attendees);
  }

  /**
   * Returns the location when set.
   *
   * @return optional location
   */
  public Optional<String> locationText() {
    return Optional.ofNullable(location).filter(value -> !value.isBlank());
  }

  /**
   * Returns the notes when set.
   *
   * @return optional notes
   */
  public Optional<String> notesText() {
    return Optional.ofNullable(notes).filter(value -> !value.isEmpty());
  }
}
