package ca.gc.cra.calsync.domain.sync;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.Objects;

/**
 * Half-open time range {@code [start, end)} queried from both calendars during one run.
 *
 * @param start inclusive lower bound
 * @param end exclusive upper bound; after {@code start}
 * @since 0.1.0
 */
public record SyncWindow(Instant start, Instant end) {
  /**
   * Validates the bounds.
   */
  public SyncWindow {
    Objects.requireNonNull(start, "start");
    Objects.requireNonNull(end, "end");
    if (!end.isAfter(start)) {
      throw new IllegalArgumentException("window end " + end + " must be after start " + start);
    }
  }

  /**
   * Builds the window covering {@code today} through the end of {@code today + days} in {@code zone}.
   *
   * @param today first day of the window
   * @param days number of additional days; must not be negative
   * @param zone zone whose midnight delimits days
   * @return window starting at the start of {@code today}
   */
  public static SyncWindow ofDays(LocalDate today, int days, ZoneId zone) {
    Objects.requireNonNull(today, "today");
    Objects.requireNonNull(zone, "zone");
    if (days < 0) {
      throw new IllegalArgumentException("days must not be negative (was " + days + ")");
    }
    Instant start = today.atStartOfDay(zone).toInstant();
    Instant end = today.plusDays(days + 1L).atStartOfDay(zone).toInstant();
    return new SyncWindow(start, end);
  }

  /**
   * Tests whether an event with the given bounds overlaps this window.
   *
   * @param eventStart event start
   * @param eventEnd event end
   * @return {@code true} when the event overlaps; zero-length events count when they start inside the window
   */
  public boolean overlaps(Instant eventStart, Instant eventEnd) {
    if (eventStart.equals(eventEnd)) {
      return !eventStart.isBefore(start) && eventStart.isBefore(end);
    }
    return eventStart.isBefore(end) && eventEnd.isAfter(start);
  }
}
