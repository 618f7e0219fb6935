package ca.gc.cra.calsync.domain.sync;

import ca.gc.cra.calsync.domain.calendar.CalendarEvent;
import java.util.List;

/**
 * Events kept by the filter pipeline and how many each predicate removed.
 *
 * <p>An event failing several predicates is counted once, under the first of declined, all-day, title.</p>
 *
 * @param kept surviving events in source order
 * @param excludedDeclined events removed as declined
 * @param excludedAllDay events removed as all-day
 * @param excludedTitle events removed by a title pattern
 * @since 0.1.0
 */
public record FilterResult(List<CalendarEvent> kept, int excludedDeclined, int excludedAllDay, int excludedTitle) {
  /**
   * Defensively copies the kept events.
   */
  public FilterResult {
    kept = List.copyOf(kept);
  }

  /**
   * Total number of excluded events.
   *
   * @return excluded count
   */
  public int excluded() {
    return excludedDeclined + excludedAllDay + excludedTitle;
  }
}
