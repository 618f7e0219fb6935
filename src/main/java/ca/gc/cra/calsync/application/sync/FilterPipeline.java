package ca.gc.cra.calsync.application.sync;

import ca.gc.cra.calsync.domain.calendar.CalendarEvent;
import ca.gc.cra.calsync.domain.sync.FilterOptions;
import ca.gc.cra.calsync.domain.sync.FilterResult;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * <strong>What:</strong> Applies the configured exclusion predicates to source events.
 * <p><strong>Role:</strong> Second stage of a sync run, between fetch and identity derivation.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Keep an event only when it passes every enabled predicate, so predicate order never matters.</li>
 *   <li>Preserve source ordering of the kept events.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable after construction; no side effects.</p>
 *
 * @since 0.1.0
 */
public final class FilterPipeline {
  private final FilterOptions options;
  private final DeclinedDetector declined;

  /**
   * Creates a pipeline.
   *
   * @param options exclusion options
   * @param declined declined detector used when {@link FilterOptions#excludeDeclined()} is set
   */
  public FilterPipeline(FilterOptions options, DeclinedDetector declined) {
    this.options = Objects.requireNonNull(options, "options");
    this.declined = Objects.requireNonNull(declined, "declined");
  }

  /**
   * Filters {@code events}.
   *
   * @param events source events in source order
   * @return kept events and per-predicate exclusion counts
   */
  public FilterResult apply(List<CalendarEvent> events) {
    List<CalendarEvent> kept = new ArrayList<>(events.size());
    int excludedDeclined = 0;
    int excludedAllDay = 0;
    int excludedTitle = 0;
    for (CalendarEvent event : events) {
      if (options.excludeDeclined() && declined.isDeclined(event)) {
        excludedDeclined++;
      } else if (options.excludeAllDay() && event.allDay()) {
        excludedAllDay++;
      } else if (matchesExcludedTitle(event.title())) {
        excludedTitle++;
      } else {
        kept.add(event);
      }
    }
    return new FilterResult(kept, excludedDeclined, excludedAllDay, excludedTitle);
  }

  private boolean matchesExcludedTitle(String title) {
    if (options.excludeTitlePatterns().isEmpty() || title == null || title.isEmpty()) {
      return false;
    }
    String lower = title.toLowerCase(Locale.ROOT);
    for (String pattern : options.excludeTitlePatterns()) {
      if (lower.contains(pattern)) {
        return true;
      }
    }
    return false;
  }
}
