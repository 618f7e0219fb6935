package ca.gc.cra.calsync.api;

import ca.gc.cra.calsync.domain.calendar.CalendarEvent;
import ca.gc.cra.calsync.domain.sync.MutationFailure;
import ca.gc.cra.calsync.domain.sync.SyncCandidate;
import ca.gc.cra.calsync.domain.sync.SyncMode;
import ca.gc.cra.calsync.domain.sync.SyncSummary;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Renders a {@link SyncSummary} as the plain-text report printed on stdout.
 */
final class SummaryFormatter {
  private static final DateTimeFormatter TIME_FORMAT =
      DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm xxx", Locale.ROOT);
  private static final String SEPARATOR = "-".repeat(50);

  private SummaryFormatter() {}

  static List<String> format(SyncSummary summary, ZoneId zone) {
    List<String> lines = new ArrayList<>();
    lines.add("Events from " + TIME_FORMAT.format(summary.window().start().atZone(zone))
        + " to " + TIME_FORMAT.format(summary.window().end().atZone(zone))
        + " in '" + summary.sourceCalendar() + "'");
    lines.add("  Fetched   : " + summary.fetched());
    lines.add("  Excluded  : " + summary.excluded() + excludedDetail(summary));
    lines.add("  Candidates: " + summary.candidates().size());

    if (summary.mode() == SyncMode.LIST) {
      if (summary.candidates().isEmpty()) {
        lines.add("No events found in the specified date range.");
      }
      for (SyncCandidate candidate : summary.candidates()) {
        appendCandidate(lines, candidate, zone);
      }
      return lines;
    }

    String destination = summary.destinationCalendar().orElse("");
    if (summary.mode() == SyncMode.DRY_RUN) {
      lines.add("Dry run against '" + destination + "' (no changes written)");
      lines.add("  To create: " + summary.created());
      lines.add("  To update: " + summary.updated());
      lines.add("  Unchanged: " + summary.unchanged());
      lines.add("  To delete: " + summary.deleted());
    } else {
      lines.add("Synced to '" + destination + "'");
      lines.add("  Created  : " + summary.created());
      lines.add("  Updated  : " + summary.updated());
      lines.add("  Unchanged: " + summary.unchanged());
      lines.add("  Deleted  : " + summary.deleted());
    }
    if (summary.plan().collisions() > 0) {
      lines.add("  Identity collisions: " + summary.plan().collisions());
    }
    lines.add("  Failed   : " + summary.failed());
    for (MutationFailure failure : summary.failures()) {
      lines.add("    " + failure.operation() + " '" + failure.title() + "' [" + failure.identity() + "]: "
          + failure.message());
    }
    return lines;
  }

  private static String excludedDetail(SyncSummary summary) {
    if (summary.excluded() == 0) {
      return "";
    }
    return " (declined " + summary.filter().excludedDeclined()
        + ", all-day " + summary.filter().excludedAllDay()
        + ", title " + summary.filter().excludedTitle() + ")";
  }

  private static void appendCandidate(List<String> lines, SyncCandidate candidate, ZoneId zone) {
    CalendarEvent event = candidate.event();
    lines.add("Title: " + event.title());
    lines.add("Start: " + TIME_FORMAT.format(event.start().atZone(zone)));
    lines.add("End: " + TIME_FORMAT.format(event.end().atZone(zone)));
    lines.add("Location: " + event.locationText().orElse("No location"));
    lines.add("All Day: " + event.allDay());
    lines.add("Declined by User: " + candidate.declined());
    lines.add(SEPARATOR);
  }
}
