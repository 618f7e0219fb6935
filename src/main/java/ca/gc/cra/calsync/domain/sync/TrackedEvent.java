package ca.gc.cra.calsync.domain.sync;

import ca.gc.cra.calsync.domain.calendar.CalendarEvent;
import ca.gc.cra.calsync.domain.calendar.Fingerprint;
import ca.gc.cra.calsync.domain.calendar.SourceTag;
import java.util.Objects;
import java.util.Optional;

/**
 * Destination event carrying a source tag, with its fingerprint recomputed from current field values.
 *
 * @param event destination event
 * @param identity identity read from the tag line
 * @param fingerprint fingerprint of the event as it is stored now
 * @since 0.1.0
 */
public record TrackedEvent(CalendarEvent event, String identity, Fingerprint fingerprint) {
  /**
   * Validates fields.
   */
  public TrackedEvent {
    Objects.requireNonNull(event, "event");
    Objects.requireNonNull(identity, "identity");
    Objects.requireNonNull(fingerprint, "fingerprint");
  }

  /**
   * Recognises a tracked event; events without a valid tag are not tracked.
   *
   * @param event destination event
   * @return tracked view, or empty when the notes carry no tag
   */
  public static Optional<TrackedEvent> from(CalendarEvent event) {
    return SourceTag.extract(event.notes())
        .map(identity -> new TrackedEvent(event, identity, Fingerprint.of(event)));
  }
}
