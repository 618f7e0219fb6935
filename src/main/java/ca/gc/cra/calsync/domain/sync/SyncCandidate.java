package ca.gc.cra.calsync.domain.sync;

import ca.gc.cra.calsync.domain.calendar.Availability;
import ca.gc.cra.calsync.domain.calendar.CalendarEvent;
import ca.gc.cra.calsync.domain.calendar.Fingerprint;
import ca.gc.cra.calsync.domain.calendar.IdentityDeriver;
import java.util.Objects;

/**
 * Filtered source event together with everything the reconciler needs to place it.
 *
 * @param event source event
 * @param identity identity derived from title and time bounds
 * @param declined whether the current account declined the event
 * @param availability availability the destination copy must carry
 * @param fingerprint fingerprint of the fields as they will be written
 * @since 0.1.0
 */
public record SyncCandidate(
    CalendarEvent event,
    String identity,
    boolean declined,
    Availability availability,
    Fingerprint fingerprint) {

  /**
   * Validates fields.
   */
  public SyncCandidate {
    Objects.requireNonNull(event, "event");
    Objects.requireNonNull(identity, "identity");
    Objects.requireNonNull(availability, "availability");
    Objects.requireNonNull(fingerprint, "fingerprint");
  }

  /**
   * Builds a candidate; declined events are written {@link Availability#FREE}, all others {@link Availability#BUSY}.
   *
   * @param event filtered source event
   * @param declined whether the current account declined it
   * @return candidate
   */
  public static SyncCandidate of(CalendarEvent event, boolean declined) {
    Availability availability = declined ? Availability.FREE : Availability.BUSY;
    return new SyncCandidate(
        event,
        IdentityDeriver.derive(event),
        declined,
        availability,
        Fingerprint.of(event.title(), event.start(), event.end(), availability));
  }
}
