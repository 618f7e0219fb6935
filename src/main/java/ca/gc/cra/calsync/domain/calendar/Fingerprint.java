package ca.gc.cra.calsync.domain.calendar;

import java.time.Instant;
import java.util.Objects;

/**
 * Digest over the fields whose drift makes a tracked destination event stale: title, start, end and availability.
 *
 * @param value 64-character hex digest
 * @since 0.1.0
 */
public record Fingerprint(String value) {
  private static final char SEPARATOR = '\u001f';

  /**
   * Validates the digest value.
   */
  public Fingerprint {
    Objects.requireNonNull(value, "value");
  }

  /**
   * Computes the fingerprint of a set of synced field values.
   *
   * @param title title as written to the destination
   * @param start start instant
   * @param end end instant
   * @param availability availability as written to the destination
   * @return fingerprint
   */
  public static Fingerprint of(String title, Instant start, Instant end, Availability availability) {
    String material = (title == null ? "" : title)
        + SEPARATOR + Objects.requireNonNull(start, "start")
        + SEPARATOR + Objects.requireNonNull(end, "end")
        + SEPARATOR + Objects.requireNonNull(availability, "availability").name();
    return new Fingerprint(Hashes.sha256Hex(material));
  }

  /**
   * Recomputes the fingerprint from the current field values of a stored event.
   *
   * @param event stored event
   * @return fingerprint
   */
  public static Fingerprint of(CalendarEvent event) {
    return of(event.title(), event.start(), event.end(), event.availability());
  }
}
