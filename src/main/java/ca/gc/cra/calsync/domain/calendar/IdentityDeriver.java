package ca.gc.cra.calsync.domain.calendar;

import java.time.Instant;
import java.util.Objects;

/**
 * <strong>What:</strong> Derives the stable identity of an event from its title and time bounds.
 * <p><strong>Why:</strong> Source events carry no key that survives between runs, so the identity is what links a
 * source event to the destination copy tagged in an earlier run.</p>
 * <p><strong>Role:</strong> Pure domain function; location, notes, attendees and availability never participate.</p>
 * <p><strong>Thread-safety:</strong> Stateless.</p>
 *
 * <p>Renaming an event or moving it in time yields a new identity, so the old copy is deleted and a new one created
 * instead of being updated in place.</p>
 *
 * @since 0.1.0
 */
public final class IdentityDeriver {
  /** Title used for events whose title is blank. */
  public static final String UNTITLED = "Untitled";
  private static final char SEPARATOR = '|';

  private IdentityDeriver() {}

  /**
   * Derives the identity of {@code event}.
   *
   * @param event source event; must not be {@code null}
   * @return 64-character lower-case hex identity
   */
  public static String derive(CalendarEvent event) {
    Objects.requireNonNull(event, "event");
    return derive(event.title(), event.start(), event.end());
  }

  /**
   * Derives an identity from raw components.
   *
   * @param title event title; may be {@code null}
   * @param start start instant; must not be {@code null}
   * @param end end instant; must not be {@code null}
   * @return 64-character lower-case hex identity
   */
  public static String derive(String title, Instant start, Instant end) {
    Objects.requireNonNull(start, "start");
    Objects.requireNonNull(end, "end");
    String material = normalizeTitle(title) + SEPARATOR + start + SEPARATOR + end;
    return Hashes.sha256Hex(material);
  }

  /**
   * Trims surrounding whitespace; blank titles normalize to {@link #UNTITLED}.
   *
   * @param title raw title; may be {@code null}
   * @return normalized title
   */
  public static String normalizeTitle(String title) {
    if (title == null || title.isBlank()) {
      return UNTITLED;
    }
    return title.trim();
  }
}
