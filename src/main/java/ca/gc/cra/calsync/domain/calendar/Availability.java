package ca.gc.cra.calsync.domain.calendar;

import java.util.Locale;

/**
 * Free/busy state an event contributes to its calendar.
 *
 * <p>Synced events are only written as {@link #BUSY} or {@link #FREE}; the other values can be read back from
 * destination events that a user edited by hand.</p>
 *
 * @since 0.1.0
 */
public enum Availability {
  BUSY,
  FREE,
  TENTATIVE,
  UNAVAILABLE;

  /**
   * Parses an availability name case-insensitively.
   *
   * @param raw availability text; {@code null} or blank yields {@link #BUSY}
   * @return parsed availability
   * @throws IllegalArgumentException if the value names no availability
   */
  public static Availability fromString(String raw) {
    if (raw == null || raw.isBlank()) {
      return BUSY;
    }
    try {
      return valueOf(raw.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("unknown availability: " + raw, ex);
    }
  }
}
