package ca.gc.cra.calsync.domain.calendar;

import java.util.Locale;

/**
 * Response of an attendee to an invitation.
 *
 * @since 0.1.0
 */
public enum ParticipationStatus {
  UNKNOWN,
  PENDING,
  ACCEPTED,
  DECLINED,
  TENTATIVE;

  /**
   * Parses a status name case-insensitively.
   *
   * @param raw status text; {@code null} or blank yields {@link #UNKNOWN}
   * @return parsed status
   * @throws IllegalArgumentException if the value names no status
   */
  public static ParticipationStatus fromString(String raw) {
    if (raw == null || raw.isBlank()) {
      return UNKNOWN;
    }
    try {
      return valueOf(raw.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("unknown participation status: " + raw, ex);
    }
  }
}
