package ca.gc.cra.calsync.domain.calendar;

import java.util.Objects;
import java.util.Optional;

/**
 * Participation record of one attendee of an event.
 *
 * @param email attendee address; may be {@code null} when the store does not expose one
 * @param status the attendee's response; never {@code null}
 * @param self {@code true} when the store marks this attendee as the signed-in account
 * @since 0.1.0
 */
public record Attendee(String email, ParticipationStatus status, boolean self) {
  /**
   * Normalizes the address and defaults the status.
   */
  public Attendee {
    email = email == null || email.isBlank() ? null : email.trim();
    status = Objects.requireNonNullElse(status, ParticipationStatus.UNKNOWN);
  }

  /**
   * Returns the attendee address when present.
   *
   * @return optional e-mail address
   */
  public Optional<String> emailAddress() {
    return Optional.ofNullable(email);
  }
}
