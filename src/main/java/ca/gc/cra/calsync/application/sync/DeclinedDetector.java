package ca.gc.cra.calsync.application.sync;

import ca.gc.cra.calsync.application.port.CurrentAccountPort;
import ca.gc.cra.calsync.domain.calendar.Attendee;
import ca.gc.cra.calsync.domain.calendar.CalendarEvent;
import ca.gc.cra.calsync.domain.calendar.ParticipationStatus;
import java.util.Objects;

/**
 * Decides whether the current account declined an event.
 *
 * <p>The first attendee recognised as the current account decides. Events without attendees, or where the current
 * account is not among them (organizer-only events), are never declined.</p>
 *
 * @since 0.1.0
 */
public final class DeclinedDetector {
  private final CurrentAccountPort account;

  /**
   * Creates a detector.
   *
   * @param account current account lookup
   */
  public DeclinedDetector(CurrentAccountPort account) {
    this.account = Objects.requireNonNull(account, "account");
  }

  /**
   * Tests whether {@code event} was declined by the current account.
   *
   * @param event source event
   * @return {@code true} when the current account's response is {@link ParticipationStatus#DECLINED}
   */
  public boolean isDeclined(CalendarEvent event) {
    for (Attendee attendee : event.attendees()) {
      if (account.isCurrentAccount(attendee)) {
        return attendee.status() == ParticipationStatus.DECLINED;
      }
    }
    return false;
  }
}
