package ca.gc.cra.calsync.application.port;

import ca.gc.cra.calsync.domain.calendar.Attendee;

/**
 * Recognises the attendee record that belongs to the account the sync runs as.
 *
 * <p>Declined detection depends on it, so it is injected instead of read from ambient state.</p>
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface CurrentAccountPort {
  /**
   * Tests whether {@code attendee} is the current account.
   *
   * @param attendee attendee record of an event
   * @return {@code true} when the attendee is the current account
   */
  boolean isCurrentAccount(Attendee attendee);

  /**
   * Account lookup that trusts only the store's own {@link Attendee#self()} marker.
   */
  CurrentAccountPort STORE_MARKED = Attendee::self;
}
