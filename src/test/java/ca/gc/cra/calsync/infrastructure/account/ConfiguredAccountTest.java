package ca.gc.cra.calsync.infrastructure.account;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.calsync.domain.calendar.Attendee;
import ca.gc.cra.calsync.domain.calendar.ParticipationStatus;
import java.util.Set;
import org.junit.jupiter.api.Test;

class ConfiguredAccountTest {

  @Test
  void matchesConfiguredAddressesIgnoringCase() {
    ConfiguredAccount account = ConfiguredAccount.fromCsv(" Me@Example.com , alias@example.com,, ");

    assertEquals(Set.of("me@example.com", "alias@example.com"), account.addresses());
    assertTrue(account.isCurrentAccount(new Attendee("ME@example.COM", ParticipationStatus.ACCEPTED, false)));
    assertFalse(account.isCurrentAccount(new Attendee("boss@example.com", ParticipationStatus.ACCEPTED, false)));
  }

  @Test
  void selfMarkerAlwaysMatches() {
    ConfiguredAccount account = ConfiguredAccount.fromCsv(null);

    assertTrue(account.isCurrentAccount(new Attendee(null, ParticipationStatus.DECLINED, true)));
    assertFalse(account.isCurrentAccount(new Attendee("me@example.com", ParticipationStatus.DECLINED, false)));
    assertFalse(account.isCurrentAccount(null));
  }
}
