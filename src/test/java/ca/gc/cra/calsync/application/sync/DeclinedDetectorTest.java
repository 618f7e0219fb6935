package ca.gc.cra.calsync.application.sync;

import static ca.gc.cra.calsync.application.sync.TestEvents.me;
import static ca.gc.cra.calsync.application.sync.TestEvents.source;
import static ca.gc.cra.calsync.application.sync.TestEvents.withAttendees;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.calsync.application.port.CurrentAccountPort;
import ca.gc.cra.calsync.domain.calendar.Attendee;
import ca.gc.cra.calsync.domain.calendar.CalendarEvent;
import ca.gc.cra.calsync.domain.calendar.ParticipationStatus;
import ca.gc.cra.calsync.infrastructure.account.ConfiguredAccount;
import java.util.List;
import org.junit.jupiter.api.Test;

class DeclinedDetectorTest {
  private final DeclinedDetector detector = new DeclinedDetector(new ConfiguredAccount(List.of(TestEvents.ME)));

  @Test
  void declinedOnlyWhenCurrentAccountDeclined() {
    CalendarEvent event = source("1", "Review", "10:00", "11:00");

    assertTrue(detector.isDeclined(withAttendees(event, me(ParticipationStatus.DECLINED))));
    assertFalse(detector.isDeclined(withAttendees(event, me(ParticipationStatus.ACCEPTED))));
    assertFalse(detector.isDeclined(withAttendees(event,
        new Attendee("someone@example.com", ParticipationStatus.DECLINED, false))));
  }

  @Test
  void eventsWithoutAttendeesAreNeverDeclined() {
    assertFalse(detector.isDeclined(source("1", "Solo block", "10:00", "11:00")));
  }

  @Test
  void storeMarkedAccountUsesSelfFlag() {
    DeclinedDetector marked = new DeclinedDetector(CurrentAccountPort.STORE_MARKED);
    CalendarEvent event = withAttendees(source("1", "Review", "10:00", "11:00"),
        new Attendee("other@example.com", ParticipationStatus.ACCEPTED, false),
        new Attendee(null, ParticipationStatus.DECLINED, true));

    assertTrue(marked.isDeclined(event));
  }
}
