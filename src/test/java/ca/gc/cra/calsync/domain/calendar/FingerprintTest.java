package ca.gc.cra.calsync.domain.calendar;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;

import java.time.Instant;
import org.junit.jupiter.api.Test;

class FingerprintTest {
  private static final Instant START = Instant.parse("2024-05-01T13:00:00Z");
  private static final Instant END = Instant.parse("2024-05-01T14:00:00Z");

  @Test
  void availabilityChangesFingerprint() {
    assertNotEquals(
        Fingerprint.of("Review", START, END, Availability.BUSY),
        Fingerprint.of("Review", START, END, Availability.FREE));
  }

  @Test
  void locationAndNotesDoNotAffectFingerprint() {
    CalendarEvent source = new CalendarEvent(new EventRef("Work", "1"), "Review", START, END, false,
        "Room 1", "agenda", Availability.BUSY, null);
    CalendarEvent mirrored = new CalendarEvent(new EventRef("Mirror", "9"), "Review", START, END, false,
        null, "SOURCE_ID: " + "a".repeat(64), Availability.BUSY, null);

    assertEquals(Fingerprint.of(source), Fingerprint.of(mirrored));
  }

  @Test
  void titleIsComparedExactly() {
    assertNotEquals(
        Fingerprint.of("Review", START, END, Availability.BUSY),
        Fingerprint.of("Review ", START, END, Availability.BUSY));
  }
}
