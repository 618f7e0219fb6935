package ca.gc.cra.calsync.domain.calendar;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Instant;
import org.junit.jupiter.api.Test;

class IdentityDeriverTest {
  private static final Instant START = Instant.parse("2024-05-01T13:00:00Z");
  private static final Instant END = Instant.parse("2024-05-01T14:00:00Z");

  @Test
  void identityIsStableLowercaseSha256Hex() {
    String first = IdentityDeriver.derive("Planning", START, END);
    String second = IdentityDeriver.derive("Planning", START, END);

    assertEquals(first, second);
    assertEquals(64, first.length());
    assertTrue(first.matches("[0-9a-f]{64}"));
  }

  @Test
  void identityMatchesHashOfTitleStartAndEnd() {
    String expected = Hashes.sha256Hex("Planning|2024-05-01T13:00:00Z|2024-05-01T14:00:00Z");

    assertEquals(expected, IdentityDeriver.derive("Planning", START, END));
  }

  @Test
  void surroundingWhitespaceInTitleIsIgnored() {
    assertEquals(
        IdentityDeriver.derive("Planning", START, END),
        IdentityDeriver.derive("  Planning \t", START, END));
  }

  @Test
  void blankAndMissingTitlesShareTheUntitledIdentity() {
    String untitled = IdentityDeriver.derive(IdentityDeriver.UNTITLED, START, END);

    assertEquals(untitled, IdentityDeriver.derive(null, START, END));
    assertEquals(untitled, IdentityDeriver.derive("", START, END));
    assertEquals(untitled, IdentityDeriver.derive("   ", START, END));
  }

  @Test
  void anyChangeToTitleOrTimesChangesIdentity() {
    String base = IdentityDeriver.derive("Planning", START, END);

    assertNotEquals(base, IdentityDeriver.derive("Planning (moved)", START, END));
    assertNotEquals(base, IdentityDeriver.derive("planning", START, END));
    assertNotEquals(base, IdentityDeriver.derive("Planning", START.plusSeconds(60), END));
    assertNotEquals(base, IdentityDeriver.derive("Planning", START, END.plusSeconds(60)));
  }

  @Test
  void eventOverloadIgnoresNonIdentityFields() {
    CalendarEvent plain = new CalendarEvent(new EventRef("Work", "a"), "Planning", START, END, false,
        null, null, Availability.BUSY, null);
    CalendarEvent decorated = new CalendarEvent(new EventRef("Home", "b"), "Planning", START, END, true,
        "Room 4", "bring slides", Availability.FREE, null);

    assertEquals(IdentityDeriver.derive(plain), IdentityDeriver.derive(decorated));
  }
}
