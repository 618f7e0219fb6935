package ca.gc.cra.calsync.domain.sync;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class SyncRequestTest {
  private static final SyncWindow WINDOW = SyncWindow.ofDays(LocalDate.of(2024, 5, 1), 7, ZoneOffset.UTC);

  @Test
  void modeFollowsDestinationAndDryRun() {
    assertEquals(SyncMode.LIST, request(Optional.empty(), false).mode());
    assertEquals(SyncMode.LIST, request(Optional.of("  "), true).mode());
    assertEquals(SyncMode.DRY_RUN, request(Optional.of("Mirror"), true).mode());
    assertEquals(SyncMode.SYNC, request(Optional.of("Mirror"), false).mode());
  }

  @Test
  void destinationIsTrimmed() {
    assertEquals(Optional.of("Mirror"), request(Optional.of(" Mirror "), false).destinationCalendar());
  }

  @Test
  void blankSourceIsRejected() {
    assertThrows(IllegalArgumentException.class,
        () -> new SyncRequest(" ", Optional.empty(), WINDOW, null, false, false, false));
  }

  private static SyncRequest request(Optional<String> destination, boolean dryRun) {
    return new SyncRequest("Work", destination, WINDOW, FilterOptions.none(), false, false, dryRun);
  }
}
