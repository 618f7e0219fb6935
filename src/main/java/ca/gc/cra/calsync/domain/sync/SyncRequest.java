package ca.gc.cra.calsync.domain.sync;

import ca.gc.cra.calsync.validation.Strings;
import java.util.Objects;
import java.util.Optional;

/**
 * Inputs of one sync run.
 *
 * @param sourceCalendar name of the read-only source calendar
 * @param destinationCalendar destination calendar name; absent selects list mode
 * @param window time range read from both calendars
 * @param filters exclusion options
 * @param forceRefresh ask the store to refresh its upstream sources before querying
 * @param forceRecreate delete every tracked event in the window and create all candidates again
 * @param dryRun reconcile without mutating the destination
 * @since 0.1.0
 */
public record SyncRequest(
    String sourceCalendar,
    Optional<String> destinationCalendar,
    SyncWindow window,
    FilterOptions filters,
    boolean forceRefresh,
    boolean forceRecreate,
    boolean dryRun) {

  /**
   * Validates required values.
   */
  public SyncRequest {
    sourceCalendar = Strings.requireNonBlank("source", sourceCalendar);
    destinationCalendar = Objects.requireNonNullElse(destinationCalendar, Optional.<String>empty())
        .filter(name -> !name.isBlank())
        .map(String::trim);
    window = Objects.requireNonNull(window, "window");
    filters = Objects.requireNonNullElse(filters, FilterOptions.none());
  }

  /**
   * Resolves the mode this request runs in.
   *
   * @return {@link SyncMode#LIST} without destination, {@link SyncMode#DRY_RUN} or {@link SyncMode#SYNC} otherwise
   */
  public SyncMode mode() {
    if (destinationCalendar.isEmpty()) {
      return SyncMode.LIST;
    }
    return dryRun ? SyncMode.DRY_RUN : SyncMode.SYNC;
  }
}
