package ca.gc.cra.calsync.application.port;

import java.util.Collections;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Raised when a calendar name matches no calendar in the store.
 *
 * <p>Carries every available name so the operator can correct the configuration.</p>
 *
 * @since 0.1.0
 */
public class CalendarNotFoundException extends CalendarStoreException {
  private static final long serialVersionUID = 1L;

  private final String requestedName;
  private final SortedSet<String> availableNames;

  /**
   * Creates the exception.
   *
   * @param requestedName name that was looked up
   * @param availableNames names of the calendars that do exist
   */
  public CalendarNotFoundException(String requestedName, Set<String> availableNames) {
    super("Calendar '" + requestedName + "' not found");
    this.requestedName = requestedName;
    this.availableNames = availableNames == null
        ? Collections.emptySortedSet()
        : Collections.unmodifiableSortedSet(new TreeSet<>(availableNames));
  }

  /**
   * Name that was looked up.
   *
   * @return requested calendar name
   */
  public String requestedName() {
    return requestedName;
  }

  /**
   * Names of the calendars present in the store.
   *
   * @return available names in natural order
   */
  public SortedSet<String> availableNames() {
    return availableNames;
  }
}
