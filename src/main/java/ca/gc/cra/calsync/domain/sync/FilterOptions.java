package ca.gc.cra.calsync.domain.sync;

import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Exclusion switches applied to source events before identities are derived.
 *
 * @param excludeDeclined drop events the current account declined
 * @param excludeAllDay drop all-day events
 * @param excludeTitlePatterns case-insensitive substrings; a title containing any of them is dropped
 * @since 0.1.0
 */
public record FilterOptions(
    boolean excludeDeclined,
    boolean excludeAllDay,
    Set<String> excludeTitlePatterns) {

  /**
   * Lower-cases patterns and drops blank ones.
   */
  public FilterOptions {
    Set<String> normalized = new LinkedHashSet<>();
    if (excludeTitlePatterns != null) {
      for (String pattern : excludeTitlePatterns) {
        if (pattern != null && !pattern.isBlank()) {
          normalized.add(pattern.trim().toLowerCase(Locale.ROOT));
        }
      }
    }
    excludeTitlePatterns = Set.copyOf(normalized);
  }

  /**
   * Options that keep every event.
   *
   * @return permissive options
   */
  public static FilterOptions none() {
    return new FilterOptions(false, false, Set.of());
  }

  /**
   * Parses a comma-separated pattern list as accepted on the command line.
   *
   * @param csv comma-separated patterns; may be {@code null}
   * @return trimmed, non-blank patterns in input order
   */
  public static Set<String> parsePatterns(String csv) {
    Set<String> patterns = new LinkedHashSet<>();
    if (csv == null || csv.isBlank()) {
      return patterns;
    }
    for (String token : csv.split(",")) {
      String trimmed = token.trim();
      if (!trimmed.isEmpty()) {
        patterns.add(trimmed);
      }
    }
    return patterns;
  }
}
