package ca.gc.cra.calsync.config;

import ca.gc.cra.calsync.domain.sync.FilterOptions;
import ca.gc.cra.calsync.domain.sync.SyncRequest;
import ca.gc.cra.calsync.domain.sync.SyncWindow;
import ca.gc.cra.calsync.validation.Numbers;
import ca.gc.cra.calsync.validation.Strings;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * <strong>What:</strong> Validated settings of one {@code calsync sync} invocation.
 * <p><strong>Why:</strong> Turns the merged string map (defaults, YAML, CLI) into typed values once, so the use case
 * never sees raw configuration.</p>
 * <p><strong>Role:</strong> Configuration aggregate consumed by {@link CompositionRoot}.</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @param sourceCalendar source calendar name
 * @param destinationCalendar destination calendar name; empty selects list mode
 * @param days number of days after today included in the window
 * @param zone zone whose midnight delimits the window
 * @param filters exclusion options
 * @param accounts e-mail addresses of the current account
 * @param store path of the JSON calendar store
 * @param forceRefresh ask the store to refresh before querying
 * @param forceRecreate delete and recreate every tracked event in the window
 * @param dryRun reconcile without writing
 * @since 0.1.0
 */
public record SyncConfig(
    String sourceCalendar,
    Optional<String> destinationCalendar,
    int days,
    ZoneId zone,
    FilterOptions filters,
    Set<String> accounts,
    Path store,
    boolean forceRefresh,
    boolean forceRecreate,
    boolean dryRun) {

  /** Largest accepted {@code days} value. */
  public static final int MAX_DAYS = 366;
  /** Window length used when {@code days} is not configured. */
  public static final int DEFAULT_DAYS = 7;

  /**
   * Validates fields.
   */
  public SyncConfig {
    sourceCalendar = Strings.requireNonBlank("source", sourceCalendar);
    destinationCalendar = Objects.requireNonNullElse(destinationCalendar, Optional.<String>empty());
    Numbers.requireRange("days", days, 0, MAX_DAYS);
    zone = Objects.requireNonNull(zone, "zone");
    filters = Objects.requireNonNullElse(filters, FilterOptions.none());
    accounts = Set.copyOf(accounts);
    store = Objects.requireNonNull(store, "store");
  }

  /**
   * Builds the configuration from a merged key/value map.
   *
   * @param options merged configuration
   * @return validated configuration
   * @throws IllegalArgumentException if a value is missing or invalid; the message names the key
   */
  public static SyncConfig fromMap(Map<String, String> options) {
    Objects.requireNonNull(options, "options");
    String source = optionalString(options.get("source"))
        .orElseThrow(() -> new IllegalArgumentException("source is required"));
    Optional<String> destination = optionalString(options.get("destination"))
        .map(value -> Strings.requireNonBlank("destination", value));
    if (destination.isPresent() && destination.get().equals(source)) {
      throw new IllegalArgumentException("destination must differ from source: " + source);
    }
    int days = optionalString(options.get("days"))
        .map(value -> Numbers.parseIntInRange("days", value, 0, MAX_DAYS))
        .orElse(DEFAULT_DAYS);
    FilterOptions filters = new FilterOptions(
        parseBoolean(options.get("excludeDeclined")),
        parseBoolean(options.get("excludeAllDay")),
        FilterOptions.parsePatterns(options.get("excludeTitle")));
    return new SyncConfig(
        source,
        destination,
        days,
        parseZone(options.get("zone")),
        filters,
        parseAccounts(options.get("account")),
        storePath(options),
        parseBoolean(options.get("forceRefresh")),
        parseBoolean(options.get("forceRecreate")),
        parseBoolean(options.get("dryRun")));
  }

  /**
   * Resolves the store location from {@code store}, defaulting to {@code ~/.calsync/calendars.json}.
   *
   * @param options merged configuration
   * @return absolute normalized store path
   * @throws IllegalArgumentException if the value is not a valid path
   */
  public static Path storePath(Map<String, String> options) {
    String raw = optionalString(options.get("store")).orElse(null);
    if (raw == null) {
      return defaultStorePath();
    }
    try {
      return Path.of(Strings.requireNonBlank("store", raw)).toAbsolutePath().normalize();
    } catch (InvalidPathException ex) {
      throw new IllegalArgumentException("store is not a valid path: " + raw, ex);
    }
  }

  /**
   * Default store location under the user's home directory.
   *
   * @return {@code ~/.calsync/calendars.json}
   */
  public static Path defaultStorePath() {
    return Path.of(System.getProperty("user.home", "."), ".calsync", "calendars.json");
  }

  /**
   * Builds the run request for {@code today}.
   *
   * @param today current date in {@link #zone()}
   * @return sync request
   */
  public SyncRequest toRequest(LocalDate today) {
    return new SyncRequest(
        sourceCalendar,
        destinationCalendar,
        SyncWindow.ofDays(today, days, zone),
        filters,
        forceRefresh,
        forceRecreate,
        dryRun);
  }

  private static ZoneId parseZone(String raw) {
    Optional<String> value = optionalString(raw);
    if (value.isEmpty()) {
      return ZoneId.systemDefault();
    }
    try {
      return ZoneId.of(value.get());
    } catch (DateTimeException ex) {
      throw new IllegalArgumentException("zone is not a valid time zone: " + value.get(), ex);
    }
  }

  private static Set<String> parseAccounts(String csv) {
    Set<String> accounts = new LinkedHashSet<>();
    optionalString(csv).ifPresent(value -> Arrays.stream(value.split(","))
        .map(String::trim)
        .filter(address -> !address.isEmpty())
        .forEach(address -> {
          if (address.indexOf('@') <= 0) {
            throw new IllegalArgumentException("account must be an e-mail address: " + address);
          }
          accounts.add(address);
        }));
    return accounts;
  }

  private static boolean parseBoolean(String value) {
    return value != null && !value.isBlank() && Boolean.parseBoolean(value.trim());
  }

  private static Optional<String> optionalString(String value) {
    if (value == null) {
      return Optional.empty();
    }
    String trimmed = value.trim();
    return trimmed.isEmpty() ? Optional.empty() : Optional.of(trimmed);
  }
}
