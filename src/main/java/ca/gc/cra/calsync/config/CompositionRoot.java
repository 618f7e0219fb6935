package ca.gc.cra.calsync.config;

import ca.gc.cra.calsync.application.port.CalendarStore;
import ca.gc.cra.calsync.application.port.ClockPort;
import ca.gc.cra.calsync.application.port.CurrentAccountPort;
import ca.gc.cra.calsync.application.port.MetricsPort;
import ca.gc.cra.calsync.application.sync.SyncUseCase;
import ca.gc.cra.calsync.infrastructure.account.ConfiguredAccount;
import ca.gc.cra.calsync.infrastructure.store.json.JsonCalendarStore;
import ca.gc.cra.calsync.infrastructure.time.SystemClockAdapter;
import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.Objects;

/**
 * <strong>What:</strong> Wires the sync use case to concrete adapters.
 * <p><strong>Role:</strong> Composition root used by the CLI; tests substitute their own store and clock.</p>
 * <p><strong>Thread-safety:</strong> Not thread-safe; build one per invocation.</p>
 *
 * @since 0.1.0
 */
public final class CompositionRoot {
  private final CalendarStore store;
  private final MetricsPort metrics;
  private final ClockPort clock;

  /**
   * Creates a root backed by the JSON store at {@code storePath}.
   *
   * @param storePath JSON calendar store location
   * @param metrics metrics sink
   */
  public CompositionRoot(Path storePath, MetricsPort metrics) {
    this(new JsonCalendarStore(storePath), metrics, new SystemClockAdapter());
  }

  /**
   * Creates a root over explicit adapters.
   *
   * @param store calendar store
   * @param metrics metrics sink
   * @param clock wall clock
   */
  public CompositionRoot(CalendarStore store, MetricsPort metrics, ClockPort clock) {
    this.store = Objects.requireNonNull(store, "store");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Returns the calendar store.
   *
   * @return store shared by every use case built here
   */
  public CalendarStore calendarStore() {
    return store;
  }

  /**
   * Builds the current account lookup for {@code config}.
   *
   * @param config sync configuration
   * @return account lookup
   */
  public CurrentAccountPort currentAccount(SyncConfig config) {
    return new ConfiguredAccount(config.accounts());
  }

  /**
   * Builds the sync use case for {@code config}.
   *
   * @param config sync configuration
   * @return use case
   */
  public SyncUseCase syncUseCase(SyncConfig config) {
    return new SyncUseCase(store, currentAccount(config), metrics, clock);
  }

  /**
   * Resolves "today" in {@code zone} from the configured clock.
   *
   * @param zone zone whose calendar date is wanted
   * @return current date
   */
  public LocalDate today(ZoneId zone) {
    return LocalDate.ofInstant(Instant.ofEpochMilli(clock.nowMillis()), zone);
  }
}
