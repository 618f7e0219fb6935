package ca.gc.cra.calsync.api;

import ca.gc.cra.calsync.application.port.CalendarNotFoundException;
import ca.gc.cra.calsync.application.port.CalendarStoreException;
import ca.gc.cra.calsync.application.sync.SyncUseCase;
import ca.gc.cra.calsync.config.CompositionRoot;
import ca.gc.cra.calsync.config.SyncConfig;
import ca.gc.cra.calsync.domain.sync.SyncSummary;
import ca.gc.cra.calsync.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.calsync.logging.LoggingConfigurator;
import ca.gc.cra.calsync.validation.Paths;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for {@code calsync sync}: mirrors a source calendar into a destination calendar, or lists the filtered
 * source events when no destination is given.
 *
 * @since 0.1.0
 */
public final class SyncCli {
  private static final Logger log = LoggerFactory.getLogger(SyncCli.class);
  private static final String MODE = "sync";
  private static final Map<String, String> FLAG_KEYS = Map.of(
      "--exclude-declined", "excludeDeclined",
      "--exclude-all-day", "excludeAllDay",
      "--force-refresh", "forceRefresh",
      "--force-recreate", "forceRecreate",
      "--dry-run", "dryRun");
  private static final String SUMMARY_USAGE =
      "usage: sync source=NAME [destination=NAME] [days=N] [excludeTitle=a,b] [store=PATH] "
          + "[account=EMAIL,...] [zone=ZONE] [config=PATH] [--exclude-declined] [--exclude-all-day] "
          + "[--force-refresh] [--force-recreate] [--dry-run]";
  private static final String HELP_TEXT = """
      calsync sync

      Usage:
        sync source=NAME [destination=NAME] [options]

      Calendars:
        source=NAME               Calendar to read from (required)
        destination=NAME          Calendar to mirror into; omit to list the filtered source events
        store=PATH                JSON calendar store (default ~/.calsync/calendars.json)

      Window and filters:
        days=N                    Days after today to include, 0..366 (default 7)
        zone=ZONE                 Time zone whose midnight starts the window (default system zone)
        excludeTitle=a,b          Skip events whose title contains any pattern (case-insensitive)
        account=EMAIL,...         Addresses identifying you among attendees, for declined detection
        --exclude-declined        Skip events you declined
        --exclude-all-day         Skip all-day events

      Run control:
        --force-refresh           Ask the store to refresh its sources before reading
        --force-recreate          Delete and recreate every synced event in the window
        --dry-run                 Show planned changes without writing
        config=PATH               YAML file with common/sync sections; CLI values win

      Metrics:
        metricsExporter=otlp|none OpenTelemetry exporter (default none)
        otelEndpoint=URL          OTLP endpoint when metricsExporter=otlp
        otelResourceAttributes=k=v,...

      Global:
        --verbose                 Enable DEBUG logging
        --help                    Show this message

      Exit status: 0 when the run completed (individual event failures are reported, not fatal),
      2 invalid arguments, 3 store I/O failure, 4 configuration error or unknown calendar, 5 unexpected failure.
      """;

  private SyncCli() {}

  /**
   * Entry point invoked by the JVM.
   *
   * @param args raw CLI arguments
   */
  public static void main(String[] args) {
    ExitCode exit = run(args);
    System.exit(exit.code());
  }

  /**
   * Executes the sync command and returns a normalized exit code.
   *
   * @param args raw CLI arguments
   * @return exit code describing the outcome
   */
  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for sync CLI");
    }

    Map<String, String> kv;
    try {
      kv = new LinkedHashMap<>(CliArgsParser.toMap(input.keyValueArgs()));
      ConfigCliUtils.applyFlags(input, FLAG_KEYS, kv);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    SyncConfig config;
    try {
      Map<String, String> effective = ConfigCliUtils.effectiveConfig(MODE, kv, log::warn);
      if (!input.verbose() && ConfigCliUtils.parseBoolean(effective, "verbose")) {
        LoggingConfigurator.enableVerboseLogging();
      }
      TelemetryConfigurator.configureMetrics(effective);
      config = SyncConfig.fromMap(effective);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid sync configuration: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    } catch (IOException ex) {
      log.error("Unable to read configuration file", ex);
      return ExitCode.IO_ERROR;
    }

    try {
      Paths.validateDataFile(config.store(), false);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid calendar store: {}", ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    }

    try (OpenTelemetryMetricsAdapter metrics = new OpenTelemetryMetricsAdapter()) {
      CompositionRoot root = new CompositionRoot(config.store(), metrics);
      SyncUseCase useCase = root.syncUseCase(config);
      log.info("Configured sync: source='{}', destination='{}', days={}, store={}",
          config.sourceCalendar(), config.destinationCalendar().orElse("<list only>"), config.days(),
          config.store());
      SyncSummary summary = useCase.run(config.toRequest(root.today(config.zone())));
      CliPrinter.printLines(SummaryFormatter.format(summary, config.zone()));
      if (summary.failed() > 0) {
        log.warn("{} of the planned changes failed; see summary", summary.failed());
      }
      return ExitCode.SUCCESS;
    } catch (CalendarNotFoundException ex) {
      log.error("Calendar '{}' not found. Available calendars: {}", ex.requestedName(),
          String.join(", ", ex.availableNames()));
      return ExitCode.CONFIG_ERROR;
    } catch (CalendarStoreException ex) {
      log.error("Calendar store failure: {}", ex.getMessage(), ex);
      return ExitCode.IO_ERROR;
    } catch (IllegalArgumentException ex) {
      log.error("Sync configuration error: {}", ex.getMessage(), ex);
      return ExitCode.CONFIG_ERROR;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure in sync", ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }
}
