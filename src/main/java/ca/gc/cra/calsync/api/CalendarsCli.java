package ca.gc.cra.calsync.api;

import ca.gc.cra.calsync.application.port.CalendarStoreException;
import ca.gc.cra.calsync.application.sync.EventSource;
import ca.gc.cra.calsync.config.SyncConfig;
import ca.gc.cra.calsync.infrastructure.store.json.JsonCalendarStore;
import ca.gc.cra.calsync.logging.LoggingConfigurator;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for {@code calsync calendars}: prints the calendar names held by the store.
 *
 * @since 0.1.0
 */
public final class CalendarsCli {
  private static final Logger log = LoggerFactory.getLogger(CalendarsCli.class);
  private static final String MODE = "calendars";
  private static final String SUMMARY_USAGE = "usage: calendars [store=PATH] [config=PATH] [--force-refresh]";
  private static final String HELP_TEXT = """
      calsync calendars

      Usage:
        calendars [store=PATH] [config=PATH]

      Options:
        store=PATH        JSON calendar store (default ~/.calsync/calendars.json)
        config=PATH       YAML file with common/calendars sections
        --force-refresh   Ask the store to refresh its sources before listing
        --verbose         Enable DEBUG logging
        --help            Show this message
      """;

  private CalendarsCli() {}

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
   * Lists calendars and returns a normalized exit code.
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
    }

    Path storePath;
    try {
      Map<String, String> kv = new LinkedHashMap<>(CliArgsParser.toMap(input.keyValueArgs()));
      ConfigCliUtils.applyFlags(input, Map.of("--force-refresh", "forceRefresh"), kv);
      Map<String, String> effective = ConfigCliUtils.effectiveConfig(MODE, kv, log::warn);
      storePath = SyncConfig.storePath(effective);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    } catch (IOException ex) {
      log.error("Unable to read configuration file", ex);
      return ExitCode.IO_ERROR;
    }

    EventSource source = new EventSource(new JsonCalendarStore(storePath));
    if (input.hasFlag("--force-refresh")) {
      source.forceRefresh();
    }
    try {
      List<String> names = new ArrayList<>(source.listCalendars());
      if (names.isEmpty()) {
        CliPrinter.println("No calendars found in " + storePath);
      } else {
        CliPrinter.printLines(names);
      }
      return ExitCode.SUCCESS;
    } catch (CalendarStoreException ex) {
      log.error("Calendar store failure: {}", ex.getMessage(), ex);
      return ExitCode.IO_ERROR;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure listing calendars", ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }
}
