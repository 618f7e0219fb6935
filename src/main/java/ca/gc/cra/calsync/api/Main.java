package ca.gc.cra.calsync.api;

import ca.gc.cra.calsync.logging.LoggingConfigurator;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * calsync CLI dispatcher that routes to subcommands.
 *
 * @since 0.1.0
 */
public final class Main {
  private static final Logger log = LoggerFactory.getLogger(Main.class);
  private static final String SUMMARY_USAGE = "usage: calsync <sync|calendars> [options]";
  private static final String HELP_TEXT = """
      calsync command dispatcher

      Usage:
        calsync <command> [options]

      Commands:
        sync        Mirror a source calendar into a destination calendar (sync --help for details)
        calendars   List the calendars of the store

      Global flags:
        --help      Show this message (or the command's help after a command)
        --verbose   Enable DEBUG logging
      """;

  private Main() {}

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
   * Dispatches a subcommand and returns its exit code without terminating the JVM.
   *
   * @param args dispatcher arguments (first non-flag token is the subcommand)
   * @return exit code reported by the delegated CLI
   */
  static ExitCode run(String[] args) {
    String[] safeArgs = args == null ? new String[0] : args;
    int commandIndex = -1;
    for (int i = 0; i < safeArgs.length; i++) {
      if (safeArgs[i] != null && !safeArgs[i].isBlank() && !safeArgs[i].trim().startsWith("-")) {
        commandIndex = i;
        break;
      }
    }
    if (commandIndex < 0) {
      CliInput input = CliInput.parse(safeArgs);
      if (input.help()) {
        CliPrinter.println(HELP_TEXT.stripTrailing());
        return ExitCode.SUCCESS;
      }
      log.error("Missing command");
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    String command = safeArgs[commandIndex].trim().toLowerCase(Locale.ROOT);
    List<String> delegate = new ArrayList<>();
    for (int i = 0; i < safeArgs.length; i++) {
      if (i != commandIndex) {
        delegate.add(safeArgs[i]);
      }
    }
    String[] delegateArgs = delegate.toArray(String[]::new);

    return switch (command) {
      case "sync" -> SyncCli.run(delegateArgs);
      case "calendars" -> CalendarsCli.run(delegateArgs);
      case "help" -> {
        CliPrinter.println(HELP_TEXT.stripTrailing());
        yield ExitCode.SUCCESS;
      }
      default -> {
        if (CliInput.parse(delegateArgs).verbose()) {
          LoggingConfigurator.enableVerboseLogging();
        }
        log.error("Unknown command: {}", command);
        CliPrinter.println(SUMMARY_USAGE);
        yield ExitCode.INVALID_ARGS;
      }
    };
  }
}
