package ca.gc.cra.calsync.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class MainTest {
  @TempDir Path tempDir;

  private StringWriter buffer;

  @BeforeEach
  void setUp() {
    buffer = new StringWriter();
    CliPrinter.setWriterForTesting(new PrintWriter(buffer));
  }

  @AfterEach
  void tearDown() {
    CliPrinter.clearTestWriter();
  }

  @Test
  void noCommandPrintsUsage() {
    assertEquals(ExitCode.INVALID_ARGS, Main.run(new String[0]));
    assertTrue(buffer.toString().contains("usage: calsync"));
  }

  @Test
  void helpListsCommands() {
    assertEquals(ExitCode.SUCCESS, Main.run(new String[] {"--help"}));
    assertTrue(buffer.toString().contains("calendars"));
  }

  @Test
  void unknownCommandIsRejected() {
    assertEquals(ExitCode.INVALID_ARGS, Main.run(new String[] {"capture"}));
  }

  @Test
  void calendarsCommandListsStoreCalendars() throws Exception {
    Path store = tempDir.resolve("calendars.json");
    Files.writeString(store, "{\"calendars\":[{\"name\":\"Work\"},{\"name\":\"Home\"}]}", StandardCharsets.UTF_8);

    ExitCode code = Main.run(new String[] {"calendars", "store=" + store});

    assertEquals(ExitCode.SUCCESS, code);
    String output = buffer.toString();
    assertTrue(output.contains("Work"));
    assertTrue(output.contains("Home"));
  }

  @Test
  void calendarsCommandReportsEmptyStore() {
    ExitCode code = Main.run(new String[] {"calendars", "store=" + tempDir.resolve("missing.json")});

    assertEquals(ExitCode.SUCCESS, code);
    assertTrue(buffer.toString().contains("No calendars found"));
  }

  @Test
  void calendarsCommandFailsOnCorruptStore() throws Exception {
    Path store = tempDir.resolve("calendars.json");
    Files.writeString(store, "not json", StandardCharsets.UTF_8);

    assertEquals(ExitCode.IO_ERROR, Main.run(new String[] {"calendars", "store=" + store}));
  }

  @Test
  void syncCommandIsDelegated() {
    assertEquals(ExitCode.INVALID_ARGS, Main.run(new String[] {"sync", "days=1"}));
    assertTrue(buffer.toString().contains("usage: sync"));
  }
}
