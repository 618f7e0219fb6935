package ca.gc.cra.calsync.logging;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class LogsTest {

  @AfterEach
  void resetLogging() {
    LoggingConfigurator.resetRootLevel();
  }

  @Test
  void shortValuesAreUnchanged() {
    assertEquals("Standup", Logs.truncate("Standup"));
    assertEquals("<null>", Logs.truncate(null));
  }

  @Test
  void longValuesAreCutAtByteBudget() {
    String truncated = Logs.truncate("x".repeat(100));

    assertTrue(truncated.startsWith("x".repeat(Logs.DEFAULT_MAX_BYTES) + "... (truncated, 80 of 100 bytes)"));
  }

  @Test
  void multiByteCharactersAreNotSplit() {
    String truncated = Logs.truncate("ééé", 3);

    assertEquals("é... (truncated, 3 of 6 bytes)", truncated);
  }

  @Test
  void nonPositiveBudgetIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> Logs.truncate("abc", 0));
  }

  @Test
  void verboseLoggingSwitchesRootToDebug() {
    Logger root = (Logger) LoggerFactory.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);

    LoggingConfigurator.enableVerboseLogging();
    assertEquals(Level.DEBUG, root.getLevel());

    LoggingConfigurator.resetRootLevel();
    assertEquals(Level.INFO, root.getLevel());
  }
}
