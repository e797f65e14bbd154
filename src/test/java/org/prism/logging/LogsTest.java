package org.prism.logging;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class LogsTest {

  @Test
  void printableEscapesControlCharacters() {
    assertEquals("a\\nb\\tc\\u0001", Logs.printable("a\nb\tc\u0001"));
    assertEquals("plain", Logs.printable("plain"));
    assertEquals("<null>", Logs.printable(null));
  }

  @Test
  void truncateCutsOnUtf8Boundary() {
    String truncated = Logs.truncate("caf\u00E9 au lait", 4);
    assertTrue(truncated.startsWith("caf..."), truncated);
    assertEquals("short", Logs.truncate("short", 80));
    assertThrows(IllegalArgumentException.class, () -> Logs.truncate("x", 0));
  }

  @Test
  void verboseLoggingCanBeRestored() {
    String before = LoggingConfigurator.rootLevel();
    try {
      LoggingConfigurator.enableVerboseLogging();
      assertEquals("DEBUG", LoggingConfigurator.rootLevel());
    } finally {
      LoggingConfigurator.restoreRootLevel(before);
    }
    assertEquals(before, LoggingConfigurator.rootLevel());
  }
}
