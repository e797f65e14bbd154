package org.prism.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class MainTest {
  private CliTestSupport cli;

  @BeforeEach
  void setUp() {
    cli = new CliTestSupport();
  }

  @AfterEach
  void tearDown() {
    cli.close();
  }

  @Test
  void missingCommandPrintsUsage() {
    assertEquals(ExitCode.INVALID_ARGS, Main.run(new String[0]));
    assertTrue(cli.output().startsWith("usage: prism"));
  }

  @Test
  void unknownCommandIsRejected() {
    assertEquals(ExitCode.INVALID_ARGS, Main.run(new String[] {"capture"}));
  }

  @Test
  void helpIsPrinted() {
    assertEquals(ExitCode.SUCCESS, Main.run(new String[] {"--help"}));
    assertTrue(cli.output().startsWith("PRISM command dispatcher"));
  }

  @Test
  void dispatchesToSubcommandsAfterGlobalVerbose() {
    assertEquals(ExitCode.SUCCESS, Main.run(new String[] {"--verbose", "validate-labels"}));
    assertTrue(cli.output().startsWith("Label map is valid"));
  }
}
