package org.prism.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.prism.testutil.Fixtures;
import org.slf4j.LoggerFactory;

class AggregateCliTest {

  @TempDir Path dir;

  private CliTestSupport cli;
  private Path cases;
  private Path out;
  private ch.qos.logback.classic.Logger logger;
  private ListAppender<ILoggingEvent> appender;

  @BeforeEach
  void setUp() throws Exception {
    cli = new CliTestSupport();
    cases = dir.resolve("cases");
    Fixtures.copy(Fixtures.MEGAN, cases);
    Fixtures.copy(Fixtures.TAMARA, cases);
    out = dir.resolve("result/discussions.json");
    logger = (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(AggregateCli.class);
    appender = new ListAppender<>();
    appender.start();
    logger.addAppender(appender);
    logger.setAdditive(false);
  }

  @AfterEach
  void tearDown() {
    logger.detachAppender(appender);
    logger.setAdditive(true);
    cli.close();
  }

  @Test
  void aggregatesDirectoryIntoDiscussionJson() throws Exception {
    Path jsonl = dir.resolve("jsonl");

    ExitCode exit = AggregateCli.run(new String[] {"in=" + cases, "out=" + out, "jsonlOut=" + jsonl});

    assertEquals(ExitCode.SUCCESS, exit);
    String json = Files.readString(out);
    assertTrue(json.indexOf("\"Megan\"") < json.indexOf("\"Tamara\""), json);
    assertTrue(json.contains("\"denial\""), json);
    assertTrue(Files.exists(jsonl.resolve("meganDenial.jsonl")));
    assertEquals(5, Files.readAllLines(jsonl.resolve("tamaraDenial.jsonl")).size());
  }

  @Test
  void skippedDocumentsYieldPartialSuccess() throws Exception {
    Files.writeString(cases.resolve("adamDenial.rtf"), "{\\rtf1 plain}");

    ExitCode exit = AggregateCli.run(new String[] {"in=" + cases, "out=" + out});

    assertEquals(ExitCode.PARTIAL_SUCCESS, exit);
    assertTrue(Files.exists(out));
    assertTrue(appender.list.stream().anyMatch(e -> e.getLevel() == Level.WARN
        && e.getFormattedMessage().contains("1 skipped document")));
  }

  @Test
  void failFastAbortsWithDocumentFailure() throws Exception {
    Files.writeString(cases.resolve("adamDenial.rtf"), "{\\rtf1 plain}");

    ExitCode exit = AggregateCli.run(new String[] {"in=" + cases, "out=" + out, "errorPolicy=FAIL_FAST"});

    assertEquals(ExitCode.DOCUMENT_FAILURE, exit);
    assertFalse(Files.exists(out));
  }

  @Test
  void dryRunReportsPlanWithoutWriting() {
    ExitCode exit = AggregateCli.run(new String[] {"in=" + cases, "out=" + out, "--dry-run"});

    assertEquals(ExitCode.SUCCESS, exit);
    String printed = cli.output();
    assertTrue(printed.startsWith("Aggregate dry-run: no files will be produced."), printed);
    assertTrue(printed.contains("Documents matched : 2"), printed);
    assertFalse(Files.exists(out));
  }

  @Test
  void rejectsMissingInputDirectory() {
    ExitCode exit = AggregateCli.run(new String[] {"in=" + dir.resolve("absent")});

    assertEquals(ExitCode.INVALID_ARGS, exit);
    assertTrue(cli.output().startsWith("usage: aggregate"));
    assertTrue(appender.list.stream().anyMatch(e -> e.getLevel() == Level.ERROR));
  }

  @Test
  void invalidLabelMapLeavesNothingOnDisk() {
    Path jsonl = dir.resolve("jsonl");

    ExitCode exit = AggregateCli.run(
        new String[] {"in=" + cases, "out=" + out, "jsonlOut=" + jsonl, "labels=purple=Expert"});

    assertEquals(ExitCode.INVALID_ARGS, exit);
    assertFalse(Files.exists(jsonl));
    assertFalse(Files.exists(out.getParent()));
  }

  @Test
  void rejectsOutputThatWouldBeReadAsInput() {
    ExitCode exit = AggregateCli.run(new String[] {
        "in=" + cases, "out=" + cases.resolve("all.rtf")});
    assertEquals(ExitCode.INVALID_ARGS, exit);
  }

  @Test
  void helpListsExitCodes() {
    assertEquals(ExitCode.SUCCESS, AggregateCli.run(new String[] {"--help"}));
    assertTrue(cli.output().contains("Exit codes:"));
  }
}
