package org.prism.api;

import java.io.PrintWriter;
import java.io.StringWriter;
import org.prism.logging.LoggingConfigurator;

/**
 * Captures {@link CliPrinter} output and restores global state touched by CLI runs.
 */
final class CliTestSupport implements AutoCloseable {
  private final StringWriter buffer = new StringWriter();
  private final String rootLevel = LoggingConfigurator.rootLevel();
  private final String exporterProperty = System.getProperty("otel.metrics.exporter");

  CliTestSupport() {
    CliPrinter.setWriterForTesting(new PrintWriter(buffer, true));
  }

  String output() {
    CliPrinter.writer().flush();
    return buffer.toString();
  }

  @Override
  public void close() {
    CliPrinter.clearTestWriter();
    LoggingConfigurator.restoreRootLevel(rootLevel);
    if (exporterProperty == null) {
      System.clearProperty("otel.metrics.exporter");
    } else {
      System.setProperty("otel.metrics.exporter", exporterProperty);
    }
  }
}
