package org.prism.api;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.prism.application.port.TranscriptPersistencePort;
import org.prism.config.CompositionRoot;
import org.prism.config.ConvertConfig;
import org.prism.domain.color.LabelMap;
import org.prism.domain.color.LabelMapValidator;
import org.prism.domain.error.InvalidLabelMapException;
import org.prism.domain.error.TranscriptException;
import org.prism.domain.transcript.Transcript;
import org.prism.logging.LoggingConfigurator;
import org.prism.validation.Paths;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for converting a single color-coded document into a labeled transcript.
 *
 * @since 0.1.0
 */
public final class ConvertCli {
  private static final Logger log = LoggerFactory.getLogger(ConvertCli.class);
  private static final Set<String> KNOWN_FLAGS = Set.of("--dry-run", "--allow-overwrite");
  private static final String SUMMARY_USAGE =
      "usage: convert in=FILE [out=FILE] [format=ndjson|script] [labels=COLOR=Label;...] "
          + "[config=YAML] [--dry-run] [--allow-overwrite] [metricsExporter=otlp|none]";
  private static final String HELP_TEXT = """
      PRISM convert

      Usage:
        convert in=./meganDenial.rtf [options]

      Required:
        in=FILE                  Color-coded RTF document

      Optional:
        out=FILE                 Transcript destination (default: stdout)
        format=ndjson|script     ndjson writes {"Label":"text"} per line; script writes "Label: text"
        labels=COLOR=Label;...   Color map, e.g. RGB(74,21,148)=Expert;#0B5DA2=AI
                                 (default RGB(74,21,148)=Expert;RGB(11,93,162)=AI; labels= for none)
        labels.COLOR=Label       Add one color mapping instead of the default map
        config=PATH              YAML file with common/convert sections
        --dry-run                Validate inputs and print plan without converting
        --allow-overwrite        Permit replacing an existing out file
        metricsExporter=otlp|none  Configure metrics exporter (default none)
        otelEndpoint=URL           OTLP metrics endpoint when exporter=otlp
        otelResourceAttributes=K=V Comma-separated OTel resource attributes
        --verbose                Enable DEBUG logging
        --help                   Show this message
      """;

  private ConvertCli() {}

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
   * Executes the convert CLI logic using structured logging and exit codes.
   *
   * @param args raw CLI arguments
   * @return exit code capturing the outcome
   */
  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for convert CLI");
    }
    List<String> unknown = input.unknownFlags(KNOWN_FLAGS);
    if (!unknown.isEmpty()) {
      log.error("Unknown flag(s): {}", unknown);
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    EffectiveConfig effective = EffectiveConfig.resolve("convert", input, SUMMARY_USAGE, log);
    if (!effective.ok()) {
      return effective.failure();
    }
    boolean dryRun = effective.flag(input, "--dry-run", "dryRun");
    boolean allowOverwrite = effective.flag(input, "--allow-overwrite", "allowOverwrite");

    Map<String, String> configInputs = effective.values();
    ConvertConfig config;
    Path document;
    Path output;
    LabelMap labels;
    try {
      TelemetryConfigurator.configureMetrics(configInputs);
      config = ConvertConfig.fromMap(configInputs);
      labels = LabelMapValidator.validate(config.labels());
      document = Paths.requireReadableFile("in", config.inputFile());
      output = config.outputFile()
          .map(path -> Paths.validateOutputFile("out", path, allowOverwrite))
          .orElse(null);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid convert arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    } catch (InvalidLabelMapException ex) {
      log.error("Invalid label map: {}", ex.getMessage());
      return ExitCode.INVALID_ARGS;
    }

    if (dryRun) {
      CliPrinter.printLines(
          "Convert dry-run: no transcript will be produced.",
          " Input document    : " + document,
          " Output            : " + (output == null ? "<stdout>" : output),
          " Format            : " + config.format(),
          " Labels            : " + labels,
          " Allow overwrite   : " + allowOverwrite,
          " Re-run without --dry-run to convert.");
      return ExitCode.SUCCESS;
    }

    try (CompositionRoot root = new CompositionRoot()) {
      TranscriptPersistencePort sink = root.transcriptSink(config, CliPrinter.writer());
      Transcript transcript = root.convertUseCase().convert(document, labels, sink);
      log.info("Convert completed: {} turns from {} -> {}",
          transcript.turns().size(), document, output == null ? "<stdout>" : output);
      return ExitCode.SUCCESS;
    } catch (TranscriptException ex) {
      log.error("Unable to convert {}: {}", document, ex.getMessage());
      return ExitCode.DOCUMENT_FAILURE;
    } catch (IOException ex) {
      log.error("Convert I/O failure for {}", document, ex);
      return ExitCode.IO_ERROR;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure in convert", ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }
}
