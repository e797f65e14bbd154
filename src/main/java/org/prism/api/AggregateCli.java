package org.prism.api;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.prism.application.pipeline.DocumentProcessingException;
import org.prism.application.port.MetricsPort;
import org.prism.config.AggregateConfig;
import org.prism.config.CompositionRoot;
import org.prism.domain.color.LabelMap;
import org.prism.domain.color.LabelMapValidator;
import org.prism.domain.error.InvalidLabelMapException;
import org.prism.domain.transcript.DiscussionSet;
import org.prism.logging.LoggingConfigurator;
import org.prism.validation.Paths;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for aggregating a directory of case documents into one discussion JSON file.
 *
 * @since 0.1.0
 */
public final class AggregateCli {
  private static final Logger log = LoggerFactory.getLogger(AggregateCli.class);
  private static final Set<String> KNOWN_FLAGS = Set.of("--dry-run", "--allow-overwrite");
  private static final String SUMMARY_USAGE =
      "usage: aggregate in=DIR [out=FILE] [jsonlOut=DIR] [extension=rtf] [errorPolicy=SKIP|FAIL_FAST] "
          + "[labels=COLOR=Label;...] [config=YAML] [--dry-run] [--allow-overwrite] "
          + "[metricsExporter=otlp|none] [otelEndpoint=URL] [otelResourceAttributes=K=V,...]";
  private static final String HELP_TEXT = """
      PRISM aggregate

      Usage:
        aggregate in=./cases out=./discussions.json [options]

      Required:
        in=DIR                   Directory of <clientName><Category>.rtf documents

      Optional (validated):
        out=FILE                 Combined discussion JSON (default ./discussions.json)
        jsonlOut=DIR             Also write one <stem>.jsonl transcript per document
        extension=EXT            Document extension to match (default rtf)
        errorPolicy=SKIP|FAIL_FAST  SKIP logs and omits failing documents (default); FAIL_FAST aborts
        labels=COLOR=Label;...   Color map, e.g. RGB(74,21,148)=Expert;#0B5DA2=AI
                                 (default RGB(74,21,148)=Expert;RGB(11,93,162)=AI)
        labels.COLOR=Label       Add one color mapping instead of the default map
        config=PATH              YAML file with common/aggregate sections
        --dry-run                Validate inputs and print plan without aggregating
        --allow-overwrite        Permit replacing out and reusing a non-empty jsonlOut
        metricsExporter=otlp|none  Configure metrics exporter (default none)
        otelEndpoint=URL           OTLP metrics endpoint when exporter=otlp
        otelResourceAttributes=K=V Comma-separated OTel resource attributes
        --verbose                Enable DEBUG logging
        --help                   Show this message

      Exit codes:
        0 success, 2 invalid arguments or labels, 3 I/O failure, 4 bad YAML,
        6 document failure under FAIL_FAST, 7 completed with skipped documents
      """;

  private AggregateCli() {}

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
   * Executes the aggregate CLI logic using structured logging and exit codes.
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
      log.debug("Verbose logging enabled for aggregate CLI");
    }
    List<String> unknown = input.unknownFlags(KNOWN_FLAGS);
    if (!unknown.isEmpty()) {
      log.error("Unknown flag(s): {}", unknown);
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    EffectiveConfig effective = EffectiveConfig.resolve("aggregate", input, SUMMARY_USAGE, log);
    if (!effective.ok()) {
      return effective.failure();
    }
    boolean dryRun = effective.flag(input, "--dry-run", "dryRun");
    boolean allowOverwrite = effective.flag(input, "--allow-overwrite", "allowOverwrite");

    Map<String, String> configInputs = effective.values();
    String metricsExporter = configInputs.getOrDefault("metricsExporter", "none");
    AggregateConfig config;
    ValidatedPaths validated;
    LabelMap labels;
    try {
      TelemetryConfigurator.configureMetrics(configInputs);
      config = AggregateConfig.fromMap(configInputs);
      labels = LabelMapValidator.validate(config.labels());
      validated = validatePaths(config, allowOverwrite, !dryRun);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid aggregate arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    } catch (InvalidLabelMapException ex) {
      log.error("Invalid label map: {}", ex.getMessage());
      return ExitCode.INVALID_ARGS;
    }

    if (dryRun) {
      return printDryRunPlan(config, validated, labels, allowOverwrite);
    }

    try (CompositionRoot root = new CompositionRoot()) {
      log.info(
          "Configured aggregate pipeline: input={}, output={}, jsonlOut={}, errorPolicy={}, metricsExporter={}",
          validated.input(),
          validated.output(),
          validated.jsonl().map(Path::toString).orElse("<none>"),
          config.errorPolicy(),
          metricsExporter);
      DiscussionSet result = root.aggregateUseCase().aggregate(
          validated.input(),
          config.extension(),
          labels,
          config.errorPolicy(),
          root.perDocumentSink(config),
          root.discussionSink(config));
      if (result.hasSkipped()) {
        log.warn("Aggregate completed with {} skipped document(s); see warnings above",
            result.skipped().size());
        return ExitCode.PARTIAL_SUCCESS;
      }
      log.info("Aggregate completed for input {}", validated.input());
      return ExitCode.SUCCESS;
    } catch (DocumentProcessingException ex) {
      log.error("Aggregate aborted: {}", ex.getMessage(), ex.getCause());
      return ExitCode.DOCUMENT_FAILURE;
    } catch (IOException ex) {
      log.error("Aggregate I/O failure while processing {}", validated.input(), ex);
      return ExitCode.IO_ERROR;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure in aggregate pipeline", ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }

  private static ValidatedPaths validatePaths(
      AggregateConfig config, boolean allowOverwrite, boolean createIfMissing) {
    Path input = Paths.requireReadableDirectory("in", config.inputDirectory());
    Path output = Paths.validateOutputFile("out", config.outputFile(), allowOverwrite);
    if (output.startsWith(input) && output.getFileName().toString().toLowerCase(Locale.ROOT)
        .endsWith("." + config.extension())) {
      throw new IllegalArgumentException("out would be picked up as an input document: " + output);
    }
    Optional<Path> jsonl = config.jsonlDirectory().map(dir -> {
      if (!createIfMissing && !Files.exists(dir)) {
        return dir;
      }
      return Paths.validateWritableDir("jsonlOut", dir, createIfMissing, allowOverwrite);
    });
    return new ValidatedPaths(input, output, jsonl);
  }

  private static ExitCode printDryRunPlan(
      AggregateConfig config, ValidatedPaths paths, LabelMap labels, boolean allowOverwrite) {
    int matched;
    try (CompositionRoot root = new CompositionRoot(MetricsPort.NO_OP)) {
      matched = root.documentSource().list(paths.input(), config.extension()).size();
    } catch (IOException ex) {
      log.error("Unable to list {}", paths.input(), ex);
      return ExitCode.IO_ERROR;
    }
    CliPrinter.printLines(
        "Aggregate dry-run: no files will be produced.",
        " Input directory   : " + paths.input(),
        " Extension         : ." + config.extension(),
        " Documents matched : " + matched,
        " Output file       : " + paths.output(),
        " JSONL directory   : " + paths.jsonl().map(Path::toString).orElse("<none>"),
        " Error policy      : " + config.errorPolicy(),
        " Labels            : " + labels,
        " Allow overwrite   : " + allowOverwrite,
        " Re-run without --dry-run to aggregate documents.");
    return ExitCode.SUCCESS;
  }

  private record ValidatedPaths(Path input, Path output, Optional<Path> jsonl) {}
}
