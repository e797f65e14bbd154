package org.prism.api;

import java.util.List;
import java.util.Map;
import java.util.Set;
import org.prism.config.LabelSpecs;
import org.prism.domain.color.LabelMap;
import org.prism.domain.color.LabelMapValidator;
import org.prism.domain.color.Rgb;
import org.prism.domain.error.InvalidLabelMapException;
import org.prism.logging.LoggingConfigurator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Checks a label map without reading any document and prints the normalized colors.
 *
 * @since 0.1.0
 */
public final class LabelsCli {
  private static final Logger log = LoggerFactory.getLogger(LabelsCli.class);
  private static final String SUMMARY_USAGE =
      "usage: validate-labels [labels=COLOR=Label;...] [labels.COLOR=Label ...] [config=YAML]";
  private static final String HELP_TEXT = """
      PRISM validate-labels

      Usage:
        validate-labels labels="RGB(74,21,148)=Expert;#0B5DA2=AI"

      Resolves the label map exactly as convert and aggregate would (CLI over YAML over the default map),
      validates it, and prints one line per color. Exits 2 when any entry is invalid.

      Optional:
        labels=COLOR=Label;...   Compact color map
        labels.COLOR=Label       Single color mapping
        config=PATH              YAML file with a common labels section
        --verbose                Enable DEBUG logging
        --help                   Show this message
      """;

  private LabelsCli() {}

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
   * Validates the effective label map.
   *
   * @param args raw CLI arguments
   * @return {@link ExitCode#SUCCESS} when the map is valid
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
    List<String> unknown = input.unknownFlags(Set.of());
    if (!unknown.isEmpty()) {
      log.error("Unknown flag(s): {}", unknown);
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    EffectiveConfig effective = EffectiveConfig.resolve("validate-labels", input, SUMMARY_USAGE, log);
    if (!effective.ok()) {
      return effective.failure();
    }

    LabelMap labels;
    try {
      Map<String, String> raw = LabelSpecs.collect(effective.values());
      labels = LabelMapValidator.validate(raw);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid labels argument: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    } catch (InvalidLabelMapException ex) {
      log.error("Invalid label map: {}", ex.getMessage());
      return ExitCode.INVALID_ARGS;
    }

    if (labels.isEmpty()) {
      CliPrinter.println("Label map is empty: turns are split by color and left unlabeled.");
      return ExitCode.SUCCESS;
    }
    CliPrinter.println("Label map is valid (" + labels.size() + " colors):");
    for (Map.Entry<Rgb, String> entry : labels.asMap().entrySet()) {
      Rgb color = entry.getKey();
      CliPrinter.println(" " + color.toRgbString() + "  " + color.toHex() + "  -> '" + entry.getValue() + "'");
    }
    return ExitCode.SUCCESS;
  }
}
