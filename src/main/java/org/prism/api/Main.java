package org.prism.api;

import java.util.Arrays;
import java.util.Locale;
import org.prism.logging.LoggingConfigurator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * PRISM CLI dispatcher that routes to subcommands.
 *
 * @since 0.1.0
 */
public final class Main {
  private static final Logger log = LoggerFactory.getLogger(Main.class);
  private static final String SUMMARY_USAGE =
      "usage: prism <convert|aggregate|validate-labels> [options]";
  private static final String HELP_TEXT = """
      PRISM command dispatcher

      Usage:
        prism <command> [options]

      Commands:
        convert          Convert one color-coded RTF document into a labeled transcript
        aggregate        Aggregate a directory of case documents into one discussion JSON file
        validate-labels  Check a color-to-label map without reading documents

      Global flags:
        --help      Show this message
        --verbose   Enable DEBUG logging before dispatching to subcommand
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
   * @param args dispatcher arguments (first token is the subcommand)
   * @return exit code reported by the delegated CLI
   */
  static ExitCode run(String[] args) {
    if (args == null || args.length == 0) {
      log.error("Missing command");
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    String first = args[0] == null ? "" : args[0].trim().toLowerCase(Locale.ROOT);
    String[] delegateArgs = Arrays.copyOfRange(args, 1, args.length);

    return switch (first) {
      case "convert" -> ConvertCli.run(delegateArgs);
      case "aggregate" -> AggregateCli.run(delegateArgs);
      case "validate-labels" -> LabelsCli.run(delegateArgs);
      default -> dispatchFlags(args, first);
    };
  }

  private static ExitCode dispatchFlags(String[] args, String command) {
    CliInput input = CliInput.parse(args);
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for dispatcher");
      String[] remainder = Arrays.stream(args)
          .filter(arg -> arg != null && !isVerboseFlag(arg))
          .toArray(String[]::new);
      if (remainder.length > 0 && remainder.length < args.length) {
        return run(remainder);
      }
    }
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    log.error("Unknown command: {}", command);
    CliPrinter.println(SUMMARY_USAGE);
    return ExitCode.INVALID_ARGS;
  }

  private static boolean isVerboseFlag(String arg) {
    String lower = arg.trim().toLowerCase(Locale.ROOT);
    return lower.equals("--verbose") || lower.equals("-v") || lower.equals("--debug");
  }
}
