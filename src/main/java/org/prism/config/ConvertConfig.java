package org.prism.config;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.prism.validation.Strings;

/**
 * <strong>What:</strong> Immutable settings for {@code prism convert}, which turns one document into a transcript.
 * <p><strong>Role:</strong> Built from the merged configuration map; consumed by the CLI and
 * {@link CompositionRoot}.</p>
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * @param inputFile document to convert
 * @param outputFile transcript destination; empty writes to stdout
 * @param format transcript encoding
 * @param labels raw color-to-label entries, validated later by {@link org.prism.domain.color.LabelMapValidator}
 * @since 0.1.0
 */
public record ConvertConfig(
    Path inputFile,
    Optional<Path> outputFile,
    OutputFormat format,
    Map<String, String> labels) {

  /**
   * Normalizes paths and freezes the label entries.
   */
  public ConvertConfig {
    inputFile = Objects.requireNonNull(inputFile, "inputFile").toAbsolutePath().normalize();
    outputFile = outputFile == null ? Optional.empty() : outputFile.map(p -> p.toAbsolutePath().normalize());
    format = Objects.requireNonNull(format, "format");
    labels = Map.copyOf(Objects.requireNonNull(labels, "labels"));
  }

  /**
   * Baseline settings; the input path is a placeholder that every invocation overrides.
   *
   * @return default convert configuration
   */
  public static ConvertConfig defaults() {
    return new ConvertConfig(
        Path.of("transcript.rtf"),
        Optional.empty(),
        OutputFormat.NDJSON,
        LabelSpecs.parseCompact(DefaultsForMode.DEFAULT_LABELS));
  }

  /**
   * Builds a configuration from a merged key/value map.
   *
   * @param options merged configuration; {@code in} is required
   * @return validated configuration
   * @throws IllegalArgumentException if a value is missing or malformed
   */
  public static ConvertConfig fromMap(Map<String, String> options) {
    Objects.requireNonNull(options, "options");
    ConvertConfig defaults = defaults();

    String inRaw = options.get("in");
    if (inRaw == null || inRaw.isBlank()) {
      throw new IllegalArgumentException("in is required");
    }
    Path input = parsePath("in", inRaw);
    Optional<Path> output = optionalPath("out", options.get("out"));
    String formatRaw = options.get("format");
    OutputFormat format = formatRaw == null || formatRaw.isBlank()
        ? defaults.format()
        : OutputFormat.fromString(formatRaw);
    return new ConvertConfig(input, output, format, LabelSpecs.collect(options));
  }

  private static Optional<Path> optionalPath(String name, String value) {
    if (value == null || value.isBlank()) {
      return Optional.empty();
    }
    return Optional.of(parsePath(name, value));
  }

  static Path parsePath(String name, String value) {
    try {
      return Path.of(Strings.requireNonBlank(name, value).trim()).toAbsolutePath().normalize();
    } catch (InvalidPathException ex) {
      throw new IllegalArgumentException(name + " is not a valid path: " + value, ex);
    }
  }
}
