package org.prism.config;

import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.prism.application.pipeline.ErrorPolicy;
import org.prism.infrastructure.markup.FileSystemDocumentSource;

/**
 * <strong>What:</strong> Immutable settings for {@code prism aggregate}.
 * <p><strong>Role:</strong> Built from the merged configuration map; consumed by the CLI and
 * {@link CompositionRoot}.</p>
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * @param inputDirectory directory holding the case documents
 * @param outputFile combined discussion JSON file
 * @param jsonlDirectory optional directory receiving one {@code <stem>.jsonl} per document
 * @param extension document extension without the dot, lower case
 * @param errorPolicy per-document failure handling
 * @param labels raw color-to-label entries, validated later by {@link org.prism.domain.color.LabelMapValidator}
 * @since 0.1.0
 */
public record AggregateConfig(
    Path inputDirectory,
    Path outputFile,
    Optional<Path> jsonlDirectory,
    String extension,
    ErrorPolicy errorPolicy,
    Map<String, String> labels) {

  /**
   * Normalizes paths and the extension, and freezes the label entries.
   */
  public AggregateConfig {
    inputDirectory = Objects.requireNonNull(inputDirectory, "inputDirectory").toAbsolutePath().normalize();
    outputFile = Objects.requireNonNull(outputFile, "outputFile").toAbsolutePath().normalize();
    jsonlDirectory = jsonlDirectory == null
        ? Optional.empty()
        : jsonlDirectory.map(p -> p.toAbsolutePath().normalize());
    extension = FileSystemDocumentSource.normalizeExtension(extension);
    errorPolicy = Objects.requireNonNull(errorPolicy, "errorPolicy");
    labels = Map.copyOf(Objects.requireNonNull(labels, "labels"));
  }

  /**
   * Baseline settings. {@code in} has no meaningful default and must always be configured.
   *
   * @return default aggregate configuration
   */
  public static AggregateConfig defaults() {
    return new AggregateConfig(
        Path.of("."),
        Path.of("discussions.json"),
        Optional.empty(),
        "rtf",
        ErrorPolicy.SKIP,
        LabelSpecs.parseCompact(DefaultsForMode.DEFAULT_LABELS));
  }

  /**
   * Builds a configuration from a merged key/value map.
   *
   * @param options merged configuration; {@code in} is required
   * @return validated configuration
   * @throws IllegalArgumentException if a value is missing or malformed
   */
  public static AggregateConfig fromMap(Map<String, String> options) {
    Objects.requireNonNull(options, "options");
    AggregateConfig defaults = defaults();

    String inRaw = options.get("in");
    if (inRaw == null || inRaw.isBlank()) {
      throw new IllegalArgumentException("in is required");
    }
    Path input = ConvertConfig.parsePath("in", inRaw);
    String outRaw = options.get("out");
    Path output = outRaw == null || outRaw.isBlank()
        ? defaults.outputFile()
        : ConvertConfig.parsePath("out", outRaw);
    String jsonlRaw = options.get("jsonlOut");
    Optional<Path> jsonl = jsonlRaw == null || jsonlRaw.isBlank()
        ? Optional.empty()
        : Optional.of(ConvertConfig.parsePath("jsonlOut", jsonlRaw));
    String extRaw = options.get("extension");
    String extension = extRaw == null || extRaw.isBlank() ? defaults.extension() : extRaw;
    String policyRaw = options.get("errorPolicy");
    ErrorPolicy policy = policyRaw == null || policyRaw.isBlank()
        ? defaults.errorPolicy()
        : ErrorPolicy.fromString(policyRaw);

    if (jsonl.isPresent() && jsonl.get().equals(input)) {
      throw new IllegalArgumentException("jsonlOut must differ from in");
    }
    return new AggregateConfig(input, output, jsonl, extension, policy, LabelSpecs.collect(options));
  }
}
