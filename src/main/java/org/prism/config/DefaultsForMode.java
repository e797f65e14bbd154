package org.prism.config;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Supplies flattened default configuration maps for each PRISM command.
 *
 * <p>The defaults are the single source of truth for optional YAML keys. The default {@code labels} entry is the
 * two-speaker map used for expert/AI training dialogues.</p>
 */
public final class DefaultsForMode {
  /** Label map applied when neither YAML nor the CLI configures one. */
  public static final String DEFAULT_LABELS = "RGB(74,21,148)=Expert;RGB(11,93,162)=AI";

  private static final Map<String, String> COMMON_DEFAULTS = buildCommonDefaults();

  private DefaultsForMode() {}

  /**
   * Returns a flattened map of defaults for the requested command merged with common defaults.
   *
   * @param mode target command (convert, aggregate, validate-labels)
   * @return unmodifiable map of default key/value pairs as strings
   * @throws IllegalArgumentException if {@code mode} is unknown
   */
  public static Map<String, String> asFlatMap(String mode) {
    Objects.requireNonNull(mode, "mode");
    String normalized = mode.trim().toLowerCase(Locale.ROOT);
    Map<String, String> defaults = new LinkedHashMap<>(COMMON_DEFAULTS);
    defaults.putAll(switch (normalized) {
      case "convert" -> buildConvertDefaults();
      case "aggregate" -> buildAggregateDefaults();
      case "validate-labels" -> Map.of();
      default -> throw new IllegalArgumentException("Unsupported mode: " + mode);
    });
    return Map.copyOf(defaults);
  }

  private static Map<String, String> buildCommonDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("metricsExporter", "none");
    map.put("otelEndpoint", "");
    map.put("otelResourceAttributes", "");
    map.put("verbose", "false");
    map.put(LabelSpecs.KEY, DEFAULT_LABELS);
    return Map.copyOf(map);
  }

  private static Map<String, String> buildConvertDefaults() {
    ConvertConfig defaults = ConvertConfig.defaults();
    Map<String, String> map = new LinkedHashMap<>();
    map.put("in", "");
    map.put("out", "");
    map.put("format", defaults.format().name().toLowerCase(Locale.ROOT));
    map.put("allowOverwrite", "false");
    map.put("dryRun", "false");
    return map;
  }

  private static Map<String, String> buildAggregateDefaults() {
    AggregateConfig defaults = AggregateConfig.defaults();
    Map<String, String> map = new LinkedHashMap<>();
    map.put("in", "");
    map.put("out", defaults.outputFile().toString());
    map.put("jsonlOut", "");
    map.put("extension", defaults.extension());
    map.put("errorPolicy", defaults.errorPolicy().name());
    map.put("allowOverwrite", "false");
    map.put("dryRun", "false");
    return map;
  }
}
