package org.prism.config;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Merges configuration from defaults, YAML, and CLI sources while enforcing precedence and invariants.
 *
 * <p>Label entries are replaced as a whole rather than merged key by key: a CLI {@code labels=} value discards
 * every {@code labels.<color>} key from YAML, and per-color keys from YAML or the CLI discard the default
 * compact map.</p>
 */
public final class ConfigMerger {

  private ConfigMerger() {}

  /**
   * Builds an effective configuration map using precedence CLI &gt; YAML &gt; defaults.
   *
   * @param mode active command
   * @param yaml optional YAML-derived settings for the command
   * @param cli CLI key/value overrides (may be empty)
   * @param defaults embedded defaults for the command
   * @param warn consumer invoked when a CLI key overrides a YAML key
   * @return immutable merged configuration map
   * @throws IllegalArgumentException when validation fails
   */
  public static Map<String, String> buildEffectiveConfig(
      String mode,
      Optional<Map<String, String>> yaml,
      Map<String, String> cli,
      Map<String, String> defaults,
      Consumer<String> warn) {
    Objects.requireNonNull(mode, "mode");
    Objects.requireNonNull(yaml, "yaml");
    Map<String, String> defaultsCopy = defaults == null ? Map.of() : defaults;
    Map<String, String> yamlCopy = yaml.orElse(Map.of());
    Map<String, String> cliCopy = cli == null ? Map.of() : cli;

    Map<String, String> merged = new LinkedHashMap<>(defaultsCopy);
    merged.putAll(yamlCopy);

    boolean compactFromYaml = yamlCopy.containsKey(LabelSpecs.KEY);
    boolean compactFromCli = cliCopy.containsKey(LabelSpecs.KEY);
    if (compactFromCli) {
      merged.keySet().removeIf(key -> key.startsWith(LabelSpecs.PREFIX));
    } else if (!compactFromYaml
        && (LabelSpecs.hasPerColorKeys(yamlCopy) || LabelSpecs.hasPerColorKeys(cliCopy))) {
      merged.remove(LabelSpecs.KEY);
    }

    for (Map.Entry<String, String> entry : cliCopy.entrySet()) {
      String key = entry.getKey();
      if (key == null) {
        continue;
      }
      String value = entry.getValue();
      if (yamlCopy.containsKey(key) && warn != null) {
        warn.accept("CLI overrides YAML for key: " + key);
      }
      if (value != null) {
        merged.put(key, value);
      }
    }

    validate(mode, merged);
    return Map.copyOf(merged);
  }

  private static void validate(String mode, Map<String, String> effective) {
    if ("aggregate".equalsIgnoreCase(mode)) {
      String in = trim(effective.get("in"));
      String jsonlOut = trim(effective.get("jsonlOut"));
      if (!in.isEmpty() && in.equals(jsonlOut)) {
        throw new IllegalArgumentException("jsonlOut must not be the input directory");
      }
    }
    if ("convert".equalsIgnoreCase(mode)) {
      String in = trim(effective.get("in"));
      if (!in.isEmpty() && in.equals(trim(effective.get("out")))) {
        throw new IllegalArgumentException("out must not be the input document");
      }
    }
  }

  private static String trim(String value) {
    return value == null ? "" : value.trim();
  }
}
