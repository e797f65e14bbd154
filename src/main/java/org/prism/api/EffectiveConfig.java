package org.prism.api;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import org.prism.config.ConfigMerger;
import org.prism.config.DefaultsForMode;
import org.prism.config.YamlConfigLoader;
import org.slf4j.Logger;

/**
 * Resolves the effective configuration map for one command: CLI {@code key=value} pairs over the optional
 * {@code config=} YAML file over {@link DefaultsForMode}.
 *
 * <p>Failures are logged and reported as an {@link ExitCode}; the usage line is printed for argument errors.</p>
 */
final class EffectiveConfig {
  private final Map<String, String> values;
  private final ExitCode failure;

  private EffectiveConfig(Map<String, String> values, ExitCode failure) {
    this.values = values;
    this.failure = failure;
  }

  static EffectiveConfig resolve(String mode, CliInput input, String usage, Logger log) {
    Map<String, String> kv;
    try {
      kv = new LinkedHashMap<>(CliArgsParser.toMap(input.keyValueArgs()));
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(usage);
      return failed(ExitCode.INVALID_ARGS);
    }

    String configPath = ConfigCliUtils.extractConfigPath(kv);
    Optional<Map<String, String>> yamlConfig = Optional.empty();
    if (configPath != null) {
      Path yamlPath = Path.of(configPath);
      if (!Files.exists(yamlPath)) {
        log.error("Configuration file does not exist: {}", yamlPath);
        CliPrinter.println(usage);
        return failed(ExitCode.INVALID_ARGS);
      }
      try {
        yamlConfig = YamlConfigLoader.load(yamlPath, mode);
      } catch (IllegalArgumentException ex) {
        log.error("Invalid YAML configuration: {}", ex.getMessage());
        return failed(ExitCode.CONFIG_ERROR);
      } catch (IOException ex) {
        log.error("Unable to read configuration file {}", yamlPath, ex);
        return failed(ExitCode.IO_ERROR);
      }
    }

    try {
      Map<String, String> merged = ConfigMerger.buildEffectiveConfig(
          mode, yamlConfig, kv, DefaultsForMode.asFlatMap(mode), log::warn);
      return new EffectiveConfig(new LinkedHashMap<>(merged), null);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid {} arguments: {}", mode, ex.getMessage());
      CliPrinter.println(usage);
      return failed(ExitCode.INVALID_ARGS);
    }
  }

  private static EffectiveConfig failed(ExitCode code) {
    return new EffectiveConfig(Map.of(), code);
  }

  boolean ok() {
    return failure == null;
  }

  ExitCode failure() {
    return failure;
  }

  /**
   * Returns the mutable merged map; telemetry keys are removed from it by {@link TelemetryConfigurator}.
   */
  Map<String, String> values() {
    return values;
  }

  boolean flag(CliInput input, String flag, String key) {
    return input.hasFlag(flag) || ConfigCliUtils.parseBoolean(values, key);
  }
}
