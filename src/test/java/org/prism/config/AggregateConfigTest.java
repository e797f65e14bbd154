package org.prism.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.prism.application.pipeline.ErrorPolicy;

class AggregateConfigTest {

  @Test
  void fromMapAppliesDefaults() {
    AggregateConfig config = AggregateConfig.fromMap(Map.of("in", "cases"));

    assertEquals(Path.of("cases").toAbsolutePath().normalize(), config.inputDirectory());
    assertEquals(Path.of("discussions.json").toAbsolutePath().normalize(), config.outputFile());
    assertEquals(Optional.empty(), config.jsonlDirectory());
    assertEquals("rtf", config.extension());
    assertEquals(ErrorPolicy.SKIP, config.errorPolicy());
    assertEquals(Map.of(), config.labels());
  }

  @Test
  void fromMapReadsEveryOption() {
    AggregateConfig config = AggregateConfig.fromMap(Map.of(
        "in", "cases",
        "out", "out/all.json",
        "jsonlOut", "out/jsonl",
        "extension", ".RTF",
        "errorPolicy", "fail-fast",
        "labels.#4A1594", "Expert"));

    assertEquals(Optional.of(Path.of("out/jsonl").toAbsolutePath().normalize()), config.jsonlDirectory());
    assertEquals("rtf", config.extension());
    assertEquals(ErrorPolicy.FAIL_FAST, config.errorPolicy());
    assertEquals(Map.of("#4A1594", "Expert"), config.labels());
  }

  @Test
  void jsonlDirectoryMustDifferFromInput() {
    assertThrows(IllegalArgumentException.class,
        () -> AggregateConfig.fromMap(Map.of("in", "cases", "jsonlOut", "./cases")));
  }
}
