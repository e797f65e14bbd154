package org.prism.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class YamlConfigLoaderTest {

  @TempDir Path dir;

  @Test
  void missingFileYieldsEmpty() throws Exception {
    assertTrue(YamlConfigLoader.load(dir.resolve("absent.yaml"), "convert").isEmpty());
  }

  @Test
  void mergesCommonAndModeSectionsFlatteningLabels() throws Exception {
    Path file = Files.writeString(dir.resolve("prism.yaml"), String.join("\n",
        "common:",
        "  verbose: true",
        "  labels:",
        "    \"RGB(74,21,148)\": Therapist",
        "    \"#0B5DA2\": Assistant",
        "aggregate:",
        "  in: ./cases",
        "  errorPolicy: FAIL_FAST",
        "convert:",
        "  format: script",
        ""));

    Map<String, String> aggregate = YamlConfigLoader.load(file, "aggregate").orElseThrow();

    assertEquals("true", aggregate.get("verbose"));
    assertEquals("Therapist", aggregate.get("labels.RGB(74,21,148)"));
    assertEquals("Assistant", aggregate.get("labels.#0B5DA2"));
    assertEquals("./cases", aggregate.get("in"));
    assertEquals("FAIL_FAST", aggregate.get("errorPolicy"));
    assertFalse(aggregate.containsKey("format"));
  }

  @Test
  void modeSectionOverridesCommon() throws Exception {
    Path file = Files.writeString(dir.resolve("prism.yaml"),
        "common:\n  labels: \"RGB(1,2,3)=A\"\nconvert:\n  labels: \"RGB(4,5,6)=B\"\n");

    assertEquals(Optional.of(Map.of("labels", "RGB(4,5,6)=B")), YamlConfigLoader.load(file, "Convert"));
  }

  @Test
  void emptyDocumentYieldsEmptyMap() throws Exception {
    Path file = Files.writeString(dir.resolve("empty.yaml"), "");
    assertEquals(Optional.of(Map.of()), YamlConfigLoader.load(file, "convert"));
  }

  @Test
  void rejectsMalformedYamlAndArrays() throws Exception {
    Path broken = Files.writeString(dir.resolve("broken.yaml"), "common: [unclosed\n");
    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(broken, "convert"));

    Path array = Files.writeString(dir.resolve("array.yaml"), "convert:\n  in:\n    - a\n    - b\n");
    IllegalArgumentException ex =
        assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(array, "convert"));
    assertEquals("YAML arrays are not supported for key in", ex.getMessage());

    Path scalar = Files.writeString(dir.resolve("scalar.yaml"), "just text\n");
    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(scalar, "convert"));
  }
}
