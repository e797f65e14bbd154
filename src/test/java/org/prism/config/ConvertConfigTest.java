package org.prism.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class ConvertConfigTest {

  @Test
  void fromMapAppliesDefaults() {
    ConvertConfig config = ConvertConfig.fromMap(Map.of("in", "meganDenial.rtf", "labels", "RGB(1,2,3)=A"));

    assertEquals(Path.of("meganDenial.rtf").toAbsolutePath().normalize(), config.inputFile());
    assertTrue(config.outputFile().isEmpty());
    assertEquals(OutputFormat.NDJSON, config.format());
    assertEquals(Map.of("RGB(1,2,3)", "A"), config.labels());
  }

  @Test
  void fromMapReadsOutputAndFormat() {
    ConvertConfig config = ConvertConfig.fromMap(Map.of("in", "a.rtf", "out", "out/a.txt", "format", "Script"));

    assertEquals(Optional.of(Path.of("out/a.txt").toAbsolutePath().normalize()), config.outputFile());
    assertEquals(OutputFormat.SCRIPT, config.format());
  }

  @Test
  void rejectsMissingInputAndUnknownFormat() {
    assertThrows(IllegalArgumentException.class, () -> ConvertConfig.fromMap(Map.of("in", " ")));
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> ConvertConfig.fromMap(Map.of("in", "a.rtf", "format", "csv")));
    assertEquals("format must be ndjson or script (was 'csv')", ex.getMessage());
  }
}
