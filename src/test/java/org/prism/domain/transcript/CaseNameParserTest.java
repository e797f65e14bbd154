package org.prism.domain.transcript;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.prism.domain.error.UnparsableFilenameException;

class CaseNameParserTest {

  @Test
  void splitsClientAndCategory() throws Exception {
    assertEquals(new CaseKey("Megan", "denial"), CaseNameParser.parse("meganDenial.rtf"));
    assertEquals(new CaseKey("Tamara", "denial"), CaseNameParser.parse(Path.of("/cases/tamaraDenial.rtf")));
  }

  @Test
  void concatenatesMultiRunCategories() throws Exception {
    assertEquals(new CaseKey("Marcel", "characterdefense"), CaseNameParser.parse("marcelCharacterDefense.rtf"));
  }

  @Test
  void capitalizedClientNamesAreNormalized() throws Exception {
    assertEquals(new CaseKey("Adam", "denial"), CaseNameParser.parse("AdamDenial.jsonl"));
  }

  @Test
  void onlyTheLastExtensionIsRemoved() throws Exception {
    assertEquals(new CaseKey("Megan", "denialbackup"), CaseNameParser.parse("meganDenial.backup.rtf"));
  }

  @Test
  void singleRunNamesAreRejected() {
    UnparsableFilenameException ex =
        assertThrows(UnparsableFilenameException.class, () -> CaseNameParser.parse("notes.rtf"));
    assertEquals("notes.rtf", ex.fileName());
    assertThrows(UnparsableFilenameException.class, () -> CaseNameParser.parse("1234.rtf"));
  }
}
