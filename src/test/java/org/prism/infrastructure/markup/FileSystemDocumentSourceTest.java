package org.prism.infrastructure.markup;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FileSystemDocumentSourceTest {
  private final FileSystemDocumentSource source = new FileSystemDocumentSource();

  @TempDir Path dir;

  @Test
  void listsMatchingFilesSortedByName() throws Exception {
    Files.writeString(dir.resolve("tamaraDenial.rtf"), "t");
    Files.writeString(dir.resolve("adamDenial.RTF"), "a");
    Files.writeString(dir.resolve("meganDenial.rtf"), "m");
    Files.writeString(dir.resolve("notes.txt"), "n");
    Files.createDirectory(dir.resolve("nested.rtf"));

    List<Path> found = source.list(dir, ".rtf");

    assertEquals(List.of("adamDenial.RTF", "meganDenial.rtf", "tamaraDenial.rtf"),
        found.stream().map(p -> p.getFileName().toString()).toList());
  }

  @Test
  void readsUtf8() throws Exception {
    Path file = dir.resolve("a.rtf");
    Files.writeString(file, "caf\u00E9", StandardCharsets.UTF_8);
    assertEquals("caf\u00E9", source.read(file));
  }

  @Test
  void fallsBackToLatin1ForInvalidUtf8() throws Exception {
    Path file = dir.resolve("b.rtf");
    Files.write(file, new byte[] {'c', 'a', 'f', (byte) 0xE9});
    assertEquals("caf\u00E9", source.read(file));
  }

  @Test
  void normalizesExtensions() {
    assertEquals("rtf", FileSystemDocumentSource.normalizeExtension(" .RTF "));
    assertEquals("rtf", FileSystemDocumentSource.normalizeExtension("rtf"));
    assertThrows(IllegalArgumentException.class, () -> FileSystemDocumentSource.normalizeExtension("."));
    assertThrows(IllegalArgumentException.class, () -> FileSystemDocumentSource.normalizeExtension(" "));
  }
}
