package org.prism.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class PathsTest {

  @TempDir Path dir;

  @Test
  void readableFileAndDirectory() throws Exception {
    Path file = Files.writeString(dir.resolve("a.rtf"), "x");

    assertEquals(file.toAbsolutePath().normalize(), Paths.requireReadableFile("in", file));
    assertThrows(IllegalArgumentException.class, () -> Paths.requireReadableFile("in", dir));
    assertEquals(dir.toAbsolutePath().normalize(), Paths.requireReadableDirectory("in", dir));
    assertThrows(IllegalArgumentException.class, () -> Paths.requireReadableDirectory("in", file));
  }

  @Test
  void outputFileRespectsOverwriteFlag() throws Exception {
    Path existing = Files.writeString(dir.resolve("out.json"), "{}");

    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> Paths.validateOutputFile("out", existing, false));
    assertTrue(ex.getMessage().contains("--allow-overwrite"));
    assertEquals(existing.toAbsolutePath().normalize(), Paths.validateOutputFile("out", existing, true));
    assertEquals(dir.resolve("new/deeper/out.json").toAbsolutePath().normalize(),
        Paths.validateOutputFile("out", dir.resolve("new/deeper/out.json"), false));
    assertThrows(IllegalArgumentException.class, () -> Paths.validateOutputFile("out", dir, true));
  }

  @Test
  void writableDirectoryIsCreatedAndMustBeEmptyUnlessReused() throws Exception {
    Path target = dir.resolve("jsonl");

    assertThrows(IllegalArgumentException.class, () -> Paths.validateWritableDir("jsonlOut", target, false, false));
    Paths.validateWritableDir("jsonlOut", target, true, false);
    assertTrue(Files.isDirectory(target));

    Files.writeString(target.resolve("old.jsonl"), "");
    assertThrows(IllegalArgumentException.class, () -> Paths.validateWritableDir("jsonlOut", target, true, false));
    assertEquals(target.toAbsolutePath().normalize(), Paths.validateWritableDir("jsonlOut", target, true, true));
  }
}
