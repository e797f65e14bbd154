package org.prism.testutil;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Loads RTF fixtures from {@code src/test/resources/fixtures}.
 */
public final class Fixtures {
  /** Three-turn Expert/AI/Expert dialogue with a four-color palette. */
  public static final String MEGAN = "meganDenial.rtf";
  /** Five-turn Expert/AI/Expert/AI/Expert dialogue with a five-color palette. */
  public static final String TAMARA = "tamaraDenial.rtf";

  private Fixtures() {}

  public static String read(String name) throws IOException {
    try (InputStream in = Fixtures.class.getResourceAsStream("/fixtures/" + name)) {
      if (in == null) {
        throw new IOException("missing fixture " + name);
      }
      return new String(in.readAllBytes(), StandardCharsets.UTF_8);
    }
  }

  public static Path copy(String name, Path directory) throws IOException {
    return copy(name, directory, name);
  }

  public static Path copy(String name, Path directory, String targetName) throws IOException {
    Files.createDirectories(directory);
    return Files.writeString(directory.resolve(targetName), read(name), StandardCharsets.UTF_8);
  }
}
