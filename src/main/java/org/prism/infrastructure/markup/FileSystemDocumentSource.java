package org.prism.infrastructure.markup;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.stream.Stream;
import org.prism.application.port.DocumentSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link DocumentSource} backed by the local filesystem.
 * <p><strong>Listing:</strong> non-recursive; regular files only; extension compared case-insensitively; results
 * sorted by file name so runs are reproducible across platforms.</p>
 * <p><strong>Decoding:</strong> UTF-8, falling back to ISO-8859-1 when the bytes are not valid UTF-8.</p>
 * <p><strong>Thread-safety:</strong> Stateless.</p>
 *
 * @since 0.1.0
 */
public final class FileSystemDocumentSource implements DocumentSource {
  private static final Logger log = LoggerFactory.getLogger(FileSystemDocumentSource.class);

  /**
   * Creates a filesystem document source.
   */
  public FileSystemDocumentSource() {}

  @Override
  public List<Path> list(Path directory, String extension) throws IOException {
    Objects.requireNonNull(directory, "directory");
    String suffix = "." + normalizeExtension(extension);
    List<Path> matches = new ArrayList<>();
    try (Stream<Path> entries = Files.list(directory)) {
      entries
          .filter(Files::isRegularFile)
          .filter(p -> p.getFileName() != null
              && p.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(suffix))
          .sorted(Comparator.comparing(p -> p.getFileName().toString()))
          .forEach(matches::add);
    }
    log.debug("Found {} {} documents in {}", matches.size(), suffix, directory);
    return matches;
  }

  @Override
  public String read(Path document) throws IOException {
    Objects.requireNonNull(document, "document");
    return decode(Files.readAllBytes(document), document);
  }

  static String decode(byte[] bytes, Path origin) {
    try {
      return StandardCharsets.UTF_8.newDecoder()
          .onMalformedInput(CodingErrorAction.REPORT)
          .onUnmappableCharacter(CodingErrorAction.REPORT)
          .decode(ByteBuffer.wrap(bytes))
          .toString();
    } catch (CharacterCodingException ex) {
      log.debug("{} is not valid UTF-8; decoding as ISO-8859-1", origin);
      return new String(bytes, StandardCharsets.ISO_8859_1);
    }
  }

  /**
   * Normalizes an extension to lower case without a leading dot.
   *
   * @param extension extension such as {@code rtf}, {@code .RTF}
   * @return normalized extension
   * @throws IllegalArgumentException if the extension is blank
   */
  public static String normalizeExtension(String extension) {
    if (extension == null || extension.isBlank()) {
      throw new IllegalArgumentException("extension must not be blank");
    }
    String trimmed = extension.trim();
    String bare = trimmed.startsWith(".") ? trimmed.substring(1) : trimmed;
    if (bare.isEmpty()) {
      throw new IllegalArgumentException("extension must not be blank");
    }
    return bare.toLowerCase(Locale.ROOT);
  }
}
