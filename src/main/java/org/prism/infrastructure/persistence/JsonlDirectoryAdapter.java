package org.prism.infrastructure.persistence;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import org.prism.application.port.TranscriptPersistencePort;
import org.prism.domain.transcript.Transcript;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Writes each transcript to {@code <directory>/<stem>.jsonl}, where {@code stem} is the
 * document name without its extension.
 * <p><strong>Role:</strong> Intermediate per-document artifact of {@code prism aggregate}.</p>
 * <p><strong>Thread-safety:</strong> Not thread-safe; files are opened and closed per transcript.</p>
 *
 * @since 0.1.0
 */
public final class JsonlDirectoryAdapter implements TranscriptPersistencePort {
  private static final Logger log = LoggerFactory.getLogger(JsonlDirectoryAdapter.class);

  private final Path directory;

  /**
   * Creates an adapter writing into {@code directory}; the directory is created on first write.
   *
   * @param directory output directory
   */
  public JsonlDirectoryAdapter(Path directory) {
    this.directory = Objects.requireNonNull(directory, "directory");
  }

  @Override
  public void persist(Transcript transcript) throws IOException {
    Objects.requireNonNull(transcript, "transcript");
    Files.createDirectories(directory);
    Path target = directory.resolve(stem(transcript.documentName()) + ".jsonl");
    Writer writer = Files.newBufferedWriter(target, StandardCharsets.UTF_8);
    try (NdjsonTranscriptAdapter ndjson = new NdjsonTranscriptAdapter(writer, true)) {
      ndjson.persist(transcript);
    }
    log.debug("Wrote {} turns to {}", transcript.turns().size(), target);
  }

  /**
   * Returns the output file name for a document, without directory.
   *
   * @param documentName source document name
   * @return name without its last extension
   */
  static String stem(String documentName) {
    int dot = documentName.lastIndexOf('.');
    return dot > 0 ? documentName.substring(0, dot) : documentName;
  }
}
