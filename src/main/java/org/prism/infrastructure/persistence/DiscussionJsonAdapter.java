package org.prism.infrastructure.persistence;

import com.fasterxml.jackson.core.JsonGenerator;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import org.prism.application.port.DiscussionPersistencePort;
import org.prism.domain.transcript.CaseRecord;
import org.prism.domain.transcript.DiscussionSet;
import org.prism.domain.transcript.Turn;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Writes a {@link DiscussionSet} as a pretty-printed JSON array.
 * <p><strong>Format:</strong>
 * {@code [{"clientName":"Megan","category":"denial","conversation":[{"Expert":"..."},{"AI":"..."}]}]}</p>
 * <p><strong>Thread-safety:</strong> Not thread-safe.</p>
 *
 * @since 0.1.0
 */
public final class DiscussionJsonAdapter implements DiscussionPersistencePort {
  private static final Logger log = LoggerFactory.getLogger(DiscussionJsonAdapter.class);

  private final Path target;

  /**
   * Creates an adapter writing to {@code target}, replacing any existing file.
   *
   * @param target output file; parent directories are created as needed
   */
  public DiscussionJsonAdapter(Path target) {
    this.target = Objects.requireNonNull(target, "target");
  }

  @Override
  public void persist(DiscussionSet discussions) throws IOException {
    Objects.requireNonNull(discussions, "discussions");
    Path parent = target.toAbsolutePath().getParent();
    if (parent != null) {
      Files.createDirectories(parent);
    }
    try (Writer writer = Files.newBufferedWriter(target, StandardCharsets.UTF_8)) {
      write(discussions, writer);
    }
    log.info("Wrote {} case records to {}", discussions.records().size(), target);
  }

  /**
   * Serializes {@code discussions} to {@code out} without closing it.
   *
   * @param discussions records to write
   * @param out destination
   * @throws IOException if writing fails
   */
  static void write(DiscussionSet discussions, Writer out) throws IOException {
    try (JsonGenerator gen = NdjsonTranscriptAdapter.JSON.createGenerator(out)) {
      gen.useDefaultPrettyPrinter();
      gen.writeStartArray();
      for (CaseRecord record : discussions.records()) {
        gen.writeStartObject();
        gen.writeStringField("clientName", record.clientName());
        gen.writeStringField("category", record.category());
        gen.writeArrayFieldStart("conversation");
        for (Turn turn : record.turns()) {
          NdjsonTranscriptAdapter.writeTurn(gen, turn);
        }
        gen.writeEndArray();
        gen.writeEndObject();
      }
      gen.writeEndArray();
    }
    out.write('\n');
  }
}
