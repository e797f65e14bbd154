package org.prism.infrastructure.persistence;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.StreamWriteFeature;
import java.io.IOException;
import java.io.Writer;
import java.util.Objects;
import org.prism.application.port.TranscriptPersistencePort;
import org.prism.domain.transcript.Transcript;
import org.prism.domain.transcript.Turn;

/**
 * <strong>What:</strong> Writes transcripts as newline-delimited JSON, one {@code {"<label>":"<text>"}} object per
 * turn.
 * <p><strong>Role:</strong> Default output of {@code prism convert} and the per-document artifact of
 * {@code prism aggregate}.</p>
 * <p><strong>Thread-safety:</strong> Not thread-safe.</p>
 *
 * @since 0.1.0
 */
public final class NdjsonTranscriptAdapter implements TranscriptPersistencePort {
  static final JsonFactory JSON = JsonFactory.builder()
      .disable(StreamWriteFeature.AUTO_CLOSE_TARGET)
      .build();

  private final Writer out;
  private final boolean ownsWriter;

  /**
   * Creates an adapter over {@code out}.
   *
   * @param out destination writer
   * @param ownsWriter whether {@link #close()} closes {@code out}; pass {@code false} for stdout
   */
  public NdjsonTranscriptAdapter(Writer out, boolean ownsWriter) {
    this.out = Objects.requireNonNull(out, "out");
    this.ownsWriter = ownsWriter;
  }

  @Override
  public void persist(Transcript transcript) throws IOException {
    Objects.requireNonNull(transcript, "transcript");
    for (Turn turn : transcript.turns()) {
      try (JsonGenerator gen = JSON.createGenerator(out)) {
        writeTurn(gen, turn);
      }
      out.write('\n');
    }
  }

  /**
   * Writes a turn as a single-field object.
   *
   * @param gen generator positioned where a value may start
   * @param turn turn to write
   * @throws IOException if the generator fails
   */
  static void writeTurn(JsonGenerator gen, Turn turn) throws IOException {
    gen.writeStartObject();
    gen.writeStringField(turn.label(), turn.text());
    gen.writeEndObject();
  }

  @Override
  public void flush() throws IOException {
    out.flush();
  }

  @Override
  public void close() throws IOException {
    if (ownsWriter) {
      out.close();
    } else {
      out.flush();
    }
  }
}
