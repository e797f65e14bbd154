package org.prism.infrastructure.persistence;

import java.io.IOException;
import java.io.Writer;
import java.util.Objects;
import org.prism.application.port.TranscriptPersistencePort;
import org.prism.domain.transcript.Transcript;
import org.prism.domain.transcript.Turn;

/**
 * Writes transcripts like a play script: one {@code Label: text} line per turn, or just the text when the turn is
 * unlabeled. Trailing whitespace of each turn is dropped so every turn ends on its own line.
 *
 * @since 0.1.0
 */
public final class ScriptTranscriptAdapter implements TranscriptPersistencePort {
  private final Writer out;
  private final boolean ownsWriter;

  /**
   * Creates an adapter over {@code out}.
   *
   * @param out destination writer
   * @param ownsWriter whether {@link #close()} closes {@code out}
   */
  public ScriptTranscriptAdapter(Writer out, boolean ownsWriter) {
    this.out = Objects.requireNonNull(out, "out");
    this.ownsWriter = ownsWriter;
  }

  @Override
  public void persist(Transcript transcript) throws IOException {
    Objects.requireNonNull(transcript, "transcript");
    for (Turn turn : transcript.turns()) {
      out.write(line(turn));
      out.write('\n');
    }
  }

  static String line(Turn turn) {
    String text = turn.text().stripTrailing();
    return turn.label().isEmpty() ? text : turn.label() + ": " + text;
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
