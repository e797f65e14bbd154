package org.prism.application.port;

import java.io.IOException;
import org.prism.domain.transcript.Transcript;

/**
 * <strong>What:</strong> Port writing parsed transcripts to a destination bound at construction time.
 * <p><strong>Implementations:</strong> NDJSON and script writers over a stream, and a directory writer that emits one
 * {@code <stem>.jsonl} file per transcript.</p>
 * <p><strong>Thread-safety:</strong> Implementations are not required to be thread-safe.</p>
 *
 * @since 0.1.0
 */
public interface TranscriptPersistencePort extends AutoCloseable {
  /**
   * Persists one transcript.
   *
   * @param transcript transcript to write; must not be {@code null}
   * @throws IOException if the destination rejects the write
   */
  void persist(Transcript transcript) throws IOException;

  /**
   * Flushes buffered output.
   *
   * @throws IOException if flushing fails
   */
  default void flush() throws IOException {}

  /**
   * Releases the destination.
   *
   * @throws IOException if closing fails
   */
  @Override
  default void close() throws IOException {}
}
