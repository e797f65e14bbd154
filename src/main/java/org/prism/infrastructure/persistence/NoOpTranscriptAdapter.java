package org.prism.infrastructure.persistence;

import org.prism.application.port.TranscriptPersistencePort;
import org.prism.domain.transcript.Transcript;

/**
 * Transcript sink used when per-document output is disabled.
 * <p>Thread-safe and stateless.</p>
 *
 * @since 0.1.0
 */
public final class NoOpTranscriptAdapter implements TranscriptPersistencePort {
  /**
   * Creates a sink that drops every transcript.
   */
  public NoOpTranscriptAdapter() {}

  /**
   * Discards the transcript.
   *
   * @param transcript ignored
   */
  @Override
  public void persist(Transcript transcript) {
    // per-document output disabled
  }
}
