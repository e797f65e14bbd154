package org.prism.domain.error;

/**
 * Base checked exception for failures that prevent a document from becoming a transcript.
 * <p>Subclasses identify the failure class so batch callers can decide whether to skip the offending
 * document or abort the run.</p>
 *
 * @since 0.1.0
 */
public abstract class TranscriptException extends Exception {
  /**
   * Creates an exception with a descriptive message.
   *
   * @param message human-readable error
   */
  protected TranscriptException(String message) {
    super(message);
  }

  /**
   * Creates an exception with a message and underlying cause.
   *
   * @param message human-readable error
   * @param cause root cause
   */
  protected TranscriptException(String message, Throwable cause) {
    super(message, cause);
  }
}
