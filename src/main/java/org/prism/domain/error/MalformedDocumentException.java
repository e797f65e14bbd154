package org.prism.domain.error;

/**
 * Thrown when a document lacks a usable color declaration block.
 *
 * @since 0.1.0
 */
public final class MalformedDocumentException extends TranscriptException {
  /**
   * Creates an exception with a descriptive message.
   *
   * @param message human-readable error
   */
  public MalformedDocumentException(String message) {
    super(message);
  }
}
