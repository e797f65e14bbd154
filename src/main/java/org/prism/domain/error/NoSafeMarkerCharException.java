package org.prism.domain.error;

/**
 * Thrown when every reserved marker candidate already occurs in a document, so color-change markers cannot be
 * protected from markup stripping without corrupting text.
 *
 * @since 0.1.0
 */
public final class NoSafeMarkerCharException extends TranscriptException {
  /**
   * Creates an exception with a descriptive message.
   *
   * @param message human-readable error
   */
  public NoSafeMarkerCharException(String message) {
    super(message);
  }
}
