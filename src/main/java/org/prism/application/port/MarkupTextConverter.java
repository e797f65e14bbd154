package org.prism.application.port;

/**
 * <strong>What:</strong> Port converting markup into plain text.
 * <p><strong>Contract:</strong> implementations drop formatting control words and destination groups, decode
 * escaped characters, and pass every other character through unchanged, including the control characters used
 * as color-run markers.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be stateless or confine state to a single call.</p>
 *
 * @since 0.1.0
 * @see org.prism.infrastructure.markup.RtfPlainTextConverter
 */
public interface MarkupTextConverter {
  /**
   * Converts markup to plain text.
   *
   * @param markup markup text; must not be {@code null}
   * @return plain text with paragraph breaks rendered as {@code \n}
   */
  String toPlainText(String markup);
}
