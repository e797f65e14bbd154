package org.prism.domain.error;

/**
 * Thrown when a caller-supplied color-to-label mapping contains an entry that is not a valid
 * {@code RGB(r,g,b)} or {@code #RRGGBB} key, or whose label is unusable.
 *
 * @since 0.1.0
 */
public final class InvalidLabelMapException extends TranscriptException {
  private final String entry;

  /**
   * Creates an exception naming the offending entry.
   *
   * @param entry printable form of the rejected entry
   * @param reason why the entry was rejected
   */
  public InvalidLabelMapException(String entry, String reason) {
    super("Invalid label map entry " + entry + ": " + reason);
    this.entry = entry;
  }

  /**
   * Creates an exception naming the offending entry and the parse failure behind it.
   *
   * @param entry printable form of the rejected entry
   * @param cause parse failure
   */
  public InvalidLabelMapException(String entry, IllegalArgumentException cause) {
    super("Invalid label map entry " + entry + ": " + cause.getMessage(), cause);
    this.entry = entry;
  }

  /**
   * Returns the printable form of the rejected entry.
   *
   * @return entry such as {@code RGB(300,0,0)=Fred}
   */
  public String entry() {
    return entry;
  }
}
