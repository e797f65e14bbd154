package org.prism.domain.error;

/**
 * Thrown when a document name cannot be split into a client name and a category.
 *
 * @since 0.1.0
 */
public final class UnparsableFilenameException extends TranscriptException {
  private final String fileName;

  /**
   * Creates an exception naming the rejected file.
   *
   * @param fileName file name as supplied
   * @param reason why the name was rejected
   */
  public UnparsableFilenameException(String fileName, String reason) {
    super("File name " + fileName + " " + reason);
    this.fileName = fileName;
  }

  /**
   * Returns the rejected file name.
   *
   * @return file name as supplied
   */
  public String fileName() {
    return fileName;
  }
}
