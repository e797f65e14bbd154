package org.prism.application.pipeline;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Thrown when a fail-fast aggregation run stops at a document that could not be read, named or parsed.
 *
 * @since 0.1.0
 */
public final class DocumentProcessingException extends Exception {
  private final transient Path document;

  /**
   * Creates an exception naming the failed document.
   *
   * @param document document that failed
   * @param cause transcript or I/O failure
   */
  public DocumentProcessingException(Path document, Exception cause) {
    super("Failed to process " + fileName(document) + ": " + cause.getMessage(), cause);
    this.document = document;
  }

  /**
   * Returns the document that failed.
   *
   * @return document path
   */
  public Path document() {
    return document;
  }

  private static String fileName(Path document) {
    Objects.requireNonNull(document, "document");
    Path name = document.getFileName();
    return name == null ? document.toString() : name.toString();
  }
}
