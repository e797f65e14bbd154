package org.prism.domain.transcript;

import java.util.Objects;

/**
 * A document left out of a {@link DiscussionSet}, with the failure that excluded it.
 *
 * @param fileName file name of the skipped document
 * @param failureType simple name of the failure class, e.g. {@code UnresolvedColorException}
 * @param reason failure message
 * @since 0.1.0
 */
public record SkippedDocument(String fileName, String failureType, String reason) {

  /**
   * Validates components.
   *
   * @throws NullPointerException if any component is {@code null}
   */
  public SkippedDocument {
    Objects.requireNonNull(fileName, "fileName");
    Objects.requireNonNull(failureType, "failureType");
    Objects.requireNonNull(reason, "reason");
  }

  /**
   * Describes a skipped document from the exception that excluded it.
   *
   * @param fileName file name of the skipped document
   * @param failure failure raised while processing it
   * @return skipped-document entry
   */
  public static SkippedDocument of(String fileName, Exception failure) {
    String message = failure.getMessage() == null ? failure.getClass().getSimpleName() : failure.getMessage();
    return new SkippedDocument(fileName, failure.getClass().getSimpleName(), message);
  }
}
