package org.prism.application.pipeline;

import java.util.Locale;

/**
 * How an aggregation run reacts to a document that cannot be processed.
 *
 * @since 0.1.0
 */
public enum ErrorPolicy {
  /** Log the failure, record the document as skipped, and continue with the next one. */
  SKIP,
  /** Abort the run with a {@link DocumentProcessingException} naming the document. */
  FAIL_FAST;

  /**
   * Parses a policy name, ignoring case and treating {@code -} as {@code _}.
   *
   * @param raw policy name such as {@code skip} or {@code fail-fast}
   * @return matching policy
   * @throws IllegalArgumentException if {@code raw} is blank or unknown
   */
  public static ErrorPolicy fromString(String raw) {
    if (raw == null || raw.isBlank()) {
      throw new IllegalArgumentException("errorPolicy must not be blank");
    }
    String normalized = raw.trim().toUpperCase(Locale.ROOT).replace('-', '_');
    return switch (normalized) {
      case "SKIP" -> SKIP;
      case "FAIL_FAST" -> FAIL_FAST;
      default -> throw new IllegalArgumentException(
          "errorPolicy must be SKIP or FAIL_FAST (was '" + raw + "')");
    };
  }
}
