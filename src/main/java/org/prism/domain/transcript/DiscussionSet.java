package org.prism.domain.transcript;

import java.util.List;
import java.util.Objects;

/**
 * <strong>What:</strong> Final deliverable of an aggregation run: one {@link CaseRecord} per successfully parsed
 * document plus the documents that were skipped.
 * <p><strong>Ordering:</strong> Records follow input enumeration order; the aggregator sorts by file name.</p>
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * @param records case records in input order
 * @param skipped documents excluded under the skip error policy
 * @since 0.1.0
 */
public record DiscussionSet(List<CaseRecord> records, List<SkippedDocument> skipped) {

  /**
   * Copies both lists.
   *
   * @throws NullPointerException if any component is {@code null}
   */
  public DiscussionSet {
    records = List.copyOf(Objects.requireNonNull(records, "records"));
    skipped = List.copyOf(Objects.requireNonNull(skipped, "skipped"));
  }

  /**
   * Indicates whether any document was skipped.
   *
   * @return {@code true} when at least one document failed
   */
  public boolean hasSkipped() {
    return !skipped.isEmpty();
  }
}
