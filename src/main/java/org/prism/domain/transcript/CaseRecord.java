package org.prism.domain.transcript;

import java.util.List;
import java.util.Objects;

/**
 * <strong>What:</strong> Aggregated output for one source document: who the client is, which category the
 * discussion covers, and the labeled conversation.
 * <p><strong>Role:</strong> Long-lived output owned by the caller; element of a {@link DiscussionSet}.</p>
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * @param clientName capitalized client name
 * @param category lower-cased category
 * @param turns conversation in document order
 * @param sourceName file name the record was built from
 * @since 0.1.0
 */
public record CaseRecord(String clientName, String category, List<Turn> turns, String sourceName) {

  /**
   * Copies the turn list and validates components.
   *
   * @throws NullPointerException if any component is {@code null}
   */
  public CaseRecord {
    Objects.requireNonNull(clientName, "clientName");
    Objects.requireNonNull(category, "category");
    turns = List.copyOf(Objects.requireNonNull(turns, "turns"));
    Objects.requireNonNull(sourceName, "sourceName");
  }

  /**
   * Combines a case key with a parsed transcript.
   *
   * @param key client/category key derived from the file name
   * @param transcript parsed turns
   * @return case record named after the transcript's document
   */
  public static CaseRecord of(CaseKey key, Transcript transcript) {
    return new CaseRecord(key.clientName(), key.category(), transcript.turns(), transcript.documentName());
  }
}
