package org.prism.domain.transcript;

import java.util.List;
import java.util.Objects;

/**
 * Ordered turns parsed from one source document.
 *
 * @param documentName file name of the source document, used for output naming and diagnostics
 * @param turns turns in document order
 * @since 0.1.0
 */
public record Transcript(String documentName, List<Turn> turns) {

  /**
   * Copies the turn list.
   *
   * @throws NullPointerException if any component is {@code null}
   */
  public Transcript {
    Objects.requireNonNull(documentName, "documentName");
    turns = List.copyOf(Objects.requireNonNull(turns, "turns"));
  }
}
