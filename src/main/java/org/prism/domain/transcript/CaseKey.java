package org.prism.domain.transcript;

import java.util.Objects;

/**
 * Client identity and discussion category derived from a document's file name.
 *
 * @param clientName capitalized client name, e.g. {@code Megan}
 * @param category lower-cased category, e.g. {@code denial} or {@code characterdefense}
 * @since 0.1.0
 */
public record CaseKey(String clientName, String category) {

  /**
   * Validates key components.
   *
   * @throws NullPointerException if any component is {@code null}
   */
  public CaseKey {
    Objects.requireNonNull(clientName, "clientName");
    Objects.requireNonNull(category, "category");
  }
}
