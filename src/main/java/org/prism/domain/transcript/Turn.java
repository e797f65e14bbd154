package org.prism.domain.transcript;

import java.util.Objects;

/**
 * <strong>What:</strong> One contiguous span of same-colored text attributed to a speaker label.
 * <p><strong>Role:</strong> Domain value emitted by the turn segmenter in document order.</p>
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * @param label speaker label; empty when the color is unmapped or no color was active yet
 * @param text span text, whitespace preserved; never empty
 * @since 0.1.0
 */
public record Turn(String label, String text) {

  /**
   * Validates turn components.
   *
   * @throws NullPointerException if either component is {@code null}
   * @throws IllegalArgumentException if {@code text} is empty
   */
  public Turn {
    Objects.requireNonNull(label, "label");
    Objects.requireNonNull(text, "text");
    if (text.isEmpty()) {
      throw new IllegalArgumentException("turn text must not be empty");
    }
  }
}
