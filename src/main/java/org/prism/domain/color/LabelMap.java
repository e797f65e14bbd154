package org.prism.domain.color;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Validated mapping from text colors to speaker labels.
 * <p><strong>Why:</strong> Keys are normalized to {@link Rgb} so {@code RGB(11,93,162)} and {@code #0B5DA2} address
 * the same speaker.</p>
 * <p><strong>Role:</strong> Read-only parse input; instances come from {@link LabelMapValidator} so an unvalidated
 * map can never reach the parser.</p>
 * <p><strong>Thread-safety:</strong> Immutable; safe to share across parses.</p>
 *
 * @since 0.1.0
 */
public final class LabelMap {
  private static final LabelMap EMPTY = new LabelMap(Map.of());

  private final Map<Rgb, String> labels;

  LabelMap(Map<Rgb, String> labels) {
    this.labels = Collections.unmodifiableMap(new LinkedHashMap<>(labels));
  }

  /**
   * Returns the degenerate mapping that leaves every turn unlabeled.
   *
   * @return shared empty label map
   */
  public static LabelMap empty() {
    return EMPTY;
  }

  /**
   * Looks up the label for a color.
   *
   * @param color color to resolve; must not be {@code null}
   * @return label, or empty when the color is unmapped
   */
  public Optional<String> label(Rgb color) {
    Objects.requireNonNull(color, "color");
    return Optional.ofNullable(labels.get(color));
  }

  /**
   * Indicates whether the map has no entries.
   *
   * @return {@code true} when every color resolves to the empty label
   */
  public boolean isEmpty() {
    return labels.isEmpty();
  }

  /**
   * Returns the number of mapped colors.
   *
   * @return entry count
   */
  public int size() {
    return labels.size();
  }

  /**
   * Returns the normalized entries in caller order.
   *
   * @return unmodifiable color-to-label view
   */
  public Map<Rgb, String> asMap() {
    return labels;
  }

  @Override
  public boolean equals(Object other) {
    return other instanceof LabelMap map && labels.equals(map.labels);
  }

  @Override
  public int hashCode() {
    return labels.hashCode();
  }

  @Override
  public String toString() {
    return "LabelMap" + labels;
  }
}
