package org.prism.domain.color;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Ordered color table of one document, addressed by 1-origin slot.
 * <p><strong>Why:</strong> RTF color-change control words ({@code \cfN}) refer to colors by their position in the
 * document's {@code \colortbl} group; slot 0 is the implicit "auto" color and never part of the palette.</p>
 * <p><strong>Role:</strong> Domain value built once per parse by
 * {@link org.prism.domain.rtf.PaletteExtractor} and read by the turn segmenter.</p>
 * <p><strong>Thread-safety:</strong> Immutable; safe for concurrent reads.</p>
 *
 * @since 0.1.0
 */
public final class Palette {
  private final List<Rgb> colors;

  private Palette(List<Rgb> colors) {
    this.colors = colors;
  }

  /**
   * Creates a palette whose slot {@code i + 1} holds {@code colors.get(i)}.
   *
   * @param colors colors in declaration order; must not be {@code null} or contain {@code null}
   * @return immutable palette
   */
  public static Palette of(List<Rgb> colors) {
    Objects.requireNonNull(colors, "colors");
    return new Palette(List.copyOf(colors));
  }

  /**
   * Looks up the color declared at {@code slot}.
   *
   * @param slot 1-origin palette slot
   * @return declared color, or empty for slot 0 and undeclared slots
   */
  public Optional<Rgb> color(int slot) {
    if (slot < 1 || slot > colors.size()) {
      return Optional.empty();
    }
    return Optional.of(colors.get(slot - 1));
  }

  /**
   * Returns the number of declared colors.
   *
   * @return highest valid slot number
   */
  public int size() {
    return colors.size();
  }

  /**
   * Returns the palette as an insertion-ordered slot-to-color map.
   *
   * @return unmodifiable map keyed by slots {@code 1..size()}
   */
  public Map<Integer, Rgb> asMap() {
    Map<Integer, Rgb> map = new LinkedHashMap<>();
    for (int i = 0; i < colors.size(); i++) {
      map.put(i + 1, colors.get(i));
    }
    return Collections.unmodifiableMap(map);
  }

  @Override
  public boolean equals(Object other) {
    return other instanceof Palette palette && colors.equals(palette.colors);
  }

  @Override
  public int hashCode() {
    return colors.hashCode();
  }

  @Override
  public String toString() {
    return "Palette" + asMap();
  }
}
