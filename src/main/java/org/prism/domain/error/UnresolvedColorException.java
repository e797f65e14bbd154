package org.prism.domain.error;

import java.util.Optional;
import org.prism.domain.color.Rgb;

/**
 * Thrown when a color-change marker cannot be mapped to a label: the referenced slot is not declared in the
 * palette, or the label map has no entry for the slot's color.
 *
 * @since 0.1.0
 */
public final class UnresolvedColorException extends TranscriptException {
  private final int offset;
  private final int slot;
  private final transient Rgb color;

  /**
   * Creates an exception for a marker whose color has no label.
   *
   * @param offset marker offset in the cleaned text
   * @param slot palette slot referenced by the marker
   * @param color resolved color; {@code null} when the slot is undeclared
   */
  public UnresolvedColorException(int offset, int slot, Rgb color) {
    super(describe(offset, slot, color));
    this.offset = offset;
    this.slot = slot;
    this.color = color;
  }

  /**
   * Returns the marker offset in the cleaned text.
   *
   * @return zero-based character offset
   */
  public int offset() {
    return offset;
  }

  /**
   * Returns the palette slot referenced by the marker.
   *
   * @return slot number as written after {@code cf}
   */
  public int slot() {
    return slot;
  }

  /**
   * Returns the slot's color when the palette declares it.
   *
   * @return color, or empty for slot 0 and undeclared slots
   */
  public Optional<Rgb> color() {
    return Optional.ofNullable(color);
  }

  private static String describe(int offset, int slot, Rgb color) {
    if (color == null) {
      return "Color slot cf" + slot + " at offset " + offset + " is not declared in the color table";
    }
    return "No label for color " + color.toRgbString() + " (" + color.toHex() + ", slot cf" + slot
        + ") at offset " + offset;
  }
}
