package org.prism.domain.color;

/**
 * One color-change marker located in cleaned transcript text.
 *
 * @param startOffset character offset of the marker in the cleaned text
 * @param length number of characters the marker occupies (marker character, {@code cf}, digits)
 * @param paletteSlot palette slot referenced by the marker
 * @since 0.1.0
 */
public record ColorRun(int startOffset, int length, int paletteSlot) {

  /**
   * Returns the offset immediately after the marker.
   *
   * @return {@code startOffset + length}
   */
  public int endOffset() {
    return startOffset + length;
  }
}
