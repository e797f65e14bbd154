/**
 * Color-run scanning over RTF-like markup: palette extraction, marker protection, marker scanning and turn
 * segmentation.
 * <p><strong>Flow:</strong> {@link org.prism.domain.rtf.PaletteExtractor} reads and cuts the color table,
 * {@link org.prism.domain.rtf.MarkerProtector} rewrites color words into markers that survive plain-text conversion,
 * and {@link org.prism.domain.rtf.TurnSegmenter} walks the converted text with a
 * {@link org.prism.domain.rtf.ColorRunScanner}.</p>
 *
 * @since 0.1.0
 */
package org.prism.domain.rtf;
