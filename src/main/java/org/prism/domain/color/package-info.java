/**
 * Color model for color-coded transcripts: RGB values, per-document palettes, caller label maps, and the
 * color-change markers located in cleaned text.
 * <p><strong>Concurrency:</strong> All types are immutable.</p>
 *
 * @since 0.1.0
 */
package org.prism.domain.color;
