/**
 * Color-run parsing use case: from raw markup and a label map to an ordered transcript.
 *
 * @since 0.1.0
 */
package org.prism.application.parse;
