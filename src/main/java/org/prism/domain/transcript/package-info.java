/**
 * Transcript outputs: labeled turns, per-document transcripts, case records keyed by file-name metadata, and the
 * discussion set produced by an aggregation run.
 * <p><strong>Concurrency:</strong> Types are immutable records; safe to share.</p>
 *
 * @since 0.1.0
 */
package org.prism.domain.transcript;
