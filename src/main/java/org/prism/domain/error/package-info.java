/**
 * Checked failures raised while turning color-coded documents into transcripts.
 * <p><strong>Role:</strong> Domain error taxonomy shared by the parser and the case aggregator.</p>
 * <p><strong>Propagation:</strong> Label-map failures are raised once per run before any document is read;
 * every other failure is scoped to a single document and attached to its file name by the aggregator.</p>
 *
 * @since 0.1.0
 */
package org.prism.domain.error;
