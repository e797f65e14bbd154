/**
 * Batch use cases: single-document conversion and directory aggregation into case records.
 * <p><strong>Concurrency:</strong> Sequential; each document is read, parsed and released before the next.</p>
 * <p><strong>Metrics:</strong> Publishes {@code convert.*} and {@code aggregate.*} counters.</p>
 *
 * @since 0.1.0
 */
package org.prism.application.pipeline;
