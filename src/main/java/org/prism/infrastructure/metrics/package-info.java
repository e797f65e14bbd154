/**
 * Metrics adapters bridging {@link org.prism.application.port.MetricsPort} to OpenTelemetry.
 * <p><strong>Concurrency:</strong> Instruments are cached in concurrent maps; updates are thread-safe.</p>
 * <p><strong>Metrics:</strong> Publishes under the {@code parse.*}, {@code convert.*} and {@code aggregate.*}
 * namespaces. Transcript text is never exported.</p>
 */
package org.prism.infrastructure.metrics;
