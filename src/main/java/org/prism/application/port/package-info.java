/**
 * Ports connecting PRISM use cases to markup conversion, document sources, persistence, clocks and metrics.
 * <p><strong>Role:</strong> Hexagonal boundary; infrastructure adapters implement these interfaces and the
 * composition root wires them.</p>
 *
 * @since 0.1.0
 */
package org.prism.application.port;
