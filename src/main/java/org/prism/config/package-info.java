/**
 * Layered configuration (defaults, YAML, CLI) and the composition root that wires PRISM adapters.
 */
package org.prism.config;
