/**
 * Logging helpers for PRISM: verbosity control over Logback and safe rendering of transcript snippets.
 *
 * @since 0.1.0
 */
package org.prism.logging;
