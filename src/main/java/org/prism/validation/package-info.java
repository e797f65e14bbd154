/**
 * Input validation helpers shared by configuration and CLI layers.
 * <p><strong>Errors:</strong> Every violation is an {@link java.lang.IllegalArgumentException} carrying the
 * offending parameter name.</p>
 *
 * @since 0.1.0
 */
package org.prism.validation;
