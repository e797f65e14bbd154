/**
 * Markup adapters: filesystem document source and RTF-to-plain-text conversion.
 *
 * @since 0.1.0
 */
package org.prism.infrastructure.markup;
