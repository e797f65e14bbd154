package org.prism.validation;

import java.util.Objects;

/**
 * <strong>What:</strong> Validation utilities for strings supplied through the PRISM CLI and YAML configuration.
 * <p><strong>Role:</strong> Called by config records and CLI adapters before any document is opened.</p>
 * <p><strong>Thread-safety:</strong> Stateless utilities.</p>
 * <p><strong>Observability:</strong> No logs; violations raise {@link IllegalArgumentException}.</p>
 *
 * @implNote Control characters are detected via {@link Character#isISOControl(char)}.
 * @since 0.1.0
 * @see Paths
 */
public final class Strings {
  private Strings() {
    // Utility
  }

  /**
   * Ensures a candidate string is non-null, non-blank, and control-character free.
   *
   * @param name logical parameter name for diagnostics; if {@code null} defaults to {@code "value"}
   * @param value candidate text; must not be {@code null}
   * @return trimmed input
   * @throws NullPointerException if {@code value} is {@code null}
   * @throws IllegalArgumentException if the trimmed value is blank or contains ISO control characters
   */
  public static String requireNonBlank(String name, String value) {
    String raw = Objects.requireNonNull(value, name == null ? "value" : name);
    if (containsControl(raw)) {
      throw new IllegalArgumentException(message(name, "must not contain control characters"));
    }
    String trimmed = raw.trim();
    if (trimmed.isEmpty()) {
      throw new IllegalArgumentException(message(name, "must not be blank"));
    }
    return trimmed;
  }

  /**
   * Ensures a value contains only printable ASCII characters and fits a length budget.
   *
   * @param name logical name for diagnostics
   * @param value candidate string; must not be {@code null}
   * @param maxLength maximum permitted length in characters
   * @return validated, trimmed value containing only characters {@code 0x20-0x7E}
   * @throws IllegalArgumentException if the value is blank, too long, or contains non-printable characters
   */
  public static String requirePrintableAscii(String name, String value, int maxLength) {
    String sanitized = requireNonBlank(name, value);
    if (sanitized.length() > maxLength) {
      throw new IllegalArgumentException(message(name, "length must be <= " + maxLength));
    }
    for (int i = 0; i < sanitized.length(); i++) {
      char c = sanitized.charAt(i);
      if (c < 0x20 || c > 0x7E) {
        throw new IllegalArgumentException(message(name, "must contain printable ASCII characters"));
      }
    }
    return sanitized;
  }

  /**
   * Ensures a speaker label is usable in JSON keys and script lines: no control characters, no leading or
   * trailing whitespace. The empty label is allowed.
   *
   * @param name logical name for diagnostics
   * @param label candidate label; must not be {@code null}
   * @return the label unchanged
   * @throws IllegalArgumentException if the label contains control characters or surrounding whitespace
   */
  public static String requireLabel(String name, String label) {
    Objects.requireNonNull(label, name == null ? "label" : name);
    if (containsControl(label)) {
      throw new IllegalArgumentException(message(name, "must not contain control characters"));
    }
    if (!label.equals(label.strip())) {
      throw new IllegalArgumentException(message(name, "must not start or end with whitespace"));
    }
    return label;
  }

  private static boolean containsControl(CharSequence value) {
    for (int i = 0; i < value.length(); i++) {
      if (Character.isISOControl(value.charAt(i))) {
        return true;
      }
    }
    return false;
  }

  private static String message(String name, String suffix) {
    String label = (name == null || name.isBlank()) ? "value" : name;
    return label + " " + suffix;
  }
}
