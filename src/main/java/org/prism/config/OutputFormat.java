package org.prism.config;

import java.util.Locale;

/**
 * Output encodings supported by {@code prism convert}.
 *
 * @since 0.1.0
 */
public enum OutputFormat {
  /** One {@code {"label":"text"}} object per line. */
  NDJSON,
  /** Plain {@code Label: text} lines. */
  SCRIPT;

  /**
   * Parses a format name, ignoring case.
   *
   * @param raw configured value
   * @return matching format
   * @throws IllegalArgumentException if {@code raw} is blank or unknown
   */
  public static OutputFormat fromString(String raw) {
    if (raw == null || raw.isBlank()) {
      throw new IllegalArgumentException("format must not be blank");
    }
    try {
      return OutputFormat.valueOf(raw.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("format must be ndjson or script (was '" + raw + "')", ex);
    }
  }
}
