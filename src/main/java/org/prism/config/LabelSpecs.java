package org.prism.config;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * <strong>What:</strong> Collects color-to-label entries from a flattened configuration map.
 * <p><strong>Forms:</strong> a compact {@code labels=COLOR=Label;COLOR=Label} value, or one
 * {@code labels.<color>=Label} key per entry (the shape a nested YAML {@code labels:} mapping flattens to).
 * Entries from both forms are combined in map order, compact entries first.</p>
 * <p>Only the syntax is checked here. Colors and labels are validated later by
 * {@link org.prism.domain.color.LabelMapValidator}.</p>
 *
 * @since 0.1.0
 */
public final class LabelSpecs {
  /** Key holding the compact form. */
  public static final String KEY = "labels";
  /** Prefix of per-color keys. */
  public static final String PREFIX = KEY + ".";

  private LabelSpecs() {}

  /**
   * Extracts the raw label entries from {@code config}.
   *
   * @param config flattened configuration
   * @return mutable, insertion-ordered map of color specification to label; empty when none configured
   * @throws IllegalArgumentException if a compact entry lacks {@code '='} or names no color
   */
  public static Map<String, String> collect(Map<String, String> config) {
    Map<String, String> labels = new LinkedHashMap<>();
    String compact = config.get(KEY);
    if (compact != null) {
      labels.putAll(parseCompact(compact));
    }
    for (Map.Entry<String, String> entry : config.entrySet()) {
      String key = entry.getKey();
      if (key.startsWith(PREFIX) && key.length() > PREFIX.length()) {
        labels.put(key.substring(PREFIX.length()), entry.getValue() == null ? "" : entry.getValue());
      }
    }
    return labels;
  }

  /**
   * Parses the compact {@code COLOR=Label;COLOR=Label} form. Blank entries are ignored, so an empty value yields
   * an empty map.
   *
   * @param compact compact label specification
   * @return insertion-ordered map of color specification to label
   * @throws IllegalArgumentException if an entry is malformed
   */
  public static Map<String, String> parseCompact(String compact) {
    Map<String, String> labels = new LinkedHashMap<>();
    for (String raw : compact.split(";")) {
      String entry = raw.trim();
      if (entry.isEmpty()) {
        continue;
      }
      int idx = entry.indexOf('=');
      if (idx <= 0) {
        throw new IllegalArgumentException("labels entry must be COLOR=Label (was '" + entry + "')");
      }
      labels.put(entry.substring(0, idx).trim(), entry.substring(idx + 1).trim());
    }
    return labels;
  }

  /**
   * Reports whether {@code config} carries any per-color key.
   *
   * @param config flattened configuration
   * @return {@code true} when at least one {@code labels.<color>} key is present
   */
  static boolean hasPerColorKeys(Map<String, String> config) {
    for (String key : config.keySet()) {
      if (key != null && key.startsWith(PREFIX)) {
        return true;
      }
    }
    return false;
  }
}
