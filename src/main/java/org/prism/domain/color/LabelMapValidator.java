package org.prism.domain.color;

import java.util.LinkedHashMap;
import java.util.Map;
import org.prism.domain.error.InvalidLabelMapException;
import org.prism.validation.Strings;

/**
 * <strong>What:</strong> Validates caller-supplied color specifications and turns them into a {@link LabelMap}.
 * <p><strong>Role:</strong> Runs once per batch, before any document is read.</p>
 * <p><strong>Grammar:</strong> keys are {@code RGB(<0-255>,<0-255>,<0-255>)} (case-insensitive, whitespace-tolerant)
 * or {@code #} followed by exactly six hex digits. Labels must be strings without control characters or
 * surrounding whitespace; the empty label is allowed.</p>
 * <p><strong>Thread-safety:</strong> Stateless utility.</p>
 *
 * @since 0.1.0
 */
public final class LabelMapValidator {
  private LabelMapValidator() {}

  /**
   * Validates every entry and returns the normalized mapping.
   *
   * @param raw mapping from color specification to label; {@code null} or empty yields {@link LabelMap#empty()}
   * @return validated label map preserving the caller's entry order
   * @throws InvalidLabelMapException naming the first offending entry
   */
  public static LabelMap validate(Map<?, ?> raw) throws InvalidLabelMapException {
    if (raw == null || raw.isEmpty()) {
      return LabelMap.empty();
    }
    Map<Rgb, String> labels = new LinkedHashMap<>();
    for (Map.Entry<?, ?> entry : raw.entrySet()) {
      String printable = entry.getKey() + "=" + entry.getValue();
      if (!(entry.getKey() instanceof String key)) {
        throw new InvalidLabelMapException(printable, "color keys must be strings, not "
            + (entry.getKey() == null ? "null" : entry.getKey().getClass().getSimpleName()));
      }
      if (!(entry.getValue() instanceof String label)) {
        throw new InvalidLabelMapException(printable, "labels must be strings");
      }
      Rgb color;
      try {
        Strings.requireLabel("label", label);
        color = Rgb.parse(key);
      } catch (IllegalArgumentException ex) {
        throw new InvalidLabelMapException(printable, ex);
      }
      String previous = labels.putIfAbsent(color, label);
      if (previous != null && !previous.equals(label)) {
        throw new InvalidLabelMapException(printable,
            "color " + color.toRgbString() + " is already mapped to '" + previous + "'");
      }
    }
    return new LabelMap(labels);
  }

  /**
   * Checks a single color specification without building a map.
   *
   * @param spec candidate key
   * @return {@code true} when {@code spec} is a valid {@code RGB(r,g,b)} or {@code #RRGGBB} string
   */
  public static boolean isValidColor(String spec) {
    try {
      Rgb.parse(spec);
      return true;
    } catch (IllegalArgumentException ex) {
      return false;
    }
  }
}
