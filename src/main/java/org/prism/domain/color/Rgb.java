package org.prism.domain.color;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * <strong>What:</strong> Immutable 24-bit color with red, green, and blue components in {@code [0, 255]}.
 * <p><strong>Why:</strong> Gives palette entries and label-map keys one canonical identity regardless of whether
 * the caller wrote {@code RGB(74,21,148)} or {@code #4A1594}.</p>
 * <p><strong>Role:</strong> Domain value shared by {@link Palette} and {@link LabelMap}.</p>
 * <p><strong>Thread-safety:</strong> Immutable record; safe for sharing.</p>
 *
 * @param red red component (0-255)
 * @param green green component (0-255)
 * @param blue blue component (0-255)
 * @since 0.1.0
 */
public record Rgb(int red, int green, int blue) {
  private static final Pattern RGB_PATTERN =
      Pattern.compile("^RGB\\(\\s*(-?\\d+)\\s*,\\s*(-?\\d+)\\s*,\\s*(-?\\d+)\\s*\\)$", Pattern.CASE_INSENSITIVE);
  private static final Pattern HEX_PATTERN = Pattern.compile("^#([0-9a-fA-F]{6})$");

  /**
   * Validates component ranges.
   *
   * @throws IllegalArgumentException if any component lies outside {@code [0, 255]}
   */
  public Rgb {
    requireComponent("red", red);
    requireComponent("green", green);
    requireComponent("blue", blue);
  }

  /**
   * Parses {@code RGB(r,g,b)} (case-insensitive, whitespace-tolerant) or {@code #RRGGBB} notation.
   *
   * @param spec color specification; must not be {@code null}
   * @return parsed color
   * @throws IllegalArgumentException if {@code spec} matches neither grammar or a component is out of range
   */
  public static Rgb parse(String spec) {
    if (spec == null) {
      throw new IllegalArgumentException("color specification must not be null");
    }
    String trimmed = spec.trim();
    Matcher rgb = RGB_PATTERN.matcher(trimmed);
    if (rgb.matches()) {
      return new Rgb(component(rgb.group(1)), component(rgb.group(2)), component(rgb.group(3)));
    }
    Matcher hex = HEX_PATTERN.matcher(trimmed);
    if (hex.matches()) {
      int value = Integer.parseInt(hex.group(1), 16);
      return new Rgb((value >> 16) & 0xFF, (value >> 8) & 0xFF, value & 0xFF);
    }
    throw new IllegalArgumentException(
        "color must be of the form RGB(<0-255>,<0-255>,<0-255>) or #RRGGBB (was '" + spec + "')");
  }

  /**
   * Returns the functional notation, e.g. {@code RGB(74,21,148)}.
   *
   * @return normalized {@code RGB(r,g,b)} string without whitespace
   */
  public String toRgbString() {
    return "RGB(" + red + ',' + green + ',' + blue + ')';
  }

  /**
   * Returns the upper-case hex notation, e.g. {@code #4A1594}.
   *
   * @return normalized {@code #RRGGBB} string
   */
  public String toHex() {
    return String.format(Locale.ROOT, "#%02X%02X%02X", red, green, blue);
  }

  @Override
  public String toString() {
    return toRgbString();
  }

  private static int component(String digits) {
    try {
      return Integer.parseInt(digits);
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException("color component is not a valid integer: " + digits, ex);
    }
  }

  private static void requireComponent(String name, int value) {
    if (value < 0 || value > 255) {
      throw new IllegalArgumentException(name + " must be between 0 and 255 (was " + value + ")");
    }
  }
}
