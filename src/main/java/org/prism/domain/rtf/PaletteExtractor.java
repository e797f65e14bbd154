package org.prism.domain.rtf;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.prism.domain.color.Palette;
import org.prism.domain.color.Rgb;
import org.prism.domain.error.MalformedDocumentException;

/**
 * <strong>What:</strong> Locates a document's {@code \colortbl} group and reads its color declarations.
 * <p><strong>Why:</strong> The declaration syntax is opaque to the rest of the pipeline and its trailing
 * characters could otherwise be tokenized as color-change markers, so callers cut the whole group using
 * {@link Extraction#bodyWithoutTable()} before scanning.</p>
 * <p><strong>Grammar:</strong> entries are separated by {@code ;}. The entry before the first {@code ;} is the
 * implicit "auto" color (slot 0) and is never part of the palette, even when it declares components: a table
 * written as {@code \colortbl\red255\green0\blue0;\red0\green0\blue255;} has one slot, blue, because
 * {@code \cf1} addresses the entry after the first {@code ;}. Each later entry must carry
 * {@code \redN}, {@code \greenN} and {@code \blueN}, in any order, alongside other control words such as
 * {@code \ctint}.</p>
 * <p><strong>Thread-safety:</strong> Stateless utility.</p>
 *
 * @since 0.1.0
 */
public final class PaletteExtractor {
  private static final String COLOR_TABLE = "\\colortbl";
  private static final Pattern RED = Pattern.compile("\\\\red(\\d+)");
  private static final Pattern GREEN = Pattern.compile("\\\\green(\\d+)");
  private static final Pattern BLUE = Pattern.compile("\\\\blue(\\d+)");

  private PaletteExtractor() {}

  /**
   * Result of palette extraction.
   *
   * @param palette declared colors, slot 1 first
   * @param markup markup the table was found in
   * @param blockStart offset of the group's opening brace (or of {@code \colortbl} when the group is unbraced)
   * @param blockEnd offset just past the group's closing brace
   */
  public record Extraction(Palette palette, String markup, int blockStart, int blockEnd) {

    /**
     * Validates the extent.
     *
     * @throws IllegalArgumentException if the extent does not lie within {@code markup}
     */
    public Extraction {
      Objects.requireNonNull(palette, "palette");
      Objects.requireNonNull(markup, "markup");
      if (blockStart < 0 || blockEnd < blockStart || blockEnd > markup.length()) {
        throw new IllegalArgumentException("color table extent [" + blockStart + ", " + blockEnd
            + ") outside markup of length " + markup.length());
      }
    }

    /**
     * Returns the markup with the color table group removed.
     *
     * @return markup preceding and following the table, concatenated
     */
    public String bodyWithoutTable() {
      return markup.substring(0, blockStart) + markup.substring(blockEnd);
    }
  }

  /**
   * Extracts the palette declared by the first color table in {@code markup}.
   *
   * @param markup raw document text
   * @return palette plus the table's extent
   * @throws MalformedDocumentException if no table is present, it is unterminated, declares no colors, or an entry
   *         is incomplete or out of range
   */
  public static Extraction extract(String markup) throws MalformedDocumentException {
    Objects.requireNonNull(markup, "markup");
    int keyword = findColorTable(markup);
    if (keyword < 0) {
      throw new MalformedDocumentException("Document does not contain a color table (\\colortbl)");
    }
    int close = markup.indexOf('}', keyword);
    if (close < 0) {
      throw new MalformedDocumentException("Color table starting at offset " + keyword + " is not terminated");
    }
    int start = groupStart(markup, keyword);
    String table = markup.substring(keyword + COLOR_TABLE.length(), close);

    String[] entries = table.split(";", -1);
    List<Rgb> colors = new ArrayList<>();
    for (int i = 1; i < entries.length; i++) {
      String entry = entries[i];
      if (i == entries.length - 1 && entry.isBlank()) {
        break;
      }
      colors.add(parseEntry(i, entry));
    }
    if (colors.isEmpty()) {
      throw new MalformedDocumentException("Color table declares no colors");
    }
    return new Extraction(Palette.of(colors), markup, start, close + 1);
  }

  private static int findColorTable(String markup) {
    int from = 0;
    while (true) {
      int idx = markup.indexOf(COLOR_TABLE, from);
      if (idx < 0) {
        return -1;
      }
      int after = idx + COLOR_TABLE.length();
      // \colortbl must end here, not continue as a longer control word
      if (after >= markup.length() || !Character.isLetter(markup.charAt(after))) {
        return idx;
      }
      from = after;
    }
  }

  private static int groupStart(String markup, int keyword) {
    int i = keyword - 1;
    while (i >= 0 && Character.isWhitespace(markup.charAt(i))) {
      i--;
    }
    return i >= 0 && markup.charAt(i) == '{' ? i : keyword;
  }

  private static Rgb parseEntry(int slot, String entry) throws MalformedDocumentException {
    Integer red = component(RED, entry);
    Integer green = component(GREEN, entry);
    Integer blue = component(BLUE, entry);
    if (red == null || green == null || blue == null) {
      throw new MalformedDocumentException(
          "Color table entry " + slot + " lacks a red, green or blue component: '" + entry.strip() + "'");
    }
    try {
      return new Rgb(red, green, blue);
    } catch (IllegalArgumentException ex) {
      throw new MalformedDocumentException("Color table entry " + slot + " is invalid: " + ex.getMessage());
    }
  }

  private static Integer component(Pattern pattern, String entry) throws MalformedDocumentException {
    Matcher matcher = pattern.matcher(entry);
    if (!matcher.find()) {
      return null;
    }
    String digits = matcher.group(1);
    if (digits.length() > 3) {
      throw new MalformedDocumentException("Color component out of range: " + matcher.group());
    }
    return Integer.parseInt(digits);
  }
}
