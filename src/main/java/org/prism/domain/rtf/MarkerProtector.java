package org.prism.domain.rtf;

import java.util.BitSet;
import java.util.Objects;
import org.prism.domain.error.NoSafeMarkerCharException;

/**
 * <strong>What:</strong> Rewrites every {@code \cfN} color-change control word so it survives markup stripping as
 * literal text.
 * <p><strong>How:</strong> picks the first candidate control character that cannot appear in the stripped output,
 * then replaces the leading backslash of each {@code \cfN} with it. The delimiter after the digits is normalized to
 * exactly one space, so the marker cannot run into a following group, control word or digit.</p>
 * <p>A candidate is unusable when it occurs literally or when an escape ({@code \'hh} or <code>&#92;uN</code>) decodes to it.
 * Escaped backslashes and braces are copied verbatim and never start a control word.</p>
 * <p><strong>Thread-safety:</strong> Stateless utility.</p>
 *
 * @since 0.1.0
 */
public final class MarkerProtector {
  private static final char[] CANDIDATES = candidates();

  private MarkerProtector() {}

  /**
   * Protected markup and the marker that was substituted into it.
   *
   * @param text markup with every {@code \cfN} rewritten as {@code <marker>cfN }
   * @param marker substituted marker character
   * @param markerCount number of color-change words rewritten
   */
  public record Protected(String text, char marker, int markerCount) {}

  /**
   * Returns the candidate marker characters in preference order.
   *
   * @return copy of U+0001-U+0008 followed by U+000E-U+001F
   */
  public static char[] candidateMarkers() {
    return CANDIDATES.clone();
  }

  /**
   * Chooses a marker absent from {@code markup} and protects every color-change control word.
   *
   * @param markup markup to rewrite, normally with the color table already removed
   * @return rewritten markup plus the chosen marker
   * @throws NoSafeMarkerCharException if every candidate already occurs in the document
   */
  public static Protected protect(String markup) throws NoSafeMarkerCharException {
    Objects.requireNonNull(markup, "markup");
    char marker = chooseMarker(markup);
    StringBuilder out = new StringBuilder(markup.length() + 16);
    int count = 0;
    int i = 0;
    int n = markup.length();
    while (i < n) {
      char c = markup.charAt(i);
      if (c != '\\' || i + 1 >= n) {
        out.append(c);
        i++;
        continue;
      }
      char next = markup.charAt(i + 1);
      if (next == 'c' && isColorChange(markup, i)) {
        int digitsStart = i + 3;
        int digitsEnd = digitsStart;
        while (digitsEnd < n && isAsciiDigit(markup.charAt(digitsEnd))) {
          digitsEnd++;
        }
        out.append(marker).append("cf").append(markup, digitsStart, digitsEnd).append(' ');
        i = digitsEnd < n && markup.charAt(digitsEnd) == ' ' ? digitsEnd + 1 : digitsEnd;
        count++;
        continue;
      }
      // escaped symbol or the start of another control word; copy the pair
      out.append(c).append(next);
      i += 2;
    }
    return new Protected(out.toString(), marker, count);
  }

  /**
   * Chooses the first candidate that neither occurs literally nor is produced by an escape.
   *
   * @param markup document text
   * @return marker character
   * @throws NoSafeMarkerCharException if every candidate is occupied
   */
  public static char chooseMarker(String markup) throws NoSafeMarkerCharException {
    BitSet occupied = occupied(markup);
    for (char candidate : CANDIDATES) {
      if (!occupied.get(candidate)) {
        return candidate;
      }
    }
    throw new NoSafeMarkerCharException("Every reserved marker character (U+0001-U+0008, U+000E-U+001F) "
        + "already occurs in the document; color runs cannot be marked safely");
  }

  private static BitSet occupied(String markup) {
    BitSet occupied = new BitSet(0x20);
    int n = markup.length();
    for (int i = 0; i < n; i++) {
      char c = markup.charAt(i);
      if (c < 0x20) {
        occupied.set(c);
        continue;
      }
      if (c != '\\' || i + 1 >= n) {
        continue;
      }
      char next = markup.charAt(i + 1);
      if (next == '\\') {
        i++;
      } else if (next == '\'' && i + 3 < n) {
        int value = hexValue(markup.charAt(i + 2), markup.charAt(i + 3));
        if (value >= 0 && value < 0x20) {
          occupied.set(value);
        }
      } else if (next == 'u') {
        int value = unicodeEscape(markup, i + 2);
        if (value >= 0 && value < 0x20) {
          occupied.set(value);
        }
      }
    }
    return occupied;
  }

  private static boolean isColorChange(String markup, int backslash) {
    int n = markup.length();
    return backslash + 3 < n
        && markup.charAt(backslash + 1) == 'c'
        && markup.charAt(backslash + 2) == 'f'
        && isAsciiDigit(markup.charAt(backslash + 3));
  }

  private static int unicodeEscape(String markup, int from) {
    int i = from;
    int n = markup.length();
    boolean negative = i < n && markup.charAt(i) == '-';
    if (negative) {
      i++;
    }
    int start = i;
    long value = 0;
    while (i < n && isAsciiDigit(markup.charAt(i)) && i - start < 6) {
      value = value * 10 + (markup.charAt(i) - '0');
      i++;
    }
    if (i == start) {
      return -1;
    }
    long signed = negative ? -value : value;
    return (int) (signed < 0 ? signed + 65536 : signed);
  }

  private static int hexValue(char high, char low) {
    int h = Character.digit(high, 16);
    int l = Character.digit(low, 16);
    return h < 0 || l < 0 ? -1 : (h << 4) | l;
  }

  private static boolean isAsciiDigit(char c) {
    return c >= '0' && c <= '9';
  }

  private static char[] candidates() {
    char[] chars = new char[8 + 18];
    int idx = 0;
    for (char c = 0x01; c <= 0x08; c++) {
      chars[idx++] = c;
    }
    for (char c = 0x0E; c <= 0x1F; c++) {
      chars[idx++] = c;
    }
    return chars;
  }
}
