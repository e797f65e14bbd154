package org.prism.domain.rtf;

import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Objects;
import org.prism.domain.color.ColorRun;

/**
 * <strong>What:</strong> Forward-only cursor that yields one {@link ColorRun} per protected color-change marker
 * ({@code <marker>cf<digits>}) in cleaned text.
 * <p><strong>Laziness:</strong> each {@link #next()} scans only as far as the following marker.</p>
 * <p><strong>Thread-safety:</strong> Not thread-safe; confine each scanner to the parse that created it.</p>
 *
 * @since 0.1.0
 */
public final class ColorRunScanner implements Iterator<ColorRun> {
  private final String text;
  private final char marker;
  private int cursor;
  private ColorRun pending;

  /**
   * Creates a scanner positioned at the start of {@code text}.
   *
   * @param text cleaned text produced from protected markup
   * @param marker marker chosen by {@link MarkerProtector}
   */
  public ColorRunScanner(String text, char marker) {
    this.text = Objects.requireNonNull(text, "text");
    this.marker = marker;
  }

  @Override
  public boolean hasNext() {
    if (pending == null) {
      pending = advance();
    }
    return pending != null;
  }

  @Override
  public ColorRun next() {
    if (!hasNext()) {
      throw new NoSuchElementException("no further color runs after offset " + cursor);
    }
    ColorRun run = pending;
    pending = null;
    return run;
  }

  private ColorRun advance() {
    int n = text.length();
    while (cursor < n) {
      int at = text.indexOf(marker, cursor);
      if (at < 0) {
        cursor = n;
        return null;
      }
      int digitsStart = at + 3;
      int end = digitsStart;
      while (end < n && text.charAt(end) >= '0' && text.charAt(end) <= '9') {
        end++;
      }
      if (digitsStart <= n && text.startsWith("cf", at + 1) && end > digitsStart) {
        cursor = end;
        return new ColorRun(at, end - at, slot(digitsStart, end));
      }
      // stray marker without a color word; leave it in the text
      cursor = at + 1;
    }
    return null;
  }

  private int slot(int from, int to) {
    long value = 0;
    for (int i = from; i < to; i++) {
      value = value * 10 + (text.charAt(i) - '0');
      if (value > Integer.MAX_VALUE) {
        return Integer.MAX_VALUE;
      }
    }
    return (int) value;
  }
}
