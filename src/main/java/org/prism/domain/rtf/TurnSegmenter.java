package org.prism.domain.rtf;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.prism.domain.color.ColorRun;
import org.prism.domain.color.LabelMap;
import org.prism.domain.color.Palette;
import org.prism.domain.color.Rgb;
import org.prism.domain.error.UnresolvedColorException;
import org.prism.domain.transcript.Turn;

/**
 * <strong>What:</strong> Splits cleaned text into labeled {@link Turn}s at each color-change marker.
 * <p><strong>Labeling:</strong> resolution is one-ahead. The label resolved at marker <em>i</em> applies to the
 * span that follows marker <em>i</em>; the span before the first marker carries the empty label. The span after
 * the final marker is emitted once scanning completes.</p>
 * <p><strong>Whitespace:</strong> one space directly after a marker is the control-word delimiter and is dropped;
 * all other whitespace is kept verbatim. Empty spans yield no turn but still move the pending label forward.</p>
 * <p><strong>Resolution:</strong> with an empty {@link LabelMap} every label is empty. Otherwise slot 0, undeclared
 * slots and unmapped colors raise {@link UnresolvedColorException}.</p>
 * <p><strong>Thread-safety:</strong> Stateless utility.</p>
 *
 * @since 0.1.0
 */
public final class TurnSegmenter {
  private TurnSegmenter() {}

  /**
   * Segments {@code text} into turns.
   *
   * @param text cleaned text containing protected markers
   * @param marker marker character chosen during protection
   * @param palette document palette
   * @param labels validated color-to-label mapping
   * @return turns in document order
   * @throws UnresolvedColorException if a marker's color cannot be labeled
   */
  public static List<Turn> segment(String text, char marker, Palette palette, LabelMap labels)
      throws UnresolvedColorException {
    Objects.requireNonNull(text, "text");
    Objects.requireNonNull(palette, "palette");
    Objects.requireNonNull(labels, "labels");

    List<Turn> turns = new ArrayList<>();
    ColorRunScanner scanner = new ColorRunScanner(text, marker);
    String pendingLabel = "";
    int spanStart = 0;
    boolean afterMarker = false;
    while (scanner.hasNext()) {
      ColorRun run = scanner.next();
      emit(turns, pendingLabel, span(text, spanStart, run.startOffset(), afterMarker));
      pendingLabel = resolve(run, palette, labels);
      spanStart = run.endOffset();
      afterMarker = true;
    }
    emit(turns, pendingLabel, span(text, spanStart, text.length(), afterMarker));
    return turns;
  }

  /**
   * Resolves the label for one marker.
   *
   * @param run marker to resolve
   * @param palette document palette
   * @param labels validated label map
   * @return label, empty when {@code labels} is empty
   * @throws UnresolvedColorException if the slot is undeclared or its color is unmapped
   */
  static String resolve(ColorRun run, Palette palette, LabelMap labels) throws UnresolvedColorException {
    if (labels.isEmpty()) {
      return "";
    }
    Optional<Rgb> color = palette.color(run.paletteSlot());
    if (color.isEmpty()) {
      throw new UnresolvedColorException(run.startOffset(), run.paletteSlot(), null);
    }
    Rgb rgb = color.get();
    return labels.label(rgb)
        .orElseThrow(() -> new UnresolvedColorException(run.startOffset(), run.paletteSlot(), rgb));
  }

  private static String span(String text, int from, int to, boolean afterMarker) {
    int start = from;
    if (afterMarker && start < to && text.charAt(start) == ' ') {
      start++;
    }
    return text.substring(start, to);
  }

  private static void emit(List<Turn> turns, String label, String text) {
    if (!text.isEmpty()) {
      turns.add(new Turn(label, text));
    }
  }
}
