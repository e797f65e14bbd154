package org.prism.application.parse;

import java.util.List;
import java.util.Objects;
import org.prism.application.port.ClockPort;
import org.prism.application.port.MarkupTextConverter;
import org.prism.application.port.MetricsPort;
import org.prism.domain.color.LabelMap;
import org.prism.domain.error.TranscriptException;
import org.prism.domain.rtf.MarkerProtector;
import org.prism.domain.rtf.PaletteExtractor;
import org.prism.domain.rtf.TurnSegmenter;
import org.prism.domain.transcript.Transcript;
import org.prism.domain.transcript.Turn;
import org.prism.logging.Logs;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Turns one color-coded markup document into a labeled {@link Transcript}.
 * <p><strong>Steps:</strong>
 * <ol>
 *   <li>Extract the palette and cut the color table ({@link PaletteExtractor}).</li>
 *   <li>Protect color-change words with a marker absent from the document ({@link MarkerProtector}).</li>
 *   <li>Strip the remaining markup through the {@link MarkupTextConverter} port.</li>
 *   <li>Split the plain text into turns ({@link TurnSegmenter}).</li>
 * </ol>
 * <p><strong>Thread-safety:</strong> Stateless apart from its collaborators; safe to reuse across documents and
 * threads when the converter and metrics port are.</p>
 * <p><strong>Observability:</strong> Increments {@code parse.turns.emitted} per turn and records
 * {@code parse.latencyNanos} per successful parse.</p>
 *
 * @since 0.1.0
 */
public final class ColorRunParser {
  private static final Logger log = LoggerFactory.getLogger(ColorRunParser.class);

  private final MarkupTextConverter converter;
  private final MetricsPort metrics;
  private final ClockPort clock;

  /**
   * Creates a parser without metrics.
   *
   * @param converter markup-to-text converter; must not be {@code null}
   */
  public ColorRunParser(MarkupTextConverter converter) {
    this(converter, MetricsPort.NO_OP, ClockPort.SYSTEM);
  }

  /**
   * Creates a parser with explicit collaborators.
   *
   * @param converter markup-to-text converter; must not be {@code null}
   * @param metrics metrics sink; must not be {@code null}
   * @param clock monotonic clock used for latency; must not be {@code null}
   */
  public ColorRunParser(MarkupTextConverter converter, MetricsPort metrics, ClockPort clock) {
    this.converter = Objects.requireNonNull(converter, "converter");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Parses one document.
   *
   * @param documentName name recorded on the transcript, normally the source file name
   * @param markup full document text
   * @param labels validated color-to-label mapping; {@link LabelMap#empty()} leaves every turn unlabeled
   * @return transcript with turns in document order
   * @throws TranscriptException if the document has no usable color table, no safe marker exists, or a color
   *         cannot be labeled
   */
  public Transcript parse(String documentName, String markup, LabelMap labels) throws TranscriptException {
    Objects.requireNonNull(documentName, "documentName");
    Objects.requireNonNull(markup, "markup");
    Objects.requireNonNull(labels, "labels");
    long started = clock.nanoTime();

    PaletteExtractor.Extraction extraction = PaletteExtractor.extract(markup);
    MarkerProtector.Protected prepared = MarkerProtector.protect(extraction.bodyWithoutTable());
    log.debug("{}: palette of {} colors, {} color changes, marker U+{}",
        documentName,
        extraction.palette().size(),
        prepared.markerCount(),
        String.format("%04X", (int) prepared.marker()));

    String text = converter.toPlainText(prepared.text());
    List<Turn> turns = TurnSegmenter.segment(text, prepared.marker(), extraction.palette(), labels);
    for (Turn turn : turns) {
      metrics.increment("parse.turns.emitted");
      if (log.isTraceEnabled()) {
        log.trace("{}: [{}] {}", documentName, turn.label(), Logs.truncate(turn.text(), 80));
      }
    }
    metrics.observe("parse.latencyNanos", Math.max(0L, clock.nanoTime() - started));
    return new Transcript(documentName, turns);
  }
}
