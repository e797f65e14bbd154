package org.prism.application.pipeline;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Objects;
import org.prism.application.parse.ColorRunParser;
import org.prism.application.port.DocumentSource;
import org.prism.application.port.MetricsPort;
import org.prism.application.port.TranscriptPersistencePort;
import org.prism.domain.color.LabelMap;
import org.prism.domain.error.TranscriptException;
import org.prism.domain.transcript.Transcript;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Converts a single color-coded document into a labeled transcript and writes it.
 * <p><strong>Role:</strong> Application use case behind {@code prism convert}.</p>
 * <p><strong>Thread-safety:</strong> Not thread-safe; one conversion per call.</p>
 * <p><strong>Observability:</strong> Sets MDC key {@code document} for the duration of the call and increments
 * {@code convert.documents.parsed}.</p>
 *
 * @since 0.1.0
 */
public final class ConvertUseCase {
  private static final Logger log = LoggerFactory.getLogger(ConvertUseCase.class);

  private final ColorRunParser parser;
  private final DocumentSource source;
  private final MetricsPort metrics;

  /**
   * Creates a convert use case.
   *
   * @param parser color-run parser; must not be {@code null}
   * @param source document reader; must not be {@code null}
   * @param metrics metrics sink; must not be {@code null}
   */
  public ConvertUseCase(ColorRunParser parser, DocumentSource source, MetricsPort metrics) {
    this.parser = Objects.requireNonNull(parser, "parser");
    this.source = Objects.requireNonNull(source, "source");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Reads, parses and persists one document. The sink is flushed and closed before returning.
   *
   * @param document file to convert
   * @param labels validated label map
   * @param sink destination for the transcript; closed by this call
   * @return the transcript that was written
   * @throws IOException if the document cannot be read or the sink fails
   * @throws TranscriptException if the document cannot be parsed
   */
  public Transcript convert(Path document, LabelMap labels, TranscriptPersistencePort sink)
      throws IOException, TranscriptException {
    Objects.requireNonNull(document, "document");
    Objects.requireNonNull(labels, "labels");
    String name = document.getFileName() == null ? document.toString() : document.getFileName().toString();
    MDC.put("document", name);
    try (TranscriptPersistencePort out = Objects.requireNonNull(sink, "sink")) {
      String markup = source.read(document);
      Transcript transcript = parser.parse(name, markup, labels);
      out.persist(transcript);
      out.flush();
      metrics.increment("convert.documents.parsed");
      log.info("Converted {} into {} turns", name, transcript.turns().size());
      return transcript;
    } finally {
      MDC.remove("document");
    }
  }
}
