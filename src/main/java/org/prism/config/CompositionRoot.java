package org.prism.config;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import org.prism.application.parse.ColorRunParser;
import org.prism.application.pipeline.AggregateUseCase;
import org.prism.application.pipeline.ConvertUseCase;
import org.prism.application.port.ClockPort;
import org.prism.application.port.DiscussionPersistencePort;
import org.prism.application.port.DocumentSource;
import org.prism.application.port.MarkupTextConverter;
import org.prism.application.port.MetricsPort;
import org.prism.application.port.TranscriptPersistencePort;
import org.prism.infrastructure.markup.FileSystemDocumentSource;
import org.prism.infrastructure.markup.RtfPlainTextConverter;
import org.prism.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import org.prism.infrastructure.persistence.DiscussionJsonAdapter;
import org.prism.infrastructure.persistence.JsonlDirectoryAdapter;
import org.prism.infrastructure.persistence.NdjsonTranscriptAdapter;
import org.prism.infrastructure.persistence.NoOpTranscriptAdapter;
import org.prism.infrastructure.persistence.ScriptTranscriptAdapter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Central composition root that wires PRISM use cases to concrete adapters.
 * <p><strong>Role:</strong> Adapter composition root spanning document source, parser and transcript sinks.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Build the RTF converter, document source and color-run parser.</li>
 *   <li>Construct the convert and aggregate use cases.</li>
 *   <li>Translate {@link ConvertConfig} and {@link AggregateConfig} into persistence adapters.</li>
 *   <li>Own the metrics adapter and release it on {@link #close()}.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Construct and use on one thread; factory methods are not synchronized.</p>
 *
 * @since 0.1.0
 */
public final class CompositionRoot implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(CompositionRoot.class);

  private final MetricsPort metrics;
  private final ClockPort clock;

  /**
   * Creates a composition root backed by the OpenTelemetry metrics adapter.
   */
  public CompositionRoot() {
    this(new OpenTelemetryMetricsAdapter());
  }

  /**
   * Creates a composition root with an explicit metrics adapter.
   *
   * @param metricsPort metrics adapter used by constructed use cases; must not be {@code null}
   */
  public CompositionRoot(MetricsPort metricsPort) {
    this(metricsPort, ClockPort.SYSTEM);
  }

  /**
   * Creates a composition root with explicit metrics and clock adapters.
   *
   * @param metricsPort metrics adapter used by constructed use cases; must not be {@code null}
   * @param clockPort monotonic clock used for latency metrics; must not be {@code null}
   */
  public CompositionRoot(MetricsPort metricsPort, ClockPort clockPort) {
    this.metrics = Objects.requireNonNull(metricsPort, "metricsPort");
    this.clock = Objects.requireNonNull(clockPort, "clockPort");
  }

  /**
   * Builds the markup-to-text converter.
   *
   * @return converter for RTF documents
   */
  public MarkupTextConverter markupConverter() {
    return new RtfPlainTextConverter();
  }

  /**
   * Builds the file-system document source.
   *
   * @return document source reading from the local file system
   */
  public DocumentSource documentSource() {
    return new FileSystemDocumentSource();
  }

  /**
   * Builds a parser wired to the shared metrics and clock.
   *
   * @return color-run parser
   */
  public ColorRunParser parser() {
    return new ColorRunParser(markupConverter(), metrics, clock);
  }

  /**
   * Builds the single-document convert use case.
   *
   * @return convert use case
   */
  public ConvertUseCase convertUseCase() {
    return new ConvertUseCase(parser(), documentSource(), metrics);
  }

  /**
   * Builds the batch aggregate use case.
   *
   * @return aggregate use case
   */
  public AggregateUseCase aggregateUseCase() {
    return new AggregateUseCase(parser(), documentSource(), metrics);
  }

  /**
   * Opens the transcript sink for {@code prism convert}.
   *
   * @param config convert settings
   * @param stdout writer used when no output file is configured; never closed by the returned sink
   * @return sink in the configured format
   * @throws IOException if the output file cannot be opened
   */
  public TranscriptPersistencePort transcriptSink(ConvertConfig config, Writer stdout) throws IOException {
    Objects.requireNonNull(config, "config");
    Writer writer;
    boolean owns;
    if (config.outputFile().isPresent()) {
      Path target = config.outputFile().get();
      Path parent = target.getParent();
      if (parent != null) {
        Files.createDirectories(parent);
      }
      writer = Files.newBufferedWriter(target, StandardCharsets.UTF_8);
      owns = true;
    } else {
      writer = Objects.requireNonNull(stdout, "stdout");
      owns = false;
    }
    log.debug("Transcript sink: format={}, target={}",
        config.format(), config.outputFile().map(Path::toString).orElse("<stdout>"));
    return switch (config.format()) {
      case NDJSON -> new NdjsonTranscriptAdapter(writer, owns);
      case SCRIPT -> new ScriptTranscriptAdapter(writer, owns);
    };
  }

  /**
   * Builds the per-document sink for {@code prism aggregate}.
   *
   * @param config aggregate settings
   * @return JSONL directory writer when {@code jsonlOut} is set, otherwise a no-op sink
   */
  public TranscriptPersistencePort perDocumentSink(AggregateConfig config) {
    Objects.requireNonNull(config, "config");
    return config.jsonlDirectory()
        .<TranscriptPersistencePort>map(JsonlDirectoryAdapter::new)
        .orElseGet(NoOpTranscriptAdapter::new);
  }

  /**
   * Builds the combined discussion sink for {@code prism aggregate}.
   *
   * @param config aggregate settings
   * @return JSON array writer targeting {@link AggregateConfig#outputFile()}
   */
  public DiscussionPersistencePort discussionSink(AggregateConfig config) {
    Objects.requireNonNull(config, "config");
    return new DiscussionJsonAdapter(config.outputFile());
  }

  /**
   * Supplies the metrics implementation used across use cases.
   *
   * @return metrics implementation
   */
  public MetricsPort metrics() {
    return metrics;
  }

  /**
   * Flushes and shuts down the metrics adapter when it owns exporter resources.
   */
  @Override
  public void close() {
    if (metrics instanceof OpenTelemetryMetricsAdapter otel) {
      otel.close();
    }
  }
}
