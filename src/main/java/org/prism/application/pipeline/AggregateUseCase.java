package org.prism.application.pipeline;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;
import org.prism.application.parse.ColorRunParser;
import org.prism.application.port.DiscussionPersistencePort;
import org.prism.application.port.DocumentSource;
import org.prism.application.port.MetricsPort;
import org.prism.application.port.TranscriptPersistencePort;
import org.prism.domain.color.LabelMap;
import org.prism.domain.color.LabelMapValidator;
import org.prism.domain.error.InvalidLabelMapException;
import org.prism.domain.error.TranscriptException;
import org.prism.domain.transcript.CaseKey;
import org.prism.domain.transcript.CaseNameParser;
import org.prism.domain.transcript.CaseRecord;
import org.prism.domain.transcript.DiscussionSet;
import org.prism.domain.transcript.SkippedDocument;
import org.prism.domain.transcript.Transcript;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Builds a {@link DiscussionSet} from a directory of color-coded documents.
 * <p><strong>Role:</strong> Application use case behind {@code prism aggregate}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Enumerate matching documents in file-name order.</li>
 *   <li>Derive each document's client and category from its file name and parse its body with one label map.</li>
 *   <li>Write optional per-document transcripts, then the combined discussion set.</li>
 *   <li>Apply the {@link ErrorPolicy} to per-document failures.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Not thread-safe; intended for single-threaded batch execution. Documents are
 * processed sequentially and each is fully read, parsed and released before the next.</p>
 * <p><strong>Observability:</strong> Sets MDC keys {@code prism.in} and {@code document}; increments
 * {@code aggregate.documents.parsed} and {@code aggregate.documents.skipped}.</p>
 *
 * @since 0.1.0
 */
public final class AggregateUseCase {
  private static final Logger log = LoggerFactory.getLogger(AggregateUseCase.class);

  private final ColorRunParser parser;
  private final DocumentSource source;
  private final MetricsPort metrics;

  /**
   * Creates an aggregate use case.
   *
   * @param parser color-run parser; must not be {@code null}
   * @param source document enumerator and reader; must not be {@code null}
   * @param metrics metrics sink; must not be {@code null}
   */
  public AggregateUseCase(ColorRunParser parser, DocumentSource source, MetricsPort metrics) {
    this.parser = Objects.requireNonNull(parser, "parser");
    this.source = Objects.requireNonNull(source, "source");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Validates a raw label map, then aggregates. No document is read when validation fails.
   *
   * @param directory directory holding the source documents
   * @param extension extension to match, without the dot
   * @param rawLabels caller-supplied color-to-label mapping
   * @param policy per-document error policy
   * @param perDocument sink for per-document transcripts; closed by this call
   * @param out sink for the combined discussion set; closed by this call
   * @return the discussion set that was written
   * @throws InvalidLabelMapException if any label entry is invalid
   * @throws IOException if the directory cannot be listed or a sink fails
   * @throws DocumentProcessingException if {@code policy} is {@link ErrorPolicy#FAIL_FAST} and a document fails
   */
  public DiscussionSet aggregate(
      Path directory,
      String extension,
      Map<?, ?> rawLabels,
      ErrorPolicy policy,
      TranscriptPersistencePort perDocument,
      DiscussionPersistencePort out)
      throws InvalidLabelMapException, IOException, DocumentProcessingException {
    LabelMap labels = LabelMapValidator.validate(rawLabels);
    return aggregate(directory, extension, labels, policy, perDocument, out);
  }

  /**
   * Parses every matching document in {@code directory} and writes the combined result.
   *
   * @param directory directory holding the source documents
   * @param extension extension to match, without the dot
   * @param labels validated label map shared by every document
   * @param policy per-document error policy
   * @param perDocument sink for per-document transcripts; closed by this call
   * @param out sink for the combined discussion set; closed by this call
   * @return the discussion set that was written
   * @throws IOException if the directory cannot be listed or a sink fails
   * @throws DocumentProcessingException if {@code policy} is {@link ErrorPolicy#FAIL_FAST} and a document fails
   */
  public DiscussionSet aggregate(
      Path directory,
      String extension,
      LabelMap labels,
      ErrorPolicy policy,
      TranscriptPersistencePort perDocument,
      DiscussionPersistencePort out)
      throws IOException, DocumentProcessingException {
    Objects.requireNonNull(directory, "directory");
    Objects.requireNonNull(extension, "extension");
    Objects.requireNonNull(labels, "labels");
    Objects.requireNonNull(policy, "policy");
    MDC.put("prism.in", directory.toString());
    try (TranscriptPersistencePort transcripts = Objects.requireNonNull(perDocument, "perDocument");
         DiscussionPersistencePort discussions = Objects.requireNonNull(out, "out")) {
      List<Path> documents = source.list(directory, extension);
      log.info("Aggregating {} .{} documents from {} (errorPolicy={})",
          documents.size(), extension, directory, policy);
      List<CaseRecord> records = new ArrayList<>();
      List<SkippedDocument> skipped = new ArrayList<>();
      for (Path document : documents) {
        CaseRecord record = process(document, labels, policy, transcripts, skipped);
        if (record != null) {
          records.add(record);
        }
      }
      transcripts.flush();
      DiscussionSet result = new DiscussionSet(records, skipped);
      discussions.persist(result);
      logSummary(result);
      return result;
    } finally {
      MDC.remove("prism.in");
    }
  }

  private CaseRecord process(
      Path document,
      LabelMap labels,
      ErrorPolicy policy,
      TranscriptPersistencePort transcripts,
      List<SkippedDocument> skipped)
      throws IOException, DocumentProcessingException {
    String name = fileName(document);
    MDC.put("document", name);
    try {
      CaseKey key;
      Transcript transcript;
      try {
        key = CaseNameParser.parse(name);
        transcript = parser.parse(name, source.read(document), labels);
      } catch (TranscriptException | IOException ex) {
        if (policy == ErrorPolicy.FAIL_FAST) {
          log.error("Aborting aggregation at {}: {}", name, ex.getMessage());
          throw new DocumentProcessingException(document, ex);
        }
        log.warn("Skipping {}: {}", name, ex.getMessage());
        log.debug("Skip cause for {}", name, ex);
        skipped.add(SkippedDocument.of(name, ex));
        metrics.increment("aggregate.documents.skipped");
        return null;
      }
      transcripts.persist(transcript);
      metrics.increment("aggregate.documents.parsed");
      log.debug("Parsed {} as {}/{} with {} turns",
          name, key.clientName(), key.category(), transcript.turns().size());
      return CaseRecord.of(key, transcript);
    } finally {
      MDC.remove("document");
    }
  }

  private static void logSummary(DiscussionSet result) {
    if (!result.hasSkipped()) {
      log.info("Aggregated {} case records", result.records().size());
      return;
    }
    String names = result.skipped().stream()
        .map(s -> s.fileName() + " (" + s.failureType() + ")")
        .collect(Collectors.joining(", "));
    log.warn("Aggregated {} case records; skipped {} documents: {}",
        result.records().size(), result.skipped().size(), names);
  }

  private static String fileName(Path document) {
    Path name = document.getFileName();
    return name == null ? document.toString() : name.toString();
  }
}
