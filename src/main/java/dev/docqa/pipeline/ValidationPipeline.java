package dev.docqa.pipeline;

import dev.docqa.extraction.FieldExtractor;
import dev.docqa.extraction.FieldMap;
import dev.docqa.extraction.FieldVocabulary;
import dev.docqa.failure.ExtractionFailureException;
import dev.docqa.failure.JobFailureException;
import dev.docqa.failure.PersistenceFailureException;
import dev.docqa.progress.ProgressLedger;
import dev.docqa.storage.ArtifactKind;
import dev.docqa.storage.ArtifactWriter;
import dev.docqa.storage.BlobSink;
import dev.docqa.validation.Anomaly;
import dev.docqa.validation.ConsistencyChecker;
import dev.docqa.validation.PageValidator;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Segmented, checkpointed validation of one document.
 *
 * <p>Pages are streamed one at a time through extraction and page validation. Result rows are
 * buffered for at most {@code segment-size} pages and then checkpointed to the {@link BlobSink} as
 * one segment, so peak memory does not grow with the page count. Once every page is processed the
 * segments are merged, in index order, into the final artifact and deleted. The cross-page
 * consistency check, the field summary and the anomaly artifact follow, and the ledger is marked
 * complete.
 *
 * <p>Progress is pushed after every page except the last. 100% is only reported together with the
 * result locator, so a poller never sees a finished job without its result.
 *
 * <p><strong>Merge semantics:</strong> a segment that cannot be read back is logged, left in place
 * and skipped; the terminal record is then flagged {@code partial}. Any other exception aborts the
 * run and propagates to the caller, which owns the failure path.
 */
@Service
public class ValidationPipeline {

  private static final Logger log = LoggerFactory.getLogger(ValidationPipeline.class);

  private static final List<String> ANOMALY_HEADER = List.of("Page", "Field", "Issue");

  private final FieldExtractor extractor;
  private final PageValidator pageValidator;
  private final ConsistencyChecker consistencyChecker;
  private final BlobSink blobSink;
  private final ProgressLedger ledger;
  private final PipelineProperties properties;

  public ValidationPipeline(
      FieldExtractor extractor,
      PageValidator pageValidator,
      ConsistencyChecker consistencyChecker,
      BlobSink blobSink,
      ProgressLedger ledger,
      PipelineProperties properties) {
    this.extractor = extractor;
    this.pageValidator = pageValidator;
    this.consistencyChecker = consistencyChecker;
    this.blobSink = blobSink;
    this.ledger = ledger;
    this.properties = properties;
  }

  /**
   * Validate every page of a document and publish the results.
   *
   * @param jobKey key of the job, used for artifact names and ledger updates
   * @param pages text of the document's pages
   * @return locators and counts of the completed run
   * @throws JobFailureException when a page cannot be processed or storage fails
   */
  public PipelineResult run(String jobKey, PageTextProvider pages) {
    Run run = new Run(jobKey, pages.pageCount(), properties.getSegmentSize());
    run.enter(PipelineStage.INIT);
    try {
      run.enter(PipelineStage.STREAMING);
      stream(run, pages);

      run.enter(PipelineStage.MERGING);
      Merged merged = merge(run);

      run.enter(PipelineStage.FINALIZING);
      PipelineResult result = finish(run, merged);

      run.enter(PipelineStage.COMPLETED);
      log.info(
          "Job {} completed: {} pages, {} segments, {} anomalies ({} critical){}",
          jobKey,
          result.pages(),
          result.segments(),
          result.anomalies(),
          result.criticalIssues(),
          result.partial() ? ", partial result" : "");
      return result;
    } catch (RuntimeException e) {
      run.enter(PipelineStage.FAILED);
      throw e;
    }
  }

  private void stream(Run run, PageTextProvider pages) {
    List<ResultRow> buffer = new ArrayList<>(run.segmentSize * FieldVocabulary.size());
    int pagesInBuffer = 0;

    for (int page = 1; page <= run.totalPages; page++) {
      FieldMap fields = processPage(run, page, pages);
      buffer.addAll(ResultRow.forPage(page, fields));
      pagesInBuffer++;

      boolean lastPage = page == run.totalPages;
      if (pagesInBuffer == run.segmentSize || lastPage) {
        flush(run, buffer);
        buffer.clear();
        pagesInBuffer = 0;
      }
      if (!lastPage) {
        ledger.updatePercent(run.jobKey, (int) ((long) page * 100 / run.totalPages));
      }
    }
  }

  private FieldMap processPage(Run run, int page, PageTextProvider pages) {
    try {
      FieldMap fields = extractor.extract(pages.getPageText(page));
      run.anomalies.addAll(pageValidator.validatePage(page, fields));
      run.consistencyProjection.add(fields.retainOnly(FieldVocabulary.CONSISTENCY_FIELDS));
      run.summary.record(fields);
      log.debug(
          "Job {} page {}/{}: {} fields found", run.jobKey, page, run.totalPages, fields.size());
      return fields;
    } catch (JobFailureException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new ExtractionFailureException(page, e);
    }
  }

  private void flush(Run run, List<ResultRow> buffer) {
    List<List<String>> rows = new ArrayList<>(buffer.size());
    for (ResultRow row : buffer) {
      rows.add(row.toCsvRow());
    }
    run.segmentLocators.add(blobSink.writeSegment(run.jobKey, run.segmentLocators.size(), rows));
  }

  private Merged merge(Run run) {
    boolean partial = false;
    try (ArtifactWriter writer = blobSink.writeFinalArtifact(run.jobKey, ResultRow.HEADER)) {
      for (int index = 0; index < run.segmentLocators.size(); index++) {
        String locator = run.segmentLocators.get(index);
        List<List<String>> rows;
        try {
          rows = blobSink.readSegment(locator);
        } catch (PersistenceFailureException e) {
          log.warn(
              "Skipping unreadable segment {} of job {}: {}", index, run.jobKey, e.getMessage());
          partial = true;
          continue;
        }
        writer.writeRows(rows);
        deleteConsumed(run, locator);
      }
      long expectedRows = (long) run.totalPages * FieldVocabulary.size();
      if (!partial && writer.rowCount() != expectedRows) {
        log.warn(
            "Job {} merged {} rows, expected {}", run.jobKey, writer.rowCount(), expectedRows);
        partial = true;
      }
      long rowCount = writer.rowCount();
      return new Merged(writer.commit(), rowCount, partial);
    }
  }

  private void deleteConsumed(Run run, String locator) {
    try {
      blobSink.deleteSegment(locator);
    } catch (PersistenceFailureException e) {
      log.warn(
          "Could not delete merged segment {} of job {}: {}", locator, run.jobKey, e.getMessage());
    }
  }

  private PipelineResult finish(Run run, Merged merged) {
    run.anomalies.addAll(consistencyChecker.findInconsistencies(run.consistencyProjection));

    String summaryLocator =
        blobSink.writeArtifact(
            run.jobKey, ArtifactKind.FIELD_SUMMARY, FieldValueSummary.HEADER, run.summary.toRows());

    List<List<String>> anomalyRows = new ArrayList<>(run.anomalies.size());
    int critical = 0;
    for (Anomaly anomaly : run.anomalies) {
      anomalyRows.add(anomaly.toRow());
      if (anomaly.critical()) {
        critical++;
      }
    }
    String anomaliesLocator =
        blobSink.writeArtifact(run.jobKey, ArtifactKind.ANOMALIES, ANOMALY_HEADER, anomalyRows);

    ledger.complete(run.jobKey, merged.locator(), merged.partial());

    return new PipelineResult(
        merged.locator(),
        summaryLocator,
        anomaliesLocator,
        run.totalPages,
        run.segmentLocators.size(),
        merged.rows(),
        run.anomalies.size(),
        critical,
        merged.partial());
  }

  /** Mutable state of one run; confined to the thread executing it. */
  private static final class Run {

    private final String jobKey;
    private final int totalPages;
    private final int segmentSize;
    private final List<Anomaly> anomalies = new ArrayList<>();
    private final List<FieldMap> consistencyProjection = new ArrayList<>();
    private final FieldValueSummary summary = new FieldValueSummary();
    private final List<String> segmentLocators = new ArrayList<>();
    private PipelineStage stage;

    Run(String jobKey, int totalPages, int segmentSize) {
      this.jobKey = jobKey;
      this.totalPages = totalPages;
      this.segmentSize = segmentSize;
    }

    void enter(PipelineStage next) {
      if (next == PipelineStage.INIT) {
        log.info(
            "Job {}: validating {} pages (segment size {})", jobKey, totalPages, segmentSize);
      } else {
        log.debug("Job {}: {} -> {}", jobKey, stage, next);
      }
      stage = next;
    }
  }

  private record Merged(String locator, long rows, boolean partial) {}
}
