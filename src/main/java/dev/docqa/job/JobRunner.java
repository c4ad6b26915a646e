package dev.docqa.job;

import dev.docqa.failure.JobErrorCode;
import dev.docqa.failure.JobFailureException;
import dev.docqa.pipeline.DocumentStore;
import dev.docqa.pipeline.PageTextProvider;
import dev.docqa.pipeline.PipelineResult;
import dev.docqa.pipeline.ValidationPipeline;
import dev.docqa.progress.ProgressError;
import dev.docqa.progress.ProgressLedger;
import dev.docqa.storage.BlobSink;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

/**
 * Runs one validation job end to end, whichever {@link JobLauncher} dispatched it.
 *
 * <p>Success is recorded by the pipeline itself. On any failure the runner writes the error
 * artifact and the failed terminal record. The ledger ignores writes to terminal records, so a job
 * gets exactly one terminal state even when a failure follows a terminal write. No exception
 * escapes {@link #runJob}.
 */
@Service
public class JobRunner {

  private static final Logger log = LoggerFactory.getLogger(JobRunner.class);

  static final String MDC_JOB_KEY = "jobKey";

  private final ValidationPipeline pipeline;
  private final ProgressLedger ledger;
  private final BlobSink blobSink;
  private final DocumentStore documentStore;
  private final Clock clock;

  public JobRunner(
      ValidationPipeline pipeline,
      ProgressLedger ledger,
      BlobSink blobSink,
      DocumentStore documentStore,
      Clock clock) {
    this.pipeline = pipeline;
    this.ledger = ledger;
    this.blobSink = blobSink;
    this.documentStore = documentStore;
    this.clock = clock;
  }

  /** Run a submitted job against the document stored under its key. */
  public void run(JobRequest request) {
    runJob(request.jobKey(), () -> documentStore.open(request.jobKey()));
  }

  /**
   * Validate a document and record the outcome in the progress ledger.
   *
   * @param jobKey key of the job
   * @param pageSource opens the document's page text; may throw {@link
   *     dev.docqa.failure.DependencyUnavailableException}
   */
  public void runJob(String jobKey, Supplier<PageTextProvider> pageSource) {
    MDC.put(MDC_JOB_KEY, jobKey);
    Instant started = clock.instant();
    try {
      log.info("Starting job {}", jobKey);
      PageTextProvider pages = pageSource.get();
      PipelineResult result = pipeline.run(jobKey, pages);
      log.info(
          "Job {} finished in {} ms, result {}",
          jobKey,
          Duration.between(started, clock.instant()).toMillis(),
          result.resultLocator());
    } catch (Exception e) {
      recordFailure(jobKey, e);
    } finally {
      MDC.remove(MDC_JOB_KEY);
    }
  }

  private void recordFailure(String jobKey, Exception failure) {
    JobErrorCode code =
        failure instanceof JobFailureException jobFailure
            ? jobFailure.code()
            : JobErrorCode.EXTRACTION_FAILURE;
    String message = messageOf(failure);
    log.error("Job {} failed ({}): {}", jobKey, code, message, failure);

    String errorLocator = null;
    try {
      errorLocator = blobSink.writeErrorArtifact(jobKey, message, traceLines(failure));
    } catch (RuntimeException e) {
      log.error("Could not write error artifact for job {}: {}", jobKey, e.getMessage());
    }

    try {
      ledger.fail(jobKey, new ProgressError(code.name(), message), errorLocator);
    } catch (RuntimeException e) {
      log.error("Could not record failure of job {} in the progress ledger", jobKey, e);
    }
  }

  static String messageOf(Throwable failure) {
    String message = failure.getMessage();
    return message == null || message.isBlank() ? failure.getClass().getName() : message;
  }

  static List<String> traceLines(Throwable failure) {
    StringWriter trace = new StringWriter();
    failure.printStackTrace(new PrintWriter(trace));
    return trace.toString().lines().toList();
  }
}
