package dev.docqa.job;

import dev.docqa.failure.DependencyUnavailableException;
import dev.docqa.failure.JobErrorCode;
import dev.docqa.pipeline.DocumentStore;
import dev.docqa.pipeline.PipelineProperties;
import dev.docqa.progress.ProgressError;
import dev.docqa.progress.ProgressLedger;
import dev.docqa.progress.ProgressRecord;
import dev.docqa.storage.StorageProperties;
import java.nio.file.Path;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Entry point for submitting documents and polling their validation.
 *
 * <p>A submission stores the document, creates its ledger record and hands the job to the
 * configured {@link JobLauncher}. The returned key is both the progress key and the prefix of every
 * artifact the job writes.
 */
@Service
public class ValidationJobService {

  private static final Logger log = LoggerFactory.getLogger(ValidationJobService.class);

  static final String DEFAULT_DOCUMENT_NAME = "document";

  private final DocumentStore documentStore;
  private final ProgressLedger ledger;
  private final JobLauncher launcher;
  private final StorageProperties storageProperties;
  private final PipelineProperties pipelineProperties;

  public ValidationJobService(
      DocumentStore documentStore,
      ProgressLedger ledger,
      JobLauncher launcher,
      StorageProperties storageProperties,
      PipelineProperties pipelineProperties) {
    this.documentStore = documentStore;
    this.ledger = ledger;
    this.launcher = launcher;
    this.storageProperties = storageProperties;
    this.pipelineProperties = pipelineProperties;
  }

  /**
   * Submit a document for validation.
   *
   * @param documentName name to log the document under; blank names are replaced
   * @param text page texts separated by form feeds
   * @return the job key to poll
   * @throws DependencyUnavailableException when the job cannot be dispatched, including a launcher
   *     that rejects it while shutting down; the job is then already recorded as failed
   */
  public String submit(String documentName, String text) {
    String jobKey = UUID.randomUUID().toString();
    String name =
        documentName == null || documentName.isBlank() ? DEFAULT_DOCUMENT_NAME : documentName;

    int pages = documentStore.store(jobKey, text);
    ledger.start(jobKey);
    log.info("Accepted {} ({} pages) as job {}", name, pages, jobKey);

    try {
      launcher.launch(new JobRequest(jobKey, name));
    } catch (RuntimeException e) {
      DependencyUnavailableException failure =
          e instanceof DependencyUnavailableException unavailable
              ? unavailable
              : new DependencyUnavailableException(
                  "Job " + jobKey + " could not be dispatched: " + e, e);
      ProgressError error =
          new ProgressError(JobErrorCode.DEPENDENCY_UNAVAILABLE.name(), failure.getMessage());
      ledger.fail(jobKey, error, null);
      throw failure;
    }
    return jobKey;
  }

  /** Current progress of a job; unknown keys yield the zeroed record. */
  public ProgressRecord poll(String jobKey) {
    return ledger.getProgress(jobKey);
  }

  /** Current progress of a job, or empty when the key is unknown. */
  public Optional<ProgressRecord> find(String jobKey) {
    return ledger.find(jobKey);
  }

  /** Runtime wiring, as reported by the diagnostics endpoint. */
  public Diagnostics diagnostics() {
    return new Diagnostics(
        ledger.backendName(),
        launcher.name(),
        storageProperties.exportsDir(),
        storageProperties.uploadsDir(),
        pipelineProperties.getSegmentSize());
  }

  /**
   * Selected backends and directories of this process.
   *
   * @param progressBackend name of the progress ledger backend
   * @param launcher name of the job launcher
   * @param exportsDir directory artifacts are written to
   * @param uploadsDir directory submitted documents are kept in
   * @param segmentSize pages per checkpointed segment
   */
  public record Diagnostics(
      String progressBackend, String launcher, Path exportsDir, Path uploadsDir, int segmentSize) {}
}
