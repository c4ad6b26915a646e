package dev.docqa.job;

import java.util.Objects;

/**
 * A submitted validation job, as handed to a {@link JobLauncher}. Serialized to JSON by the queue
 * launcher, so it carries only what another process needs to find the stored document.
 *
 * @param jobKey progress key and artifact prefix of the job
 * @param documentName name the document was submitted under, for logs
 */
public record JobRequest(String jobKey, String documentName) {

  public JobRequest {
    Objects.requireNonNull(jobKey, "jobKey must not be null");
    Objects.requireNonNull(documentName, "documentName must not be null");
  }
}
