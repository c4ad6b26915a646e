package dev.docqa.failure;

import org.jspecify.annotations.Nullable;

/** Thrown when the page-text source of a job, or the job queue, cannot be reached. */
public class DependencyUnavailableException extends JobFailureException {

  public DependencyUnavailableException(String message) {
    this(message, null);
  }

  public DependencyUnavailableException(String message, @Nullable Throwable cause) {
    super(JobErrorCode.DEPENDENCY_UNAVAILABLE, message, cause);
  }
}
