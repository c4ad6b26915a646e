package dev.docqa.failure;

import org.jspecify.annotations.Nullable;

/** Base class for infrastructure faults that abort a validation job. */
public abstract class JobFailureException extends RuntimeException {

  private final JobErrorCode code;

  protected JobFailureException(JobErrorCode code, String message, @Nullable Throwable cause) {
    super(message, cause);
    this.code = code;
  }

  public JobErrorCode code() {
    return code;
  }
}
