package dev.docqa.failure;

import org.jspecify.annotations.Nullable;

/** Thrown when a ledger record, segment or artifact cannot be written or read back. */
public class PersistenceFailureException extends JobFailureException {

  public PersistenceFailureException(String message, @Nullable Throwable cause) {
    super(JobErrorCode.PERSISTENCE_FAILURE, message, cause);
  }
}
